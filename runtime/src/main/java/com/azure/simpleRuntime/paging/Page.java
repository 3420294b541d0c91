package com.azure.simpleRuntime.paging;

import java.util.List;

/**
 * One fetched page. Missing items read as an empty page and a blank continuation token as the
 * last page.
 */
public record Page<T>(
    List<T> items,
    String continuationToken
) {
    public Page {
        items = items == null ? List.of() : List.copyOf(items);
        continuationToken = continuationToken == null || continuationToken.isBlank() ? null : continuationToken;
    }

    public boolean hasNext() {
        return continuationToken != null;
    }
}
