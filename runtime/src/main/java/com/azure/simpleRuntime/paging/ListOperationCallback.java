package com.azure.simpleRuntime.paging;

import java.util.List;

/**
 * Observes a paged traversal page by page and decides whether to keep going.
 */
@FunctionalInterface
public interface ListOperationCallback<T> {

    enum PagingBehavior {
        CONTINUE,
        STOP
    }

    /**
     * Called after each page has been added to the result.
     *
     * @param pageItems items of the page just fetched
     * @return {@link PagingBehavior#STOP} to finish with what has been fetched so far
     */
    PagingBehavior progress(List<T> pageItems);
}
