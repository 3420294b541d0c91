package com.azure.simpleRuntime.paging;

import com.azure.simpleRuntime.exceptions.ServiceClientException;
import com.azure.simpleRuntime.exceptions.UncheckedServiceClientException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily fetched sequence of pages. Pages already handed out stay with the caller when a later
 * page fails or the traversal is cancelled.
 */
public class PagedIterable<T> implements Iterable<Page<T>> {
    private final Supplier<Pager.PageCursor<T>> cursorFactory;
    private final int maxPages;

    PagedIterable(Supplier<Pager.PageCursor<T>> cursorFactory, int maxPages) {
        this.cursorFactory = cursorFactory;
        this.maxPages = maxPages;
    }

    @Override
    public Iterator<Page<T>> iterator() {
        Pager.PageCursor<T> cursor = cursorFactory.get();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return cursor.hasMore() && (maxPages == 0 || cursor.pagesFetched() < maxPages);
            }

            @Override
            public Page<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                try {
                    return cursor.fetch();
                } catch (ServiceClientException e) {
                    throw new UncheckedServiceClientException(e);
                }
            }
        };
    }

    public Stream<Page<T>> streamByPage() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public Stream<T> stream() {
        return streamByPage().flatMap(page -> page.items().stream());
    }
}
