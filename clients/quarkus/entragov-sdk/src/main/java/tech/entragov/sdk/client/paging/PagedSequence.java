package tech.entragov.sdk.client.paging;

import com.fasterxml.jackson.databind.JsonNode;
import tech.entragov.sdk.exception.PaginationException;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy sequence over every item of a paginated endpoint.
 *
 * <p>Pages are fetched only as iteration reaches them, so a caller that stops early
 * stops fetching. Every call to {@link #iterator()} starts again from the first page.
 * Iteration ends when a page has no continuation, and fails with
 * {@link PaginationException} once more than {@code maxPages} pages or
 * {@code maxItems} items would be consumed.
 *
 * <pre>{@code
 * for (JsonNode user : client.getAllPages("users")) {
 *     ...
 * }
 * List<Policy> policies = client.getAllPages("identity/conditionalAccess/policies")
 *     .map(Policy::fromJson)
 *     .toList();
 * }</pre>
 */
public final class PagedSequence<T> implements Iterable<T> {

    private final String path;
    private final PageSource source;
    private final int maxPages;
    private final int maxItems;
    private final Function<JsonNode, T> mapper;

    private PagedSequence(String path, PageSource source, int maxPages, int maxItems,
                          Function<JsonNode, T> mapper) {
        this.path = path;
        this.source = source;
        this.maxPages = maxPages;
        this.maxItems = maxItems;
        this.mapper = mapper;
    }

    public static PagedSequence<JsonNode> of(String path, PageSource source, int maxPages, int maxItems) {
        return new PagedSequence<>(path, source, maxPages, maxItems, Function.identity());
    }

    /**
     * Lazily transform every item. The returned sequence shares this one's page source.
     */
    public <R> PagedSequence<R> map(Function<? super T, ? extends R> fn) {
        Function<JsonNode, R> composed = mapper.andThen(fn);
        return new PagedSequence<>(path, source, maxPages, maxItems, composed);
    }

    @Override
    public Iterator<T> iterator() {
        return new PagingIterator();
    }

    public Stream<T> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    /**
     * Fetch every page and collect the items.
     */
    public List<T> toList() {
        return stream().toList();
    }

    private final class PagingIterator implements Iterator<T> {

        private Iterator<JsonNode> current;
        private String cursor;
        private boolean started;
        private int pages;
        private int items;

        @Override
        public boolean hasNext() {
            while (current == null || !current.hasNext()) {
                if (started && cursor == null) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (++items > maxItems) {
                throw PaginationException.tooManyItems(path, maxItems);
            }
            return mapper.apply(current.next());
        }

        private void fetchNextPage() {
            if (pages >= maxPages) {
                throw PaginationException.tooManyPages(path, maxPages);
            }
            Page page = started ? source.next(cursor) : source.first();
            started = true;
            pages++;
            current = page.items().iterator();
            cursor = page.nextCursor();
        }
    }
}
