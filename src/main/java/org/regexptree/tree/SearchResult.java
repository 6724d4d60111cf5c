package org.regexptree.tree;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of {@link Node#find(Selector)} or {@link Node#findFirst(Selector)}.
 * <p>
 * "Nothing matched" and "the search failed" are different outcomes: a failed search carries
 * its cause, which is either a {@link SelectorException} or whatever the visitor threw.
 *
 * @param <T> The type of the value of a successful search.
 */
public final class SearchResult<T> {

    /**
     * The three outcomes of a search.
     */
    public enum Status {
        /** At least one element matched. */
        FOUND,
        /** The search ran to completion without a match. */
        NOT_FOUND,
        /** The selector could not be resolved or the visitor threw. */
        FAILED
    }

    private static final SearchResult<?> NOT_FOUND = new SearchResult<>(Status.NOT_FOUND, null, null);

    private final Status status;
    private final T value;
    private final Throwable failure;

    private SearchResult(Status status, T value, Throwable failure) {
        this.status = status;
        this.value = value;
        this.failure = failure;
    }

    public static <T> SearchResult<T> found(T value) {
        return new SearchResult<>(Status.FOUND, Objects.requireNonNull(value, "value"), null);
    }

    @SuppressWarnings("unchecked")
    public static <T> SearchResult<T> notFound() {
        return (SearchResult<T>) NOT_FOUND;
    }

    public static <T> SearchResult<T> failed(Throwable cause) {
        return new SearchResult<>(Status.FAILED, null, Objects.requireNonNull(cause, "cause"));
    }

    public Status status() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Returns the value of a successful search.
     *
     * @return The value, or empty if nothing was found or the search failed.
     */
    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    /**
     * Returns the value of a successful search.
     *
     * @return The value.
     * @throws NoSuchElementException if the search found nothing or failed.
     */
    public T get() {
        if (status != Status.FOUND) {
            throw new NoSuchElementException("Search result is " + status, failure);
        }
        return value;
    }

    public T orElse(T other) {
        return status == Status.FOUND ? value : other;
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return switch (status) {
            case FOUND -> "FOUND" + value;
            case NOT_FOUND -> "NOT_FOUND";
            case FAILED -> "FAILED(" + failure + ")";
        };
    }
}
