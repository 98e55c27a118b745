package com.plaetzchen.community.domain.common;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link Pageable} addressed by {@code skip}/{@code limit} instead of page numbers.
 * <p>
 * List endpoints take {@code skip} and {@code limit} query parameters; Spring Data's
 * {@code PageRequest} can only express offsets that are multiples of the page size.
 */
public final class OffsetLimit implements Pageable {

    public static final int MAX_LIMIT = 100;

    private final long offset;
    private final int limit;
    private final Sort sort;

    private OffsetLimit(long offset, int limit, Sort sort) {
        this.offset = offset;
        this.limit = limit;
        this.sort = sort;
    }

    /**
     * @throws IllegalArgumentException if skip is negative or limit is outside 1..{@value #MAX_LIMIT}
     */
    public static OffsetLimit of(int skip, int limit, Sort sort) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be >= 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return new OffsetLimit(skip, limit, sort == null ? Sort.unsorted() : sort);
    }

    public static OffsetLimit of(int skip, int limit) {
        return of(skip, limit, Sort.unsorted());
    }

    /** First {@code limit} rows in the given order. */
    public static OffsetLimit first(int limit, Sort sort) {
        return of(0, limit, sort);
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Pageable next() {
        return new OffsetLimit(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetLimit(Math.max(0, offset - limit), limit, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetLimit(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetLimit((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
}
