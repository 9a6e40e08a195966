package com.qasandbox.api.common;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Objects;

/**
 * {@link Pageable} addressed by raw offset ("skip") instead of page number,
 * so skip values that are not a multiple of the limit work.
 */
public final class OffsetPageRequest implements Pageable {

  public static final int DEFAULT_LIMIT = 20;
  public static final int MAX_LIMIT = 100;

  private final long offset;
  private final int limit;
  private final Sort sort;

  private OffsetPageRequest(long offset, int limit, Sort sort) {
    this.offset = offset;
    this.limit = limit;
    this.sort = Objects.requireNonNull(sort, "sort");
  }

  /**
   * @throws IllegalArgumentException when skip is negative or limit is outside 1..100
   */
  public static OffsetPageRequest of(int skip, int limit, Sort sort) {
    if (skip < 0) {
      throw new IllegalArgumentException("skip must be >= 0");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return new OffsetPageRequest(skip, limit, sort);
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
    return new OffsetPageRequest(offset + limit, limit, sort);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious() ? new OffsetPageRequest(Math.max(0, offset - limit), limit, sort) : first();
  }

  @Override
  public Pageable first() {
    return new OffsetPageRequest(0, limit, sort);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetPageRequest((long) pageNumber * limit, limit, sort);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OffsetPageRequest that)) return false;
    return offset == that.offset && limit == that.limit && sort.equals(that.sort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(offset, limit, sort);
  }

  @Override
  public String toString() {
    return "OffsetPageRequest[offset=" + offset + ", limit=" + limit + ", sort=" + sort + "]";
  }
}
