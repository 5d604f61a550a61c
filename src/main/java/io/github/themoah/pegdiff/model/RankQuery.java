package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.config.InvalidConfigException;
import java.util.Locale;

/**
 * Filter, sort and paging parameters for the comparison table.
 *
 * @param nameFilter case-insensitive substring on the metric name, null or blank for all
 * @param weightFilter weight bucket filter
 * @param trendFilter trend filter
 * @param sortKey sort column
 * @param direction sort direction
 * @param page zero-based page index
 * @param pageSize rows per page
 */
public record RankQuery(
  String nameFilter,
  WeightFilter weightFilter,
  TrendFilter trendFilter,
  SortKey sortKey,
  SortDirection direction,
  int page,
  int pageSize
) {

  public static final int DEFAULT_PAGE_SIZE = 10;

  public enum WeightFilter { ALL, HIGH, MEDIUM, LOW }

  public enum TrendFilter { ALL, UP, DOWN, STABLE }

  public enum SortKey { WEIGHT, PERCENT_CHANGE, NAME }

  public enum SortDirection { ASC, DESC }

  public RankQuery {
    weightFilter = weightFilter == null ? WeightFilter.ALL : weightFilter;
    trendFilter = trendFilter == null ? TrendFilter.ALL : trendFilter;
    sortKey = sortKey == null ? SortKey.WEIGHT : sortKey;
    direction = direction == null ? SortDirection.DESC : direction;
  }

  /**
   * All rows, heaviest first, first page of the default size.
   */
  public static RankQuery defaults() {
    return new RankQuery(null, WeightFilter.ALL, TrendFilter.ALL,
      SortKey.WEIGHT, SortDirection.DESC, 0, DEFAULT_PAGE_SIZE);
  }

  public RankQuery withTrendFilter(TrendFilter filter) {
    return new RankQuery(nameFilter, weightFilter, filter, sortKey, direction, page, pageSize);
  }

  public RankQuery withPage(int newPage, int newPageSize) {
    return new RankQuery(nameFilter, weightFilter, trendFilter, sortKey, direction, newPage, newPageSize);
  }

  /**
   * Returns true if the name passes the name filter.
   */
  public boolean matchesName(String name) {
    if (nameFilter == null || nameFilter.isBlank()) {
      return true;
    }
    return name.toLowerCase(Locale.ROOT).contains(nameFilter.toLowerCase(Locale.ROOT));
  }

  public boolean matchesWeight(WeightBucket bucket) {
    return switch (weightFilter) {
      case ALL -> true;
      case HIGH -> bucket == WeightBucket.HIGH;
      case MEDIUM -> bucket == WeightBucket.MEDIUM;
      case LOW -> bucket == WeightBucket.LOW;
    };
  }

  public boolean matchesTrend(Trend trend) {
    return switch (trendFilter) {
      case ALL -> true;
      case UP -> trend == Trend.UP;
      case DOWN -> trend == Trend.DOWN;
      case STABLE -> trend == Trend.STABLE;
    };
  }

  /**
   * @throws InvalidConfigException if the page index is negative or the page size is not positive
   */
  public void validate() {
    if (page < 0) {
      throw new InvalidConfigException("page must not be negative: " + page);
    }
    if (pageSize <= 0) {
      throw new InvalidConfigException("pageSize must be positive: " + pageSize);
    }
  }
}
