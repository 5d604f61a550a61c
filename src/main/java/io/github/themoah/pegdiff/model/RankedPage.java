package io.github.themoah.pegdiff.model;

import java.util.List;

/**
 * One page of the filtered and sorted comparison table.
 *
 * @param items rows on this page
 * @param totalItems rows matching the filters across all pages
 * @param totalPages ceil(totalItems / pageSize)
 * @param page zero-based page index
 * @param pageSize requested page size
 * @param summary trend roll-up of this page
 */
public record RankedPage(
  List<ChangeRecord> items,
  int totalItems,
  int totalPages,
  int page,
  int pageSize,
  TrendSummary summary
) {

  public RankedPage {
    items = List.copyOf(items);
  }
}
