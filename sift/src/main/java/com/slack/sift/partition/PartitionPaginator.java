package com.slack.sift.partition;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the logical pages of a result set spread over partitions.
 *
 * <p>Pages are filled partition by partition in partition order. When a partition ends part way
 * through a page, the head of the next partition tops that page up to exactly {@code rowsPerPage},
 * so one page may be read from several partitions. A partition of unknown size contributes one
 * best effort slice that closes the current page; its real size is filled in once a response
 * reports it and the pages are rebuilt.
 */
public class PartitionPaginator {
  // Keep at least this many pages ahead of the current page before rebuilding.
  static final int REBUILD_HORIZON = 3;
  // Never build more than this many pages past the current page.
  static final int LOOKAHEAD = 10;

  private PartitionPaginator() {}

  /**
   * Rebuilds {@code detail}'s pages unless enough pages ahead of {@code currentPage} already exist
   * and {@code force} is not set.
   *
   * @return the total row count of the measured partitions
   */
  public static long refresh(
      PartitionDetail detail, int rowsPerPage, int currentPage, boolean force) {
    if (detail.getPaginations().size() > currentPage + REBUILD_HORIZON && !force) {
      return detail.knownTotal();
    }

    List<List<PageSlice>> pages = new ArrayList<>();
    List<PageSlice> page = new ArrayList<>();
    int pageFill = 0;

    partitions:
    for (int i = 0; i < detail.size(); i++) {
      PartitionRange partition = detail.getPartition(i);
      long total = detail.getTotal(i);

      if (total == 0) {
        // Keeps the slice cursor aligned with the partitions without taking page space.
        page.add(slice(detail, partition, 0, 0));
        continue;
      }

      if (total < 0) {
        page.add(slice(detail, partition, 0, rowsPerPage - pageFill));
        pages.add(page);
        page = new ArrayList<>();
        pageFill = 0;
        if (pages.size() > currentPage + LOOKAHEAD) {
          break;
        }
        continue;
      }

      long from = 0;
      while (from < total) {
        int size = (int) Math.min(rowsPerPage - pageFill, total - from);
        page.add(slice(detail, partition, (int) from, size));
        pageFill += size;
        from += size;

        if (pageFill == rowsPerPage) {
          pages.add(page);
          page = new ArrayList<>();
          pageFill = 0;
          if (pages.size() > currentPage + LOOKAHEAD) {
            break partitions;
          }
        }
      }
    }

    if (!page.isEmpty()) {
      pages.add(page);
    }
    detail.setPaginations(pages);
    return detail.knownTotal();
  }

  private static PageSlice slice(
      PartitionDetail detail, PartitionRange partition, int from, int size) {
    return new PageSlice(
        partition.startTime(),
        partition.endTime(),
        from,
        size,
        detail.isStreamingOutput(),
        detail.getStreamingId());
  }
}
