package com.slack.sift.histogram;

import java.text.NumberFormat;
import java.util.Locale;

/**
 * Summary line shown above the histogram, e.g. {@code Showing 1 to 50 out of 1,234 events in 35
 * ms. (Scan Size: 1.20 MB)}. A {@code +} after the total marks a total that is still a lower bound.
 */
public class HistogramTitle {
  private HistogramTitle() {}

  public static String format(
      int currentPage,
      int rowsPerPage,
      int pageCount,
      boolean paginationEnabled,
      int hitCount,
      long total,
      boolean incompleteTotal,
      long took,
      double scanSizeMb,
      boolean deltaScan) {
    int pageIndex = Math.max(currentPage - 1, 0);
    long startCount = (long) pageIndex * rowsPerPage + 1;
    long totalCount = Math.max(hitCount, total);
    long endCount;

    if (!paginationEnabled) {
      endCount = hitCount;
      totalCount = hitCount;
    } else if (pageIndex >= pageCount - 1) {
      endCount = Math.min(startCount + rowsPerPage - 1, totalCount);
    } else {
      endCount = (long) rowsPerPage * (pageIndex + 1);
    }

    String plusSign = incompleteTotal && endCount <= totalCount ? "+" : "";
    String scanSizeLabel = deltaScan ? "Delta Scan Size" : "Scan Size";
    return "Showing "
        + startCount
        + " to "
        + endCount
        + " out of "
        + NumberFormat.getIntegerInstance(Locale.US).format(totalCount)
        + plusSign
        + " events in "
        + took
        + " ms. ("
        + scanSizeLabel
        + ": "
        + formatSizeFromMb(scanSizeMb)
        + plusSign
        + ")";
  }

  /** Scan sizes are reported in MB. */
  public static String formatSizeFromMb(double sizeMb) {
    double bytes = sizeMb * 1024 * 1024;
    if (bytes < 1024) {
      return String.format(Locale.US, "%.2f B", bytes);
    }
    if (bytes < 1024 * 1024) {
      return String.format(Locale.US, "%.2f KB", bytes / 1024);
    }
    if (sizeMb < 1024) {
      return String.format(Locale.US, "%.2f MB", sizeMb);
    }
    return String.format(Locale.US, "%.2f GB", sizeMb / 1024);
  }
}
