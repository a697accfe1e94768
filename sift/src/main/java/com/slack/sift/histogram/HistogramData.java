package com.slack.sift.histogram;

import java.util.List;

/** Chart ready histogram: bucket keys, their counts, the title line and any histogram error. */
public class HistogramData {
  public static final HistogramData EMPTY = new HistogramData(List.of(), List.of(), "", 0, "", "");

  public final List<String> xData;
  public final List<Long> yData;
  public final String title;
  public final int errorCode;
  public final String errorMsg;
  public final String errorDetail;

  public HistogramData(
      List<String> xData,
      List<Long> yData,
      String title,
      int errorCode,
      String errorMsg,
      String errorDetail) {
    this.xData = List.copyOf(xData);
    this.yData = List.copyOf(yData);
    this.title = title;
    this.errorCode = errorCode;
    this.errorMsg = errorMsg;
    this.errorDetail = errorDetail;
  }

  public static HistogramData error(String errorMsg, int errorCode, String title) {
    return new HistogramData(List.of(), List.of(), title, errorCode, errorMsg, "");
  }

  public boolean hasError() {
    return errorMsg != null && !errorMsg.isEmpty();
  }

  public HistogramData withTitle(String title) {
    return new HistogramData(xData, yData, title, errorCode, errorMsg, errorDetail);
  }

  public HistogramData withError(String errorMsg, int errorCode) {
    return new HistogramData(xData, yData, title, errorCode, errorMsg, errorDetail);
  }

  @Override
  public String toString() {
    return "HistogramData{"
        + "buckets="
        + xData.size()
        + ", title='"
        + title
        + '\''
        + ", errorCode="
        + errorCode
        + ", errorMsg='"
        + errorMsg
        + '\''
        + '}';
  }
}
