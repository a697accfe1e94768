package com.slack.sift.partition;

/**
 * One fetch that fills part of a logical page: {@code size} rows starting at {@code from} within
 * the partition {@code [startTime, endTime]}.
 */
public record PageSlice(
    long startTime,
    long endTime,
    int from,
    int size,
    boolean streamingOutput,
    String streamingId) {}
