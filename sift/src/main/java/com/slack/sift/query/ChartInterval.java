package com.slack.sift.query;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Histogram bucket width picked from the width of the searched time range. The label is the
 * interval literal used in the histogram SQL, e.g. {@code histogram(_timestamp, '5 minute')}.
 */
public enum ChartInterval {
  SECONDS_10("10 second", Duration.ofSeconds(10), Duration.ZERO),
  SECONDS_15("15 second", Duration.ofSeconds(15), Duration.ofMinutes(30)),
  SECONDS_30("30 second", Duration.ofSeconds(30), Duration.ofHours(1)),
  MINUTE_1("1 minute", Duration.ofMinutes(1), Duration.ofHours(2)),
  MINUTES_5("5 minute", Duration.ofMinutes(5), Duration.ofHours(6)),
  MINUTES_30("30 minute", Duration.ofMinutes(30), Duration.ofHours(24)),
  HOUR_1("1 hour", Duration.ofHours(1), Duration.ofDays(7)),
  DAY_1("1 day", Duration.ofDays(1), Duration.ofDays(30));

  public static final DateTimeFormatter KEY_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

  public final String label;
  public final Duration width;
  // The interval applies to ranges strictly longer than this.
  private final Duration rangeAbove;

  ChartInterval(String label, Duration width, Duration rangeAbove) {
    this.label = label;
    this.width = width;
    this.rangeAbove = rangeAbove;
  }

  public long widthMicros() {
    return width.toNanos() / 1000;
  }

  public static ChartInterval forRange(long startTimeMicros, long endTimeMicros) {
    Duration range = Duration.of(endTimeMicros - startTimeMicros, ChronoUnit.MICROS);
    ChartInterval interval = SECONDS_10;
    for (ChartInterval candidate : values()) {
      if (range.compareTo(candidate.rangeAbove) > 0) {
        interval = candidate;
      }
    }
    return interval;
  }

  /**
   * Aligns the first histogram bucket. Second intervals snap to :00 or :30, a one minute interval
   * drops the seconds, longer minute intervals round down to a multiple of the interval, hours
   * move to the top of the next hour and days to the next UTC midnight.
   */
  public Instant alignStart(Instant start) {
    ZonedDateTime time = start.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
    switch (this) {
      case SECONDS_10, SECONDS_15, SECONDS_30 -> time =
          time.withSecond(time.getSecond() > 30 ? 30 : 0);
      case MINUTE_1 -> time = time.withSecond(0);
      case MINUTES_5, MINUTES_30 -> {
        int minutes = (int) width.toMinutes();
        time = time.withSecond(0).withMinute(time.getMinute() / minutes * minutes);
      }
      case HOUR_1 -> time = time.truncatedTo(ChronoUnit.HOURS).plusHours(1);
      case DAY_1 -> time = time.truncatedTo(ChronoUnit.DAYS).plusDays(1);
      default -> throw new IllegalStateException("Unknown interval " + this);
    }
    return time.toInstant();
  }

  public static String formatKey(Instant instant) {
    return KEY_FORMAT.format(instant);
  }
}
