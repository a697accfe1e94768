package com.slack.sift.query;

/** Parses user SQL into a {@link QueryIR}. */
public interface SqlParser {

  /**
   * @throws IllegalArgumentException when the text is not a valid statement
   */
  QueryIR parse(String sql);
}
