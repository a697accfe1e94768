package com.slack.sift.query;

/** Renders a {@link QueryIR} back into SQL text. */
public interface SqlRenderer {
  String render(QueryIR queryIR);
}
