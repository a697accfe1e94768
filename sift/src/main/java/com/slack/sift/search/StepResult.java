package com.slack.sift.search;

/** Outcome of one iteration of a fetch loop. */
public enum StepResult {
  CONTINUE,
  DONE
}
