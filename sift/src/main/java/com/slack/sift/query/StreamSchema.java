package com.slack.sift.query;

import java.util.Set;

/** A selected stream and the field names its schema is known to have. */
public record StreamSchema(String name, Set<String> fields) {
  public StreamSchema {
    fields = Set.copyOf(fields);
  }

  public boolean hasField(String field) {
    return fields.contains(field);
  }
}
