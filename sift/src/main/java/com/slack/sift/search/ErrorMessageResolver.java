package com.slack.sift.search;

import java.util.Optional;

/** Maps server error codes to localized messages. */
@FunctionalInterface
public interface ErrorMessageResolver {
  ErrorMessageResolver NONE = code -> Optional.empty();

  Optional<String> customMessage(int code);
}
