package com.slack.sift.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** User facing notifications raised while a search runs, such as a confirmed cancel. */
public interface SearchNotifier {

  void notify(String message);

  SearchNotifier LOGGING =
      new SearchNotifier() {
        private final Logger log = LoggerFactory.getLogger(SearchNotifier.class);

        @Override
        public void notify(String message) {
          log.info("Search notification: {}", message);
        }
      };
}
