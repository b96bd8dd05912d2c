package journal.filter;

import journal.JournalEvent;

/**
 * Structured predicate over a journal event's path, scope, content and attributes.
 *
 * <p>Build instances with {@link EventFilters}; arbitrary lambdas are accepted too.
 */
@FunctionalInterface
public interface EventFilter {

  boolean test(JournalEvent event);

  default EventFilter and(EventFilter other) {
    return event -> test(event) && other.test(event);
  }

  default EventFilter or(EventFilter other) {
    return event -> test(event) || other.test(event);
  }

  default EventFilter negate() {
    return event -> !test(event);
  }
}
