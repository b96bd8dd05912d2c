package journal.filter;

import journal.JournalEvent;
import journal.JournalPath;

import java.util.List;
import java.util.Objects;

/**
 * Factory for {@link EventFilter} instances.
 *
 * <p>Administrative search uses {@link #parse(String)}, a fixed term syntax with no
 * expression evaluation:
 *
 * <pre>{@code
 * path=/journal/channel/add     exact path
 * path^=/journal                path or any descendant
 * scope=guild-1                 scope equality
 * content~=kicked               content contains text
 * attr.channel=mod-log          attribute equals (string form)
 * attr.reason~=spam             attribute contains text
 * has=channel                   attribute present
 * !has=recursive                negation
 * content~="two words"          quoted values may contain spaces
 * }</pre>
 *
 * <p>Terms are separated by whitespace and combined with AND.
 */
public final class EventFilters {

  private static final EventFilter ALL = event -> true;

  private EventFilters() {}

  public static EventFilter all() {
    return ALL;
  }

  public static EventFilter pathEquals(String path) {
    JournalPath expected = JournalPath.of(path);
    return event -> event.path().equals(expected);
  }

  /**
   * Matches events on {@code path} or any descendant of it.
   *
   * @param path the subtree root
   * @return the filter
   */
  public static EventFilter pathUnder(String path) {
    JournalPath ancestor = JournalPath.of(path);
    return event -> event.path().isSameOrDescendantOf(ancestor);
  }

  /**
   * Matches events whose scope equals {@code scope}; a {@code null} scope matches
   * global events only.
   *
   * @param scope the scope
   * @return the filter
   */
  public static EventFilter scopeEquals(String scope) {
    return event -> Objects.equals(scope, event.scope());
  }

  public static EventFilter contentContains(String text) {
    Objects.requireNonNull(text, "text");
    return event -> event.content().contains(text);
  }

  public static EventFilter hasAttribute(String key) {
    Objects.requireNonNull(key, "key");
    return event -> event.attributes().containsKey(key);
  }

  /**
   * Matches events whose attribute {@code key} has the string form {@code value}.
   *
   * @param key attribute key
   * @param value expected value, compared with {@code String.valueOf}
   * @return the filter
   */
  public static EventFilter attributeEquals(String key, Object value) {
    Objects.requireNonNull(key, "key");
    String expected = String.valueOf(value);
    return event -> {
      Object actual = event.attributes().get(key);
      return actual != null && expected.equals(String.valueOf(actual));
    };
  }

  public static EventFilter attributeContains(String key, String text) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(text, "text");
    return event -> {
      Object actual = event.attributes().get(key);
      return actual != null && String.valueOf(actual).contains(text);
    };
  }

  public static EventFilter and(List<EventFilter> filters) {
    EventFilter result = ALL;
    for (EventFilter filter : filters) {
      result = result == ALL ? filter : result.and(filter);
    }
    return result;
  }

  public static EventFilter or(EventFilter first, EventFilter second) {
    return first.or(second);
  }

  public static EventFilter not(EventFilter filter) {
    return filter.negate();
  }

  /**
   * Parses a filter expression. A {@code null} or blank expression matches everything.
   *
   * @param expression the expression
   * @return the parsed filter
   * @throws FilterSyntaxException if a term is unknown or malformed
   */
  public static EventFilter parse(String expression) {
    return FilterParser.parse(expression);
  }
}
