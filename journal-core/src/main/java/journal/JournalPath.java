package journal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root-anchored, slash-delimited topic name under which journal events are published
 * and output listeners are mounted.
 *
 * <p>Examples: {@code /}, {@code /journal}, {@code /journal/channel/add}.
 *
 * <p>Descendant checks honour segment boundaries: {@code /journal/channel} is under
 * {@code /journal}, but {@code /journalist} is not.
 */
public final class JournalPath implements Comparable<JournalPath> {
  public static final char SEPARATOR = '/';

  private static final JournalPath ROOT = new JournalPath("/");

  private final String value;

  private JournalPath(String value) {
    this.value = value;
  }

  /**
   * Parses and validates a path.
   *
   * @param path the textual path
   * @return the parsed path
   * @throws PathFormatException if the path is null, empty, relative, has empty or
   *     relative segments, a trailing slash, or whitespace/control characters
   */
  public static JournalPath of(String path) {
    validate(path);
    return path.length() == 1 ? ROOT : new JournalPath(path);
  }

  public static JournalPath root() {
    return ROOT;
  }

  private static void validate(String path) {
    if (path == null) {
      throw new PathFormatException(null, "path is null");
    }
    if (path.isEmpty()) {
      throw new PathFormatException(path, "path is empty");
    }
    if (path.charAt(0) != SEPARATOR) {
      throw new PathFormatException(path, "path must start with '/'");
    }
    if (path.length() == 1) {
      return;
    }
    if (path.charAt(path.length() - 1) == SEPARATOR) {
      throw new PathFormatException(path, "trailing '/' is not allowed");
    }
    int start = 1;
    while (start <= path.length()) {
      int end = path.indexOf(SEPARATOR, start);
      if (end < 0) {
        end = path.length();
      }
      String segment = path.substring(start, end);
      if (segment.isEmpty()) {
        throw new PathFormatException(path, "empty segment");
      }
      if (segment.equals(".") || segment.equals("..")) {
        throw new PathFormatException(path, "relative segment '" + segment + "'");
      }
      for (int i = 0; i < segment.length(); i++) {
        char c = segment.charAt(i);
        if (Character.isWhitespace(c) || Character.isISOControl(c)) {
          throw new PathFormatException(path, "whitespace or control character in segment '" + segment + "'");
        }
      }
      start = end + 1;
    }
  }

  public boolean isRoot() {
    return this == ROOT || value.length() == 1;
  }

  /**
   * Returns the parent path, or {@code null} for the root.
   *
   * @return the parent, or {@code null}
   */
  public JournalPath parent() {
    if (isRoot()) {
      return null;
    }
    int idx = value.lastIndexOf(SEPARATOR);
    return idx == 0 ? ROOT : new JournalPath(value.substring(0, idx));
  }

  /**
   * Resolves a relative, slash-delimited child path against this path.
   *
   * @param relative relative path such as {@code channel/add}; must not start with '/'
   * @return the resolved path
   * @throws PathFormatException if the result is not a valid path
   */
  public JournalPath resolve(String relative) {
    if (relative == null || relative.isEmpty()) {
      throw new PathFormatException(relative, "relative path is empty");
    }
    if (relative.charAt(0) == SEPARATOR) {
      throw new PathFormatException(relative, "relative path must not start with '/'");
    }
    return of(isRoot() ? SEPARATOR + relative : value + SEPARATOR + relative);
  }

  /**
   * Returns the path segments, root first. The root path has no segments.
   *
   * @return unmodifiable segment list
   */
  public List<String> segments() {
    if (isRoot()) {
      return Collections.emptyList();
    }
    List<String> segments = new ArrayList<>();
    int start = 1;
    while (start <= value.length()) {
      int end = value.indexOf(SEPARATOR, start);
      if (end < 0) {
        end = value.length();
      }
      segments.add(value.substring(start, end));
      start = end + 1;
    }
    return Collections.unmodifiableList(segments);
  }

  /**
   * Returns {@code true} if this path lies strictly below {@code ancestor}.
   *
   * @param ancestor candidate ancestor
   * @return whether this path is a strict descendant
   */
  public boolean isDescendantOf(JournalPath ancestor) {
    if (ancestor.isRoot()) {
      return !isRoot();
    }
    return value.length() > ancestor.value.length()
        && value.startsWith(ancestor.value)
        && value.charAt(ancestor.value.length()) == SEPARATOR;
  }

  public boolean isSameOrDescendantOf(JournalPath ancestor) {
    return equals(ancestor) || isDescendantOf(ancestor);
  }

  public String value() {
    return value;
  }

  @Override
  public int compareTo(JournalPath other) {
    return value.compareTo(other.value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof JournalPath)) return false;
    return value.equals(((JournalPath) o).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value;
  }
}
