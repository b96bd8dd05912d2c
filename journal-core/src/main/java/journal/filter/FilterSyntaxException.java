package journal.filter;

/**
 * Thrown by {@link EventFilters#parse(String)} when a filter expression is malformed.
 */
public final class FilterSyntaxException extends IllegalArgumentException {

  public FilterSyntaxException(String message) {
    super(message);
  }
}
