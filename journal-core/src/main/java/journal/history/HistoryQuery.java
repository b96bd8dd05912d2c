package journal.history;

import journal.filter.EventFilter;
import journal.filter.EventFilters;

import java.util.Objects;

/**
 * Parameters of a {@link History#query(HistoryQuery)}: optional scope, optional structured
 * filter and a cap on the number of returned events.
 *
 * <pre>{@code
 * List<JournalEvent> recent = history.query(HistoryQuery.builder()
 *     .scope("guild-1")
 *     .filter(EventFilters.parse("path^=/journal attr.channel=mod-log"))
 *     .build());
 * }</pre>
 */
public final class HistoryQuery {
  public static final int DEFAULT_LIMIT = 20;
  public static final int NO_LIMIT = 0;

  private static final HistoryQuery UNLIMITED = builder().limit(NO_LIMIT).build();

  private final boolean hasScope;
  private final String scope;
  private final EventFilter filter;
  private final int limit;

  private HistoryQuery(Builder builder) {
    if (builder.limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0");
    }
    this.hasScope = builder.hasScope;
    this.scope = builder.scope;
    this.filter = builder.filter == null ? EventFilters.all() : builder.filter;
    this.limit = builder.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a query that matches every event with no cap.
   *
   * @return the unlimited query
   */
  public static HistoryQuery unlimited() {
    return UNLIMITED;
  }

  public boolean hasScope() {
    return hasScope;
  }

  public String scope() {
    return scope;
  }

  public EventFilter filter() {
    return filter;
  }

  public int limit() {
    return limit;
  }

  /** Builder for {@link HistoryQuery}. */
  public static final class Builder {
    private boolean hasScope;
    private String scope;
    private EventFilter filter;
    private int limit = DEFAULT_LIMIT;

    private Builder() {}

    /**
     * Restricts results to events of {@code scope}. Passing {@code null} restricts to
     * global events.
     *
     * @param scope the scope
     * @return this builder
     */
    public Builder scope(String scope) {
      this.hasScope = true;
      this.scope = scope;
      return this;
    }

    public Builder filter(EventFilter filter) {
      this.filter = Objects.requireNonNull(filter, "filter");
      return this;
    }

    /**
     * Caps the number of returned events.
     *
     * <p>Optional. Defaults to {@value HistoryQuery#DEFAULT_LIMIT}; {@value HistoryQuery#NO_LIMIT}
     * disables the cap.
     *
     * @param limit maximum number of events
     * @return this builder
     */
    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public HistoryQuery build() {
      return new HistoryQuery(this);
    }
  }
}
