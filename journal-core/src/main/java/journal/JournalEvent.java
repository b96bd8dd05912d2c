package journal;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one routed journal occurrence.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default. Events carry a
 * hierarchical {@link JournalPath}, an optional scope (the tenant the event belongs to;
 * {@code null} for global events), a text payload, free-form attributes and an optional
 * icon tag used by renderers.
 *
 * <p>Events are never published on the root path.
 *
 * @see Broadcaster
 */
public final class JournalEvent {

  private final String eventId;
  private final JournalPath path;
  private final String scope;
  private final String content;
  private final Map<String, Object> attributes;
  private final String icon;
  private final Instant timestamp;

  private JournalEvent(Builder builder) {
    this.path = Objects.requireNonNull(builder.path, "path");
    if (path.isRoot()) {
      throw new PathFormatException(path.value(), "events cannot be published on the root path");
    }
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.scope = builder.scope;
    this.content = Objects.requireNonNull(builder.content, "content");
    this.icon = builder.icon;
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;

    Map<String, Object> attributeCopy = builder.attributes == null || builder.attributes.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    if (attributeCopy.containsKey(null)) {
      throw new IllegalArgumentException("attributes cannot contain null keys");
    }
    if (attributeCopy.containsValue(null)) {
      throw new IllegalArgumentException("attributes cannot contain null values");
    }
    this.attributes = attributeCopy;
  }

  /**
   * Creates a builder for an event on the given path.
   *
   * @param path the textual event path
   * @return a new builder
   * @throws PathFormatException if the path is malformed
   */
  public static Builder builder(String path) {
    return new Builder(JournalPath.of(path));
  }

  public static Builder builder(JournalPath path) {
    return new Builder(Objects.requireNonNull(path, "path"));
  }

  public String eventId() {
    return eventId;
  }

  public JournalPath path() {
    return path;
  }

  /**
   * Returns the tenant this event belongs to, or {@code null} for a global event.
   *
   * @return the scope, or {@code null}
   */
  public String scope() {
    return scope;
  }

  public String content() {
    return content;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  public String icon() {
    return icon;
  }

  public Instant timestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("JournalEvent{eventId=").append(eventId)
        .append(", path=").append(path);
    if (scope != null) {
      sb.append(", scope=").append(scope);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link JournalEvent}.
   */
  public static final class Builder {
    private final JournalPath path;
    private String eventId;
    private String scope;
    private String content = "";
    private Map<String, ?> attributes;
    private String icon;
    private Instant timestamp;

    private Builder(JournalPath path) {
      this.path = path;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the scope (tenant) of the event.
     *
     * <p>Optional. Defaults to {@code null}, a global event.
     *
     * @param scope the scope identifier
     * @return this builder
     */
    public Builder scope(String scope) {
      this.scope = scope;
      return this;
    }

    /**
     * Sets the text payload.
     *
     * <p>Optional. Defaults to an empty string.
     *
     * @param content the content
     * @return this builder
     */
    public Builder content(String content) {
      this.content = content;
      return this;
    }

    /**
     * Sets the event attributes. The map is defensively copied at build time.
     *
     * <p>Optional. Null keys and null values are rejected at build time.
     *
     * @param attributes the attributes
     * @return this builder
     */
    public Builder attributes(Map<String, ?> attributes) {
      this.attributes = attributes;
      return this;
    }

    public Builder icon(String icon) {
      this.icon = icon;
      return this;
    }

    /**
     * Sets the event timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp the timestamp
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Builds an immutable {@link JournalEvent}.
     *
     * @return a new event
     * @throws PathFormatException if the path is the root
     * @throws IllegalArgumentException if attributes contain null keys or values
     */
    public JournalEvent build() {
      return new JournalEvent(this);
    }
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
