package journal;

import java.util.Objects;

/**
 * Outcome of a single delivery attempt to one output listener.
 *
 * <ul>
 *   <li>{@link Delivered}: the destination accepted the content.</li>
 *   <li>{@link Failed}: the destination rejected it or could not be reached. The event
 *       stays in history; there is no retry.</li>
 * </ul>
 */
public sealed interface DeliveryResult permits DeliveryResult.Delivered, DeliveryResult.Failed {

  Delivered DELIVERED = new Delivered();

  static Delivered delivered() {
    return DELIVERED;
  }

  static Failed failed(Throwable cause) {
    return new Failed(cause);
  }

  default boolean isSuccess() {
    return this instanceof Delivered;
  }

  /** Content accepted by the destination. */
  record Delivered() implements DeliveryResult {
  }

  /**
   * Delivery failed.
   *
   * @param cause the failure raised by rendering or by the destination
   */
  record Failed(Throwable cause) implements DeliveryResult {
    public Failed {
      Objects.requireNonNull(cause, "cause");
    }
  }
}
