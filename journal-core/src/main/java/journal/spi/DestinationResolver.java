package journal.spi;

import journal.Destination;

import java.util.Optional;

/**
 * Resolves a persisted destination id back to a live {@link Destination}, for example by
 * looking up a chat channel by its id.
 */
@FunctionalInterface
public interface DestinationResolver {

  /**
   * Resolves a destination.
   *
   * @param destinationId the persisted id
   * @return the destination, or empty if it no longer exists
   */
  Optional<Destination> resolve(String destinationId);
}
