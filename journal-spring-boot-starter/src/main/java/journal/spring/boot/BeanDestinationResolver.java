package journal.spring.boot;

import journal.Destination;
import journal.spi.DestinationResolver;

import org.springframework.beans.factory.ListableBeanFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves persisted destination ids against the {@link Destination} beans of the
 * application context. Beans are looked up on every call so destinations created after
 * this resolver are still found.
 */
public class BeanDestinationResolver implements DestinationResolver {

    private final ListableBeanFactory beanFactory;

    public BeanDestinationResolver(ListableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory");
    }

    @Override
    public Optional<Destination> resolve(String destinationId) {
        return beanFactory.getBeansOfType(Destination.class).values().stream()
                .filter(destination -> destination.id().equals(destinationId))
                .findFirst();
    }
}
