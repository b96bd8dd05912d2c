package journal.spring.boot;

import journal.Destination;
import journal.JournalPath;
import journal.PathFormatException;
import journal.admin.JournalOutputs;
import journal.dispatch.Router;
import journal.listener.ChannelOutputListener;
import journal.spi.ConnectionProvider;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings the router up once every singleton exists: mounts {@link JournalOutput}
 * destinations, restores persisted outputs, then starts dispatch.
 *
 * @see JournalOutput
 */
public class JournalOutputRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(JournalOutputRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Router router;
    private final JournalOutputs outputs;
    private final ConnectionProvider connectionProvider;
    private final boolean restoreOnStartup;

    public JournalOutputRegistrar(ListableBeanFactory beanFactory, Router router,
            JournalOutputs outputs, ConnectionProvider connectionProvider, boolean restoreOnStartup) {
        this.beanFactory = beanFactory;
        this.router = router;
        this.outputs = outputs;
        this.connectionProvider = connectionProvider;
        this.restoreOnStartup = restoreOnStartup;
    }

    @Override
    public void afterSingletonsInstantiated() {
        registerAnnotated();
        if (restoreOnStartup) {
            restorePersisted();
        }
        router.start();
    }

    private void registerAnnotated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(JournalOutput.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof Destination destination)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @JournalOutput must implement Destination, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Looks through proxies and @Bean factory methods
            JournalOutput annotation = beanFactory.findAnnotationOnBean(beanName, JournalOutput.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @JournalOutput annotation on " + bean.getClass().getName());
            }
            if (annotation.value().length == 0) {
                throw new BeanCreationException(beanName, "@JournalOutput must name at least one path");
            }

            String scope = annotation.scope().isEmpty() ? null : annotation.scope();
            for (String path : annotation.value()) {
                JournalPath journalPath;
                try {
                    journalPath = JournalPath.of(path);
                } catch (PathFormatException e) {
                    throw new BeanCreationException(beanName, "Invalid @JournalOutput path: " + path, e);
                }
                router.register(new ChannelOutputListener(journalPath, annotation.recursive(), scope,
                        destination, annotation.showAttributes()));
                logger.log(Level.INFO, "Mounted {0} on journal path ''{1}''",
                        new Object[]{destination.id(), journalPath});
            }
        }
    }

    private void restorePersisted() {
        try (Connection conn = connectionProvider.getConnection()) {
            int restored = outputs.restoreAll(conn);
            logger.log(Level.INFO, "Restored {0} persisted journal outputs", restored);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to restore journal outputs", e);
        }
    }
}
