package journal.spring.boot;

import journal.admin.JournalOutputs;
import journal.dispatch.Router;
import journal.listener.OutputListener;
import journal.spi.ConnectionProvider;
import journal.spi.ListenerRecord;
import journal.spi.ListenerStore;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JournalOutputRegistrarTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(RegistrarConfig.class);

    @Test
    void mountsAnnotatedDestinationOnEveryPath() {
        runner.withUserConfiguration(MultiPathConfig.class).run(ctx -> {
            var router = ctx.getBean(Router.class);
            var destination = ctx.getBean(MultiPathDestination.class);

            assertTrue(router.get("/moderation", destination).isPresent());
            assertTrue(router.get("/journal", destination).isPresent());
            assertEquals(2, router.listeners().size());
        });
    }

    @Test
    void appliesAnnotationAttributes() {
        runner.withUserConfiguration(ScopedConfig.class).run(ctx -> {
            var router = ctx.getBean(Router.class);
            Optional<OutputListener> listener = router.get("/member/join");

            assertTrue(listener.isPresent());
            assertFalse(listener.get().recursive());
            assertEquals("guild-7", listener.get().scope());
        });
    }

    @Test
    void emptyScopeMeansEveryScope() {
        runner.withUserConfiguration(MultiPathConfig.class).run(ctx -> {
            var router = ctx.getBean(Router.class);
            assertNull(router.get("/moderation").orElseThrow().scope());
        });
    }

    @Test
    void findsAnnotationOnBeanMethod() {
        runner.withUserConfiguration(FactoryMethodConfig.class).run(ctx -> {
            var router = ctx.getBean(Router.class);
            assertTrue(router.get("/filter").isPresent());
        });
    }

    @Test
    void startsRouter() {
        runner.run(ctx -> {
            assertTrue(ctx.getBean(Router.class).isRunning());
        });
    }

    @Test
    void failsWhenBeanIsNotADestination() {
        runner.withUserConfiguration(NotADestinationConfig.class).run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
        });
    }

    @Test
    void failsOnMalformedPath() {
        runner.withUserConfiguration(BadPathConfig.class).run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(BeanCreationException.class, ctx.getStartupFailure());
        });
    }

    // ── Test configurations ──────────────────────────────────────

    @Configuration
    static class RegistrarConfig {
        @Bean(destroyMethod = "close")
        Router router() {
            return Router.builder().build();
        }

        @Bean
        JournalOutputs journalOutputs(Router router) {
            return new JournalOutputs(router, new EmptyStore(), id -> Optional.empty());
        }

        @Bean
        JournalOutputRegistrar journalOutputRegistrar(ListableBeanFactory beanFactory, Router router,
                JournalOutputs journalOutputs) {
            ConnectionProvider noConnections = () -> {
                throw new AssertionError("restore is disabled");
            };
            return new JournalOutputRegistrar(beanFactory, router, journalOutputs, noConnections, false);
        }
    }

    @JournalOutput({"/moderation", "/journal"})
    static class MultiPathDestination extends TestDestination {
        MultiPathDestination() {
            super("mod-log");
        }
    }

    @Configuration
    static class MultiPathConfig {
        @Bean
        MultiPathDestination multiPathDestination() {
            return new MultiPathDestination();
        }
    }

    @JournalOutput(value = "/member/join", recursive = false, scope = "guild-7", showAttributes = false)
    static class ScopedDestination extends TestDestination {
        ScopedDestination() {
            super("joins");
        }
    }

    @Configuration
    static class ScopedConfig {
        @Bean
        ScopedDestination scopedDestination() {
            return new ScopedDestination();
        }
    }

    @Configuration
    static class FactoryMethodConfig {
        @Bean
        @JournalOutput("/filter")
        TestDestination filterLog() {
            return new TestDestination("filter-log");
        }
    }

    @JournalOutput("/moderation")
    static class NotADestination {
    }

    @Configuration
    static class NotADestinationConfig {
        @Bean
        NotADestination notADestination() {
            return new NotADestination();
        }
    }

    @JournalOutput("relative/path")
    static class BadPathDestination extends TestDestination {
        BadPathDestination() {
            super("bad");
        }
    }

    @Configuration
    static class BadPathConfig {
        @Bean
        BadPathDestination badPathDestination() {
            return new BadPathDestination();
        }
    }

    static class EmptyStore implements ListenerStore {
        @Override
        public List<ListenerRecord> listListeners(Connection conn, String scope) {
            return List.of();
        }

        @Override
        public List<ListenerRecord> listAll(Connection conn) {
            return List.of();
        }

        @Override
        public List<ListenerRecord> listByDestination(Connection conn, String destinationId) {
            return List.of();
        }

        @Override
        public boolean exists(Connection conn, String destinationId, String path) {
            return false;
        }

        @Override
        public void insert(Connection conn, ListenerRecord record) {
        }

        @Override
        public int update(Connection conn, ListenerRecord record) {
            return 0;
        }

        @Override
        public int delete(Connection conn, String destinationId, String path) {
            return 0;
        }
    }
}
