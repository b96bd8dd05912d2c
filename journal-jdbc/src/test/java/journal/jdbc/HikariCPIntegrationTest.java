package journal.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import journal.Destination;
import journal.admin.JournalOutputs;
import journal.dispatch.Router;
import journal.jdbc.store.H2ListenerStore;
import journal.jdbc.store.JdbcListenerStores;
import journal.jdbc.tx.JdbcTransactionManager;
import journal.spi.ListenerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcTransactionManager txManager;
  private H2ListenerStore store;
  private final Map<String, Destination> channels = new HashMap<>();

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("journal-test-pool");

    hikariDs = new HikariDataSource(config);
    txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(hikariDs));
    store = (H2ListenerStore) JdbcListenerStores.detect(hikariDs);

    try (Connection conn = hikariDs.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("RUNSCRIPT FROM 'classpath:journal/schema/h2.sql'");
    }
  }

  @AfterEach
  void teardown() {
    if (hikariDs != null) {
      hikariDs.close();
    }
  }

  private CollectingChannel channel(String id, int expected) {
    CollectingChannel channel = new CollectingChannel(id, expected);
    channels.put(id, channel);
    return channel;
  }

  @Test
  void outputsSurviveRestartThroughTheStore() throws Exception {
    CollectingChannel modLog = channel("mod-log", 1);

    try (Router router = Router.builder().build()) {
      JournalOutputs outputs = new JournalOutputs(router, store, id -> Optional.ofNullable(channels.get(id)));
      try (var tx = txManager.begin()) {
        outputs.add(tx.connection(), "guild-1", modLog, "/moderation", true);
        tx.commit();
      }
    }

    try (Router restarted = Router.builder().build()) {
      JournalOutputs outputs = new JournalOutputs(restarted, store, id -> Optional.ofNullable(channels.get(id)));
      try (Connection conn = hikariDs.getConnection()) {
        assertEquals(1, outputs.restoreAll(conn));
      }
      restarted.start();
      modLog.reset(1);

      restarted.broadcaster("/moderation").send("/moderation/member/kick", "guild-1", "Kicked spammer");

      assertTrue(modLog.latch.await(5, TimeUnit.SECONDS));
      assertTrue(modLog.received.get(0).startsWith("Kicked spammer"));
    }
  }

  @Test
  void rolledBackAddIsNotPersisted() throws Exception {
    CollectingChannel modLog = channel("mod-log", 1);

    try (Router router = Router.builder().build()) {
      JournalOutputs outputs = new JournalOutputs(router, store, id -> Optional.ofNullable(channels.get(id)));
      try (var tx = txManager.begin()) {
        outputs.add(tx.connection(), "guild-1", modLog, "/moderation", true);
        tx.rollback();
      }

      try (Connection conn = hikariDs.getConnection()) {
        assertTrue(outputs.outputs(conn, "guild-1").isEmpty());
      }
    }
  }

  @Test
  void moveAndRemoveUpdateStoredRows() throws Exception {
    CollectingChannel modLog = channel("mod-log", 10);
    CollectingChannel audit = channel("audit", 10);

    try (Router router = Router.builder().build()) {
      JournalOutputs outputs = new JournalOutputs(router, store, id -> Optional.ofNullable(channels.get(id)));
      try (var tx = txManager.begin()) {
        outputs.add(tx.connection(), "guild-1", modLog, "/journal", true);
        outputs.add(tx.connection(), "guild-1", modLog, "/filter", false);
        assertTrue(outputs.move(tx.connection(), "guild-1", modLog, audit, "/journal", true));
        assertTrue(outputs.remove(tx.connection(), "guild-1", modLog, "/filter"));
        tx.commit();
      }

      try (Connection conn = hikariDs.getConnection()) {
        assertEquals(List.of(new ListenerRecord("guild-1", "audit", "/journal", true)),
            outputs.outputs(conn, "guild-1"));
      }
    }
  }

  private static final class CollectingChannel implements Destination {
    private final String id;
    private final List<String> received = new ArrayList<>();
    private volatile CountDownLatch latch;

    CollectingChannel(String id, int expected) {
      this.id = id;
      this.latch = new CountDownLatch(expected);
    }

    void reset(int expected) {
      synchronized (received) {
        received.clear();
      }
      latch = new CountDownLatch(expected);
    }

    @Override
    public String id() {
      return id;
    }

    @Override
    public void send(String content) {
      synchronized (received) {
        received.add(content);
      }
      latch.countDown();
    }
  }
}
