package journal;

import journal.dispatch.Router;
import journal.listener.RawOutputListener;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BroadcasterTest {

  @Test
  void sendUsesPathVerbatim() {
    try (Router router = Router.builder().build()) {
      Broadcaster journal = router.broadcaster("/journal");

      JournalEvent event = journal.send("/filter/message/blocked", "guild-1", "blocked", Map.of("rule", "r1"), "filter");

      assertEquals(JournalPath.of("/filter/message/blocked"), event.path());
      assertEquals("guild-1", event.scope());
      assertEquals("r1", event.attributes().get("rule"));
      assertEquals("filter", event.icon());
      assertSame(event, journal.history().latest());
    }
  }

  @Test
  void resolveBuildsPathUnderRoot() {
    try (Router router = Router.builder().build()) {
      Broadcaster journal = router.broadcaster("/journal");

      assertEquals(JournalPath.of("/journal/channel/add"), journal.resolve("channel/add"));
      assertEquals(JournalPath.of("/journal"), journal.root());
    }
  }

  @Test
  void broadcastersShareOneHistory() {
    try (Router router = Router.builder().build()) {
      router.broadcaster("/a").send("/a/x", null, "1");
      router.broadcaster("/b").send("/b/y", null, "2");

      assertEquals(2, router.broadcaster("/a").history().size());
      assertSame(router.history(), router.broadcaster("/b").history());
    }
  }

  @Test
  void rejectsRootAndMalformedPaths() {
    try (Router router = Router.builder().build()) {
      Broadcaster root = router.broadcaster("/");

      assertThrows(PathFormatException.class, () -> root.send("/", null, "x"));
      assertThrows(PathFormatException.class, () -> root.send("journal", null, "x"));
      assertTrue(router.history().isEmpty());
    }
  }

  @Test
  void sendDoesNotWaitForSlowDestinations() throws Exception {
    RecordingDestination destination = new RecordingDestination("d");
    try (Router router = Router.builder().build()) {
      router.register(new RawOutputListener("/journal", true, destination));
      Broadcaster journal = router.broadcaster("/journal");

      journal.send("/journal/a", null, "queued before start");
      assertTrue(destination.received().isEmpty());

      router.start();
      assertTrue(destination.await(1, 5, TimeUnit.SECONDS));
      assertEquals(List.of("queued before start"), destination.received());
    }
  }
}
