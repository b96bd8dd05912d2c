package journal.filter;

import journal.JournalEvent;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventFiltersTest {

    private static JournalEvent kick() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("channel", "mod-log");
        attrs.put("reason", "posting spam links");
        attrs.put("count", 3);
        return JournalEvent.builder("/moderation/member/kick")
                .scope("guild-1")
                .content("Kicked member for spam")
                .attributes(attrs)
                .build();
    }

    @Test
    void factoryFilters() {
        JournalEvent event = kick();

        assertTrue(EventFilters.pathEquals("/moderation/member/kick").test(event));
        assertTrue(EventFilters.pathUnder("/moderation").test(event));
        assertFalse(EventFilters.pathUnder("/mod").test(event));
        assertTrue(EventFilters.scopeEquals("guild-1").test(event));
        assertTrue(EventFilters.contentContains("spam").test(event));
        assertTrue(EventFilters.hasAttribute("channel").test(event));
        assertTrue(EventFilters.attributeEquals("count", 3).test(event));
        assertTrue(EventFilters.attributeEquals("count", "3").test(event));
        assertTrue(EventFilters.attributeContains("reason", "spam").test(event));
        assertFalse(EventFilters.attributeContains("missing", "x").test(event));
    }

    @Test
    void combinators() {
        JournalEvent event = kick();
        EventFilter yes = EventFilters.all();
        EventFilter no = EventFilters.not(yes);

        assertFalse(no.test(event));
        assertTrue(EventFilters.or(no, yes).test(event));
        assertFalse(EventFilters.and(List.of(yes, no)).test(event));
        assertTrue(EventFilters.and(List.of()).test(event));
    }

    @Test
    void parseCombinesTermsWithAnd() {
        JournalEvent event = kick();

        assertTrue(EventFilters.parse("path^=/moderation scope=guild-1 attr.channel=mod-log").test(event));
        assertFalse(EventFilters.parse("path^=/moderation scope=guild-2").test(event));
    }

    @Test
    void parseSupportsNegationAndQuotes() {
        JournalEvent event = kick();

        assertTrue(EventFilters.parse("content~=\"for spam\"").test(event));
        assertTrue(EventFilters.parse("attr.reason~=\"spam links\" !has=recursive").test(event));
        assertFalse(EventFilters.parse("!has=channel").test(event));
    }

    @Test
    void blankExpressionMatchesEverything() {
        assertTrue(EventFilters.parse(null).test(kick()));
        assertTrue(EventFilters.parse("   ").test(kick()));
    }

    @Test
    void parseRejectsInvalidTerms() {
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("color=red"));
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("path"));
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("content=spam"));
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("scope^=x"));
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("path=relative"));
        assertThrows(FilterSyntaxException.class, () -> EventFilters.parse("content~=\"open"));
    }

    @Test
    void expressionsAreNeverEvaluated() {
        assertThrows(FilterSyntaxException.class,
                () -> EventFilters.parse("__import__('os').system('true')"));
    }
}
