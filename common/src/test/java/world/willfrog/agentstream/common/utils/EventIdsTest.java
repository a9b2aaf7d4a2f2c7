package world.willfrog.agentstream.common.utils;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventIdsTest {

    @Test
    void format_shouldJoinRunIdAndSeq() {
        assertEquals("run-1_event_7", EventIds.format("run-1", 7));
    }

    @Test
    void parseSeq_shouldReadSuffixAfterLastSeparator() {
        assertEquals(OptionalLong.of(42), EventIds.parseSeq("run_123_event_42"));
        assertEquals(OptionalLong.of(0), EventIds.parseSeq("simple_event_0"));
        assertEquals(OptionalLong.of(999), EventIds.parseSeq("run_event_999"));
        assertEquals(OptionalLong.of(3), EventIds.parseSeq("a_event_b_event_3"));
    }

    @Test
    void parseSeq_shouldRejectMalformedIds() {
        assertTrue(EventIds.parseSeq(null).isEmpty());
        assertTrue(EventIds.parseSeq("broken_format").isEmpty());
        assertTrue(EventIds.parseSeq("run_event_").isEmpty());
        assertTrue(EventIds.parseSeq("run_event_abc").isEmpty());
        assertTrue(EventIds.parseSeq("run_event_-4").isEmpty());
    }

    @Test
    void parseSeqOrDefault_shouldFallBack() {
        assertEquals(0, EventIds.parseSeqOrDefault("broken_format", 0));
        assertEquals(-1, EventIds.parseSeqOrDefault("run_event_", -1));
        assertEquals(5, EventIds.parseSeqOrDefault("r_event_5", -1));
    }
}
