package org.nostrkit.nostr.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.nostrkit.nostr.subscription.TestEvents;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for Event construction and derived properties.
 */
public class EventTest {

    @Test
    public void testRegularEventDeduplicatesById() {
        Event first = TestEvents.note("e1", 100);
        Event second = TestEvents.note("e2", 100);

        assertEquals("e1", first.getDeduplicationKey());
        assertEquals(first.getDeduplicationKey(), TestEvents.note("e1", 100).getDeduplicationKey());
        assertNotEquals(first.getDeduplicationKey(), second.getDeduplicationKey());
    }

    @Test
    public void testReplaceableEventDeduplicatesByKindAndAuthor() {
        Event older = TestEvents.event("p1", TestEvents.ALICE, EventKinds.PROFILE, 100);
        Event newer = TestEvents.event("p2", TestEvents.ALICE, EventKinds.PROFILE, 200);
        Event otherAuthor = TestEvents.event("p3", TestEvents.BOB, EventKinds.PROFILE, 200);

        assertTrue(older.isReplaceable());
        assertEquals("0:" + TestEvents.ALICE, older.getDeduplicationKey());
        assertEquals(older.getDeduplicationKey(), newer.getDeduplicationKey());
        assertNotEquals(older.getDeduplicationKey(), otherAuthor.getDeduplicationKey());
    }

    @Test
    public void testParameterizedReplaceableEventIncludesDTag() {
        Event post = TestEvents.event("l1", TestEvents.ALICE, EventKinds.LONG_FORM, 100, "d", "my-post");
        Event untagged = TestEvents.event("l2", TestEvents.ALICE, EventKinds.LONG_FORM, 100);

        assertTrue(post.isParameterizedReplaceable());
        assertEquals("30023:" + TestEvents.ALICE + ":my-post", post.getDeduplicationKey());
        assertEquals("30023:" + TestEvents.ALICE + ":", untagged.getDeduplicationKey());
    }

    @Test
    public void testEphemeralKinds() {
        assertTrue(TestEvents.event("x", TestEvents.ALICE, EventKinds.CLIENT_AUTH, 1).isEphemeral());
        assertFalse(TestEvents.note("y", 1).isEphemeral());
        assertTrue(EventKinds.isReplaceable(EventKinds.RELAY_LIST));
        assertTrue(EventKinds.isReplaceable(EventKinds.CONTACTS));
        assertFalse(EventKinds.isReplaceable(EventKinds.TEXT_NOTE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingIdRejected() {
        new Event("", TestEvents.ALICE, 1, 1, null, "", null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyTagRejected() {
        new Event("e1", TestEvents.ALICE, 1, 1,
                Collections.singletonList(Collections.<String>emptyList()), "", null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullTagElementRejected() {
        new Event("e1", TestEvents.ALICE, 1, 1,
                Collections.singletonList(Arrays.asList("p", null)), "", null);
    }

    @Test
    public void testTagAccessors() {
        Event event = TestEvents.event("e1", TestEvents.ALICE, 1, 1, "p", "one", "p", "two", "t", "x");

        assertEquals("one", event.getTagValue("p"));
        assertEquals(Arrays.asList("one", "two"), event.getTagValues("p"));
        assertTrue(event.hasTag("t"));
        assertFalse(event.hasTag("e"));
        assertNull(event.getTagValue("e"));
    }

    @Test
    public void testJsonUsesWireFieldNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Event event = TestEvents.event("e1", TestEvents.ALICE, 1, 1234, "t", "nostr");

        String json = mapper.writeValueAsString(event);
        Event parsed = mapper.readValue(json, Event.class);

        assertTrue(json.contains("\"created_at\":1234"));
        assertFalse(json.contains("deduplicationKey"));
        assertFalse(json.contains("ephemeral"));
        assertEquals(event, parsed);
        assertEquals(event.getTags(), parsed.getTags());
    }
}
