package org.nostrkit.nostr.protocol;

import org.junit.Test;
import org.nostrkit.nostr.subscription.TestEvents;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for serializing client-to-relay messages.
 */
public class ClientMessageTest {

    @Test
    public void testReqWithSeveralFilters() {
        Filter notes = Filter.builder().kinds(1).limit(10).build();
        Filter reactions = Filter.builder().kinds(7).eTags("e1").build();

        String json = ClientMessage.req("sub-1", Arrays.asList(notes, reactions)).toJson();

        assertEquals("[\"REQ\",\"sub-1\",{\"kinds\":[1],\"limit\":10},{\"kinds\":[7],\"#e\":[\"e1\"]}]", json);
    }

    @Test
    public void testClose() {
        assertEquals("[\"CLOSE\",\"sub-1\"]", ClientMessage.close("sub-1").toJson());
    }

    @Test
    public void testEventMessage() {
        ClientMessage message = ClientMessage.event(TestEvents.note("e1", 5));
        String json = message.toJson();

        assertEquals(ClientMessage.Type.EVENT, message.getType());
        assertTrue(json.startsWith("[\"EVENT\",{"));
        assertTrue(json.contains("\"id\":\"e1\""));
    }

    @Test
    public void testCount() {
        String json = ClientMessage.count("c-1", Collections.singletonList(Filter.builder().kinds(3).build())).toJson();

        assertEquals("[\"COUNT\",\"c-1\",{\"kinds\":[3]}]", json);
    }
}
