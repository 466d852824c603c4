package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.protocol.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unsigned events for tests that run without signature verification.
 */
public final class TestEvents {

    public static final String ALICE = "a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1a1";
    public static final String BOB = "b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0b0";

    public static Event note(String id, long createdAt) {
        return event(id, ALICE, 1, createdAt);
    }

    /**
     * @param tags Flat name/value pairs, e.g. "t", "nostr", "p", "abc"
     */
    public static Event event(String id, String pubkey, int kind, long createdAt, String... tags) {
        List<List<String>> tagList = new ArrayList<>();
        for (int i = 0; i + 1 < tags.length; i += 2) {
            tagList.add(Arrays.asList(tags[i], tags[i + 1]));
        }
        return new Event(id, pubkey, createdAt, kind, tagList, "content of " + id, null);
    }

    private TestEvents() {
    }
}
