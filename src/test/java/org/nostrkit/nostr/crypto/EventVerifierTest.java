package org.nostrkit.nostr.crypto;

import org.junit.Test;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.EventKinds;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for event id and signature verification.
 */
public class EventVerifierTest {

    private final EventVerifier verifier = new EventVerifier();

    @Test
    public void testSignedEventVerifies() {
        EventSigner signer = EventSigner.generate();
        Event event = signer.sign(EventKinds.TEXT_NOTE,
                Collections.singletonList(Arrays.asList("t", "nostr")), "hello nostr");

        assertEquals(signer.getPublicKeyHex(), event.getPubkey());
        assertEquals(64, event.getId().length());
        assertEquals(128, event.getSig().length());
        assertTrue(verifier.isIdValid(event));
        assertTrue(verifier.isSignatureValid(event));
        assertTrue(verifier.verify(event));
    }

    @Test
    public void testTamperedContentFailsIdCheck() {
        Event event = EventSigner.generate().sign(EventKinds.TEXT_NOTE, null, "original", 1000);
        Event tampered = new Event(event.getId(), event.getPubkey(), event.getCreatedAt(), event.getKind(),
                event.getTags(), "changed", event.getSig());

        assertFalse(verifier.isIdValid(tampered));
        assertFalse(verifier.verify(tampered));
    }

    @Test
    public void testSignatureFromAnotherKeyFails() {
        Event event = EventSigner.generate().sign(EventKinds.TEXT_NOTE, null, "hi", 1000);
        Event forged = new Event(event.getId(), EventSigner.generate().getPublicKeyHex(), event.getCreatedAt(),
                event.getKind(), event.getTags(), event.getContent(), event.getSig());

        assertFalse(verifier.isSignatureValid(forged));
    }

    @Test
    public void testUnsignedOrNonHexEventsFail() {
        Event event = EventSigner.generate().sign(EventKinds.TEXT_NOTE, null, "hi", 1000);
        Event unsigned = new Event(event.getId(), event.getPubkey(), event.getCreatedAt(), event.getKind(),
                event.getTags(), event.getContent(), null);
        Event garbage = new Event(event.getId(), event.getPubkey(), event.getCreatedAt(), event.getKind(),
                event.getTags(), event.getContent(), "zz");

        assertFalse(verifier.verify(unsigned));
        assertFalse(verifier.verify(garbage));
    }

    @Test
    public void testCalculateIdIsStable() {
        List<List<String>> tags = Collections.singletonList(Arrays.asList("p", "abc"));
        String first = EventVerifier.calculateId("pub", 10, 1, tags, "x");
        String second = EventVerifier.calculateId("pub", 10, 1, tags, "x");

        assertEquals(first, second);
        assertNotEquals(first, EventVerifier.calculateId("pub", 11, 1, tags, "x"));
    }

    @Test
    public void testSignerFromHexKey() {
        EventSigner signer = EventSigner.fromPrivateKeyHex(
                "0000000000000000000000000000000000000000000000000000000000000003");

        assertEquals("f9308a019258c31049344f85f89d5229b531c845836f99b08601f113bce036f9", signer.getPublicKeyHex());
    }
}
