package org.nostrkit.nostr.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrkit.nostr.protocol.Event;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Checks that an event's id is the NIP-01 hash of its content and that its
 * signature verifies against the author key.
 */
public class EventVerifier {

    private static final ObjectMapper JSON = new ObjectMapper();

    /**
     * Full check: id matches the serialized event and the signature is valid.
     *
     * @param event Event received from a relay
     * @return true if the event is authentic
     */
    public boolean verify(Event event) {
        return isIdValid(event) && isSignatureValid(event);
    }

    /**
     * Whether the event id equals the SHA-256 of {@code [0, pubkey, created_at, kind, tags, content]}.
     */
    public boolean isIdValid(Event event) {
        return event.getId().equalsIgnoreCase(calculateId(event.getPubkey(), event.getCreatedAt(),
                event.getKind(), event.getTags(), event.getContent()));
    }

    /**
     * Whether the signature verifies for the event id and author key.
     * Unsigned events and undecodable hex fail verification.
     */
    public boolean isSignatureValid(Event event) {
        if (event.getSig() == null) {
            return false;
        }
        try {
            byte[] signature = Hex.decodeHex(event.getSig().toCharArray());
            byte[] id = Hex.decodeHex(event.getId().toCharArray());
            byte[] pubkey = Hex.decodeHex(event.getPubkey().toCharArray());
            return SchnorrSigner.verify(signature, id, pubkey);
        } catch (DecoderException e) {
            return false;
        }
    }

    /**
     * Calculate a NIP-01 event id.
     */
    public static String calculateId(String pubkey, long createdAt, int kind,
                                     List<List<String>> tags, String content) {
        List<Object> eventData = Arrays.asList(0, pubkey, createdAt, kind, tags, content);
        try {
            String serialized = JSON.writeValueAsString(eventData);
            byte[] hash = SchnorrSigner.sha256().digest(serialized.getBytes(StandardCharsets.UTF_8));
            return new String(Hex.encodeHex(hash));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event for hashing", e);
        }
    }
}
