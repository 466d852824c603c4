package org.nostrkit.nostr.crypto;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.nostrkit.nostr.protocol.Event;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Holds a private key and produces signed events.
 */
public class EventSigner {

    private final byte[] privateKey;
    private final String publicKeyHex;

    private EventSigner(byte[] privateKey) {
        if (privateKey.length != 32) {
            throw new IllegalArgumentException("Private key must be 32 bytes");
        }
        this.privateKey = Arrays.copyOf(privateKey, 32);
        this.publicKeyHex = new String(Hex.encodeHex(SchnorrSigner.getPublicKey(this.privateKey)));
    }

    public static EventSigner fromPrivateKey(byte[] privateKey) {
        return new EventSigner(privateKey);
    }

    public static EventSigner fromPrivateKeyHex(String privateKeyHex) {
        try {
            return new EventSigner(Hex.decodeHex(privateKeyHex.toCharArray()));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string", e);
        }
    }

    /**
     * Generate a signer with a new random key.
     */
    public static EventSigner generate() {
        byte[] privateKey = new byte[32];
        SecureRandom random = new SecureRandom();
        do {
            random.nextBytes(privateKey);
        } while (!isUsableKey(privateKey));
        return new EventSigner(privateKey);
    }

    private static boolean isUsableKey(byte[] privateKey) {
        try {
            SchnorrSigner.getPublicKey(privateKey);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public String getPublicKeyHex() {
        return publicKeyHex;
    }

    /**
     * Build and sign an event created now.
     */
    public Event sign(int kind, List<List<String>> tags, String content) {
        return sign(kind, tags, content, System.currentTimeMillis() / 1000);
    }

    /**
     * Build and sign an event with an explicit timestamp.
     */
    public Event sign(int kind, List<List<String>> tags, String content, long createdAt) {
        List<List<String>> eventTags = tags != null ? tags : Collections.emptyList();
        String body = content != null ? content : "";
        String id = EventVerifier.calculateId(publicKeyHex, createdAt, kind, eventTags, body);
        try {
            byte[] signature = SchnorrSigner.sign(Hex.decodeHex(id.toCharArray()), privateKey);
            return new Event(id, publicKeyHex, createdAt, kind, eventTags, body,
                    new String(Hex.encodeHex(signature)));
        } catch (DecoderException e) {
            throw new IllegalStateException("Computed event id is not hex: " + id, e);
        }
    }
}
