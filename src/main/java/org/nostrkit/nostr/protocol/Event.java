package org.nostrkit.nostr.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable Nostr event as defined in NIP-01.
 * Events are the fundamental building blocks of the Nostr protocol.
 *
 * <p>Each tag is an ordered list whose first element is the tag name and whose
 * remaining elements are the tag values, e.g. {@code ["e", "<event id>", "<relay url>"]}.
 */
public final class Event {

    /** Event ID (32-byte SHA-256 hash of serialized event data) */
    @JsonProperty("id")
    private final String id;

    /** Public key of event creator (32-byte hex string) */
    @JsonProperty("pubkey")
    private final String pubkey;

    /** Unix timestamp in seconds */
    @JsonProperty("created_at")
    private final long createdAt;

    /** Event kind (determines event type and handling) */
    @JsonProperty("kind")
    private final int kind;

    /** Event tags (list of tag arrays) */
    @JsonProperty("tags")
    private final List<List<String>> tags;

    /** Event content (arbitrary string, often JSON) */
    @JsonProperty("content")
    private final String content;

    /** Schnorr signature (64-byte hex string), null for unsigned events */
    @JsonProperty("sig")
    private final String sig;

    @JsonIgnore
    private final String deduplicationKey;

    /**
     * Full constructor, also used by Jackson for deserialization.
     *
     * @throws IllegalArgumentException if id or pubkey is missing, or a tag is empty
     */
    @JsonCreator
    public Event(@JsonProperty("id") String id,
                 @JsonProperty("pubkey") String pubkey,
                 @JsonProperty("created_at") long createdAt,
                 @JsonProperty("kind") int kind,
                 @JsonProperty("tags") List<List<String>> tags,
                 @JsonProperty("content") String content,
                 @JsonProperty("sig") String sig) {
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Event id is required");
        }
        if (pubkey == null || pubkey.isEmpty()) {
            throw new IllegalArgumentException("Event pubkey is required");
        }
        this.id = id;
        this.pubkey = pubkey;
        this.createdAt = createdAt;
        this.kind = kind;
        this.tags = copyTags(tags);
        this.content = content != null ? content : "";
        this.sig = sig;
        this.deduplicationKey = computeDeduplicationKey();
    }

    private static List<List<String>> copyTags(List<List<String>> tags) {
        if (tags == null) {
            return Collections.emptyList();
        }
        List<List<String>> copy = new ArrayList<>(tags.size());
        for (List<String> tag : tags) {
            if (tag == null || tag.isEmpty()) {
                throw new IllegalArgumentException("Tag array cannot be empty");
            }
            for (String element : tag) {
                if (element == null) {
                    throw new IllegalArgumentException("Tag elements cannot be null: " + tag);
                }
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(tag)));
        }
        return Collections.unmodifiableList(copy);
    }

    // Getters
    public String getId() { return id; }
    public String getPubkey() { return pubkey; }
    public long getCreatedAt() { return createdAt; }
    public int getKind() { return kind; }
    public List<List<String>> getTags() { return tags; }
    public String getContent() { return content; }
    public String getSig() { return sig; }

    @JsonIgnore
    public boolean isEphemeral() {
        return EventKinds.isEphemeral(kind);
    }

    @JsonIgnore
    public boolean isReplaceable() {
        return EventKinds.isReplaceable(kind);
    }

    @JsonIgnore
    public boolean isParameterizedReplaceable() {
        return EventKinds.isParameterizedReplaceable(kind);
    }

    /**
     * Key used to collapse repeated delivery of the same logical event.
     * <ul>
     *   <li>parameterized replaceable: {@code kind:pubkey:d-tag}</li>
     *   <li>replaceable: {@code kind:pubkey}</li>
     *   <li>anything else: the event id</li>
     * </ul>
     */
    @JsonIgnore
    public String getDeduplicationKey() {
        return deduplicationKey;
    }

    private String computeDeduplicationKey() {
        if (isParameterizedReplaceable()) {
            String d = getTagValue("d");
            return kind + ":" + pubkey + ":" + (d != null ? d : "");
        }
        if (isReplaceable()) {
            return kind + ":" + pubkey;
        }
        return id;
    }

    /**
     * Get the value of a tag (e.g., "p", "e", "t").
     * Returns the first occurrence of the tag value.
     */
    public String getTagValue(String tagName) {
        for (List<String> tag : tags) {
            if (tag.get(0).equals(tagName) && tag.size() > 1) {
                return tag.get(1);
            }
        }
        return null;
    }

    /**
     * Get the first value of every tag with the given name.
     */
    public List<String> getTagValues(String tagName) {
        List<String> values = new ArrayList<>();
        for (List<String> tag : tags) {
            if (tag.get(0).equals(tagName) && tag.size() > 1) {
                values.add(tag.get(1));
            }
        }
        return values;
    }

    /**
     * Check if event has a specific tag.
     */
    public boolean hasTag(String tagName) {
        return tags.stream().anyMatch(tag -> tag.get(0).equals(tagName));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return Objects.equals(id, event.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id.substring(0, Math.min(16, id.length())) + "...'" +
                ", pubkey='" + pubkey.substring(0, Math.min(16, pubkey.length())) + "...'" +
                ", kind=" + kind +
                ", createdAt=" + createdAt +
                ", tags=" + tags.size() +
                ", content=" + content.length() + " chars" +
                '}';
    }
}
