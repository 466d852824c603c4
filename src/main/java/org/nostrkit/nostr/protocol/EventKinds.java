package org.nostrkit.nostr.protocol;

/**
 * Nostr event kinds and kind ranges as defined in NIP-01 and related NIPs.
 * See: https://github.com/nostr-protocol/nips
 */
public final class EventKinds {

    /** NIP-01: Metadata (profile information) */
    public static final int PROFILE = 0;

    /** NIP-01: Text note */
    public static final int TEXT_NOTE = 1;

    /** NIP-02: Contact list */
    public static final int CONTACTS = 3;

    /** NIP-09: Event deletion */
    public static final int DELETION = 5;

    /** NIP-18: Repost */
    public static final int REPOST = 6;

    /** NIP-25: Reactions */
    public static final int REACTION = 7;

    /** NIP-65: Relay list metadata */
    public static final int RELAY_LIST = 10002;

    /** NIP-42: Client authentication (ephemeral) */
    public static final int CLIENT_AUTH = 22242;

    /** NIP-23: Long-form content (parameterized replaceable) */
    public static final int LONG_FORM = 30023;

    /** NIP-78: Application-specific data (parameterized replaceable) */
    public static final int APP_DATA = 30078;

    // Ranges

    /** Replaceable events: only the most recent event per kind+author is kept */
    public static boolean isReplaceable(int kind) {
        return kind == PROFILE || kind == CONTACTS || (kind >= 10000 && kind < 20000);
    }

    /** Ephemeral events: not stored by relays */
    public static boolean isEphemeral(int kind) {
        return kind >= 20000 && kind < 30000;
    }

    /** Parameterized replaceable events: replaceable per kind+author+"d" tag */
    public static boolean isParameterizedReplaceable(int kind) {
        return kind >= 30000 && kind < 40000;
    }

    /**
     * Get human-readable name for event kind.
     */
    public static String getName(int kind) {
        switch (kind) {
            case PROFILE: return "Profile";
            case TEXT_NOTE: return "Text Note";
            case CONTACTS: return "Contacts";
            case DELETION: return "Deletion";
            case REPOST: return "Repost";
            case REACTION: return "Reaction";
            case RELAY_LIST: return "Relay List";
            case CLIENT_AUTH: return "Client Auth";
            case LONG_FORM: return "Long-form Content";
            case APP_DATA: return "App Data";
            default: return "Unknown (" + kind + ")";
        }
    }

    private EventKinds() {
        // Utility class, no instantiation
    }
}
