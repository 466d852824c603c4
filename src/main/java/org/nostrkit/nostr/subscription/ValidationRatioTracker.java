package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.relay.Relay;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-relay signature validation statistics for trust-based sampling.
 *
 * <p>Relays that keep sending valid events get their events verified less
 * often, but never zero percent of the time:
 * <pre>
 *   trustRatio             = valid / (valid + invalid)
 *   validationProbability  = 1 - trustRatio * MAX_TRUST_REDUCTION
 * </pre>
 * Until a relay has {@link #MIN_EVENTS_BEFORE_TRUST} recorded validations every
 * event is verified. Counters are atomic and only reset through
 * {@link #reset()} or {@link #resetRelay(String)}.
 */
public class ValidationRatioTracker {

    /**
     * Largest reduction of the validation probability. Fully trusted relays
     * are still verified 1 - 0.9 = 10% of the time.
     */
    public static final double MAX_TRUST_REDUCTION = 0.9;

    /** Validations recorded before a relay's trust ratio is used. */
    public static final long MIN_EVENTS_BEFORE_TRUST = 100;

    private final Map<String, RelayValidationStats> relayStats = new ConcurrentHashMap<>();
    private final Random random;

    public ValidationRatioTracker() {
        this(null);
    }

    /**
     * @param random Source for sampling decisions; null uses {@link ThreadLocalRandom}
     */
    public ValidationRatioTracker(Random random) {
        this.random = random;
    }

    public boolean shouldValidate(Relay relay) {
        return shouldValidate(relay.getUrl());
    }

    /**
     * Decide whether the next event from a relay needs signature verification.
     * Non-deterministic once the relay has enough history.
     *
     * @param relayUrl Relay URL
     * @return true to verify, false to accept without verification
     */
    public boolean shouldValidate(String relayUrl) {
        RelayValidationStats stats = statsFor(relayUrl);
        double probability = validationProbability(stats.validCount.get(), stats.invalidCount.get());
        if (probability >= 1.0) {
            return true;
        }
        return nextDouble() < probability;
    }

    public void recordValidation(Relay relay, boolean valid) {
        recordValidation(relay.getUrl(), valid);
    }

    /**
     * Record the outcome of a signature verification.
     *
     * @param relayUrl Relay that sent the event
     * @param valid Whether the signature was valid
     */
    public void recordValidation(String relayUrl, boolean valid) {
        RelayValidationStats stats = statsFor(relayUrl);
        if (valid) {
            stats.validCount.incrementAndGet();
        } else {
            stats.invalidCount.incrementAndGet();
        }
    }

    /**
     * Record an event accepted without verification.
     */
    public void recordSkipped(String relayUrl) {
        statsFor(relayUrl).skippedCount.incrementAndGet();
    }

    /**
     * @return Trust ratio in [0, 1], or null if nothing was recorded for the relay
     */
    public Double getTrustRatio(String relayUrl) {
        ValidationStatsSnapshot snapshot = getStats(relayUrl);
        if (snapshot == null || snapshot.getTotalCount() == 0) {
            return null;
        }
        return snapshot.getTrustRatio();
    }

    /**
     * @return Snapshot of a relay's counters, or null if the relay is unknown
     */
    public ValidationStatsSnapshot getStats(String relayUrl) {
        RelayValidationStats stats = relayStats.get(relayUrl);
        if (stats == null) {
            return null;
        }
        return new ValidationStatsSnapshot(stats.validCount.get(), stats.invalidCount.get(),
                stats.skippedCount.get());
    }

    /**
     * Forget every relay's statistics.
     */
    public void reset() {
        relayStats.clear();
    }

    /**
     * Forget one relay's statistics.
     */
    public void resetRelay(String relayUrl) {
        relayStats.remove(relayUrl);
    }

    static double validationProbability(long valid, long invalid) {
        long total = valid + invalid;
        if (total < MIN_EVENTS_BEFORE_TRUST) {
            return 1.0;
        }
        double trustRatio = (double) valid / total;
        double probability = 1.0 - trustRatio * MAX_TRUST_REDUCTION;
        return Math.max(1.0 - MAX_TRUST_REDUCTION, Math.min(1.0, probability));
    }

    private RelayValidationStats statsFor(String relayUrl) {
        return relayStats.computeIfAbsent(relayUrl, url -> new RelayValidationStats());
    }

    private double nextDouble() {
        return random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }

    private static final class RelayValidationStats {
        final AtomicLong validCount = new AtomicLong();
        final AtomicLong invalidCount = new AtomicLong();
        final AtomicLong skippedCount = new AtomicLong();
    }
}
