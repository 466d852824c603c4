package org.nostrkit.nostr.subscription;

/**
 * Immutable copy of one relay's validation counters.
 */
public final class ValidationStatsSnapshot {

    private final long validCount;
    private final long invalidCount;
    private final long skippedCount;

    public ValidationStatsSnapshot(long validCount, long invalidCount, long skippedCount) {
        this.validCount = validCount;
        this.invalidCount = invalidCount;
        this.skippedCount = skippedCount;
    }

    public long getValidCount() { return validCount; }
    public long getInvalidCount() { return invalidCount; }

    /** Events accepted without verification. */
    public long getSkippedCount() { return skippedCount; }

    /** Verifications performed. */
    public long getTotalCount() {
        return validCount + invalidCount;
    }

    /** Share of verified events that were valid; 0 when nothing was verified. */
    public double getTrustRatio() {
        long total = getTotalCount();
        return total == 0 ? 0.0 : (double) validCount / total;
    }

    /** Probability that the next event from this relay is verified. */
    public double getValidationProbability() {
        return ValidationRatioTracker.validationProbability(validCount, invalidCount);
    }

    @Override
    public String toString() {
        return "ValidationStatsSnapshot{" +
                "valid=" + validCount +
                ", invalid=" + invalidCount +
                ", skipped=" + skippedCount +
                '}';
    }
}
