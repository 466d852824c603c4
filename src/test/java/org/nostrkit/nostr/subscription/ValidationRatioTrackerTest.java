package org.nostrkit.nostr.subscription;

import org.junit.Test;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * Tests for trust-based validation sampling. Sampling is random, so rates are
 * checked over many trials.
 */
public class ValidationRatioTrackerTest {

    private static final String RELAY = "wss://relay.example.com";
    private static final int TRIALS = 10_000;

    @Test
    public void testUnknownRelayAlwaysValidated() {
        ValidationRatioTracker tracker = new ValidationRatioTracker(new Random(1));

        for (int i = 0; i < 1000; i++) {
            assertTrue(tracker.shouldValidate(RELAY));
        }
        assertNull(tracker.getTrustRatio(RELAY));
    }

    @Test
    public void testBelowThresholdAlwaysValidated() {
        ValidationRatioTracker tracker = new ValidationRatioTracker(new Random(1));
        record(tracker, 99, 0);

        for (int i = 0; i < 1000; i++) {
            assertTrue(tracker.shouldValidate(RELAY));
        }
    }

    @Test
    public void testFullyTrustedRelayValidatedTenPercent() {
        ValidationRatioTracker tracker = new ValidationRatioTracker(new Random(42));
        record(tracker, 1000, 0);

        double rate = sampleRate(tracker);

        assertEquals(0.10, rate, 0.02);
        assertEquals(1.0, tracker.getTrustRatio(RELAY), 1e-9);
    }

    @Test
    public void testHalfValidRelayValidatedFiftyFivePercent() {
        ValidationRatioTracker tracker = new ValidationRatioTracker(new Random(42));
        record(tracker, 500, 500);

        double rate = sampleRate(tracker);

        assertEquals(0.55, rate, 0.02);
        assertEquals(0.55, tracker.getStats(RELAY).getValidationProbability(), 1e-9);
    }

    @Test
    public void testProbabilityNeverDropsBelowFloor() {
        assertEquals(0.1, ValidationRatioTracker.validationProbability(1_000_000, 0), 1e-9);
        assertEquals(1.0, ValidationRatioTracker.validationProbability(0, 1_000), 1e-9);
        assertEquals(1.0, ValidationRatioTracker.validationProbability(50, 0), 1e-9);
    }

    @Test
    public void testStatsAndReset() {
        ValidationRatioTracker tracker = new ValidationRatioTracker();
        record(tracker, 3, 1);
        tracker.recordSkipped(RELAY);
        tracker.recordValidation("wss://other", true);

        ValidationStatsSnapshot stats = tracker.getStats(RELAY);
        assertEquals(3, stats.getValidCount());
        assertEquals(1, stats.getInvalidCount());
        assertEquals(1, stats.getSkippedCount());
        assertEquals(4, stats.getTotalCount());
        assertEquals(0.75, stats.getTrustRatio(), 1e-9);

        tracker.resetRelay(RELAY);
        assertNull(tracker.getStats(RELAY));
        assertNotNull(tracker.getStats("wss://other"));

        tracker.reset();
        assertNull(tracker.getStats("wss://other"));
    }

    @Test
    public void testConcurrentRecordingLosesNoUpdates() throws Exception {
        ValidationRatioTracker tracker = new ValidationRatioTracker();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int thread = 0; thread < 8; thread++) {
            boolean valid = thread % 2 == 0;
            executor.execute(() -> {
                for (int i = 0; i < 1000; i++) {
                    tracker.recordValidation(RELAY, valid);
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        ValidationStatsSnapshot stats = tracker.getStats(RELAY);
        assertEquals(4000, stats.getValidCount());
        assertEquals(4000, stats.getInvalidCount());
    }

    private static void record(ValidationRatioTracker tracker, int valid, int invalid) {
        for (int i = 0; i < valid; i++) {
            tracker.recordValidation(RELAY, true);
        }
        for (int i = 0; i < invalid; i++) {
            tracker.recordValidation(RELAY, false);
        }
    }

    private static double sampleRate(ValidationRatioTracker tracker) {
        int validated = 0;
        for (int i = 0; i < TRIALS; i++) {
            if (tracker.shouldValidate(RELAY)) {
                validated++;
            }
        }
        return (double) validated / TRIALS;
    }
}
