package org.nostrkit.nostr.subscription;

import org.junit.Before;
import org.junit.Test;
import org.nostrkit.nostr.cache.InMemoryCacheAdapter;
import org.nostrkit.nostr.crypto.EventSigner;
import org.nostrkit.nostr.crypto.EventVerifier;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for event routing: deduplication, sampled verification, cache
 * writes, the global stream and EOSE/CLOSED delivery.
 */
public class SubscriptionManagerTest {

    private ManualScheduler scheduler;
    private SubscriptionManager manager;
    private RecordingRelay relay1;
    private RecordingRelay relay2;

    @Before
    public void setUp() {
        scheduler = new ManualScheduler();
        manager = newManager(null, null, 100);
        relay1 = new RecordingRelay("wss://relay1.example.com");
        relay2 = new RecordingRelay("wss://relay2.example.com");
    }

    private SubscriptionManager newManager(EventVerifier verifier, InMemoryCacheAdapter cache, int globalBuffer) {
        return new SubscriptionManager(new SubscriptionGrouper(scheduler), new ValidationRatioTracker(),
                verifier, cache, Runnable::run, 1000, globalBuffer);
    }

    private Subscription startDirect(SubscriptionManager target, Filter filter) {
        Subscription subscription = target.subscribe(filter);
        subscription.start(Arrays.asList(relay1, relay2));
        return subscription;
    }

    @Test
    public void testSameEventFromTwoRelaysDeliveredOnce() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(1).build());
        Event event = TestEvents.note("e1", 100);

        assertTrue(manager.dispatchEvent(event, relay1, subscription.getId()));
        assertFalse(manager.dispatchEvent(event, relay2, subscription.getId()));

        assertEquals(1, subscription.getEvents().getReplayCache().size());
        assertTrue(manager.getDeduplicationIndex().contains("e1"));
    }

    @Test
    public void testReplaceableEventsFirstSeenWins() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(0).build());
        Event older = TestEvents.event("p1", TestEvents.ALICE, 0, 10);
        Event newer = TestEvents.event("p2", TestEvents.ALICE, 0, 20);

        assertTrue(manager.dispatchEvent(older, relay1, subscription.getId()));
        assertFalse(manager.dispatchEvent(newer, relay2, subscription.getId()));

        List<Event> delivered = subscription.getEvents().getReplayCache();
        assertEquals(1, delivered.size());
        assertEquals("p1", delivered.get(0).getId());
    }

    @Test
    public void testParameterizedReplaceableKeyedByDTag() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(30023).build());

        assertTrue(manager.dispatchEvent(
                TestEvents.event("a1", TestEvents.ALICE, 30023, 10, "d", "first"), relay1, subscription.getId()));
        assertTrue(manager.dispatchEvent(
                TestEvents.event("a2", TestEvents.ALICE, 30023, 10, "d", "second"), relay1, subscription.getId()));
        assertFalse(manager.dispatchEvent(
                TestEvents.event("a3", TestEvents.ALICE, 30023, 20, "d", "first"), relay2, subscription.getId()));
    }

    @Test
    public void testEventFansOutToEveryMatchingSubscription() {
        Subscription notes = startDirect(manager, Filter.builder().kinds(1).build());
        Subscription alice = startDirect(manager, Filter.builder().authors(TestEvents.ALICE).build());
        Subscription bob = startDirect(manager, Filter.builder().authors(TestEvents.BOB).build());

        manager.dispatchEvent(TestEvents.note("e1", 1), relay1, notes.getId());

        assertEquals(1, notes.getEvents().getReplayCache().size());
        assertEquals(1, alice.getEvents().getReplayCache().size());
        assertTrue(bob.getEvents().getReplayCache().isEmpty());
    }

    @Test
    public void testGroupedMembersNotDeliveredTwice() {
        Subscription first = manager.subscribe(Filter.builder().kinds(1).build());
        Subscription second = manager.subscribe(Filter.builder().kinds(1).build());
        manager.enqueueForGrouping(first, Collections.singletonList(relay1));
        manager.enqueueForGrouping(second, Collections.singletonList(relay1));
        scheduler.advance(SubscriptionGrouper.DEFAULT_GROUPING_DELAY_MS);
        String groupId = first.getGroup().getRelaySubscriptionId();

        List<Event> heard = new ArrayList<>();
        first.addListener(heard::add);
        manager.dispatchEvent(TestEvents.note("e1", 1), relay1, groupId);

        assertEquals(1, heard.size());
        assertEquals(1, second.getEvents().getReplayCache().size());
    }

    @Test
    public void testGroupedMemberIgnoresEventsOnOtherIds() {
        Subscription first = manager.subscribe(Filter.builder().kinds(1).build());
        Subscription second = manager.subscribe(Filter.builder().kinds(1).build());
        manager.enqueueForGrouping(first, Collections.singletonList(relay1));
        manager.enqueueForGrouping(second, Collections.singletonList(relay1));
        scheduler.advance(SubscriptionGrouper.DEFAULT_GROUPING_DELAY_MS);
        Subscription direct = startDirect(manager, Filter.builder().kinds(1).build());

        manager.dispatchEvent(TestEvents.note("e1", 1), relay1, direct.getId());

        assertEquals(1, direct.getEvents().getReplayCache().size());
        assertTrue(first.getEvents().getReplayCache().isEmpty());
        assertTrue(second.getEvents().getReplayCache().isEmpty());
    }

    @Test
    public void testAcceptedEventsAreCached() {
        InMemoryCacheAdapter cache = new InMemoryCacheAdapter();
        SubscriptionManager cached = newManager(null, cache, 100);
        Subscription subscription = startDirect(cached, Filter.builder().kinds(1).build());

        cached.dispatchEvent(TestEvents.note("e1", 1), relay1, subscription.getId());

        assertNotNull(cache.getEvent("e1"));
        assertSame(cache, cached.getCacheAdapter());
    }

    @Test
    public void testCacheFailureDoesNotStopDelivery() {
        InMemoryCacheAdapter failing = new InMemoryCacheAdapter() {
            @Override
            public void store(Event event) {
                throw new IllegalStateException("disk full");
            }
        };
        SubscriptionManager cached = newManager(null, failing, 100);
        Subscription subscription = startDirect(cached, Filter.builder().kinds(1).build());

        assertTrue(cached.dispatchEvent(TestEvents.note("e1", 1), relay1, subscription.getId()));
        assertEquals(1, subscription.getEvents().getReplayCache().size());
    }

    @Test
    public void testGlobalStreamCarriesRelayAndDropsNewestWhenFull() {
        SubscriptionManager small = newManager(null, null, 2);
        EventStream<RelayEvent>.Cursor cursor = small.getAllEvents().open();

        small.dispatchEvent(TestEvents.note("e1", 1), relay1, "sub-x");
        small.dispatchEvent(TestEvents.note("e2", 2), relay2, "sub-x");
        small.dispatchEvent(TestEvents.note("e3", 3), relay1, "sub-x");

        assertEquals(EventStream.OverflowPolicy.DROP_NEWEST, small.getAllEvents().getOverflowPolicy());
        RelayEvent first = cursor.poll();
        assertEquals("e1", first.getEvent().getId());
        assertEquals(relay1, first.getRelay());
        assertEquals("e2", cursor.poll().getEvent().getId());
        assertNull(cursor.poll());
        assertEquals(1, small.getAllEvents().getDroppedCount());
    }

    @Test
    public void testTamperedEventDroppedWithoutMarkingSeen() {
        SubscriptionManager verifying = newManager(new EventVerifier(), null, 100);
        Subscription subscription = startDirect(verifying, Filter.builder().kinds(1).build());
        EventSigner signer = EventSigner.generate();
        Event genuine = signer.sign(1, null, "hello", 1700000000L);
        Event tampered = new Event(genuine.getId(), genuine.getPubkey(), genuine.getCreatedAt(),
                genuine.getKind(), genuine.getTags(), "goodbye", genuine.getSig());

        assertFalse(verifying.dispatchEvent(tampered, relay1, subscription.getId()));
        assertFalse(verifying.getDeduplicationIndex().contains(genuine.getId()));

        assertTrue(verifying.dispatchEvent(genuine, relay2, subscription.getId()));
        assertEquals("hello", subscription.getEvents().getReplayCache().get(0).getContent());

        ValidationStatsSnapshot stats = verifying.getValidationTracker().getStats(relay1.getUrl());
        assertEquals(1, stats.getInvalidCount());
        assertEquals(1, verifying.getValidationTracker().getStats(relay2.getUrl()).getValidCount());
    }

    @Test
    public void testEoseRoutedToSubscription() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(1).build());

        manager.dispatchEose(relay1, subscription.getId());
        assertFalse(subscription.isEoseComplete());
        manager.dispatchEose(relay2, subscription.getId());

        assertTrue(subscription.isEoseComplete());
    }

    @Test
    public void testClosedRoutedToSubscription() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(1).build());
        List<String> errors = new ArrayList<>();
        subscription.addListener(new NostrEventListener() {
            @Override
            public void onEvent(Event event) {
            }

            @Override
            public void onError(String subscriptionId, String error) {
                errors.add(subscriptionId + ": " + error);
            }
        });

        manager.dispatchClosed(relay1, subscription.getId(), "rate-limited");

        assertEquals(Collections.singletonList(subscription.getId() + ": rate-limited"), errors);
    }

    @Test
    public void testUnknownIdsAreIgnored() {
        manager.dispatchEose(relay1, "sub-unknown");
        manager.dispatchClosed(relay1, "sub-unknown", "error: gone");
        manager.unsubscribe("sub-unknown");

        assertTrue(manager.getSubscriptions().isEmpty());
    }

    @Test
    public void testUnsubscribeRemovesSubscription() {
        Subscription subscription = startDirect(manager, Filter.builder().kinds(1).build());

        manager.unsubscribe(subscription.getId());

        assertNull(manager.getSubscription(subscription.getId()));
        assertTrue(subscription.isStopped());
        assertEquals(1, relay1.unsubscribeCount(subscription.getId()));

        assertTrue(manager.dispatchEvent(TestEvents.note("e1", 1), relay1, subscription.getId()));
        assertTrue(subscription.getEvents().getReplayCache().isEmpty());
    }

    @Test
    public void testSubscriptionIdsAreUnique() {
        Subscription a = manager.subscribe(Filter.builder().kinds(1).build());
        Subscription b = manager.subscribe(Filter.builder().kinds(1).build());

        assertNotEquals(a.getId(), b.getId());
        assertTrue(a.getId().startsWith("sub-"));
    }

    @Test
    public void testBufferSettingsApplyToNewSubscriptions() {
        manager.setReplaySize(3);
        Subscription subscription = manager.subscribe(Filter.builder().kinds(1).build());

        assertEquals(3, subscription.getEvents().getReplayCapacity());
    }

    @Test
    public void testManagerUsesCallerOwnedGrouper() {
        SubscriptionGrouper grouper = new SubscriptionGrouper(scheduler);
        SubscriptionManager withDefaults = new SubscriptionManager(grouper, null, Runnable::run);
        Subscription subscription = withDefaults.subscribe(Filter.builder().kinds(1).build());

        withDefaults.enqueueForGrouping(subscription, Collections.singletonList(relay1));
        scheduler.advance(SubscriptionGrouper.DEFAULT_GROUPING_DELAY_MS);

        assertSame(grouper, withDefaults.getGrouper());
        assertEquals(1, relay1.subscribeCount(subscription.getId()));
    }
}
