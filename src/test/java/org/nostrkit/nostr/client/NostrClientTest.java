package org.nostrkit.nostr.client;

import okhttp3.OkHttpClient;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.nostrkit.nostr.cache.InMemoryCacheAdapter;
import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.RelayConnectionListener;
import org.nostrkit.nostr.subscription.ExecutorScheduler;
import org.nostrkit.nostr.subscription.ManualScheduler;
import org.nostrkit.nostr.subscription.NostrEventListener;
import org.nostrkit.nostr.subscription.RecordingRelay;
import org.nostrkit.nostr.subscription.Subscription;
import org.nostrkit.nostr.subscription.SubscriptionGrouper;
import org.nostrkit.nostr.subscription.SubscriptionManager;
import org.nostrkit.nostr.subscription.TestEvents;
import org.nostrkit.nostr.subscription.ValidationRatioTracker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * Unit tests for NostrClient configuration, subscribe, fetch and publish paths.
 */
public class NostrClientTest {

    private ManualScheduler groupingScheduler;
    private SubscriptionManager manager;
    private NostrClient client;
    private RecordingRelay relay;

    @Before
    public void setUp() {
        groupingScheduler = new ManualScheduler();
        manager = new SubscriptionManager(new SubscriptionGrouper(groupingScheduler), new ValidationRatioTracker(),
                null, null, Runnable::run, 1000, 100);
        client = new NostrClient(new OkHttpClient(), new ExecutorScheduler(), manager);
        relay = new RecordingRelay("wss://relay.example.com");
    }

    @After
    public void tearDown() {
        client.disconnect();
    }

    @Test
    public void testClientCreation() {
        NostrClient standalone = new NostrClient(new InMemoryCacheAdapter());
        try {
            assertNotNull(standalone.getSubscriptionManager());
            assertNotNull(standalone.getSubscriptionManager().getCacheAdapter());
            assertFalse(standalone.isConnected());
        } finally {
            standalone.disconnect();
        }
    }

    @Test
    public void testDefaults() {
        assertEquals(5000, client.getQueryTimeoutMs());
        assertTrue(client.isGroupingEnabled());
        assertFalse(client.isConnected());
        assertSame(manager, client.getSubscriptionManager());
    }

    @Test
    public void testSetters() {
        client.setQueryTimeoutMs(15000);
        client.setGroupingEnabled(false);

        // Should not throw
        client.setAutoReconnect(false);
        client.setReconnectIntervalMs(2000);
        client.setMaxReconnectIntervalMs(60000);

        assertEquals(15000, client.getQueryTimeoutMs());
        assertFalse(client.isGroupingEnabled());
    }

    @Test
    public void testAddAndRemoveConnectionListener() {
        RelayConnectionListener listener = new RelayConnectionListener() {
        };

        // Should not throw
        client.addConnectionListener(listener);
        client.removeConnectionListener(listener);
    }

    @Test
    public void testAddedRelayCountsAsConnected() {
        client.addRelay(relay);

        assertTrue(client.isConnected());
        assertEquals(Collections.singleton(relay.getUrl()), client.getConnectedRelays());
    }

    @Test
    public void testDirectSubscribeSendsRequest() {
        client.addRelay(relay);
        client.setGroupingEnabled(false);

        Subscription subscription = client.subscribe(Filter.builder().kinds(1).build());

        assertEquals(1, relay.subscribeCount(subscription.getId()));
    }

    @Test
    public void testGroupedSubscribeWaitsForWindow() {
        client.addRelay(relay);
        List<Event> heard = new ArrayList<>();

        Subscription subscription = client.subscribe(
                Collections.singletonList(Filter.builder().kinds(1).build()), heard::add);
        assertTrue(relay.getSubscribeIds().isEmpty());

        groupingScheduler.advance(SubscriptionGrouper.DEFAULT_GROUPING_DELAY_MS);
        assertEquals(1, relay.subscribeCount(subscription.getId()));

        manager.dispatchEvent(TestEvents.note("e1", 1), relay, subscription.getId());
        assertEquals(1, heard.size());
    }

    @Test
    public void testListenerGetsEndOfStoredEvents() {
        client.addRelay(relay);
        client.setGroupingEnabled(false);
        List<String> eose = new ArrayList<>();

        Subscription subscription = client.subscribe(Collections.singletonList(Filter.builder().kinds(1).build()),
                new NostrEventListener() {
                    @Override
                    public void onEvent(Event event) {
                    }

                    @Override
                    public void onEndOfStoredEvents(String subscriptionId) {
                        eose.add(subscriptionId);
                    }
                });
        manager.dispatchEose(relay, subscription.getId());

        assertEquals(Collections.singletonList(subscription.getId()), eose);
    }

    @Test
    public void testUnsubscribeClosesOnRelay() {
        client.addRelay(relay);
        client.setGroupingEnabled(false);
        Subscription subscription = client.subscribe(Filter.builder().kinds(1).build());

        client.unsubscribe(subscription.getId());

        assertEquals(1, relay.unsubscribeCount(subscription.getId()));
        assertNull(manager.getSubscription(subscription.getId()));
    }

    @Test
    public void testFetchWithoutRelaysResolvesNull() throws Exception {
        assertNull(client.fetchEvent(Filter.builder().kinds(0).build()).get(1, TimeUnit.SECONDS));
    }

    @Test
    public void testFetchResolvesWithDeliveredEvent() throws Exception {
        client.addRelay(relay);

        CompletableFuture<Event> future = client.fetchEvent(Filter.builder().ids("e1").build());
        String subscriptionId = relay.getSubscribeIds().get(0);
        manager.dispatchEvent(TestEvents.note("e1", 1), relay, subscriptionId);

        assertEquals("e1", future.get(1, TimeUnit.SECONDS).getId());
        assertEquals(1, relay.unsubscribeCount(subscriptionId));
    }

    @Test
    public void testFetchTimesOutWithNull() throws Exception {
        client.addRelay(relay);
        client.setQueryTimeoutMs(50);

        CompletableFuture<Event> future = client.fetchEvent(Filter.builder().ids("missing").build());

        assertNull(future.get(5, TimeUnit.SECONDS));
        assertEquals(1, relay.unsubscribeCount(relay.getSubscribeIds().get(0)));
    }

    @Test
    public void testPublishWithoutRelaysFails() {
        CompletableFuture<String> future = client.publishEvent(TestEvents.note("e1", 1));

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    public void testPublishSucceedsIfAnyRelayAccepts() throws Exception {
        RecordingRelay rejecting = new RecordingRelay("wss://strict.example.com");
        rejecting.setAcceptPublishes(false);
        client.addRelay(rejecting);
        client.addRelay(relay);

        assertEquals("e1", client.publishEvent(TestEvents.note("e1", 1)).get(1, TimeUnit.SECONDS));
        assertEquals(1, rejecting.getPublished().size());
        assertEquals(1, relay.getPublished().size());
    }

    @Test
    public void testPublishFailsIfAllRelaysReject() throws Exception {
        relay.setAcceptPublishes(false);
        client.addRelay(relay);

        try {
            client.publishEvent(TestEvents.note("e1", 1)).get(1, TimeUnit.SECONDS);
            fail("Expected publish failure");
        } catch (ExecutionException e) {
            assertTrue(e.getCause().getMessage().contains("blocked"));
        }
    }

    @Test
    public void testDisconnectStopsSubscriptions() {
        client.addRelay(relay);
        client.setGroupingEnabled(false);
        Subscription subscription = client.subscribe(Filter.builder().kinds(1).build());

        client.disconnect();

        assertTrue(subscription.isStopped());
        assertFalse(client.isConnected());
    }
}
