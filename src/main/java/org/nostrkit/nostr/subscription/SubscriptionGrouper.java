package org.nostrkit.nostr.subscription;

import org.nostrkit.nostr.protocol.Event;
import org.nostrkit.nostr.protocol.Filter;
import org.nostrkit.nostr.relay.Relay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batches new subscriptions with identical filter fingerprints into one shared
 * relay-level subscription.
 *
 * <p>Subscriptions are held for a short window ({@link #DEFAULT_GROUPING_DELAY_MS})
 * so that near-simultaneous requests for the same data can share a REQ. After
 * the window:
 * <ul>
 *   <li>a lone subscription with no active group for its fingerprint is started directly</li>
 *   <li>otherwise the batch creates or joins a {@link GroupedSubscription}</li>
 * </ul>
 * When the last member leaves a group its relay subscription is closed right away.
 */
public class SubscriptionGrouper {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionGrouper.class);

    /** Window during which new subscriptions are batched. */
    public static final long DEFAULT_GROUPING_DELAY_MS = 100;

    private final Scheduler scheduler;
    private final long groupingDelayMs;

    private final Queue<PendingSubscription> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);

    // Mutated under lock; read without it from delivery threads
    private final Object lock = new Object();
    private final Map<String, GroupedSubscription> groupsByFingerprint = new ConcurrentHashMap<>();
    private final Map<String, GroupedSubscription> groupsByRelayId = new ConcurrentHashMap<>();
    private final Map<String, GroupedSubscription> groupsByMember = new ConcurrentHashMap<>();

    public SubscriptionGrouper(Scheduler scheduler) {
        this(scheduler, DEFAULT_GROUPING_DELAY_MS);
    }

    public SubscriptionGrouper(Scheduler scheduler, long groupingDelayMs) {
        if (groupingDelayMs < 0) {
            throw new IllegalArgumentException("Grouping delay cannot be negative");
        }
        this.scheduler = scheduler;
        this.groupingDelayMs = groupingDelayMs;
    }

    public long getGroupingDelayMs() {
        return groupingDelayMs;
    }

    /**
     * Queue a subscription for grouping. It is started, alone or in a group,
     * once the current delay window closes.
     *
     * @param subscription Subscription to place
     * @param relays Relays to run it on
     */
    public void enqueue(Subscription subscription, Collection<? extends Relay> relays) {
        subscription.markPending();
        pending.add(new PendingSubscription(subscription, new ArrayList<>(relays)));
        if (flushScheduled.compareAndSet(false, true)) {
            scheduler.schedule(this::flush, groupingDelayMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Process everything queued so far. Normally run by the scheduler.
     */
    void flush() {
        // Cleared first so an enqueue racing with the drain schedules another flush
        flushScheduled.set(false);
        List<PendingSubscription> batch = new ArrayList<>();
        PendingSubscription next;
        while ((next = pending.poll()) != null) {
            batch.add(next);
        }
        if (!batch.isEmpty()) {
            processBatch(batch);
        }
    }

    private void processBatch(List<PendingSubscription> batch) {
        Map<String, List<PendingSubscription>> byFingerprint = new LinkedHashMap<>();
        for (PendingSubscription entry : batch) {
            if (entry.subscription.isStopped()) {
                continue;
            }
            byFingerprint.computeIfAbsent(groupingKey(entry.subscription), key -> new ArrayList<>()).add(entry);
        }

        for (Map.Entry<String, List<PendingSubscription>> entry : byFingerprint.entrySet()) {
            String fingerprint = entry.getKey();
            List<PendingSubscription> sameFingerprint = entry.getValue();
            try {
                if (sameFingerprint.size() == 1 && !groupsByFingerprint.containsKey(fingerprint)) {
                    PendingSubscription single = sameFingerprint.get(0);
                    single.subscription.start(single.relays);
                } else {
                    createOrJoinGroup(fingerprint, sameFingerprint);
                }
            } catch (RuntimeException e) {
                logger.error("Failed to start subscriptions for fingerprint '{}'", fingerprint, e);
            }
        }
    }

    private void createOrJoinGroup(String fingerprint, List<PendingSubscription> joining) {
        List<Subscription> members = new ArrayList<>();
        Set<Relay> relays = new LinkedHashSet<>();
        for (PendingSubscription entry : joining) {
            members.add(entry.subscription);
            relays.addAll(entry.relays);
        }

        GroupedSubscription group;
        synchronized (lock) {
            group = groupsByFingerprint.get(fingerprint);
            if (group == null) {
                group = new GroupedSubscription(fingerprint);
                groupsByFingerprint.put(fingerprint, group);
                groupsByRelayId.put(group.getRelaySubscriptionId(), group);
                logger.debug("Created group {} for fingerprint '{}'", group.getRelaySubscriptionId(), fingerprint);
            }
            for (Subscription member : members) {
                groupsByMember.put(member.getId(), group);
            }
            group.join(members, relays);
        }

        // A member stopped while joining is detached now
        for (Subscription member : members) {
            if (member.isStopped()) {
                remove(member.getId());
            }
        }
    }

    /**
     * Detach a subscription from its group. When the group has no members left
     * its relay-level subscription is closed immediately.
     *
     * @param subscriptionId Subscription id
     */
    public void remove(String subscriptionId) {
        GroupedSubscription emptied = null;
        synchronized (lock) {
            GroupedSubscription group = groupsByMember.remove(subscriptionId);
            if (group == null) {
                return;
            }
            group.removeMember(subscriptionId);
            if (group.isEmpty()) {
                groupsByFingerprint.remove(group.getFingerprint(), group);
                groupsByRelayId.remove(group.getRelaySubscriptionId());
                emptied = group;
            }
        }
        if (emptied != null) {
            emptied.close();
        }
    }

    /**
     * Deliver an event that arrived on a group's relay-level id to the
     * members whose own filters match.
     *
     * @return Number of members that received it; 0 for an unknown id
     */
    public int dispatchToGroup(Event event, Relay relay, String groupSubscriptionId) {
        GroupedSubscription group = groupsByRelayId.get(groupSubscriptionId);
        if (group == null) {
            logger.debug("Event {} for unknown group {}", event.getId(), groupSubscriptionId);
            return 0;
        }
        return group.dispatch(event, relay);
    }

    /**
     * @return true if the id belonged to an active group
     */
    public boolean dispatchEoseToGroup(Relay relay, String groupSubscriptionId) {
        GroupedSubscription group = groupsByRelayId.get(groupSubscriptionId);
        if (group == null) {
            return false;
        }
        group.markEose(relay);
        return true;
    }

    /**
     * @return true if the id belonged to an active group
     */
    public boolean dispatchClosedToGroup(Relay relay, String groupSubscriptionId, String message) {
        GroupedSubscription group = groupsByRelayId.get(groupSubscriptionId);
        if (group == null) {
            return false;
        }
        group.markClosed(relay, message);
        return true;
    }

    /**
     * @return Whether the relay-level id is owned by an active group
     */
    public boolean isGroupSubscriptionId(String subscriptionId) {
        return groupsByRelayId.containsKey(subscriptionId);
    }

    /**
     * @return Whether the subscription is a member of a group
     */
    public boolean isGrouped(String subscriptionId) {
        return groupsByMember.containsKey(subscriptionId);
    }

    public int getGroupCount() {
        return groupsByFingerprint.size();
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * @return Active groups
     */
    public Collection<GroupedSubscription> getGroups() {
        return Collections.unmodifiableCollection(new ArrayList<>(groupsByFingerprint.values()));
    }

    /**
     * Key shared by subscriptions that can be grouped: sorted filter
     * fingerprints joined by ';'.
     */
    static String groupingKey(Subscription subscription) {
        List<String> fingerprints = new ArrayList<>();
        for (Filter filter : subscription.getFilters()) {
            fingerprints.add(filter.fingerprint());
        }
        Collections.sort(fingerprints);
        return String.join(";", fingerprints);
    }

    private static final class PendingSubscription {
        final Subscription subscription;
        final List<Relay> relays;

        PendingSubscription(Subscription subscription, List<Relay> relays) {
            this.subscription = subscription;
            this.relays = relays;
        }
    }
}
