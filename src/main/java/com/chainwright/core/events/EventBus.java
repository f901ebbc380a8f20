package com.chainwright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub bus for chain run events.
 * <p>
 * Run subscriptions may carry a filter, e.g. {@link ChainEvent#forStage} or
 * {@link ChainEvent#isWarning}. A run's subscriptions are dropped once its terminal event
 * ({@code run.completed}, {@code run.failed}, {@code run.aborted}) has been delivered; a run
 * parked for remediation keeps them. Global subscriptions see every run until unsubscribed.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Subscriber(Predicate<ChainEvent> filter, Consumer<ChainEvent> consumer) {}

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ChainEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ChainEvent event) {
        log.debug("Publishing {} for run {} at {}", event.eventType(), event.runId(), event.stage());

        List<Subscriber> runSubs = event.runId() == null ? null : runSubscribers.get(event.runId());
        if (runSubs != null) {
            for (Subscriber subscriber : runSubs) {
                if (subscriber.filter().test(event)) {
                    deliverSafely(subscriber.consumer(), event);
                }
            }
        }

        for (Consumer<ChainEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }

        if (event.isTerminal()) {
            var dropped = runSubscribers.remove(event.runId());
            if (dropped != null) {
                log.debug("Run {} ended with {}; dropped {} subscription(s)",
                        event.runId(), event.eventType(), dropped.size());
            }
        }
    }

    /**
     * Subscribes to every event of one run until the run ends or the handle is unsubscribed.
     */
    public Subscription subscribe(String runId, Consumer<ChainEvent> consumer) {
        return subscribe(runId, e -> true, consumer);
    }

    /**
     * Subscribes to the events of one run that pass the filter.
     *
     * @param runId    the run to follow
     * @param filter   events outside the filter are not delivered
     * @param consumer callback invoked for each matching event
     * @return a handle that cancels the subscription
     */
    public Subscription subscribe(String runId, Predicate<ChainEvent> filter, Consumer<ChainEvent> consumer) {
        var subscriber = new Subscriber(filter, consumer);
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        log.debug("Subscribed to run {}", runId);
        return () -> runSubscribers.computeIfPresent(runId, (id, subs) -> {
            subs.remove(subscriber);
            return subs.isEmpty() ? null : subs;
        });
    }

    /**
     * Subscribes to events from all runs.
     */
    public Subscription subscribeAll(Consumer<ChainEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /** Live subscriptions on one run. */
    public int subscriberCount(String runId) {
        var subs = runSubscribers.get(runId);
        return subs == null ? 0 : subs.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ChainEvent> subscriber, ChainEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }
}
