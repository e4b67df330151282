package com.manifold.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory event bus scoped to the lifecycle of research runs.
 * <p>
 * Run subscribers are held in a channel per run. The channel is opened by the first
 * subscription and released right after the run's terminal event ({@code run.completed} or
 * {@code run.failed}) has been delivered, so watchers never outlive their run. Global
 * subscribers see every event of every run. Workers publish from their own threads; delivery
 * happens on the publishing thread, in publish order per thread.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, RunChannel> channels = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<ResearchEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(ResearchEvent event) {
        RunChannel channel = channels.get(event.runId());
        if (channel != null) {
            channel.deliver(event);
        }
        globalSubscribers.forEach(subscriber -> deliverSafely(subscriber, event));

        if (event.isTerminal() && channel != null && channels.remove(event.runId(), channel)) {
            log.debug("Released {} watcher(s) of run {} after {}", channel.size(), event.runId(), event.eventType());
        }
    }

    /**
     * Watches every event of one run until its terminal event.
     *
     * @return a handle that detaches the consumer early
     */
    public Subscription subscribe(String runId, Consumer<ResearchEvent> consumer) {
        return subscribe(runId, null, consumer);
    }

    /**
     * Watches one run, receiving only the given event types.
     */
    public Subscription subscribe(String runId, Set<String> eventTypes, Consumer<ResearchEvent> consumer) {
        Consumer<ResearchEvent> filtered = eventTypes == null ? consumer
                : event -> {
                    if (eventTypes.contains(event.eventType())) {
                        consumer.accept(event);
                    }
                };
        RunChannel channel = channels.computeIfAbsent(runId, k -> new RunChannel());
        channel.subscribers.add(filtered);
        return () -> {
            channel.subscribers.remove(filtered);
            if (channel.subscribers.isEmpty()) {
                channels.remove(runId, channel);
            }
        };
    }

    public Subscription subscribeAll(Consumer<ResearchEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /** Runs that currently have at least one watcher. */
    public Set<String> watchedRuns() {
        return Set.copyOf(channels.keySet());
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliverSafely(Consumer<ResearchEvent> subscriber, ResearchEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for run {}: {}", event.eventType(), event.runId(), e.getMessage(), e);
        }
    }

    private static final class RunChannel {

        private final CopyOnWriteArrayList<Consumer<ResearchEvent>> subscribers = new CopyOnWriteArrayList<>();

        private void deliver(ResearchEvent event) {
            for (Consumer<ResearchEvent> subscriber : subscribers) {
                deliverSafely(subscriber, event);
            }
        }

        private int size() {
            return subscribers.size();
        }
    }
}
