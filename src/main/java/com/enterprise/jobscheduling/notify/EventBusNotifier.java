package com.enterprise.jobscheduling.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe bus. Events are delivered to the topic's subscribers on a
 * dedicated thread, in publish order. A failing subscriber is logged and skipped.
 */
public class EventBusNotifier implements JobStatusNotifier {

    private static final Logger logger = LoggerFactory.getLogger(EventBusNotifier.class);

    private final Map<String, List<Consumer<JobStatusEvent>>> subscribers = new ConcurrentHashMap<>();
    private final ExecutorService deliveryExecutor;
    private final AtomicLong published = new AtomicLong(0);
    private final AtomicLong deliveryFailures = new AtomicLong(0);

    public EventBusNotifier() {
        this.deliveryExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "job-status-bus");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Register a subscriber for a topic
     * @return handle that removes the subscription when run
     */
    public Runnable subscribe(String topic, Consumer<JobStatusEvent> subscriber) {
        subscribers.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(subscriber);
        logger.debug("Subscriber added to topic {}", topic);
        return () -> unsubscribe(topic, subscriber);
    }

    public Runnable subscribe(Consumer<JobStatusEvent> subscriber) {
        return subscribe(JOB_STATUS_TOPIC, subscriber);
    }

    public void unsubscribe(String topic, Consumer<JobStatusEvent> subscriber) {
        List<Consumer<JobStatusEvent>> list = subscribers.get(topic);
        if (list != null && list.remove(subscriber)) {
            logger.debug("Subscriber removed from topic {}", topic);
        }
    }

    @Override
    public void publish(String topic, JobStatusEvent event) {
        published.incrementAndGet();
        List<Consumer<JobStatusEvent>> targets = subscribers.get(topic);
        if (targets == null || targets.isEmpty()) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> deliver(topic, targets, event));
        } catch (RejectedExecutionException e) {
            deliveryFailures.incrementAndGet();
            logger.warn("Dropped status event for job {}: event bus is shut down", event.getId());
        }
    }

    private void deliver(String topic, List<Consumer<JobStatusEvent>> targets, JobStatusEvent event) {
        for (Consumer<JobStatusEvent> subscriber : targets) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                deliveryFailures.incrementAndGet();
                logger.warn("Subscriber on topic {} failed to handle event for job {}", topic, event.getId(), e);
            }
        }
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDeliveryFailureCount() {
        return deliveryFailures.get();
    }

    /**
     * Deliver pending events, then stop
     */
    public void shutdown() {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Event bus did not drain in time, forcing shutdown");
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        subscribers.clear();
        logger.info("EventBusNotifier stopped");
    }
}
