package io.streamvault.store.feed;

import io.streamvault.core.EventRecord;
import io.streamvault.store.CommitListener;
import io.streamvault.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Catch-up subscriptions over the global order.
 *
 * A subscriber first receives every hot event after its start offset, then every event
 * committed later, each exactly once and in strictly increasing global sequence. Delivery
 * always pulls from {@link EventLog#readAll}; commit notifications only wake the pull, so
 * catch-up and live phases cannot interleave out of order.
 */
public final class EventFeed implements CommitListener {
    private static final Logger log = LoggerFactory.getLogger(EventFeed.class);

    private final EventLog eventLog;
    private final Executor executor;
    private final int batchSize;
    private final Set<FeedSubscription> active = ConcurrentHashMap.newKeySet();

    public EventFeed(EventLog eventLog) {
        this(eventLog, ForkJoinPool.commonPool(), 256);
    }

    public EventFeed(EventLog eventLog, Executor executor, int batchSize) {
        this.eventLog = Objects.requireNonNull(eventLog);
        this.executor = Objects.requireNonNull(executor);
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.batchSize = batchSize;
    }

    /** Publisher of every event with a global sequence above {@code afterGlobalSequence}; 0 means from the start. */
    public Flow.Publisher<EventRecord> subscribe(long afterGlobalSequence) {
        return subscriber -> {
            Objects.requireNonNull(subscriber);
            var subscription = new FeedSubscription(subscriber, afterGlobalSequence);
            active.add(subscription);
            subscriber.onSubscribe(subscription);
        };
    }

    @Override
    public void onCommitted(EventRecord event) {
        active.forEach(FeedSubscription::signal);
    }

    int activeSubscriptions() {
        return active.size();
    }

    private final class FeedSubscription implements Flow.Subscription {
        private final Flow.Subscriber<? super EventRecord> subscriber;
        private final AtomicLong demand = new AtomicLong();
        private final AtomicInteger wip = new AtomicInteger();
        private volatile boolean cancelled;
        private volatile Throwable pendingError;
        private long cursor; // only touched inside drain

        FeedSubscription(Flow.Subscriber<? super EventRecord> subscriber, long afterGlobalSequence) {
            this.subscriber = subscriber;
            this.cursor = afterGlobalSequence;
        }

        @Override
        public void request(long n) {
            if (cancelled) return;
            if (n <= 0) {
                // reported from drain, which may be inside onNext right now
                if (pendingError == null) pendingError = new IllegalArgumentException("non-positive request: " + n);
                active.remove(this);
                signal();
                return;
            }
            demand.accumulateAndGet(n, (a, b) -> a + b < 0 ? Long.MAX_VALUE : a + b);
            signal();
        }

        @Override
        public void cancel() {
            cancelled = true;
            active.remove(this);
        }

        void signal() {
            if (wip.getAndIncrement() == 0) {
                executor.execute(this::drain);
            }
        }

        private void drain() {
            int missed = 1;
            do {
                var error = pendingError;
                if (error != null) {
                    if (!cancelled) {
                        cancel();
                        subscriber.onError(error);
                    }
                    return;
                }
                try {
                    deliverAvailable();
                } catch (RuntimeException ex) {
                    log.warn("Feed subscription after sequence {} failed: {}", cursor, ex.getMessage());
                    cancel();
                    subscriber.onError(ex);
                    return;
                }
                missed = wip.addAndGet(-missed);
            } while (missed != 0);
        }

        private void deliverAvailable() {
            while (!cancelled && pendingError == null && demand.get() > 0) {
                var batch = eventLog.readAll(cursor, (int) Math.min(demand.get(), batchSize));
                if (batch.isEmpty()) return;
                for (var e : batch) {
                    if (cancelled || pendingError != null) return;
                    cursor = e.globalSequence();
                    if (demand.get() != Long.MAX_VALUE) demand.decrementAndGet();
                    subscriber.onNext(e);
                }
            }
        }
    }
}
