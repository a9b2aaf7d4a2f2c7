package world.willfrog.stream.channel;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentstream.common.model.ChannelEvent;
import world.willfrog.agentstream.common.model.RawEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 进程内通道：每个订阅者一条无界队列，put 时广播到所有当前订阅者。
 */
@Slf4j
public class InMemoryRunChannel implements RunChannel {

    public static final String BACKEND_NAME = "in-memory";

    private final String runId;
    private final Duration pollTimeout;
    private final Clock clock;
    private final Instant createdAt;
    private final Set<Subscription> subscriptions = new CopyOnWriteArraySet<>();
    private final Object putLock = new Object();
    private volatile boolean finished;

    public InMemoryRunChannel(String runId, Duration pollTimeout, Clock clock) {
        this.runId = runId;
        this.pollTimeout = pollTimeout;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public void put(String eventId, RawEvent event) {
        synchronized (putLock) {
            if (finished) {
                log.debug("Drop event on finished channel: runId={}, eventId={}, type={}", runId, eventId, event.getType());
                return;
            }
            ChannelEvent channelEvent = new ChannelEvent(eventId, event);
            for (Subscription subscription : subscriptions) {
                subscription.queue.offer(channelEvent);
            }
            if (event.isTerminal()) {
                finished = true;
            }
        }
    }

    @Override
    public ChannelSubscription subscribe() {
        Subscription subscription = new Subscription();
        synchronized (putLock) {
            subscriptions.add(subscription);
        }
        return subscription;
    }

    @Override
    public void markFinished() {
        finished = true;
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public boolean isDrained() {
        for (Subscription subscription : subscriptions) {
            if (!subscription.queue.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Duration getAge() {
        return Duration.between(createdAt, clock.instant());
    }

    @Override
    public String backendName() {
        return BACKEND_NAME;
    }

    private class Subscription implements ChannelSubscription {

        private final BlockingQueue<ChannelEvent> queue = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        @Override
        public ChannelEvent next() throws InterruptedException {
            while (!closed) {
                if (finished && queue.isEmpty()) {
                    close();
                    return null;
                }
                ChannelEvent event = queue.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (event.isTerminal()) {
                    close();
                }
                return event;
            }
            return null;
        }

        @Override
        public void close() {
            closed = true;
            subscriptions.remove(this);
        }
    }
}
