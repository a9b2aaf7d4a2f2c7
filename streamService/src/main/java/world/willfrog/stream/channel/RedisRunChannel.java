package world.willfrog.stream.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import world.willfrog.agentstream.common.model.ChannelEvent;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.wire.WirePayloadCodec;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 Redis pub/sub 的分布式通道。
 * <p>
 * 消息体为 JSON 信封 {@code {"event_id": ..., "payload": ...}}，payload 是编码后的 {@link RawEvent#toWire()}。
 * 结束状态除本地标记外还写入 {@code run:{runId}:finished}，其他节点上的订阅者在空闲轮次会检查它。
 */
@Slf4j
public class RedisRunChannel implements RunChannel {

    public static final String BACKEND_NAME = "redis";

    static final String EVENT_ID_FIELD = "event_id";
    static final String PAYLOAD_FIELD = "payload";

    private final String runId;
    private final ChannelTopic topic;
    private final String finishedKey;
    private final Duration pollTimeout;
    private final Duration finishedFlagTtl;
    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final WirePayloadCodec codec;
    private final Clock clock;
    private final Instant createdAt;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    public RedisRunChannel(String runId,
                           String topicName,
                           String finishedKey,
                           Duration pollTimeout,
                           Duration finishedFlagTtl,
                           StringRedisTemplate redisTemplate,
                           RedisMessageListenerContainer listenerContainer,
                           ObjectMapper objectMapper,
                           WirePayloadCodec codec,
                           Clock clock) {
        this.runId = runId;
        this.topic = new ChannelTopic(topicName);
        this.finishedKey = finishedKey;
        this.pollTimeout = pollTimeout;
        this.finishedFlagTtl = finishedFlagTtl;
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    @Override
    public String getRunId() {
        return runId;
    }

    @Override
    public void put(String eventId, RawEvent event) {
        if (finished.get()) {
            log.debug("Drop event on finished channel: runId={}, eventId={}, type={}", runId, eventId, event.getType());
            return;
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(EVENT_ID_FIELD, eventId);
        envelope.put(PAYLOAD_FIELD, codec.encode(event.toWire()));
        try {
            String message = objectMapper.writeValueAsString(envelope);
            redisTemplate.convertAndSend(topic.getTopic(), message);
        } catch (JsonProcessingException e) {
            String msg = String.format("Failed to serialize channel envelope: runId=%s, eventId=%s", runId, eventId);
            throw new ChannelPublishException(msg, e);
        } catch (RuntimeException e) {
            String msg = String.format("Failed to publish to redis channel: runId=%s, eventId=%s, topic=%s",
                    runId, eventId, topic.getTopic());
            log.error(msg, e);
            throw new ChannelPublishException(msg, e);
        }
        if (event.isTerminal()) {
            markFinished();
        }
    }

    @Override
    public ChannelSubscription subscribe() {
        Subscription subscription = new Subscription();
        try {
            listenerContainer.addMessageListener(subscription, topic);
        } catch (RuntimeException e) {
            log.warn("Redis channel subscribe failed, subscription ends: runId={}, topic={}, error={}",
                    runId, topic.getTopic(), e.getMessage());
            subscription.close();
        }
        return subscription;
    }

    @Override
    public void markFinished() {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(finishedKey, "true", finishedFlagTtl);
        } catch (RuntimeException e) {
            log.warn("Failed to write finished flag: runId={}, key={}, error={}", runId, finishedKey, e.getMessage());
        }
    }

    @Override
    public boolean isFinished() {
        return finished.get();
    }

    /**
     * pub/sub 不保留积压，订阅者各自持有收件箱。
     */
    @Override
    public boolean isDrained() {
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

    private boolean remoteFinished() {
        String flag = redisTemplate.opsForValue().get(finishedKey);
        return Boolean.parseBoolean(flag);
    }

    private ChannelEvent decode(String message) {
        try {
            Map<?, ?> envelope = objectMapper.readValue(message, Map.class);
            Object eventId = envelope.get(EVENT_ID_FIELD);
            RawEvent event = RawEvent.fromWire(codec.decode(envelope.get(PAYLOAD_FIELD)));
            return new ChannelEvent(eventId == null ? null : String.valueOf(eventId), event);
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("Skip undecodable channel message: runId={}, error={}", runId, e.getMessage());
            return null;
        }
    }

    private class Subscription implements ChannelSubscription, MessageListener {

        private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        @Override
        public void onMessage(Message message, byte[] pattern) {
            if (!closed.get()) {
                inbox.offer(new String(message.getBody(), StandardCharsets.UTF_8));
            }
        }

        @Override
        public ChannelEvent next() throws InterruptedException {
            while (!closed.get()) {
                String message = inbox.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (message == null) {
                    if (endedWhileIdle()) {
                        close();
                        return null;
                    }
                    continue;
                }
                ChannelEvent event = decode(message);
                if (event == null) {
                    continue;
                }
                if (event.isTerminal()) {
                    finished.set(true);
                    close();
                }
                return event;
            }
            return null;
        }

        private boolean endedWhileIdle() {
            if (finished.get()) {
                return true;
            }
            try {
                return remoteFinished();
            } catch (RuntimeException e) {
                log.warn("Redis finished flag check failed, subscription ends: runId={}, error={}", runId, e.getMessage());
                return true;
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                listenerContainer.removeMessageListener(this, topic);
            } catch (RuntimeException e) {
                log.debug("Failed to remove redis listener: runId={}, error={}", runId, e.getMessage());
            }
        }
    }
}
