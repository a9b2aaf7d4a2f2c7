package world.willfrog.stream.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import world.willfrog.agentstream.common.model.ChannelEvent;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.agentstream.common.wire.WirePayloadCodec;
import world.willfrog.stream.support.MutableClock;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisRunChannelTest {

    private static final String TOPIC = "agentstream:stream:r1";
    private static final String FINISHED_KEY = "run:r1:finished";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;
    @Mock
    private RedisMessageListenerContainer listenerContainer;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WirePayloadCodec codec = new WirePayloadCodec(objectMapper);
    private RedisRunChannel channel;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        channel = new RedisRunChannel("r1", TOPIC, FINISHED_KEY, Duration.ofMillis(30), Duration.ofHours(1),
                redisTemplate, listenerContainer, objectMapper, codec,
                new MutableClock(Instant.parse("2024-05-01T00:00:00Z")));
    }

    @Test
    void put_shouldPublishEnvelopeWithEncodedPayload() throws Exception {
        channel.put("r1_event_1", RawEvent.values(Map.of("k", 1)));

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(redisTemplate).convertAndSend(eq(TOPIC), message.capture());
        Map<?, ?> envelope = objectMapper.readValue((String) message.getValue(), Map.class);
        assertEquals("r1_event_1", envelope.get("event_id"));
        assertEquals(RawEvent.values(Map.of("k", 1)), RawEvent.fromWire(codec.decode(envelope.get("payload"))));
    }

    @Test
    void putTerminal_shouldWriteFinishedFlagOnce() {
        channel.put("r1_event_1", RawEvent.end(RunStatus.SUCCESS, null));
        channel.markFinished();
        channel.put("r1_event_2", RawEvent.values("late"));

        assertTrue(channel.isFinished());
        verify(valueOps, times(1)).set(FINISHED_KEY, "true", Duration.ofHours(1));
        verify(redisTemplate, times(1)).convertAndSend(anyString(), any());
    }

    @Test
    void put_shouldRaisePublishExceptionWhenRedisFails() {
        when(redisTemplate.convertAndSend(anyString(), any())).thenThrow(new RedisConnectionFailureException("down"));

        assertThrows(ChannelPublishException.class, () -> channel.put("r1_event_1", RawEvent.values(1)));
        assertFalse(channel.isFinished());
    }

    @Test
    void subscriber_shouldDecodeDeliveredMessages() throws Exception {
        ChannelSubscription subscription = channel.subscribe();
        MessageListener listener = captureListener();

        deliver(listener, "r1_event_1", RawEvent.messages("hi", Map.of("node", "agent")));
        deliver(listener, "r1_event_2", RawEvent.end(RunStatus.SUCCESS, null));

        ChannelEvent first = subscription.next();
        assertEquals("r1_event_1", first.eventId());
        assertEquals(RawEvent.messages("hi", Map.of("node", "agent")), first.event());
        assertTrue(subscription.next().isTerminal());
        assertNull(subscription.next());
        verify(listenerContainer).removeMessageListener(eq(listener), any(Topic.class));
    }

    @Test
    void subscriber_shouldSkipUndecodableMessages() throws Exception {
        ChannelSubscription subscription = channel.subscribe();
        MessageListener listener = captureListener();

        listener.onMessage(new DefaultMessage(TOPIC.getBytes(StandardCharsets.UTF_8),
                "not-json".getBytes(StandardCharsets.UTF_8)), null);
        deliver(listener, "r1_event_1", RawEvent.values(1));

        assertEquals("r1_event_1", subscription.next().eventId());
    }

    @Test
    void idleSubscriber_shouldEndWhenRemoteFlagIsSet() throws Exception {
        when(valueOps.get(FINISHED_KEY)).thenReturn("true");
        ChannelSubscription subscription = channel.subscribe();

        assertNull(subscription.next());
    }

    @Test
    void idleSubscriber_shouldEndOnConnectionError() throws Exception {
        when(valueOps.get(FINISHED_KEY)).thenThrow(new RedisConnectionFailureException("gone"));
        ChannelSubscription subscription = channel.subscribe();

        assertNull(subscription.next());
    }

    @Test
    void subscribeFailure_shouldEndOnlyThatSubscription() throws Exception {
        doThrow(new RedisConnectionFailureException("down"))
                .when(listenerContainer).addMessageListener(any(MessageListener.class), any(Topic.class));

        ChannelSubscription subscription = channel.subscribe();

        assertNull(subscription.next());
        verify(redisTemplate, never()).convertAndSend(anyString(), any());
    }

    @Test
    void isDrained_shouldAlwaysBeTrue() {
        channel.subscribe();

        assertTrue(channel.isDrained());
        assertEquals(RedisRunChannel.BACKEND_NAME, channel.backendName());
    }

    private MessageListener captureListener() {
        ArgumentCaptor<MessageListener> captor = ArgumentCaptor.forClass(MessageListener.class);
        verify(listenerContainer).addMessageListener(captor.capture(), any(Topic.class));
        List<MessageListener> listeners = captor.getAllValues();
        return listeners.get(listeners.size() - 1);
    }

    private void deliver(MessageListener listener, String eventId, RawEvent event) throws Exception {
        Map<String, Object> envelope = Map.of("event_id", eventId, "payload", codec.encode(event.toWire()));
        byte[] body = objectMapper.writeValueAsBytes(envelope);
        listener.onMessage(new DefaultMessage(TOPIC.getBytes(StandardCharsets.UTF_8), body), null);
    }
}
