package world.willfrog.stream.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;
import world.willfrog.agentstream.common.wire.WirePayloadCodec;
import world.willfrog.stream.config.RunStreamProperties;

import java.time.Clock;

/**
 * Redis pub/sub 后端。
 * <p>
 * 监听容器在首次被选中时才创建并启动，进程内模式下不会占用 Redis 连接。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisChannelBackend implements ChannelBackend {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final WirePayloadCodec codec;
    private final RunStreamProperties properties;
    private final Clock clock;

    private RedisMessageListenerContainer listenerContainer;

    @Override
    public String name() {
        return RedisRunChannel.BACKEND_NAME;
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return pong != null;
        } catch (RuntimeException e) {
            log.warn("Redis channel backend unavailable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public RunChannel create(String runId) {
        RunStreamProperties.Channel channel = properties.getChannel();
        return new RedisRunChannel(
                runId,
                channel.getTopicPrefix() + runId,
                channel.getFinishedKeyPrefix() + runId + ":finished",
                channel.getRedisPollTimeout(),
                channel.getFinishedFlagTtl(),
                redisTemplate,
                listenerContainer(),
                objectMapper,
                codec,
                clock);
    }

    @Override
    public synchronized void shutdown() {
        if (listenerContainer == null) {
            return;
        }
        try {
            listenerContainer.destroy();
        } catch (Exception e) {
            log.warn("Failed to stop redis listener container: {}", e.getMessage());
        } finally {
            listenerContainer = null;
        }
    }

    synchronized RedisMessageListenerContainer listenerContainer() {
        if (listenerContainer == null) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(redisTemplate.getRequiredConnectionFactory());
            container.afterPropertiesSet();
            container.start();
            listenerContainer = container;
            log.info("Redis listener container started for run channels");
        }
        return listenerContainer;
    }
}
