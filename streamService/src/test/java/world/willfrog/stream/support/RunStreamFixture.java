package world.willfrog.stream.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import world.willfrog.stream.channel.ChannelBackendMode;
import world.willfrog.stream.channel.InMemoryChannelBackend;
import world.willfrog.stream.channel.RedisChannelBackend;
import world.willfrog.stream.channel.RunChannelRegistry;
import world.willfrog.stream.config.RunStreamProperties;
import world.willfrog.stream.service.RunEventConverter;
import world.willfrog.stream.service.RunEventStore;
import world.willfrog.stream.service.RunStreamService;
import world.willfrog.stream.service.RunTaskRegistry;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.Mockito.mock;

/**
 * 以进程内通道和内存事件表组装的编排层，供服务测试使用。
 */
public class RunStreamFixture {

    public final ObjectMapper objectMapper = new ObjectMapper();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
    public final RunStreamProperties properties = new RunStreamProperties();
    public final InMemoryRunEventMapper mapper;
    public final RedisChannelBackend redisBackend;
    public final RunChannelRegistry channelRegistry;
    public final RunEventStore eventStore;
    public final RunEventConverter converter;
    public final RunTaskRegistry taskRegistry = new RunTaskRegistry();
    public final RunStreamService streamService;

    public RunStreamFixture() {
        this(mock(RedisChannelBackend.class), ChannelBackendMode.FORCE_IN_PROCESS);
    }

    /**
     * 与另一个节点共用同一张事件表。
     */
    public RunStreamFixture(InMemoryRunEventMapper sharedMapper) {
        this(sharedMapper, mock(RedisChannelBackend.class), ChannelBackendMode.FORCE_IN_PROCESS);
    }

    public RunStreamFixture(RedisChannelBackend redisBackend, ChannelBackendMode mode) {
        this(new InMemoryRunEventMapper(), redisBackend, mode);
    }

    private RunStreamFixture(InMemoryRunEventMapper mapper, RedisChannelBackend redisBackend, ChannelBackendMode mode) {
        this.mapper = mapper;
        properties.getChannel().setMode(mode);
        properties.getChannel().setInMemoryPollTimeout(Duration.ofMillis(20));
        properties.getCancel().setWaitTimeout(Duration.ofSeconds(5));
        this.redisBackend = redisBackend;
        this.channelRegistry = new RunChannelRegistry(new InMemoryChannelBackend(properties, clock), redisBackend, properties);
        this.channelRegistry.init();
        this.eventStore = new RunEventStore(mapper, objectMapper, properties, clock);
        this.converter = new RunEventConverter(objectMapper);
        this.streamService = new RunStreamService(channelRegistry, eventStore, converter, taskRegistry, properties);
    }
}
