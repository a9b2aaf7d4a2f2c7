package world.willfrog.stream.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import world.willfrog.stream.channel.ChannelBackendMode;

import java.time.Duration;

/**
 * Run 事件流配置属性
 *
 * 覆盖通道后端选择、事件日志保留、取消等待以及执行线程池大小。
 * 定时任务的间隔通过 {@code run-stream.channel.janitor-interval-ms} 与
 * {@code run-stream.event-log.prune-interval-ms} 直接注入 {@code @Scheduled}。
 *
 * @see world.willfrog.stream.channel.RunChannelRegistry
 * @see world.willfrog.stream.service.RunEventStore
 */
@Data
@ConfigurationProperties(prefix = "run-stream")
public class RunStreamProperties {

    private Channel channel = new Channel();

    private EventLog eventLog = new EventLog();

    private Cancel cancel = new Cancel();

    private Execution execution = new Execution();

    @Data
    public static class Channel {
        /**
         * 后端模式：auto / force-distributed / force-in-process
         */
        private ChannelBackendMode mode = ChannelBackendMode.AUTO;

        /**
         * 进程内通道订阅者单轮等待时长
         */
        private Duration inMemoryPollTimeout = Duration.ofMillis(100);

        /**
         * Redis 通道订阅者单轮等待时长，空闲轮次会检查结束标记
         */
        private Duration redisPollTimeout = Duration.ofSeconds(1);

        /**
         * 已结束通道的最短保留时长，超过后由 janitor 回收
         */
        private Duration retention = Duration.ofHours(1);

        /**
         * janitor 执行间隔（毫秒）
         */
        private long janitorIntervalMs = 300_000;

        /**
         * Redis pub/sub 频道前缀，完整频道为 prefix + runId
         */
        private String topicPrefix = "agentstream:stream:";

        /**
         * 结束标记 key 前缀，完整 key 为 prefix + runId + ":finished"
         */
        private String finishedKeyPrefix = "run:";

        private Duration finishedFlagTtl = Duration.ofHours(1);
    }

    @Data
    public static class EventLog {
        /**
         * 事件保留时长，超过后由后台清理任务删除
         */
        private Duration retention = Duration.ofHours(24);

        private long pruneIntervalMs = 300_000;
    }

    @Data
    public static class Cancel {
        /**
         * wait=true 时等待执行任务退出的最长时间
         */
        private Duration waitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Execution {
        private int maxConcurrency = 8;
    }
}
