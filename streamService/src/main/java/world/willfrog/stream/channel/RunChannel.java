package world.willfrog.stream.channel;

import world.willfrog.agentstream.common.model.RawEvent;

import java.time.Duration;

/**
 * 单个 Run 的事件通道。
 * <p>
 * 一个通道最多转发一条终止事件；终止事件写入后通道即结束，之后的 put 被忽略。
 * 订阅只能看到订阅之后写入的事件，历史事件由事件日志回放。
 */
public interface RunChannel {

    String getRunId();

    /**
     * 写入一条事件；通道已结束时不做任何事。
     *
     * @throws ChannelPublishException 分布式后端发布失败
     */
    void put(String eventId, RawEvent event);

    ChannelSubscription subscribe();

    /**
     * 标记结束，幂等。阻塞中的订阅者最多一个轮询周期后退出。
     */
    void markFinished();

    boolean isFinished();

    /**
     * 是否没有积压的待消费事件
     */
    boolean isDrained();

    Duration getAge();

    String backendName();
}
