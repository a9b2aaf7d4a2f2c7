package world.willfrog.stream.channel;

import world.willfrog.agentstream.common.model.ChannelEvent;

/**
 * 对某个通道的一次订阅。
 */
public interface ChannelSubscription extends AutoCloseable {

    /**
     * 阻塞等待下一条事件。
     *
     * @return 下一条事件；订阅已结束（收到终止事件、通道结束且无积压、已关闭、连接异常）时返回 null
     * @throws InterruptedException 等待期间线程被中断
     */
    ChannelEvent next() throws InterruptedException;

    @Override
    void close();
}
