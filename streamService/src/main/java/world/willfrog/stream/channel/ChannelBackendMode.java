package world.willfrog.stream.channel;

/**
 * 通道后端选择模式。
 */
public enum ChannelBackendMode {
    /**
     * Redis 可达时用分布式通道，否则退回进程内通道
     */
    AUTO,
    /**
     * 必须使用 Redis，不可达时启动失败
     */
    FORCE_DISTRIBUTED,
    /**
     * 始终使用进程内通道
     */
    FORCE_IN_PROCESS
}
