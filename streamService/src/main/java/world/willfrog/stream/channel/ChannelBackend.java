package world.willfrog.stream.channel;

/**
 * 通道后端策略。注册中心在启动时选定一个后端，降级时切到进程内后端。
 */
public interface ChannelBackend {

    String name();

    /**
     * 探测后端是否可用，仅在选择后端时调用一次
     */
    boolean isAvailable();

    RunChannel create(String runId);

    default void shutdown() {
    }
}
