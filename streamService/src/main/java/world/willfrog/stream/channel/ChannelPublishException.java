package world.willfrog.stream.channel;

/**
 * 分布式通道发布失败。注册中心据此降级到进程内通道。
 */
public class ChannelPublishException extends RuntimeException {

    public ChannelPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
