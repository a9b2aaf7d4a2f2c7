package world.willfrog.agentstream.common.sse;

/**
 * 一帧 SSE 文本。
 *
 * @param id    事件 ID，可为空
 * @param event 事件类型，子图事件带 {@code |} 拼接的命名空间
 * @param data  已序列化的 JSON
 */
public record SseFrame(String id, String event, String data) {

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("event: ").append(event).append('\n');
        sb.append("data: ").append(data).append('\n');
        if (id != null) {
            sb.append("id: ").append(id).append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }
}
