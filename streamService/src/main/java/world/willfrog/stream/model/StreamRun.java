package world.willfrog.stream.model;

/**
 * 一次流式订阅针对的 Run。
 *
 * @param subgraphs 为 true 时 SSE 事件名附带子图命名空间
 */
public record StreamRun(String runId, String threadId, boolean subgraphs) {

    public static StreamRun of(String runId) {
        return new StreamRun(runId, null, false);
    }
}
