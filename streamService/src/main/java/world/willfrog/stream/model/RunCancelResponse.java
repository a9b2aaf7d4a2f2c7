package world.willfrog.stream.model;

/**
 * 取消 / 中断接口的返回。
 *
 * @param wasRunning 调用前本节点上的执行任务是否仍在运行
 * @param status     事件日志记录的最终状态，尚未落库时为空
 */
public record RunCancelResponse(String runId, String action, boolean wasRunning, String status) {
}
