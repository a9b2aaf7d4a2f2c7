package world.willfrog.stream.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本节点上正在执行的 Run 任务。
 */
@Slf4j
@Component
public class RunTaskRegistry {

    private final Map<String, RunTaskHandle> tasks = new ConcurrentHashMap<>();

    public void register(RunTaskHandle handle) {
        RunTaskHandle previous = tasks.put(handle.getRunId(), handle);
        if (previous != null && !previous.isSettled()) {
            log.warn("Replacing active task handle: runId={}", handle.getRunId());
        }
    }

    public void unregister(RunTaskHandle handle) {
        tasks.remove(handle.getRunId(), handle);
    }

    public RunTaskHandle get(String runId) {
        return tasks.get(runId);
    }

    public boolean isActive(String runId) {
        RunTaskHandle handle = tasks.get(runId);
        return handle != null && !handle.isSettled();
    }

    /**
     * 取消任务；没有本地任务时返回 false。
     */
    public boolean cancel(String runId) {
        RunTaskHandle handle = tasks.get(runId);
        if (handle == null) {
            log.debug("No local task to cancel: runId={}", runId);
            return false;
        }
        boolean running = handle.cancel();
        log.info("Run task cancel requested: runId={}, wasRunning={}", runId, running);
        return running;
    }

    /**
     * 等待任务真正退出；没有本地任务视为已退出。
     */
    public boolean awaitSettled(String runId, Duration timeout) {
        RunTaskHandle handle = tasks.get(runId);
        if (handle == null) {
            return true;
        }
        try {
            boolean settled = handle.awaitSettled(timeout);
            if (!settled) {
                log.warn("Run task did not settle in time: runId={}, timeout={}", runId, timeout);
            }
            return settled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
