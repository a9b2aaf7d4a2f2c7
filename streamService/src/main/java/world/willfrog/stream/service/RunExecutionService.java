package world.willfrog.stream.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.stream.model.StreamRun;

import java.util.Iterator;
import java.util.concurrent.ExecutorService;

/**
 * Run 执行驱动。
 * <p>
 * 执行流程：
 * 1. 在 runExecutor 线程池中消费 {@link RunEventSource} 产出的事件；
 * 2. 每条事件经 {@link RunStreamService#emit} 先落库再发布；
 * 3. 引擎正常结束但没有给出 end 时补一条 end(success)；
 * 4. 引擎抛异常时写入 error + end(error)；线程被中断视为取消，由取消方负责终止事件。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunExecutionService {

    private final RunStreamService streamService;
    private final RunTaskRegistry taskRegistry;
    private final ExecutorService runExecutor;

    public RunTaskHandle start(StreamRun run, RunEventSource source) {
        RunTaskHandle handle = new RunTaskHandle(run.runId());
        taskRegistry.register(handle);
        try {
            handle.attach(runExecutor.submit(() -> drive(run, source, handle)));
        } catch (RuntimeException e) {
            handle.markSettled();
            taskRegistry.unregister(handle);
            String msg = String.format("Submit run execution failed: runId=%s", run.runId());
            log.error(msg, e);
            throw new IllegalStateException(msg, e);
        }
        log.info("Run execution submitted: runId={}, threadId={}", run.runId(), run.threadId());
        return handle;
    }

    void drive(StreamRun run, RunEventSource source, RunTaskHandle handle) {
        String runId = run.runId();
        try {
            Iterator<RawEvent> events = source.stream(run);
            boolean terminal = false;
            while (!cancelled(handle) && events.hasNext()) {
                RawEvent event = events.next();
                if (cancelled(handle)) {
                    break;
                }
                streamService.emit(runId, event);
                if (event.isTerminal()) {
                    terminal = true;
                    break;
                }
            }
            if (cancelled(handle)) {
                log.info("Run execution stopped by cancel: runId={}", runId);
                return;
            }
            if (!terminal) {
                streamService.emit(runId, RawEvent.end(RunStatus.SUCCESS, null));
            }
            log.info("Run execution finished: runId={}", runId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Run execution interrupted: runId={}", runId);
        } catch (Exception e) {
            if (cancelled(handle)) {
                log.info("Run execution aborted after cancel: runId={}, error={}", runId, e.getMessage());
                return;
            }
            log.error("Run execution failed: runId={}", runId, e);
            try {
                streamService.signalError(runId, e.getMessage(), e.getClass().getSimpleName());
            } catch (RuntimeException signalFailure) {
                log.error("Failed to record run error: runId={}", runId, signalFailure);
            }
        } finally {
            handle.markSettled();
            taskRegistry.unregister(handle);
        }
    }

    private static boolean cancelled(RunTaskHandle handle) {
        return handle.isCancelRequested() || Thread.currentThread().isInterrupted();
    }
}
