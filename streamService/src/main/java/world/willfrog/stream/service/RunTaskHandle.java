package world.willfrog.stream.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 一次执行任务的句柄。
 * <p>
 * {@link Future#isDone()} 在 cancel 后立刻为 true，而执行线程可能仍在运行，
 * 所以是否真正退出以 settled 闩为准。
 */
public class RunTaskHandle {

    private final String runId;
    private final CountDownLatch settled = new CountDownLatch(1);
    private Future<?> future;
    private boolean cancelRequested;

    public RunTaskHandle(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    synchronized void attach(Future<?> future) {
        this.future = future;
        if (cancelRequested) {
            future.cancel(true);
        }
    }

    /**
     * 请求取消并中断执行线程。
     *
     * @return 本次调用前任务是否仍在运行
     */
    public synchronized boolean cancel() {
        boolean running = !isSettled();
        cancelRequested = true;
        if (future != null) {
            future.cancel(true);
        }
        return running;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    void markSettled() {
        settled.countDown();
    }

    public boolean isSettled() {
        return settled.getCount() == 0;
    }

    public boolean awaitSettled(Duration timeout) throws InterruptedException {
        return settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
