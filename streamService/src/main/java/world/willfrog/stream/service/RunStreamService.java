package world.willfrog.stream.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.agentstream.common.sse.SseFrame;
import world.willfrog.agentstream.common.utils.EventIds;
import world.willfrog.stream.channel.ChannelPublishException;
import world.willfrog.stream.channel.ChannelSubscription;
import world.willfrog.stream.channel.RunChannel;
import world.willfrog.stream.channel.RunChannelRegistry;
import world.willfrog.stream.config.RunStreamProperties;
import world.willfrog.stream.entity.RunEvent;
import world.willfrog.stream.model.StreamRun;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run 事件流编排。
 * <p>
 * 职责：
 * 1. 分配单调递增的事件 ID，先写事件日志再发布到实时通道；
 * 2. 合并历史回放与实时事件，产出 SSE 帧；
 * 3. 处理取消、中断与执行失败，保证每个 Run 只有一条终止事件。
 * <p>
 * 同一 Run 的写入在该 Run 的状态对象上串行化；终止事件记录后，后续写入全部被拒绝。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunStreamService {

    static final int MAX_ERROR_MESSAGE_CHARS = 2000;

    private final RunChannelRegistry channelRegistry;
    private final RunEventStore eventStore;
    private final RunEventConverter converter;
    private final RunTaskRegistry taskRegistry;
    private final RunStreamProperties properties;

    private final Map<String, RunState> states = new ConcurrentHashMap<>();

    /**
     * 用外部给定的事件 ID 推进计数器，只增不减；无法解析序号的 ID 不影响计数器。
     */
    public long nextEventCounter(String runId, String eventId) {
        RunState state = state(runId);
        synchronized (state) {
            return state.advance(eventId);
        }
    }

    public String nextEventId(String runId) {
        RunState state = state(runId);
        synchronized (state) {
            return state.allocate(runId);
        }
    }

    public long currentEventCounter(String runId) {
        RunState state = states.get(runId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.counter;
        }
    }

    public void putToChannel(String runId, String eventId, RawEvent event) {
        nextEventCounter(runId, eventId);
        RunChannel channel = channelRegistry.getOrCreate(runId);
        try {
            channel.put(eventId, event);
        } catch (ChannelPublishException e) {
            RunChannel replacement = channelRegistry.degrade(runId, e);
            replacement.put(eventId, event);
        }
    }

    /**
     * 规范化并写入事件日志。Run 已有终止事件时拒绝写入。
     *
     * @return 是否写入
     */
    public boolean storeFromRaw(String runId, String eventId, RawEvent event) {
        RunState state = state(runId);
        synchronized (state) {
            if (isTerminal(state, runId)) {
                log.info("Reject event after terminal: runId={}, eventId={}, type={}", runId, eventId, event.getType());
                return false;
            }
            return store(state, runId, eventId, event);
        }
    }

    /**
     * 分配事件 ID，写入事件日志并发布到实时通道。
     *
     * @return 事件被拒绝（Run 已终止或重复）时返回 false
     */
    public boolean emit(String runId, RawEvent event) {
        RunState state = state(runId);
        synchronized (state) {
            if (isTerminal(state, runId)) {
                log.info("Reject event after terminal: runId={}, type={}", runId, event.getType());
                return false;
            }
            return emitLocked(state, runId, event);
        }
    }

    public RunEventStream streamRunExecution(StreamRun run, String lastEventId) {
        String runId = run.runId();
        boolean finishedRun = eventStore.hasTerminalEvent(runId);
        ChannelSubscription live = finishedRun ? null : subscribeLive(runId);
        try {
            List<RunEvent> stored = StringUtils.isBlank(lastEventId)
                    ? eventStore.getAllEvents(runId)
                    : eventStore.getEventsSince(runId, lastEventId);
            long highWater = EventIds.parseSeqOrDefault(lastEventId, -1);
            List<SseFrame> replay = new ArrayList<>(stored.size());
            boolean terminalReplayed = false;
            for (RunEvent row : stored) {
                if (row.getSeq() != null) {
                    highWater = Math.max(highWater, row.getSeq());
                }
                RawEvent event = converter.fromStored(row, eventStore.readData(row));
                if (event == null) {
                    continue;
                }
                replay.add(converter.toFrame(row.getId(), event, run.subgraphs()));
                if (event.isTerminal()) {
                    terminalReplayed = true;
                    break;
                }
            }
            if (terminalReplayed && live != null) {
                live.close();
                live = null;
            }
            log.info("Run stream opened: runId={}, lastEventId={}, replayed={}, live={}",
                    runId, lastEventId, replay.size(), live != null);
            return new RunEventStream(runId, replay, live, highWater, converter, run.subgraphs());
        } catch (RuntimeException e) {
            if (live != null) {
                live.close();
            }
            throw e;
        }
    }

    public void signalCancelled(String runId) {
        RunState state = state(runId);
        synchronized (state) {
            if (isTerminal(state, runId)) {
                log.debug("Cancel signal ignored, run already terminal: runId={}", runId);
            } else if (emitLocked(state, runId, RawEvent.end(RunStatus.INTERRUPTED, null))) {
                log.info("Run cancelled: runId={}", runId);
            } else {
                log.info("Cancel signal lost to a concurrent terminal event: runId={}", runId);
            }
        }
        channelRegistry.cleanup(runId);
    }

    public void signalError(String runId, String message) {
        signalError(runId, message, null);
    }

    /**
     * 写入 error 事件和 status=error 的 end 事件，然后结束通道。
     *
     * @param kind 错误类型，空时为 "Error"
     */
    public void signalError(String runId, String message, String kind) {
        String safeMessage = StringUtils.abbreviate(StringUtils.defaultString(message), MAX_ERROR_MESSAGE_CHARS);
        RunState state = state(runId);
        synchronized (state) {
            if (isTerminal(state, runId)) {
                log.debug("Error signal ignored, run already terminal: runId={}", runId);
            } else {
                emitLocked(state, runId, RawEvent.error(kind, safeMessage));
                emitLocked(state, runId, RawEvent.end(RunStatus.ERROR, null));
                log.info("Run failed: runId={}, kind={}, message={}", runId, kind, safeMessage);
            }
        }
        channelRegistry.cleanup(runId);
    }

    public boolean cancelRun(String runId) {
        return cancelRun(runId, false);
    }

    /**
     * 取消执行任务并写入 end(interrupted)，可重复调用。
     *
     * @param wait 为 true 时等待执行任务真正退出
     * @return 调用前本地任务是否仍在运行
     */
    public boolean cancelRun(String runId, boolean wait) {
        boolean wasRunning = taskRegistry.cancel(runId);
        signalCancelled(runId);
        if (wait) {
            taskRegistry.awaitSettled(runId, properties.getCancel().getWaitTimeout());
        }
        return wasRunning;
    }

    public boolean interruptRun(String runId) {
        return interruptRun(runId, false);
    }

    public boolean interruptRun(String runId, boolean wait) {
        boolean wasRunning = taskRegistry.cancel(runId);
        signalError(runId, "Run was interrupted");
        if (wait) {
            taskRegistry.awaitSettled(runId, properties.getCancel().getWaitTimeout());
        }
        return wasRunning;
    }

    public boolean isRunStreaming(String runId) {
        RunChannel channel = channelRegistry.get(runId);
        return channel != null && !channel.isFinished();
    }

    public void cleanupRun(String runId) {
        channelRegistry.cleanup(runId);
    }

    /**
     * 从事件日志里的终止事件解析最终状态；Run 未结束时返回空。
     */
    public Optional<RunStatus> resolveFinalStatus(String runId) {
        return eventStore.findTerminalEvent(runId).map(event -> {
            Object status = eventStore.readData(event).get(RunEventConverter.STATUS);
            try {
                return RunStatus.fromValue(status == null ? null : String.valueOf(status));
            } catch (IllegalArgumentException e) {
                log.warn("Unknown terminal status: runId={}, status={}", runId, status);
                return null;
            }
        });
    }

    /**
     * 释放已终止且通道已被回收的 Run 的计数器状态。
     */
    @Scheduled(fixedDelayString = "${run-stream.channel.janitor-interval-ms:300000}",
            initialDelayString = "${run-stream.channel.janitor-interval-ms:300000}")
    public void releaseRetiredRuns() {
        int before = states.size();
        states.entrySet().removeIf(entry -> entry.getValue().terminal && channelRegistry.get(entry.getKey()) == null);
        int released = before - states.size();
        if (released > 0) {
            log.info("Released retired run states: count={}, remaining={}", released, states.size());
        }
    }

    private boolean emitLocked(RunState state, String runId, RawEvent event) {
        String eventId = state.allocate(runId);
        boolean stored = store(state, runId, eventId, event);
        if (!stored && !state.terminal) {
            // ID 已被其他节点或重启前的本进程占用，按日志里的最大序号重新分配
            long lastSeq = eventStore.findLastSeq(runId);
            log.warn("Event id already taken, reallocating from log: runId={}, eventId={}, lastSeq={}",
                    runId, eventId, lastSeq);
            state.advanceTo(lastSeq);
            eventId = state.allocate(runId);
            stored = store(state, runId, eventId, event);
            if (!stored && !state.terminal) {
                String msg = String.format("Run event not recorded after reallocation: runId=%s, eventId=%s, type=%s",
                        runId, eventId, event.getType());
                log.error(msg);
                throw new IllegalStateException(msg);
            }
        }
        if (!stored) {
            return false;
        }
        putToChannel(runId, eventId, event);
        return true;
    }

    private boolean store(RunState state, String runId, String eventId, RawEvent event) {
        Map<String, Object> data = converter.toStoredData(event);
        boolean stored = eventStore.storeEvent(runId, eventId, event.getType().wireName(), data);
        if (stored ? event.isTerminal() : eventStore.hasTerminalEvent(runId)) {
            state.terminal = true;
        }
        return stored;
    }

    /**
     * 订阅实时通道。事件日志里没有记录、本地没有任务、也没有通道的 Run 不会再有事件，不订阅。
     */
    private ChannelSubscription subscribeLive(String runId) {
        RunChannel channel = channelRegistry.get(runId);
        if (channel == null && !taskRegistry.isActive(runId) && eventStore.getRunInfo(runId).isEmpty()) {
            log.warn("Run unknown on this node, stream is replay-only: runId={}", runId);
            return null;
        }
        return (channel != null ? channel : channelRegistry.getOrCreate(runId)).subscribe();
    }

    private boolean isTerminal(RunState state, String runId) {
        if (state.terminal) {
            return true;
        }
        RunChannel channel = channelRegistry.get(runId);
        return channel != null && channel.isFinished();
    }

    /**
     * 首次接触某个 Run 时用事件日志初始化计数器和终止标记，
     * 其他节点写过的事件或重启前的事件都会被计入。
     */
    private RunState state(String runId) {
        RunState existing = states.get(runId);
        if (existing != null) {
            return existing;
        }
        RunState seeded = new RunState();
        seeded.counter = eventStore.findLastSeq(runId);
        seeded.terminal = eventStore.hasTerminalEvent(runId);
        RunState raced = states.putIfAbsent(runId, seeded);
        return raced != null ? raced : seeded;
    }

    private static final class RunState {
        private long counter;
        private volatile boolean terminal;

        long advance(String eventId) {
            OptionalLong seq = EventIds.parseSeq(eventId);
            if (seq.isPresent()) {
                advanceTo(seq.getAsLong());
            }
            return counter;
        }

        void advanceTo(long seq) {
            if (seq > counter) {
                counter = seq;
            }
        }

        String allocate(String runId) {
            counter++;
            return EventIds.format(runId, counter);
        }
    }
}
