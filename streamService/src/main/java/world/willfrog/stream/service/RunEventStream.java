package world.willfrog.stream.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentstream.common.model.ChannelEvent;
import world.willfrog.agentstream.common.sse.SseFrame;
import world.willfrog.stream.channel.ChannelSubscription;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalLong;

/**
 * 一次 SSE 订阅产出的帧序列：先回放事件日志，再接实时通道。
 * <p>
 * 实时通道在回放前就已订阅，序号不大于回放高水位的实时事件会被跳过，
 * 所以两段之间既不丢也不重。{@link #hasNext()} 会阻塞等待实时事件。
 */
@Slf4j
public class RunEventStream implements Iterator<SseFrame>, AutoCloseable {

    private final String runId;
    private final Deque<SseFrame> replay;
    private final ChannelSubscription live;
    private final RunEventConverter converter;
    private final boolean subgraphs;
    private long highWater;
    private SseFrame pending;
    private boolean ended;

    RunEventStream(String runId,
                   List<SseFrame> replayFrames,
                   ChannelSubscription live,
                   long highWater,
                   RunEventConverter converter,
                   boolean subgraphs) {
        this.runId = runId;
        this.replay = new ArrayDeque<>(replayFrames);
        this.live = live;
        this.highWater = highWater;
        this.converter = converter;
        this.subgraphs = subgraphs;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        pending = advance();
        if (pending == null) {
            ended = true;
            close();
        }
        return pending != null;
    }

    @Override
    public SseFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException("run event stream ended: " + runId);
        }
        SseFrame frame = pending;
        pending = null;
        return frame;
    }

    public boolean isLive() {
        return live != null;
    }

    private SseFrame advance() {
        if (!replay.isEmpty()) {
            return replay.poll();
        }
        if (live == null) {
            return null;
        }
        try {
            while (true) {
                ChannelEvent event = live.next();
                if (event == null) {
                    return null;
                }
                OptionalLong seq = event.seq();
                if (seq.isPresent()) {
                    if (seq.getAsLong() <= highWater) {
                        log.debug("Skip live event already replayed: runId={}, eventId={}", runId, event.eventId());
                        continue;
                    }
                    highWater = seq.getAsLong();
                }
                return converter.toFrame(event.eventId(), event.event(), subgraphs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Run event stream interrupted: runId={}", runId);
            return null;
        }
    }

    @Override
    public void close() {
        ended = true;
        if (live != null) {
            live.close();
        }
    }
}
