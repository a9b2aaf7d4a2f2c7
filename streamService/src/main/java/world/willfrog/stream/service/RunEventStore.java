package world.willfrog.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import world.willfrog.agentstream.common.model.RawEventType;
import world.willfrog.agentstream.common.utils.EventIds;
import world.willfrog.stream.config.RunStreamProperties;
import world.willfrog.stream.entity.RunEvent;
import world.willfrog.stream.entity.RunEventSeqRange;
import world.willfrog.stream.mapper.RunEventMapper;
import world.willfrog.stream.model.RunEventInfo;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run 事件日志。
 * <p>
 * 职责：
 * 1. 按事件 ID 中的序号持久化事件，供断线重连回放；
 * 2. 按 Last-Event-ID 返回之后的事件；
 * 3. 定期删除超过保留期的事件。
 * <p>
 * 同一 Run 最多存一条 end 事件，由表上的部分唯一索引保证；end 之后的事件在插入时被拒绝。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunEventStore {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final RunEventMapper eventMapper;
    private final ObjectMapper objectMapper;
    private final RunStreamProperties properties;
    private final Clock clock;

    /**
     * 写入一条事件。
     *
     * @param runId     Run ID
     * @param eventId   事件 ID，序号解析失败时按 0 存
     * @param eventType 事件类型（RawEvent 的线上名称）
     * @param data      规范化后的事件数据
     * @return 是否真正写入；重复 ID 或 Run 已有 end 时返回 false
     */
    public boolean storeEvent(String runId, String eventId, String eventType, Map<String, Object> data) {
        RunEvent event = new RunEvent();
        event.setId(eventId);
        event.setRunId(runId);
        event.setSeq(EventIds.parseSeqOrDefault(eventId, 0));
        event.setEventType(eventType);
        event.setDataJson(writeData(runId, eventId, data));
        event.setCreatedAt(OffsetDateTime.now(clock));
        int inserted;
        try {
            inserted = eventMapper.insert(event);
        } catch (Exception e) {
            String msg = String.format(
                    "Store run event failed (fail-fast): runId=%s, eventId=%s, eventType=%s",
                    runId, eventId, eventType
            );
            log.error(msg, e);
            throw new IllegalStateException(msg, e);
        }
        if (inserted == 0) {
            log.info("Run event not stored (duplicate id or run already ended): runId={}, eventId={}, eventType={}",
                    runId, eventId, eventType);
            return false;
        }
        return true;
    }

    public List<RunEvent> getAllEvents(String runId) {
        return eventMapper.listByRunId(runId);
    }

    /**
     * 返回序号大于 lastEventId 序号的事件；lastEventId 无法解析时返回全部事件。
     */
    public List<RunEvent> getEventsSince(String runId, String lastEventId) {
        long afterSeq = EventIds.parseSeqOrDefault(lastEventId, -1);
        return eventMapper.listByRunIdAfterSeq(runId, afterSeq);
    }

    public Optional<RunEventInfo> getRunInfo(String runId) {
        RunEventSeqRange range = eventMapper.findSeqRange(runId);
        if (range == null || range.getRowCount() == null || range.getRowCount() == 0) {
            return Optional.empty();
        }
        RunEvent latest = eventMapper.findLatestByRunId(runId);
        if (latest == null) {
            return Optional.empty();
        }
        long eventCount = range.getRowCount() > 1 ? range.getLastSeq() - range.getFirstSeq() + 1 : 1;
        return Optional.of(new RunEventInfo(runId, eventCount, latest.getId(), latest.getCreatedAt()));
    }

    /**
     * 事件日志中该 Run 的最大序号，没有事件时为 0。
     */
    public long findLastSeq(String runId) {
        RunEventSeqRange range = eventMapper.findSeqRange(runId);
        if (range == null || range.getLastSeq() == null) {
            return 0;
        }
        return Math.max(range.getLastSeq(), 0);
    }

    public Optional<RunEvent> findTerminalEvent(String runId) {
        return Optional.ofNullable(eventMapper.findTerminalByRunId(runId));
    }

    public boolean hasTerminalEvent(String runId) {
        return findTerminalEvent(runId).isPresent();
    }

    public int cleanupEvents(String runId) {
        int deleted = eventMapper.deleteByRunId(runId);
        log.info("Run events cleaned up: runId={}, deleted={}", runId, deleted);
        return deleted;
    }

    /**
     * 解析事件数据；存量数据损坏时包成 {@code {"raw": json}}。
     */
    public Map<String, Object> readData(RunEvent event) {
        String json = event.getDataJson();
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, DATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable run event data: runId={}, eventId={}, error={}",
                    event.getRunId(), event.getId(), e.getOriginalMessage());
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", json);
            return raw;
        }
    }

    public static boolean isTerminal(RunEvent event) {
        return RawEventType.END.wireName().equals(event.getEventType());
    }

    @Scheduled(fixedDelayString = "${run-stream.event-log.prune-interval-ms:300000}",
            initialDelayString = "${run-stream.event-log.prune-interval-ms:300000}")
    public void pruneExpiredEvents() {
        try {
            OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(properties.getEventLog().getRetention());
            int deleted = eventMapper.deleteCreatedBefore(cutoff);
            if (deleted > 0) {
                log.info("Pruned expired run events: deleted={}, cutoff={}", deleted, cutoff);
            }
        } catch (Exception e) {
            log.error("Prune expired run events failed", e);
        }
    }

    private String writeData(String runId, String eventId, Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data == null ? Map.of() : data);
        } catch (JsonProcessingException e) {
            log.warn("Run event data not serializable, storing raw text: runId={}, eventId={}, error={}",
                    runId, eventId, e.getOriginalMessage());
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("raw", String.valueOf(data));
            try {
                return objectMapper.writeValueAsString(raw);
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Failed to serialize raw run event data: eventId=" + eventId, ex);
            }
        }
    }
}
