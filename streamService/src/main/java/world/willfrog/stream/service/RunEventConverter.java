package world.willfrog.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RawEventType;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.agentstream.common.sse.SseFrame;
import world.willfrog.stream.entity.RunEvent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RawEvent 与存储记录、SSE 帧之间的转换。
 * <p>
 * 回放路径先把存储记录还原成 RawEvent，再和实时路径走同一个 {@link #toFrame}，
 * 两条路径产出的帧完全一致。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunEventConverter {

    static final String TYPE = "type";
    static final String CHUNK = "chunk";
    static final String MESSAGE_CHUNK = "message_chunk";
    static final String METADATA = "metadata";
    static final String STATUS = "status";
    static final String FINAL_OUTPUT = "final_output";
    static final String ERROR = "error";
    static final String MESSAGE = "message";
    static final String NAMESPACE = "namespace";
    static final String INTERRUPT_KEY = "__interrupt__";

    private final ObjectMapper objectMapper;

    /**
     * 规范化成事件日志中存储的数据。
     */
    public Map<String, Object> toStoredData(RawEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        switch (event.getType()) {
            case VALUES -> {
                data.put(TYPE, "execution_values");
                data.put(CHUNK, event.getChunk());
            }
            case MESSAGES -> {
                data.put(TYPE, "messages_stream");
                data.put(MESSAGE_CHUNK, event.getChunk());
                data.put(METADATA, event.getMetadata());
            }
            case UPDATES -> {
                data.put(TYPE, "execution_updates");
                data.put(CHUNK, event.getChunk());
            }
            case DEBUG -> {
                data.put(TYPE, "debug_event");
                data.put(CHUNK, event.getChunk());
            }
            case CUSTOM -> {
                data.put(TYPE, "custom_event");
                data.put(CHUNK, event.getChunk());
            }
            case END -> {
                data.put(TYPE, "run_complete");
                data.put(STATUS, event.getStatus().value());
                data.put(FINAL_OUTPUT, event.getFinalOutput());
            }
            case ERROR -> {
                data.put(TYPE, "execution_error");
                data.put(ERROR, event.getErrorKind());
                data.put(MESSAGE, event.getErrorMessage());
            }
        }
        if (event.hasNamespace()) {
            data.put(NAMESPACE, new ArrayList<>(event.getNamespace()));
        }
        return data;
    }

    /**
     * 从存储记录还原 RawEvent；未知事件类型返回 null。
     */
    public RawEvent fromStored(RunEvent stored, Map<String, Object> data) {
        RawEventType type;
        try {
            type = RawEventType.fromWireName(stored.getEventType());
        } catch (IllegalArgumentException e) {
            log.debug("Skip stored event of unknown type: runId={}, eventId={}, type={}",
                    stored.getRunId(), stored.getId(), stored.getEventType());
            return null;
        }
        RawEvent event = switch (type) {
            case VALUES -> RawEvent.values(data.get(CHUNK));
            case MESSAGES -> RawEvent.messages(data.get(MESSAGE_CHUNK), data.get(METADATA));
            case UPDATES -> RawEvent.updates(data.get(CHUNK));
            case DEBUG -> RawEvent.debug(data.get(CHUNK));
            case CUSTOM -> RawEvent.custom(data.get(CHUNK));
            case END -> RawEvent.end(resolveStatus(data.get(STATUS)), data.get(FINAL_OUTPUT));
            case ERROR -> RawEvent.error(stringOrNull(data.get(ERROR)), stringOrNull(data.get(MESSAGE)));
        };
        if (data.get(NAMESPACE) instanceof List<?> path) {
            List<String> namespace = new ArrayList<>(path.size());
            path.forEach(segment -> namespace.add(String.valueOf(segment)));
            event = event.withNamespace(namespace);
        }
        return event;
    }

    public SseFrame toFrame(String eventId, RawEvent event, boolean subgraphs) {
        return new SseFrame(eventId, eventName(event, subgraphs), writeJson(eventId, frameData(event)));
    }

    private Object frameData(RawEvent event) {
        return switch (event.getType()) {
            case MESSAGES -> event.getMetadata() == null
                    ? event.getChunk()
                    : Arrays.asList(event.getChunk(), event.getMetadata());
            case END -> {
                Map<String, Object> end = new LinkedHashMap<>();
                end.put(STATUS, event.getStatus().value());
                yield end;
            }
            case ERROR -> {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put(ERROR, event.getErrorKind());
                error.put(MESSAGE, event.getErrorMessage());
                yield error;
            }
            default -> event.getChunk();
        };
    }

    /**
     * 带 {@code __interrupt__} 的 updates 以 values 帧下发，客户端据此进入人工介入流程。
     */
    private String eventName(RawEvent event, boolean subgraphs) {
        String name = isInterruptUpdate(event) ? RawEventType.VALUES.wireName() : event.getType().wireName();
        if (subgraphs && event.hasNamespace()) {
            return name + "|" + String.join("|", event.getNamespace());
        }
        return name;
    }

    private static boolean isInterruptUpdate(RawEvent event) {
        return event.getType() == RawEventType.UPDATES
                && event.getChunk() instanceof Map<?, ?> chunk
                && chunk.containsKey(INTERRUPT_KEY);
    }

    private String writeJson(String eventId, Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("SSE data not serializable, sending text: eventId={}, error={}", eventId, e.getOriginalMessage());
            try {
                return objectMapper.writeValueAsString(String.valueOf(data));
            } catch (JsonProcessingException ex) {
                throw new IllegalStateException("Failed to serialize SSE data: eventId=" + eventId, ex);
            }
        }
    }

    private static RunStatus resolveStatus(Object status) {
        try {
            RunStatus resolved = RunStatus.fromValue(stringOrNull(status));
            return resolved.isTerminal() ? resolved : RunStatus.SUCCESS;
        } catch (IllegalArgumentException e) {
            return RunStatus.SUCCESS;
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
