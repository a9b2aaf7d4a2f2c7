package world.willfrog.agentstream.common.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行引擎产出的一条原始事件。
 * <p>
 * 类型在构造时就已确定，后续的存储、转发、SSE 转换都按 {@link RawEventType} 分派。
 * 只有 {@link RawEventType#END} 是终止事件；error 事件之后总会跟一条 status=error 的 end。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RawEvent {

    private final RawEventType type;
    private final Object chunk;
    private final Object metadata;
    private final List<String> namespace;
    private final RunStatus status;
    private final Object finalOutput;
    private final String errorKind;
    private final String errorMessage;

    public static RawEvent values(Object chunk) {
        return chunk(RawEventType.VALUES, chunk);
    }

    public static RawEvent updates(Object chunk) {
        return chunk(RawEventType.UPDATES, chunk);
    }

    public static RawEvent debug(Object chunk) {
        return chunk(RawEventType.DEBUG, chunk);
    }

    public static RawEvent custom(Object chunk) {
        return chunk(RawEventType.CUSTOM, chunk);
    }

    public static RawEvent messages(Object chunk, Object metadata) {
        return new RawEvent(RawEventType.MESSAGES, chunk, metadata, List.of(), null, null, null, null);
    }

    public static RawEvent end(RunStatus status, Object finalOutput) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("end event requires a terminal status, got " + status);
        }
        return new RawEvent(RawEventType.END, null, null, List.of(), status, finalOutput, null, null);
    }

    public static RawEvent error(String kind, String message) {
        String resolvedKind = kind == null || kind.isBlank() ? "Error" : kind;
        return new RawEvent(RawEventType.ERROR, null, null, List.of(), null, null, resolvedKind, message);
    }

    private static RawEvent chunk(RawEventType type, Object chunk) {
        return new RawEvent(type, chunk, null, List.of(), null, null, null, null);
    }

    public RawEvent withNamespace(List<String> path) {
        List<String> copy = path == null ? List.of() : List.copyOf(path);
        return new RawEvent(type, chunk, metadata, copy, status, finalOutput, errorKind, errorMessage);
    }

    public boolean isTerminal() {
        return type == RawEventType.END;
    }

    public boolean hasNamespace() {
        return !namespace.isEmpty();
    }

    /**
     * 转成跨进程传输用的 tuple：{@code (type, body, namespace)}。
     */
    public Tuple toWire() {
        Object body = switch (type) {
            case MESSAGES -> Tuple.of(chunk, metadata);
            case END -> {
                Map<String, Object> end = new LinkedHashMap<>();
                end.put("status", status.value());
                end.put("final_output", finalOutput);
                yield end;
            }
            case ERROR -> {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("error", errorKind);
                error.put("message", errorMessage);
                yield error;
            }
            default -> chunk;
        };
        return Tuple.of(type.wireName(), body, hasNamespace() ? new ArrayList<>(namespace) : null);
    }

    public static RawEvent fromWire(Object wire) {
        if (!(wire instanceof Tuple tuple) || tuple.size() < 2) {
            throw new IllegalArgumentException("raw event wire form must be a tuple (type, body[, namespace]), got " + wire);
        }
        RawEventType type = RawEventType.fromWireName(String.valueOf(tuple.get(0)));
        Object body = tuple.get(1);
        RawEvent event = switch (type) {
            case MESSAGES -> {
                if (body instanceof Tuple pair && pair.size() == 2) {
                    yield messages(pair.get(0), pair.get(1));
                }
                yield messages(body, null);
            }
            case END -> {
                Map<?, ?> endBody = asMap(body, type);
                yield end(RunStatus.fromValue(String.valueOf(endBody.get("status"))), endBody.get("final_output"));
            }
            case ERROR -> {
                Map<?, ?> errorBody = asMap(body, type);
                Object kind = errorBody.get("error");
                Object message = errorBody.get("message");
                yield error(kind == null ? null : String.valueOf(kind), message == null ? null : String.valueOf(message));
            }
            default -> chunk(type, body);
        };
        if (tuple.size() > 2 && tuple.get(2) instanceof List<?> path) {
            List<String> namespace = new ArrayList<>(path.size());
            for (Object segment : path) {
                namespace.add(String.valueOf(segment));
            }
            event = event.withNamespace(namespace);
        }
        return event;
    }

    private static Map<?, ?> asMap(Object body, RawEventType type) {
        if (body instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException(type.wireName() + " event body must be a map, got " + body);
    }
}
