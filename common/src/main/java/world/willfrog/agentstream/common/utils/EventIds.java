package world.willfrog.agentstream.common.utils;

import java.util.OptionalLong;

/**
 * 事件 ID 工具。
 * <p>
 * 事件 ID 固定为 {@code {runId}_event_{n}}，序号只在这里解析，
 * 实时计数器和事件日志共用同一套规则。
 */
public final class EventIds {

    public static final String SEQ_SEPARATOR = "_event_";

    private EventIds() {
    }

    public static String format(String runId, long seq) {
        return runId + SEQ_SEPARATOR + seq;
    }

    /**
     * 解析事件序号：取最后一个 {@code _event_} 之后的数字。
     * 没有分隔符、后缀为空、非数字或为负数时返回空。
     */
    public static OptionalLong parseSeq(String eventId) {
        if (eventId == null) {
            return OptionalLong.empty();
        }
        int idx = eventId.lastIndexOf(SEQ_SEPARATOR);
        if (idx < 0) {
            return OptionalLong.empty();
        }
        String suffix = eventId.substring(idx + SEQ_SEPARATOR.length());
        if (suffix.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            long seq = Long.parseLong(suffix);
            return seq < 0 ? OptionalLong.empty() : OptionalLong.of(seq);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    public static long parseSeqOrDefault(String eventId, long defaultSeq) {
        return parseSeq(eventId).orElse(defaultSeq);
    }
}
