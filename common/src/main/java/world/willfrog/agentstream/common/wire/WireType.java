package world.willfrog.agentstream.common.wire;

import java.util.Locale;

/**
 * 编码后载荷的形态标签，写在 {@code __type__} 字段里。
 */
public enum WireType {
    TUPLE,
    LIST,
    MAP,
    SCALAR,
    OPAQUE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 未知标签返回 null，由调用方走兜底解码。
     */
    public static WireType fromTag(Object tag) {
        if (!(tag instanceof String text)) {
            return null;
        }
        for (WireType type : values()) {
            if (type.tag().equals(text)) {
                return type;
            }
        }
        return null;
    }
}
