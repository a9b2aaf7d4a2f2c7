package world.willfrog.agentstream.common.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import world.willfrog.agentstream.common.model.Tuple;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 跨进程载荷编解码。
 * <p>
 * 每个值都包成带 {@code __type__} 标签的 JSON 结构，解码时按标签还原原始形态，
 * tuple 与 list 不会互相混淆。数值额外记录 {@code numeric} 子类型，解码后 Java 类型不变；
 * BigInteger 与 BigDecimal 以字符串承载，不丢精度。无法按结构转换的对象退化成 opaque 字符串。
 */
@Slf4j
public class WirePayloadCodec {

    public static final String TYPE_FIELD = "__type__";
    public static final String ITEMS_FIELD = "items";
    public static final String VALUE_FIELD = "value";
    public static final String ENCODING_FIELD = "encoding";
    public static final String NUMERIC_FIELD = "numeric";

    private static final String BASE64_ENCODING = "base64";
    private static final String STRING_ENCODING = "string";

    private final ObjectMapper objectMapper;

    public WirePayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Object encode(Object value) {
        if (value instanceof Tuple tuple) {
            return tagged(WireType.TUPLE, ITEMS_FIELD, encodeAll(tuple.items()));
        }
        if (value instanceof Number number) {
            return encodeNumber(number);
        }
        if (value == null || isScalar(value)) {
            Object scalar = value instanceof Character ch ? String.valueOf(ch) : value;
            return tagged(WireType.SCALAR, VALUE_FIELD, scalar);
        }
        if (value instanceof byte[] bytes) {
            Map<String, Object> opaque = tagged(WireType.OPAQUE, VALUE_FIELD, Base64.getEncoder().encodeToString(bytes));
            opaque.put(ENCODING_FIELD, BASE64_ENCODING);
            return opaque;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> items = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                items.put(String.valueOf(entry.getKey()), encode(entry.getValue()));
            }
            return tagged(WireType.MAP, ITEMS_FIELD, items);
        }
        if (value instanceof Collection<?> collection) {
            return tagged(WireType.LIST, ITEMS_FIELD, encodeAll(collection));
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(encode(Array.get(value, i)));
            }
            return tagged(WireType.LIST, ITEMS_FIELD, items);
        }
        return encodeConverted(value);
    }

    public Object decode(Object encoded) {
        if (!(encoded instanceof Map<?, ?> map)) {
            return encoded;
        }
        WireType type = WireType.fromTag(map.get(TYPE_FIELD));
        if (type == null) {
            return decodeUntagged(map);
        }
        return switch (type) {
            case TUPLE -> Tuple.fromList(decodeAll(map.get(ITEMS_FIELD)));
            case LIST -> decodeAll(map.get(ITEMS_FIELD));
            case MAP -> decodeMap(map.get(ITEMS_FIELD));
            case SCALAR -> decodeScalar(map);
            case OPAQUE -> decodeOpaque(map);
        };
    }

    public String encodeToJson(Object value) {
        try {
            return objectMapper.writeValueAsString(encode(value));
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to write wire payload: " + e.getOriginalMessage(), e);
        }
    }

    public Object decodeFromJson(String json) {
        try {
            return decode(objectMapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to read wire payload: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Object> encodeNumber(Number number) {
        String numeric = numericTag(number);
        Object value = number instanceof BigInteger || number instanceof BigDecimal ? number.toString() : number;
        Map<String, Object> scalar = tagged(WireType.SCALAR, VALUE_FIELD, value);
        if (numeric != null) {
            scalar.put(NUMERIC_FIELD, numeric);
        }
        return scalar;
    }

    private static String numericTag(Number number) {
        if (number instanceof Integer) {
            return "int";
        }
        if (number instanceof Long) {
            return "long";
        }
        if (number instanceof Short) {
            return "short";
        }
        if (number instanceof Byte) {
            return "byte";
        }
        if (number instanceof Float) {
            return "float";
        }
        if (number instanceof Double) {
            return "double";
        }
        if (number instanceof BigInteger) {
            return "bigint";
        }
        if (number instanceof BigDecimal) {
            return "decimal";
        }
        return null;
    }

    private static Object decodeScalar(Map<?, ?> map) {
        Object value = map.get(VALUE_FIELD);
        Object numeric = map.get(NUMERIC_FIELD);
        if (numeric == null || value == null) {
            return value;
        }
        try {
            return switch (String.valueOf(numeric)) {
                case "int" -> toNumber(value).intValue();
                case "long" -> toNumber(value).longValue();
                case "short" -> toNumber(value).shortValue();
                case "byte" -> toNumber(value).byteValue();
                case "float" -> toNumber(value).floatValue();
                case "double" -> toNumber(value).doubleValue();
                case "bigint" -> new BigInteger(String.valueOf(value));
                case "decimal" -> new BigDecimal(String.valueOf(value));
                default -> value;
            };
        } catch (NumberFormatException e) {
            throw new WireFormatException("Invalid " + numeric + " scalar in wire payload: " + value, e);
        }
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        // NaN 与 Infinity 在 JSON 里是字符串
        return Double.valueOf(String.valueOf(value));
    }

    private Object encodeConverted(Object value) {
        Object converted;
        try {
            converted = objectMapper.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            log.debug("Wire payload falls back to opaque string: type={}, reason={}",
                    value.getClass().getName(), e.getMessage());
            Map<String, Object> opaque = tagged(WireType.OPAQUE, VALUE_FIELD, String.valueOf(value));
            opaque.put(ENCODING_FIELD, STRING_ENCODING);
            return opaque;
        }
        if (converted != null && converted.getClass() == value.getClass()) {
            // convertValue 原样返回时按字符串处理，避免无限递归
            Map<String, Object> opaque = tagged(WireType.OPAQUE, VALUE_FIELD, String.valueOf(value));
            opaque.put(ENCODING_FIELD, STRING_ENCODING);
            return opaque;
        }
        return encode(converted);
    }

    private List<Object> encodeAll(Collection<?> values) {
        List<Object> items = new ArrayList<>(values.size());
        for (Object item : values) {
            items.add(encode(item));
        }
        return items;
    }

    private List<Object> decodeAll(Object items) {
        if (!(items instanceof Collection<?> collection)) {
            throw new WireFormatException("Wire items must be an array, got " + items);
        }
        List<Object> decoded = new ArrayList<>(collection.size());
        for (Object item : collection) {
            decoded.add(decode(item));
        }
        return decoded;
    }

    private Map<String, Object> decodeMap(Object items) {
        if (!(items instanceof Map<?, ?> map)) {
            throw new WireFormatException("Wire map items must be an object, got " + items);
        }
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            decoded.put(String.valueOf(entry.getKey()), decode(entry.getValue()));
        }
        return decoded;
    }

    private Map<String, Object> decodeUntagged(Map<?, ?> map) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (TYPE_FIELD.equals(entry.getKey())) {
                continue;
            }
            decoded.put(String.valueOf(entry.getKey()), decode(entry.getValue()));
        }
        return decoded;
    }

    private Object decodeOpaque(Map<?, ?> map) {
        Object value = map.get(VALUE_FIELD);
        if (BASE64_ENCODING.equals(map.get(ENCODING_FIELD)) && value instanceof String text) {
            try {
                return Base64.getDecoder().decode(text);
            } catch (IllegalArgumentException e) {
                throw new WireFormatException("Invalid base64 in opaque wire payload", e);
            }
        }
        return value;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof Character;
    }

    private static Map<String, Object> tagged(WireType type, String field, Object payload) {
        Map<String, Object> tagged = new LinkedHashMap<>();
        tagged.put(TYPE_FIELD, type.tag());
        tagged.put(field, payload);
        return tagged;
    }
}
