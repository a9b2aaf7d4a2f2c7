package world.willfrog.agentstream.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应包装，SSE 以外的接口都返回它。
 *
 * @param <T> 响应数据类型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseWrapper<T> {

    private String code;

    private String message;

    private T data;

    private long timestamp;

    public static <T> ResponseWrapper<T> success(T data) {
        return of(ResponseCode.SUCCESS, ResponseCode.SUCCESS.getMessage(), data);
    }

    public static <T> ResponseWrapper<T> error(ResponseCode responseCode, String message) {
        return of(responseCode, message, null);
    }

    public static <T> ResponseWrapper<T> notFound(String message) {
        return of(ResponseCode.DATA_NOT_FOUND, message, null);
    }

    public boolean isSuccess() {
        return ResponseCode.SUCCESS.getCode().equals(code);
    }

    private static <T> ResponseWrapper<T> of(ResponseCode responseCode, String message, T data) {
        return ResponseWrapper.<T>builder()
                .code(responseCode.getCode())
                .message(message)
                .data(data)
                .timestamp(System.currentTimeMillis())
                .build();
    }
}
