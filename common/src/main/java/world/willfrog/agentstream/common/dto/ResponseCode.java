package world.willfrog.agentstream.common.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 统一响应状态码
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    SUCCESS("200", "成功"),

    PARAM_ERROR("400", "参数错误"),

    /**
     * Run 或其事件不存在
     */
    DATA_NOT_FOUND("404", "数据未找到"),

    SYSTEM_ERROR("500", "系统内部错误"),

    /**
     * 事件日志或通道后端不可用
     */
    SERVICE_UNAVAILABLE("503", "服务不可用");

    private final String code;

    private final String message;
}
