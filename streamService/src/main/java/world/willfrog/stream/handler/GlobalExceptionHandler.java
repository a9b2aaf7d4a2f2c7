package world.willfrog.stream.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import world.willfrog.agentstream.common.dto.ResponseCode;
import world.willfrog.agentstream.common.dto.ResponseWrapper;
import world.willfrog.stream.channel.ChannelPublishException;
import world.willfrog.stream.exception.BizException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BizException.class)
    public ResponseWrapper<Void> handleBizException(BizException ex) {
        return ResponseWrapper.error(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class, MissingRequestHeaderException.class})
    public ResponseWrapper<Void> handleBadRequest(Exception ex) {
        return ResponseWrapper.error(ResponseCode.PARAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler({IllegalStateException.class, ChannelPublishException.class})
    public ResponseWrapper<Void> handleUnavailable(RuntimeException ex) {
        log.error("Run stream backend unavailable", ex);
        return ResponseWrapper.error(ResponseCode.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseWrapper<Void> handleOther(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseWrapper.error(ResponseCode.SYSTEM_ERROR, "系统异常，请稍后再试");
    }
}
