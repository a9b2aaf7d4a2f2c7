package world.willfrog.stream.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import world.willfrog.agentstream.common.dto.ResponseCode;
import world.willfrog.agentstream.common.dto.ResponseWrapper;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.agentstream.common.sse.SseFrame;
import world.willfrog.stream.exception.BizException;
import world.willfrog.stream.model.RunCancelResponse;
import world.willfrog.stream.model.RunEventInfo;
import world.willfrog.stream.model.StreamRun;
import world.willfrog.stream.service.RunEventStore;
import world.willfrog.stream.service.RunEventStream;
import world.willfrog.stream.service.RunStreamService;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunStreamController {

    static final String LAST_EVENT_ID_HEADER = "Last-Event-ID";

    private final RunStreamService streamService;
    private final RunEventStore eventStore;

    /**
     * 订阅 Run 事件流；带 Last-Event-ID 时只回放其后的事件。
     */
    @GetMapping(value = "/{runId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<StreamingResponseBody> stream(@PathVariable("runId") String runId,
                                                        @RequestParam(value = "threadId", required = false) String threadId,
                                                        @RequestParam(value = "subgraphs", defaultValue = "false") boolean subgraphs,
                                                        @RequestHeader(value = LAST_EVENT_ID_HEADER, required = false) String lastEventId) {
        RunEventStream stream = streamService.streamRunExecution(new StreamRun(runId, threadId, subgraphs), lastEventId);
        StreamingResponseBody body = out -> writeFrames(runId, stream, out);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(body);
    }

    @PostMapping("/{runId}/cancel")
    public ResponseWrapper<RunCancelResponse> cancel(@PathVariable("runId") String runId,
                                                     @RequestParam(value = "action", defaultValue = "cancel") String action,
                                                     @RequestParam(value = "wait", defaultValue = "false") boolean wait) {
        boolean wasRunning = switch (action) {
            case "cancel" -> streamService.cancelRun(runId, wait);
            case "interrupt" -> streamService.interruptRun(runId, wait);
            default -> throw new BizException(ResponseCode.PARAM_ERROR, "action must be cancel or interrupt: " + action);
        };
        String status = streamService.resolveFinalStatus(runId).map(RunStatus::value).orElse(null);
        return ResponseWrapper.success(new RunCancelResponse(runId, action, wasRunning, status));
    }

    @GetMapping("/{runId}/events/info")
    public ResponseWrapper<RunEventInfo> info(@PathVariable("runId") String runId) {
        return eventStore.getRunInfo(runId)
                .map(ResponseWrapper::success)
                .orElseGet(() -> ResponseWrapper.notFound("No events for run: " + runId));
    }

    private void writeFrames(String runId, RunEventStream stream, OutputStream out) throws IOException {
        try (stream) {
            while (stream.hasNext()) {
                SseFrame frame = stream.next();
                out.write(frame.format().getBytes(StandardCharsets.UTF_8));
                out.flush();
            }
        } finally {
            log.debug("Run stream closed: runId={}", runId);
        }
    }
}
