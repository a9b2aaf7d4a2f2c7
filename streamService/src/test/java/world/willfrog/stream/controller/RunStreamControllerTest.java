package world.willfrog.stream.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.stream.handler.GlobalExceptionHandler;
import world.willfrog.stream.model.StreamRun;
import world.willfrog.stream.service.RunEventStore;
import world.willfrog.stream.service.RunEventStream;
import world.willfrog.stream.service.RunStreamService;
import world.willfrog.stream.support.RunStreamFixture;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class RunStreamControllerTest {

    @Mock
    private RunStreamService streamService;
    @Mock
    private RunEventStore eventStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RunStreamController(streamService, eventStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void cancel_shouldReturnFinalStatus() throws Exception {
        when(streamService.cancelRun("r1", false)).thenReturn(true);
        when(streamService.resolveFinalStatus("r1")).thenReturn(Optional.of(RunStatus.INTERRUPTED));

        mockMvc.perform(post("/api/runs/r1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("200"))
                .andExpect(jsonPath("$.data.action").value("cancel"))
                .andExpect(jsonPath("$.data.wasRunning").value(true))
                .andExpect(jsonPath("$.data.status").value("interrupted"));
    }

    @Test
    void cancel_shouldRouteInterruptWithWait() throws Exception {
        when(streamService.resolveFinalStatus("r1")).thenReturn(Optional.of(RunStatus.ERROR));

        mockMvc.perform(post("/api/runs/r1/cancel").param("action", "interrupt").param("wait", "true"))
                .andExpect(jsonPath("$.data.status").value("error"));

        verify(streamService).interruptRun("r1", true);
    }

    @Test
    void cancel_shouldRejectUnknownAction() throws Exception {
        mockMvc.perform(post("/api/runs/r1/cancel").param("action", "pause"))
                .andExpect(jsonPath("$.code").value("400"));
    }

    @Test
    void info_shouldReportMissingRun() throws Exception {
        when(eventStore.getRunInfo("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/runs/missing/events/info").accept(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.code").value("404"));
    }

    @Test
    void stream_shouldWriteSseFrames() throws Exception {
        RunStreamFixture fixture = new RunStreamFixture();
        fixture.streamService.emit("r1", RawEvent.values(1));
        fixture.streamService.emit("r1", RawEvent.end(RunStatus.SUCCESS, null));
        RunEventStream stream = fixture.streamService.streamRunExecution(StreamRun.of("r1"), "r1_event_1");
        when(streamService.streamRunExecution(any(StreamRun.class), any())).thenReturn(stream);

        ResponseEntity<StreamingResponseBody> response = new RunStreamController(streamService, eventStore)
                .stream("r1", null, false, "r1_event_1");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        response.getBody().writeTo(out);

        assertEquals(MediaType.TEXT_EVENT_STREAM, response.getHeaders().getContentType());
        assertEquals("event: end\ndata: {\"status\":\"success\"}\nid: r1_event_2\n\n",
                out.toString(StandardCharsets.UTF_8));
    }
}
