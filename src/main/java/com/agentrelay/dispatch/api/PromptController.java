package com.agentrelay.dispatch.api;

import com.agentrelay.core.engine.InvalidRequestException;
import com.agentrelay.core.engine.RunHandle;
import com.agentrelay.core.engine.Supervisor;
import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.routing.SupervisorRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

/**
 * HTTP boundary for prompts: synchronous JSON and newline-delimited JSON streaming.
 */
@RestController
@RequestMapping("/agent")
public class PromptController {

    private static final Logger log = LoggerFactory.getLogger(PromptController.class);

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final Supervisor supervisor;
    private final ObjectMapper objectMapper;

    public PromptController(Supervisor supervisor, ObjectMapper objectMapper) {
        this.supervisor = supervisor;
        this.objectMapper = objectMapper;
    }

    /**
     * POST /agent/prompt: Run a prompt and wait for the aggregated response.
     * Returns 200 on success, 400 for requests that produce no tasks, 502 when tasks failed
     * and 504 when the run deadline forced a partial response.
     */
    @PostMapping("/prompt")
    public ResponseEntity<Map<String, Object>> prompt(@RequestBody PromptRequest request) {
        RunHandle handle;
        try {
            handle = supervisor.submit(toSupervisorRequest(request), RunMode.SYNCHRONOUS, null);
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        AggregatedResult result = supervisor.await(handle);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("response", result.response());
        body.put("session_id", result.runId());
        if (result.isError()) {
            body.put("error", result.outcome().name());
        }
        return ResponseEntity.status(statusFor(result)).body(body);
    }

    /**
     * POST /agent/prompt/stream: One NDJSON line per finished task in completion order,
     * then one line with the aggregated response. Errors arrive as the final line.
     */
    @PostMapping(value = "/prompt/stream", produces = "application/x-ndjson")
    public ResponseEntity<StreamingResponseBody> promptStream(@RequestBody PromptRequest request) {
        RunHandle handle;
        try {
            handle = supervisor.submit(toSupervisorRequest(request), RunMode.STREAMING, null);
        } catch (InvalidRequestException e) {
            Map<String, Object> line = errorLine(e.getMessage(), "INVALID_REQUEST", null);
            return ResponseEntity.badRequest().contentType(NDJSON).body(out -> writeLine(out, line));
        }

        String sessionId = handle.runId();
        StreamingResponseBody body = out -> {
            try (Stream<RunEvent> events = supervisor.stream(handle)) {
                Iterator<RunEvent> it = events.iterator();
                while (it.hasNext()) {
                    writeLine(out, toLine(it.next(), sessionId));
                }
            } catch (IOException e) {
                log.info("Client disconnected from stream {}: {}", sessionId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Stream {} failed: {}", sessionId, e.getMessage(), e);
                writeLine(out, errorLine(e.getMessage(), "INTERNAL_ERROR", sessionId));
            }
        };
        return ResponseEntity.ok().contentType(NDJSON).body(body);
    }

    Map<String, Object> toLine(RunEvent event, String sessionId) {
        Map<String, Object> line = new LinkedHashMap<>();
        if (!event.isFinal()) {
            line.put("response", TaskEventView.from(event));
            line.put("session_id", sessionId);
            return line;
        }
        AggregatedResult result = event.result();
        line.put("response", result.response());
        line.put("session_id", sessionId);
        if (result.isError()) {
            line.put("error", result.outcome().name());
        }
        return line;
    }

    private static Map<String, Object> errorLine(String message, String error, String sessionId) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("response", "Error: " + message);
        if (sessionId != null) {
            line.put("session_id", sessionId);
        }
        line.put("error", error);
        return line;
    }

    private void writeLine(OutputStream out, Map<String, Object> line) throws IOException {
        out.write(objectMapper.writeValueAsString(line).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    private static SupervisorRequest toSupervisorRequest(PromptRequest request) {
        return new SupervisorRequest(request.prompt(), request.urls());
    }

    static HttpStatus statusFor(AggregatedResult result) {
        return switch (result.outcome()) {
            case COMPLETED, COMPLETED_PARTIAL -> HttpStatus.OK;
            case TASK_FAILED, ALL_TASKS_FAILED -> HttpStatus.BAD_GATEWAY;
            case DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }
}
