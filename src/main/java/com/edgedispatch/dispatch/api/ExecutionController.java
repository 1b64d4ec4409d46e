package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionDispatcher;
import com.edgedispatch.core.execution.ExecutionNotFoundException;
import com.edgedispatch.core.execution.ExecutionValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for remote executions.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final ExecutionDispatcher dispatcher;

    public ExecutionController(ExecutionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * POST /api/v1/executions: Submit a command or deployment. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody ExecutionSubmitRequest request) {
        return accept(dispatcher, request);
    }

    /**
     * GET /api/v1/executions: List all tracked executions, newest first.
     */
    @GetMapping
    public ResponseEntity<List<ExecutionResponse>> list() {
        return ResponseEntity.ok(dispatcher.listExecutions().stream()
                .map(ExecutionResponse::from)
                .toList());
    }

    /**
     * GET /api/v1/executions/{id}: Current status, output and error of one execution.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        return status(dispatcher, id);
    }

    static ResponseEntity<Map<String, String>> accept(ExecutionDispatcher dispatcher, ExecutionSubmitRequest request) {
        String executionId;
        try {
            executionId = dispatcher.dispatch(request != null ? request.toExecutionRequest() : null);
        } catch (ExecutionValidationException e) {
            log.debug("Rejected execution request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        }
        return ResponseEntity.accepted().body(Map.of(
                "execution_id", executionId,
                "status", "accepted",
                "message", "Command dispatched"
        ));
    }

    static ResponseEntity<?> status(ExecutionDispatcher dispatcher, String id) {
        try {
            return ResponseEntity.ok(ExecutionResponse.from(dispatcher.getStatus(id)));
        } catch (ExecutionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("execution id not found"));
        }
    }

    static Map<String, String> error(String message) {
        return Map.of("error", message, "status", "error");
    }
}
