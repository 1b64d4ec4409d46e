package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Routes kept for gateways that still call the legacy sidecar paths.
 * Same contract as {@link ExecutionController}.
 */
@RestController
public class SidecarCompatController {

    private final ExecutionDispatcher dispatcher;

    public SidecarCompatController(ExecutionDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/ssh/exec")
    public ResponseEntity<Map<String, String>> exec(@RequestBody ExecutionSubmitRequest request) {
        return ExecutionController.accept(dispatcher, request);
    }

    @GetMapping("/deployments/status")
    public ResponseEntity<?> deploymentStatus(@RequestParam(name = "id", required = false) String id) {
        if (id == null || id.isBlank()) {
            return ResponseEntity.badRequest().body(ExecutionController.error("execution id required (query param id)"));
        }
        return ExecutionController.status(dispatcher, id);
    }
}
