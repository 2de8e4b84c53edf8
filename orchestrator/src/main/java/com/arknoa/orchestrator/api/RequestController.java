package com.arknoa.orchestrator.api;

import com.arknoa.orchestrator.api.dto.EventResponse;
import com.arknoa.orchestrator.api.dto.HistoryResponse;
import com.arknoa.orchestrator.api.dto.RequestResponse;
import com.arknoa.orchestrator.api.dto.SubmitRequest;
import com.arknoa.orchestrator.ledger.RequestNotFoundException;
import com.arknoa.orchestrator.model.CompositeResult;
import com.arknoa.orchestrator.model.DigestRequest;
import com.arknoa.orchestrator.service.PipelineOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * REST API for digest requests.
 *
 * POST /requests                 submit a payload for digestion
 * GET  /requests/{id}            current state
 * GET  /requests/{id}/history    stage attempts and their outcomes
 * GET  /requests/{id}/events     retained bus events (audit trail)
 * GET  /requests/{id}/result     composite output once COMPLETED
 * POST /requests/{id}/abort      stop the request
 */
@RestController
@RequestMapping("/requests")
public class RequestController {

    private final PipelineOrchestrator orchestrator;

    public RequestController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Submit a new digest request.
     *
     * Example:
     *   curl -X POST http://localhost:8080/requests \
     *     -H "Content-Type: application/json" \
     *     -d '{"payloadRef":"s3://uploads/repo-4711.tar.gz"}'
     */
    @PostMapping
    public ResponseEntity<RequestResponse> submit(@RequestBody SubmitRequest req) {
        UUID id;
        try {
            id = orchestrator.submit(req.payloadRef());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(RequestResponse.from(orchestrator.status(id)));
    }

    @GetMapping("/{id}")
    public RequestResponse getRequest(@PathVariable UUID id) {
        return RequestResponse.from(find(id));
    }

    @GetMapping("/{id}/history")
    public List<HistoryResponse> getHistory(@PathVariable UUID id) {
        return find(id).history().stream()
                .map(HistoryResponse::from)
                .toList();
    }

    @GetMapping("/{id}/events")
    public List<EventResponse> getEvents(@PathVariable UUID id) {
        try {
            return orchestrator.events(id).stream()
                    .map(EventResponse::from)
                    .toList();
        } catch (RequestNotFoundException e) {
            throw notFound(id, e);
        }
    }

    /**
     * HTTP 200   request COMPLETED, body is the composite result
     * HTTP 202   still running, or FAILED / ABORTED (body carries the state)
     * HTTP 404   unknown id
     */
    @GetMapping("/{id}/result")
    public ResponseEntity<?> getResult(@PathVariable UUID id) {
        Optional<CompositeResult> result;
        try {
            result = orchestrator.result(id);
        } catch (RequestNotFoundException e) {
            throw notFound(id, e);
        }
        if (result.isPresent()) {
            return ResponseEntity.ok(result.get());
        }
        return ResponseEntity.accepted()
                .body(Map.of("status", "pending", "state", find(id).state().label()));
    }

    @PostMapping("/{id}/abort")
    public RequestResponse abort(@PathVariable UUID id) {
        try {
            return RequestResponse.from(orchestrator.abort(id));
        } catch (RequestNotFoundException e) {
            throw notFound(id, e);
        }
    }

    private DigestRequest find(UUID id) {
        try {
            return orchestrator.status(id);
        } catch (RequestNotFoundException e) {
            throw notFound(id, e);
        }
    }

    private static ResponseStatusException notFound(UUID id, RequestNotFoundException cause) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Request not found: " + id, cause);
    }
}
