package com.arknoa.orchestrator.api;

import com.arknoa.orchestrator.api.dto.RegisterStageRequest;
import com.arknoa.orchestrator.api.dto.StageResponse;
import com.arknoa.orchestrator.stage.ConfigurationException;
import com.arknoa.orchestrator.stage.StageRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for the stage registry.
 *
 * GET /stages           the pipeline in execution order
 * PUT /stages/{name}    add a stage or replace its descriptor; takes effect on
 *                       the next dispatch, no restart
 */
@RestController
@RequestMapping("/stages")
public class StageController {

    private final StageRegistry registry;

    public StageController(StageRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<StageResponse> list() {
        return registry.pipeline().stream()
                .map(StageResponse::from)
                .toList();
    }

    @PutMapping("/{name}")
    public StageResponse register(@PathVariable String name, @RequestBody RegisterStageRequest req) {
        try {
            return StageResponse.from(registry.register(req.toDescriptor(name)));
        } catch (ConfigurationException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
