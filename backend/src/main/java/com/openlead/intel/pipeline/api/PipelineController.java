package com.openlead.intel.pipeline.api;

import com.openlead.intel.pipeline.model.PipelineRunRequest;
import com.openlead.intel.pipeline.model.PipelineRunResult;
import com.openlead.intel.pipeline.model.PipelineRunStartResponse;
import com.openlead.intel.pipeline.service.PipelineRunService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {
    private final PipelineRunService runService;

    public PipelineController(PipelineRunService runService) {
        this.runService = runService;
    }

    @PostMapping("/run")
    public PipelineRunResult run(@RequestBody(required = false) PipelineRunRequest request) {
        return runService.run(request);
    }

    @PostMapping("/runs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public PipelineRunStartResponse start(@RequestBody(required = false) PipelineRunRequest request) {
        return runService.startAsync(request);
    }

    @GetMapping("/runs/{id}")
    public PipelineRunResult status(@PathVariable("id") String runId) {
        return runService.find(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown pipeline run: " + runId));
    }

    @PostMapping("/runs/{id}/cancel")
    public PipelineRunResult cancel(@PathVariable("id") String runId) {
        return runService.cancel(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown pipeline run: " + runId));
    }
}
