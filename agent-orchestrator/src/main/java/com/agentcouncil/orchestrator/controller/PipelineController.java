package com.agentcouncil.orchestrator.controller;

import com.agentcouncil.common.exception.ErrorType;
import com.agentcouncil.common.exception.PipelineError;
import com.agentcouncil.common.exception.PipelineException;
import com.agentcouncil.orchestrator.pipeline.PipelineDriver;
import com.agentcouncil.orchestrator.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineDriver pipelineDriver;

    public PipelineController(PipelineDriver pipelineDriver) {
        this.pipelineDriver = pipelineDriver;
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<PipelineResult>> run(@RequestBody PipelineRequest request) {
        return pipelineDriver.run(request.instrumentId(), request.seed()).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<PipelineError> onPipelineError(PipelineException e) {
        HttpStatus status = e.getErrorType() == ErrorType.CONFIGURATION
            ? HttpStatus.INTERNAL_SERVER_ERROR
            : HttpStatus.UNPROCESSABLE_ENTITY;
        log.warn("Pipeline run rejected. type={} unit={} status={}", e.getErrorType(), e.getUnitName(), status.value());
        return ResponseEntity.status(status).body(e.toError());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<PipelineError> onBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(new PipelineError(ErrorType.CONFIGURATION, e.getMessage(), "request", List.of()));
    }
}
