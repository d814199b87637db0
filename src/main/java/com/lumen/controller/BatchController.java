package com.lumen.controller;

import com.lumen.model.BatchRequest;
import com.lumen.model.GenerateOptions;
import com.lumen.model.Priority;
import com.lumen.model.dto.BatchStatistics;
import com.lumen.model.dto.BatchSubmission;
import com.lumen.runtime.RuntimeRequestFactory;
import com.lumen.service.batch.BatchScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Fire-and-forget batch submission. Results are reported as BATCH_RESPONSE telemetry events.
 */
@Slf4j
@RestController
@RequestMapping("/v1/batch")
public class BatchController {

    private final BatchScheduler batchScheduler;
    private final RuntimeRequestFactory requestFactory;

    public BatchController(BatchScheduler batchScheduler, RuntimeRequestFactory requestFactory) {
        this.batchScheduler = batchScheduler;
        this.requestFactory = requestFactory;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody BatchSubmission submission) {
        GenerateOptions options = GenerateOptions.builder()
                .model(submission.getModel())
                .options(submission.getOptions())
                .priority(submission.getPriority())
                .urgent(false)
                .build();

        String id = batchScheduler.enqueue(BatchRequest.builder()
                .prompt(submission.getPrompt())
                .model(requestFactory.resolveModel(options))
                .options(options)
                .priority(submission.getPriority() != null ? submission.getPriority() : Priority.MEDIUM)
                .build());

        log.info("Accepted batch request {}", id);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("id", id, "status", "queued"));
    }

    @GetMapping("/stats")
    public BatchStatistics stats() {
        return batchScheduler.stats();
    }
}
