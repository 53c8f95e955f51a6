package com.example.ingestion.controller;

import com.example.ingestion.dto.CancelTaskResponse;
import com.example.ingestion.dto.SubmitIngestionRequest;
import com.example.ingestion.dto.SubmitIngestionResponse;
import com.example.ingestion.service.IngestionSubmissionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 摄取任务API控制器
 * 
 * <ul>
 *   <li>POST /api/v1/ingestion/jobs - 提交摄取任务，立即返回taskId和排队位置</li>
 *   <li>DELETE /api/v1/ingestion/jobs/{taskId} - 取消排队中的任务</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/ingestion/jobs")
public class IngestionJobController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionJobController.class);

    private final IngestionSubmissionService submissionService;

    public IngestionJobController(IngestionSubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping
    public ResponseEntity<SubmitIngestionResponse> submit(@Valid @RequestBody SubmitIngestionRequest request) {
        logger.info("Received ingestion request for subject {} with {} files",
                request.subjectId(), request.selectedFiles().size());

        SubmitIngestionResponse response = submissionService.submit(request);

        logger.info("Ingestion task queued: taskId={}, position={}", response.taskId(), response.queuePosition());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<CancelTaskResponse> cancel(@PathVariable String taskId) {
        logger.info("Received cancel request for task {}", taskId);
        return ResponseEntity.ok(submissionService.cancel(taskId));
    }
}
