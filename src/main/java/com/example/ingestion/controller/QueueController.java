package com.example.ingestion.controller;

import com.example.ingestion.dto.QueueStatsResponse;
import com.example.ingestion.dto.QueuedTaskResponse;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.service.QueueService;
import com.example.ingestion.worker.QueueWorker;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 队列与Worker状态查询
 */
@RestController
@RequestMapping("/api/v1/ingestion/queue")
public class QueueController {

    private final QueueService queueService;
    private final QueueWorker queueWorker;

    public QueueController(QueueService queueService, QueueWorker queueWorker) {
        this.queueService = queueService;
        this.queueWorker = queueWorker;
    }

    @GetMapping("/stats")
    public ResponseEntity<QueueStatsResponse> stats() {
        return ResponseEntity.ok(queueService.stats());
    }

    @GetMapping("/tasks")
    public ResponseEntity<List<QueuedTaskResponse>> queuedTasks() {
        return ResponseEntity.ok(queueService.listQueued().stream().map(QueuedTaskResponse::from).toList());
    }

    @GetMapping("/worker")
    public ResponseEntity<WorkerStatusResponse> worker() {
        return ResponseEntity.ok(queueWorker.status());
    }
}
