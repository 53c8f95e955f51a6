package com.example.ingestion.controller;

import com.example.ingestion.dto.ProgressResponse;
import com.example.ingestion.exception.ProgressNotFoundException;
import com.example.ingestion.service.ProgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 摄取进度API控制器
 * 
 * <p>客户端建议每2秒轮询一次，读路径只访问持久化状态，不受Worker负载影响。
 * </p>
 */
@RestController
@RequestMapping("/api/v1/ingestion/progress")
public class ProgressController {

    private static final Logger logger = LoggerFactory.getLogger(ProgressController.class);

    private final ProgressService progressService;

    public ProgressController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @GetMapping("/active")
    public ResponseEntity<List<ProgressResponse>> listActive() {
        return ResponseEntity.ok(progressService.listActive());
    }

    @GetMapping("/{subjectId}")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String subjectId) {
        logger.debug("Received progress query for subject {}", subjectId);
        ProgressResponse response = progressService.get(subjectId)
                .orElseThrow(() -> new ProgressNotFoundException(subjectId));
        return ResponseEntity.ok(response);
    }

    /**
     * 客户端确认终态后清理进度记录
     */
    @DeleteMapping("/{subjectId}")
    public ResponseEntity<Void> deleteProgress(@PathVariable String subjectId) {
        progressService.delete(subjectId);
        return ResponseEntity.noContent().build();
    }
}
