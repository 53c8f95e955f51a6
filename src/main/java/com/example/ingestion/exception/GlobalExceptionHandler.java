package com.example.ingestion.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * 
 * <p>把领域异常映射为统一的JSON错误响应：
 * <ul>
 *   <li>校验失败、非法参数 - 400</li>
 *   <li>任务或进度不存在 - 404</li>
 *   <li>重复活动任务、不可取消、仍在进行中的进度不可删除 - 409</li>
 *   <li>其他 - 500</li>
 * </ul>
 * </p>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({TaskNotFoundException.class, ProgressNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        logger.warn("Resource not found: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(DuplicateActiveJobException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateActiveJob(DuplicateActiveJobException e) {
        logger.warn("Rejected duplicate submission: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Active ingestion task exists", e.getMessage());
    }

    @ExceptionHandler(TaskNotCancellableException.class)
    public ResponseEntity<ErrorResponse> handleNotCancellable(TaskNotCancellableException e) {
        logger.warn("Cancel rejected: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Task not cancellable", e.getMessage());
    }

    /**
     * 删除仍在进行中的进度记录等非法状态操作
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        logger.warn("Illegal state: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Conflict", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        logger.warn("Validation error: {}", e.getMessage());

        Map<String, String> errors = new LinkedHashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String name = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(name, error.getDefaultMessage());
        });

        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        logger.warn("Illegal argument: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid argument", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unexpected error occurred", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                e.getMessage() != null ? e.getMessage() : "An unexpected error occurred");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message, details));
    }

    /**
     * 错误响应DTO
     * 
     * @param status HTTP状态码
     * @param message 错误类型消息
     * @param details 详细错误信息
     */
    public record ErrorResponse(int status, String message, String details) {
    }
}
