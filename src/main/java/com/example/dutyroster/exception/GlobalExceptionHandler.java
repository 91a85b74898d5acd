package com.example.dutyroster.exception;

import com.example.dutyroster.common.ApiResponse;
import com.example.dutyroster.schedule.RotationScheduleDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, Object> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "バリデーションエラー", "VALIDATION_ERROR", "入力データに問題があります", errors, LocalDateTime.now()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        logger.warn("リクエストを解析できませんでした: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "リクエストエラー", "MALFORMED_REQUEST", "リクエストの形式が正しくありません", null, LocalDateTime.now()));
    }

    @ExceptionHandler(InvalidPeriodException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPeriod(InvalidPeriodException ex) {
        logger.warn("ローテーション期間が不正です: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        Object[] params = ex.getParameters();
        details.put("startDate", params.length > 0 ? params[0] : null);
        details.put("endDate", params.length > 1 ? params[1] : null);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "期間エラー", ex.getErrorCode(), ex.getMessage(), details, LocalDateTime.now()));
    }

    @ExceptionHandler(ConfigInconsistencyException.class)
    public ResponseEntity<ErrorResponse> handleConfigInconsistency(ConfigInconsistencyException ex) {
        logger.warn("設定に矛盾があります: {}", ex.getProblems());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "設定エラー", ex.getErrorCode(), ex.getMessage(), Map.of("problems", ex.getProblems()), LocalDateTime.now()));
    }

    @ExceptionHandler(NoCandidateException.class)
    public ResponseEntity<ApiResponse<RotationScheduleDto>> handleNoCandidate(NoCandidateException ex) {
        logger.error("割り当て可能なメンバーがいません: {}", ex.getMessage());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("errorCode", ex.getErrorCode());
        meta.put("assignmentCount", ex.getResult().assignments().size());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.failure(
                "割り当て可能なメンバーがいない枠があります: " + ex.getResult().failure().slot().label(),
                RotationScheduleDto.from(ex.getResult()), meta));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "引数エラー", "INVALID_ARGUMENT", ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                "内部サーバーエラー", "INTERNAL_ERROR", "予期しないエラーが発生しました", null, LocalDateTime.now()));
    }

    public record ErrorResponse(
            String error,
            String errorCode,
            String message,
            Map<String, Object> details,
            LocalDateTime timestamp
    ) {}
}
