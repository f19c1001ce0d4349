package com.saddlery.auth.api;

import com.saddlery.auth.exception.BusinessException;
import com.saddlery.auth.exception.ErrorCode;
import com.saddlery.auth.exception.ErrorKind;
import com.saddlery.auth.token.InvalidTokenException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常统一返回，状态码由 {@link ErrorCode} 决定：
     * - 带字段的错误：{status, errors:{field: reason}}；
     * - 未授权：{status, message}；
     * - 其余：{status, error: reason}。
     *
     * @param ex 业务异常，包含错误码与可选明细。
     * @return 响应体。
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusiness(BusinessException ex) {
        ErrorCode code = ex.getErrorCode();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", code.getStatus().value());
        if (code.getKind() == ErrorKind.UNAUTHORIZED) {
            body.put("message", ex.reasonCode());
        } else if (code.getField() != null) {
            body.put("errors", Map.of(code.getField(), ex.reasonCode()));
        } else {
            body.put("error", ex.reasonCode());
        }
        return ResponseEntity.status(code.getStatus()).body(body);
    }

    /**
     * 访问令牌声明缺失或格式不合法：HTTP 401。
     *
     * @param ex 令牌异常。
     * @return 响应体：status/message。
     */
    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidToken(InvalidTokenException ex) {
        log.debug("Access token rejected: {}", ex.getMessage());
        return handleBusiness(new BusinessException(ErrorCode.UNAUTHORIZED));
    }

    /**
     * 参数校验失败（@Valid）统一返回：HTTP 422，逐字段给出提示。
     *
     * @param ex Spring 的方法参数校验异常。
     * @return 响应体：status/errors。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        return unprocessable(errors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getConstraintViolations().forEach(v -> errors.putIfAbsent(v.getPropertyPath().toString(), v.getMessage()));
        return unprocessable(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return unprocessable(Map.of("body", "请求体格式错误"));
    }

    /**
     * 未处理异常统一返回：HTTP 500。
     * 记录错误日志并返回通用提示。
     *
     * @param ex 未捕获的异常。
     * @return 响应体：status/message。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.INTERNAL_SERVER_ERROR.value());
        body.put("message", "服务异常，请稍后重试");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<Map<String, Object>> unprocessable(Map<String, String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", HttpStatus.UNPROCESSABLE_ENTITY.value());
        body.put("errors", errors);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }
}
