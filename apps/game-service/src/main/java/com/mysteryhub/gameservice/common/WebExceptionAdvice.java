package com.mysteryhub.gameservice.common;

import com.mysteryhub.gameservice.games.mystery.domain.exception.GameError;
import com.mysteryhub.gameservice.games.mystery.domain.exception.GameException;
import com.mysteryhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 业务异常：按错误类型映射 HTTP 状态，响应体带机器可读的 error 与细节
     */
    @ExceptionHandler(GameException.class)
    public ResponseEntity<ApiResponse<Object>> game(GameException e) {
        HttpStatus status = e.getError().status();
        Object details = e.getDetails().isEmpty() ? null : e.getDetails();
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status.value(), e.getError().name(), e.getMessage(), details));
    }

    /**
     * 请求体校验失败（@Valid）。
     * @return HTTP 400，data 为 字段 -> 错误信息
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(ApiResponse.error(HttpStatus.BAD_REQUEST.value(),
                GameError.INVALID_ARGUMENT.name(), "请求参数不合法", fields));
    }

    /**
     * 缺少查询参数或请求体无法解析。
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Object>> unreadable(Exception e) {
        return ResponseEntity.badRequest().body(ApiResponse.error(HttpStatus.BAD_REQUEST.value(),
                GameError.INVALID_ARGUMENT.name(), "请求格式不正确"));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理非法状态异常（IllegalStateException）。
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        log.warn("非法状态: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
