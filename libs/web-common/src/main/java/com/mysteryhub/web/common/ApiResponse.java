package com.mysteryhub.web.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    /**
     * 响应状态码（与 HTTP 状态码一致）
     * 200: 成功
     * 400: 参数错误
     * 403: 无权限（如非房主操作）
     * 404: 资源不存在
     * 409: 冲突（业务状态不允许）
     * 500: 服务器错误
     */
    int code,

    /**
     * 机器可读的错误类型（如 CHARACTER_TAKEN），成功时为 null
     */
    String error,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据；失败时可携带错误细节
     */
    T data
) implements Serializable {

    public boolean isSuccess() {
        return code == 200;
    }

    /**
     * 成功响应（无数据）
     */
    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, null, "success", null);
    }

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, null, "success", data);
    }

    /**
     * 成功响应（带消息和数据）
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(200, null, message, data);
    }

    /**
     * 失败响应（带错误类型）
     */
    public static <T> ApiResponse<T> error(int code, String error, String message) {
        return new ApiResponse<>(code, error, message, null);
    }

    /**
     * 失败响应（带错误类型和细节）
     */
    public static <T> ApiResponse<T> error(int code, String error, String message, T details) {
        return new ApiResponse<>(code, error, message, details);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, "INVALID_ARGUMENT", message, null);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, "NOT_FOUND", message, null);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, "CONFLICT", message, null);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, "INTERNAL_ERROR", message, null);
    }
}
