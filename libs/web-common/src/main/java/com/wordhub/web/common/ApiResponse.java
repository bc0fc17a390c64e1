package com.wordhub.web.common;

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
     * 响应状态码（与 HTTP 状态保持一致）
     * 200: 成功
     * 400: 非法走子（落点/字架/单词/换牌/质疑）
     * 404: 房间或机器人不存在
     * 409: 冲突（房间已满、非本方回合、对局未进行）
     * 503: 词典服务不可用（调用方可重试）
     */
    int code,

    /**
     * 业务错误码（如 NOT_YOUR_TURN），成功时为空
     */
    String errorCode,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

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
     * 失败响应（带业务错误码）
     */
    public static <T> ApiResponse<T> failure(int code, String errorCode, String message) {
        return new ApiResponse<>(code, errorCode, message, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, null, message, null);
    }

    /**
     * 失败响应（404 Not Found）
     */
    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, null, message, null);
    }

    /**
     * 失败响应（409 Conflict）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, null, message, null);
    }

    /**
     * 失败响应（500 Internal Server Error）
     */
    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, null, message, null);
    }

    /** 是否成功 */
    public boolean ok() {
        return code == 200;
    }
}
