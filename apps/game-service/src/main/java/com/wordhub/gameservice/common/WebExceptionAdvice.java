package com.wordhub.gameservice.common;

import com.wordhub.gameservice.games.scrabble.domain.exception.GameException;
import com.wordhub.gameservice.games.scrabble.domain.exception.RoomStateCorruptedException;
import com.wordhub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 业务异常：HTTP 状态取自错误码（400/404/409/503），响应体带错误码。
     */
    @ExceptionHandler(GameException.class)
    public ResponseEntity<ApiResponse<Object>> game(GameException e) {
        int status = e.getCode().httpStatus();
        return ResponseEntity.status(status).body(ApiResponse.failure(status, e.getCode().name(), e.getMessage()));
    }

    /**
     * 房间内部状态损坏：房间已被中止，对外只返回 500。
     */
    @ExceptionHandler(RoomStateCorruptedException.class)
    public ResponseEntity<ApiResponse<Object>> corrupted(RoomStateCorruptedException e) {
        log.error("房间状态损坏", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.serverError("房间状态异常，对局已中止"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiResponse<Object>> missingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
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
     * 处理非法状态异常（IllegalStateException），例如重复提交、流程冲突等。
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
