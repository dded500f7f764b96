package com.ches.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    状态码：200 成功 / 400 参数或棋盘编码错误 / 409 状态冲突（如房间已关闭）
 * @param message 响应消息
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    /** 成功响应（带数据） */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /** 失败响应（400 Bad Request），例如坐标写错、棋盘串无法解码 */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /** 失败响应（409 Conflict） */
    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null);
    }
}
