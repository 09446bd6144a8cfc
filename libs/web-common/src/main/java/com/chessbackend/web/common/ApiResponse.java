package com.chessbackend.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 客户端错误（参数错误、非法走子等）
     * 500: 服务器错误
     */
    int code,

    /**
     * 响应消息；失败时为可直接展示给玩家的原因
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null);
    }

    /**
     * 失败响应（400 Bad Request），附带机器可读的错误明细
     * （例如非法走子的错误种类，便于前端按类型提示）
     */
    public static <T> ApiResponse<T> badRequest(String message, T detail) {
        return new ApiResponse<>(400, message, detail);
    }
}
