package com.mvccdb.api.service;

/**
 * 通用执行响应，getData 为执行结果或快照等载荷。
 */
public class StatementResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    private StatementResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> StatementResponse<T> success(T data) {
        return new StatementResponse<>(true, data, null);
    }

    public static <T> StatementResponse<T> failure(String message) {
        return new StatementResponse<>(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
