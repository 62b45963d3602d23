package com.work.orderlock.exception;

/**
 * 锁服务内部的统一异常类型，便于 Web 层统一转换为 HTTP 状态码。
 */
public class OrderLockException extends RuntimeException {

    public OrderLockException(String message) {
        super(message);
    }

    public OrderLockException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过调用方重试解决。服务自身从不自动重试。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
