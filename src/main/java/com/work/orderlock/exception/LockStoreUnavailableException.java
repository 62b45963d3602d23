package com.work.orderlock.exception;

/**
 * 存储层不可达或超时（应返回 503）。
 * <p>绝不能被当作 Unlocked / NotHeld 处理，否则存储故障期间两个编辑者可能同时进入。</p>
 */
public class LockStoreUnavailableException extends OrderLockException {

    private final String operation;

    public LockStoreUnavailableException(String operation, Throwable cause) {
        super("Lock store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
