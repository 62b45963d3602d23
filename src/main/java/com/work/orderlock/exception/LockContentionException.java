package com.work.orderlock.exception;

/**
 * 在竞争窗口内锁状态连续变化，本次调用无法给出确定结论，调用方应退避后重试。
 */
public class LockContentionException extends OrderLockException {

    public LockContentionException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
