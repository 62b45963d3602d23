package com.work.orderlock.exception;

import java.time.Instant;

/**
 * 订单正被其他人有效持有（应返回 409）。只暴露持有者身份，不暴露其 session id。
 */
public class LockConflictException extends OrderLockException {

    private final String resourceId;
    private final String holderUserId;
    private final String holderUserName;
    private final Instant expiresAt;

    public LockConflictException(String resourceId, String holderUserId, String holderUserName, Instant expiresAt) {
        super("Order is currently locked by " + holderUserName);
        this.resourceId = resourceId;
        this.holderUserId = holderUserId;
        this.holderUserName = holderUserName;
        this.expiresAt = expiresAt;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getHolderUserId() {
        return holderUserId;
    }

    public String getHolderUserName() {
        return holderUserName;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
