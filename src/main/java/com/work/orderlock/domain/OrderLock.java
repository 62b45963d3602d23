package com.work.orderlock.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * 一条锁记录的领域视图（不可变）。
 */
public class OrderLock {

    private final String lockId;
    private final ResourceKind resourceKind;
    private final String resourceId;
    private final String holderUserId;
    private final String holderSessionId;
    private final Instant acquiredAt;
    private final Instant expiresAt;
    private final Instant lastActivityAt;

    public OrderLock(String lockId,
                     ResourceKind resourceKind,
                     String resourceId,
                     String holderUserId,
                     String holderSessionId,
                     Instant acquiredAt,
                     Instant expiresAt,
                     Instant lastActivityAt) {
        this.lockId = lockId;
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
        this.holderUserId = holderUserId;
        this.holderSessionId = holderSessionId;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
        this.lastActivityAt = lastActivityAt;
    }

    public String getLockId() {
        return lockId;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getHolderUserId() {
        return holderUserId;
    }

    public String getHolderSessionId() {
        return holderSessionId;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    /**
     * now <= expiresAt 视为仍然有效；过期判断永远在读取时实时计算。
     */
    public boolean isLiveAt(Instant now) {
        return expiresAt != null && !now.isAfter(expiresAt);
    }

    public boolean isHeldBy(String userId, String sessionId) {
        return holderUserId.equals(userId) && holderSessionId.equals(sessionId);
    }

    public Duration remainingAt(Instant now) {
        if (!isLiveAt(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expiresAt);
    }

    @Override
    public String toString() {
        return "OrderLock{" +
                "lockId='" + lockId + '\'' +
                ", resourceKind=" + resourceKind +
                ", resourceId='" + resourceId + '\'' +
                ", holderUserId='" + holderUserId + '\'' +
                ", acquiredAt=" + acquiredAt +
                ", expiresAt=" + expiresAt +
                '}';
    }
}
