package com.work.orderlock.domain;

import java.time.Instant;

/**
 * inspect 的结果：Unlocked 或 LockedBy{holder, acquiredAt, expiresAt}。
 */
public class LockStatus {

    private final String resourceId;
    private final boolean locked;
    private final ResourceKind resourceKind;
    private final String holderUserId;
    private final String holderUserName;
    private final Instant acquiredAt;
    private final Instant expiresAt;

    private LockStatus(String resourceId,
                       boolean locked,
                       ResourceKind resourceKind,
                       String holderUserId,
                       String holderUserName,
                       Instant acquiredAt,
                       Instant expiresAt) {
        this.resourceId = resourceId;
        this.locked = locked;
        this.resourceKind = resourceKind;
        this.holderUserId = holderUserId;
        this.holderUserName = holderUserName;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
    }

    public static LockStatus unlocked(String resourceId) {
        return new LockStatus(resourceId, false, null, null, null, null, null);
    }

    public static LockStatus lockedBy(OrderLock lock, String holderUserName) {
        return new LockStatus(lock.getResourceId(), true, lock.getResourceKind(), lock.getHolderUserId(),
                holderUserName, lock.getAcquiredAt(), lock.getExpiresAt());
    }

    public String getResourceId() {
        return resourceId;
    }

    public boolean isLocked() {
        return locked;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public String getHolderUserId() {
        return holderUserId;
    }

    public String getHolderUserName() {
        return holderUserName;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }
}
