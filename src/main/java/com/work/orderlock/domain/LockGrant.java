package com.work.orderlock.domain;

import java.time.Instant;

/**
 * acquire / renew 成功后的返回值。不包含 session id。
 */
public class LockGrant {

    public enum GrantType {
        /**
         * 新建锁，或接管了一条已过期的锁记录。
         */
        ACQUIRED,
        /**
         * 续期，包括同一 session 的重复 acquire。
         */
        RENEWED
    }

    private final GrantType type;
    private final String lockId;
    private final ResourceKind resourceKind;
    private final String resourceId;
    private final String holderUserId;
    private final Instant acquiredAt;
    private final Instant expiresAt;
    private final Instant lastActivityAt;

    public LockGrant(GrantType type, OrderLock lock) {
        this.type = type;
        this.lockId = lock.getLockId();
        this.resourceKind = lock.getResourceKind();
        this.resourceId = lock.getResourceId();
        this.holderUserId = lock.getHolderUserId();
        this.acquiredAt = lock.getAcquiredAt();
        this.expiresAt = lock.getExpiresAt();
        this.lastActivityAt = lock.getLastActivityAt();
    }

    public GrantType getType() {
        return type;
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

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }
}
