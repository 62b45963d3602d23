package com.work.orderlock.exception;

/**
 * 调用方试图 renew/release 一把自己并未（或不再）持有的锁。
 * <p>heldByAnother=true 表示锁当前属于别的 session，通常意味着调用方逻辑有误。</p>
 */
public class LockNotHeldException extends OrderLockException {

    private final String resourceId;
    private final boolean heldByAnother;

    public LockNotHeldException(String resourceId, boolean heldByAnother) {
        super(heldByAnother
                ? "Lock on " + resourceId + " is held by another session"
                : "No lock held on " + resourceId + " by this session");
        this.resourceId = resourceId;
        this.heldByAnother = heldByAnother;
    }

    public String getResourceId() {
        return resourceId;
    }

    public boolean isHeldByAnother() {
        return heldByAnother;
    }
}
