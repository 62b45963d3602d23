package com.work.orderlock.repository;

import com.work.orderlock.domain.OrderLock;

import java.util.Optional;

/**
 * 单条条件写的结果：写入是否生效，以及同一条语句里读到的锁记录。
 * <ul>
 *     <li>applied=true：lock 为写入（或删除）的那一行</li>
 *     <li>applied=false：lock 为条件不满足时的当前记录；记录不存在时为 empty</li>
 * </ul>
 */
public final class LockWriteResult {

    private static final LockWriteResult REJECTED_NO_ROW = new LockWriteResult(false, null);

    private final boolean applied;
    private final OrderLock lock;

    private LockWriteResult(boolean applied, OrderLock lock) {
        this.applied = applied;
        this.lock = lock;
    }

    public static LockWriteResult applied(OrderLock lock) {
        if (lock == null) {
            throw new IllegalArgumentException("lock 不能为null");
        }
        return new LockWriteResult(true, lock);
    }

    public static LockWriteResult rejected(OrderLock current) {
        return current == null ? REJECTED_NO_ROW : new LockWriteResult(false, current);
    }

    public boolean isApplied() {
        return applied;
    }

    public Optional<OrderLock> getLock() {
        return Optional.ofNullable(lock);
    }
}
