package com.work.orderlock.repository;

import com.work.orderlock.domain.OrderLock;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 锁存储端口。每个方法对应存储上的一次原子条件操作。
 * <p>
 * 实现必须把存储故障转换为 {@link com.work.orderlock.exception.LockStoreUnavailableException}，
 * 不得以"未找到"的形式吞掉。
 */
public interface OrderLockRepository {

    /**
     * 原子地获取锁：不存在则插入；已过期则整行替换；同一 user+session 持有则续期（保留原有 resourceKind）。
     *
     * @param candidate 期望写入的新锁（lockId、acquiredAt、expiresAt 已由调用方生成）
     * @param now       判断过期所用的当前时间
     * @return 生效时带写入后的记录；锁被他人有效持有时带当前持有者（同一次存储往返内读到）
     */
    LockWriteResult tryAcquire(OrderLock candidate, Instant now);

    /**
     * 读取原始记录，不做过期过滤。
     */
    Optional<OrderLock> findByResourceId(String resourceId);

    /**
     * 仅当 sessionId 持有且未过期时把 expiresAt 推到 newExpiresAt。
     */
    Optional<OrderLock> renew(String resourceId, String sessionId, Instant now, Instant newExpiresAt);

    /**
     * 删除 sessionId 持有的锁记录。
     *
     * @return 生效时带被删除的记录；未删除时带当前记录（如有）
     */
    LockWriteResult release(String resourceId, String sessionId);

    List<OrderLock> findAllLive(Instant now);

    int deleteExpiredBefore(Instant cutoff);
}
