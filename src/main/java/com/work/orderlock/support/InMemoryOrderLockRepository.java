package com.work.orderlock.support;

import com.work.orderlock.domain.OrderLock;
import com.work.orderlock.repository.LockWriteResult;
import com.work.orderlock.repository.OrderLockRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下演示与测试协调器行为。
 * 用 ConcurrentHashMap 的单 key 原子操作（compute / remove(key, value)）模拟存储层的单行原子条件写，
 * 记录删除后不残留任何按 key 的状态。
 * 注意：该实现不具备跨进程一致性。
 */
public class InMemoryOrderLockRepository implements OrderLockRepository {

    private final Map<String, OrderLock> lockTable = new ConcurrentHashMap<>();

    @Override
    public LockWriteResult tryAcquire(OrderLock candidate, Instant now) {
        LockWriteResult[] outcome = new LockWriteResult[1];
        lockTable.compute(candidate.getResourceId(), (resourceId, current) -> {
            if (current == null || current.getExpiresAt().isBefore(now)) {
                outcome[0] = LockWriteResult.applied(candidate);
                return candidate;
            }
            if (current.isHeldBy(candidate.getHolderUserId(), candidate.getHolderSessionId())) {
                OrderLock renewed = new OrderLock(current.getLockId(), current.getResourceKind(),
                        current.getResourceId(), current.getHolderUserId(), current.getHolderSessionId(),
                        current.getAcquiredAt(), candidate.getExpiresAt(), now);
                outcome[0] = LockWriteResult.applied(renewed);
                return renewed;
            }
            outcome[0] = LockWriteResult.rejected(current);
            return current;
        });
        return outcome[0];
    }

    @Override
    public Optional<OrderLock> findByResourceId(String resourceId) {
        return Optional.ofNullable(lockTable.get(resourceId));
    }

    @Override
    public Optional<OrderLock> renew(String resourceId, String sessionId, Instant now, Instant newExpiresAt) {
        OrderLock[] renewed = new OrderLock[1];
        lockTable.computeIfPresent(resourceId, (key, current) -> {
            if (!current.getHolderSessionId().equals(sessionId) || current.getExpiresAt().isBefore(now)) {
                return current;
            }
            renewed[0] = new OrderLock(current.getLockId(), current.getResourceKind(),
                    current.getResourceId(), current.getHolderUserId(), current.getHolderSessionId(),
                    current.getAcquiredAt(), newExpiresAt, now);
            return renewed[0];
        });
        return Optional.ofNullable(renewed[0]);
    }

    @Override
    public LockWriteResult release(String resourceId, String sessionId) {
        LockWriteResult[] outcome = {LockWriteResult.rejected(null)};
        lockTable.computeIfPresent(resourceId, (key, current) -> {
            if (current.getHolderSessionId().equals(sessionId)) {
                outcome[0] = LockWriteResult.applied(current);
                return null;
            }
            outcome[0] = LockWriteResult.rejected(current);
            return current;
        });
        return outcome[0];
    }

    @Override
    public List<OrderLock> findAllLive(Instant now) {
        List<OrderLock> live = new ArrayList<>();
        for (OrderLock lock : lockTable.values()) {
            if (lock.isLiveAt(now)) {
                live.add(lock);
            }
        }
        live.sort(Comparator.comparing(OrderLock::getExpiresAt));
        return live;
    }

    @Override
    public int deleteExpiredBefore(Instant cutoff) {
        int deleted = 0;
        for (OrderLock lock : new ArrayList<>(lockTable.values())) {
            // 只删除读到的那个版本；期间被续期或接管的记录保持不变
            if (lock.getExpiresAt().isBefore(cutoff) && lockTable.remove(lock.getResourceId(), lock)) {
                deleted++;
            }
        }
        return deleted;
    }

    int size() {
        return lockTable.size();
    }
}
