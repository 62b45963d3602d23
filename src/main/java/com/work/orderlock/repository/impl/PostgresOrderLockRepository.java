package com.work.orderlock.repository.impl;

import com.work.orderlock.domain.OrderLock;
import com.work.orderlock.domain.ResourceKind;
import com.work.orderlock.exception.LockStoreUnavailableException;
import com.work.orderlock.repository.LockWriteResult;
import com.work.orderlock.repository.OrderLockRepository;
import com.work.orderlock.repository.entity.OrderLockEntity;
import com.work.orderlock.repository.mapper.OrderLockMapper;
import org.apache.ibatis.exceptions.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.work.orderlock.support.ValidationUtils.requireNonEmpty;
import static com.work.orderlock.support.ValidationUtils.requireNonNull;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的锁存储实现。
 * <p>
 * 注意：
 * 1. 每个方法只发一条 SQL，不开启事务，原子性由单条条件语句保证；acquire/release 未生效时的当前持有者也由同一条语句带回
 * 2. 语句超时由 mybatis-plus.configuration.default-statement-timeout 兜底
 * 3. 所有存储异常统一转换为 LockStoreUnavailableException
 */
@Repository
@ConditionalOnProperty(prefix = "order-lock", name = "store", havingValue = "postgres", matchIfMissing = true)
public class PostgresOrderLockRepository implements OrderLockRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresOrderLockRepository.class);

    private final OrderLockMapper lockMapper;

    public PostgresOrderLockRepository(OrderLockMapper lockMapper) {
        this.lockMapper = requireNonNull(lockMapper, "lockMapper");
    }

    @Override
    public LockWriteResult tryAcquire(OrderLock candidate, Instant now) {
        requireNonNull(candidate, "candidate");
        requireNonNull(now, "now");

        OrderLockEntity entity = call("acquire", () -> lockMapper.tryAcquire(
                candidate.getLockId(),
                candidate.getResourceKind().getCode(),
                candidate.getResourceId(),
                candidate.getHolderUserId(),
                candidate.getHolderSessionId(),
                now,
                candidate.getExpiresAt()));
        return toWriteResult(entity);
    }

    @Override
    public Optional<OrderLock> findByResourceId(String resourceId) {
        requireNonEmpty(resourceId, "resourceId");

        OrderLockEntity entity = call("inspect", () -> lockMapper.selectByOrderId(resourceId));
        return Optional.ofNullable(entity).map(this::convertToLock);
    }

    @Override
    public Optional<OrderLock> renew(String resourceId, String sessionId, Instant now, Instant newExpiresAt) {
        requireNonEmpty(resourceId, "resourceId");
        requireNonEmpty(sessionId, "sessionId");

        OrderLockEntity entity = call("renew", () -> lockMapper.renew(resourceId, sessionId, now, newExpiresAt));
        return Optional.ofNullable(entity).map(this::convertToLock);
    }

    @Override
    public LockWriteResult release(String resourceId, String sessionId) {
        requireNonEmpty(resourceId, "resourceId");
        requireNonEmpty(sessionId, "sessionId");

        OrderLockEntity entity = call("release", () -> lockMapper.release(resourceId, sessionId));
        return toWriteResult(entity);
    }

    @Override
    public List<OrderLock> findAllLive(Instant now) {
        List<OrderLockEntity> entities = call("list", () -> lockMapper.listLive(now));
        List<OrderLock> result = new ArrayList<>();
        if (entities == null) {
            return result;
        }
        for (OrderLockEntity entity : entities) {
            result.add(convertToLock(entity));
        }
        return result;
    }

    @Override
    public int deleteExpiredBefore(Instant cutoff) {
        requireNonNull(cutoff, "cutoff");

        Integer deleted = call("sweep", () -> lockMapper.deleteExpiredBefore(cutoff));
        return deleted == null ? 0 : deleted;
    }

    /**
     * 统一的存储调用入口：存储异常一律视为 Unavailable，交由调用方决定是否重试。
     */
    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | PersistenceException e) {
            LOGGER.error("[order-lock] store failure during {}", operation, e);
            throw new LockStoreUnavailableException(operation, e);
        }
    }

    private LockWriteResult toWriteResult(OrderLockEntity entity) {
        if (entity == null) {
            return LockWriteResult.rejected(null);
        }
        OrderLock lock = convertToLock(entity);
        return Boolean.TRUE.equals(entity.getApplied()) ? LockWriteResult.applied(lock) : LockWriteResult.rejected(lock);
    }

    private OrderLock convertToLock(OrderLockEntity entity) {
        return new OrderLock(
                entity.getId(),
                ResourceKind.fromCode(entity.getOrderType()),
                entity.getOrderId(),
                entity.getLockedByUserId(),
                entity.getLockedBySessionId(),
                entity.getLockedAt(),
                entity.getExpiresAt(),
                entity.getLastActivityAt()
        );
    }
}
