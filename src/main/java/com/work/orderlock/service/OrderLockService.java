package com.work.orderlock.service;

import com.work.orderlock.config.OrderLockProperties;
import com.work.orderlock.domain.LockGrant;
import com.work.orderlock.domain.LockStatus;
import com.work.orderlock.domain.OrderLock;
import com.work.orderlock.domain.ResourceKind;
import com.work.orderlock.event.LockEventPublisher;
import com.work.orderlock.event.OrderLockEvent;
import com.work.orderlock.exception.LockConflictException;
import com.work.orderlock.exception.LockContentionException;
import com.work.orderlock.exception.LockNotHeldException;
import com.work.orderlock.exception.LockStoreUnavailableException;
import com.work.orderlock.exception.OrderNotFoundException;
import com.work.orderlock.repository.LockWriteResult;
import com.work.orderlock.repository.OrderLockRepository;
import com.work.orderlock.support.OrderDirectory;
import com.work.orderlock.support.UserDirectory;
import com.work.orderlock.support.metrics.OrderLockMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.work.orderlock.support.ValidationUtils.MAX_SESSION_ID_LENGTH;
import static com.work.orderlock.support.ValidationUtils.MAX_USER_ID_LENGTH;
import static com.work.orderlock.support.ValidationUtils.requireNonNull;
import static com.work.orderlock.support.ValidationUtils.requireValidIdentity;
import static com.work.orderlock.support.ValidationUtils.requireValidResourceId;
import static com.work.orderlock.support.ValidationUtils.requireValidTtl;

/**
 * 订单编辑锁协调器：acquire / renew / release / inspect。
 * <p>
 * 约束：
 * - 无状态服务，锁归属只存在于存储中，不在进程内缓存（多实例可直接挂在负载均衡后面）
 * - 每个写操作都是存储上的一次原子条件写，从不 read-then-write
 * - 过期在读取时实时判断，不依赖 sweep 是否已清理
 * - Conflict / NotHeld 直接返回给调用方，服务内不做自动重试
 */
@Service
public class OrderLockService {

    private static final Logger log = LoggerFactory.getLogger(OrderLockService.class);

    /**
     * tryAcquire 未生效时带回的持有者来自语句快照，可能恰好已被释放或过期，此时重新尝试获取。
     */
    private static final int MAX_ACQUIRE_ATTEMPTS = 3;

    private final OrderLockRepository lockRepository;
    private final OrderDirectory orderDirectory;
    private final UserDirectory userDirectory;
    private final LockEventPublisher eventPublisher;
    private final OrderLockProperties props;
    private final OrderLockMetrics metrics;
    private final Clock clock;

    public OrderLockService(OrderLockRepository lockRepository,
                            OrderDirectory orderDirectory,
                            UserDirectory userDirectory,
                            LockEventPublisher eventPublisher,
                            OrderLockProperties props,
                            OrderLockMetrics metrics,
                            Clock clock) {
        this.lockRepository = requireNonNull(lockRepository, "lockRepository");
        this.orderDirectory = requireNonNull(orderDirectory, "orderDirectory");
        this.userDirectory = requireNonNull(userDirectory, "userDirectory");
        this.eventPublisher = requireNonNull(eventPublisher, "eventPublisher");
        this.props = requireNonNull(props, "props");
        this.metrics = requireNonNull(metrics, "metrics");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * 获取锁。
     *
     * @param ttl 为 null 时使用 order-lock.default-ttl
     * @throws LockConflictException         锁被其他 user/session 有效持有
     * @throws OrderNotFoundException        订单不存在
     * @throws LockContentionException       竞争窗口内锁状态连续变化
     * @throws LockStoreUnavailableException 存储不可用
     */
    public LockGrant acquire(ResourceKind kind, String resourceId, String userId, String sessionId, Duration ttl) {
        requireNonNull(kind, "resourceKind");
        requireValidResourceId(resourceId);
        requireValidIdentity(userId, "userId", MAX_USER_ID_LENGTH);
        requireValidIdentity(sessionId, "sessionId", MAX_SESSION_ID_LENGTH);
        Duration effectiveTtl = resolveTtl(ttl);

        if (!orderDirectory.exists(kind, resourceId)) {
            metrics.acquire("not_found");
            throw new OrderNotFoundException(kind, resourceId);
        }

        for (int attempt = 1; attempt <= MAX_ACQUIRE_ATTEMPTS; attempt++) {
            Instant now = clock.instant();
            OrderLock candidate = new OrderLock(UUID.randomUUID().toString(), kind, resourceId, userId, sessionId,
                    now, now.plus(effectiveTtl), now);

            LockWriteResult result = guarded("acquire", () -> lockRepository.tryAcquire(candidate, now));
            if (result.isApplied()) {
                OrderLock lock = result.getLock().get();
                if (candidate.getLockId().equals(lock.getLockId())) {
                    metrics.acquire("acquired");
                    log.info("[order-lock] acquired {} {} by user={} until {}",
                            kind, resourceId, userId, lock.getExpiresAt());
                    publishSafely(OrderLockEvent.locked(lock, resolveUserName(userId), now));
                    return new LockGrant(LockGrant.GrantType.ACQUIRED, lock);
                }
                metrics.acquire("renewed");
                log.debug("[order-lock] re-acquire treated as renew {} by user={} until {}",
                        resourceId, userId, lock.getExpiresAt());
                return new LockGrant(LockGrant.GrantType.RENEWED, lock);
            }

            // 锁被他人持有：同一条语句带回的持有者用于提示；若快照中已释放/过期则重新尝试
            Optional<OrderLock> current = result.getLock();
            if (current.isPresent() && current.get().isLiveAt(now)
                    && !current.get().isHeldBy(userId, sessionId)) {
                OrderLock holder = current.get();
                metrics.acquire("conflict");
                log.info("[order-lock] conflict on {}: requested by user={}, held by user={} until {}",
                        resourceId, userId, holder.getHolderUserId(), holder.getExpiresAt());
                throw new LockConflictException(resourceId, holder.getHolderUserId(),
                        resolveUserName(holder.getHolderUserId()), holder.getExpiresAt());
            }
            log.debug("[order-lock] holder of {} vanished between attempts, retry {}/{}",
                    resourceId, attempt, MAX_ACQUIRE_ATTEMPTS);
        }

        metrics.acquire("contention");
        throw new LockContentionException("Lock on " + resourceId + " changed concurrently, retry later");
    }

    /**
     * 续期：仅当前未过期的持有 session 可以续期，expiresAt = now + ttl。
     *
     * @throws LockNotHeldException 锁不存在、属于其他 session 或已过期
     */
    public LockGrant renew(String resourceId, String sessionId, Duration ttl) {
        requireValidResourceId(resourceId);
        requireValidIdentity(sessionId, "sessionId", MAX_SESSION_ID_LENGTH);
        Duration effectiveTtl = resolveTtl(ttl);

        Instant now = clock.instant();
        Optional<OrderLock> renewed = guarded("renew",
                () -> lockRepository.renew(resourceId, sessionId, now, now.plus(effectiveTtl)));
        if (!renewed.isPresent()) {
            metrics.renew("not_held");
            log.debug("[order-lock] renew rejected, {} not held by this session", resourceId);
            throw new LockNotHeldException(resourceId, false);
        }
        metrics.renew("renewed");
        log.debug("[order-lock] renewed {} until {}", resourceId, renewed.get().getExpiresAt());
        return new LockGrant(LockGrant.GrantType.RENEWED, renewed.get());
    }

    /**
     * 释放锁。
     *
     * @throws LockNotHeldException 锁不存在（heldByAnother=false），或属于其他 session（heldByAnother=true）
     */
    public void release(String resourceId, String sessionId) {
        requireValidResourceId(resourceId);
        requireValidIdentity(sessionId, "sessionId", MAX_SESSION_ID_LENGTH);

        LockWriteResult result = guarded("release", () -> lockRepository.release(resourceId, sessionId));
        if (result.isApplied()) {
            metrics.release("released");
            log.info("[order-lock] released {}", resourceId);
            publishSafely(OrderLockEvent.unlocked(resourceId, clock.instant()));
            return;
        }

        // 未删除：区分"本就不持有"与"锁属于别人"，后者说明调用方状态有误
        Optional<OrderLock> current = result.getLock();
        boolean heldByAnother = current.isPresent() && current.get().isLiveAt(clock.instant());
        if (heldByAnother) {
            metrics.release("held_by_another");
            log.warn("[order-lock] release of {} rejected: held by user={} in another session",
                    resourceId, current.get().getHolderUserId());
        } else {
            metrics.release("not_held");
        }
        throw new LockNotHeldException(resourceId, heldByAnother);
    }

    /**
     * 只读查询。已过期但尚未被清理的记录视为 Unlocked。
     */
    public LockStatus inspect(String resourceId) {
        requireValidResourceId(resourceId);

        Optional<OrderLock> current = guarded("inspect", () -> lockRepository.findByResourceId(resourceId));
        if (current.isPresent() && current.get().isLiveAt(clock.instant())) {
            OrderLock lock = current.get();
            return LockStatus.lockedBy(lock, resolveUserName(lock.getHolderUserId()));
        }
        return LockStatus.unlocked(resourceId);
    }

    /**
     * 当前所有有效锁（管理端列表页的"正在编辑"标记）。
     */
    public List<LockStatus> listActive() {
        Instant now = clock.instant();
        List<OrderLock> live = guarded("list", () -> lockRepository.findAllLive(now));
        List<LockStatus> result = new ArrayList<>(live.size());
        for (OrderLock lock : live) {
            result.add(LockStatus.lockedBy(lock, resolveUserName(lock.getHolderUserId())));
        }
        return result;
    }

    private Duration resolveTtl(Duration ttl) {
        Duration effective = ttl != null ? ttl : props.getDefaultTtl();
        return requireValidTtl(effective, props.getMaxTtl());
    }

    private <T> T guarded(String operation, StoreCall<T> call) {
        try {
            return call.run();
        } catch (LockStoreUnavailableException e) {
            metrics.storeUnavailable(operation);
            throw e;
        }
    }

    /**
     * 展示名查询失败不影响锁操作本身。
     */
    private String resolveUserName(String userId) {
        try {
            return userDirectory.findDisplayName(userId).orElse(UserDirectory.UNKNOWN_USER);
        } catch (RuntimeException e) {
            log.warn("[order-lock] display name lookup failed for user={}", userId, e);
            return UserDirectory.UNKNOWN_USER;
        }
    }

    /**
     * 通知推送失败只记录日志，锁操作已经生效。
     */
    private void publishSafely(OrderLockEvent event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("[order-lock] failed to publish {} for {}", event.getTopic(), event.getResourceId(), e);
        }
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T run();
    }
}
