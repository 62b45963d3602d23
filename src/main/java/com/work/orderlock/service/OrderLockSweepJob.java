package com.work.orderlock.service;

import com.work.orderlock.config.OrderLockProperties;
import com.work.orderlock.repository.OrderLockRepository;
import com.work.orderlock.support.metrics.OrderLockMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * 定期清理过期锁记录，仅用于存储卫生：
 * - 正确性不依赖本任务，acquire/inspect 都会实时判断过期
 * - 只删除 expires_at < now - grace 的记录，避免与恰好在过期边界续期的客户端竞争
 */
@Component
@ConditionalOnProperty(prefix = "order-lock", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class OrderLockSweepJob {

    private static final Logger log = LoggerFactory.getLogger(OrderLockSweepJob.class);

    private final OrderLockRepository lockRepository;
    private final OrderLockProperties props;
    private final OrderLockMetrics metrics;
    private final Clock clock;

    public OrderLockSweepJob(OrderLockRepository lockRepository,
                             OrderLockProperties props,
                             OrderLockMetrics metrics,
                             Clock clock) {
        this.lockRepository = Objects.requireNonNull(lockRepository, "lockRepository");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(fixedDelayString = "${order-lock.sweep-interval-ms:60000}")
    public void runOnce() {
        try {
            sweepOnce();
        } catch (Exception e) {
            // 下一个周期照常执行
            log.error("[order-lock-sweep] sweep failed", e);
        }
    }

    /**
     * 执行一次清理。
     *
     * @return 删除的记录数
     */
    public int sweepOnce() {
        Instant cutoff = clock.instant().minus(props.getEffectiveSweepGrace());
        int deleted = lockRepository.deleteExpiredBefore(cutoff);
        metrics.swept(deleted);
        if (deleted > 0) {
            log.info("[order-lock-sweep] deleted {} expired locks (expires_at < {})", deleted, cutoff);
        } else {
            log.debug("[order-lock-sweep] nothing to delete before {}", cutoff);
        }
        return deleted;
    }
}
