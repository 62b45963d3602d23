package com.work.orderlock.repository.mapper;

import com.work.orderlock.repository.entity.OrderLockEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 在真实 PostgreSQL 上执行 order_locks 的条件写语句。没有 Docker 时整体跳过。
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {"order-lock.sweep-enabled=false", "order-lock.store=postgres"})
public class OrderLockMapperPostgresTest {

    @Container
    @SuppressWarnings("resource")
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:15-alpine"));

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final Instant T0 = Instant.parse("2026-01-01T08:00:00Z");
    private static final Duration TTL = Duration.ofMinutes(5);

    @Autowired
    private OrderLockMapper mapper;

    private final Map<String, String> lockIds = new ConcurrentHashMap<>();

    @Test
    public void fresh_insert_is_applied_with_candidate_columns() {
        String orderId = newOrderId();

        OrderLockEntity row = acquire("lock-a", "customer", orderId, "A", "s1", T0);

        assertTrue(row.getApplied());
        assertEquals(id("lock-a"), row.getId());
        assertEquals("customer", row.getOrderType());
        assertEquals(T0, row.getLockedAt());
        assertEquals(T0.plus(TTL), row.getExpiresAt());
    }

    @Test
    public void live_lock_of_other_session_is_returned_unchanged() {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);

        OrderLockEntity row = acquire("lock-b", "customer", orderId, "B", "s2", T0.plusSeconds(60));

        assertFalse(row.getApplied());
        assertEquals(id("lock-a"), row.getId());
        assertEquals("A", row.getLockedByUserId());
        assertEquals(T0.plus(TTL), row.getExpiresAt());
        // 到期瞬间仍然有效
        assertFalse(acquire("lock-c", "customer", orderId, "B", "s2", T0.plus(TTL)).getApplied());
        assertEquals(id("lock-a"), mapper.selectByOrderId(orderId).getId());
    }

    @Test
    public void same_session_reacquire_keeps_id_kind_and_locked_at() {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);

        Instant later = T0.plus(Duration.ofMinutes(4));
        OrderLockEntity row = acquire("lock-b", "internal", orderId, "A", "s1", later);

        assertTrue(row.getApplied());
        assertEquals(id("lock-a"), row.getId());
        assertEquals("customer", row.getOrderType());
        assertEquals(T0, row.getLockedAt());
        assertEquals(later.plus(TTL), row.getExpiresAt());
        assertEquals(later, row.getLastActivityAt());
    }

    @Test
    public void expired_lock_is_taken_over_as_new_row() {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);

        Instant afterExpiry = T0.plus(TTL).plusSeconds(1);
        OrderLockEntity row = acquire("lock-b", "internal", orderId, "B", "s2", afterExpiry);

        assertTrue(row.getApplied());
        assertEquals(id("lock-b"), row.getId());
        assertEquals("internal", row.getOrderType());
        assertEquals("B", row.getLockedByUserId());
        assertEquals(afterExpiry, row.getLockedAt());
    }

    @Test
    public void renew_requires_live_lock_of_same_session() {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);
        Instant at = T0.plus(Duration.ofMinutes(4));

        assertNull(mapper.renew(orderId, "s2", at, at.plus(TTL)));
        OrderLockEntity renewed = mapper.renew(orderId, "s1", at, at.plus(TTL));
        assertNotNull(renewed);
        assertEquals(id("lock-a"), renewed.getId());
        assertEquals(at.plus(TTL), renewed.getExpiresAt());

        Instant expired = at.plus(TTL).plusSeconds(1);
        assertNull(mapper.renew(orderId, "s1", expired, expired.plus(TTL)));
    }

    @Test
    public void release_reports_remaining_holder_when_not_applied() {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);

        OrderLockEntity byOther = mapper.release(orderId, "s2");
        assertFalse(byOther.getApplied());
        assertEquals("s1", byOther.getLockedBySessionId());

        OrderLockEntity byHolder = mapper.release(orderId, "s1");
        assertTrue(byHolder.getApplied());
        assertEquals(id("lock-a"), byHolder.getId());

        assertNull(mapper.release(orderId, "s1"));
        assertNull(mapper.selectByOrderId(orderId));
    }

    @Test
    public void delete_expired_before_spares_recent_rows() {
        String old = newOrderId();
        String recent = newOrderId();
        acquire("lock-old", "customer", old, "A", "s1", T0.minus(Duration.ofHours(2)));
        acquire("lock-recent", "customer", recent, "A", "s1", T0);

        int deleted = mapper.deleteExpiredBefore(T0.minus(Duration.ofHours(1)));

        assertTrue(deleted >= 1);
        assertNull(mapper.selectByOrderId(old));
        assertNotNull(mapper.selectByOrderId(recent));
    }

    @Test
    public void concurrent_takeover_of_expired_row_has_one_winner() throws Exception {
        String orderId = newOrderId();
        acquire("lock-a", "customer", orderId, "A", "s1", T0);
        Instant afterExpiry = T0.plus(TTL).plusSeconds(30);

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<OrderLockEntity>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String label = "lock-" + i;
                String user = "U" + i;
                futures.add(pool.submit((Callable<OrderLockEntity>) () -> {
                    start.await();
                    return acquire(label, "customer", orderId, user, "session-" + user, afterExpiry);
                }));
            }
            start.countDown();

            String winner = null;
            int applied = 0;
            for (Future<OrderLockEntity> f : futures) {
                OrderLockEntity row = f.get(30, TimeUnit.SECONDS);
                if (row != null && Boolean.TRUE.equals(row.getApplied())) {
                    applied++;
                    winner = row.getId();
                }
            }
            assertEquals(1, applied);
            assertEquals(winner, mapper.selectByOrderId(orderId).getId());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * id 是主键，按标签为每个测试生成唯一值。
     */
    private String id(String label) {
        return lockIds.computeIfAbsent(label, key -> UUID.randomUUID().toString());
    }

    private OrderLockEntity acquire(String label, String type, String orderId, String user, String session, Instant now) {
        return mapper.tryAcquire(id(label), type, orderId, user, session, now, now.plus(TTL));
    }

    private static String newOrderId() {
        return "t-" + UUID.randomUUID();
    }
}
