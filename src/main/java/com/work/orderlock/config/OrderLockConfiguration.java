package com.work.orderlock.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.orderlock.event.LockEventPublisher;
import com.work.orderlock.event.NoopLockEventPublisher;
import com.work.orderlock.event.RedisLockEventPublisher;
import com.work.orderlock.repository.OrderLockRepository;
import com.work.orderlock.support.InMemoryOrderLockRepository;
import com.work.orderlock.support.OrderDirectory;
import com.work.orderlock.support.UserDirectory;
import com.work.orderlock.support.metrics.NoopOrderLockMetrics;
import com.work.orderlock.support.metrics.OrderLockMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

import static com.work.orderlock.support.ValidationUtils.requirePositive;

/**
 * 装配锁服务依赖的协作方。订单/用户目录由业务模块提供，缺省时使用宽松的默认实现。
 */
@Configuration
@EnableConfigurationProperties(OrderLockProperties.class)
public class OrderLockConfiguration {

    public OrderLockConfiguration(OrderLockProperties props) {
        validate(props);
    }

    static void validate(OrderLockProperties props) {
        requirePositive(props.getDefaultTtl(), "order-lock.default-ttl");
        requirePositive(props.getMaxTtl(), "order-lock.max-ttl");
        requirePositive(props.getEffectiveSweepGrace(), "order-lock.sweep-grace");
        if (props.getDefaultTtl().compareTo(props.getMaxTtl()) > 0) {
            throw new IllegalArgumentException("order-lock.default-ttl 不能大于 order-lock.max-ttl");
        }
        if (props.getSweepIntervalMs() <= 0) {
            throw new IllegalArgumentException("order-lock.sweep-interval-ms 必须大于0");
        }
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock orderLockClock() {
        return Clock.systemUTC();
    }

    /**
     * 仅本地演示：order-lock.store=memory。
     */
    @Bean
    @ConditionalOnProperty(prefix = "order-lock", name = "store", havingValue = "memory")
    public OrderLockRepository inMemoryOrderLockRepository() {
        return new InMemoryOrderLockRepository();
    }

    @Bean
    @ConditionalOnMissingBean(OrderDirectory.class)
    public OrderDirectory orderDirectory() {
        return OrderDirectory.acceptAll();
    }

    @Bean
    @ConditionalOnMissingBean(UserDirectory.class)
    public UserDirectory userDirectory() {
        return UserDirectory.none();
    }

    @Bean
    @ConditionalOnProperty(prefix = "order-lock.events", name = "redis-enabled", havingValue = "true")
    public LockEventPublisher redisLockEventPublisher(StringRedisTemplate redisTemplate,
                                                      ObjectMapper objectMapper,
                                                      OrderLockProperties props) {
        return new RedisLockEventPublisher(redisTemplate, objectMapper, props.getEvents().getChannel());
    }

    @Bean
    @ConditionalOnMissingBean(LockEventPublisher.class)
    public LockEventPublisher noopLockEventPublisher() {
        return new NoopLockEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean(OrderLockMetrics.class)
    public OrderLockMetrics orderLockMetrics() {
        return new NoopOrderLockMetrics();
    }
}
