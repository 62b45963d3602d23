package com.work.orderlock.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.orderlock.exception.OrderLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import static com.work.orderlock.support.ValidationUtils.requireNonEmpty;
import static com.work.orderlock.support.ValidationUtils.requireNonNull;

/**
 * 基于 Redis pub/sub 的锁变更通知。
 * <p>消息体为 JSON，订阅方（realtime 网关）按 event 字段转发给前端。</p>
 */
public class RedisLockEventPublisher implements LockEventPublisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisLockEventPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisLockEventPublisher(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String channel) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        this.channel = requireNonEmpty(channel, "channel");
    }

    @Override
    public void publish(OrderLockEvent event) {
        requireNonNull(event, "event");
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new OrderLockException("锁事件序列化失败: " + event.getResourceId(), e);
        }
        try {
            redisTemplate.convertAndSend(channel, payload);
        } catch (Exception e) {
            throw new OrderLockException("Redis 推送锁事件失败: " + event.getResourceId(), e);
        }
        LOGGER.debug("[order-lock] published {} for {} on {}", event.getTopic(), event.getResourceId(), channel);
    }
}
