package com.work.orderlock.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.orderlock.domain.OrderLock;
import com.work.orderlock.domain.ResourceKind;

import java.time.Instant;

/**
 * 锁变更通知，序列化后推送给订阅方（管理端据此刷新"正在编辑"标记）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderLockEvent {

    public enum Type {
        LOCKED("order:locked"),
        UNLOCKED("order:unlocked");

        private final String topic;

        Type(String topic) {
            this.topic = topic;
        }

        public String getTopic() {
            return topic;
        }
    }

    private final Type type;
    private final String resourceId;
    private final ResourceKind resourceKind;
    private final String holderUserId;
    private final String holderUserName;
    private final Instant acquiredAt;
    private final Instant expiresAt;
    private final Instant occurredAt;

    private OrderLockEvent(Type type, String resourceId, ResourceKind resourceKind, String holderUserId,
                           String holderUserName, Instant acquiredAt, Instant expiresAt, Instant occurredAt) {
        this.type = type;
        this.resourceId = resourceId;
        this.resourceKind = resourceKind;
        this.holderUserId = holderUserId;
        this.holderUserName = holderUserName;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
        this.occurredAt = occurredAt;
    }

    public static OrderLockEvent locked(OrderLock lock, String holderUserName, Instant occurredAt) {
        return new OrderLockEvent(Type.LOCKED, lock.getResourceId(), lock.getResourceKind(),
                lock.getHolderUserId(), holderUserName, lock.getAcquiredAt(), lock.getExpiresAt(), occurredAt);
    }

    public static OrderLockEvent unlocked(String resourceId, Instant occurredAt) {
        return new OrderLockEvent(Type.UNLOCKED, resourceId, null, null, null, null, null, occurredAt);
    }

    @JsonProperty("event")
    public String getTopic() {
        return type.getTopic();
    }

    public Type getType() {
        return type;
    }

    public String getResourceId() {
        return resourceId;
    }

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public String getHolderUserId() {
        return holderUserId;
    }

    public String getHolderUserName() {
        return holderUserName;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
