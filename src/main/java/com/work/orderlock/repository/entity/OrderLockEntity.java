package com.work.orderlock.repository.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.time.Instant;

@TableName("order_locks")
public class OrderLockEntity {

    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * customer / internal（字符串化存储）。
     */
    private String orderType;

    private String orderId;

    private String lockedByUserId;

    private String lockedBySessionId;

    private Instant lockedAt;

    private Instant expiresAt;

    private Instant lastActivityAt;

    /**
     * 仅条件写语句返回：本次写入是否生效。
     */
    @TableField(exist = false)
    private Boolean applied;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOrderType() {
        return orderType;
    }

    public void setOrderType(String orderType) {
        this.orderType = orderType;
    }

    public String getOrderId() {
        return orderId;
    }

    public void setOrderId(String orderId) {
        this.orderId = orderId;
    }

    public String getLockedByUserId() {
        return lockedByUserId;
    }

    public void setLockedByUserId(String lockedByUserId) {
        this.lockedByUserId = lockedByUserId;
    }

    public String getLockedBySessionId() {
        return lockedBySessionId;
    }

    public void setLockedBySessionId(String lockedBySessionId) {
        this.lockedBySessionId = lockedBySessionId;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getLastActivityAt() {
        return lastActivityAt;
    }

    public void setLastActivityAt(Instant lastActivityAt) {
        this.lastActivityAt = lastActivityAt;
    }

    public Boolean getApplied() {
        return applied;
    }

    public void setApplied(Boolean applied) {
        this.applied = applied;
    }
}
