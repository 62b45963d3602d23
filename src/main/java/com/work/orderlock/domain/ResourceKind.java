package com.work.orderlock.domain;

/**
 * 可加锁的订单族。两类订单共用同一个锁命名空间（order_id 全局唯一），
 * 数据库层面无法对两张表同时做外键约束，因此由应用层显式区分。
 */
public enum ResourceKind {
    CUSTOMER_ORDER("customer"),
    INTERNAL_ORDER("internal");

    private final String code;

    ResourceKind(String code) {
        this.code = code;
    }

    /**
     * order_locks.order_type 列中的存储值。
     */
    public String getCode() {
        return code;
    }

    public static ResourceKind fromCode(String code) {
        for (ResourceKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的 order_type: " + code);
    }
}
