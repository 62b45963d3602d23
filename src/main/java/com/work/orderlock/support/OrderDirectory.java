package com.work.orderlock.support;

import com.work.orderlock.domain.ResourceKind;

/**
 * 订单存在性查询（由订单 CRUD 模块提供）。
 * <p>order_locks.order_id 无法同时对两张订单表做外键约束，存在性在 acquire 前由应用层校验。</p>
 */
public interface OrderDirectory {

    boolean exists(ResourceKind kind, String resourceId);

    /**
     * 默认实现：信任调用方传入的 id。
     */
    static OrderDirectory acceptAll() {
        return (kind, resourceId) -> true;
    }
}
