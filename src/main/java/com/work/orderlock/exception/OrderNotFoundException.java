package com.work.orderlock.exception;

import com.work.orderlock.domain.ResourceKind;

public class OrderNotFoundException extends OrderLockException {

    public OrderNotFoundException(ResourceKind kind, String resourceId) {
        super("Order not found: " + kind.getCode() + "/" + resourceId);
    }
}
