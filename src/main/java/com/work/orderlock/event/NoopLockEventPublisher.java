package com.work.orderlock.event;

/**
 * 默认实现：不推送任何通知。
 */
public class NoopLockEventPublisher implements LockEventPublisher {

    @Override
    public void publish(OrderLockEvent event) {
    }
}
