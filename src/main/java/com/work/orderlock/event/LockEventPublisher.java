package com.work.orderlock.event;

/**
 * 锁变更通知的发布端口。通知是尽力而为的旁路，不参与锁的正确性判断。
 */
public interface LockEventPublisher {

    void publish(OrderLockEvent event);
}
