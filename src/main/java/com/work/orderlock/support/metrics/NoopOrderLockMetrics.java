package com.work.orderlock.support.metrics;

/**
 * 默认 no-op 实现：保证在不引入任何 metrics 依赖时仍可运行。
 */
public class NoopOrderLockMetrics implements OrderLockMetrics {
}
