package com.work.orderlock.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 * 平台可通过自定义 Bean 接入具体实现。
 */
public interface OrderLockMetrics {

    default void acquire(String result) {
    }

    default void renew(String result) {
    }

    default void release(String result) {
    }

    default void swept(int count) {
    }

    default void storeUnavailable(String operation) {
    }
}
