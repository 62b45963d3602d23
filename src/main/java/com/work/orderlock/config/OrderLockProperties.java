package com.work.orderlock.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 订单编辑锁配置项（application.yml 中的 order-lock.*）。
 *
 * 注意：acquire 与 renew 共用 defaultTtl，避免客户端续期到比预期更短的窗口。
 */
@ConfigurationProperties(prefix = "order-lock")
public class OrderLockProperties {

    /**
     * 锁默认时长（必须 > 0）。
     */
    private Duration defaultTtl = Duration.ofMinutes(5);

    /**
     * 单次 acquire/renew 允许请求的最大 TTL。
     */
    private Duration maxTtl = Duration.ofHours(1);

    /**
     * 是否启用过期锁清理任务。
     */
    private boolean sweepEnabled = true;

    /**
     * 清理任务执行间隔（毫秒），由 @Scheduled 直接读取。
     */
    private long sweepIntervalMs = 60_000L;

    /**
     * 清理宽限期：只删除 expires_at 早于 now - sweepGrace 的记录。为空时取 defaultTtl。
     */
    private Duration sweepGrace;

    /**
     * 存储实现：postgres（默认）或 memory（仅本地演示，不具备跨进程一致性）。
     */
    private String store = "postgres";

    private final Events events = new Events();

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getMaxTtl() {
        return maxTtl;
    }

    public void setMaxTtl(Duration maxTtl) {
        this.maxTtl = maxTtl;
    }

    public boolean isSweepEnabled() {
        return sweepEnabled;
    }

    public void setSweepEnabled(boolean sweepEnabled) {
        this.sweepEnabled = sweepEnabled;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Duration getSweepGrace() {
        return sweepGrace;
    }

    public void setSweepGrace(Duration sweepGrace) {
        this.sweepGrace = sweepGrace;
    }

    /**
     * 实际生效的清理宽限期。
     */
    public Duration getEffectiveSweepGrace() {
        return sweepGrace != null ? sweepGrace : defaultTtl;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Events getEvents() {
        return events;
    }

    /**
     * 锁变更通知（order:locked / order:unlocked）。
     */
    public static class Events {

        private boolean redisEnabled = false;

        private String channel = "order-locks";

        public boolean isRedisEnabled() {
            return redisEnabled;
        }

        public void setRedisEnabled(boolean redisEnabled) {
            this.redisEnabled = redisEnabled;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }
    }
}
