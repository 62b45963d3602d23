package com.work.orderlock.web.dto;

import com.work.orderlock.domain.ResourceKind;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;

public class AcquireLockRequest {

    @NotNull(message = "resourceKind 不能为空")
    private ResourceKind resourceKind;

    /**
     * 可选，不传则使用默认 TTL。
     */
    @Positive(message = "ttlSeconds 必须大于0")
    private Long ttlSeconds;

    public ResourceKind getResourceKind() {
        return resourceKind;
    }

    public void setResourceKind(ResourceKind resourceKind) {
        this.resourceKind = resourceKind;
    }

    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
