package com.work.orderlock.web.dto;

import javax.validation.constraints.Positive;

public class RenewLockRequest {

    @Positive(message = "ttlSeconds 必须大于0")
    private Long ttlSeconds;

    public Long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }
}
