package com.work.orderlock.web.dto;

import java.time.Instant;

public class LockStatusView {

    private String resourceId;
    private boolean locked;
    private String resourceKind;
    private String holderUserId;
    private String holderUserName;
    private Instant acquiredAt;
    private Instant expiresAt;

    public String getResourceId() {
        return resourceId;
    }

    public void setResourceId(String resourceId) {
        this.resourceId = resourceId;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public String getResourceKind() {
        return resourceKind;
    }

    public void setResourceKind(String resourceKind) {
        this.resourceKind = resourceKind;
    }

    public String getHolderUserId() {
        return holderUserId;
    }

    public void setHolderUserId(String holderUserId) {
        this.holderUserId = holderUserId;
    }

    public String getHolderUserName() {
        return holderUserName;
    }

    public void setHolderUserName(String holderUserName) {
        this.holderUserName = holderUserName;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public void setAcquiredAt(Instant acquiredAt) {
        this.acquiredAt = acquiredAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
