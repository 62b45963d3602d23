package com.work.orderlock.web;

import com.work.orderlock.domain.LockGrant;
import com.work.orderlock.domain.LockStatus;
import com.work.orderlock.domain.OrderLock;
import com.work.orderlock.domain.ResourceKind;
import com.work.orderlock.exception.LockConflictException;
import com.work.orderlock.exception.LockContentionException;
import com.work.orderlock.exception.LockNotHeldException;
import com.work.orderlock.exception.LockStoreUnavailableException;
import com.work.orderlock.exception.OrderNotFoundException;
import com.work.orderlock.service.OrderLockService;
import com.work.orderlock.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class OrderLockControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T08:00:00Z");

    private OrderLockService lockService;
    private MockMvc mvc;

    @BeforeEach
    public void setUp() {
        lockService = mock(OrderLockService.class);
        mvc = MockMvcBuilders.standaloneSetup(new OrderLockController(lockService, new MutableClock(NOW))).build();
    }

    @Test
    public void acquire_maps_body_and_headers() throws Exception {
        OrderLock lock = new OrderLock("lock-1", ResourceKind.CUSTOMER_ORDER, "order-42", "A", "s1",
                NOW, NOW.plusSeconds(120), NOW);
        when(lockService.acquire(eq(ResourceKind.CUSTOMER_ORDER), eq("order-42"), eq("A"), eq("s1"),
                eq(Duration.ofSeconds(120)))).thenReturn(new LockGrant(LockGrant.GrantType.ACQUIRED, lock));

        mvc.perform(post("/api/v1/locks/order-42/acquire")
                        .header("X-User-Id", "A")
                        .header("X-Session-Id", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceKind\":\"CUSTOMER_ORDER\",\"ttlSeconds\":120}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lockId").value("lock-1"))
                .andExpect(jsonPath("$.grantType").value("ACQUIRED"))
                .andExpect(jsonPath("$.holderUserId").value("A"));
    }

    @Test
    public void conflict_returns_409_with_holder() throws Exception {
        when(lockService.acquire(any(), anyString(), anyString(), anyString(), isNull()))
                .thenThrow(new LockConflictException("order-42", "A", "Alice Baker", NOW.plusSeconds(240)));

        mvc.perform(post("/api/v1/locks/order-42/acquire")
                        .header("X-User-Id", "B")
                        .header("X-Session-Id", "s2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceKind\":\"CUSTOMER_ORDER\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.holder.userId").value("A"))
                .andExpect(jsonPath("$.holder.userName").value("Alice Baker"))
                .andExpect(jsonPath("$.holder.remainingSeconds").value(240));
    }

    @Test
    public void missing_resource_kind_is_bad_request() throws Exception {
        mvc.perform(post("/api/v1/locks/order-42/acquire")
                        .header("X-User-Id", "A")
                        .header("X-Session-Id", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ttlSeconds\":60}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(lockService);
    }

    @Test
    public void invalid_argument_from_service_is_bad_request() throws Exception {
        when(lockService.inspect(eq("bad!id"))).thenThrow(new IllegalArgumentException("resourceId 非法"));

        mvc.perform(get("/api/v1/locks/bad!id"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void renew_without_body_uses_default_ttl() throws Exception {
        OrderLock lock = new OrderLock("lock-1", ResourceKind.INTERNAL_ORDER, "io-1", "A", "s1",
                NOW, NOW.plusSeconds(300), NOW);
        when(lockService.renew(eq("io-1"), eq("s1"), isNull()))
                .thenReturn(new LockGrant(LockGrant.GrantType.RENEWED, lock));

        mvc.perform(post("/api/v1/locks/io-1/renew").header("X-Session-Id", "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.grantType").value("RENEWED"));
    }

    @Test
    public void not_held_maps_to_404_or_409() throws Exception {
        when(lockService.renew(eq("io-1"), eq("s1"), isNull())).thenThrow(new LockNotHeldException("io-1", false));
        doThrow(new LockNotHeldException("io-1", true)).when(lockService).release(eq("io-1"), eq("s9"));

        mvc.perform(post("/api/v1/locks/io-1/renew").header("X-Session-Id", "s1"))
                .andExpect(status().isNotFound());
        mvc.perform(delete("/api/v1/locks/io-1").header("X-Session-Id", "s9"))
                .andExpect(status().isConflict());
    }

    @Test
    public void release_returns_no_content() throws Exception {
        mvc.perform(delete("/api/v1/locks/io-1").header("X-Session-Id", "s1"))
                .andExpect(status().isNoContent());
        verify(lockService).release(eq("io-1"), eq("s1"));
    }

    @Test
    public void inspect_and_list_return_status_views() throws Exception {
        OrderLock lock = new OrderLock("lock-1", ResourceKind.INTERNAL_ORDER, "io-1", "A", "s1",
                NOW, NOW.plusSeconds(300), NOW);
        when(lockService.inspect(eq("io-2"))).thenReturn(LockStatus.unlocked("io-2"));
        when(lockService.listActive()).thenReturn(Collections.singletonList(LockStatus.lockedBy(lock, "Alice")));

        mvc.perform(get("/api/v1/locks/io-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locked").value(false));
        mvc.perform(get("/api/v1/locks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].resourceId").value("io-1"))
                .andExpect(jsonPath("$[0].holderUserName").value("Alice"))
                .andExpect(jsonPath("$[0].locked").value(true));
    }

    @Test
    public void store_outage_is_503_and_other_failures_map_to_their_codes() throws Exception {
        when(lockService.inspect(eq("io-1")))
                .thenThrow(new LockStoreUnavailableException("inspect", new RuntimeException("down")));
        when(lockService.inspect(eq("io-2"))).thenThrow(new LockContentionException("busy"));
        when(lockService.acquire(eq(ResourceKind.INTERNAL_ORDER), eq("io-3"), anyString(), anyString(), isNull()))
                .thenThrow(new OrderNotFoundException(ResourceKind.INTERNAL_ORDER, "io-3"));

        mvc.perform(get("/api/v1/locks/io-1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.retryable").value(true));
        mvc.perform(get("/api/v1/locks/io-2"))
                .andExpect(status().isConflict());
        mvc.perform(post("/api/v1/locks/io-3/acquire")
                        .header("X-User-Id", "A")
                        .header("X-Session-Id", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceKind\":\"INTERNAL_ORDER\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void unknown_resource_kind_and_missing_header_use_error_body() throws Exception {
        mvc.perform(post("/api/v1/locks/order-42/acquire")
                        .header("X-User-Id", "A")
                        .header("X-Session-Id", "s1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceKind\":\"WHOLESALE_ORDER\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").exists());
        mvc.perform(delete("/api/v1/locks/order-42"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message", containsString("X-Session-Id")));

        verifyNoInteractions(lockService);
    }
}
