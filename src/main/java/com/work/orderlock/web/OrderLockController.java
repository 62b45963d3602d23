package com.work.orderlock.web;

import com.work.orderlock.domain.LockGrant;
import com.work.orderlock.domain.LockStatus;
import com.work.orderlock.exception.LockConflictException;
import com.work.orderlock.exception.LockContentionException;
import com.work.orderlock.exception.LockNotHeldException;
import com.work.orderlock.exception.LockStoreUnavailableException;
import com.work.orderlock.exception.OrderNotFoundException;
import com.work.orderlock.service.OrderLockService;
import com.work.orderlock.web.dto.AcquireLockRequest;
import com.work.orderlock.web.dto.ErrorResponse;
import com.work.orderlock.web.dto.LockGrantView;
import com.work.orderlock.web.dto.LockStatusView;
import com.work.orderlock.web.dto.RenewLockRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 锁操作的 HTTP 契约，与协调器的四个操作一一对应。
 * <p>
 * 身份由上游认证层通过 X-User-Id / X-Session-Id 头传入，本服务不签发也不校验。
 * Conflict=409，NotHeld=404（无人持有）或 409（他人持有），Unavailable=503。
 */
@RestController
@RequestMapping("/api/v1/locks")
public class OrderLockController {

    static final String USER_HEADER = "X-User-Id";
    static final String SESSION_HEADER = "X-Session-Id";

    private final OrderLockService lockService;
    private final Clock clock;

    public OrderLockController(OrderLockService lockService, Clock clock) {
        this.lockService = lockService;
        this.clock = clock;
    }

    @PostMapping("/{resourceId}/acquire")
    public ResponseEntity<LockGrantView> acquire(@PathVariable String resourceId,
                                                 @RequestHeader(USER_HEADER) String userId,
                                                 @RequestHeader(SESSION_HEADER) String sessionId,
                                                 @Validated @RequestBody AcquireLockRequest req) {
        LockGrant grant = lockService.acquire(req.getResourceKind(), resourceId, userId, sessionId,
                toTtl(req.getTtlSeconds()));
        return ResponseEntity.ok(toView(grant));
    }

    @PostMapping("/{resourceId}/renew")
    public ResponseEntity<LockGrantView> renew(@PathVariable String resourceId,
                                               @RequestHeader(SESSION_HEADER) String sessionId,
                                               @Validated @RequestBody(required = false) RenewLockRequest req) {
        Long ttlSeconds = req == null ? null : req.getTtlSeconds();
        LockGrant grant = lockService.renew(resourceId, sessionId, toTtl(ttlSeconds));
        return ResponseEntity.ok(toView(grant));
    }

    @DeleteMapping("/{resourceId}")
    public ResponseEntity<Void> release(@PathVariable String resourceId,
                                        @RequestHeader(SESSION_HEADER) String sessionId) {
        lockService.release(resourceId, sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{resourceId}")
    public ResponseEntity<LockStatusView> inspect(@PathVariable String resourceId) {
        return ResponseEntity.ok(toView(lockService.inspect(resourceId)));
    }

    @GetMapping
    public ResponseEntity<List<LockStatusView>> listActive() {
        List<LockStatusView> views = new ArrayList<>();
        for (LockStatus status : lockService.listActive()) {
            views.add(toView(status));
        }
        return ResponseEntity.ok(views);
    }

    @ExceptionHandler(LockConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(LockConflictException e) {
        ErrorResponse body = error(HttpStatus.CONFLICT, e.getMessage());
        ErrorResponse.Holder holder = new ErrorResponse.Holder();
        holder.setUserId(e.getHolderUserId());
        holder.setUserName(e.getHolderUserName());
        holder.setExpiresAt(e.getExpiresAt());
        Duration remaining = Duration.between(clock.instant(), e.getExpiresAt());
        holder.setRemainingSeconds(Math.max(0L, remaining.getSeconds()));
        body.setHolder(holder);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(LockNotHeldException.class)
    public ResponseEntity<ErrorResponse> handleNotHeld(LockNotHeldException e) {
        HttpStatus status = e.isHeldByAnother() ? HttpStatus.CONFLICT : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(error(status, e.getMessage()));
    }

    @ExceptionHandler(LockContentionException.class)
    public ResponseEntity<ErrorResponse> handleContention(LockContentionException e) {
        ErrorResponse body = error(HttpStatus.CONFLICT, e.getMessage());
        body.setRetryable(true);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleOrderNotFound(OrderNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @ExceptionHandler(LockStoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(LockStoreUnavailableException e) {
        ErrorResponse body = error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        body.setRetryable(true);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String message = fieldError != null ? fieldError.getDefaultMessage() : "请求参数非法";
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, message));
    }

    /**
     * 请求体不是合法 JSON，或 resourceKind 不是已知取值。
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, "请求体无法解析，请检查 JSON 格式与 resourceKind 取值"));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.badRequest().body(error(HttpStatus.BAD_REQUEST, "缺少请求头 " + e.getHeaderName()));
    }

    private static Duration toTtl(Long ttlSeconds) {
        return ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds);
    }

    private static ErrorResponse error(HttpStatus status, String message) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message);
    }

    private LockGrantView toView(LockGrant g) {
        LockGrantView v = new LockGrantView();
        v.setLockId(g.getLockId());
        v.setResourceId(g.getResourceId());
        v.setResourceKind(g.getResourceKind().name());
        v.setHolderUserId(g.getHolderUserId());
        v.setGrantType(g.getType().name());
        v.setAcquiredAt(g.getAcquiredAt());
        v.setExpiresAt(g.getExpiresAt());
        v.setLastActivityAt(g.getLastActivityAt());
        return v;
    }

    private LockStatusView toView(LockStatus s) {
        LockStatusView v = new LockStatusView();
        v.setResourceId(s.getResourceId());
        v.setLocked(s.isLocked());
        v.setResourceKind(s.getResourceKind() == null ? null : s.getResourceKind().name());
        v.setHolderUserId(s.getHolderUserId());
        v.setHolderUserName(s.getHolderUserName());
        v.setAcquiredAt(s.getAcquiredAt());
        v.setExpiresAt(s.getExpiresAt());
        return v;
    }
}
