package com.work.orderlock.support;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 参数校验工具类。所有校验都发生在访问存储之前。
 */
public final class ValidationUtils {

    /**
     * resourceId 合法字符集与长度限制：
     * 仅允许大小写字母、数字以及少量分隔符，长度 1~64。
     */
    private static final Pattern RESOURCE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9:_-]{1,64}$");

    /**
     * 与 order_locks.locked_by_user_id / locked_by_session_id 的列宽一致。
     */
    public static final int MAX_USER_ID_LENGTH = 64;
    public static final int MAX_SESSION_ID_LENGTH = 255;

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 校验 resourceId 的格式与长度。
     * <p>约束：长度 1~64，仅允许 [a-zA-Z0-9:_-]。</p>
     */
    public static String requireValidResourceId(String resourceId) {
        requireNonEmpty(resourceId, "resourceId");
        if (!RESOURCE_ID_PATTERN.matcher(resourceId).matches()) {
            throw new IllegalArgumentException("resourceId 非法，只允许 1~64 位的字母、数字、':'、'_'、'-'");
        }
        return resourceId;
    }

    /**
     * 校验调用方身份（userId / sessionId）：非空且不超过存储列宽，超长值不能落到存储层再报错。
     */
    public static String requireValidIdentity(String value, String paramName, int maxLength) {
        requireNonEmpty(value, paramName);
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(paramName + " 长度不能超过 " + maxLength);
        }
        return value;
    }

    /**
     * 校验 ttl：必须大于 0 且不超过 maxTtl。
     */
    public static Duration requireValidTtl(Duration ttl, Duration maxTtl) {
        requirePositive(ttl, "ttl");
        if (ttl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("ttl 不能超过 " + maxTtl);
        }
        return ttl;
    }
}
