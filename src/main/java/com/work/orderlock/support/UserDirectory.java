package com.work.orderlock.support;

import java.util.Optional;

/**
 * 用户展示名查询，用于"订单正在被 X 编辑"之类的提示。
 */
public interface UserDirectory {

    String UNKNOWN_USER = "Unknown User";

    Optional<String> findDisplayName(String userId);

    static UserDirectory none() {
        return userId -> Optional.empty();
    }
}
