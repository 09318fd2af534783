package org.checkout.controller;

import org.springframework.util.StringUtils;

/**
 * 请求用户解析：优先取 X-User-Id 请求头，否则使用配置的默认用户
 */
final class UserContext {

    static final String USER_ID_HEADER = "X-User-Id";

    private UserContext() {
    }

    static String resolve(String headerValue, String defaultUserId) {
        return StringUtils.hasText(headerValue) ? headerValue.trim() : defaultUserId;
    }
}
