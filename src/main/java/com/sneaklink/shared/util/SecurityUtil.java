package com.sneaklink.shared.util;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * 安全工具類
 *
 * 從 SecurityContext 取得當前帳號 ID 和角色。
 * JWT 由外部登入服務簽發，principal 就是 accountId。
 */
public final class SecurityUtil {

    private SecurityUtil() {
    }

    /**
     * 取得當前登入帳號的 accountId
     *
     * @throws IllegalStateException 如果未登入
     */
    public static String getCurrentAccountId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()
                || "anonymousUser".equals(auth.getPrincipal())) {
            throw new IllegalStateException("帳號未登入");
        }
        return (String) auth.getPrincipal();
    }

    /**
     * 取得當前帳號的角色（USER / ADMIN），去掉 ROLE_ 前綴；未登入時回傳 null
     */
    public static String getCurrentRole() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return null;
        }
        return auth.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .filter(a -> a.startsWith("ROLE_"))
                .map(a -> a.substring(5))
                .findFirst()
                .orElse("USER");
    }
}
