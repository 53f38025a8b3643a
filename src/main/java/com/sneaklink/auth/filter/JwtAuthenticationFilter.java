package com.sneaklink.auth.filter;

import com.sneaklink.auth.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * 帳號身分過濾器
 *
 * 權益相關的 API（訂閱、配額、裝置）都以 token 裡的 accountId 為準，
 * 不接受 request body 或 query 自己帶帳號。
 * - subject 空白的 token 視為無效：沒有帳號就沒有權益可查
 * - role 只認 USER / ADMIN，其他值一律降為 USER，避免自訂 authority 混進 /api/admin/**
 * - 請求期間把 accountId 放進 MDC（key = accountId），配額 / 驗證 / 退款的 log 都帶得到
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String MDC_ACCOUNT = "accountId";

    private static final Set<String> KNOWN_ROLES = Set.of("USER", "ADMIN");

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String accountId = authenticate(request);
        if (accountId != null) {
            MDC.put(MDC_ACCOUNT, accountId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_ACCOUNT);
        }
    }

    /**
     * @return 認證成功的 accountId；沒有或無效的 token 回 null（交給 AuthConfig 決定是否 401）
     */
    private String authenticate(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            return null;
        }

        String token = authHeader.substring(7);
        try {
            if (!jwtService.validateToken(token)) {
                return null;
            }
            String accountId = jwtService.extractAccountId(token);
            if (accountId == null || accountId.isBlank()) {
                log.warn("帳號 token 缺少 subject，不建立身分: uri={}", request.getRequestURI());
                return null;
            }
            String role = normalizeRole(accountId, jwtService.extractRole(token));

            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(
                            accountId,
                            null,
                            List.of(new SimpleGrantedAuthority("ROLE_" + role))
                    );
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("帳號身分已建立: accountId={} role={}", accountId, role);
            return accountId;
        } catch (Exception e) {
            log.warn("帳號 token 解析失敗，視為未登入: {}", e.getMessage());
            return null;
        }
    }

    private String normalizeRole(String accountId, String role) {
        if (role != null && KNOWN_ROLES.contains(role)) {
            return role;
        }
        log.warn("未知的帳號角色，降為 USER: accountId={} role={}", accountId, role);
        return "USER";
    }
}
