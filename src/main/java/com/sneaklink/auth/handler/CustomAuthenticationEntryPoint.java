package com.sneaklink.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sneaklink.shared.dto.ErrorResponse;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 自定義認證進入點（401 Unauthorized）
 *
 * 缺少或無效的 JWT 時回傳統一 JSON，而不是 Spring 預設的 HTML。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CustomAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException)
            throws IOException, ServletException {

        String authHeader = request.getHeader("Authorization");

        log.warn("認證失敗 [{}] IP={} Header={} Message={}",
                request.getRequestURI(), ClientIp.of(request),
                authHeader != null ? "present" : "missing",
                authException.getMessage());

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);

        ErrorResponse errorResponse = ErrorResponse.builder()
                .error("未授權 (401)")
                .message("請提供有效的 Bearer Token。格式: Authorization: Bearer {token}")
                .build();

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
