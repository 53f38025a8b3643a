package com.sneaklink.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sneaklink.shared.dto.ErrorResponse;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * 自定義存取被拒處理器（403 Forbidden）
 *
 * 一般帳號呼叫 /api/admin/** 時觸發。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CustomAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException)
            throws IOException, ServletException {

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String accountId = auth != null ? String.valueOf(auth.getPrincipal()) : "unknown";

        log.warn("權限被拒 [{}] AccountId={} IP={} Message={}",
                request.getRequestURI(), accountId, ClientIp.of(request),
                accessDeniedException.getMessage());

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.setStatus(HttpServletResponse.SC_FORBIDDEN);

        ErrorResponse errorResponse = ErrorResponse.builder()
                .error("禁止存取 (403)")
                .message("您沒有權限執行此操作")
                .build();

        response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
    }
}
