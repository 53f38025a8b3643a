package com.sneaklink.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.*;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CustomAccessDeniedHandler 單元測試
 *
 * 覆蓋：403 回傳格式, 一般帳號呼叫管理端點
 */
class CustomAccessDeniedHandlerTest {

    private CustomAccessDeniedHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CustomAccessDeniedHandler(new ObjectMapper());
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("一般帳號呼叫 /api/admin/disputes — 403 + JSON")
    void returns403Json() throws Exception {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                "acc-1", null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
        HttpServletRequest request = mock(HttpServletRequest.class);
        HttpServletResponse response = mock(HttpServletResponse.class);
        StringWriter sw = new StringWriter();
        when(response.getWriter()).thenReturn(new PrintWriter(sw));
        when(request.getRequestURI()).thenReturn("/api/admin/disputes");
        when(request.getRemoteAddr()).thenReturn("192.168.1.1");

        handler.handle(request, response, new AccessDeniedException("Access is denied"));

        verify(response).setStatus(403);
        verify(response).setContentType("application/json");
        String json = sw.toString();
        assertThat(json).contains("403");
        assertThat(json).contains("權限");
    }

    @Test
    @DisplayName("未認證 — accountId 記為 unknown，不拋例外")
    void unknownAccountWhenNotAuthenticated() throws Exception {
        HttpServletRequest request = mock(HttpServletRequest.class);
        HttpServletResponse response = mock(HttpServletResponse.class);
        when(response.getWriter()).thenReturn(new PrintWriter(new StringWriter()));
        when(request.getRequestURI()).thenReturn("/api/admin/disputes");
        when(request.getRemoteAddr()).thenReturn("1.2.3.4");

        assertThatCode(() ->
                handler.handle(request, response, new AccessDeniedException("Denied"))
        ).doesNotThrowAnyException();
    }
}
