package com.sneaklink.auth.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.*;
import org.springframework.security.authentication.BadCredentialsException;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * CustomAuthenticationEntryPoint / ClientIp 單元測試
 */
class CustomAuthenticationEntryPointTest {

    private CustomAuthenticationEntryPoint entryPoint;

    @BeforeEach
    void setUp() {
        entryPoint = new CustomAuthenticationEntryPoint(new ObjectMapper());
    }

    @Test
    @DisplayName("回傳 401 + JSON 格式")
    void returns401Json() throws Exception {
        HttpServletRequest request = mock(HttpServletRequest.class);
        HttpServletResponse response = mock(HttpServletResponse.class);
        StringWriter sw = new StringWriter();
        when(response.getWriter()).thenReturn(new PrintWriter(sw));
        when(request.getRequestURI()).thenReturn("/api/quota");
        when(request.getRemoteAddr()).thenReturn("192.168.1.1");

        entryPoint.commence(request, response,
                new BadCredentialsException("Full authentication is required"));

        verify(response).setStatus(401);
        verify(response).setContentType("application/json");
        String json = sw.toString();
        assertThat(json).contains("401");
        assertThat(json).contains("Bearer Token");
    }

    @Nested
    @DisplayName("ClientIp 解析")
    class ClientIpTests {

        @Test
        @DisplayName("X-Forwarded-For 取第一個 IP")
        void forwardedFor() {
            HttpServletRequest request = mock(HttpServletRequest.class);
            when(request.getHeader("X-Forwarded-For")).thenReturn("203.0.113.50, 70.41.3.18");

            assertThat(ClientIp.of(request)).isEqualTo("203.0.113.50");
        }

        @Test
        @DisplayName("X-Real-IP 次之")
        void realIp() {
            HttpServletRequest request = mock(HttpServletRequest.class);
            when(request.getHeader("X-Real-IP")).thenReturn("198.51.100.7");

            assertThat(ClientIp.of(request)).isEqualTo("198.51.100.7");
        }

        @Test
        @DisplayName("都沒有 — remoteAddr")
        void remoteAddr() {
            HttpServletRequest request = mock(HttpServletRequest.class);
            when(request.getRemoteAddr()).thenReturn("10.0.0.1");

            assertThat(ClientIp.of(request)).isEqualTo("10.0.0.1");
        }
    }
}
