package com.sneaklink.auth.config;

import com.sneaklink.auth.filter.JwtAuthenticationFilter;
import com.sneaklink.auth.handler.CustomAccessDeniedHandler;
import com.sneaklink.auth.handler.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security 設定
 *
 * JWT 由外部登入服務簽發，這裡只驗簽。
 *
 * 路徑規則：
 * - /api/health → 公開（健康檢查）
 * - /api/subscription/webhook → 公開（Stripe callback，自己驗 Stripe-Signature）
 * - /api/admin/** → ROLE_ADMIN
 * - 其他 /api/** → 需要認證
 * - 其他 → 拒絕
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class AuthConfig {

    private final JwtAuthenticationFilter jwtAuthenticationFilter;
    private final CustomAuthenticationEntryPoint authenticationEntryPoint;
    private final CustomAccessDeniedHandler accessDeniedHandler;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(exception -> exception
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler))
                .authorizeHttpRequests(auth -> auth
                        // === 公開端點 ===
                        .requestMatchers("/api/health").permitAll()
                        .requestMatchers("/api/subscription/webhook").permitAll()

                        // === 管理端點 ===
                        .requestMatchers("/api/admin/**").hasRole("ADMIN")

                        // === 受保護：需要 JWT ===
                        .requestMatchers("/api/subscription/**").authenticated()
                        .requestMatchers("/api/quota/**").authenticated()
                        .requestMatchers("/api/session/**").authenticated()

                        // === 其他：全部拒絕 ===
                        .anyRequest().denyAll()
                )
                .addFilterBefore(jwtAuthenticationFilter,
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
