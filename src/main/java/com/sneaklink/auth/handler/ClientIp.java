package com.sneaklink.auth.handler;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 從 request 中提取真實的客戶端 IP
 * 支援：直連 IP、X-Forwarded-For、X-Real-IP
 */
final class ClientIp {

    private ClientIp() {
    }

    static String of(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isEmpty()) {
            return forwarded.split(",")[0].trim();
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isEmpty()) {
            return realIp;
        }

        return request.getRemoteAddr();
    }
}
