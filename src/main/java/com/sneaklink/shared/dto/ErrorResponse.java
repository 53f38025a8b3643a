package com.sneaklink.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 統一錯誤回應格式
 *
 * 所有 API 錯誤都使用此格式回傳，
 * 讓前端可以統一解析錯誤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    /** 錯誤類型（簡短描述） */
    private String error;

    /** 詳細錯誤訊息 */
    private String message;

    /** 機器可讀的錯誤碼（ErrorCode 名稱） */
    private String code;

    /** 額外欄位，例如配額的 limit / used */
    private Map<String, Object> details;
}
