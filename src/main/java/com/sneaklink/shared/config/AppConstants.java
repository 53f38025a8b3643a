package com.sneaklink.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * 全域應用常數
 *
 * 透過 Spring 啟動時讀取 application.yml 設定，
 * 寫入 static 欄位供 Entity（@PrePersist）等靜態 context 使用。
 *
 * 計費日與每日配額窗口都以 UTC 計算，預設值不要改成本地時區。
 */
@Component
public class AppConstants {

    /** 應用時區（ZoneId），供 LocalDateTime.now(ZONE_ID) 使用 */
    public static ZoneId ZONE_ID = ZoneId.of("UTC");

    @Value("${app.timezone:UTC}")
    public void setTimezone(String tz) {
        ZONE_ID = ZoneId.of(tz);
    }
}
