package com.sneaklink.notification.service;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.sneaklink.notification.config.OpsWebhookConfig;
import com.sneaklink.notification.event.EntitlementEvent;
import com.sneaklink.shared.config.AppConstants;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 營運通知服務
 *
 * 退款、爭議、裝置超限這類需要人看的事件推到營運頻道。
 *
 * 特性：
 * - 非同步發送（enqueue），不阻塞業務流程
 * - enabled=false 或 URL 為空時靜默跳過
 * - Embed 格式（帶顏色條和時間戳記）
 */
@Slf4j
@Service
public class OpsWebhookService {

    // 顏色常量
    public static final int COLOR_GREEN  = 0x00FF00;  // 成功
    public static final int COLOR_RED    = 0xFF0000;  // 退款 / 爭議
    public static final int COLOR_YELLOW = 0xFFFF00;  // 警告
    public static final int COLOR_BLUE   = 0x3498DB;  // 資訊

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final OkHttpClient httpClient;
    private final OpsWebhookConfig config;
    private final Gson gson = new Gson();

    public OpsWebhookService(OkHttpClient httpClient, OpsWebhookConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    @EventListener
    public void onEvent(EntitlementEvent event) {
        switch (event.type()) {
            case SUBSCRIPTION_REFUNDED -> sendNotification(
                    "💸 訂閱已退款", describe(event), COLOR_RED);
            case DISPUTE_RECORDED -> sendNotification(
                    "⚠️ 收到付款爭議", describe(event), COLOR_RED);
            case DEVICE_LIMIT_WARNING -> sendNotification(
                    "📱 裝置數超過方案上限", describe(event), COLOR_YELLOW);
            default -> {
                // 啟用、配額事件量大，不推營運頻道
            }
        }
    }

    /**
     * 發送通知
     *
     * @param title   標題
     * @param message 內容（多行描述）
     * @param color   嵌入顏色（用上面的常量）
     */
    public void sendNotification(String title, String message, int color) {
        if (!config.isEnabled()) {
            return;
        }
        String url = config.getUrl();
        if (url == null || url.isBlank()) {
            return;
        }

        String timestamp = ZonedDateTime.now(AppConstants.ZONE_ID).format(TIME_FMT);
        String json = buildEmbedJson(title, message, color, timestamp);

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(json, JSON))
                .build();

        // 非同步發送，不阻塞主流程
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("營運 Webhook 發送失敗: {}", e.getMessage());
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (!response.isSuccessful()) {
                        log.warn("營運 Webhook 回應異常: HTTP {} - {}",
                                response.code(),
                                response.body() != null ? response.body().string() : "no body");
                    } else {
                        log.debug("營運 Webhook 發送成功");
                    }
                } catch (IOException e) {
                    log.warn("讀取 Webhook 回應失敗: {}", e.getMessage());
                }
            }
        });
    }

    /**
     * {"embeds":[{"title":..., "description":..., "color":..., "footer":{"text":...}}]}
     */
    String buildEmbedJson(String title, String description, int color, String timestamp) {
        JsonObject footer = new JsonObject();
        footer.addProperty("text", "SneakLink Billing | " + timestamp);

        JsonObject embed = new JsonObject();
        embed.addProperty("title", title);
        embed.addProperty("description", description);
        embed.addProperty("color", color);
        embed.add("footer", footer);

        JsonArray embeds = new JsonArray();
        embeds.add(embed);

        JsonObject root = new JsonObject();
        root.add("embeds", embeds);
        return gson.toJson(root);
    }

    private String describe(EntitlementEvent event) {
        String attrs = event.attributes().entrySet().stream()
                .map(Map.Entry::toString)
                .collect(Collectors.joining("\n"));
        return "帳號: " + event.accountId() + (attrs.isEmpty() ? "" : "\n" + attrs);
    }
}
