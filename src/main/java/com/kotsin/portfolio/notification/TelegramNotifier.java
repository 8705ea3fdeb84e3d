package com.kotsin.portfolio.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Relays persistent notifications to a Telegram chat. Silent when no bot is configured.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TelegramNotifier implements NotificationRelay {

    private final OkHttpClient http;

    @Value("${telegram.bot.token:}")
    private String botToken;

    @Value("${telegram.chat.id:}")
    private String chatId;

    @Value("${telegram.api-url:https://api.telegram.org}")
    private String apiUrl;

    @Override
    public void send(PersistentNotification notification) {
        if (botToken == null || botToken.isBlank() || chatId == null || chatId.isBlank()) {
            log.debug("Telegram not configured; skipping notification {}", notification.notificationId());
            return;
        }
        String text = notification.title() + "\n" + notification.message();
        String url = apiUrl + "/bot" + botToken + "/sendMessage";
        FormBody body = new FormBody.Builder()
                .add("chat_id", chatId)
                .add("text", text)
                .build();
        Request req = new Request.Builder().url(url).post(body).build();
        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                log.warn("Telegram send failed: HTTP {}", resp.code());
            }
        } catch (Exception e) {
            log.warn("Telegram send error: {}", e.toString());
        }
    }
}
