package com.kotsin.portfolio.notification;

import com.kotsin.portfolio.error.FetchErrorKind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TelegramNotifierTest {

    private MockWebServer server;
    private TelegramNotifier notifier;

    private final PersistentNotification notification = new PersistentNotification(
            "investing_portfolio_main_error", "42", "Investing Portfolio - Main",
            "❌ Invalid portfolio ID for 'Main'.", FetchErrorKind.PORTFOLIO_NOT_FOUND,
            Instant.parse("2026-01-12T10:00:00Z"));

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        notifier = new TelegramNotifier(new OkHttpClient());
        String base = server.url("/").toString();
        ReflectionTestUtils.setField(notifier, "apiUrl", base.substring(0, base.length() - 1));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Unconfigured bot sends nothing")
    void testSkippedWhenUnconfigured() {
        ReflectionTestUtils.setField(notifier, "botToken", "");
        ReflectionTestUtils.setField(notifier, "chatId", "");

        notifier.send(notification);

        assertEquals(0, server.getRequestCount());
    }

    @Test
    @DisplayName("Configured bot posts title and message to the chat")
    void testSend() throws Exception {
        ReflectionTestUtils.setField(notifier, "botToken", "123:abc");
        ReflectionTestUtils.setField(notifier, "chatId", "999");
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));

        notifier.send(notification);

        RecordedRequest req = server.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(req);
        assertEquals("POST", req.getMethod());
        assertEquals("/bot123:abc/sendMessage", req.getPath());
        String body = URLDecoder.decode(req.getBody().readUtf8(), StandardCharsets.UTF_8);
        assertTrue(body.contains("chat_id=999"), body);
        assertTrue(body.contains("text=Investing Portfolio - Main\n"), body);
    }

    @Test
    @DisplayName("Telegram errors are logged, never thrown")
    void testFailureSwallowed() {
        ReflectionTestUtils.setField(notifier, "botToken", "123:abc");
        ReflectionTestUtils.setField(notifier, "chatId", "999");
        server.enqueue(new MockResponse().setResponseCode(500));

        assertDoesNotThrow(() -> notifier.send(notification));
        assertEquals(1, server.getRequestCount());
    }
}
