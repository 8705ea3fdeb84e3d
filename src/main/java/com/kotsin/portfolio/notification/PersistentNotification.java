package com.kotsin.portfolio.notification;

import com.kotsin.portfolio.error.FetchErrorKind;

import java.time.Instant;

public record PersistentNotification(String notificationId,
                                     String portfolioId,
                                     String title,
                                     String message,
                                     FetchErrorKind kind,
                                     Instant createdAt) {
}
