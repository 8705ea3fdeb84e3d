package com.kotsin.portfolio.session;

import com.kotsin.portfolio.config.TrackerProperties;
import com.kotsin.portfolio.error.FetchErrorKind;
import com.kotsin.portfolio.error.PortfolioFetchException;
import com.kotsin.portfolio.provider.PortfolioProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the one authenticated identity shared by every portfolio.
 *
 * <p>Readers take the current token without locking. Logins go through
 * {@code loginLock} with a double-check, so a burst of expired-token reports
 * from several portfolios produces a single login call and every waiter
 * observes its result.
 */
@Service
@Slf4j
public class SessionManager {

    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final PortfolioProvider provider;
    private final CredentialsProvider credentialsProvider;
    private final Clock clock;
    private final Duration maxTokenAge;
    private final MeterRegistry meterRegistry;
    private final ObjectMapper mapper = new ObjectMapper();

    private final ReentrantLock loginLock = new ReentrantLock();
    private final AtomicReference<Session> session = new AtomicReference<>(Session.unauthenticated());

    @Autowired
    public SessionManager(PortfolioProvider provider,
                          CredentialsProvider credentialsProvider,
                          Clock clock,
                          TrackerProperties props,
                          MeterRegistry meterRegistry) {
        this(provider, credentialsProvider, clock, props.maxTokenAge(), meterRegistry);
    }

    public SessionManager(PortfolioProvider provider,
                          CredentialsProvider credentialsProvider,
                          Clock clock,
                          Duration maxTokenAge,
                          MeterRegistry meterRegistry) {
        this.provider = provider;
        this.credentialsProvider = credentialsProvider;
        this.clock = clock;
        this.maxTokenAge = maxTokenAge;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns a usable token, logging in first when the session is missing or expired.
     *
     * @throws PortfolioFetchException INVALID_CREDENTIALS when the last login was rejected
     *                                 (no network call is made), or the login failure
     */
    public String getValidToken() {
        Session current = session.get();
        if (current.isUsable(clock.instant(), EXPIRY_SKEW, maxTokenAge)) {
            return current.getToken();
        }
        loginLock.lock();
        try {
            current = session.get();
            if (current.isUsable(clock.instant(), EXPIRY_SKEW, maxTokenAge)) {
                return current.getToken(); // another thread already refreshed
            }
            if (current.getState() == SessionState.INVALID) {
                throw PortfolioFetchException.invalidCredentials(
                        "Credentials were rejected by the provider; reconfigure to resume");
            }
            Credentials credentials = credentialsProvider.current();
            if (credentials == null || !credentials.isComplete()) {
                session.set(current.toBuilder().state(SessionState.INVALID).build());
                throw PortfolioFetchException.invalidCredentials("No credentials configured");
            }
            log.info("[Session] Re-authenticating (state={})", current.getState());
            return login(credentials.email(), credentials.password()).getToken();
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Explicit login, e.g. after reconfiguration. Clears an INVALID state on success.
     * A credential rejection moves the session to INVALID; a network failure leaves it unchanged.
     */
    public Session authenticate(String email, String password) {
        loginLock.lock();
        try {
            return login(email, password);
        } finally {
            loginLock.unlock();
        }
    }

    /**
     * Forces the next {@link #getValidToken()} to log in again. Also lifts INVALID.
     */
    public void invalidate() {
        Session expired = session.updateAndGet(s -> s.getState() == SessionState.UNAUTHENTICATED ? s : s.expire());
        log.info("[Session] Invalidated, state={}", expired.getState());
    }

    /**
     * Expires the session only if it still carries {@code rejectedToken}; a
     * token that was already replaced by a concurrent login is left alone.
     */
    public void invalidate(String rejectedToken) {
        session.updateAndGet(s -> s.getState() == SessionState.VALID && rejectedToken.equals(s.getToken())
                ? s.expire() : s);
    }

    /**
     * Escalates a freshly issued token that the provider rejected again.
     */
    public void markInvalid(String rejectedToken) {
        Session updated = session.updateAndGet(s -> rejectedToken.equals(s.getToken()) ? s.invalid() : s);
        if (updated.getState() == SessionState.INVALID) {
            log.error("[Session] Provider rejected a fresh token; session marked INVALID");
        }
    }

    public void logout() {
        session.set(Session.unauthenticated());
        log.info("[Session] Logged out");
    }

    public Session currentSession() {
        return session.get();
    }

    // ---------------------------------------------------------------------
    // Must be called with loginLock held
    // ---------------------------------------------------------------------
    private Session login(String email, String password) {
        try {
            String token = provider.authenticate(email, password);
            if (token == null || token.isBlank()) {
                throw PortfolioFetchException.decode("Login response carried an empty token");
            }
            Instant now = clock.instant();
            Session fresh = Session.builder()
                    .token(token)
                    .issuedAt(now)
                    .expiresAt(decodeJwtExpiry(token))
                    .state(SessionState.VALID)
                    .build();
            session.set(fresh);
            meterRegistry.counter("portfolio.session.logins", "outcome", "success").increment();
            log.info("✅ [Session] Login successful for {}, expiry {}", email,
                    fresh.hasUnknownExpiry() ? "unknown" : fresh.getExpiresAt());
            return fresh;
        } catch (PortfolioFetchException e) {
            meterRegistry.counter("portfolio.session.logins", "outcome", e.getKind().name()).increment();
            if (e.getKind() == FetchErrorKind.INVALID_CREDENTIALS) {
                session.set(session.get().invalid());
                log.error("[Session] Login rejected for {}: {}", email, e.getMessage());
            } else {
                log.warn("[Session] Login failed for {} ({}): {}", email, e.getKind(), e.getMessage());
            }
            throw e;
        }
    }

    /**
     * Reads the {@code exp} claim when the token is a JWT; null otherwise.
     */
    Instant decodeJwtExpiry(String token) {
        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            return null;
        }
        try {
            String payloadJson = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            JsonNode exp = mapper.readTree(payloadJson).path("exp");
            return exp.isNumber() ? Instant.ofEpochSecond(exp.asLong()) : null;
        } catch (Exception e) {
            log.debug("Token is not a decodable JWT: {}", e.toString());
            return null;
        }
    }
}
