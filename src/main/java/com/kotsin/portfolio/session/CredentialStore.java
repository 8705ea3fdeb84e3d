package com.kotsin.portfolio.session;

import com.kotsin.portfolio.config.TrackerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory credential holder seeded from {@code tracker.email} / {@code tracker.password}
 * and replaceable at runtime on reconfiguration.
 */
@Component
@Slf4j
public class CredentialStore implements CredentialsProvider {

    private final AtomicReference<Credentials> credentials;

    @Autowired
    public CredentialStore(TrackerProperties props) {
        this(new Credentials(props.email(), props.password()));
    }

    public CredentialStore(Credentials initial) {
        this.credentials = new AtomicReference<>(initial);
    }

    @Override
    public Credentials current() {
        return credentials.get();
    }

    public void update(Credentials updated) {
        credentials.set(updated);
        log.info("Credentials replaced for {}", updated.email());
    }
}
