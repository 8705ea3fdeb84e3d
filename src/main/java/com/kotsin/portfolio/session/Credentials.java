package com.kotsin.portfolio.session;

/**
 * Login credentials. {@link #toString()} never prints the password.
 */
public record Credentials(String email, String password) {

    public boolean isComplete() {
        return email != null && !email.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[email=" + email + "]";
    }
}
