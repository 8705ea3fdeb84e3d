package com.kotsin.portfolio.session;

/**
 * Source of credentials for silent re-authentication. Persistence belongs to
 * the implementation; the session manager only passes them through.
 */
@FunctionalInterface
public interface CredentialsProvider {

    Credentials current();
}
