package com.lendledger.access;

/** Fails the whole operation when {@code caller} may not run {@code action}. */
public interface AuthorizationCheck {

    void requireClaim(String action, String caller);
}
