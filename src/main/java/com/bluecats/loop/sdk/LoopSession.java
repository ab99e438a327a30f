package com.bluecats.loop.sdk;

import com.bluecats.loop.sdk.exception.NotAuthenticatedException;

/**
 * Auth token for one client. Written once by a successful login and only
 * read afterwards.
 */
class LoopSession {
    private volatile String token;

    boolean isAuthenticated() {
        String t = token;
        return t != null && !t.isEmpty();
    }

    void ensureAuthenticated() {
        if (!isAuthenticated()) throw new NotAuthenticatedException();
    }

    String token() { return token; }

    void setToken(String token) { this.token = token; }
}
