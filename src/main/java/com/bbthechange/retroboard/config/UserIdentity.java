package com.bbthechange.retroboard.config;

import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Who is calling, as far as the card engine cares: a stable hash of the session cookie and
 * an optional display alias from the X-User-Alias header. The raw session id never leaves
 * the filter.
 */
public record UserIdentity(String userHash, String alias) {

    public static final String HASH_ATTRIBUTE = "userHash";
    public static final String ALIAS_ATTRIBUTE = "userAlias";
    public static final String ALIAS_HEADER = "X-User-Alias";

    public static UserIdentity fromSession(String sessionId, String alias) {
        return new UserIdentity(hash(sessionId), alias);
    }

    /**
     * SHA-256 of the session id as 64 lowercase hex characters.
     */
    public static String hash(String sessionId) {
        return DigestUtils.sha256Hex(sessionId);
    }

    public void applyTo(HttpServletRequest request) {
        request.setAttribute(HASH_ATTRIBUTE, userHash);
        if (alias != null) {
            request.setAttribute(ALIAS_ATTRIBUTE, alias);
        }
    }

    /**
     * Short prefix of the hash for log lines.
     */
    public String toLogString() {
        return userHash.substring(0, 8);
    }
}
