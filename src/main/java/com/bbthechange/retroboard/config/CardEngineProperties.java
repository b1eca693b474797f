package com.bbthechange.retroboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "retro.engine")
public class CardEngineProperties {

    private int maxContentLength = 5000;

    private int maxColumnIdLength = 50;

    private int maxAliasLength = 50;

    private int maxTransactionRetries = 3;

    private String sessionCookieName = "retro_session_id";

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    public int getMaxColumnIdLength() {
        return maxColumnIdLength;
    }

    public void setMaxColumnIdLength(int maxColumnIdLength) {
        this.maxColumnIdLength = maxColumnIdLength;
    }

    public int getMaxAliasLength() {
        return maxAliasLength;
    }

    public void setMaxAliasLength(int maxAliasLength) {
        this.maxAliasLength = maxAliasLength;
    }

    public int getMaxTransactionRetries() {
        return maxTransactionRetries;
    }

    public void setMaxTransactionRetries(int maxTransactionRetries) {
        this.maxTransactionRetries = maxTransactionRetries;
    }

    public String getSessionCookieName() {
        return sessionCookieName;
    }

    public void setSessionCookieName(String sessionCookieName) {
        this.sessionCookieName = sessionCookieName;
    }
}
