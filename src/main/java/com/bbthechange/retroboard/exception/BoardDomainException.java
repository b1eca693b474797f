package com.bbthechange.retroboard.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every typed outcome the card engine reports to its callers.
 * Carries a category, a specific code and optional structured details.
 */
public abstract class BoardDomainException extends RuntimeException {

    private final ErrorCategory category;
    private final String code;
    private final Map<String, Object> details;

    protected BoardDomainException(ErrorCategory category, String code, String message) {
        this(category, code, message, Collections.emptyMap());
    }

    protected BoardDomainException(ErrorCategory category, String code, String message, Map<String, Object> details) {
        super(message);
        this.category = category;
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
