package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Shared checks on user-supplied card text, column ids and aliases.
 */
@Component
public class CardInputValidator {

    private final CardEngineProperties properties;

    @Autowired
    public CardInputValidator(CardEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * @return the content, trimmed
     */
    public String validateContent(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Content is required");
        }
        if (trimmed.length() > properties.getMaxContentLength()) {
            throw new ValidationException(
                "Content must be " + properties.getMaxContentLength() + " characters or less");
        }
        return trimmed;
    }

    public String validateColumnId(String columnId) {
        if (columnId == null || columnId.isBlank()) {
            throw new ValidationException("Column ID is required");
        }
        if (columnId.length() > properties.getMaxColumnIdLength()) {
            throw new ValidationException(
                "Column ID must be " + properties.getMaxColumnIdLength() + " characters or less");
        }
        return columnId;
    }

    /**
     * @return the alias trimmed, or null when none was given
     */
    public String normalizeAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            return null;
        }
        String trimmed = alias.trim();
        if (trimmed.length() > properties.getMaxAliasLength()) {
            throw new ValidationException(
                "Alias must be " + properties.getMaxAliasLength() + " characters or less");
        }
        return trimmed;
    }
}
