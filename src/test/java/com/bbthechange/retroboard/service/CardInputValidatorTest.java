package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CardInputValidatorTest {

    private final CardInputValidator validator = new CardInputValidator(new CardEngineProperties());

    @Test
    void validateContent_TrimsSurroundingWhitespace() {
        assertThat(validator.validateContent("  ship it  ")).isEqualTo("ship it");
    }

    @Test
    void validateContent_RejectsBlankAndOversized() {
        assertThatThrownBy(() -> validator.validateContent("   "))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Content is required");
        assertThatThrownBy(() -> validator.validateContent(null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validateContent("x".repeat(5001)))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("5000");
    }

    @Test
    void validateContent_AcceptsExactlyMaxLength() {
        assertThat(validator.validateContent("x".repeat(5000))).hasSize(5000);
    }

    @Test
    void validateColumnId_RejectsMissingAndTooLong() {
        assertThatThrownBy(() -> validator.validateColumnId(""))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validateColumnId("c".repeat(51)))
            .isInstanceOf(ValidationException.class);
        assertThat(validator.validateColumnId("went-well")).isEqualTo("went-well");
    }

    @Test
    void normalizeAlias_BlankBecomesNull() {
        assertThat(validator.normalizeAlias("  ")).isNull();
        assertThat(validator.normalizeAlias(" Sam ")).isEqualTo("Sam");
        assertThatThrownBy(() -> validator.normalizeAlias("n".repeat(51)))
            .isInstanceOf(ValidationException.class);
    }
}
