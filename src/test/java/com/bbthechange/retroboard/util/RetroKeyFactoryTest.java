package com.bbthechange.retroboard.util;

import com.bbthechange.retroboard.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RetroKeyFactoryTest {

    private static final String BOARD_ID = "11111111-1111-1111-1111-111111111111";
    private static final String CARD_ID = "33333333-3333-3333-3333-333333333333";
    private static final String USER_HASH = "0123456789abcdef".repeat(4);

    @Test
    void getBoardPk_WithValidId_ShouldReturnPrefixedKey() {
        assertThat(RetroKeyFactory.getBoardPk(BOARD_ID)).isEqualTo("BOARD#" + BOARD_ID);
    }

    @Test
    void getCardPkAndSk_ShouldShareTheCardPrefix() {
        assertThat(RetroKeyFactory.getCardPk(CARD_ID)).isEqualTo("CARD#" + CARD_ID);
        assertThat(RetroKeyFactory.getCardSk(CARD_ID)).isEqualTo("CARD#" + CARD_ID);
        assertThat(RetroKeyFactory.getMetadataSk()).isEqualTo("METADATA");
    }

    @Test
    void getReactionKeys_ShouldAddressOneVotePerUser() {
        assertThat(RetroKeyFactory.getReactionSk(USER_HASH)).isEqualTo("REACTION#" + USER_HASH);
        assertThat(RetroKeyFactory.getReactionGsiSk(CARD_ID)).isEqualTo("REACTION#" + CARD_ID);
    }

    @Test
    void getBoardUserPk_ShouldCombineBoardAndUser() {
        assertThat(RetroKeyFactory.getBoardUserPk(BOARD_ID, USER_HASH))
            .isEqualTo("BOARD#" + BOARD_ID + "#USER#" + USER_HASH);
    }

    @Test
    void getCardPk_WithNullId_ShouldThrowException() {
        assertThatThrownBy(() -> RetroKeyFactory.getCardPk(null))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Card ID cannot be null or empty");
    }

    @Test
    void getBoardPk_WithMalformedId_ShouldThrowException() {
        assertThatThrownBy(() -> RetroKeyFactory.getBoardPk("not-a-uuid"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Board ID format");
    }

    @Test
    void getReactionSk_WithUppercaseOrShortHash_ShouldThrowException() {
        assertThatThrownBy(() -> RetroKeyFactory.getReactionSk(USER_HASH.toUpperCase()))
            .isInstanceOf(InvalidKeyException.class);
        assertThatThrownBy(() -> RetroKeyFactory.getReactionSk("abc123"))
            .isInstanceOf(InvalidKeyException.class);
    }

    @Test
    void typeHelpers_ShouldRecognizeSortKeys() {
        assertThat(RetroKeyFactory.isCard("CARD#" + CARD_ID)).isTrue();
        assertThat(RetroKeyFactory.isReaction("REACTION#" + USER_HASH)).isTrue();
        assertThat(RetroKeyFactory.isCard("METADATA")).isFalse();
        assertThat(RetroKeyFactory.isReaction(null)).isFalse();
        assertThat(RetroKeyFactory.isValidId(CARD_ID)).isTrue();
        assertThat(RetroKeyFactory.isValidId("123")).isFalse();
    }
}
