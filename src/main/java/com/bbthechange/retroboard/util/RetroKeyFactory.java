package com.bbthechange.retroboard.util;

import com.bbthechange.retroboard.exception.InvalidKeyException;

import java.util.regex.Pattern;

/**
 * Type-safe key factory for the RetroBoardTable single-table design.
 *
 * Layout:
 * <pre>
 *   Board     pk=BOARD#{boardId}  sk=METADATA
 *   Card      pk=CARD#{cardId}    sk=METADATA
 *             gsi1pk=BOARD#{boardId}                 gsi1sk=CARD#{cardId}     (BoardIndex)
 *             gsi2pk=BOARD#{boardId}#USER#{userHash} gsi2sk=CARD#{cardId}     (BoardUserIndex)
 *   Reaction  pk=CARD#{cardId}    sk=REACTION#{userHash}
 *             gsi2pk=BOARD#{boardId}#USER#{userHash} gsi2sk=REACTION#{cardId} (BoardUserIndex)
 * </pre>
 */
public final class RetroKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern USER_HASH_PATTERN = Pattern.compile("[0-9a-f]{64}");

    public static final String BOARD_PREFIX = "BOARD";
    public static final String CARD_PREFIX = "CARD";
    public static final String REACTION_PREFIX = "REACTION";
    public static final String USER_PREFIX = "USER";
    public static final String METADATA_SUFFIX = "METADATA";

    // Index names
    public static final String BOARD_INDEX = "BoardIndex";
    public static final String BOARD_USER_INDEX = "BoardUserIndex";

    private RetroKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    private static void validateUserHash(String userHash) {
        if (userHash == null || !USER_HASH_PATTERN.matcher(userHash).matches()) {
            throw new InvalidKeyException("Invalid user hash format");
        }
    }

    public static boolean isValidId(String id) {
        return id != null && UUID_PATTERN.matcher(id).matches();
    }

    // Board keys
    public static String getBoardPk(String boardId) {
        validateId(boardId, "Board");
        return BOARD_PREFIX + DELIMITER + boardId;
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    // Card keys
    public static String getCardPk(String cardId) {
        validateId(cardId, "Card");
        return CARD_PREFIX + DELIMITER + cardId;
    }

    public static String getCardSk(String cardId) {
        validateId(cardId, "Card");
        return CARD_PREFIX + DELIMITER + cardId;
    }

    // Reaction keys
    public static String getReactionSk(String userHash) {
        validateUserHash(userHash);
        return REACTION_PREFIX + DELIMITER + userHash;
    }

    public static String getReactionGsiSk(String cardId) {
        validateId(cardId, "Card");
        return REACTION_PREFIX + DELIMITER + cardId;
    }

    // BoardUserIndex partition
    public static String getBoardUserPk(String boardId, String userHash) {
        validateId(boardId, "Board");
        validateUserHash(userHash);
        return BOARD_PREFIX + DELIMITER + boardId + DELIMITER + USER_PREFIX + DELIMITER + userHash;
    }

    // Prefixes for begins_with conditions
    public static String getCardPrefix() {
        return CARD_PREFIX + DELIMITER;
    }

    public static String getReactionPrefix() {
        return REACTION_PREFIX + DELIMITER;
    }

    // Type checking helpers
    public static boolean isCard(String sortKey) {
        return sortKey != null && sortKey.startsWith(CARD_PREFIX + DELIMITER);
    }

    public static boolean isReaction(String sortKey) {
        return sortKey != null && sortKey.startsWith(REACTION_PREFIX + DELIMITER);
    }
}
