package com.bbthechange.retroboard.repository;

import com.bbthechange.retroboard.model.ActionCard;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.FeedbackCard;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Card storage. Every write that depends on previously read state is conditional and
 * raises {@link com.bbthechange.retroboard.exception.VersionConflictException} when
 * that state has moved on.
 */
public interface CardRepository {

    /**
     * Insert a new card. Fails if the id is already taken.
     */
    Card save(Card card);

    /**
     * Strongly consistent read of a single card.
     */
    Optional<Card> findById(String cardId);

    /**
     * Strongly consistent read of several cards. Missing ids are skipped.
     */
    List<Card> findByIds(Collection<String> cardIds);

    /**
     * All cards on a board, parents, children and action cards alike.
     */
    List<Card> findByBoardId(String boardId);

    /**
     * Action cards on the board whose linked feedback set contains the given card.
     */
    List<ActionCard> findActionCardsLinkedTo(String boardId, String feedbackCardId);

    /**
     * Number of feedback cards the user created on the board.
     */
    long countFeedbackCards(String boardId, String ownerHash);

    Optional<Card> updateContent(String cardId, String content);

    Optional<Card> updateColumn(String cardId, String columnId);

    /**
     * Make {@code child} a child of {@code parent} and add {@code contribution} to the parent's
     * aggregate, moving the child away from {@code previousParent} when that is not null.
     */
    void attachChild(FeedbackCard parent, FeedbackCard child, FeedbackCard previousParent, int contribution);

    /**
     * Turn {@code child} back into a standalone card and remove {@code contribution}
     * from the parent's aggregate.
     */
    void detachChild(FeedbackCard parent, FeedbackCard child, int contribution);

    /**
     * Link {@code feedback} to {@code action}. The feedback card's version is bumped in the
     * same transaction, so a stale {@code feedback} fails with a VersionConflictException.
     */
    void addLinkedFeedback(ActionCard action, FeedbackCard feedback);

    void removeLinkedFeedback(ActionCard action, String feedbackCardId);

    void delete(CardDeletion deletion);

    /**
     * Overwrite the aggregate of a card if it is still at the version it was read at.
     *
     * @return false when the card changed in the meantime
     */
    boolean replaceAggregatedCount(Card card, int aggregatedReactionCount);
}
