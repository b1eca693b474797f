package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.dto.CardDTO;
import com.bbthechange.retroboard.dto.CardFilter;
import com.bbthechange.retroboard.dto.CardsResponse;
import com.bbthechange.retroboard.dto.CreateCardRequest;

public interface CardService {

    /**
     * Post a card. Feedback cards are subject to the card quota, action cards are not.
     */
    CardDTO createCard(String boardId, CreateCardRequest request, String userHash, String alias);

    /**
     * Single card with its children or linked feedback embedded.
     */
    CardDTO getCard(String cardId);

    CardDTO updateContent(String cardId, String content, String userHash);

    CardDTO moveColumn(String cardId, String columnId, String userHash);

    /**
     * Delete a card owned by the requester, orphaning its children and dropping links to it.
     */
    void deleteCard(String cardId, String userHash);

    CardsResponse listCardsForBoard(String boardId, CardFilter filter);

    long countFeedbackCardsForUser(String boardId, String userHash);
}
