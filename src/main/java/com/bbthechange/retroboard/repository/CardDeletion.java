package com.bbthechange.retroboard.repository;

import com.bbthechange.retroboard.model.ActionCard;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.model.Reaction;

import java.util.List;

/**
 * Everything a card delete has to touch, gathered from one consistent read of the card.
 *
 * @param card the card being deleted, at the version the plan was built from
 * @param parent its parent, or null
 * @param parentContribution amount to subtract from the parent's aggregate
 * @param children cards to turn into standalone cards
 * @param linkingActions action cards whose links to this card must be dropped
 * @param reactions reactions placed on the card
 */
public record CardDeletion(Card card,
                           FeedbackCard parent,
                           int parentContribution,
                           List<FeedbackCard> children,
                           List<ActionCard> linkingActions,
                           List<Reaction> reactions) {
}
