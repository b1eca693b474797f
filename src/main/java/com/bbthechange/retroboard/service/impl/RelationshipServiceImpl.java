package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.dto.CardLinkPayload;
import com.bbthechange.retroboard.event.BoardEvent;
import com.bbthechange.retroboard.event.BoardEventPublisher;
import com.bbthechange.retroboard.event.BoardEventType;
import com.bbthechange.retroboard.exception.CardNotFoundException;
import com.bbthechange.retroboard.exception.InvalidRelationshipException;
import com.bbthechange.retroboard.exception.RelationshipViolation;
import com.bbthechange.retroboard.exception.UnauthorizedException;
import com.bbthechange.retroboard.model.ActionCard;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.model.LinkType;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.service.AggregationPropagator;
import com.bbthechange.retroboard.service.BoardLifecycleGuard;
import com.bbthechange.retroboard.service.BoardService;
import com.bbthechange.retroboard.service.RelationshipService;
import com.bbthechange.retroboard.util.ConflictRetrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Applies parent_of and linked_to relationships.
 *
 * Depth is capped at one level, so every hierarchy rule is a single-hop check on the two
 * cards involved: a parent may not have a parent, a child may not have children.
 * The store re-checks the same facts as transaction conditions.
 */
@Service
public class RelationshipServiceImpl implements RelationshipService {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipServiceImpl.class);

    private final CardRepository cardRepository;
    private final BoardService boardService;
    private final BoardLifecycleGuard lifecycleGuard;
    private final AggregationPropagator aggregationPropagator;
    private final BoardEventPublisher eventPublisher;
    private final ConflictRetrier retrier;

    @Autowired
    public RelationshipServiceImpl(CardRepository cardRepository,
                                   BoardService boardService,
                                   BoardLifecycleGuard lifecycleGuard,
                                   AggregationPropagator aggregationPropagator,
                                   BoardEventPublisher eventPublisher,
                                   ConflictRetrier retrier) {
        this.cardRepository = cardRepository;
        this.boardService = boardService;
        this.lifecycleGuard = lifecycleGuard;
        this.aggregationPropagator = aggregationPropagator;
        this.eventPublisher = eventPublisher;
        this.retrier = retrier;
    }

    @Override
    public void link(String sourceCardId, String targetCardId, LinkType linkType, String userHash) {
        logger.info("Linking card {} {} card {}", sourceCardId, linkType.getWireValue(), targetCardId);

        Card source = retrier.execute("link cards", () -> {
            Card[] pair = loadAuthorizedPair(sourceCardId, targetCardId, userHash);
            boolean changed = linkType == LinkType.PARENT_OF
                ? attachChild(pair[0], pair[1])
                : linkAction(pair[0], pair[1]);
            return changed ? pair[0] : null;
        });

        if (source == null) {
            logger.debug("Cards {} and {} already linked as {}", sourceCardId, targetCardId, linkType.getWireValue());
            return;
        }
        if (linkType == LinkType.PARENT_OF) {
            aggregationPropagator.recompute(sourceCardId);
        }

        logger.info("Linked card {} {} card {}", sourceCardId, linkType.getWireValue(), targetCardId);
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_LINKED, source.getBoardId(),
            new CardLinkPayload(sourceCardId, targetCardId, source.getBoardId(), linkType)));
    }

    @Override
    public void unlink(String sourceCardId, String targetCardId, LinkType linkType, String userHash) {
        logger.info("Unlinking card {} {} card {}", sourceCardId, linkType.getWireValue(), targetCardId);

        Card source = retrier.execute("unlink cards", () -> {
            Card[] pair = loadAuthorizedPair(sourceCardId, targetCardId, userHash);
            boolean changed = linkType == LinkType.PARENT_OF
                ? detachChild(pair[0], pair[1])
                : unlinkAction(pair[0], pair[1]);
            return changed ? pair[0] : null;
        });

        if (source == null) {
            logger.debug("Cards {} and {} were not linked as {}", sourceCardId, targetCardId, linkType.getWireValue());
            return;
        }
        if (linkType == LinkType.PARENT_OF) {
            aggregationPropagator.recompute(sourceCardId);
        }

        logger.info("Unlinked card {} {} card {}", sourceCardId, linkType.getWireValue(), targetCardId);
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_UNLINKED, source.getBoardId(),
            new CardLinkPayload(sourceCardId, targetCardId, source.getBoardId(), linkType)));
    }

    /**
     * Read both cards fresh, then run the guard and the owner-or-admin check on the source.
     */
    private Card[] loadAuthorizedPair(String sourceCardId, String targetCardId, String userHash) {
        Card source = cardRepository.findById(sourceCardId)
            .orElseThrow(() -> new CardNotFoundException("Source card not found: " + sourceCardId));
        Card target = cardRepository.findById(targetCardId)
            .orElseThrow(() -> new CardNotFoundException("Target card not found: " + targetCardId));

        lifecycleGuard.ensureOpen(source.getBoardId());

        if (!source.isOwnedBy(userHash) && !boardService.isAdmin(source.getBoardId(), userHash)) {
            throw new UnauthorizedException("Only the card creator or a board admin can change card links");
        }
        if (!source.getBoardId().equals(target.getBoardId())) {
            throw new InvalidRelationshipException(RelationshipViolation.CROSS_BOARD,
                "Cards must be on the same board");
        }
        return new Card[] {source, target};
    }

    private boolean attachChild(Card source, Card target) {
        if (!(source instanceof FeedbackCard parent) || !(target instanceof FeedbackCard child)) {
            throw new InvalidRelationshipException(RelationshipViolation.INVALID_CARD_TYPE,
                "Both cards must be feedback cards for parent-child linking");
        }
        if (parent.getCardId().equals(child.getCardId())) {
            throw new InvalidRelationshipException(RelationshipViolation.CIRCULAR_RELATIONSHIP,
                "A card cannot be its own parent");
        }
        if (child.getCardId().equals(parent.getParentCardId())) {
            throw new InvalidRelationshipException(RelationshipViolation.CIRCULAR_RELATIONSHIP,
                "Cannot create circular parent-child relationship");
        }
        if (parent.hasParent()) {
            throw new InvalidRelationshipException(RelationshipViolation.CHILD_CANNOT_BE_PARENT,
                "A child card cannot become a parent (1-level hierarchy limit)");
        }
        if (child.hasChildren()) {
            throw new InvalidRelationshipException(RelationshipViolation.PARENT_CANNOT_BE_CHILD,
                "A parent card cannot become a child (1-level hierarchy limit)");
        }
        if (parent.getCardId().equals(child.getParentCardId())) {
            return false;
        }

        FeedbackCard previousParent = null;
        if (child.hasParent()) {
            previousParent = cardRepository.findById(child.getParentCardId())
                .filter(FeedbackCard.class::isInstance)
                .map(FeedbackCard.class::cast)
                .orElseThrow(() -> new CardNotFoundException("Current parent card not found: " + child.getParentCardId()));
        }

        cardRepository.attachChild(parent, child, previousParent, aggregationPropagator.contributionOf(child));
        return true;
    }

    private boolean detachChild(Card source, Card target) {
        if (!(source instanceof FeedbackCard parent) || !(target instanceof FeedbackCard child)) {
            throw new InvalidRelationshipException(RelationshipViolation.INVALID_CARD_TYPE,
                "Both cards must be feedback cards for parent-child linking");
        }
        if (!parent.getCardId().equals(child.getParentCardId())) {
            return false;
        }

        cardRepository.detachChild(parent, child, aggregationPropagator.contributionOf(child));
        return true;
    }

    private boolean linkAction(Card source, Card target) {
        ActionCard action = requireActionToFeedback(source, target);
        if (action.isLinkedTo(target.getCardId())) {
            return false;
        }
        cardRepository.addLinkedFeedback(action, (FeedbackCard) target);
        return true;
    }

    private boolean unlinkAction(Card source, Card target) {
        ActionCard action = requireActionToFeedback(source, target);
        if (!action.isLinkedTo(target.getCardId())) {
            return false;
        }
        cardRepository.removeLinkedFeedback(action, target.getCardId());
        return true;
    }

    private static ActionCard requireActionToFeedback(Card source, Card target) {
        if (!(source instanceof ActionCard action)) {
            throw new InvalidRelationshipException(RelationshipViolation.INVALID_CARD_TYPE,
                "Source card must be an action card");
        }
        if (!(target instanceof FeedbackCard)) {
            throw new InvalidRelationshipException(RelationshipViolation.INVALID_CARD_TYPE,
                "Target card must be a feedback card");
        }
        return action;
    }
}
