package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.dto.*;
import com.bbthechange.retroboard.event.BoardEvent;
import com.bbthechange.retroboard.event.BoardEventPublisher;
import com.bbthechange.retroboard.event.BoardEventType;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import com.bbthechange.retroboard.exception.CardNotFoundException;
import com.bbthechange.retroboard.exception.LimitReachedException;
import com.bbthechange.retroboard.exception.UnauthorizedException;
import com.bbthechange.retroboard.exception.ValidationException;
import com.bbthechange.retroboard.model.*;
import com.bbthechange.retroboard.repository.CardDeletion;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.*;
import com.bbthechange.retroboard.util.ConflictRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

@Service
public class CardServiceImpl implements CardService {

    private static final Logger logger = LoggerFactory.getLogger(CardServiceImpl.class);
    private static final Comparator<Card> OLDEST_FIRST = Comparator.comparing(Card::getCreatedAt);

    private final CardRepository cardRepository;
    private final ReactionRepository reactionRepository;
    private final BoardService boardService;
    private final QuotaService quotaService;
    private final BoardLifecycleGuard lifecycleGuard;
    private final AggregationPropagator aggregationPropagator;
    private final CardInputValidator validator;
    private final BoardEventPublisher eventPublisher;
    private final ConflictRetrier retrier;
    private final MeterRegistry meterRegistry;

    @Autowired
    public CardServiceImpl(CardRepository cardRepository,
                           ReactionRepository reactionRepository,
                           BoardService boardService,
                           QuotaService quotaService,
                           BoardLifecycleGuard lifecycleGuard,
                           AggregationPropagator aggregationPropagator,
                           CardInputValidator validator,
                           BoardEventPublisher eventPublisher,
                           ConflictRetrier retrier,
                           MeterRegistry meterRegistry) {
        this.cardRepository = cardRepository;
        this.reactionRepository = reactionRepository;
        this.boardService = boardService;
        this.quotaService = quotaService;
        this.lifecycleGuard = lifecycleGuard;
        this.aggregationPropagator = aggregationPropagator;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.retrier = retrier;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CardDTO createCard(String boardId, CreateCardRequest request, String userHash, String alias) {
        lifecycleGuard.ensureOpen(boardId);

        String content = validator.validateContent(request.getContent());
        String columnId = validator.validateColumnId(request.getColumnId());
        if (!boardService.columnExists(boardId, columnId)) {
            throw new ValidationException("COLUMN_NOT_FOUND", "Column not found on board: " + columnId);
        }
        String displayAlias = validator.normalizeAlias(alias);

        CardKind kind = request.getCardType() != null ? request.getCardType() : CardKind.FEEDBACK;
        if (kind == CardKind.FEEDBACK) {
            CardQuotaDTO quota = quotaService.getCardQuota(boardId, userHash);
            if (!quota.canCreate()) {
                logger.warn("User {} reached the card limit on board {} ({}/{})",
                    shortHash(userHash), boardId, quota.currentCount(), quota.limit());
                throw LimitReachedException.forCards(quota.currentCount(), quota.limit());
            }
        }

        Card card = kind == CardKind.FEEDBACK
            ? new FeedbackCard(boardId, columnId, content, userHash, displayAlias, request.isAnonymous())
            : new ActionCard(boardId, columnId, content, userHash, displayAlias, request.isAnonymous());
        cardRepository.save(card);

        meterRegistry.counter("retro_cards_total", "type", kind.wireValue()).increment();
        logger.info("Created {} card {} on board {} by user {}", kind.wireValue(), card.getCardId(), boardId, shortHash(userHash));

        CardDTO dto = new CardDTO(card);
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_CREATED, boardId, dto));
        return dto;
    }

    @Override
    public CardDTO getCard(String cardId) {
        Card card = requireCard(cardId);
        CardDTO dto = new CardDTO(card);

        if (card instanceof FeedbackCard feedback && feedback.hasChildren()) {
            cardRepository.findByIds(feedback.children()).stream()
                .filter(child -> cardId.equals(child.parentId()))
                .sorted(OLDEST_FIRST)
                .forEach(child -> dto.addChild(new CardDTO(child)));
        } else if (card instanceof ActionCard action && !action.linkedFeedback().isEmpty()) {
            cardRepository.findByIds(action.linkedFeedback()).stream()
                .sorted(OLDEST_FIRST)
                .forEach(linked -> dto.addLinkedFeedbackCard(toLinkedSummary(linked)));
        }
        return dto;
    }

    @Override
    public CardDTO updateContent(String cardId, String content, String userHash) {
        Card card = requireCard(cardId);
        lifecycleGuard.ensureOpen(card.getBoardId());
        requireOwner(card, userHash, "update");
        String validated = validator.validateContent(content);

        Card updated = cardRepository.updateContent(cardId, validated)
            .orElseThrow(() -> new CardNotFoundException("Card not found: " + cardId));
        logger.info("Updated content of card {}", cardId);

        CardDTO dto = new CardDTO(updated);
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_UPDATED, updated.getBoardId(), dto));
        return dto;
    }

    @Override
    public CardDTO moveColumn(String cardId, String columnId, String userHash) {
        Card card = requireCard(cardId);
        lifecycleGuard.ensureOpen(card.getBoardId());
        requireOwner(card, userHash, "move");
        String validated = validator.validateColumnId(columnId);
        if (!boardService.columnExists(card.getBoardId(), validated)) {
            throw new ValidationException("COLUMN_NOT_FOUND", "Column not found on board: " + validated);
        }

        Card moved = cardRepository.updateColumn(cardId, validated)
            .orElseThrow(() -> new CardNotFoundException("Card not found: " + cardId));
        logger.info("Moved card {} from column {} to {}", cardId, card.getColumnId(), validated);

        CardDTO dto = new CardDTO(moved);
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_MOVED, moved.getBoardId(), dto));
        return dto;
    }

    @Override
    public void deleteCard(String cardId, String userHash) {
        CardDeletion deletion = retrier.execute("delete card", () -> {
            Card card = requireCard(cardId);
            lifecycleGuard.ensureOpen(card.getBoardId());
            requireOwner(card, userHash, "delete");

            CardDeletion plan = planDeletion(card);
            cardRepository.delete(plan);
            return plan;
        });

        Card card = deletion.card();
        logger.info("Deleted card {} ({} children orphaned, {} reactions removed, {} action links dropped)",
            cardId, deletion.children().size(), deletion.reactions().size(), deletion.linkingActions().size());

        if (deletion.parent() != null) {
            aggregationPropagator.recompute(deletion.parent().getCardId());
        }
        eventPublisher.publish(BoardEvent.of(BoardEventType.CARD_DELETED, card.getBoardId(),
            new CardDeletedPayload(cardId, card.getBoardId())));
    }

    private CardDeletion planDeletion(Card card) {
        FeedbackCard parent = null;
        List<FeedbackCard> children = new ArrayList<>();
        List<ActionCard> linkingActions = Collections.emptyList();

        if (card instanceof FeedbackCard feedback) {
            if (feedback.hasParent()) {
                parent = cardRepository.findById(feedback.getParentCardId())
                    .filter(FeedbackCard.class::isInstance)
                    .map(FeedbackCard.class::cast)
                    .orElse(null);
            }
            if (feedback.hasChildren()) {
                for (Card child : cardRepository.findByIds(feedback.children())) {
                    if (child instanceof FeedbackCard childCard && card.getCardId().equals(childCard.getParentCardId())) {
                        children.add(childCard);
                    }
                }
            }
            linkingActions = cardRepository.findActionCardsLinkedTo(card.getBoardId(), card.getCardId());
        }

        List<Reaction> reactions = reactionRepository.findByCardId(card.getCardId());
        int contribution = parent != null ? aggregationPropagator.contributionOf((FeedbackCard) card) : 0;
        return new CardDeletion(card, parent, contribution, children, linkingActions, reactions);
    }

    @Override
    public CardsResponse listCardsForBoard(String boardId, CardFilter filter) {
        if (!boardService.boardExists(boardId)) {
            throw new BoardNotFoundException("Board not found: " + boardId);
        }
        CardFilter effective = filter != null ? filter : CardFilter.all();

        List<Card> all = cardRepository.findByBoardId(boardId);
        List<Card> matching = all.stream()
            .filter(card -> effective.columnId() == null || effective.columnId().equals(card.getColumnId()))
            .filter(card -> effective.createdBy() == null || card.isOwnedBy(effective.createdBy()))
            .collect(Collectors.toList());

        Map<String, Integer> cardsByColumn = new TreeMap<>();
        for (Card card : matching) {
            cardsByColumn.merge(card.getColumnId(), 1, Integer::sum);
        }

        Set<String> boardCardIds = all.stream().map(Card::getCardId).collect(Collectors.toSet());
        List<CardDTO> cards;
        if (effective.includeRelationships()) {
            cards = assembleTopLevel(all, matching);
        } else {
            cards = matching.stream()
                .filter(card -> isTopLevel(card, boardCardIds))
                .sorted(OLDEST_FIRST.reversed())
                .map(CardDTO::new)
                .collect(Collectors.toList());
        }

        cards.forEach(dto -> dto.retainLinkedFeedback(boardCardIds));

        logger.debug("Listed {} cards ({} top-level) for board {}", matching.size(), cards.size(), boardId);
        return new CardsResponse(cards, matching.size(), cardsByColumn);
    }

    /**
     * Top-level cards newest first, each parent with its children oldest first and each
     * action card with summaries of the feedback it links to.
     */
    private List<CardDTO> assembleTopLevel(List<Card> all, List<Card> matching) {
        Map<String, Card> byId = new HashMap<>();
        Map<String, List<Card>> childrenByParent = new HashMap<>();
        for (Card card : all) {
            byId.put(card.getCardId(), card);
        }
        for (Card card : all) {
            if (card.parentId() != null && byId.containsKey(card.parentId())) {
                childrenByParent.computeIfAbsent(card.parentId(), id -> new ArrayList<>()).add(card);
            }
        }

        List<CardDTO> topLevel = new ArrayList<>();
        matching.stream()
            .filter(card -> isTopLevel(card, byId.keySet()))
            .sorted(OLDEST_FIRST.reversed())
            .forEach(card -> {
                CardDTO dto = new CardDTO(card);
                childrenByParent.getOrDefault(card.getCardId(), Collections.emptyList()).stream()
                    .sorted(OLDEST_FIRST)
                    .forEach(child -> dto.addChild(new CardDTO(child)));
                if (card instanceof ActionCard action) {
                    action.linkedFeedback().stream()
                        .map(byId::get)
                        .filter(Objects::nonNull)
                        .sorted(OLDEST_FIRST)
                        .forEach(linked -> dto.addLinkedFeedbackCard(toLinkedSummary(linked)));
                }
                topLevel.add(dto);
            });
        return topLevel;
    }

    /** A child whose parent is gone from the board is shown at top level. */
    private static boolean isTopLevel(Card card, Set<String> boardCardIds) {
        return card.parentId() == null || !boardCardIds.contains(card.parentId());
    }

    @Override
    public long countFeedbackCardsForUser(String boardId, String userHash) {
        return cardRepository.countFeedbackCards(boardId, userHash);
    }

    private Card requireCard(String cardId) {
        return cardRepository.findById(cardId)
            .orElseThrow(() -> new CardNotFoundException("Card not found: " + cardId));
    }

    private void requireOwner(Card card, String userHash, String action) {
        if (!card.isOwnedBy(userHash)) {
            logger.warn("User {} tried to {} card {} they do not own", shortHash(userHash), action, card.getCardId());
            throw new UnauthorizedException("Only the card creator can " + action + " this card");
        }
    }

    private static LinkedFeedbackDTO toLinkedSummary(Card linked) {
        return new LinkedFeedbackDTO(linked.getCardId(), linked.getContent(),
            linked.isAnonymous() ? null : linked.getDisplayAlias());
    }

    static String shortHash(String userHash) {
        return userHash == null || userHash.length() < 8 ? String.valueOf(userHash) : userHash.substring(0, 8) + "...";
    }
}
