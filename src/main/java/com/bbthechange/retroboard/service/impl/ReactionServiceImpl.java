package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.dto.ReactionChangePayload;
import com.bbthechange.retroboard.dto.ReactionDTO;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;
import com.bbthechange.retroboard.dto.ReactionResult;
import com.bbthechange.retroboard.event.BoardEvent;
import com.bbthechange.retroboard.event.BoardEventPublisher;
import com.bbthechange.retroboard.event.BoardEventType;
import com.bbthechange.retroboard.exception.CardNotFoundException;
import com.bbthechange.retroboard.exception.LimitReachedException;
import com.bbthechange.retroboard.exception.ReactionNotFoundException;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.Reaction;
import com.bbthechange.retroboard.model.ReactionKind;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.AggregationPropagator;
import com.bbthechange.retroboard.service.BoardLifecycleGuard;
import com.bbthechange.retroboard.service.CardInputValidator;
import com.bbthechange.retroboard.service.QuotaService;
import com.bbthechange.retroboard.service.ReactionService;
import com.bbthechange.retroboard.util.ConflictRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ReactionServiceImpl implements ReactionService {

    private static final Logger logger = LoggerFactory.getLogger(ReactionServiceImpl.class);

    private final ReactionRepository reactionRepository;
    private final CardRepository cardRepository;
    private final QuotaService quotaService;
    private final BoardLifecycleGuard lifecycleGuard;
    private final AggregationPropagator aggregationPropagator;
    private final CardInputValidator validator;
    private final BoardEventPublisher eventPublisher;
    private final ConflictRetrier retrier;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ReactionServiceImpl(ReactionRepository reactionRepository,
                               CardRepository cardRepository,
                               QuotaService quotaService,
                               BoardLifecycleGuard lifecycleGuard,
                               AggregationPropagator aggregationPropagator,
                               CardInputValidator validator,
                               BoardEventPublisher eventPublisher,
                               ConflictRetrier retrier,
                               MeterRegistry meterRegistry) {
        this.reactionRepository = reactionRepository;
        this.cardRepository = cardRepository;
        this.quotaService = quotaService;
        this.lifecycleGuard = lifecycleGuard;
        this.aggregationPropagator = aggregationPropagator;
        this.validator = validator;
        this.eventPublisher = eventPublisher;
        this.retrier = retrier;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public ReactionResult addOrUpdateReaction(String cardId, String userHash, String alias, ReactionKind kind) {
        ReactionKind reactionKind = kind != null ? kind : ReactionKind.THUMBS_UP;
        String displayAlias = validator.normalizeAlias(alias);

        ReactionResult result = retrier.execute("add reaction", () -> {
            Card card = requireCard(cardId);
            lifecycleGuard.ensureOpen(card.getBoardId());

            Optional<Reaction> existing = reactionRepository.findByCardAndUser(cardId, userHash);
            if (existing.isPresent()) {
                Reaction reaction = existing.get();
                reaction.setReactionType(reactionKind);
                if (displayAlias != null) {
                    reaction.setUserAlias(displayAlias);
                }
                return new ReactionResult(ReactionDTO.from(reactionRepository.update(reaction)), false);
            }

            ReactionQuotaDTO quota = quotaService.getReactionQuota(card.getBoardId(), userHash);
            if (!quota.canReact()) {
                logger.warn("User {} reached the reaction limit on board {} ({}/{})",
                    CardServiceImpl.shortHash(userHash), card.getBoardId(), quota.currentCount(), quota.limit());
                throw LimitReachedException.forReactions(quota.currentCount(), quota.limit());
            }

            Reaction reaction = new Reaction(cardId, card.getBoardId(), userHash, displayAlias, reactionKind);
            reactionRepository.insert(reaction, aggregationPropagator.reactionDeltas(card, 1));
            return new ReactionResult(ReactionDTO.from(reaction), true);
        });

        if (!result.created()) {
            logger.debug("Updated existing reaction on card {}", cardId);
            return result;
        }

        meterRegistry.counter("retro_reactions_total", "type", reactionKind.getWireValue()).increment();
        logger.info("Added {} reaction to card {}", reactionKind.getWireValue(), cardId);
        publishChange(BoardEventType.REACTION_ADDED, cardId, reactionKind, displayAlias);
        return result;
    }

    @Override
    public void removeReaction(String cardId, String userHash) {
        Reaction removed = retrier.execute("remove reaction", () -> {
            Card card = requireCard(cardId);
            lifecycleGuard.ensureOpen(card.getBoardId());

            Reaction reaction = reactionRepository.findByCardAndUser(cardId, userHash)
                .orElseThrow(() -> new ReactionNotFoundException("No reaction by this user on card " + cardId));
            reactionRepository.delete(reaction, aggregationPropagator.reactionDeltas(card, -1));
            return reaction;
        });

        logger.info("Removed reaction from card {}", cardId);
        publishChange(BoardEventType.REACTION_REMOVED, cardId, removed.getReactionType(), removed.getUserAlias());
    }

    @Override
    public Optional<ReactionDTO> getUserReaction(String cardId, String userHash) {
        requireCard(cardId);
        return reactionRepository.findByCardAndUser(cardId, userHash).map(ReactionDTO::from);
    }

    private void publishChange(BoardEventType type, String cardId, ReactionKind kind, String alias) {
        Optional<Card> current = cardRepository.findById(cardId);
        if (current.isEmpty()) {
            return;
        }
        Card card = current.get();
        if (card.parentId() != null) {
            aggregationPropagator.recompute(cardId);
        }
        eventPublisher.publish(BoardEvent.of(type, card.getBoardId(),
            new ReactionChangePayload(cardId, card.getBoardId(), kind, alias,
                card.getDirectReactionCount(), card.getAggregatedReactionCount(), card.parentId())));
    }

    private Card requireCard(String cardId) {
        return cardRepository.findById(cardId)
            .orElseThrow(() -> new CardNotFoundException("Card not found: " + cardId));
    }
}
