package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.exception.TransactionFailedException;
import com.bbthechange.retroboard.exception.VersionConflictException;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.CounterDelta;
import com.bbthechange.retroboard.util.ConflictRetrier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps aggregatedReactionCount consistent.
 *
 * Mutations carry their counter changes as deltas inside their own transaction, so the
 * aggregate is never observed out of step. {@link #recompute(String)} then re-derives the
 * aggregate of the affected parent from scratch. The hierarchy is one level deep, so this
 * is a single pass over the parent's direct children and never recurses.
 */
@Component
public class AggregationPropagator {

    private static final Logger logger = LoggerFactory.getLogger(AggregationPropagator.class);

    private final CardRepository cardRepository;
    private final ConflictRetrier retrier;
    private final MeterRegistry meterRegistry;

    @Autowired
    public AggregationPropagator(CardRepository cardRepository, ConflictRetrier retrier,
                                 MeterRegistry meterRegistry) {
        this.cardRepository = cardRepository;
        this.retrier = retrier;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Counter changes for a reaction added (+1) or removed (-1) on {@code card}:
     * the card's direct and aggregated counts, and its parent's aggregate when it has one.
     */
    public List<CounterDelta> reactionDeltas(Card card, int delta) {
        List<CounterDelta> deltas = new ArrayList<>();
        deltas.add(CounterDelta.onReactedCard(card.getCardId(), card.parentId(), delta));
        if (card.parentId() != null) {
            deltas.add(CounterDelta.onParent(card.parentId(), delta));
        }
        return deltas;
    }

    /**
     * What a child adds to its parent's aggregate.
     */
    public int contributionOf(FeedbackCard child) {
        return child.getDirectReactionCount();
    }

    /**
     * Re-derive the aggregate of the card, or of its parent when it is a child, and store it
     * if it drifted.
     */
    public void recompute(String cardId) {
        try {
            retrier.run("recompute aggregate", () -> recomputeOnce(cardId));
        } catch (TransactionFailedException e) {
            // The delta already committed with the mutation; a later recompute settles any drift.
            meterRegistry.counter("retro_aggregate_drift_total", "outcome", "unresolved").increment();
            logger.warn("Could not verify aggregate for card {}: {}", cardId, e.getMessage());
        }
    }

    private void recomputeOnce(String cardId) {
        Optional<Card> found = cardRepository.findById(cardId);
        if (found.isEmpty()) {
            return;
        }

        Card root = found.get();
        if (root.parentId() != null) {
            Optional<Card> parent = cardRepository.findById(root.parentId());
            if (parent.isEmpty()) {
                return;
            }
            root = parent.get();
        }

        int expected = expectedAggregate(root);
        if (expected == root.getAggregatedReactionCount()) {
            return;
        }

        logger.warn("Aggregate drift on card {}: stored {}, expected {}",
            root.getCardId(), root.getAggregatedReactionCount(), expected);
        if (!cardRepository.replaceAggregatedCount(root, expected)) {
            throw new VersionConflictException("Card " + root.getCardId() + " changed during recompute");
        }
        meterRegistry.counter("retro_aggregate_drift_total", "outcome", "repaired").increment();
    }

    int expectedAggregate(Card card) {
        int total = card.getDirectReactionCount();
        if (card instanceof FeedbackCard feedback && feedback.hasChildren()) {
            for (Card child : cardRepository.findByIds(feedback.children())) {
                total += child.getDirectReactionCount();
            }
        }
        return total;
    }
}
