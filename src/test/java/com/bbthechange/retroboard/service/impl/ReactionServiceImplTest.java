package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.dto.ReactionChangePayload;
import com.bbthechange.retroboard.dto.ReactionDTO;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;
import com.bbthechange.retroboard.dto.ReactionResult;
import com.bbthechange.retroboard.event.BoardEvent;
import com.bbthechange.retroboard.event.BoardEventPublisher;
import com.bbthechange.retroboard.event.BoardEventType;
import com.bbthechange.retroboard.exception.*;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.bbthechange.retroboard.model.Reaction;
import com.bbthechange.retroboard.model.ReactionKind;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.CounterDelta;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.AggregationPropagator;
import com.bbthechange.retroboard.service.BoardLifecycleGuard;
import com.bbthechange.retroboard.service.CardInputValidator;
import com.bbthechange.retroboard.service.QuotaService;
import com.bbthechange.retroboard.util.ConflictRetrier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.bbthechange.retroboard.testutil.CardTestBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReactionServiceImplTest {

    @Mock
    private ReactionRepository reactionRepository;

    @Mock
    private CardRepository cardRepository;

    @Mock
    private QuotaService quotaService;

    @Mock
    private BoardLifecycleGuard lifecycleGuard;

    @Mock
    private AggregationPropagator aggregationPropagator;

    @Mock
    private BoardEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private ReactionServiceImpl reactionService;

    @BeforeEach
    void setUp() {
        CardEngineProperties properties = new CardEngineProperties();
        meterRegistry = new SimpleMeterRegistry();
        reactionService = new ReactionServiceImpl(reactionRepository, cardRepository, quotaService, lifecycleGuard,
            aggregationPropagator, new CardInputValidator(properties), eventPublisher,
            new ConflictRetrier(properties, meterRegistry), meterRegistry);
    }

    @Test
    void addReaction_FirstVote_InsertsWithDeltasAndPublishes() {
        FeedbackCard card = aCard().feedback();
        FeedbackCard afterVote = aCard().withCounts(1, 1).feedback();
        afterVote.setCardId(card.getCardId());
        List<CounterDelta> deltas = List.of(CounterDelta.onReactedCard(card.getCardId(), null, 1));
        when(cardRepository.findById(card.getCardId()))
            .thenReturn(Optional.of(card))
            .thenReturn(Optional.of(afterVote));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.empty());
        when(quotaService.getReactionQuota(BOARD_ID, BOB)).thenReturn(new ReactionQuotaDTO(0, null, true, false));
        when(aggregationPropagator.reactionDeltas(card, 1)).thenReturn(deltas);

        ReactionResult result = reactionService.addOrUpdateReaction(card.getCardId(), BOB, "Bob", null);

        assertThat(result.created()).isTrue();
        assertThat(result.reaction().reactionType()).isEqualTo(ReactionKind.THUMBS_UP);
        assertThat(result.reaction().userAlias()).isEqualTo("Bob");

        ArgumentCaptor<Reaction> inserted = ArgumentCaptor.forClass(Reaction.class);
        verify(reactionRepository).insert(inserted.capture(), eq(deltas));
        assertThat(inserted.getValue().getUserHash()).isEqualTo(BOB);
        verify(aggregationPropagator, never()).recompute(anyString());

        ArgumentCaptor<BoardEvent> event = ArgumentCaptor.forClass(BoardEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertThat(event.getValue().type()).isEqualTo(BoardEventType.REACTION_ADDED);
        ReactionChangePayload payload = (ReactionChangePayload) event.getValue().payload();
        assertThat(payload.directReactionCount()).isEqualTo(1);
        assertThat(payload.aggregatedReactionCount()).isEqualTo(1);
        assertThat(meterRegistry.counter("retro_reactions_total", "type", "thumbs_up").count()).isEqualTo(1.0);
    }

    @Test
    void addReaction_ExistingVote_UpdatesInPlaceWithoutQuotaOrEvent() {
        FeedbackCard card = aCard().withCounts(1, 1).feedback();
        Reaction existing = new Reaction(card.getCardId(), BOARD_ID, BOB, "Bob", ReactionKind.THUMBS_UP);
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.of(existing));
        when(reactionRepository.update(existing)).thenReturn(existing);

        ReactionResult result = reactionService.addOrUpdateReaction(card.getCardId(), BOB, "Robert", ReactionKind.THUMBS_UP);

        assertThat(result.created()).isFalse();
        assertThat(result.reaction().userAlias()).isEqualTo("Robert");
        verify(reactionRepository, never()).insert(any(), anyList());
        verifyNoInteractions(quotaService, eventPublisher);
    }

    @Test
    void addReaction_QuotaExhausted_ThrowsLimitReached() {
        FeedbackCard card = aCard().feedback();
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.empty());
        when(quotaService.getReactionQuota(BOARD_ID, BOB)).thenReturn(new ReactionQuotaDTO(5, 5, false, true));

        assertThatThrownBy(() -> reactionService.addOrUpdateReaction(card.getCardId(), BOB, null, null))
            .isInstanceOfSatisfying(LimitReachedException.class, e -> {
                assertThat(e.getCurrentCount()).isEqualTo(5);
                assertThat(e.getLimit()).isEqualTo(5);
            });

        verify(reactionRepository, never()).insert(any(), anyList());
    }

    @Test
    void addReaction_OnChildCard_RecomputesParentAggregate() {
        FeedbackCard parent = aCard().feedback();
        FeedbackCard child = aCard().withParent(parent.getCardId()).feedback();
        when(cardRepository.findById(child.getCardId())).thenReturn(Optional.of(child));
        when(reactionRepository.findByCardAndUser(child.getCardId(), BOB)).thenReturn(Optional.empty());
        when(quotaService.getReactionQuota(BOARD_ID, BOB)).thenReturn(new ReactionQuotaDTO(0, null, true, false));

        reactionService.addOrUpdateReaction(child.getCardId(), BOB, null, null);

        verify(aggregationPropagator).recompute(child.getCardId());
    }

    @Test
    void addReaction_ConflictOnInsert_RetriesAndRereadsQuota() {
        FeedbackCard card = aCard().feedback();
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.empty());
        when(quotaService.getReactionQuota(BOARD_ID, BOB)).thenReturn(new ReactionQuotaDTO(0, null, true, false));
        doThrow(new VersionConflictException("counter moved"))
            .doNothing()
            .when(reactionRepository).insert(any(Reaction.class), any());

        ReactionResult result = reactionService.addOrUpdateReaction(card.getCardId(), BOB, null, null);

        assertThat(result.created()).isTrue();
        verify(reactionRepository, times(2)).insert(any(Reaction.class), any());
        verify(quotaService, times(2)).getReactionQuota(BOARD_ID, BOB);
    }

    @Test
    void addReaction_ClosedBoard_WritesNothing() {
        FeedbackCard card = aCard().feedback();
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        doThrow(new BoardClosedException(BOARD_ID)).when(lifecycleGuard).ensureOpen(BOARD_ID);

        assertThatThrownBy(() -> reactionService.addOrUpdateReaction(card.getCardId(), BOB, null, null))
            .isInstanceOf(BoardClosedException.class);

        verifyNoInteractions(reactionRepository, eventPublisher);
    }

    @Test
    void removeReaction_Existing_DeletesWithNegativeDeltas() {
        FeedbackCard card = aCard().withCounts(1, 1).feedback();
        Reaction existing = new Reaction(card.getCardId(), BOARD_ID, BOB, "Bob", ReactionKind.THUMBS_UP);
        List<CounterDelta> deltas = List.of(CounterDelta.onReactedCard(card.getCardId(), null, -1));
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.of(existing));
        when(aggregationPropagator.reactionDeltas(card, -1)).thenReturn(deltas);

        reactionService.removeReaction(card.getCardId(), BOB);

        verify(reactionRepository).delete(existing, deltas);
        verify(eventPublisher).publish(argThat(e -> e.type() == BoardEventType.REACTION_REMOVED));
    }

    @Test
    void removeReaction_NoVote_ThrowsNotFound() {
        FeedbackCard card = aCard().feedback();
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), BOB)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reactionService.removeReaction(card.getCardId(), BOB))
            .isInstanceOfSatisfying(ReactionNotFoundException.class,
                e -> assertThat(e.getCategory()).isEqualTo(ErrorCategory.NOT_FOUND));

        verify(reactionRepository, never()).delete(any(), anyList());
    }

    @Test
    void getUserReaction_NoVote_ReturnsEmpty() {
        FeedbackCard card = aCard().feedback();
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), ALICE)).thenReturn(Optional.empty());

        assertThat(reactionService.getUserReaction(card.getCardId(), ALICE)).isEmpty();
    }

    @Test
    void getUserReaction_MissingCard_ThrowsNotFound() {
        when(cardRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reactionService.getUserReaction("missing", ALICE))
            .isInstanceOf(CardNotFoundException.class);
    }

    @Test
    void getUserReaction_Existing_ExposesAliasNotHash() {
        FeedbackCard card = aCard().feedback();
        Reaction existing = new Reaction(card.getCardId(), BOARD_ID, ALICE, "Alice", ReactionKind.THUMBS_UP);
        when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
        when(reactionRepository.findByCardAndUser(card.getCardId(), ALICE)).thenReturn(Optional.of(existing));

        Optional<ReactionDTO> dto = reactionService.getUserReaction(card.getCardId(), ALICE);

        assertThat(dto).hasValueSatisfying(r -> {
            assertThat(r.userAlias()).isEqualTo("Alice");
            assertThat(r.cardId()).isEqualTo(card.getCardId());
        });
    }
}
