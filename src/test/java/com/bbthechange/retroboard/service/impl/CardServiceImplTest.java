package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.dto.*;
import com.bbthechange.retroboard.event.BoardEvent;
import com.bbthechange.retroboard.event.BoardEventPublisher;
import com.bbthechange.retroboard.event.BoardEventType;
import com.bbthechange.retroboard.exception.*;
import com.bbthechange.retroboard.model.*;
import com.bbthechange.retroboard.repository.CardDeletion;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.AggregationPropagator;
import com.bbthechange.retroboard.service.BoardLifecycleGuard;
import com.bbthechange.retroboard.service.BoardService;
import com.bbthechange.retroboard.service.CardInputValidator;
import com.bbthechange.retroboard.service.QuotaService;
import com.bbthechange.retroboard.util.ConflictRetrier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.bbthechange.retroboard.testutil.CardTestBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CardServiceImplTest {

    @Mock
    private CardRepository cardRepository;

    @Mock
    private ReactionRepository reactionRepository;

    @Mock
    private BoardService boardService;

    @Mock
    private QuotaService quotaService;

    @Mock
    private BoardLifecycleGuard lifecycleGuard;

    @Mock
    private AggregationPropagator aggregationPropagator;

    @Mock
    private BoardEventPublisher eventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private CardServiceImpl cardService;

    @BeforeEach
    void setUp() {
        CardEngineProperties properties = new CardEngineProperties();
        meterRegistry = new SimpleMeterRegistry();
        cardService = new CardServiceImpl(cardRepository, reactionRepository, boardService, quotaService,
            lifecycleGuard, aggregationPropagator, new CardInputValidator(properties), eventPublisher,
            new ConflictRetrier(properties, meterRegistry), meterRegistry);
    }

    @Nested
    class CreateCard {

        @Test
        void createCard_FeedbackWithinQuota_SavesAndPublishes() {
            when(boardService.columnExists(BOARD_ID, COLUMN)).thenReturn(true);
            when(quotaService.getCardQuota(BOARD_ID, ALICE)).thenReturn(new CardQuotaDTO(0, 2, true, true));
            when(cardRepository.save(any(Card.class))).thenAnswer(inv -> inv.getArgument(0));

            CardDTO created = cardService.createCard(BOARD_ID,
                new CreateCardRequest(COLUMN, "  Good pairing  ", null, false), ALICE, " Alice ");

            assertThat(created.getContent()).isEqualTo("Good pairing");
            assertThat(created.getCardType()).isEqualTo(CardKind.FEEDBACK);
            assertThat(created.getCreatedByAlias()).isEqualTo("Alice");
            assertThat(created.getDirectReactionCount()).isZero();

            ArgumentCaptor<Card> saved = ArgumentCaptor.forClass(Card.class);
            verify(cardRepository).save(saved.capture());
            assertThat(saved.getValue()).isInstanceOf(FeedbackCard.class);
            assertThat(saved.getValue().isOwnedBy(ALICE)).isTrue();

            ArgumentCaptor<BoardEvent> event = ArgumentCaptor.forClass(BoardEvent.class);
            verify(eventPublisher).publish(event.capture());
            assertThat(event.getValue().type()).isEqualTo(BoardEventType.CARD_CREATED);
            assertThat(event.getValue().boardId()).isEqualTo(BOARD_ID);
            assertThat(meterRegistry.counter("retro_cards_total", "type", "feedback").count()).isEqualTo(1.0);
        }

        @Test
        void createCard_QuotaExhausted_ThrowsLimitReached() {
            when(boardService.columnExists(BOARD_ID, COLUMN)).thenReturn(true);
            when(quotaService.getCardQuota(BOARD_ID, ALICE)).thenReturn(new CardQuotaDTO(2, 2, false, true));

            assertThatThrownBy(() -> cardService.createCard(BOARD_ID,
                new CreateCardRequest(COLUMN, "One too many", CardKind.FEEDBACK, false), ALICE, null))
                .isInstanceOfSatisfying(LimitReachedException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.LIMIT_REACHED);
                    assertThat(e.getCurrentCount()).isEqualTo(2);
                    assertThat(e.getLimit()).isEqualTo(2);
                });

            verify(cardRepository, never()).save(any());
            verifyNoInteractions(eventPublisher);
        }

        @Test
        void createCard_ActionCard_SkipsQuota() {
            when(boardService.columnExists(BOARD_ID, "actions")).thenReturn(true);
            when(cardRepository.save(any(Card.class))).thenAnswer(inv -> inv.getArgument(0));

            CardDTO created = cardService.createCard(BOARD_ID,
                new CreateCardRequest("actions", "Timebox standups", CardKind.ACTION, false), ALICE, null);

            assertThat(created.getCardType()).isEqualTo(CardKind.ACTION);
            verifyNoInteractions(quotaService);
        }

        @Test
        void createCard_UnknownColumn_ThrowsValidation() {
            when(boardService.columnExists(BOARD_ID, "nowhere")).thenReturn(false);

            assertThatThrownBy(() -> cardService.createCard(BOARD_ID,
                new CreateCardRequest("nowhere", "Lost card", null, false), ALICE, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("nowhere");
        }

        @Test
        void createCard_BlankContent_ThrowsValidation() {
            assertThatThrownBy(() -> cardService.createCard(BOARD_ID,
                new CreateCardRequest(COLUMN, "   ", null, false), ALICE, null))
                .isInstanceOf(ValidationException.class);

            verifyNoInteractions(cardRepository);
        }

        @Test
        void createCard_ClosedBoard_PropagatesAndWritesNothing() {
            doThrow(new BoardClosedException(BOARD_ID)).when(lifecycleGuard).ensureOpen(BOARD_ID);

            assertThatThrownBy(() -> cardService.createCard(BOARD_ID,
                new CreateCardRequest(COLUMN, "Too late", null, false), ALICE, null))
                .isInstanceOf(BoardClosedException.class);

            verifyNoInteractions(cardRepository, eventPublisher);
        }
    }

    @Nested
    class GetCard {

        @Test
        void getCard_ParentWithChildren_EmbedsChildrenOldestFirst() {
            FeedbackCard older = aCard().createdAt(Instant.parse("2026-01-01T10:00:00Z")).feedback();
            FeedbackCard newer = aCard().createdAt(Instant.parse("2026-01-01T11:00:00Z")).feedback();
            FeedbackCard parent = aCard().withChildren(older.getCardId(), newer.getCardId()).feedback();
            older.setParentCardId(parent.getCardId());
            newer.setParentCardId(parent.getCardId());
            when(cardRepository.findById(parent.getCardId())).thenReturn(Optional.of(parent));
            when(cardRepository.findByIds(parent.children())).thenReturn(List.of(newer, older));

            CardDTO dto = cardService.getCard(parent.getCardId());

            assertThat(dto.getChildren()).extracting(CardDTO::getId)
                .containsExactly(older.getCardId(), newer.getCardId());
        }

        @Test
        void getCard_ActionCard_EmbedsLinkedSummariesWithoutAnonymousAlias() {
            FeedbackCard anonymous = aCard().anonymous().withContent("Secret gripe").feedback();
            ActionCard action = aCard().linkedTo(anonymous.getCardId()).action();
            when(cardRepository.findById(action.getCardId())).thenReturn(Optional.of(action));
            when(cardRepository.findByIds(action.linkedFeedback())).thenReturn(List.of(anonymous));

            CardDTO dto = cardService.getCard(action.getCardId());

            assertThat(dto.getLinkedFeedbackCards()).singleElement()
                .satisfies(linked -> {
                    assertThat(linked.id()).isEqualTo(anonymous.getCardId());
                    assertThat(linked.content()).isEqualTo("Secret gripe");
                    assertThat(linked.createdByAlias()).isNull();
                });
        }

        @Test
        void getCard_Missing_ThrowsNotFound() {
            when(cardRepository.findById("missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> cardService.getCard("missing"))
                .isInstanceOf(CardNotFoundException.class);
        }
    }

    @Nested
    class UpdateAndMove {

        @Test
        void updateContent_ByOwner_PersistsTrimmedContent() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            FeedbackCard updated = aCard().ownedBy(ALICE).withContent("Edited").feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
            when(cardRepository.updateContent(card.getCardId(), "Edited")).thenReturn(Optional.of(updated));

            CardDTO dto = cardService.updateContent(card.getCardId(), " Edited ", ALICE);

            assertThat(dto.getContent()).isEqualTo("Edited");
            verify(eventPublisher).publish(argThat(e -> e.type() == BoardEventType.CARD_UPDATED));
        }

        @Test
        void updateContent_ByOtherUser_ThrowsForbidden() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));

            assertThatThrownBy(() -> cardService.updateContent(card.getCardId(), "Hijack", BOB))
                .isInstanceOf(UnauthorizedException.class);

            verify(cardRepository, never()).updateContent(anyString(), anyString());
        }

        @Test
        void moveColumn_ToExistingColumn_PublishesMove() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            FeedbackCard moved = aCard().ownedBy(ALICE).inColumn("to-improve").feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
            when(boardService.columnExists(BOARD_ID, "to-improve")).thenReturn(true);
            when(cardRepository.updateColumn(card.getCardId(), "to-improve")).thenReturn(Optional.of(moved));

            CardDTO dto = cardService.moveColumn(card.getCardId(), "to-improve", ALICE);

            assertThat(dto.getColumnId()).isEqualTo("to-improve");
            verify(eventPublisher).publish(argThat(e -> e.type() == BoardEventType.CARD_MOVED));
        }

        @Test
        void moveColumn_UnknownColumn_ThrowsValidation() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
            when(boardService.columnExists(BOARD_ID, "nowhere")).thenReturn(false);

            assertThatThrownBy(() -> cardService.moveColumn(card.getCardId(), "nowhere", ALICE))
                .isInstanceOf(ValidationException.class);
            verify(cardRepository, never()).updateColumn(anyString(), anyString());
        }
    }

    @Nested
    class DeleteCard {

        @Test
        void deleteCard_ChildCard_RemovesContributionAndRecomputesParent() {
            FeedbackCard parent = aCard().ownedBy(BOB).feedback();
            FeedbackCard child = aCard().ownedBy(ALICE).withParent(parent.getCardId()).withCounts(2, 2).feedback();
            parent.setChildCardIds(java.util.Set.of(child.getCardId()));
            Reaction reaction = new Reaction(child.getCardId(), BOARD_ID, BOB, null, ReactionKind.THUMBS_UP);
            when(cardRepository.findById(child.getCardId())).thenReturn(Optional.of(child));
            when(cardRepository.findById(parent.getCardId())).thenReturn(Optional.of(parent));
            when(cardRepository.findActionCardsLinkedTo(BOARD_ID, child.getCardId())).thenReturn(List.of());
            when(reactionRepository.findByCardId(child.getCardId())).thenReturn(List.of(reaction));
            when(aggregationPropagator.contributionOf(child)).thenReturn(2);

            cardService.deleteCard(child.getCardId(), ALICE);

            ArgumentCaptor<CardDeletion> plan = ArgumentCaptor.forClass(CardDeletion.class);
            verify(cardRepository).delete(plan.capture());
            assertThat(plan.getValue().parent()).isSameAs(parent);
            assertThat(plan.getValue().parentContribution()).isEqualTo(2);
            assertThat(plan.getValue().reactions()).containsExactly(reaction);
            verify(aggregationPropagator).recompute(parent.getCardId());
            verify(eventPublisher).publish(argThat(e -> e.type() == BoardEventType.CARD_DELETED
                && e.payload() instanceof CardDeletedPayload payload
                && payload.cardId().equals(child.getCardId())));
        }

        @Test
        void deleteCard_ParentCard_OrphansChildrenAndDropsActionLinks() {
            FeedbackCard child = aCard().ownedBy(BOB).feedback();
            FeedbackCard stale = aCard().ownedBy(BOB).feedback();
            FeedbackCard parent = aCard().ownedBy(ALICE).withChildren(child.getCardId(), stale.getCardId()).feedback();
            child.setParentCardId(parent.getCardId());
            ActionCard action = aCard().linkedTo(parent.getCardId()).action();
            when(cardRepository.findById(parent.getCardId())).thenReturn(Optional.of(parent));
            when(cardRepository.findByIds(parent.children())).thenReturn(List.of(child, stale));
            when(cardRepository.findActionCardsLinkedTo(BOARD_ID, parent.getCardId())).thenReturn(List.of(action));
            when(reactionRepository.findByCardId(parent.getCardId())).thenReturn(List.of());

            cardService.deleteCard(parent.getCardId(), ALICE);

            ArgumentCaptor<CardDeletion> plan = ArgumentCaptor.forClass(CardDeletion.class);
            verify(cardRepository).delete(plan.capture());
            assertThat(plan.getValue().children()).containsExactly(child);
            assertThat(plan.getValue().linkingActions()).containsExactly(action);
            assertThat(plan.getValue().parent()).isNull();
            verify(aggregationPropagator, never()).recompute(anyString());
        }

        @Test
        void deleteCard_ConflictOnce_RetriesWithFreshRead() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));
            when(cardRepository.findActionCardsLinkedTo(BOARD_ID, card.getCardId())).thenReturn(List.of());
            when(reactionRepository.findByCardId(card.getCardId())).thenReturn(List.of());
            doThrow(new VersionConflictException("card moved on"))
                .doNothing()
                .when(cardRepository).delete(any(CardDeletion.class));

            cardService.deleteCard(card.getCardId(), ALICE);

            verify(cardRepository, times(2)).findById(card.getCardId());
            verify(cardRepository, times(2)).delete(any(CardDeletion.class));
            verify(eventPublisher).publish(any(BoardEvent.class));
        }

        @Test
        void deleteCard_ByOtherUser_ThrowsForbidden() {
            FeedbackCard card = aCard().ownedBy(ALICE).feedback();
            when(cardRepository.findById(card.getCardId())).thenReturn(Optional.of(card));

            assertThatThrownBy(() -> cardService.deleteCard(card.getCardId(), BOB))
                .isInstanceOf(UnauthorizedException.class);

            verify(cardRepository, never()).delete(any());
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    class ListCards {

        @Test
        void listCards_WithRelationships_NestsChildrenUnderTopLevel() {
            FeedbackCard parent = aCard().createdAt(Instant.parse("2026-01-01T09:00:00Z")).feedback();
            FeedbackCard child = aCard().withParent(parent.getCardId())
                .createdAt(Instant.parse("2026-01-01T10:00:00Z")).feedback();
            FeedbackCard loner = aCard().inColumn("to-improve")
                .createdAt(Instant.parse("2026-01-01T11:00:00Z")).feedback();
            parent.setChildCardIds(java.util.Set.of(child.getCardId()));
            when(boardService.boardExists(BOARD_ID)).thenReturn(true);
            when(cardRepository.findByBoardId(BOARD_ID)).thenReturn(List.of(parent, child, loner));

            CardsResponse response = cardService.listCardsForBoard(BOARD_ID, CardFilter.all());

            assertThat(response.cards()).extracting(CardDTO::getId)
                .containsExactly(loner.getCardId(), parent.getCardId());
            assertThat(response.cards().get(1).getChildren()).extracting(CardDTO::getId)
                .containsExactly(child.getCardId());
            assertThat(response.totalCount()).isEqualTo(3);
            assertThat(response.cardsByColumn()).containsEntry(COLUMN, 2).containsEntry("to-improve", 1);
        }

        @Test
        void listCards_WithoutRelationships_StillOmitsChildCards() {
            FeedbackCard parent = aCard().createdAt(Instant.parse("2026-01-01T09:00:00Z")).feedback();
            FeedbackCard child = aCard().withParent(parent.getCardId())
                .createdAt(Instant.parse("2026-01-01T10:00:00Z")).feedback();
            FeedbackCard orphan = aCard().withParent(randomId())
                .createdAt(Instant.parse("2026-01-01T11:00:00Z")).feedback();
            parent.setChildCardIds(java.util.Set.of(child.getCardId()));
            when(boardService.boardExists(BOARD_ID)).thenReturn(true);
            when(cardRepository.findByBoardId(BOARD_ID)).thenReturn(List.of(parent, child, orphan));

            CardsResponse flat = cardService.listCardsForBoard(BOARD_ID, new CardFilter(null, null, false));
            CardsResponse nested = cardService.listCardsForBoard(BOARD_ID, CardFilter.all());

            assertThat(flat.cards()).extracting(CardDTO::getId)
                .containsExactly(orphan.getCardId(), parent.getCardId());
            assertThat(flat.cards()).extracting(CardDTO::getId)
                .containsExactlyElementsOf(nested.cards().stream().map(CardDTO::getId).toList());
            assertThat(flat.cards().get(1).getChildren()).isNull();
            assertThat(flat.totalCount()).isEqualTo(3);
        }

        @Test
        void listCards_ActionLinkedToDeletedFeedback_HidesDanglingId() {
            FeedbackCard kept = aCard().feedback();
            String deletedId = randomId();
            ActionCard action = aCard().linkedTo(kept.getCardId(), deletedId).action();
            when(boardService.boardExists(BOARD_ID)).thenReturn(true);
            when(cardRepository.findByBoardId(BOARD_ID)).thenReturn(List.of(kept, action));

            CardsResponse response = cardService.listCardsForBoard(BOARD_ID, new CardFilter(null, null, false));

            CardDTO actionDto = response.cards().stream()
                .filter(dto -> dto.getId().equals(action.getCardId()))
                .findFirst().orElseThrow();
            assertThat(actionDto.getLinkedFeedbackIds()).containsExactly(kept.getCardId());
        }

        @Test
        void listCards_FilteredByCreator_CountsOnlyMatches() {
            FeedbackCard mine = aCard().ownedBy(ALICE).feedback();
            FeedbackCard theirs = aCard().ownedBy(BOB).feedback();
            when(boardService.boardExists(BOARD_ID)).thenReturn(true);
            when(cardRepository.findByBoardId(BOARD_ID)).thenReturn(List.of(mine, theirs));

            CardsResponse response = cardService.listCardsForBoard(BOARD_ID, new CardFilter(null, ALICE, false));

            assertThat(response.cards()).extracting(CardDTO::getId).containsExactly(mine.getCardId());
            assertThat(response.totalCount()).isEqualTo(1);
        }

        @Test
        void listCards_UnknownBoard_ThrowsNotFound() {
            when(boardService.boardExists(BOARD_ID)).thenReturn(false);

            assertThatThrownBy(() -> cardService.listCardsForBoard(BOARD_ID, null))
                .isInstanceOf(BoardNotFoundException.class);
        }
    }
}
