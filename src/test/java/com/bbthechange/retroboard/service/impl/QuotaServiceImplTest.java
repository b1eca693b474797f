package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.dto.CardQuotaDTO;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.BoardService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.bbthechange.retroboard.testutil.CardTestBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaServiceImplTest {

    @Mock
    private BoardService boardService;

    @Mock
    private CardRepository cardRepository;

    @Mock
    private ReactionRepository reactionRepository;

    @InjectMocks
    private QuotaServiceImpl quotaService;

    @Test
    void getCardQuota_BelowLimit_CanCreate() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(true);
        when(boardService.getCardLimit(BOARD_ID)).thenReturn(3);
        when(cardRepository.countFeedbackCards(BOARD_ID, ALICE)).thenReturn(2L);

        CardQuotaDTO quota = quotaService.getCardQuota(BOARD_ID, ALICE);

        assertThat(quota).isEqualTo(new CardQuotaDTO(2, 3, true, true));
    }

    @Test
    void getCardQuota_AtLimit_CannotCreate() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(true);
        when(boardService.getCardLimit(BOARD_ID)).thenReturn(2);
        when(cardRepository.countFeedbackCards(BOARD_ID, ALICE)).thenReturn(2L);

        assertThat(quotaService.getCardQuota(BOARD_ID, ALICE).canCreate()).isFalse();
    }

    @Test
    void getReactionQuota_NoLimit_AlwaysAllowed() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(true);
        when(boardService.getReactionLimit(BOARD_ID)).thenReturn(null);
        when(reactionRepository.countByBoardAndUser(BOARD_ID, BOB)).thenReturn(250L);

        ReactionQuotaDTO quota = quotaService.getReactionQuota(BOARD_ID, BOB);

        assertThat(quota.canReact()).isTrue();
        assertThat(quota.limitEnabled()).isFalse();
        assertThat(quota.limit()).isNull();
        assertThat(quota.currentCount()).isEqualTo(250);
    }

    @Test
    void getReactionQuota_MissingBoard_ThrowsNotFound() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(false);

        assertThatThrownBy(() -> quotaService.getReactionQuota(BOARD_ID, BOB))
            .isInstanceOf(BoardNotFoundException.class);
        verifyNoInteractions(reactionRepository);
    }
}
