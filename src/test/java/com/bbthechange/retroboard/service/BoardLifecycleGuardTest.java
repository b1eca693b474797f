package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.exception.BoardClosedException;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import com.bbthechange.retroboard.exception.ErrorCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.bbthechange.retroboard.testutil.CardTestBuilder.BOARD_ID;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BoardLifecycleGuardTest {

    @Mock
    private BoardService boardService;

    @InjectMocks
    private BoardLifecycleGuard guard;

    @Test
    void ensureOpen_OpenBoard_Passes() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(true);
        when(boardService.isOpen(BOARD_ID)).thenReturn(true);

        assertThatCode(() -> guard.ensureOpen(BOARD_ID)).doesNotThrowAnyException();
    }

    @Test
    void ensureOpen_MissingBoard_ThrowsNotFound() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(false);

        assertThatThrownBy(() -> guard.ensureOpen(BOARD_ID))
            .isInstanceOf(BoardNotFoundException.class);
        verify(boardService, never()).isOpen(anyString());
    }

    @Test
    void ensureOpen_ClosedBoard_ThrowsConflict() {
        when(boardService.boardExists(BOARD_ID)).thenReturn(true);
        when(boardService.isOpen(BOARD_ID)).thenReturn(false);

        assertThatThrownBy(() -> guard.ensureOpen(BOARD_ID))
            .isInstanceOf(BoardClosedException.class)
            .satisfies(e -> assertThat(((BoardClosedException) e).getCategory()).isEqualTo(ErrorCategory.CONFLICT));
    }
}
