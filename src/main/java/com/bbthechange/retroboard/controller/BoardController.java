package com.bbthechange.retroboard.controller;

import com.bbthechange.retroboard.dto.AddAdminRequest;
import com.bbthechange.retroboard.dto.BoardDTO;
import com.bbthechange.retroboard.dto.CardDTO;
import com.bbthechange.retroboard.dto.CardFilter;
import com.bbthechange.retroboard.dto.CardQuotaDTO;
import com.bbthechange.retroboard.dto.CardsResponse;
import com.bbthechange.retroboard.dto.CreateBoardRequest;
import com.bbthechange.retroboard.dto.CreateCardRequest;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;
import com.bbthechange.retroboard.service.BoardService;
import com.bbthechange.retroboard.service.CardService;
import com.bbthechange.retroboard.service.QuotaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Boards and the board-scoped card endpoints: listing, creation and quotas.
 */
@RestController
@RequestMapping("/v1/boards")
@Validated
@Tag(name = "Boards", description = "Board lifecycle, card listing and per-user quotas")
public class BoardController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BoardController.class);

    /** "me" in the createdBy filter stands for the caller, since owner hashes are never returned. */
    static final String CREATED_BY_ME = "me";

    private final BoardService boardService;
    private final CardService cardService;
    private final QuotaService quotaService;

    @Autowired
    public BoardController(BoardService boardService, CardService cardService, QuotaService quotaService) {
        this.boardService = boardService;
        this.cardService = cardService;
        this.quotaService = quotaService;
    }

    @PostMapping
    @Operation(summary = "Create a board", description = "The caller becomes the board's first admin.")
    public ResponseEntity<BoardDTO> createBoard(@Valid @RequestBody CreateBoardRequest request,
                                                HttpServletRequest httpRequest) {
        String userHash = extractUserHash(httpRequest);
        logger.info("Creating board {}", request.getName());

        BoardDTO board = boardService.createBoard(request, userHash);
        logger.info("Successfully created board {} with {} columns", board.getId(), board.getColumns().size());

        return ResponseEntity.status(HttpStatus.CREATED).body(board);
    }

    @GetMapping("/{boardId}")
    @Operation(summary = "Get a board")
    public ResponseEntity<BoardDTO> getBoard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(boardService.getBoard(boardId, extractUserHash(httpRequest)));
    }

    @PatchMapping("/{boardId}/close")
    @Operation(summary = "Close a board", description = "Admins only. A closed board rejects every card and reaction change.")
    public ResponseEntity<BoardDTO> closeBoard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            HttpServletRequest httpRequest) {
        BoardDTO board = boardService.closeBoard(boardId, extractUserHash(httpRequest));
        logger.info("Closed board {}", boardId);
        return ResponseEntity.ok(board);
    }

    @PostMapping("/{boardId}/admins")
    @Operation(summary = "Add a board admin",
               description = "Admins only. Admins may link and unlink any card on the board but still cannot edit or delete other users' cards.")
    public ResponseEntity<BoardDTO> addAdmin(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            @Valid @RequestBody AddAdminRequest request,
            HttpServletRequest httpRequest) {
        BoardDTO board = boardService.addAdmin(boardId, request.getUserHash(), extractUserHash(httpRequest));
        logger.info("Added admin to board {}", boardId);
        return ResponseEntity.ok(board);
    }

    @GetMapping("/{boardId}/cards")
    @Operation(summary = "List the cards of a board",
               description = "Top-level cards newest first, with children and linked feedback embedded unless includeRelationships=false.")
    public ResponseEntity<CardsResponse> listCards(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            @Parameter(description = "Only cards in this column") @RequestParam(required = false) String columnId,
            @Parameter(description = "Only cards created by the caller (\"me\")") @RequestParam(required = false) String createdBy,
            @RequestParam(defaultValue = "true") boolean includeRelationships,
            HttpServletRequest httpRequest) {

        String ownerHash = null;
        if (createdBy != null && !createdBy.isBlank()) {
            ownerHash = CREATED_BY_ME.equals(createdBy) ? extractUserHash(httpRequest) : createdBy;
        }

        CardsResponse response = cardService.listCardsForBoard(boardId,
            new CardFilter(columnId, ownerHash, includeRelationships));
        logger.debug("Returning {} cards for board {}", response.totalCount(), boardId);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{boardId}/cards")
    @Operation(summary = "Create a card", description = "Feedback cards count against the caller's card quota.")
    public ResponseEntity<CardDTO> createCard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            @Valid @RequestBody CreateCardRequest request,
            HttpServletRequest httpRequest) {

        String userHash = extractUserHash(httpRequest);
        CardDTO card = cardService.createCard(boardId, request, userHash, extractAlias(httpRequest));
        logger.info("Created card {} on board {}", card.getId(), boardId);

        return ResponseEntity.status(HttpStatus.CREATED).body(card);
    }

    @GetMapping("/{boardId}/cards/quota")
    @Operation(summary = "Card quota of the caller")
    public ResponseEntity<CardQuotaDTO> getCardQuota(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(quotaService.getCardQuota(boardId, extractUserHash(httpRequest)));
    }

    @GetMapping("/{boardId}/reactions/quota")
    @Operation(summary = "Reaction quota of the caller")
    public ResponseEntity<ReactionQuotaDTO> getReactionQuota(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid board ID format") String boardId,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(quotaService.getReactionQuota(boardId, extractUserHash(httpRequest)));
    }
}
