package com.bbthechange.retroboard.controller;

import com.bbthechange.retroboard.dto.AddReactionRequest;
import com.bbthechange.retroboard.dto.ReactionDTO;
import com.bbthechange.retroboard.dto.ReactionResult;
import com.bbthechange.retroboard.service.ReactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/cards/{cardId}/reactions")
@Validated
@Tag(name = "Reactions", description = "One vote per user per card")
public class ReactionController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ReactionController.class);

    private final ReactionService reactionService;

    @Autowired
    public ReactionController(ReactionService reactionService) {
        this.reactionService = reactionService;
    }

    @PostMapping
    @Operation(summary = "React to a card",
               description = "201 for a first vote, 200 when the caller's existing vote was changed in place.")
    public ResponseEntity<ReactionDTO> addReaction(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            @RequestBody(required = false) AddReactionRequest request,
            HttpServletRequest httpRequest) {

        String userHash = extractUserHash(httpRequest);
        ReactionResult result = reactionService.addOrUpdateReaction(cardId, userHash, extractAlias(httpRequest),
            request != null ? request.getReactionType() : null);

        if (result.created()) {
            logger.info("Reaction added to card {}", cardId);
            return ResponseEntity.status(HttpStatus.CREATED).body(result.reaction());
        }
        return ResponseEntity.ok(result.reaction());
    }

    @DeleteMapping
    @Operation(summary = "Remove the caller's reaction from a card")
    public ResponseEntity<Void> removeReaction(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            HttpServletRequest httpRequest) {

        reactionService.removeReaction(cardId, extractUserHash(httpRequest));
        logger.info("Reaction removed from card {}", cardId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/mine")
    @Operation(summary = "The caller's reaction on a card", description = "404 when the caller has not reacted.")
    public ResponseEntity<ReactionDTO> getMyReaction(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            HttpServletRequest httpRequest) {

        return reactionService.getUserReaction(cardId, extractUserHash(httpRequest))
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
