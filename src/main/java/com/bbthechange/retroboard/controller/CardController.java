package com.bbthechange.retroboard.controller;

import com.bbthechange.retroboard.dto.CardDTO;
import com.bbthechange.retroboard.dto.LinkCardsRequest;
import com.bbthechange.retroboard.dto.MoveCardRequest;
import com.bbthechange.retroboard.dto.UpdateCardRequest;
import com.bbthechange.retroboard.model.LinkType;
import com.bbthechange.retroboard.service.CardService;
import com.bbthechange.retroboard.service.RelationshipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/cards")
@Validated
@Tag(name = "Cards", description = "Card content, placement and relationships")
public class CardController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CardController.class);

    private final CardService cardService;
    private final RelationshipService relationshipService;

    @Autowired
    public CardController(CardService cardService, RelationshipService relationshipService) {
        this.cardService = cardService;
        this.relationshipService = relationshipService;
    }

    @GetMapping("/{cardId}")
    @Operation(summary = "Get a card", description = "Children or linked feedback summaries are embedded.")
    public ResponseEntity<CardDTO> getCard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId) {
        return ResponseEntity.ok(cardService.getCard(cardId));
    }

    @PutMapping("/{cardId}")
    @Operation(summary = "Edit card content", description = "Card creator only.")
    public ResponseEntity<CardDTO> updateCard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            @Valid @RequestBody UpdateCardRequest request,
            HttpServletRequest httpRequest) {

        CardDTO card = cardService.updateContent(cardId, request.getContent(), extractUserHash(httpRequest));
        logger.info("Updated card {}", cardId);
        return ResponseEntity.ok(card);
    }

    @PatchMapping("/{cardId}/column")
    @Operation(summary = "Move a card to another column", description = "Card creator only.")
    public ResponseEntity<CardDTO> moveCard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            @Valid @RequestBody MoveCardRequest request,
            HttpServletRequest httpRequest) {

        CardDTO card = cardService.moveColumn(cardId, request.getColumnId(), extractUserHash(httpRequest));
        logger.info("Moved card {} to column {}", cardId, request.getColumnId());
        return ResponseEntity.ok(card);
    }

    @DeleteMapping("/{cardId}")
    @Operation(summary = "Delete a card",
               description = "Card creator only. Children become top-level cards and links to the card are dropped.")
    public ResponseEntity<Void> deleteCard(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            HttpServletRequest httpRequest) {

        cardService.deleteCard(cardId, extractUserHash(httpRequest));
        logger.info("Deleted card {}", cardId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{cardId}/link")
    @Operation(summary = "Link two cards",
               description = "parent_of groups a feedback card under this one; linked_to points this action card at feedback.")
    public ResponseEntity<Void> linkCards(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            @Valid @RequestBody LinkCardsRequest request,
            HttpServletRequest httpRequest) {

        LinkType linkType = LinkType.fromWire(request.getLinkType());
        relationshipService.link(cardId, request.getTargetCardId(), linkType, extractUserHash(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{cardId}/unlink")
    @Operation(summary = "Unlink two cards", description = "Unlinking cards that are not linked succeeds without change.")
    public ResponseEntity<Void> unlinkCards(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid card ID format") String cardId,
            @Valid @RequestBody LinkCardsRequest request,
            HttpServletRequest httpRequest) {

        LinkType linkType = LinkType.fromWire(request.getLinkType());
        relationshipService.unlink(cardId, request.getTargetCardId(), linkType, extractUserHash(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
