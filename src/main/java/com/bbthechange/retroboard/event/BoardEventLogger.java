package com.bbthechange.retroboard.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Audit trail of board events at debug level.
 */
@Component
public class BoardEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(BoardEventLogger.class);

    @EventListener
    public void onBoardEvent(BoardEvent event) {
        logger.debug("Board event {} on board {} at {}", event.type().getEventName(), event.boardId(), event.occurredAt());
    }
}
