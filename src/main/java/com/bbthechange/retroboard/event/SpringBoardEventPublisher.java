package com.bbthechange.retroboard.event;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Hands board events to Spring's event bus, where the push transport subscribes.
 * A failing subscriber is logged and counted; the mutation that produced the event stands.
 */
@Component
public class SpringBoardEventPublisher implements BoardEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(SpringBoardEventPublisher.class);

    private final ApplicationEventPublisher applicationEventPublisher;
    private final MeterRegistry meterRegistry;

    @Autowired
    public SpringBoardEventPublisher(ApplicationEventPublisher applicationEventPublisher, MeterRegistry meterRegistry) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void publish(BoardEvent event) {
        try {
            applicationEventPublisher.publishEvent(event);
            meterRegistry.counter("retro_board_events_total", "type", event.type().getEventName(), "status", "published").increment();
        } catch (RuntimeException e) {
            meterRegistry.counter("retro_board_events_total", "type", event.type().getEventName(), "status", "error").increment();
            logger.warn("Failed to publish {} for board {}: {}", event.type().getEventName(), event.boardId(), e.getMessage());
        }
    }
}
