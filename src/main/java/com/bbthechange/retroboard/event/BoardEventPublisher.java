package com.bbthechange.retroboard.event;

/**
 * Outbound notification port. Best effort: implementations must never fail the caller.
 */
public interface BoardEventPublisher {

    void publish(BoardEvent event);
}
