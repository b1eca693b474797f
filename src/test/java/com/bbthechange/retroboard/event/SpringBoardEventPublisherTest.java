package com.bbthechange.retroboard.event;

import com.bbthechange.retroboard.dto.CardDeletedPayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static com.bbthechange.retroboard.testutil.CardTestBuilder.BOARD_ID;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpringBoardEventPublisherTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private SpringBoardEventPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new SpringBoardEventPublisher(applicationEventPublisher, meterRegistry);
    }

    @Test
    void publish_HandsEventToSpringAndCountsIt() {
        BoardEvent event = BoardEvent.of(BoardEventType.CARD_DELETED, BOARD_ID, new CardDeletedPayload("c", BOARD_ID));

        publisher.publish(event);

        verify(applicationEventPublisher).publishEvent(event);
        assertThat(meterRegistry.counter("retro_board_events_total",
            "type", BoardEventType.CARD_DELETED.getEventName(), "status", "published").count()).isEqualTo(1.0);
    }

    @Test
    void publish_SubscriberFailure_IsCountedNotRethrown() {
        doThrow(new IllegalStateException("listener down")).when(applicationEventPublisher).publishEvent(any(Object.class));
        BoardEvent event = BoardEvent.of(BoardEventType.CARD_CREATED, BOARD_ID, null);

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();

        assertThat(meterRegistry.counter("retro_board_events_total",
            "type", BoardEventType.CARD_CREATED.getEventName(), "status", "error").count()).isEqualTo(1.0);
    }
}
