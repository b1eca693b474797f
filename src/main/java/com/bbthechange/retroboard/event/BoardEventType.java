package com.bbthechange.retroboard.event;

public enum BoardEventType {
    CARD_CREATED("card:created"),
    CARD_UPDATED("card:updated"),
    CARD_DELETED("card:deleted"),
    CARD_MOVED("card:moved"),
    CARD_LINKED("card:linked"),
    CARD_UNLINKED("card:unlinked"),
    REACTION_ADDED("reaction:added"),
    REACTION_REMOVED("reaction:removed");

    private final String eventName;

    BoardEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
