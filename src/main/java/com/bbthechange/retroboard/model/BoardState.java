package com.bbthechange.retroboard.model;

public enum BoardState {
    ACTIVE,
    CLOSED
}
