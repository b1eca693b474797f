package com.bbthechange.retroboard.exception;

import java.util.Map;

public class InvalidRelationshipException extends BoardDomainException {

    private final RelationshipViolation violation;

    public InvalidRelationshipException(RelationshipViolation violation, String message) {
        super(ErrorCategory.INVALID_RELATIONSHIP, violation.name(), message,
            Map.of("violation", violation.name()));
        this.violation = violation;
    }

    public RelationshipViolation getViolation() {
        return violation;
    }
}
