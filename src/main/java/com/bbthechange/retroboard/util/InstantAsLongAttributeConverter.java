package com.bbthechange.retroboard.util;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;

/**
 * Stores card, reaction and board timestamps as epoch milliseconds.
 * Raw update expressions use {@link #now()} so mapped and hand-built writes agree on the format.
 */
public class InstantAsLongAttributeConverter implements AttributeConverter<Instant> {

    private static final AttributeValue NULL_VALUE = AttributeValue.builder().nul(true).build();

    @Override
    public AttributeValue transformFrom(Instant instant) {
        return instant == null ? NULL_VALUE : epochMillis(instant);
    }

    @Override
    public Instant transformTo(AttributeValue attributeValue) {
        if (attributeValue == null || attributeValue.n() == null) {
            return null;
        }
        return Instant.ofEpochMilli(Long.parseLong(attributeValue.n()));
    }

    @Override
    public EnhancedType<Instant> type() {
        return EnhancedType.of(Instant.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.N;
    }

    public static AttributeValue now() {
        return epochMillis(Instant.now());
    }

    private static AttributeValue epochMillis(Instant instant) {
        return AttributeValue.builder().n(Long.toString(instant.toEpochMilli())).build();
    }
}
