package com.purchasingpower.itemgraph.normalize;

import lombok.Builder;
import lombok.Value;

/**
 * One row of a node kind's field table: name, type, default and expected range.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class FieldRule {

    String name;
    FieldType type;
    Object defaultValue;

    @Builder.Default
    RangeRule range = RangeRule.ANY;

    public static FieldRule string(String name) {
        return of(name, FieldType.STRING, RangeRule.ANY);
    }

    public static FieldRule bool(String name) {
        return of(name, FieldType.BOOLEAN, RangeRule.ANY);
    }

    /** Non-negative integer. */
    public static FieldRule count(String name) {
        return of(name, FieldType.INTEGER, RangeRule.NON_NEGATIVE);
    }

    /** Signed integer, e.g. slot indexes. */
    public static FieldRule integer(String name) {
        return of(name, FieldType.INTEGER, RangeRule.ANY);
    }

    /** Non-negative decimal. */
    public static FieldRule stat(String name) {
        return of(name, FieldType.DECIMAL, RangeRule.NON_NEGATIVE);
    }

    public static FieldRule chance(String name) {
        return of(name, FieldType.DECIMAL, RangeRule.CHANCE);
    }

    public static FieldRule numbers(String name) {
        return of(name, FieldType.NUMBER_LIST, RangeRule.NON_NEGATIVE);
    }

    public static FieldRule ingredients(String name) {
        return of(name, FieldType.INGREDIENT_LIST, RangeRule.ANY);
    }

    public static FieldRule of(String name, FieldType type, RangeRule range) {
        return FieldRule.builder()
                .name(name)
                .type(type)
                .defaultValue(type.getDefaultValue())
                .range(range)
                .build();
    }

    public FieldRule withDefault(Object value) {
        return FieldRule.builder()
                .name(name)
                .type(type)
                .defaultValue(value)
                .range(range)
                .build();
    }
}
