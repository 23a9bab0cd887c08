package com.libragraph.vfs.core.doc;

import java.util.Objects;

/**
 * Single-field query predicate over document bodies.
 */
public record Selector(String field, Operator operator, String value) {

    public enum Operator { EQUAL, STARTS_WITH }

    public Selector {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public static Selector equal(String field, String value) {
        return new Selector(field, Operator.EQUAL, value);
    }

    public static Selector startsWith(String field, String prefix) {
        return new Selector(field, Operator.STARTS_WITH, prefix);
    }

    /** Evaluates the predicate against a field value; a missing field never matches. */
    public boolean matches(String fieldValue) {
        if (fieldValue == null) {
            return false;
        }
        return switch (operator) {
            case EQUAL -> fieldValue.equals(value);
            case STARTS_WITH -> fieldValue.startsWith(value);
        };
    }
}
