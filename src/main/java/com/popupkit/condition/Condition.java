package com.popupkit.condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed display guard. {@link #toString()} yields the normalized guard text that is stored
 * in an element's "when" field.
 */
public final class Condition {

    public enum Type {
        TRUTHY,
        NOT,
        HAS,
        COMPARE,
        AND,
        OR
    }

    private final Type type;
    private final String reference;
    private final ComparisonOperator operator;
    private final String operand;
    private final List<Condition> parts;

    private Condition(Type type, String reference, ComparisonOperator operator, String operand, List<Condition> parts) {
        this.type = type;
        this.reference = reference;
        this.operator = operator;
        this.operand = operand;
        this.parts = parts;
    }

    public static Condition truthy(String reference) {
        return new Condition(Type.TRUTHY, reference, null, null, List.of());
    }

    public static Condition not(Condition inner) {
        return new Condition(Type.NOT, null, null, null, List.of(inner));
    }

    public static Condition has(String reference, String value) {
        return new Condition(Type.HAS, reference, null, value, List.of());
    }

    public static Condition compare(String reference, ComparisonOperator operator, String value) {
        return new Condition(Type.COMPARE, reference, operator, value, List.of());
    }

    public static Condition and(List<Condition> parts) {
        return new Condition(Type.AND, null, null, null, Collections.unmodifiableList(new ArrayList<>(parts)));
    }

    public static Condition or(List<Condition> parts) {
        return new Condition(Type.OR, null, null, null, Collections.unmodifiableList(new ArrayList<>(parts)));
    }

    public Type getType() { return type; }

    /**
     * Element the guard inspects: an id, or a label that slugs to one.
     */
    public String getReference() { return reference; }

    public ComparisonOperator getOperator() { return operator; }

    public String getOperand() { return operand; }

    public List<Condition> getParts() { return parts; }

    public Condition getInner() {
        return parts.get(0);
    }

    @Override
    public String toString() {
        switch (type) {
            case TRUTHY:
                return reference;
            case NOT:
                return "not " + wrapped(getInner(), Type.NOT);
            case HAS:
                return reference + " has " + operand;
            case COMPARE:
                return reference + " " + operator.getSymbol() + " " + operand;
            case AND:
                return join(" and ");
            case OR:
                return join(" or ");
            default:
                throw new IllegalStateException("Unhandled condition type " + type);
        }
    }

    private String join(String separator) {
        List<String> texts = new ArrayList<>();
        for (Condition part : parts) {
            texts.add(wrapped(part, type));
        }
        return String.join(separator, texts);
    }

    /**
     * Parenthesize a nested compound that binds looser than its parent.
     */
    private static String wrapped(Condition child, Type parent) {
        boolean loose = child.type == Type.OR && parent != Type.OR
            || child.type == Type.AND && parent == Type.NOT;
        return loose ? "(" + child + ")" : child.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition that = (Condition) o;
        return type == that.type
            && Objects.equals(reference, that.reference)
            && operator == that.operator
            && Objects.equals(operand, that.operand)
            && parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, reference, operator, operand, parts);
    }
}
