package de.leidenheit.apicontext.infrastructure.utils;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/**
 * Leaf comparator for {@link JsonNode#equals(Comparator, JsonNode)} under which numbers are equal
 * when their values are, regardless of representation ({@code 5} equals {@code 5.0}).
 */
public class NumericAwareNodeComparator implements Comparator<JsonNode> {

    public static final NumericAwareNodeComparator INSTANCE = new NumericAwareNodeComparator();

    @Override
    public int compare(final JsonNode left, final JsonNode right) {
        if (left.equals(right)) {
            return 0;
        }
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return 1;
    }

    public static boolean jsonEquals(final JsonNode left, final JsonNode right) {
        return left.equals(INSTANCE, right);
    }

    private NumericAwareNodeComparator() {}
}
