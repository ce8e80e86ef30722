package com.vidnyan.ust.domain.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Factory helpers for the node shapes every parser produces.
 */
public final class AstNodes {

    private AstNodes() {
    }

    public static AstNode program(String language) {
        AstNode node = new AstNode(NodeType.PROGRAM, language);
        node.setAttribute("language", language);
        return node;
    }

    public static AstNode function(String name, List<String> parameters, String language) {
        AstNode node = new AstNode(NodeType.FUNCTION_DECLARATION, language);
        node.setAttribute("name", name);
        node.setAttribute("parameters", List.copyOf(parameters));
        return node;
    }

    public static AstNode variable(String name, String kind, String language) {
        AstNode node = new AstNode(NodeType.VARIABLE_DECLARATION, language);
        node.setAttribute("name", name);
        if (kind != null) {
            node.setAttribute("kind", kind);
        }
        return node;
    }

    public static AstNode identifier(String name, String language) {
        AstNode node = new AstNode(NodeType.IDENTIFIER, language);
        node.setAttribute("name", name);
        return node;
    }

    public static AstNode literal(Object value, DataType dataType, String language) {
        AstNode node = new AstNode(NodeType.LITERAL, language);
        node.setAttribute("value", normalizeNumber(value));
        node.setAttribute("data_type", dataType.value());
        return node;
    }

    /**
     * Integral values are stored in the narrowest of Integer, Long, BigInteger,
     * the same representation a JSON reader picks, so literals survive a round trip.
     */
    public static Object normalizeNumber(Object value) {
        if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        if (value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() < 32) {
                return big.intValue();
            }
            if (big.bitLength() < 64) {
                return big.longValue();
            }
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    /**
     * Parse an integer literal body (digits only, no sign) in the given radix.
     */
    public static Object parseInteger(String digits, int radix) {
        return normalizeNumber(new BigInteger(digits, radix));
    }
}
