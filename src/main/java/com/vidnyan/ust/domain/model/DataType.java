package com.vidnyan.ust.domain.model;

/**
 * Primitive value kinds used to annotate literal nodes.
 */
public enum DataType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    NULL("null"),
    UNDEFINED("undefined"),
    VOID("void"),
    ANY("any");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
