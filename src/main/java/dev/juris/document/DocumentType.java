package dev.juris.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of legal instrument a document represents. */
public enum DocumentType {
    CONSTITUTION("constitution"),
    LAW("law"),
    CODE("code"),
    REGULATION("regulation"),
    NORM("norm"),
    JURISPRUDENCE("jurisprudence"),
    TREATY("treaty"),
    FORMAT("format");

    private final String value;

    DocumentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DocumentType fromValue(String value) {
        for (DocumentType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid document type: " + value);
    }
}
