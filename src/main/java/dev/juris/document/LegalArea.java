package dev.juris.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Topical classification of a legal document (civil, labor, criminal...).
 */
public enum LegalArea {
    CONSTITUTIONAL("constitutional"),
    CIVIL("civil"),
    CRIMINAL("criminal"),
    LABOR("labor"),
    TAX("tax"),
    COMMERCIAL("commercial"),
    ADMINISTRATIVE("administrative"),
    ENVIRONMENTAL("environmental"),
    FAMILY("family"),
    PROPERTY("property"),
    MIGRATION("migration"),
    HUMAN_RIGHTS("human-rights");

    private final String value;

    LegalArea(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static LegalArea fromValue(String value) {
        for (LegalArea area : values()) {
            if (area.value.equalsIgnoreCase(value)) {
                return area;
            }
        }
        throw new IllegalArgumentException("Invalid legal area: " + value);
    }
}
