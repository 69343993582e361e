package dev.juris.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Structural role of a {@link Section} inside a legal document. */
public enum SectionType {
    TITLE("title", "Título"),
    CHAPTER("chapter", "Capítulo"),
    SECTION("section", "Sección"),
    ARTICLE("article", "Artículo"),
    PARAGRAPH("paragraph", "Párrafo"),
    FRACTION("fraction", "Fracción");

    private final String value;
    private final String label;

    SectionType(String value, String label) {
        this.value = value;
        this.label = label;
    }

    /** Spanish heading label used when rendering section paths, e.g. "Capítulo". */
    public String label() {
        return label;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SectionType fromValue(String value) {
        for (SectionType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid section type: " + value);
    }
}
