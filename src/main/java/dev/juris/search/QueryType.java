package dev.juris.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of a user query, as classified by the retrieval orchestrator.
 *
 * <p>The category selects fusion weights ({@link FusionWeights#forQueryType}) and enables the
 * article-citation boost of {@link LegalReranker}.
 */
public enum QueryType {
    CITATION("citation"),
    PROCEDURAL("procedural"),
    CONCEPTUAL("conceptual"),
    ANALYTICAL("analytical"),
    COMPARATIVE("comparative"),
    INTERPRETATION("interpretation"),
    ANALYSIS("analysis"),
    ADVICE("advice"),
    DEFINITION("definition"),
    PROCEDURE("procedure"),
    GENERAL("general"),
    DOCUMENT_ANALYSIS("document analysis");

    private final String value;

    QueryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static QueryType fromValue(String value) {
        for (QueryType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid query type: " + value);
    }
}
