package dev.juris.fixture;

import dev.juris.document.DocumentType;
import dev.juris.document.LegalArea;
import dev.juris.document.LegalDocument;
import dev.juris.document.Section;
import dev.juris.document.SectionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight test builder for {@link LegalDocument}.
 * Provides sensible defaults so tests only override what they care about.
 *
 * <pre>{@code
 * LegalDocument doc = new LegalDocumentBuilder()
 *         .article("1", "Disposiciones generales", "Esta ley es de orden público.")
 *         .build();
 * }</pre>
 */
public final class LegalDocumentBuilder {

    private String id = "lft";
    private String title = "Ley Federal del Trabajo";
    private String shortTitle = "LFT";
    private DocumentType type = DocumentType.LAW;
    private int hierarchy = 3;
    private LegalArea area = LegalArea.LABOR;
    private String authority = "Congreso de la Unión";
    private String publicationDate = "1970-04-01";
    private String lastUpdated = "2024-01-15";
    private final List<Section> sections = new ArrayList<>();
    private String fullText;

    public LegalDocumentBuilder id(String id) {
        this.id = id;
        return this;
    }

    public LegalDocumentBuilder title(String title) {
        this.title = title;
        return this;
    }

    public LegalDocumentBuilder type(DocumentType type) {
        this.type = type;
        return this;
    }

    public LegalDocumentBuilder hierarchy(int hierarchy) {
        this.hierarchy = hierarchy;
        return this;
    }

    public LegalDocumentBuilder area(LegalArea area) {
        this.area = area;
        return this;
    }

    public LegalDocumentBuilder lastUpdated(String lastUpdated) {
        this.lastUpdated = lastUpdated;
        return this;
    }

    public LegalDocumentBuilder section(Section section) {
        this.sections.add(section);
        return this;
    }

    /** Adds a top-level article with an id derived from its number. */
    public LegalDocumentBuilder article(String number, String title, String content) {
        return section(new Section("art-" + number, SectionType.ARTICLE, number, title, content));
    }

    public LegalDocumentBuilder fullText(String fullText) {
        this.fullText = fullText;
        return this;
    }

    public LegalDocument build() {
        return new LegalDocument(id, title, shortTitle, type, hierarchy, area, authority,
                publicationDate, lastUpdated, sections, fullText);
    }
}
