package dev.juris.ingestion.chunking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises article citations ("artículo 27", "Art. 5", "art 14") in Spanish legal text.
 */
public final class LegalCitations {

    /** Matches an article citation and captures the article number. */
    public static final Pattern ARTICLE_REFERENCE = Pattern.compile(
            "\\b(?:artículo|art\\.?)\\s+(\\d+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private LegalCitations() {
        // static utility
    }

    /**
     * Returns the distinct article numbers cited in the text, in order of first appearance.
     *
     * @param text the text to scan
     * @return cited article numbers; empty if none
     */
    public static List<String> citedArticles(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> numbers = new LinkedHashSet<>();
        Matcher matcher = ARTICLE_REFERENCE.matcher(text);
        while (matcher.find()) {
            numbers.add(matcher.group(1));
        }
        return new ArrayList<>(numbers);
    }
}
