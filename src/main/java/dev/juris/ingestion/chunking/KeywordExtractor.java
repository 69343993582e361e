package dev.juris.ingestion.chunking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts legal keyword tags from chunk text.
 *
 * <p>Three kinds of tags are produced, in this order: plain legal terms found in the text
 * ({@code "amparo"}), article citations ({@code "art_123"}) and named laws or codes
 * ({@code "ley_federal_del_trabajo"}).
 */
public final class KeywordExtractor {

    private static final List<String> LEGAL_TERMS = List.of(
            "artículo", "fracción", "inciso", "párrafo", "constitución",
            "código", "ley", "reglamento", "derecho", "obligación",
            "responsabilidad", "procedimiento", "amparo", "tribunal",
            "juzgado", "sentencia", "jurisprudencia", "tesis", "criterio");

    private static final Pattern LAW_REFERENCE = Pattern.compile(
            "\\b(?:ley|código)\\s+(?:federal\\s+)?(?:del?\\s+)?([\\w\\s]+?)(?:\\.|,|;|\\n|$)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MAX_LAW_NAME_LENGTH = 50;

    private KeywordExtractor() {
        // static utility
    }

    /**
     * Extracts the keyword tags of a text.
     *
     * @param text the chunk body (without contextual prefix)
     * @return distinct tags in extraction order; empty for blank text
     */
    public static List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> keywords = new LinkedHashSet<>();
        String lower = text.toLowerCase(Locale.ROOT);

        for (String term : LEGAL_TERMS) {
            if (lower.contains(term)) {
                keywords.add(term);
            }
        }

        for (String article : LegalCitations.citedArticles(text)) {
            keywords.add("art_" + article);
        }

        Matcher laws = LAW_REFERENCE.matcher(text);
        while (laws.find()) {
            String lawName = laws.group(1).trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
            if (!lawName.isEmpty() && lawName.length() < MAX_LAW_NAME_LENGTH) {
                keywords.add("ley_" + lawName);
            }
        }

        if (lower.contains("ley federal del trabajo")) {
            keywords.add("ley_federal_del_trabajo");
        }
        if (lower.contains("código civil")) {
            keywords.add("ley_codigo_civil");
        }

        return new ArrayList<>(keywords);
    }
}
