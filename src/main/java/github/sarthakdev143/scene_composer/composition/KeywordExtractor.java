package github.sarthakdev143.scene_composer.composition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lower-case tokenisation shared by profiling, scoring and candidate search.
 */
public final class KeywordExtractor {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}'-]+");
    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "are", "was", "were", "you", "your",
            "our", "their", "from", "into", "about", "have", "has", "had", "will", "can", "its",
            "not", "but", "all", "any", "how", "what", "why", "when", "who", "which", "there",
            "here", "then", "than", "them", "they", "these", "those", "just", "also", "very",
            "more", "most", "some", "such", "each", "been", "being", "over", "only", "out",
            "now", "let", "let's", "it's", "we're", "you're", "did", "does", "get", "got");

    private KeywordExtractor() {
    }

    public static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String raw : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            String token = trimPunctuation(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Distinct content words of the given texts in order of first appearance.
     */
    public static List<String> keywords(int limit, String... texts) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String text : texts) {
            for (String token : tokens(text)) {
                if (keywords.size() >= limit) {
                    return List.copyOf(keywords);
                }
                if (token.length() >= MIN_KEYWORD_LENGTH && !STOP_WORDS.contains(token)) {
                    keywords.add(token);
                }
            }
        }
        return List.copyOf(keywords);
    }

    /**
     * Token stream joined by single spaces and padded on both ends, so that whole-word and
     * multi-word terms can be found with {@link #containsTerm(String, String)}.
     */
    public static String normalizedText(String text) {
        return " " + String.join(" ", tokens(text)) + " ";
    }

    public static boolean containsTerm(String normalizedText, String term) {
        List<String> termTokens = tokens(term);
        if (termTokens.isEmpty()) {
            return false;
        }
        return normalizedText.contains(" " + String.join(" ", termTokens) + " ");
    }

    private static String trimPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isEdgePunctuation(token.charAt(start))) {
            start++;
        }
        while (end > start && isEdgePunctuation(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isEdgePunctuation(char value) {
        return value == '-' || value == '\'';
    }
}
