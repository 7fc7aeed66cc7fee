package info.acme.ordering.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the product search pattern from a {@code |}-separated term
 * expression such as {@code "rockets | skates"}.
 */
public final class SearchTerms {

    private SearchTerms() {
    }

    /**
     * Splits the expression into trimmed, non-blank, singularized terms.
     *
     * @param termExpression Terms separated by {@code |}.
     * @return The terms in their original order.
     */
    public static List<String> parse(String termExpression) {
        if (termExpression == null) {
            return List.of();
        }

        return Arrays.stream(termExpression.split("\\|"))
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .map(SearchTerms::singularize)
                .collect(Collectors.toList());
    }

    /**
     * Compiles a case-insensitive alternation of the quoted terms.
     *
     * @param terms Terms as returned by {@link #parse(String)}, not empty.
     * @return The compiled pattern.
     */
    public static Pattern toPattern(List<String> terms) {
        String alternation = terms.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));

        return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /**
     * Reduces a regular English plural to its singular form. Words that do not
     * look like plurals are returned unchanged.
     *
     * @param word A single term.
     * @return The singular form.
     */
    static String singularize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);

        if (lower.length() <= 3 || lower.endsWith("ss") || lower.endsWith("us") || lower.endsWith("is")) {
            return word;
        }
        if (lower.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (lower.endsWith("ches") || lower.endsWith("shes") || lower.endsWith("sses") || lower.endsWith("xes")
                || lower.endsWith("zes")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("s")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }
}
