package com.dbprobe.core.catalog;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive substring or regular-expression matching of a search keyword against
 * catalog identifiers and comments.
 * <p>
 * Identifiers are folded with the engine's {@link IdentifierCase} before comparison; comment
 * text is compared exactly as stored. In regex mode the pattern itself is never folded, since
 * upper-casing a pattern turns classes such as {@code \d} into their negations.
 */
public class TextMatcher {
    private final String keyword;
    private final Pattern pattern;
    private final IdentifierCase identifierCase;

    public TextMatcher(String keyword, boolean regex, IdentifierCase identifierCase) {
        this.keyword = keyword;
        this.pattern = regex ? Pattern.compile(keyword, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE) : null;
        this.identifierCase = identifierCase;
    }

    public boolean matchesIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return false;
        }
        String folded = identifierCase.fold(identifier);
        if (pattern != null) {
            return pattern.matcher(folded).find();
        }
        return contains(folded, identifierCase.fold(keyword));
    }

    public boolean matchesComment(String comment) {
        if (comment == null || comment.isEmpty()) {
            return false;
        }
        if (pattern != null) {
            return pattern.matcher(comment).find();
        }
        return contains(comment, keyword);
    }

    private static boolean contains(String text, String needle) {
        return text.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
