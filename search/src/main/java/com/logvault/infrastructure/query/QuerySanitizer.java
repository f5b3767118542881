package com.logvault.infrastructure.query;

import com.logvault.domain.MatchExpression;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free text into an FTS5 match expression that cannot carry query syntax.
 * <p>
 * Quotes, grouping, prefix and boost characters become spaces, as do control characters (a NUL
 * ends the string inside SQLite). Every remaining token is quoted as a phrase. Several tokens are
 * OR-ed: a record matching any of them is a hit.
 */
public final class QuerySanitizer {

    private static final Pattern RESERVED = Pattern.compile("[\"*^(){}\\[\\]\\p{Cntrl}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QuerySanitizer() {}

    public static MatchExpression sanitize(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return MatchExpression.nothing();
        }

        String cleaned = RESERVED.matcher(rawQuery).replaceAll(" ");
        List<String> tokens = Arrays.stream(WHITESPACE.split(cleaned.strip()))
                .filter(t -> !t.isEmpty())
                .toList();

        if (tokens.isEmpty()) {
            return MatchExpression.nothing();
        }
        if (tokens.size() == 1) {
            return new MatchExpression(phrase(tokens.get(0)), tokens);
        }
        String expression = tokens.stream()
                .map(QuerySanitizer::phrase)
                .collect(Collectors.joining(" OR "));
        return new MatchExpression(expression, tokens);
    }

    private static String phrase(String token) {
        return "\"" + token + "\"";
    }
}
