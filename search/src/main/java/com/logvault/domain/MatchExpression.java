package com.logvault.domain;

import java.util.List;

public record MatchExpression(String expression, List<String> tokens) {

    public static final String MATCH_NOTHING = "\"\"";

    public MatchExpression {
        tokens = List.copyOf(tokens);
    }

    public static MatchExpression nothing() {
        return new MatchExpression(MATCH_NOTHING, List.of());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
