package com.vidnyan.smelldsl.dsl.lexer;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of token kinds produced by the {@link Lexer}.
 * Keyword kinds carry the exact source text that selects them.
 */
public enum TokenKind {
    IDENTIFIER,
    OPERATOR,
    LBRACE,
    RBRACE,
    DOT,
    COMMA,

    SMELLTYPE("smelltype"),
    SMELL("smell"),
    EXTENDS("extends"),
    FEATURE("feature"),
    IS("is"),
    INTERVAL("Interval"),
    WITH("with"),
    THRESHOLD("threshold"),
    SYMPTOM("symptom"),
    TREATMENT("treatment"),
    RULE("rule"),
    WHEN("when"),
    THEN("then");

    private static final Map<String, TokenKind> KEYWORDS = Arrays.stream(values())
            .filter(TokenKind::isKeyword)
            .collect(Collectors.toUnmodifiableMap(k -> k.keyword, Function.identity()));

    private final String keyword;

    TokenKind() {
        this(null);
    }

    TokenKind(String keyword) {
        this.keyword = keyword;
    }

    public boolean isKeyword() {
        return keyword != null;
    }

    /**
     * Keyword kind whose text is exactly {@code word}. Matching is case sensitive.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
