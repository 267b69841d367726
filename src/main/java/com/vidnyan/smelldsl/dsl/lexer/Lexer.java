package com.vidnyan.smelldsl.dsl.lexer;

import com.vidnyan.smelldsl.domain.error.LexException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns SmellDSL source into a flat list of tokens.
 *
 * Token classes are tried in a fixed order: line comment, identifier or keyword,
 * operator ({@code >=} before {@code >} and {@code =}), braces, dot, comma,
 * newline, blanks. Comments, newlines and blanks are dropped. The first character
 * that fits no class aborts lexing.
 */
@Slf4j
@Component
public class Lexer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(String.join("|",
            "(?<COMMENT>//[^\\r\\n]*)",
            "(?<ID>[A-Za-z_][A-Za-z0-9_]*)",
            "(?<OPERATOR>>=|>|=)",
            "(?<LBRACE>\\{)",
            "(?<RBRACE>\\})",
            "(?<DOT>\\.)",
            "(?<COMMA>,)",
            "(?<NEWLINE>\\r?\\n)",
            "(?<SKIP>[ \\t]+)"));

    /**
     * Tokenize the whole source.
     *
     * @throws LexException on the first unrecognized character
     */
    public List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(source);

        int position = 0;
        int line = 1;
        int lineStart = 0;

        while (position < source.length()) {
            matcher.region(position, source.length());
            int column = position - lineStart + 1;
            if (!matcher.lookingAt()) {
                throw new LexException(source.charAt(position), line, column);
            }

            String text = matcher.group();
            if (matcher.group("NEWLINE") != null) {
                line++;
                lineStart = matcher.end();
            } else if (matcher.group("ID") != null) {
                TokenKind kind = TokenKind.keyword(text).orElse(TokenKind.IDENTIFIER);
                tokens.add(new Token(kind, text, line, column));
            } else if (matcher.group("OPERATOR") != null) {
                tokens.add(new Token(TokenKind.OPERATOR, text, line, column));
            } else if (matcher.group("LBRACE") != null) {
                tokens.add(new Token(TokenKind.LBRACE, text, line, column));
            } else if (matcher.group("RBRACE") != null) {
                tokens.add(new Token(TokenKind.RBRACE, text, line, column));
            } else if (matcher.group("DOT") != null) {
                tokens.add(new Token(TokenKind.DOT, text, line, column));
            } else if (matcher.group("COMMA") != null) {
                tokens.add(new Token(TokenKind.COMMA, text, line, column));
            }
            // comments and blanks are dropped

            position = matcher.end();
        }

        log.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return tokens;
    }
}
