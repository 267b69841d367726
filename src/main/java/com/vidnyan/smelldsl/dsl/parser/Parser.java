package com.vidnyan.smelldsl.dsl.parser;

import com.vidnyan.smelldsl.domain.error.DslSyntaxException;
import com.vidnyan.smelldsl.domain.model.Feature;
import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.model.Rule;
import com.vidnyan.smelldsl.domain.model.Smell;
import com.vidnyan.smelldsl.dsl.lexer.Token;
import com.vidnyan.smelldsl.dsl.lexer.TokenKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for SmellDSL.
 *
 * Grammar:
 * <pre>
 * program   := declaration*
 * declaration := smelltype | smell | rule
 * smelltype := 'smelltype' ID
 * smell     := 'smell' ID ('extends' ID)? '{' member* '}'
 * member    := feature | 'symptom' ID | 'treatment' ID
 * feature   := 'feature' ID 'is' 'Interval' 'with' 'threshold' ID (',' ID)*
 * rule      := 'rule' ID 'when' token* 'then' ID+
 * </pre>
 *
 * Single forward cursor, no backtracking and no recovery. A parser instance holds
 * the cursor of one token list and must not be shared between runs.
 */
@Slf4j
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    private final List<String> smellTypes = new ArrayList<>();
    private final List<Smell> smells = new ArrayList<>();
    private final List<Rule> rules = new ArrayList<>();

    public Parser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Parse every declaration until the tokens run out.
     *
     * @throws DslSyntaxException on the first grammar violation
     */
    public ParsedProgram parse() {
        while (current() != null) {
            Token token = current();
            switch (token.kind()) {
                case SMELLTYPE -> parseSmellType();
                case SMELL -> parseSmell();
                case RULE -> parseRule();
                default -> throw new DslSyntaxException(
                        "Unexpected token at the start of a declaration: " + token.describe());
            }
        }

        log.debug("Parsed {} smell types, {} smells, {} rules",
                smellTypes.size(), smells.size(), rules.size());
        return new ParsedProgram(smellTypes, smells, rules);
    }

    private void parseSmellType() {
        eat(TokenKind.SMELLTYPE);
        smellTypes.add(eat(TokenKind.IDENTIFIER).text());
    }

    private void parseSmell() {
        eat(TokenKind.SMELL);
        Smell.Builder smell = Smell.builder(eat(TokenKind.IDENTIFIER).text());

        if (check(TokenKind.EXTENDS)) {
            eat(TokenKind.EXTENDS);
            smell.extendsType(eat(TokenKind.IDENTIFIER).text());
        }

        eat(TokenKind.LBRACE);
        while (current() != null && !check(TokenKind.RBRACE)) {
            Token token = current();
            switch (token.kind()) {
                case FEATURE -> smell.feature(parseFeature());
                case SYMPTOM -> {
                    eat(TokenKind.SYMPTOM);
                    smell.symptom(eat(TokenKind.IDENTIFIER).text());
                }
                case TREATMENT -> {
                    eat(TokenKind.TREATMENT);
                    smell.treatment(eat(TokenKind.IDENTIFIER).text());
                }
                default -> throw new DslSyntaxException(
                        "Unexpected token inside a 'smell' block: " + token.describe());
            }
        }
        eat(TokenKind.RBRACE);

        smells.add(smell.build());
    }

    private Feature parseFeature() {
        eat(TokenKind.FEATURE);
        String name = eat(TokenKind.IDENTIFIER).text();
        eat(TokenKind.IS);
        eat(TokenKind.INTERVAL);
        eat(TokenKind.WITH);
        eat(TokenKind.THRESHOLD);

        List<String> thresholds = new ArrayList<>();
        thresholds.add(eat(TokenKind.IDENTIFIER).text());
        while (check(TokenKind.COMMA)) {
            eat(TokenKind.COMMA);
            thresholds.add(eat(TokenKind.IDENTIFIER).text());
        }
        return new Feature(name, thresholds);
    }

    private void parseRule() {
        eat(TokenKind.RULE);
        String name = eat(TokenKind.IDENTIFIER).text();
        eat(TokenKind.WHEN);

        List<String> conditionParts = new ArrayList<>();
        while (current() != null && !check(TokenKind.THEN)) {
            conditionParts.add(current().text());
            advance();
        }
        String condition = String.join(" ", conditionParts).replace(" . ", ".");

        eat(TokenKind.THEN);

        List<String> actionParts = new ArrayList<>();
        actionParts.add(eat(TokenKind.IDENTIFIER).text());
        while (check(TokenKind.IDENTIFIER)) {
            actionParts.add(current().text());
            advance();
        }

        rules.add(new Rule(name, condition, String.join(" ", actionParts)));
    }

    private Token current() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private boolean check(TokenKind kind) {
        Token token = current();
        return token != null && token.is(kind);
    }

    private void advance() {
        position++;
    }

    private Token eat(TokenKind expected) {
        Token token = current();
        if (token != null && token.is(expected)) {
            advance();
            return token;
        }
        String found = token != null ? token.describe() : "end of input";
        throw new DslSyntaxException(
                String.format("Syntax error: expected token '%s' but found %s", expected, found));
    }
}
