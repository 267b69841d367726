package com.vidnyan.smelldsl.dsl;

import com.vidnyan.smelldsl.domain.model.ParsedProgram;
import com.vidnyan.smelldsl.domain.report.RunLog;
import com.vidnyan.smelldsl.dsl.lexer.Lexer;
import com.vidnyan.smelldsl.dsl.lexer.Token;
import com.vidnyan.smelldsl.dsl.parser.Parser;
import com.vidnyan.smelldsl.dsl.semantic.SemanticAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Language front end: lexes, parses and validates a SmellDSL document.
 * A fresh {@link Parser} is created for every call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmellDslInterpreter {

    private final Lexer lexer;
    private final SemanticAnalyzer semanticAnalyzer;

    /**
     * Interpret a document and return its validated program.
     *
     * @throws com.vidnyan.smelldsl.domain.error.SmellDslException on lexical,
     *         syntax or semantic errors
     */
    public ParsedProgram run(String source, RunLog runLog) {
        List<Token> tokens = lexer.tokenize(source);

        ParsedProgram program = new Parser(tokens).parse();
        runLog.success("Syntax analysis completed successfully!");

        runLog.info("Starting semantic analysis...");
        semanticAnalyzer.analyze(program);
        runLog.success("Semantic analysis completed successfully!");

        log.debug("Interpreted program:\n{}", program.describe());
        return program;
    }
}
