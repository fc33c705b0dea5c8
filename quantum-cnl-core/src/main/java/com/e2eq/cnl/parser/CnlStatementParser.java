package com.e2eq.cnl.parser;

import com.e2eq.cnl.grammar.CnlNotationLexer;
import com.e2eq.cnl.grammar.CnlNotationParser;
import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses single notation lines. Never throws on bad input: a line that matches neither
 * statement form comes back as a {@link ParsedLine} carrying a {@link ParseError}.
 */
public class CnlStatementParser {
    private static final Logger LOG = Logger.getLogger(CnlStatementParser.class.getName());

    public ParsedLine parseLine(int lineNumber, String raw) {
        String line = raw == null ? "" : raw.trim();
        if (line.isEmpty()) {
            return ParsedLine.failed(lineNumber, raw, "empty statement");
        }
        try {
            return ParsedLine.ok(lineNumber, raw, parse(line));
        } catch (IllegalArgumentException e) {
            LOG.log(Level.FINE, "Line {0} rejected: {1}", new Object[]{lineNumber, e.getMessage()});
            return ParsedLine.failed(lineNumber, raw, e.getMessage());
        }
    }

    /**
     * Parses one well-formed line.
     *
     * @throws IllegalArgumentException when the line matches neither statement form
     */
    public Statement parse(String line) {
        CnlNotationLexer lexer = new CnlNotationLexer(CharStreams.fromString(line));
        lexer.removeErrorListeners();
        lexer.addErrorListener(failFast(line));
        CnlNotationParser parser = new CnlNotationParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(failFast(line));

        ParseTree tree = parser.statement();
        StatementBuildingListener listener = new StatementBuildingListener();
        new ParseTreeWalker().walk(listener, tree);
        if (listener.getStatement() == null) {
            throw new IllegalArgumentException("Failed to parse " + line + ": not a relation or attribute statement");
        }
        return listener.getStatement();
    }

    private static BaseErrorListener failFast(String line) {
        return new BaseErrorListener() {
            @Override
            public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int lineNo,
                                    int charPositionInLine, String msg, RecognitionException e) {
                throw new IllegalArgumentException("Failed to parse " + line + " at position "
                        + charPositionInLine + " due to " + msg, e);
            }
        };
    }
}
