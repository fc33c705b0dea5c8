package com.e2eq.cnl.parser;

import com.e2eq.cnl.grammar.CnlNotationBaseListener;
import com.e2eq.cnl.grammar.CnlNotationParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;

import java.util.Optional;

/**
 * Turns a parse tree of one notation line into a {@link Statement}.
 */
class StatementBuildingListener extends CnlNotationBaseListener {

    private Statement statement;

    Statement getStatement() {
        return statement;
    }

    @Override
    public void exitRelationStatement(CnlNotationParser.RelationStatementContext ctx) {
        statement = new RelationStatement(
                ctx.adverb() == null ? Optional.empty() : Optional.of(strip(ctx.adverb().getText(), 2)),
                strip(ctx.RELATION_NAME().getText(), 1),
                ctx.quantifier() == null ? Optional.empty() : Optional.of(strip(ctx.quantifier().getText(), 1)),
                ctx.qualifier() == null ? Optional.empty() : Optional.of(strip(ctx.qualifier().getText(), 2)),
                originalText(ctx.target()),
                ctx.modality() == null ? Optional.empty() : Optional.of(strip(ctx.modality().getText(), 1)));
    }

    @Override
    public void exitAttributeStatement(CnlNotationParser.AttributeStatementContext ctx) {
        statement = new AttributeStatement(
                originalText(ctx.attributeName()),
                ctx.adverb() == null ? Optional.empty() : Optional.of(strip(ctx.adverb().getText(), 2)),
                originalText(ctx.value()),
                ctx.unit() == null ? Optional.empty() : Optional.of(strip(ctx.unit().getText(), 1)),
                ctx.modality() == null ? Optional.empty() : Optional.of(strip(ctx.modality().getText(), 1)));
    }

    // delimiters are symmetric: '++x++', '**x**', '*x*', '<x>', '[x]'
    private static String strip(String token, int width) {
        return token.substring(width, token.length() - width);
    }

    // multi-token rules read the source span so that text such as "12:30" keeps its spacing
    private static String originalText(ParserRuleContext ctx) {
        int start = ctx.getStart().getStartIndex();
        int stop = ctx.getStop().getStopIndex();
        return ctx.getStart().getInputStream().getText(Interval.of(start, stop));
    }
}
