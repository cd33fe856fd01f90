package org.stockflow.compiler.frontend.lexer;

import org.stockflow.compiler.diagnostics.IllegalNameException;
import org.stockflow.compiler.diagnostics.InvalidParametersException;
import org.stockflow.compiler.diagnostics.LineParseException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the line scanner and the stock and flow classifiers.
 */
@Tag("unit")
public class LexerTest {

    @Test
    void scansSimpleFlowLine() {
        SourceLines lines = Lexer.lex("a > b @ 5");

        assertThat(lines.lines()).hasSize(1);
        Line line = lines.lines().get(0);
        assertThat(line.number()).isEqualTo(1);
        assertThat(line.tokens()).hasSize(5);
        assertThat(line.tokens().get(0)).isEqualTo(new StockToken("a", Parameters.NONE, false));
        assertThat(line.tokens().get(1)).isInstanceOf(FlowDirectionToken.class);
        assertThat(line.tokens().get(2)).isEqualTo(new StockToken("b", Parameters.NONE, false));
        assertThat(line.tokens().get(3)).isInstanceOf(FlowDelimiterToken.class);

        FlowToken flow = (FlowToken) line.tokens().get(4);
        assertThat(flow.isLabeled()).isFalse();
        assertThat(flow.parameters().size()).isEqualTo(1);
        assertThat(flow.parameters().get(0).terms()).containsExactly(new ValueTerm(ValueKind.WHOLE, "5"));
    }

    @Test
    void skipsBlankLinesButKeepsLineNumbers() {
        SourceLines lines = Lexer.lex("\na > b @ 1\n\n   \nb > c @ 2\n");

        assertThat(lines.lines()).extracting(Line::number).containsExactly(2, 5);
    }

    @Test
    void scansInfiniteStockAndStockParameters() {
        Line line = Lexer.lex("[Candidates] > Employees(5, 10) @ 1").lines().get(0);

        StockToken source = (StockToken) line.tokens().get(0);
        assertThat(source.infinite()).isTrue();
        assertThat(source.name()).isEqualTo("Candidates");

        StockToken destination = (StockToken) line.tokens().get(2);
        assertThat(destination.infinite()).isFalse();
        assertThat(destination.parameters().size()).isEqualTo(2);
        assertThat(destination.parameters().get(0).terms()).containsExactly(new ValueTerm(ValueKind.WHOLE, "5"));
        assertThat(destination.parameters().get(1).terms()).containsExactly(new ValueTerm(ValueKind.WHOLE, "10"));
    }

    @Test
    void lineStartingWithHashIsAComment() {
        Line line = Lexer.lex("# a > b @ 5").lines().get(0);

        assertThat(line.tokens()).hasSize(1);
        assertThat(line.tokens().get(0)).isEqualTo(new CommentToken(" a > b @ 5"));
    }

    @Test
    void inlineCommentAfterFlowEndsTheFlow() {
        Line line = Lexer.lex("a > b @ Leak(0.2) # quits").lines().get(0);

        assertThat(line.tokens()).hasSize(6);
        FlowToken flow = (FlowToken) line.tokens().get(4);
        assertThat(flow.label()).isEqualTo("Leak");
        assertThat(line.tokens().get(5)).isEqualTo(new CommentToken(" quits"));
    }

    @Test
    void inlineCommentWithoutPrecedingSpace() {
        Line line = Lexer.lex("a > b @ 3#note").lines().get(0);

        assertThat(line.tokens()).hasSize(6);
        assertThat(((FlowToken) line.tokens().get(4)).parameters().get(0).terms())
                .containsExactly(new ValueTerm(ValueKind.WHOLE, "3"));
        assertThat(line.tokens().get(5)).isEqualTo(new CommentToken("note"));
    }

    @Test
    void commentAfterStockDeclaration() {
        Line line = Lexer.lex("Employees(5) # headcount").lines().get(0);

        assertThat(line.tokens()).hasSize(2);
        assertThat(line.tokens().get(0)).isInstanceOf(StockToken.class);
        assertThat(line.tokens().get(1)).isInstanceOf(CommentToken.class);
    }

    @Test
    void lexFlowRecognizesLabeledFlows() {
        FlowToken flow = Lexer.lexFlow("Conversion(0.5)");

        assertThat(flow.label()).isEqualTo("Conversion");
        assertThat(flow.parameters().get(0).isSingleDecimal()).isTrue();
    }

    @Test
    void lexFlowTreatsFormulaAsSingleUnlabeledParameter() {
        FlowToken flow = Lexer.lexFlow("Recruiters*3");

        assertThat(flow.isLabeled()).isFalse();
        assertThat(flow.parameters().size()).isEqualTo(1);
        assertThat(flow.parameters().get(0).terms()).containsExactly(
                new ValueTerm(ValueKind.REFERENCE, "Recruiters"),
                new OperatorTerm(Operator.MULTIPLY),
                new ValueTerm(ValueKind.WHOLE, "3"));
    }

    @Test
    void lexFlowKeepsUnknownLabelsForTheParser() {
        FlowToken flow = Lexer.lexFlow("Fake(5)");

        assertThat(flow.label()).isEqualTo("Fake");
    }

    @Test
    void lexStockRejectsIllegalNames() {
        assertThatThrownBy(() -> Lexer.lexStock("1abc"))
                .isInstanceOf(IllegalNameException.class)
                .hasMessageContaining("1abc");
        assertThatThrownBy(() -> Lexer.lexStock("[not a name]"))
                .isInstanceOf(IllegalNameException.class);
    }

    @Test
    void lexStockRejectsTrailingGarbage() {
        assertThatThrownBy(() -> Lexer.lexStock("abc(5)x"))
                .isInstanceOf(IllegalNameException.class);
    }

    @Test
    void illegalNameIsReportedWithLine() {
        assertThatThrownBy(() -> Lexer.lex("a > b @ 1\n2b > c @ 1"))
                .isInstanceOf(LineParseException.class)
                .hasMessageContaining("line 2")
                .hasMessageContaining("2b > c @ 1");
    }

    @Test
    void unbalancedParametersAreReportedWithLine() {
        assertThatThrownBy(() -> Lexer.lex("a > b @ Rate((5)"))
                .isInstanceOf(InvalidParametersException.class)
                .satisfies(e -> assertThat(((InvalidParametersException) e).getLineNumber()).isEqualTo(1))
                .hasMessageContaining("line 1");
    }

    @Test
    void scansMultipleLines() {
        SourceLines lines = Lexer.lex(String.join("\n", List.of(
                "[Candidates] > PhoneScreens @ 25",
                "PhoneScreens > Onsites @ 0.5",
                "Employees > Departures @ Leak(0.1)")));

        assertThat(lines.lines()).hasSize(3);
        assertThat(((FlowToken) lines.lines().get(1).tokens().get(4)).parameters().get(0).isSingleDecimal()).isTrue();
    }
}
