package org.stockflow.runtime.model;

import org.stockflow.compiler.diagnostics.InvalidFormulaException;
import org.stockflow.compiler.frontend.lexer.FormulaToken;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class FormulaTest {

    @Test
    void evaluatesLeftToRightWithoutPrecedence() {
        assertThat(new Formula("10 + 5 * 2").compute()).isEqualTo(30.0);
        assertThat(new Formula("2 * 3 + 4 / 2").compute()).isEqualTo(5.0);
    }

    @Test
    void evaluatesParenthesizedGroups() {
        assertThat(new Formula("10 + (5 * 2)").compute()).isEqualTo(20.0);
        assertThat(new Formula("((1 + 1) * (2 + 2))").compute()).isEqualTo(8.0);
    }

    @Test
    void resolvesReferencesFromEnvironment() {
        Formula formula = new Formula("Recruiters * 3");

        assertThat(formula.compute(Map.of("Recruiters", 7.0))).isEqualTo(21.0);
    }

    @Test
    void unresolvedReferenceEvaluatesToNaN() {
        assertThat(new Formula("missing + 1").compute(Map.of())).isNaN();
    }

    @Test
    void followsDoubleArithmetic() {
        assertThat(new Formula("1 / 0").compute()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(new Formula("inf - 5").compute()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(new Formula("0.5 + 0.25").compute()).isEqualTo(0.75);
    }

    @Test
    void emptyFormulaIsRejected() {
        assertThatThrownBy(() -> new Formula(""))
                .isInstanceOf(InvalidFormulaException.class)
                .hasMessageContaining("formula is empty");
    }

    @Test
    void misplacedOperatorsAreRejected() {
        assertThatThrownBy(() -> new Formula("* 2"))
                .hasMessageContaining("can't start with an operation");
        assertThatThrownBy(() -> new Formula("2 * / 3"))
                .hasMessageContaining("operation can't be preceded by an operation");
        assertThatThrownBy(() -> new Formula("2 3"))
                .hasMessageContaining("must have an operation between values or references");
        assertThatThrownBy(() -> new Formula("2 +"))
                .isInstanceOf(InvalidFormulaException.class)
                .hasMessageContaining("formula cannot end with an operation");
    }

    @Test
    void malformedGroupIsRejectedWhenEvaluated() {
        Formula formula = new Formula("1 + (2 *)");

        assertThatThrownBy(formula::compute).isInstanceOf(InvalidFormulaException.class);
    }

    @Test
    void validatesTokensPassedDirectly() {
        assertThatThrownBy(() -> new Formula(new FormulaToken(List.of()), 3))
                .isInstanceOf(InvalidFormulaException.class);
    }

    @Test
    void listsReferencesIncludingNestedOnes() {
        Formula formula = new Formula("a + (b * a) - 2");

        assertThat(formula.references()).containsExactly("a", "b", "a");
    }

    @Test
    void createsFormulasFromNumbers() {
        assertThat(Formula.of(Double.POSITIVE_INFINITY).expression()).isEqualTo("inf");
        assertThat(Formula.of(5).expression()).isEqualTo("5");
        assertThat(Formula.of(0.5).compute()).isEqualTo(0.5);
    }

    @Test
    void createsFormulasFromTinyHugeAndNegativeNumbers() {
        assertThat(Formula.of(1e-7).references()).isEmpty();
        assertThat(Formula.of(1e-7).compute()).isEqualTo(1e-7);
        assertThat(Formula.of(1e20).compute()).isEqualTo(1e20);
        assertThat(Formula.of(-3).compute()).isEqualTo(-3.0);
        assertThat(Formula.of(-0.5).compute()).isEqualTo(-0.5);
        assertThatThrownBy(() -> Formula.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void wholeNumbersBeyondLongRangeEvaluate() {
        assertThat(new Formula("99999999999999999999").compute()).isEqualTo(1e20);
        assertThat(new Formula("99999999999999999999 - 1").compute()).isEqualTo(1e20);
    }

    @Test
    void equalityFollowsLexedTokens() {
        assertThat(new Formula("a+1")).isEqualTo(new Formula("a + 1"));
        assertThat(new Formula("a + 1")).isNotEqualTo(new Formula("a + 2"));
        assertThat(new Formula("a + 1")).hasToString("F(a + 1)");
    }
}
