package net.littleredcomputer.sat.formula;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.junit.Test;

import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class FormulaParserTest {
    private static void assertSameParse(String a, String b) {
        assertThat(Formula.parse(a), is(Formula.parse(b)));
    }

    private static FormulaSyntaxException syntaxError(String text) {
        try {
            Formula.parse(text);
        } catch (FormulaSyntaxException e) {
            return e;
        }
        fail("parsed " + text);
        return null;
    }

    @Test
    public void symbolicAndTextualAgree() {
        assertSameParse("not p and (q or r)", "¬p ∧ (q ∨ r)");
        assertSameParse("p -> q <-> r", "p → q ↔ r");
    }

    private static String chain(int n, String connective) {
        return Joiner.on(connective).join(IntStream.range(0, n).mapToObj(i -> "x" + i).iterator());
    }

    @Test(timeout = 2000)
    public void longConjunctionIsOneNode() {
        Formula f = Formula.parse(chain(10000, " ∧ "));
        assertThat(f.kind(f.root()), is(Formula.Kind.AND));
        assertThat(f.children(f.root()).length, is(10000));
        assertThat(f.size(), is(10001));
    }

    @Test(timeout = 2000)
    public void longDisjunctionIsOneNode() {
        Formula f = Formula.parse(chain(10000, " or "));
        assertThat(f.kind(f.root()), is(Formula.Kind.OR));
        assertThat(f.children(f.root()).length, is(10000));
    }

    @Test
    public void runsOfOneConnectiveRespectPrecedence() {
        assertSameParse("p ∧ q ∧ r ∨ s", "(p ∧ q ∧ r) ∨ s");
        assertSameParse("p ∨ q ∧ r ∨ s", "p ∨ (q ∧ r) ∨ s");
        assertSameParse("p ∧ q ∧ r → s ∨ t ∨ u", "(p ∧ (q ∧ r)) → ((s ∨ t) ∨ u)");
        assertSameParse("¬p ∧ ¬q ∧ (r ∨ s)", "(¬p ∧ ¬q) ∧ (r ∨ s)");
    }

    @Test
    public void precedence() {
        assertSameParse("p ∨ q ∧ r", "p ∨ (q ∧ r)");
        assertSameParse("¬p ∧ q", "(¬p) ∧ q");
        assertSameParse("p ∨ q → r", "(p ∨ q) → r");
        assertSameParse("p → q ↔ r", "(p → q) ↔ r");
        assertSameParse("¬p ↔ q ∧ r → s", "(¬p) ↔ ((q ∧ r) → s)");
    }

    @Test
    public void associativity() {
        assertSameParse("p → q → r", "p → (q → r)");
        assertSameParse("p ↔ q ↔ r", "(p ↔ q) ↔ r");
        assertThat(Formula.parse("p ↔ q ↔ r").toString(), is("(p ↔ q) ↔ r"));
        // Conjunction and disjunction are flattened, so grouping does not matter.
        assertSameParse("(p ∧ q) ∧ r", "p ∧ (q ∧ r)");
    }

    @Test
    public void spacingAndIdentifiers() {
        assertSameParse("p∧q", "  p ∧ q  ");
        Formula f = Formula.parse("x_1 and Y2");
        assertThat(f.variables().size(), is(2));
        assertThat(f.variableName(1), is("x_1"));
        assertThat(f.variableName(2), is("Y2"));
        // Keywords must stand alone: these are atoms.
        assertThat(Formula.parse("nota ∧ order").variables().size(), is(2));
    }

    @Test
    public void atomsShareVariables() {
        Formula f = Formula.parse("p ∧ q ∨ ¬p");
        assertThat(f.nVariables(), is(2));
        assertThat(f.variableNumber("p"), is(1));
        assertThat(f.variableNumber("z"), is(0));
    }

    @Test
    public void roundTrip() {
        for (String s : new String[]{"¬p ∧ (q ∨ r)", "p → (q → r)", "¬(p ↔ ¬q)", "(p ∨ q) ∧ (r ∨ s) ∧ ¬¬t"}) {
            Formula f = Formula.parse(s);
            assertThat(f.toString(), is(s));
            assertThat(Formula.parse(f.toString()), is(f));
        }
    }

    @Test
    public void deepNesting() {
        int depth = 20000;
        Formula f = Formula.parse(Strings.repeat("¬", depth) + "p");
        assertThat(f.size(), is(depth + 1));
        assertThat(f.toNNF(), is(Formula.parse("p")));
        Formula g = Formula.parse(Strings.repeat("(", depth) + "p" + Strings.repeat(")", depth));
        assertThat(g, is(Formula.parse("p")));
        Formula h = Formula.parse(Strings.repeat("p → (", depth) + "q" + Strings.repeat(")", depth));
        assertThat(h.size(), is(depth + 2));
    }

    @Test
    public void emptyFormula() {
        assertThat(syntaxError("").getMessage(), containsString("empty"));
        assertThat(syntaxError("   ").position(), is(0));
    }

    @Test
    public void unknownCharacter() {
        FormulaSyntaxException e = syntaxError("p & q");
        assertThat(e.position(), is(2));
        assertThat(e.getMessage(), containsString("'&'"));
        assertThat(syntaxError("p1 ∧ 2q").position(), is(5));
    }

    @Test
    public void unbalancedParentheses() {
        assertThat(syntaxError("(p ∧ q").position(), is(0));
        assertThat(syntaxError("p ∧ q)").position(), is(5));
        assertThat(syntaxError("((p)").getMessage(), containsString("unbalanced '('"));
        assertThat(syntaxError("()").position(), is(1));
    }

    @Test
    public void misplacedTokens() {
        assertThat(syntaxError("p q").position(), is(2));
        assertThat(syntaxError("∧ p").position(), is(0));
        assertThat(syntaxError("p ∧").position(), is(3));
        assertThat(syntaxError("p ¬ q").position(), is(2));
        assertThat(syntaxError("not").position(), is(3));
        assertThat(syntaxError("p (q)").position(), is(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void syntaxErrorsAreIllegalArguments() {
        Formula.parse("p ∨ ∨ q");
    }
}
