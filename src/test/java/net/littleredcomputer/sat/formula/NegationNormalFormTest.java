package net.littleredcomputer.sat.formula;

import org.junit.Test;

import java.util.Random;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class NegationNormalFormTest {
    private static String nnf(String text) {
        return Formula.parse(text).toNNF().toString();
    }

    @Test
    public void deMorgan() {
        assertThat(nnf("¬(p ∧ q)"), is("¬p ∨ ¬q"));
        assertThat(nnf("¬(p ∨ q)"), is("¬p ∧ ¬q"));
        assertThat(nnf("¬(p ∧ (q ∨ ¬r))"), is("¬p ∨ (¬q ∧ r)"));
    }

    @Test
    public void doubleNegation() {
        assertThat(nnf("¬¬p"), is("p"));
        assertThat(nnf("¬¬¬p"), is("¬p"));
    }

    @Test
    public void implication() {
        assertThat(nnf("p → q"), is("¬p ∨ q"));
        assertThat(nnf("¬(p → q)"), is("p ∧ ¬q"));
    }

    @Test
    public void biconditional() {
        assertThat(nnf("p ↔ q"), is("(¬p ∨ q) ∧ (¬q ∨ p)"));
        assertThat(nnf("¬(p ↔ q)"), is("(p ∧ ¬q) ∨ (q ∧ ¬p)"));
    }

    @Test
    public void flattensWhatNegationExposes() {
        // The negated conjunction becomes a disjunction absorbed by its parent.
        assertThat(nnf("p ∨ ¬(q ∧ r)"), is("p ∨ ¬q ∨ ¬r"));
    }

    @Test
    public void keepsVariableNumbering() {
        Formula f = Formula.parse("¬(b → a) ∨ c");
        Formula g = f.toNNF();
        assertThat(g.variables(), is(f.variables()));
    }

    @Test
    public void randomFormulas() {
        Random r = new Random(1);
        for (int t = 0; t < 300; ++t) {
            Formula f = RandomFormulas.random(r, 5, 1 + r.nextInt(12));
            Formula g = f.toNNF();
            assertTrue(f + " → " + g, g.isNNF());
            for (int i = 0; i < g.size(); ++i) assertThat(g.kind(i) == Formula.Kind.NOT, is(false));
            assertTrue(f + " ≢ " + g, RandomFormulas.equivalent(f, g));
            assertThat(g.toNNF(), is(g));
        }
    }
}
