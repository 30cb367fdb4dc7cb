package net.littleredcomputer.sat;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class SATProblemTest {

    @Test
    public void simple() {
        SATProblem p = SATProblem.parseFrom(new StringReader("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0"));
        assertThat(p.nVariables(), is(3));
        assertThat(p.nClauses(), is(2));
        assertThat(p.nLiterals(), is(5));
        assertThat(p.width(), is(3));
        assertThat(p.getClause(1), contains(2, 3, -1));
    }

    @Test
    public void clausesMaySpanLines() {
        SATProblem p = SATProblem.parseFrom("p cnf 3 2\n1\n-3 0 2\n3 -1 0\n");
        assertThat(p.getClause(0), contains(1, -3));
        assertThat(p.getClause(1), contains(2, 3, -1));
    }

    @Test
    public void percentEndsInput() {
        SATProblem p = SATProblem.parseFrom("c satlib style\np cnf  3  2 \n 1 -3 0\n 2 3 -1 0\n%\n0\n\n");
        assertThat(p.nClauses(), is(2));
    }

    @Test
    public void satlibFixture() {
        SATProblem p = SATTestBase.uf20;
        assertThat(p.nVariables(), is(20));
        assertThat(p.nClauses(), is(91));
        assertThat(p.width(), is(3));
    }

    @Test
    public void loneZeroLineIsSkipped() {
        SATProblem p = SATProblem.parseFrom("p cnf 2 1\n1 2 0\n0\n");
        assertThat(p.nClauses(), is(1));
        assertThat(p.getClause(0), contains(1, 2));
    }

    @Test
    public void zeroLineMayEndASplitClause() {
        SATProblem p = SATProblem.parseFrom("p cnf 2 1\n1 2\n0\n");
        assertThat(p.getClause(0), contains(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyClauseThrows() {
        SATProblem.parseFrom(new StringReader("c empty clause\np cnf 3 3\n1 2 3 0 0 1 2 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void literalOutOfBounds() {
        SATProblem.parseFrom(new StringReader("c oob literal\np cnf 3 2\n1 2 3 0\n2 3 4 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooManyClauses() {
        SATProblem.parseFrom(new StringReader("c oob clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooFewClauses() {
        SATProblem.parseFrom("p cnf 3 3\n1 2 3 0\n2 3 -1 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void danglingClause() {
        SATProblem.parseFrom(new StringReader("c unclosed clause\np cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingHeader() {
        SATProblem.parseFrom("1 2 0\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void noData() {
        SATProblem.parseFrom("c nothing here\n");
    }

    @Test(expected = IllegalArgumentException.class)
    public void notANumber() {
        SATProblem.parseFrom("p cnf 2 1\n1 x 0\n");
    }

    @Test
    public void duplicateLiteralsAreMerged() {
        SATProblem p = new SATProblem(3);
        p.addClause(1, 2, 1, 2, 3);
        assertThat(p.getClause(0), contains(1, 2, 3));
        assertThat(p.nLiterals(), is(3));
    }

    @Test
    public void tautologiesAreDropped() {
        SATProblem p = new SATProblem(3);
        assertThat(p.addClause(1, -2, 2), is(false));
        assertThat(p.addClause(1, 2), is(true));
        assertThat(p.nClauses(), is(1));
        assertThat(p.tautologiesDropped(), is(1));
    }

    @Test
    public void tautologiesCountTowardTheHeader() {
        SATProblem p = SATProblem.parseFrom("p cnf 2 2\n1 -1 0\n1 2 0\n");
        assertThat(p.nClauses(), is(1));
        assertThat(p.tautologiesDropped(), is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void addClauseRejectsZero() {
        new SATProblem(2).addClause(1, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void addClauseRejectsOutOfRange() {
        new SATProblem(2).addClause(-3);
    }

    @Test
    public void evaluate() {
        SATProblem p = SATProblem.parseFrom("p cnf 2 2\n1 2 0\n-1 0\n");
        assertThat(p.evaluate(new boolean[]{false, true}), is(true));
        assertThat(p.evaluate(new boolean[]{true, true}), is(false));
        assertThat(p.evaluate(new boolean[]{false, false}), is(false));
    }

    @Test
    public void printedDimacsReadsBack() {
        SATProblem p = SATProblem.waerden(3, 3, 8);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        p.printDimacs(new PrintStream(bytes, true), "waerden 3 3 8");
        String text = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        assertThat(text.startsWith("c waerden 3 3 8\np cnf 8 24\n"), is(true));
        SATProblem q = SATProblem.parseFrom(text);
        assertThat(q.toString(), is(p.toString()));
    }

    @Test
    public void randomInstancesAreReproducible() {
        SATProblem a = SATProblem.randomInstance(3, 20, 8, 42);
        SATProblem b = SATProblem.randomInstance(3, 20, 8, 42);
        assertThat(a.toString(), is(b.toString()));
        assertThat(a.nClauses() + a.tautologiesDropped(), is(20));
        for (int i = 0; i < a.nClauses(); ++i) {
            // k distinct variables per clause
            assertThat(a.getClause(i).stream().map(Math::abs).distinct().count(), is(3L));
        }
    }

    @Test
    public void pigeonholeShape() {
        SATProblem p = SATProblem.pigeonhole(3, 2);
        assertThat(p.nVariables(), is(6));
        // 3 "somewhere" clauses and 3 exclusions in each of 2 holes
        assertThat(p.nClauses(), is(9));
        assertThat(p.getClause(0), contains(1, 2));
    }

    @Test
    public void waerdenShape() {
        // Progressions of length 3 in [1..9]: d=1 gives 7, d=2 gives 5, d=3 gives 3, d=4 gives 1.
        SATProblem p = SATProblem.waerden(3, 3, 9);
        assertThat(p.nClauses(), is(32));
        assertThat(p.getClause(0), contains(1, 2, 3));
        assertThat(p.getClause(16), contains(-1, -2, -3));
    }

    @Test
    public void langfordShape() {
        SATProblem p = SATProblem.langford(3);
        // Digit 1 (i=0) has 4 placements, digit 2 has 3, digit 3 has 2.
        assertThat(p.nVariables(), is(9));
        assertThat(p.getClause(0), contains(1, 2, 3, 4));
    }
}
