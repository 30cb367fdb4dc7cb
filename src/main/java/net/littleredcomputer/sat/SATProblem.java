package net.littleredcomputer.sat;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import gnu.trove.list.array.TIntArrayList;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.stream.Collectors.toList;

/**
 * A formula in conjunctive normal form over the variables [1, nVariables()]. Clauses may be
 * appended but never changed once added. Duplicate literals within a clause are removed, and
 * a clause containing a literal together with its complement is dropped (and counted) rather
 * than stored, so {@link #nClauses()} reports only the clauses the solvers will see.
 */
public class SATProblem {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.onPattern("\\s+").trimResults().omitEmptyStrings();
    private final int nVariables;
    private final List<ImmutableList<Integer>> clauses = new ArrayList<>();
    private int nLiterals = 0;
    private int width = 0;
    private int tautologies = 0;

    public SATProblem(int nVariables) {
        if (nVariables < 0) throw new IllegalArgumentException("Variable count must not be negative");
        this.nVariables = nVariables;
    }

    public int nClauses() {
        return clauses.size();
    }

    public int nVariables() {
        return nVariables;
    }

    public int nLiterals() {
        return nLiterals;
    }

    /** @return the length of the longest clause */
    public int width() {
        return width;
    }

    public int tautologiesDropped() {
        return tautologies;
    }


    /**
     * @return a private copy of the encoded clauses, which a solver may permute freely
     */
    int[][] clauseArrays() {
        int[][] a = new int[clauses.size()][];
        for (int i = 0; i < a.length; ++i) a[i] = Ints.toArray(clauses.get(i));
        return a;
    }

    /** @return the i-th clause with its literals in signed (DIMACS) form */
    public List<Integer> getClause(int i) {
        return clauses.get(i).stream().map(Literals::decode).collect(toList());
    }

    /**
     * Append a clause. Literals are given in signed form and must lie within the declared
     * variable range.
     *
     * @param literals nonzero signed variable numbers
     * @return false if the clause was a tautology, and so was not added
     */
    public boolean addClause(Iterable<Integer> literals) {
        Set<Integer> clause = new LinkedHashSet<>();
        boolean tautology = false;
        for (int l : literals) {
            if (l == 0) throw new IllegalArgumentException("0 is not a literal");
            if (l > nVariables || l < -nVariables) throw new IllegalArgumentException("literal out of declared bounds: " + l);
            int e = Literals.encode(l);
            if (clause.contains(Literals.not(e))) tautology = true;
            clause.add(e);
        }
        if (tautology) {
            ++tautologies;
            return false;
        }
        ImmutableList<Integer> c = ImmutableList.copyOf(clause);
        clauses.add(c);
        nLiterals += c.size();
        if (c.size() > width) width = c.size();
        return true;
    }

    public boolean addClause(int... literals) {
        return addClause(Ints.asList(literals));
    }

    /**
     * Evaluate the boolean function represented by the problem's clauses at the specified point
     * @param p point (i.e., vector of booleans, indexed by variable number less one) at which to evaluate
     * @return the truth value of this problem at p
     */
    public boolean evaluate(boolean[] p) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[(literal >> 1) - 1] == ((literal & 1) == 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;  // No clause was falsified by any literal.
    }

    public static SATProblem parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a problem in DIMACS cnf format. Comment lines are skipped, and a line consisting of
     * "%" (as found at the end of the SATLIB benchmark files) ends the input.
     */
    public static SATProblem parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines()
                .map(String::trim)
                .filter(s -> !s.isEmpty() && !s.startsWith("c"))
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        SATProblem p = new SATProblem(nVar);
        int clausesRead = 0;
        while (ls.hasNext()) {
            String line = ls.next();
            if (line.equals("%")) break;
            // A lone 0 between clauses (SATLIB files end with one) is not an empty clause.
            if (line.equals("0") && literals.isEmpty()) continue;
            for (String token : splitter.split(line)) {
                int l;
                try {
                    l = Integer.parseInt(token);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("invalid literal: " + token, e);
                }
                if (l == 0) {
                    if (literals.isEmpty())
                        throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                    p.addClause(literals);
                    literals.clear();
                    ++clausesRead;
                } else {
                    if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                    literals.add(l);
                }
            }
        }
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (clausesRead != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return p;
    }

    public void printDimacs(PrintStream p, String title) {
        if (title != null) p.println("c " + title);
        p.printf("p cnf %d %d\n", nVariables, nClauses());
        for (int i = 0; i < nClauses(); ++i) {
            for (int l : getClause(i)) p.printf("%d ", l);
            p.println("0");
        }
    }

    /**
     * Generate a random k-SAT instance: each clause mentions k distinct variables, each
     * negated with probability 1/2. The same arguments always produce the same instance.
     *
     * @param k    size of each clause
     * @param m    number of clauses
     * @param n    number of variables
     * @param seed for random number generator
     * @return random SAT instance
     */
    public static SATProblem randomInstance(int k, int m, int n, long seed) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        if (m <= 0) throw new IllegalArgumentException("m must be positive!");
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        if (k > n) throw new IllegalArgumentException("k mustn't exceed n!");
        final Random R = new Random(seed);
        SATProblem p = new SATProblem(n);
        int[] vars = new int[n];
        for (int j = 0; j < m; j++) {
            for (int i = 0; i < n; ++i) vars[i] = i + 1;
            int[] clause = new int[k];
            // Partial Fisher-Yates: the first k slots receive a uniform k-subset.
            for (int i = 0; i < k; ++i) {
                int t = i + R.nextInt(n - i);
                int v = vars[t];
                vars[t] = vars[i];
                vars[i] = v;
                clause[i] = R.nextBoolean() ? v : -v;
            }
            p.addClause(clause);
        }
        return p;
    }

    /**
     * The pigeonhole principle: each pigeon must sit in some hole, and no hole holds two
     * pigeons. Unsatisfiable whenever there are more pigeons than holes. Variable
     * i*holes+j+1 means "pigeon i sits in hole j".
     */
    public static SATProblem pigeonhole(int pigeons, int holes) {
        if (pigeons < 1 || holes < 1) throw new IllegalArgumentException("need at least one pigeon and one hole");
        SATProblem p = new SATProblem(pigeons * holes);
        for (int i = 0; i < pigeons; ++i) {
            int[] somewhere = new int[holes];
            for (int j = 0; j < holes; ++j) somewhere[j] = i * holes + j + 1;
            p.addClause(somewhere);
        }
        for (int j = 0; j < holes; ++j) {
            for (int i = 0; i < pigeons; ++i) {
                for (int ii = i + 1; ii < pigeons; ++ii) {
                    p.addClause(-(i * holes + j + 1), -(ii * holes + j + 1));
                }
            }
        }
        return p;
    }

    /**
     * Generate the SAT problem waerden(j, k; n), defined by 7.2.2.2 (10) of TAOCP
     *
     * @param j Number of consecutive 0s to require
     * @param k Number of consecutive 1s to require
     * @param n Length of binary string
     * @return the problem, satisfiable iff n &lt; W(j, k)
     */
    public static SATProblem waerden(int j, int k, int n) {
        SATProblem p = new SATProblem(n);
        // No j equally-spaced 0's in a string of length n
        addProgressions(p, j, n, 1);
        // No k equally-spaced 1's
        addProgressions(p, k, n, -1);
        return p;
    }

    private static void addProgressions(SATProblem p, int length, int n, int sign) {
        boolean addedSome = true;
        for (int d = 1; addedSome; ++d) {
            addedSome = false;
            for (int i = 1; i + (length - 1) * d <= n; ++i) {
                int[] clause = new int[length];
                for (int h = 0; h < length; ++h) clause[h] = sign * (i + d * h);
                p.addClause(clause);
                addedSome = true;
            }
        }
    }

    /**
     * Langford's problem of order n, posed as an exact cover problem and then as SAT (see
     * 7.2.2.2 (11) of TAOCP). Each variable selects one placement of a digit; the problem is
     * satisfiable iff n mod 4 is 0 or 3, in which case exactly n variables are true.
     */
    public static SATProblem langford(int n) {
        // The first n columns (or items) represent the digits; the next 2n columns represent the
        // placement of that digit (two of these per row).
        List<TIntArrayList> columns = new ArrayList<>(3 * n);
        for (int i = 0; i < 3 * n; ++i) columns.add(new TIntArrayList());
        int row = 0;
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j + i + 2 < 2 * n; ++j) {
                ++row;
                columns.get(i).add(row);
                columns.get(n + j).add(row);
                columns.get(n + j + i + 2).add(row);
            }
        }
        SATProblem p = new SATProblem(row);
        for (TIntArrayList c : columns) {
            // Exactly one of the rows in this column: one clause requiring one, and
            // clauses forbidding any two.
            p.addClause(c.toArray());
            for (int a = 0; a < c.size(); ++a) {
                for (int b = a + 1; b < c.size(); ++b) {
                    p.addClause(-c.get(a), -c.get(b));
                }
            }
        }
        return p;
    }

    @Override
    public String toString() {
        return clauses.stream()
                .map(c -> c.stream().map(Literals::toString).collect(toList()).toString())
                .collect(toList())
                .toString();
    }
}
