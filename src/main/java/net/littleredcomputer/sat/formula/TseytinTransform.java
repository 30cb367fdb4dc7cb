package net.littleredcomputer.sat.formula;

import net.littleredcomputer.sat.SATProblem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static com.google.common.base.Preconditions.checkState;

/**
 * Encodes a formula in negation normal form as an equisatisfiable set of clauses. The atoms
 * keep their variable numbers; every conjunction and disjunction node gets a fresh auxiliary
 * variable numbered after them, defined to be equivalent to the node:
 * <pre>
 *   a ↔ (c1 ∧ ... ∧ ck):  (¬a ∨ cj) for each j, and (a ∨ ¬c1 ∨ ... ∨ ¬ck)
 *   a ↔ (c1 ∨ ... ∨ ck):  (¬a ∨ c1 ∨ ... ∨ ck), and (a ∨ ¬cj) for each j
 * </pre>
 * and the literal standing for the root is asserted by a unit clause. Since the arena shares
 * identical subformulas, each is encoded once. A formula that is a single literal becomes
 * one unit clause with no auxiliary variable.
 */
public final class TseytinTransform {
    private static final Logger log = LogManager.getFormatterLogger(TseytinTransform.class);

    private TseytinTransform() {}

    public static TseytinEncoding encode(Formula f) {
        final int n = f.nVariables();
        int nAux = 0;
        for (int i = 0; i < f.size(); ++i) {
            switch (f.kind(i)) {
                case AND:
                case OR:
                    ++nAux;
                    break;
                case NOT:
                    if (f.kind(f.children(i)[0]) == Formula.Kind.ATOM) break;
                    // fall through
                case IMPLIES:
                case IFF:
                    throw new IllegalArgumentException("formula is not in negation normal form: " + f.toString(i));
                default:
                    break;
            }
        }
        final SATProblem p = new SATProblem(n + nAux);
        final int[] literal = new int[f.size()];  // signed literal standing for each node
        final int[] auxNode = new int[nAux];
        int next = n;
        for (int i = 0; i < f.size(); ++i) {
            final int[] c = f.children(i);
            switch (f.kind(i)) {
                case ATOM:
                    literal[i] = f.literal(i);
                    break;
                case NOT:
                    literal[i] = -literal[c[0]];
                    break;
                case AND: {
                    final int a = ++next;
                    auxNode[a - n - 1] = i;
                    literal[i] = a;
                    int[] big = new int[c.length + 1];
                    big[0] = a;
                    for (int j = 0; j < c.length; ++j) {
                        emit(p, -a, literal[c[j]]);
                        big[j + 1] = -literal[c[j]];
                    }
                    emit(p, big);
                    break;
                }
                case OR: {
                    final int a = ++next;
                    auxNode[a - n - 1] = i;
                    literal[i] = a;
                    int[] big = new int[c.length + 1];
                    big[0] = -a;
                    for (int j = 0; j < c.length; ++j) {
                        emit(p, a, -literal[c[j]]);
                        big[j + 1] = literal[c[j]];
                    }
                    emit(p, big);
                    break;
                }
                default:
                    throw new IllegalStateException("unexpected " + f.kind(i));
            }
        }
        emit(p, literal[f.root()]);
        log.debug("encoded %d nodes over %d atoms as %d clauses over %d variables (%d tautologies dropped)",
                f.size(), n, p.nClauses(), p.nVariables(), p.tautologiesDropped());
        return new TseytinEncoding(f, p, auxNode, literal[f.root()]);
    }

    private static void emit(SATProblem p, int... clause) {
        for (int l : clause) {
            checkState(l != 0 && Math.abs(l) <= p.nVariables(),
                    "encoding produced literal %s outside a universe of %s variables", l, p.nVariables());
        }
        p.addClause(clause);
    }
}
