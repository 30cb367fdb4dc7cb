package net.littleredcomputer.sat.formula;

/**
 * Rewrites a formula into an equivalent one built from atoms, conjunction and disjunction
 * alone. Implications and biconditionals are expanded, and negations are pushed down by De
 * Morgan's laws until they reach the atoms, where they become negative literals.
 * <p>
 * A subformula may be needed in both polarities (every operand of a biconditional is, and
 * sharing can make others so), so each node is given up to two images: the NNF of the node
 * and the NNF of its negation. A descending pass over the arena works out which images are
 * needed; an ascending pass builds them.
 */
public final class NegationNormalForm {
    private static final int POSITIVE = 1;
    private static final int NEGATIVE = 2;

    private NegationNormalForm() {}

    public static Formula transform(Formula f) {
        final int size = f.size();
        final int[] need = new int[size];
        need[f.root()] = POSITIVE;
        for (int i = f.root(); i >= 0; --i) {
            if (need[i] == 0) continue;
            final int[] c = f.children(i);
            switch (f.kind(i)) {
                case ATOM:
                    break;
                case NOT:
                    need[c[0]] |= flip(need[i]);
                    break;
                case AND:
                case OR:
                    for (int child : c) need[child] |= need[i];
                    break;
                case IMPLIES:
                    // a → b is ¬a ∨ b; its negation is a ∧ ¬b.
                    if ((need[i] & POSITIVE) != 0) {
                        need[c[0]] |= NEGATIVE;
                        need[c[1]] |= POSITIVE;
                    }
                    if ((need[i] & NEGATIVE) != 0) {
                        need[c[0]] |= POSITIVE;
                        need[c[1]] |= NEGATIVE;
                    }
                    break;
                case IFF:
                    need[c[0]] = need[c[1]] = POSITIVE | NEGATIVE;
                    break;
            }
        }

        Formula.Builder b = new Formula.Builder(f.variables());
        final int[] pos = new int[size];
        final int[] neg = new int[size];
        for (int i = 0; i <= f.root(); ++i) {
            if (need[i] == 0) continue;
            final int[] c = f.children(i);
            switch (f.kind(i)) {
                case ATOM:
                    pos[i] = b.literal(f.literal(i));
                    neg[i] = b.literal(-f.literal(i));
                    break;
                case NOT:
                    pos[i] = neg[c[0]];
                    neg[i] = pos[c[0]];
                    break;
                case AND:
                    if ((need[i] & POSITIVE) != 0) pos[i] = b.and(images(pos, c));
                    if ((need[i] & NEGATIVE) != 0) neg[i] = b.or(images(neg, c));
                    break;
                case OR:
                    if ((need[i] & POSITIVE) != 0) pos[i] = b.or(images(pos, c));
                    if ((need[i] & NEGATIVE) != 0) neg[i] = b.and(images(neg, c));
                    break;
                case IMPLIES:
                    if ((need[i] & POSITIVE) != 0) pos[i] = b.or(neg[c[0]], pos[c[1]]);
                    if ((need[i] & NEGATIVE) != 0) neg[i] = b.and(pos[c[0]], neg[c[1]]);
                    break;
                case IFF:
                    // a ↔ b is (¬a ∨ b) ∧ (¬b ∨ a); its negation is (a ∧ ¬b) ∨ (b ∧ ¬a).
                    if ((need[i] & POSITIVE) != 0) pos[i] = b.and(b.or(neg[c[0]], pos[c[1]]), b.or(neg[c[1]], pos[c[0]]));
                    if ((need[i] & NEGATIVE) != 0) neg[i] = b.or(b.and(pos[c[0]], neg[c[1]]), b.and(pos[c[1]], neg[c[0]]));
                    break;
            }
        }
        return b.build(pos[f.root()]);
    }

    private static int flip(int polarities) {
        return ((polarities & POSITIVE) != 0 ? NEGATIVE : 0) | ((polarities & NEGATIVE) != 0 ? POSITIVE : 0);
    }

    private static int[] images(int[] image, int[] children) {
        int[] r = new int[children.length];
        for (int k = 0; k < children.length; ++k) r[k] = image[children[k]];
        return r;
    }
}
