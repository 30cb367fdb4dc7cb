package net.littleredcomputer.sat;

/**
 * Helpers for the literal encoding used throughout the solvers: variable v (one-based)
 * is represented by the literal 2v when asserted and 2v+1 when denied, so that the
 * complement of a literal is obtained by flipping its low bit. At the API boundary
 * literals are written DIMACS style, as nonzero signed integers.
 */
public final class Literals {
    private Literals() {}

    public static int thevar(int literal) { return literal >> 1; }
    public static int poslit(int variable) { return 2*variable; }
    public static int neglit(int variable) { return 2*variable+1; }
    public static int not(int l) { return l^1; }
    public static boolean negated(int l) { return (l & 1) != 0; }

    /**
     * @param dimacs A positive or negative variable number
     * @return The [2n|2n+1]-encoded value
     */
    public static int encode(int dimacs) {
        if (dimacs == 0) throw new IllegalArgumentException("0 is not a literal");
        return dimacs > 0 ? 2 * dimacs : -2 * dimacs + 1;
    }

    public static int decode(int literal) {
        int sign = ((literal & 1) == 0) ? 1 : -1;
        return sign * (literal >> 1);
    }

    public static String toString(int literal) {
        return (negated(literal) ? "~" : "") + thevar(literal);
    }
}
