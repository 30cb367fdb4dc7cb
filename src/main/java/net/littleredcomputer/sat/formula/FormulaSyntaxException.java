package net.littleredcomputer.sat.formula;

/**
 * Raised when formula text cannot be parsed. The position is the zero-based offset in the
 * text at which the problem was noticed.
 */
public class FormulaSyntaxException extends IllegalArgumentException {
    private final int position;

    public FormulaSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
