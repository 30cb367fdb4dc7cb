package net.littleredcomputer.sat.formula;

import com.google.common.collect.ImmutableMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads propositional formulas written with either symbolic connectives (¬ ∧ ∨ → ↔) or their
 * textual forms (not and or -> &lt;-&gt;), parentheses, and identifiers naming atoms.
 * Negation binds tightest, then conjunction, disjunction, implication (which groups to the
 * right) and finally the biconditional (which groups to the left).
 * <p>
 * The parser is an operator-precedence (shunting-yard) parser with explicit stacks, so deeply
 * nested input cannot exhaust the call stack.
 */
final class FormulaParser {
    private enum Type {
        ATOM(0, false),
        NOT(5, true),
        AND(4, false),
        OR(3, false),
        IMPLIES(2, true),
        IFF(1, false),
        LPAREN(0, false),
        RPAREN(0, false);

        final int precedence;
        final boolean rightAssociative;

        Type(int precedence, boolean rightAssociative) {
            this.precedence = precedence;
            this.rightAssociative = rightAssociative;
        }

        boolean isBinary() {
            return this == AND || this == OR || this == IMPLIES || this == IFF;
        }
    }

    private static final class Token {
        final Type type;
        final String text;
        final int position;
        int operands = 2;  // a stacked conjunction or disjunction absorbs the rest of its run

        Token(Type type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        boolean continuesRun(Type incoming) {
            return type == incoming && (type == Type.AND || type == Type.OR);
        }
    }

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final ImmutableMap<String, Type> SYMBOLS = ImmutableMap.<String, Type>builder()
            .put("<->", Type.IFF)
            .put("->", Type.IMPLIES)
            .put("¬", Type.NOT)
            .put("∧", Type.AND)
            .put("∨", Type.OR)
            .put("→", Type.IMPLIES)
            .put("↔", Type.IFF)
            .put("(", Type.LPAREN)
            .put(")", Type.RPAREN)
            .build();
    private static final ImmutableMap<String, Type> KEYWORDS = ImmutableMap.of(
            "not", Type.NOT,
            "and", Type.AND,
            "or", Type.OR);

    private FormulaParser() {}

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(text);
        int i = 0;
        SCAN:
        while (i < text.length()) {
            if (Character.isWhitespace(text.charAt(i))) {
                ++i;
                continue;
            }
            // Longer symbols come first in SYMBOLS, so "<->" is not taken for something shorter.
            for (Map.Entry<String, Type> e : SYMBOLS.entrySet()) {
                if (text.startsWith(e.getKey(), i)) {
                    tokens.add(new Token(e.getValue(), e.getKey(), i));
                    i += e.getKey().length();
                    continue SCAN;
                }
            }
            m.region(i, text.length());
            if (!m.lookingAt()) throw new FormulaSyntaxException("unexpected character '" + text.charAt(i) + "'", i);
            String word = m.group();
            tokens.add(new Token(KEYWORDS.getOrDefault(word, Type.ATOM), word, i));
            i = m.end();
        }
        return tokens;
    }

    static Formula parse(String text) {
        List<Token> tokens = tokenize(text);
        if (tokens.isEmpty()) throw new FormulaSyntaxException("empty formula", 0);
        Formula.Builder b = new Formula.Builder();
        Deque<Integer> operands = new ArrayDeque<>();
        Deque<Token> operators = new ArrayDeque<>();
        boolean expectOperand = true;
        for (Token t : tokens) {
            if (expectOperand) {
                switch (t.type) {
                    case ATOM:
                        operands.push(b.atom(t.text));
                        expectOperand = false;
                        break;
                    case NOT:
                    case LPAREN:
                        operators.push(t);
                        break;
                    default:
                        throw new FormulaSyntaxException("expected an operand but found '" + t.text + "'", t.position);
                }
            } else if (t.type == Type.RPAREN) {
                while (!operators.isEmpty() && operators.peek().type != Type.LPAREN) reduce(b, operators.pop(), operands);
                if (operators.isEmpty()) throw new FormulaSyntaxException("unbalanced ')'", t.position);
                operators.pop();
            } else if (t.type.isBinary()) {
                while (!operators.isEmpty() && bindsBefore(operators.peek().type, t.type)
                        && !operators.peek().continuesRun(t.type)) {
                    reduce(b, operators.pop(), operands);
                }
                if (!operators.isEmpty() && operators.peek().continuesRun(t.type)) ++operators.peek().operands;
                else operators.push(t);
                expectOperand = true;
            } else {
                throw new FormulaSyntaxException("expected an operator but found '" + t.text + "'", t.position);
            }
        }
        if (expectOperand) throw new FormulaSyntaxException("formula ends where an operand was expected", text.length());
        while (!operators.isEmpty()) {
            Token t = operators.pop();
            if (t.type == Type.LPAREN) throw new FormulaSyntaxException("unbalanced '('", t.position);
            reduce(b, t, operands);
        }
        return b.build(operands.pop());
    }

    /** @return true if an operator on the stack must be applied before the incoming binary operator is pushed */
    private static boolean bindsBefore(Type stacked, Type incoming) {
        if (stacked == Type.LPAREN) return false;
        if (stacked.precedence > incoming.precedence) return true;
        return stacked.precedence == incoming.precedence && !incoming.rightAssociative;
    }

    private static void reduce(Formula.Builder b, Token op, Deque<Integer> operands) {
        if (op.type == Type.NOT) {
            operands.push(b.not(operands.pop()));
            return;
        }
        if (op.type == Type.AND || op.type == Type.OR) {
            // One node for the whole run p ∧ q ∧ ... rather than a nest of binary ones.
            int[] run = new int[op.operands];
            for (int k = run.length - 1; k >= 0; --k) run[k] = operands.pop();
            operands.push(op.type == Type.AND ? b.and(run) : b.or(run));
            return;
        }
        int right = operands.pop();
        int left = operands.pop();
        switch (op.type) {
            case IMPLIES:
                operands.push(b.implies(left, right));
                break;
            case IFF:
                operands.push(b.iff(left, right));
                break;
            default:
                throw new IllegalStateException("cannot apply " + op.type);
        }
    }
}
