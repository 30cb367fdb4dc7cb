package net.littleredcomputer.sat.formula;

import com.google.common.collect.ImmutableList;

import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A propositional formula over named atoms, stored as an arena of nodes. Nodes refer to their
 * operands by index, and every operand has a smaller index than the node using it, so any
 * bottom-up computation is a single ascending pass over the arena and any top-down one a
 * descending pass; nothing here recurses on the depth of the formula.
 * <p>
 * Formulas are immutable. They are made with a {@link Builder}, which shares identical
 * subformulas, so a formula is in general a DAG rather than a tree.
 */
public final class Formula {
    public enum Kind {
        ATOM,
        NOT,
        AND,
        OR,
        IMPLIES,
        IFF
    }

    private static final int[] NONE = new int[0];

    static final class Node {
        final Kind kind;
        final int[] children;
        final int literal;  // for atoms, the signed variable number; otherwise 0

        Node(Kind kind, int[] children, int literal) {
            this.kind = kind;
            this.children = children;
            this.literal = literal;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Node)) return false;
            Node n = (Node) o;
            return kind == n.kind && literal == n.literal && Arrays.equals(children, n.children);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * kind.hashCode() + literal) + Arrays.hashCode(children);
        }
    }

    private final ImmutableList<String> variables;  // variable v is named variables[v-1]
    private final ImmutableList<Node> nodes;
    private final int root;

    private Formula(ImmutableList<String> variables, ImmutableList<Node> nodes, int root) {
        this.variables = variables;
        this.nodes = nodes;
        this.root = root;
    }

    public static Formula parse(String text) {
        return FormulaParser.parse(text);
    }

    public int root() { return root; }
    public int size() { return nodes.size(); }
    public int nVariables() { return variables.size(); }
    public ImmutableList<String> variables() { return variables; }

    public String variableName(int variable) {
        checkArgument(variable >= 1 && variable <= variables.size(), "no variable %s", variable);
        return variables.get(variable - 1);
    }

    /** @return the number of the named variable, or 0 if the formula has no such variable */
    public int variableNumber(String name) {
        return variables.indexOf(name) + 1;
    }

    public Kind kind(int node) { return nodes.get(node).kind; }
    public int[] children(int node) { return nodes.get(node).children.clone(); }

    /** @return the signed variable number of an atom */
    public int literal(int node) {
        Node n = nodes.get(node);
        checkArgument(n.kind == Kind.ATOM, "node %s is not an atom", node);
        return n.literal;
    }

    /**
     * @return true if the formula contains no implication or biconditional, and negation is
     * applied only to atoms
     */
    public boolean isNNF() {
        for (Node n : nodes) {
            if (n.kind == Kind.IMPLIES || n.kind == Kind.IFF) return false;
            if (n.kind == Kind.NOT && nodes.get(n.children[0]).kind != Kind.ATOM) return false;
        }
        return true;
    }

    public Formula toNNF() {
        return NegationNormalForm.transform(this);
    }

    public TseytinEncoding toCNF() {
        return TseytinTransform.encode(toNNF());
    }

    /**
     * The truth value of every node under the given assignment.
     * @param values indexed by variable number less one
     */
    boolean[] evaluateNodes(boolean[] values) {
        checkArgument(values.length >= variables.size(), "assignment covers %s of %s variables", values.length, variables.size());
        boolean[] t = new boolean[nodes.size()];
        for (int i = 0; i < nodes.size(); ++i) {
            Node n = nodes.get(i);
            switch (n.kind) {
                case ATOM:
                    t[i] = values[Math.abs(n.literal) - 1] == (n.literal > 0);
                    break;
                case NOT:
                    t[i] = !t[n.children[0]];
                    break;
                case AND:
                    t[i] = true;
                    for (int c : n.children) t[i] &= t[c];
                    break;
                case OR:
                    t[i] = false;
                    for (int c : n.children) t[i] |= t[c];
                    break;
                case IMPLIES:
                    t[i] = !t[n.children[0]] || t[n.children[1]];
                    break;
                case IFF:
                    t[i] = t[n.children[0]] == t[n.children[1]];
                    break;
            }
        }
        return t;
    }

    /** @param values indexed by variable number less one */
    public boolean evaluate(boolean[] values) {
        return evaluateNodes(values)[root];
    }

    /** @param values a truth value for each variable of the formula, by name */
    public boolean evaluate(Map<String, Boolean> values) {
        boolean[] v = new boolean[variables.size()];
        for (int i = 0; i < v.length; ++i) {
            Boolean b = values.get(variables.get(i));
            if (b == null) throw new IllegalArgumentException("no value for " + variables.get(i));
            v[i] = b;
        }
        return evaluate(v);
    }

    private static String symbol(Kind kind) {
        switch (kind) {
            case AND: return " ∧ ";
            case OR: return " ∨ ";
            case IMPLIES: return " → ";
            case IFF: return " ↔ ";
            default: throw new IllegalArgumentException("not a binary connective: " + kind);
        }
    }

    /** @return the given subformula written with symbolic connectives */
    public String toString(int node) {
        String[] s = new String[node + 1];
        for (int i = 0; i <= node; ++i) {
            Node n = nodes.get(i);
            switch (n.kind) {
                case ATOM:
                    s[i] = (n.literal < 0 ? "¬" : "") + variables.get(Math.abs(n.literal) - 1);
                    break;
                case NOT:
                    s[i] = "¬" + operand(n.children[0], s);
                    break;
                default:
                    s[i] = Arrays.stream(n.children).mapToObj(c -> operand(c, s)).collect(Collectors.joining(symbol(n.kind)));
            }
        }
        return s[node];
    }

    private String operand(int node, String[] s) {
        Kind k = nodes.get(node).kind;
        return k == Kind.ATOM || k == Kind.NOT ? s[node] : "(" + s[node] + ")";
    }

    @Override
    public String toString() {
        return toString(root);
    }

    /**
     * Formulas are equal when their trees are identical, node by node, with atoms compared by
     * name and sign. How the trees share subformulas, and how variables are numbered, does
     * not matter.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula f = (Formula) o;
        Set<Long> visited = new HashSet<>();
        Deque<int[]> work = new ArrayDeque<>();
        work.push(new int[]{root, f.root});
        while (!work.isEmpty()) {
            int[] pair = work.pop();
            if (!visited.add(((long) pair[0] << 32) | pair[1])) continue;
            Node a = nodes.get(pair[0]);
            Node b = f.nodes.get(pair[1]);
            if (a.kind != b.kind || a.children.length != b.children.length) return false;
            if (a.kind == Kind.ATOM) {
                if (Integer.signum(a.literal) != Integer.signum(b.literal)) return false;
                if (!variables.get(Math.abs(a.literal) - 1).equals(f.variables.get(Math.abs(b.literal) - 1))) return false;
                continue;
            }
            for (int i = 0; i < a.children.length; ++i) work.push(new int[]{a.children[i], b.children[i]});
        }
        return true;
    }

    @Override
    public int hashCode() {
        int[] h = new int[nodes.size()];
        for (int i = 0; i < h.length; ++i) {
            Node n = nodes.get(i);
            if (n.kind == Kind.ATOM) {
                h[i] = 31 * variables.get(Math.abs(n.literal) - 1).hashCode() + Integer.signum(n.literal);
            } else {
                int x = n.kind.hashCode();
                for (int c : n.children) x = 31 * x + h[c];
                h[i] = x;
            }
        }
        return h[root];
    }

    /**
     * Accumulates the nodes of a formula. Each method returns the index of the (possibly
     * preexisting) node it describes. Conjunctions and disjunctions are kept flat: an operand
     * of the same kind contributes its own operands, repeated operands are dropped, and a
     * connective left with a single operand is that operand.
     */
    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final Map<String, Integer> numbers = new HashMap<>();
        private final List<Node> nodes = new ArrayList<>();
        private final Map<Node, Integer> unique = new HashMap<>();

        public Builder() {}

        /** A builder whose variables are numbered as in the given list. */
        Builder(List<String> variables) {
            variables.forEach(this::variable);
        }

        /** @return the number of the named variable, which is created if it is new */
        public int variable(String name) {
            checkArgument(name != null && !name.isEmpty(), "variable names must be nonempty");
            Integer v = numbers.get(name);
            if (v != null) return v;
            names.add(name);
            numbers.put(name, names.size());
            return names.size();
        }

        public int atom(String name) {
            return literal(variable(name));
        }

        /** @param signed a variable number, negated for a negative literal */
        public int literal(int signed) {
            checkArgument(signed != 0 && Math.abs(signed) <= names.size(), "no variable %s", signed);
            return intern(new Node(Kind.ATOM, NONE, signed));
        }

        public int not(int operand) {
            checkNode(operand);
            return intern(new Node(Kind.NOT, new int[]{operand}, 0));
        }

        public int and(int... operands) { return nary(Kind.AND, operands); }
        public int or(int... operands) { return nary(Kind.OR, operands); }

        public int implies(int antecedent, int consequent) {
            checkNode(antecedent);
            checkNode(consequent);
            return intern(new Node(Kind.IMPLIES, new int[]{antecedent, consequent}, 0));
        }

        public int iff(int left, int right) {
            checkNode(left);
            checkNode(right);
            return intern(new Node(Kind.IFF, new int[]{left, right}, 0));
        }

        private int nary(Kind kind, int[] operands) {
            checkArgument(operands.length > 0, "%s needs at least one operand", kind);
            Set<Integer> flat = new LinkedHashSet<>();
            for (int o : operands) {
                checkNode(o);
                Node n = nodes.get(o);
                if (n.kind == kind) {
                    for (int c : n.children) flat.add(c);
                } else {
                    flat.add(o);
                }
            }
            if (flat.size() == 1) return flat.iterator().next();
            return intern(new Node(kind, flat.stream().mapToInt(Integer::intValue).toArray(), 0));
        }

        private void checkNode(int node) {
            checkArgument(node >= 0 && node < nodes.size(), "no node %s", node);
        }

        private int intern(Node n) {
            Integer i = unique.get(n);
            if (i != null) return i;
            nodes.add(n);
            unique.put(n, nodes.size() - 1);
            return nodes.size() - 1;
        }

        Kind kind(int node) { return nodes.get(node).kind; }

        /**
         * @return the formula rooted at the given node. Nodes not reachable from the root are
         * left out; all variables created so far are kept.
         */
        public Formula build(int root) {
            checkNode(root);
            boolean[] reachable = new boolean[root + 1];
            reachable[root] = true;
            for (int i = root; i >= 0; --i) {
                if (reachable[i]) for (int c : nodes.get(i).children) reachable[c] = true;
            }
            int[] renumber = new int[root + 1];
            ImmutableList.Builder<Node> kept = ImmutableList.builder();
            int next = 0;
            for (int i = 0; i <= root; ++i) {
                if (!reachable[i]) continue;
                Node n = nodes.get(i);
                int[] children = n.children.length == 0 ? NONE : Arrays.stream(n.children).map(c -> renumber[c]).toArray();
                kept.add(new Node(n.kind, children, n.literal));
                renumber[i] = next++;
            }
            return new Formula(ImmutableList.copyOf(names), kept.build(), renumber[root]);
        }
    }
}
