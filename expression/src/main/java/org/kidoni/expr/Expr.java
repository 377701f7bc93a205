package org.kidoni.expr;

import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simple arithmetic expression.
 * <p>
 * An expression is either
 * <ul>
 *   <li>a number ({@link Num}) with an integer value,</li>
 *   <li>a variable ({@link Var}) with a name,</li>
 *   <li>an addition ({@link Add}) of two sub-expressions, or</li>
 *   <li>a multiplication ({@link Mul}) of two sub-expressions.</li>
 * </ul>
 * <pre>
 *  Num(8)                                // 8
 *  Add(Var("x"), Num(1))                 // x + 1
 *  Mul(Num(2), Add(Var("x"), Var("y")))  // 2 * (x + y)
 * </pre>
 */
public sealed interface Expr {

    static Expr num(final int value) {
        return new Num(value);
    }

    static Expr var(final String name) {
        return new Var(name);
    }

    static Expr add(final Expr left, final Expr right) {
        return new Add(left, right);
    }

    static Expr mul(final Expr left, final Expr right) {
        return new Mul(left, right);
    }

    /**
     * @return {@code true} if the variable {@code name} occurs anywhere in this expression
     */
    boolean has(String name);

    /**
     * @return the unmodifiable set of variable names occurring in this expression
     */
    Set<String> vars();

    /**
     * Evaluates this expression. A variable missing from {@code assignment} evaluates to
     * {@code defaultValue}. Arithmetic wraps on overflow like any {@code int}.
     */
    int eval(Map<String, Integer> assignment, int defaultValue);

    default int eval(final Map<String, Integer> assignment) {
        return eval(assignment, 0);
    }

    /**
     * Infix rendering. Operands of a multiplication that are additions get parentheses;
     * nothing else does.
     */
    String show();

    record Num(int value) implements Expr {
        @Override
        public boolean has(final String name) {
            return false;
        }

        @Override
        public Set<String> vars() {
            return Set.of();
        }

        @Override
        public int eval(final Map<String, Integer> assignment, final int defaultValue) {
            return value;
        }

        @Override
        public String show() {
            return String.valueOf(value);
        }

        @Override
        public String toString() {
            return show();
        }
    }

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean has(final String name) {
            return this.name.equals(name);
        }

        @Override
        public Set<String> vars() {
            return Set.of(name);
        }

        @Override
        public int eval(final Map<String, Integer> assignment, final int defaultValue) {
            return assignment.getOrDefault(name, defaultValue);
        }

        @Override
        public String show() {
            return name;
        }

        @Override
        public String toString() {
            return show();
        }
    }

    record Add(Expr left, Expr right) implements Expr {
        public Add {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean has(final String name) {
            return left.has(name) || right.has(name);
        }

        @Override
        public Set<String> vars() {
            return union(left.vars(), right.vars());
        }

        @Override
        public int eval(final Map<String, Integer> assignment, final int defaultValue) {
            return left.eval(assignment, defaultValue) + right.eval(assignment, defaultValue);
        }

        @Override
        public String show() {
            return left.show() + " + " + right.show();
        }

        @Override
        public String toString() {
            return show();
        }
    }

    record Mul(Expr left, Expr right) implements Expr {
        public Mul {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public boolean has(final String name) {
            return left.has(name) || right.has(name);
        }

        @Override
        public Set<String> vars() {
            return union(left.vars(), right.vars());
        }

        @Override
        public int eval(final Map<String, Integer> assignment, final int defaultValue) {
            return left.eval(assignment, defaultValue) * right.eval(assignment, defaultValue);
        }

        @Override
        public String show() {
            return operand(left) + " * " + operand(right);
        }

        @Override
        public String toString() {
            return show();
        }

        private static String operand(final Expr expr) {
            return expr instanceof Add ? "(" + expr.show() + ")" : expr.show();
        }
    }

    private static Set<String> union(final Set<String> left, final Set<String> right) {
        if (right.isEmpty()) {
            return left;
        }
        if (left.isEmpty()) {
            return right;
        }
        final Set<String> result = new HashSet<>(left);
        result.addAll(right);
        return Set.copyOf(result);
    }
}
