package io.stepflow.core.template.expression;

import java.util.List;

/// Parsed expression tree. Every node is data only; {@link Evaluator} interprets it.
public sealed interface Expr {

    record Literal(Object value) implements Expr {}

    record Variable(String name) implements Expr {}

    record Member(Expr target, String name) implements Expr {}

    record Index(Expr target, Expr index) implements Expr {}

    record ListLiteral(List<Expr> elements) implements Expr {
        public ListLiteral {
            elements = List.copyOf(elements);
        }
    }

    record Unary(String operator, Expr operand) implements Expr {}

    record Binary(String operator, Expr left, Expr right) implements Expr {}

    record Conditional(Expr condition, Expr whenTrue, Expr whenFalse) implements Expr {}

    record FilterCall(Expr input, String filter, List<Expr> arguments) implements Expr {
        public FilterCall {
            arguments = List.copyOf(arguments);
        }
    }
}
