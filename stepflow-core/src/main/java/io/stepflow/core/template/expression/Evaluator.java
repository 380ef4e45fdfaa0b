package io.stepflow.core.template.expression;

import io.stepflow.core.exception.TemplateException;
import io.stepflow.core.template.TemplateFilter;
import io.stepflow.core.template.TemplateFilters;
import io.stepflow.core.util.Values;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Interprets {@link Expr} trees against a variable map.
///
/// Property and index access only reach into `Map`, `List` and `String` values. No other
/// object is inspected, so expressions cannot touch host classes. Undefined variables and
/// missing properties evaluate to null.
public final class Evaluator {

    private final TemplateFilters filters;

    public Evaluator(TemplateFilters filters) {
        this.filters = Objects.requireNonNull(filters, "filters must not be null");
    }

    /// Evaluates an expression.
    ///
    /// @param expr parsed expression, not null
    /// @param variables variable bindings, not null
    /// @return the value, may be null
    /// @throws TemplateException on evaluation errors such as an unknown filter
    public Object evaluate(Expr expr, Map<String, Object> variables) {
        if (expr instanceof Expr.Literal literal) {
            return literal.value();
        }
        if (expr instanceof Expr.Variable variable) {
            return variables.get(variable.name());
        }
        if (expr instanceof Expr.Member member) {
            return property(evaluate(member.target(), variables), member.name());
        }
        if (expr instanceof Expr.Index index) {
            return index(evaluate(index.target(), variables), evaluate(index.index(), variables));
        }
        if (expr instanceof Expr.ListLiteral list) {
            List<Object> values = new ArrayList<>(list.elements().size());
            for (Expr element : list.elements()) {
                values.add(evaluate(element, variables));
            }
            return values;
        }
        if (expr instanceof Expr.Unary unary) {
            Object operand = evaluate(unary.operand(), variables);
            if ("not".equals(unary.operator())) {
                return !Values.isTruthy(operand);
            }
            return Values.normalize(-number(operand, "-"));
        }
        if (expr instanceof Expr.Conditional conditional) {
            return Values.isTruthy(evaluate(conditional.condition(), variables))
                    ? evaluate(conditional.whenTrue(), variables)
                    : evaluate(conditional.whenFalse(), variables);
        }
        if (expr instanceof Expr.FilterCall call) {
            return applyFilter(call, variables);
        }
        return binary((Expr.Binary) expr, variables);
    }

    private Object applyFilter(Expr.FilterCall call, Map<String, Object> variables) {
        TemplateFilter filter =
                filters.get(call.filter())
                        .orElseThrow(
                                () -> new TemplateException("Unknown filter: " + call.filter()));
        Object input = evaluate(call.input(), variables);
        List<Object> arguments = new ArrayList<>(call.arguments().size());
        for (Expr argument : call.arguments()) {
            arguments.add(evaluate(argument, variables));
        }
        try {
            return filter.apply(input, arguments);
        } catch (TemplateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TemplateException(
                    "Filter '" + call.filter() + "' failed: " + e.getMessage(), e);
        }
    }

    private Object binary(Expr.Binary binary, Map<String, Object> variables) {
        String op = binary.operator();
        Object left = evaluate(binary.left(), variables);
        if ("and".equals(op)) {
            return Values.isTruthy(left) ? evaluate(binary.right(), variables) : left;
        }
        if ("or".equals(op)) {
            return Values.isTruthy(left) ? left : evaluate(binary.right(), variables);
        }
        Object right = evaluate(binary.right(), variables);
        return switch (op) {
            case "+" -> plus(left, right);
            case "-" -> Values.normalize(number(left, op) - number(right, op));
            case "*" -> Values.normalize(number(left, op) * number(right, op));
            case "/" -> divide(number(left, op), number(right, op));
            case "%" -> modulo(number(left, op), number(right, op));
            case "==" -> looseEquals(left, right);
            case "!=" -> !looseEquals(left, right);
            case "===" -> Values.looseEquals(left, right) && sameKind(left, right);
            case "!==" -> !(Values.looseEquals(left, right) && sameKind(left, right));
            case "<" -> compare(left, right) < 0;
            case "<=" -> compare(left, right) <= 0;
            case ">" -> compare(left, right) > 0;
            case ">=" -> compare(left, right) >= 0;
            case "in" -> contains(right, left);
            default -> throw new TemplateException("Unsupported operator: " + op);
        };
    }

    private static Object plus(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Values.normalize(a.doubleValue() + b.doubleValue());
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            return joined;
        }
        return Values.stringify(left) + Values.stringify(right);
    }

    private static Object divide(double left, double right) {
        if (right == 0) {
            throw new TemplateException("Division by zero");
        }
        return Values.normalize(left / right);
    }

    private static Object modulo(double left, double right) {
        if (right == 0) {
            throw new TemplateException("Division by zero");
        }
        return Values.normalize(left % right);
    }

    private static double number(Object value, String op) {
        Double number = Values.toNumber(value);
        if (number == null) {
            throw new TemplateException(
                    "Operator '"
                            + op
                            + "' expects a number but got '"
                            + Values.stringify(value)
                            + "'");
        }
        return number;
    }

    private static boolean looseEquals(Object left, Object right) {
        if (Values.looseEquals(left, right)) {
            return true;
        }
        if ((left instanceof Number && right instanceof String)
                || (left instanceof String && right instanceof Number)) {
            Double a = Values.toNumber(left);
            Double b = Values.toNumber(right);
            return a != null && a.equals(b);
        }
        return false;
    }

    private static boolean sameKind(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        return (left instanceof Number && right instanceof Number)
                || left.getClass() == right.getClass()
                || (left instanceof Map<?, ?> && right instanceof Map<?, ?>)
                || (left instanceof List<?> && right instanceof List<?>);
    }

    private static int compare(Object left, Object right) {
        Double a = left instanceof String ? null : Values.toNumber(left);
        Double b = right instanceof String ? null : Values.toNumber(right);
        if (a != null && b != null) {
            return Double.compare(a, b);
        }
        if (left instanceof String || right instanceof String) {
            Double x = Values.toNumber(left);
            Double y = Values.toNumber(right);
            if (x != null && y != null && !(left instanceof String && right instanceof String)) {
                return Double.compare(x, y);
            }
        }
        return Values.compare(left, right);
    }

    private static boolean contains(Object container, Object element) {
        if (container instanceof Collection<?> collection) {
            for (Object candidate : collection) {
                if (looseEquals(candidate, element)) {
                    return true;
                }
            }
            return false;
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(Values.stringify(element));
        }
        if (container instanceof String text) {
            return text.contains(Values.stringify(element));
        }
        return false;
    }

    static Object property(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        if (target instanceof List<?> list) {
            return index(list, name);
        }
        if (target instanceof String text && "length".equals(name)) {
            return text.length();
        }
        return null;
    }

    static Object index(Object target, Object key) {
        if (target instanceof Map<?, ?> map) {
            return map.get(Values.stringify(key));
        }
        if (target instanceof List<?> list) {
            Double position = Values.toNumber(key);
            if (position == null) {
                String name = Values.stringify(key);
                return "length".equals(name) || "size".equals(name) ? list.size() : null;
            }
            int i = position.intValue();
            if (i < 0) {
                i += list.size();
            }
            return i >= 0 && i < list.size() ? list.get(i) : null;
        }
        if (target instanceof String text) {
            Double position = Values.toNumber(key);
            if (position == null) {
                return null;
            }
            int i = position.intValue();
            return i >= 0 && i < text.length() ? String.valueOf(text.charAt(i)) : null;
        }
        return null;
    }
}
