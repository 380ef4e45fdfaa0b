package io.stepflow.core.template.expression;

import io.stepflow.core.exception.TemplateException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Recursive-descent parser for template expressions.
///
/// ### Grammar
/// ```
/// expression  := or ( "?" expression ":" expression )?
/// or          := and ( ( "or" | "||" ) and )*
/// and         := not ( ( "and" | "&&" ) not )*
/// not         := ( "not" | "!" ) not | comparison
/// comparison  := additive ( ( "==" | "!=" | "===" | "!==" | "<" | "<=" | ">" | ">="
///                           | "in" | "not" "in" ) additive )*
/// additive    := term ( ( "+" | "-" ) term )*
/// term        := unary ( ( "*" | "/" | "%" ) unary )*
/// unary       := "-" unary | filtered
/// filtered    := postfix ( "|" identifier ( "(" arguments ")" )? )*
/// postfix     := primary ( "." identifier | "[" expression "]" )*
/// primary     := number | string | "true" | "false" | "null" | "none" | identifier
///              | "(" expression ")" | "[" arguments "]"
/// ```
///
/// A `(` directly after a value is a function call, which the language does not have: it is
/// rejected with a {@link TemplateException}, as is anything left over after the expression.
public final class Parser {

    private static final Set<String> COMPARISONS =
            Set.of("==", "!=", "===", "!==", "<", "<=", ">", ">=");

    private final String source;
    private final List<Token> tokens;
    private int current;

    private Parser(String source) {
        this.source = source;
        this.tokens = new Lexer(source).tokenize();
    }

    /// Parses one expression.
    ///
    /// @param source expression text without `{{ }}` delimiters, not null
    /// @return expression tree, never null
    /// @throws TemplateException on any syntax error
    public static Expr parse(String source) {
        Parser parser = new Parser(source);
        if (parser.peek().is(Token.Type.END)) {
            throw new TemplateException("Empty expression");
        }
        Expr expr = parser.expression();
        if (!parser.peek().is(Token.Type.END)) {
            throw parser.error("Unexpected '" + parser.peek().text() + "'");
        }
        return expr;
    }

    private Expr expression() {
        Expr condition = or();
        if (match(Token.Type.QUESTION)) {
            Expr whenTrue = expression();
            expect(Token.Type.COLON, "':'");
            Expr whenFalse = expression();
            return new Expr.Conditional(condition, whenTrue, whenFalse);
        }
        return condition;
    }

    private Expr or() {
        Expr left = and();
        while (peek().isKeyword("or") || peek().isOperator("||")) {
            advance();
            left = new Expr.Binary("or", left, and());
        }
        return left;
    }

    private Expr and() {
        Expr left = not();
        while (peek().isKeyword("and") || peek().isOperator("&&")) {
            advance();
            left = new Expr.Binary("and", left, not());
        }
        return left;
    }

    private Expr not() {
        if ((peek().isKeyword("not") && !peekNext().isKeyword("in")) || peek().isOperator("!")) {
            advance();
            return new Expr.Unary("not", not());
        }
        return comparison();
    }

    private Expr comparison() {
        Expr left = additive();
        while (true) {
            Token token = peek();
            if (token.is(Token.Type.OPERATOR) && COMPARISONS.contains(token.text())) {
                advance();
                left = new Expr.Binary(token.text(), left, additive());
            } else if (token.isKeyword("in")) {
                advance();
                left = new Expr.Binary("in", left, additive());
            } else if (token.isKeyword("not") && peekNext().isKeyword("in")) {
                advance();
                advance();
                left = new Expr.Unary("not", new Expr.Binary("in", left, additive()));
            } else {
                return left;
            }
        }
    }

    private Expr additive() {
        Expr left = term();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, term());
        }
        return left;
    }

    private Expr term() {
        Expr left = unary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("%")) {
            String op = advance().text();
            left = new Expr.Binary(op, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (peek().isOperator("-")) {
            advance();
            return new Expr.Unary("-", unary());
        }
        return filtered();
    }

    private Expr filtered() {
        Expr expr = postfix();
        while (match(Token.Type.PIPE)) {
            Token name = expect(Token.Type.IDENTIFIER, "filter name");
            List<Expr> arguments = List.of();
            if (match(Token.Type.LEFT_PAREN)) {
                arguments = arguments(Token.Type.RIGHT_PAREN);
            }
            expr = new Expr.FilterCall(expr, name.text(), arguments);
        }
        return expr;
    }

    private Expr postfix() {
        Expr expr = primary();
        while (true) {
            if (match(Token.Type.DOT)) {
                Token name = advance();
                if (!name.is(Token.Type.IDENTIFIER) && !name.is(Token.Type.NUMBER)) {
                    throw error("Expected property name after '.'");
                }
                expr = new Expr.Member(expr, name.text());
            } else if (match(Token.Type.LEFT_BRACKET)) {
                Expr index = expression();
                expect(Token.Type.RIGHT_BRACKET, "']'");
                expr = new Expr.Index(expr, index);
            } else if (peek().is(Token.Type.LEFT_PAREN)) {
                throw error("Function calls are not allowed");
            } else {
                return expr;
            }
        }
    }

    private Expr primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
            case STRING:
                return new Expr.Literal(token.value());
            case IDENTIFIER:
                return switch (token.text()) {
                    case "true", "True" -> new Expr.Literal(Boolean.TRUE);
                    case "false", "False" -> new Expr.Literal(Boolean.FALSE);
                    case "null", "none", "None", "undefined" -> new Expr.Literal(null);
                    default -> new Expr.Variable(token.text());
                };
            case LEFT_PAREN:
                Expr inner = expression();
                expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            case LEFT_BRACKET:
                return new Expr.ListLiteral(arguments(Token.Type.RIGHT_BRACKET));
            default:
                String problem =
                        token.is(Token.Type.END)
                                ? "Unexpected end of expression"
                                : "Unexpected '" + token.text() + "'";
                throw new TemplateException(
                        problem + " at position " + token.position() + " in '" + source + "'");
        }
    }

    private List<Expr> arguments(Token.Type closing) {
        List<Expr> arguments = new ArrayList<>();
        if (match(closing)) {
            return arguments;
        }
        do {
            arguments.add(expression());
        } while (match(Token.Type.COMMA));
        expect(closing, closing == Token.Type.RIGHT_PAREN ? "')'" : "']'");
        return arguments;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return tokens.get(Math.min(current + 1, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(Token.Type.END)) {
            current++;
        }
        return token;
    }

    private boolean match(Token.Type type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(Token.Type type, String description) {
        if (!peek().is(type)) {
            throw error("Expected " + description + " but found '" + peek().text() + "'");
        }
        return advance();
    }

    private TemplateException error(String message) {
        return new TemplateException(
                message + " at position " + peek().position() + " in '" + source + "'");
    }
}
