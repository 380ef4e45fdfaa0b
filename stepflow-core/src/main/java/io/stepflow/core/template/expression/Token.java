package io.stepflow.core.template.expression;

/// Lexical token of the expression language.
///
/// @param type token category, not null
/// @param text source text (unquoted for strings), not null
/// @param value parsed literal for numbers and strings, may be null
/// @param position zero-based offset in the expression
record Token(Type type, String text, Object value, int position) {

    enum Type {
        NUMBER,
        STRING,
        IDENTIFIER,
        OPERATOR,
        DOT,
        COMMA,
        PIPE,
        QUESTION,
        COLON,
        LEFT_PAREN,
        RIGHT_PAREN,
        LEFT_BRACKET,
        RIGHT_BRACKET,
        END
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isOperator(String op) {
        return type == Type.OPERATOR && text.equals(op);
    }

    boolean isKeyword(String keyword) {
        return type == Type.IDENTIFIER && text.equals(keyword);
    }
}
