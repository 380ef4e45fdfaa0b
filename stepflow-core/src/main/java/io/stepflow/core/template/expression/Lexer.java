package io.stepflow.core.template.expression;

import io.stepflow.core.exception.TemplateException;
import java.util.ArrayList;
import java.util.List;

/// Splits an expression into tokens. Rejects characters outside the language, including a bare
/// `=` (assignment) and `=>` (arrow functions).
final class Lexer {

    private final String source;
    private int position;

    Lexer(String source) {
        this.source = source;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new Token(Token.Type.END, "", null, position));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = position;
        char c = source.charAt(position);
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            while (position < source.length() && isIdentifierPart(source.charAt(position))) {
                position++;
            }
            return new Token(Token.Type.IDENTIFIER, source.substring(start, position), null, start);
        }
        position++;
        switch (c) {
            case '.':
                return new Token(Token.Type.DOT, ".", null, start);
            case ',':
                return new Token(Token.Type.COMMA, ",", null, start);
            case '?':
                return new Token(Token.Type.QUESTION, "?", null, start);
            case ':':
                return new Token(Token.Type.COLON, ":", null, start);
            case '(':
                return new Token(Token.Type.LEFT_PAREN, "(", null, start);
            case ')':
                return new Token(Token.Type.RIGHT_PAREN, ")", null, start);
            case '[':
                return new Token(Token.Type.LEFT_BRACKET, "[", null, start);
            case ']':
                return new Token(Token.Type.RIGHT_BRACKET, "]", null, start);
            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
                return operator(String.valueOf(c), start);
            case '|':
                if (peek('|')) {
                    position++;
                    return operator("||", start);
                }
                return new Token(Token.Type.PIPE, "|", null, start);
            case '&':
                if (peek('&')) {
                    position++;
                    return operator("&&", start);
                }
                throw error("Unexpected character '&'", start);
            case '=':
                if (peek('=')) {
                    position++;
                    if (peek('=')) {
                        position++;
                        return operator("===", start);
                    }
                    return operator("==", start);
                }
                throw error("Assignment is not allowed", start);
            case '!':
                if (peek('=')) {
                    position++;
                    if (peek('=')) {
                        position++;
                        return operator("!==", start);
                    }
                    return operator("!=", start);
                }
                return operator("!", start);
            case '<':
            case '>':
                if (peek('=')) {
                    position++;
                    return operator(c + "=", start);
                }
                return operator(String.valueOf(c), start);
            default:
                throw error("Unexpected character '" + c + "'", start);
        }
    }

    private Token number(int start) {
        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }
        boolean decimal = false;
        if (position + 1 < source.length()
                && source.charAt(position) == '.'
                && Character.isDigit(source.charAt(position + 1))) {
            decimal = true;
            position++;
            while (position < source.length() && Character.isDigit(source.charAt(position))) {
                position++;
            }
        }
        String text = source.substring(start, position);
        Object value;
        if (decimal) {
            value = Double.parseDouble(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = Double.parseDouble(text);
            }
        }
        return new Token(Token.Type.NUMBER, text, value, start);
    }

    private Token string(int start, char quote) {
        position++;
        StringBuilder value = new StringBuilder();
        while (position < source.length()) {
            char c = source.charAt(position++);
            if (c == quote) {
                return new Token(Token.Type.STRING, value.toString(), value.toString(), start);
            }
            if (c == '\\' && position < source.length()) {
                char escaped = source.charAt(position++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw error("Unterminated string literal", start);
    }

    private Token operator(String op, int start) {
        return new Token(Token.Type.OPERATOR, op, null, start);
    }

    private boolean peek(char expected) {
        return position < source.length() && source.charAt(position) == expected;
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private TemplateException error(String message, int at) {
        return new TemplateException(message + " at position " + at + " in '" + source + "'");
    }
}
