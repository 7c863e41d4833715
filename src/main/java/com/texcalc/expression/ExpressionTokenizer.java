package com.texcalc.expression;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits a normalized expression into tokens. Whitespace only separates tokens.
 */
public class ExpressionTokenizer {

    public ImmutableList<Token> tokenize(String input) {
        MutableList<Token> tokens = Lists.mutable.empty();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isDigit(c) || (c == '.' && i + 1 < input.length() && isDigit(input.charAt(i + 1)))) {
                i = readNumber(input, i, tokens);
            } else if (isLetter(c)) {
                int start = i;
                while (i < input.length() && isLetter(input.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, input.substring(start, i), start));
            } else if (c == '\\') {
                i = readCommand(input, i, tokens);
            } else {
                TokenType type = punctuation(c);
                if (type == null) {
                    throw new ExpressionException(ErrorKind.SYNTAX_ERROR,
                            "Unrecognized character '" + c + "' at position " + i, i);
                }
                tokens.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        tokens.add(new Token(TokenType.EOF, "", input.length()));
        return tokens.toImmutable();
    }

    private int readNumber(String input, int start, MutableList<Token> tokens) {
        int i = start;
        while (i < input.length() && isDigit(input.charAt(i))) {
            i++;
        }
        if (i < input.length() && input.charAt(i) == '.') {
            i++;
            while (i < input.length() && isDigit(input.charAt(i))) {
                i++;
            }
        }
        // Scientific notation only when digits follow the 'e', otherwise 'e' is the constant
        if (i < input.length() && (input.charAt(i) == 'e' || input.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < input.length() && (input.charAt(j) == '+' || input.charAt(j) == '-')) {
                j++;
            }
            if (j < input.length() && isDigit(input.charAt(j))) {
                i = j;
                while (i < input.length() && isDigit(input.charAt(i))) {
                    i++;
                }
            }
        }
        tokens.add(new Token(TokenType.NUMBER, input.substring(start, i), start));
        return i;
    }

    private int readCommand(String input, int start, MutableList<Token> tokens) {
        int i = start + 1;
        while (i < input.length() && isLetter(input.charAt(i))) {
            i++;
        }
        if (i == start + 1 && i < input.length()) {
            // Single-symbol command such as \{ or \%
            i++;
        }
        tokens.add(new Token(TokenType.COMMAND, input.substring(start, i), start));
        return i;
    }

    private static TokenType punctuation(char c) {
        return switch (c) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '^' -> TokenType.CARET;
            case '_' -> TokenType.UNDERSCORE;
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LEFT_PAREN;
            case ')' -> TokenType.RIGHT_PAREN;
            case '{' -> TokenType.LEFT_BRACE;
            case '}' -> TokenType.RIGHT_BRACE;
            case '[' -> TokenType.LEFT_BRACKET;
            case ']' -> TokenType.RIGHT_BRACKET;
            case '|' -> TokenType.BAR;
            case '!' -> TokenType.BANG;
            default -> null;
        };
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
