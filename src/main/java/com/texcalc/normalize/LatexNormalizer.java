package com.texcalc.normalize;

import com.texcalc.expression.MathFunction;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites LaTeX math into the canonical form read by
 * {@link com.texcalc.expression.ExpressionParser}:
 * {@code frac{a}{b}}, {@code sqrt{x}}, {@code nthroot[n]{x}}, {@code abs(x)}, {@code log_{b}{x}},
 * bare function names, {@code pi}, {@code e} and ASCII operators.
 *
 * <p>Never fails. Anything it does not understand is passed through for the parser to reject.
 */
public class LatexNormalizer {
    static final int NESTING_LIMIT = 256;

    private static final Pattern DOLLARS = Pattern.compile("^\\$+|\\$+$");
    private static final Pattern STYLE = Pattern.compile("\\\\(displaystyle|textstyle|scriptstyle|scriptscriptstyle)(?![a-zA-Z])\\s*");
    private static final Pattern SIZING = Pattern.compile("\\\\(left|right|big|Big|bigg|Bigg)(?![a-zA-Z])\\.?");
    private static final Pattern SPACING = Pattern.compile("\\\\[,;:! ]|\\\\q?quad(?![a-zA-Z])|~");
    private static final Pattern TEXT = Pattern.compile("\\\\text\\s*\\{[^}]*\\}");
    private static final Pattern UPRIGHT = Pattern.compile("\\\\(mathrm|operatorname)\\s*\\{([^}]*)\\}");
    private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+)");
    private static final Pattern LOG_SUBSCRIPT = Pattern.compile("(?<![a-zA-Z])log\\s*_\\s*([0-9]+(?:\\.[0-9]+)?|[a-zA-Z])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String[] FRACTION_MACROS = {"\\frac", "\\dfrac", "\\tfrac", "\\cfrac"};
    private static final String[] ROOT_MACROS = {"\\sqrt"};

    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String expr = stripWrappers(raw.replace('\u00A0', ' ').trim());
        expr = stripPresentation(expr);
        expr = rewriteFractions(expr, 0);
        expr = rewriteRoots(expr, 0);
        expr = rewriteGlyphs(expr);
        expr = rewriteAbsoluteValue(expr);
        expr = moveFunctionExponents(expr, 0);
        return WHITESPACE.matcher(expr).replaceAll(" ").trim();
    }

    private String stripWrappers(String expr) {
        String result = DOLLARS.matcher(expr).replaceAll("").trim();
        if ((result.startsWith("\\[") && result.endsWith("\\]"))
                || (result.startsWith("\\(") && result.endsWith("\\)"))) {
            result = result.substring(2, result.length() - 2).trim();
        }
        return STYLE.matcher(result).replaceAll("");
    }

    private String stripPresentation(String expr) {
        String result = expr
                .replace('−', '-')
                .replace("π", "\\pi ")
                .replace("×", "\\times ")
                .replace("·", "\\cdot ")
                .replace("⋅", "\\cdot ")
                .replace("÷", "\\div ")
                .replace("∞", "\\infty ");
        result = SIZING.matcher(result).replaceAll("");
        result = SPACING.matcher(result).replaceAll(" ");
        result = TEXT.matcher(result).replaceAll("");
        return UPRIGHT.matcher(result).replaceAll(" $2 ");
    }

    // \frac{a}{b}, \dfrac{a}{b}, \tfrac{a}{b}, \cfrac{a}{b} -> frac{a}{b}
    private String rewriteFractions(String expr, int depth) {
        StringBuilder out = new StringBuilder(expr.length() + 8);
        int i = 0;
        while (i < expr.length()) {
            int macroEnd = matchMacro(expr, i, FRACTION_MACROS);
            if (macroEnd < 0) {
                out.append(expr.charAt(i++));
                continue;
            }
            if (depth >= NESTING_LIMIT) {
                return out.append(expr, i, expr.length()).toString();
            }
            Argument numerator = readArgument(expr, macroEnd);
            Argument denominator = numerator == null ? null : readArgument(expr, numerator.end());
            if (denominator == null) {
                // Unbalanced or missing argument: keep the rest for the parser to report
                appendWord(out, "frac");
                i = macroEnd;
                continue;
            }
            appendWord(out, "frac{").append(rewriteFractions(numerator.content(), depth + 1))
               .append("}{").append(rewriteFractions(denominator.content(), depth + 1))
               .append('}');
            i = denominator.end();
        }
        return out.toString();
    }

    // \sqrt{x} -> sqrt{x}, \sqrt[n]{x} -> nthroot[n]{x}
    private String rewriteRoots(String expr, int depth) {
        StringBuilder out = new StringBuilder(expr.length() + 8);
        int i = 0;
        while (i < expr.length()) {
            int macroEnd = matchMacro(expr, i, ROOT_MACROS);
            if (macroEnd < 0) {
                out.append(expr.charAt(i++));
                continue;
            }
            if (depth >= NESTING_LIMIT) {
                return out.append(expr, i, expr.length()).toString();
            }
            int bracket = skipSpaces(expr, macroEnd);
            if (bracket < expr.length() && expr.charAt(bracket) == '[') {
                int close = matchClosing(expr, bracket);
                Argument radicand = close < 0 ? null : readArgument(expr, close + 1);
                if (radicand == null) {
                    appendWord(out, "nthroot");
                    i = bracket;
                    continue;
                }
                appendWord(out, "nthroot[").append(rewriteRoots(expr.substring(bracket + 1, close), depth + 1))
                   .append("]{").append(rewriteRoots(radicand.content(), depth + 1))
                   .append('}');
                i = radicand.end();
            } else {
                Argument radicand = readArgument(expr, macroEnd);
                if (radicand == null) {
                    appendWord(out, "sqrt");
                    i = macroEnd;
                    continue;
                }
                appendWord(out, "sqrt{").append(rewriteRoots(radicand.content(), depth + 1)).append('}');
                i = radicand.end();
            }
        }
        return out.toString();
    }

    private String rewriteGlyphs(String expr) {
        StringBuilder out = new StringBuilder(expr.length());
        Matcher matcher = COMMAND.matcher(expr);
        int last = 0;
        while (matcher.find()) {
            out.append(expr, last, matcher.start());
            String replacement = glyph(matcher.group(1));
            if (replacement == null) {
                out.append(matcher.group());
            } else {
                boolean word = isLetter(replacement.charAt(0));
                if (word) {
                    appendWord(out, replacement);
                } else {
                    out.append(replacement);
                }
                if (word && matcher.end() < expr.length()
                        && (isLetter(expr.charAt(matcher.end())) || expr.charAt(matcher.end()) == '\\')) {
                    out.append(' ');
                }
            }
            last = matcher.end();
        }
        out.append(expr, last, expr.length());
        return LOG_SUBSCRIPT.matcher(out).replaceAll("log_{$1}");
    }

    private static String glyph(String command) {
        return switch (command) {
            case "times", "cdot", "ast" -> "*";
            case "div" -> "/";
            case "pi", "e" -> command;
            case "lvert", "rvert", "vert", "mid" -> "|";
            default -> MathFunction.isFunctionName(command) ? command : null;
        };
    }

    /**
     * |x| -> abs(x). A bar opens where an operand is expected and closes otherwise, and only
     * pairs with a bar opened at the same bracket depth. If pairing fails anywhere the input is
     * returned unchanged so the parser reports the stray bar.
     */
    private String rewriteAbsoluteValue(String expr) {
        if (expr.indexOf('|') < 0) {
            return expr;
        }
        StringBuilder out = new StringBuilder(expr.length() + 16);
        Deque<Character> open = new ArrayDeque<>();
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            switch (c) {
                case '|' -> {
                    boolean operandExpected = operandExpected(out);
                    if (!operandExpected && !open.isEmpty() && open.peek() == '|') {
                        out.append(')');
                        open.pop();
                    } else {
                        appendWord(out, "abs(");
                        open.push('|');
                    }
                }
                case '(', '{', '[' -> {
                    open.push(c);
                    out.append(c);
                }
                case ')', '}', ']' -> {
                    if (!open.isEmpty()) {
                        if (open.peek() == '|') {
                            return expr;
                        }
                        open.pop();
                    }
                    out.append(c);
                }
                default -> out.append(c);
            }
        }
        return open.contains('|') ? expr : out.toString();
    }

    private static boolean operandExpected(CharSequence out) {
        for (int i = out.length() - 1; i >= 0; i--) {
            char c = out.charAt(i);
            if (!Character.isWhitespace(c)) {
                return "+-*/^([{,_".indexOf(c) >= 0;
            }
        }
        return true;
    }

    /**
     * f^{k}{x} and f^{k}(x) -> f{x}^{k}, so the power always applies to the function's result.
     * f^{-1} is left alone: it usually means the inverse function, not a reciprocal.
     */
    private String moveFunctionExponents(String expr, int depth) {
        if (expr.indexOf('^') < 0 || depth >= NESTING_LIMIT) {
            return expr;
        }
        StringBuilder out = new StringBuilder(expr.length() + 8);
        int i = 0;
        while (i < expr.length()) {
            char c = expr.charAt(i);
            if (!isLetter(c)) {
                out.append(c);
                i++;
                continue;
            }
            int nameEnd = i;
            while (nameEnd < expr.length() && isLetter(expr.charAt(nameEnd))) {
                nameEnd++;
            }
            String name = expr.substring(i, nameEnd);
            int rewritten = MathFunction.isFunctionName(name) ? rewriteExponent(expr, i, nameEnd, out, depth) : -1;
            if (rewritten < 0) {
                out.append(name);
                i = nameEnd;
            } else {
                i = rewritten;
            }
        }
        return out.toString();
    }

    // Returns the index after the rewritten call, or -1 when the call does not have the f^{k}{x} shape
    private int rewriteExponent(String expr, int start, int nameEnd, StringBuilder out, int depth) {
        int headEnd = nameEnd;
        if (expr.startsWith("log", start) && nameEnd - start == 3) {
            int underscore = skipSpaces(expr, nameEnd);
            if (underscore < expr.length() && expr.charAt(underscore) == '_') {
                Argument base = readArgument(expr, underscore + 1);
                if (base == null) {
                    return -1;
                }
                headEnd = base.end();
            }
        }
        int caret = skipSpaces(expr, headEnd);
        if (caret >= expr.length() || expr.charAt(caret) != '^') {
            return -1;
        }
        Argument exponent = readArgument(expr, caret + 1);
        if (exponent == null || exponent.content().replace(" ", "").equals("-1")) {
            return -1;
        }
        int argumentStart = skipSpaces(expr, exponent.end());
        if (argumentStart >= expr.length() || (expr.charAt(argumentStart) != '{' && expr.charAt(argumentStart) != '(')) {
            return -1;
        }
        int argumentEnd = matchClosing(expr, argumentStart);
        if (argumentEnd < 0) {
            return -1;
        }
        out.append(expr, start, headEnd)
           .append(expr.charAt(argumentStart))
           .append(moveFunctionExponents(expr.substring(argumentStart + 1, argumentEnd), depth + 1))
           .append(expr.charAt(argumentEnd))
           .append("^{")
           .append(moveFunctionExponents(exponent.content(), depth + 1))
           .append('}');
        return argumentEnd + 1;
    }

    // Keeps a rewritten name from fusing with a preceding identifier
    private static StringBuilder appendWord(StringBuilder out, String word) {
        if (!out.isEmpty() && isLetter(out.charAt(out.length() - 1))) {
            out.append(' ');
        }
        return out.append(word);
    }

    /**
     * A macro argument: a balanced brace group, one digit, one letter standing alone, or a
     * constant command such as {@code \pi}. Anything else is left for the parser to read as an
     * undelimited operand.
     */
    private record Argument(String content, int end) {}

    private static Argument readArgument(String expr, int from) {
        int i = skipSpaces(expr, from);
        if (i >= expr.length()) {
            return null;
        }
        char c = expr.charAt(i);
        if (c == '{') {
            int close = matchClosing(expr, i);
            return close < 0 ? null : new Argument(expr.substring(i + 1, close), close + 1);
        }
        if (Character.isDigit(c)) {
            return new Argument(String.valueOf(c), i + 1);
        }
        if (isLetter(c)) {
            boolean standsAlone = i + 1 >= expr.length() || !isLetter(expr.charAt(i + 1));
            return standsAlone ? new Argument(String.valueOf(c), i + 1) : null;
        }
        if (c == '\\') {
            int end = i + 1;
            while (end < expr.length() && isLetter(expr.charAt(end))) {
                end++;
            }
            String name = expr.substring(i + 1, end);
            return name.equals("pi") || name.equals("e") ? new Argument(expr.substring(i, end), end) : null;
        }
        return null;
    }

    // Index of the bracket closing the one at openIndex, tracking only that bracket kind
    static int matchClosing(String expr, int openIndex) {
        char open = expr.charAt(openIndex);
        char close = switch (open) {
            case '{' -> '}';
            case '[' -> ']';
            case '(' -> ')';
            default -> throw new IllegalArgumentException("Not an opening bracket: " + open);
        };
        int depth = 0;
        for (int i = openIndex; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // End index of one of the macros at position i, provided the name is not a prefix of a longer command
    private static int matchMacro(String expr, int i, String[] macros) {
        if (expr.charAt(i) != '\\') {
            return -1;
        }
        for (String macro : macros) {
            int end = i + macro.length();
            if (expr.startsWith(macro, i) && (end >= expr.length() || !isLetter(expr.charAt(end)))) {
                return end;
            }
        }
        return -1;
    }

    private static int skipSpaces(String expr, int from) {
        int i = from;
        while (i < expr.length() && Character.isWhitespace(expr.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
