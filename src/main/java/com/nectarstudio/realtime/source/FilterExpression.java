package com.nectarstudio.realtime.source;

import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parser for list-view filter expressions, compiled into a parameterised {@link RowPredicate}.
 * <p>
 * Grammar: {@code clause ((and | or) clause)*} where a clause is {@code column op literal},
 * {@code column is [not] null}, or a parenthesised expression. Operators: {@code = != <> > >= < <= like}.
 * Literals: single-quoted strings ({@code ''} escapes a quote), numbers, {@code true}, {@code false}.
 * Column names are checked against the table's columns so nothing unknown reaches SQL.
 */
public final class FilterExpression {

    private static final Set<String> OPERATORS = Set.of("=", "!=", "<>", ">", ">=", "<", "<=", "LIKE");

    private final List<String> tokens;
    private final Map<String, String> knownColumns;
    private final String paramPrefix;
    private final Map<String, Object> params = new LinkedHashMap<>();
    private int position;

    private FilterExpression(List<String> tokens, Set<String> columns, String paramPrefix) {
        this.tokens = tokens;
        this.paramPrefix = paramPrefix;
        this.knownColumns = new LinkedHashMap<>();
        columns.forEach(c -> knownColumns.put(c.toLowerCase(Locale.ROOT), c));
    }

    /**
     * Compiles {@code expression}; a blank expression matches every row.
     *
     * @throws SubscriptionConfigurationException when the expression is malformed or names an unknown column
     */
    public static RowPredicate compile(String expression, Set<String> columns, String paramPrefix) {
        if (expression == null || expression.isBlank()) {
            return RowPredicate.always();
        }
        FilterExpression parser = new FilterExpression(tokenize(expression), columns, paramPrefix);
        String sql = parser.parseExpression();
        if (parser.position != parser.tokens.size()) {
            throw invalid("unexpected '" + parser.tokens.get(parser.position) + "'");
        }
        return new RowPredicate(sql, parser.params);
    }

    /**
     * Collapses insignificant whitespace so equivalent filters canonicalise to the same job key.
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        return String.join(" ", tokenize(expression));
    }

    private String parseExpression() {
        StringBuilder sql = new StringBuilder(parseClause());
        while (peek().map(t -> t.equalsIgnoreCase("and") || t.equalsIgnoreCase("or")).orElse(false)) {
            String joiner = next().toUpperCase(Locale.ROOT);
            sql.append(' ').append(joiner).append(' ').append(parseClause());
        }
        return sql.toString();
    }

    private String parseClause() {
        String token = next();
        if (token.equals("(")) {
            String inner = parseExpression();
            expect(")");
            return "(" + inner + ")";
        }
        String column = resolveColumn(token);
        String op = next().toUpperCase(Locale.ROOT);
        if (op.equals("IS")) {
            boolean negated = peek().map(t -> t.equalsIgnoreCase("not")).orElse(false);
            if (negated) {
                next();
            }
            String nullWord = next();
            if (!nullWord.equalsIgnoreCase("null")) {
                throw invalid("expected NULL after IS");
            }
            return column + (negated ? " IS NOT NULL" : " IS NULL");
        }
        if (!OPERATORS.contains(op)) {
            throw invalid("unsupported operator '" + op + "'");
        }
        String param = paramPrefix + params.size();
        params.put(param, literal(next()));
        return column + " " + (op.equals("!=") ? "<>" : op) + " :" + param;
    }

    private String resolveColumn(String token) {
        String column = knownColumns.get(token.toLowerCase(Locale.ROOT));
        if (column == null) {
            throw invalid("unknown column '" + token + "'");
        }
        return column;
    }

    private Object literal(String token) {
        if (token.startsWith("'")) {
            return token.substring(1, token.length() - 1).replace("''", "'");
        }
        if (token.equalsIgnoreCase("true") || token.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(token);
        }
        try {
            BigDecimal number = new BigDecimal(token);
            return number.scale() <= 0 ? (Object) number.longValueExact() : number;
        } catch (NumberFormatException | ArithmeticException e) {
            throw invalid("bad literal '" + token + "'");
        }
    }

    private Optional<String> peek() {
        return position < tokens.size() ? Optional.of(tokens.get(position)) : Optional.empty();
    }

    private String next() {
        if (position >= tokens.size()) {
            throw invalid("unexpected end of expression");
        }
        return tokens.get(position++);
    }

    private void expect(String token) {
        String actual = next();
        if (!actual.equals(token)) {
            throw invalid("expected '" + token + "' but found '" + actual + "'");
        }
    }

    private static List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(' || c == ')') {
                tokens.add(String.valueOf(c));
                i++;
            } else if (c == '\'') {
                int end = i + 1;
                while (true) {
                    if (end >= n) {
                        throw invalid("unterminated string literal");
                    }
                    if (expression.charAt(end) == '\'') {
                        if (end + 1 < n && expression.charAt(end + 1) == '\'') {
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    end++;
                }
                tokens.add(expression.substring(i, end + 1));
                i = end + 1;
            } else if ("=!<>".indexOf(c) >= 0) {
                int end = i + 1;
                if (end < n && expression.charAt(end) == '=' || (c == '<' && end < n && expression.charAt(end) == '>')) {
                    end++;
                }
                tokens.add(expression.substring(i, end));
                i = end;
            } else {
                int end = i;
                while (end < n && !Character.isWhitespace(expression.charAt(end))
                        && "()'=!<>".indexOf(expression.charAt(end)) < 0) {
                    end++;
                }
                tokens.add(expression.substring(i, end));
                i = end;
            }
        }
        return tokens;
    }

    private static SubscriptionConfigurationException invalid(String reason) {
        return new SubscriptionConfigurationException("Invalid filter: " + reason);
    }
}
