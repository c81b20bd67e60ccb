package com.openforge.mnemosyne.vector.local;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Parser for the scalar filter subset used against memory collections.
 *
 * Grammar:
 *
 *   expr    := clause ( "and" clause )*
 *   clause  := IDENT op literal
 *   op      := == | != | > | >= | < | <=
 *   literal := "string" | number | true | false
 *
 * Strings use double quotes with backslash escapes. A blank expression
 * matches every row. A clause on a missing field never matches.
 */
public final class FilterExpression implements Predicate<Map<String, Object>> {

    private static final FilterExpression MATCH_ALL = new FilterExpression(List.of());

    private final List<Clause> clauses;

    private FilterExpression(List<Clause> clauses) {
        this.clauses = clauses;
    }

    public static FilterExpression parse(String expression) {
        if (expression == null || expression.isBlank()) return MATCH_ALL;
        return new Parser(expression).parse();
    }

    @Override
    public boolean test(Map<String, Object> row) {
        for (Clause c : clauses) {
            if (!c.matches(row)) return false;
        }
        return true;
    }

    // ── Clause ───────────────────────────────────────────────────────────────

    private record Clause(String field, String op, Object literal) {

        boolean matches(Map<String, Object> row) {
            Object value = row.get(field);
            if (value == null) return false;
            int cmp;
            if (literal instanceof BigDecimal num) {
                if (!(value instanceof Number n)) return false;
                cmp = new BigDecimal(n.toString()).compareTo(num);
            } else if (literal instanceof Boolean b) {
                if (!(value instanceof Boolean v)) return false;
                cmp = Boolean.compare(v, b);
            } else {
                cmp = value.toString().compareTo((String) literal);
            }
            return switch (op) {
                case "==" -> cmp == 0;
                case "!=" -> cmp != 0;
                case ">"  -> cmp > 0;
                case ">=" -> cmp >= 0;
                case "<"  -> cmp < 0;
                case "<=" -> cmp <= 0;
                default   -> throw new IllegalStateException("Unknown operator " + op);
            };
        }
    }

    // ── Parser ───────────────────────────────────────────────────────────────

    private static final class Parser {

        private final String src;
        private int pos;

        Parser(String src) {
            this.src = src;
        }

        FilterExpression parse() {
            List<Clause> clauses = new ArrayList<>();
            clauses.add(clause());
            skipSpace();
            while (pos < src.length()) {
                expectKeyword("and");
                clauses.add(clause());
                skipSpace();
            }
            return new FilterExpression(List.copyOf(clauses));
        }

        private Clause clause() {
            String field = identifier();
            String op = operator();
            Object literal = literal();
            return new Clause(field, op, literal);
        }

        private String identifier() {
            skipSpace();
            int start = pos;
            while (pos < src.length()
                    && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
            if (start == pos) throw error("field name expected");
            return src.substring(start, pos);
        }

        private String operator() {
            skipSpace();
            for (String op : new String[]{"==", "!=", ">=", "<=", ">", "<"}) {
                if (src.startsWith(op, pos)) {
                    pos += op.length();
                    return op;
                }
            }
            throw error("comparison operator expected");
        }

        private Object literal() {
            skipSpace();
            if (pos >= src.length()) throw error("literal expected");
            char c = src.charAt(pos);
            if (c == '"') return string();
            if (src.startsWith("true", pos))  { pos += 4; return Boolean.TRUE; }
            if (src.startsWith("false", pos)) { pos += 5; return Boolean.FALSE; }
            int start = pos;
            if (c == '-' || c == '+') pos++;
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) pos++;
            if (start == pos) throw error("literal expected");
            try {
                return new BigDecimal(src.substring(start, pos));
            } catch (NumberFormatException e) {
                throw error("invalid number '" + src.substring(start, pos) + "'");
            }
        }

        private String string() {
            StringBuilder sb = new StringBuilder();
            pos++;
            while (pos < src.length()) {
                char c = src.charAt(pos++);
                if (c == '\\' && pos < src.length()) {
                    sb.append(src.charAt(pos++));
                } else if (c == '"') {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            throw error("unterminated string");
        }

        private void expectKeyword(String keyword) {
            skipSpace();
            if (!src.regionMatches(true, pos, keyword, 0, keyword.length())) {
                throw error("'" + keyword + "' expected");
            }
            pos += keyword.length();
        }

        private void skipSpace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(
                    "Invalid filter expression at %d: %s in [%s]".formatted(pos, message, src));
        }
    }
}
