package polyc.scop;

import polyc.hir.ArrayAccess;
import polyc.hir.AssignmentExpression;
import polyc.hir.AssignmentOperator;
import polyc.hir.BinaryExpression;
import polyc.hir.BinaryOperator;
import polyc.hir.ConditionalExpression;
import polyc.hir.Expression;
import polyc.hir.FloatLiteral;
import polyc.hir.FunctionCall;
import polyc.hir.Identifier;
import polyc.hir.IntegerLiteral;
import polyc.hir.UnaryExpression;
import polyc.hir.UnaryOperator;
import polyc.hir.UnsupportedInput;
import polyc.poly.Relation;
import polyc.poly.RelationReader;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
* Recursive-descent parser for the C expression of a statement body. Array
* references, uses of the statement iterators and uses of scalars listed as
* arrays become {@link AccessExpression}s; their access relations are built
* from the affine subscripts.
*/
class BodyParser {

    private static final String[] PUNCTUATORS = {
            "<<=", ">>=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
            "+", "-", "*", "/", "%", "<", ">", "=", "!", "~", "&", "|", "^",
            "?", ":", "(", ")", "[", "]", ","};

    private final String text;
    private final ScopStatementHeader header;
    private final Map<String, ScopArray> arrays;
    private final List<String> tokens;
    private int next;

    /** The name and iterators of the statement whose body is parsed. */
    static class ScopStatementHeader {
        final String name;
        final List<String> iterators;

        ScopStatementHeader(String name, List<String> iterators) {
            this.name = name;
            this.iterators = iterators;
        }
    }

    BodyParser(String text, ScopStatementHeader header,
            Map<String, ScopArray> arrays) {
        this.text = text;
        this.header = header;
        this.arrays = arrays;
        this.tokens = tokenize(text);
        this.next = 0;
    }

    /**
    * Parses the whole text as one expression.
    *
    * @throws UnsupportedInput if the text is not a supported expression.
    */
    Expression parse() {
        Expression e = expression();
        if (next < tokens.size()) {
            throw error("unexpected '" + tokens.get(next) + "'");
        }
        return e;
    }

    private static List<String> tokenize(String text) {
        List<String> ret = new ArrayList<String>();
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            int start = pos;
            if (Character.isLetter(c) || c == '_') {
                while (pos < text.length() &&
                       (Character.isLetterOrDigit(text.charAt(pos)) ||
                        text.charAt(pos) == '_')) {
                    pos++;
                }
            } else if (Character.isDigit(c) || (c == '.' &&
                       pos + 1 < text.length() &&
                       Character.isDigit(text.charAt(pos + 1)))) {
                while (pos < text.length() &&
                       (Character.isLetterOrDigit(text.charAt(pos)) ||
                        text.charAt(pos) == '.' ||
                        ((text.charAt(pos) == '+' || text.charAt(pos) == '-') &&
                         (text.charAt(pos - 1) == 'e' ||
                          text.charAt(pos - 1) == 'E') &&
                         isFloatPrefix(text.substring(start, pos))))) {
                    pos++;
                }
            } else {
                String match = null;
                for (String p : PUNCTUATORS) {
                    if (text.startsWith(p, pos)) {
                        match = p;
                        break;
                    }
                }
                if (match == null) {
                    throw new UnsupportedInput(
                            "unexpected character '" + c + "' in " + text);
                }
                pos += match.length();
            }
            ret.add(text.substring(start, pos));
        }
        return ret;
    }

    // Hexadecimal literals may hold an 'e' that is not an exponent.
    private static boolean isFloatPrefix(String s) {
        return !(s.startsWith("0x") || s.startsWith("0X"));
    }

    private String peek() {
        return (next < tokens.size()) ? tokens.get(next) : null;
    }

    private boolean accept(String s) {
        if (s.equals(peek())) {
            next++;
            return true;
        }
        return false;
    }

    private void expect(String s) {
        if (!accept(s)) {
            throw error("'" + s + "' expected");
        }
    }

    private UnsupportedInput error(String message) {
        return new UnsupportedInput(message + " in \"" + text + "\"");
    }

    private Expression expression() {
        Expression lhs = conditional();
        String tok = peek();
        AssignmentOperator op =
                (tok == null) ? null : AssignmentOperator.fromString(tok);
        if (op == null) {
            return lhs;
        }
        next++;
        if (lhs instanceof AccessExpression) {
            ((AccessExpression)lhs).setAccessType(
                    op != AssignmentOperator.NORMAL, true);
        } else {
            throw error("cannot assign to " + lhs);
        }
        Expression rhs = expression();
        return new AssignmentExpression(lhs, op, rhs);
    }

    private Expression conditional() {
        Expression cond = binary(0);
        if (!accept("?")) {
            return cond;
        }
        Expression t = expression();
        expect(":");
        Expression f = conditional();
        return new ConditionalExpression(cond, t, f);
    }

    // Precedence climbing over the C binary operators.
    private Expression binary(int min_prec) {
        Expression lhs = unary();
        while (true) {
            String tok = peek();
            BinaryOperator op =
                    (tok == null) ? null : BinaryOperator.fromString(tok);
            if (op == null || op.getPrecedence() < min_prec ||
                AssignmentOperator.fromString(tok) != null) {
                return lhs;
            }
            next++;
            Expression rhs = binary(op.getPrecedence() + 1);
            lhs = new BinaryExpression(lhs, op, rhs);
        }
    }

    private Expression unary() {
        String tok = peek();
        UnaryOperator op = (tok == null) ? null : UnaryOperator.fromString(tok);
        if (op != null) {
            next++;
            return new UnaryExpression(op, unary());
        }
        return postfix();
    }

    private Expression postfix() {
        String tok = peek();
        if (tok == null) {
            throw error("unexpected end");
        }
        if (accept("(")) {
            Expression e = expression();
            expect(")");
            e.setParens(true);
            return e;
        }
        if (Character.isDigit(tok.charAt(0)) || tok.charAt(0) == '.') {
            next++;
            return literal(tok);
        }
        if (!Character.isLetter(tok.charAt(0)) && tok.charAt(0) != '_') {
            throw error("unexpected '" + tok + "'");
        }
        next++;
        if (accept("(")) {
            List<Expression> args = new ArrayList<Expression>();
            if (!accept(")")) {
                do {
                    args.add(expression());
                } while (accept(","));
                expect(")");
            }
            return new FunctionCall(new Identifier(tok), args);
        }
        List<Expression> subscripts = new ArrayList<Expression>();
        while (accept("[")) {
            subscripts.add(subscript());
            expect("]");
        }
        if (!subscripts.isEmpty()) {
            ArrayAccess source = new ArrayAccess(new Identifier(tok), subscripts);
            return new AccessExpression(
                    accessRelation(tok, subscripts), true, false, source);
        }
        if (header.iterators.contains(tok)) {
            List<Expression> index = new ArrayList<Expression>(1);
            index.add(new Identifier(tok));
            return new AccessExpression(accessRelation(null, index),
                    true, false, new Identifier(tok));
        }
        ScopArray array = arrays.get(tok);
        if (array != null && array.getDimension() == 0) {
            return new AccessExpression(
                    accessRelation(tok, new ArrayList<Expression>(0)),
                    true, false, new Identifier(tok));
        }
        return new Identifier(tok);
    }

    // Subscripts are plain expressions; names inside are not accesses.
    private Expression subscript() {
        return new BodyParser(collectSubscript(), header, arrays).plain();
    }

    private String collectSubscript() {
        StringBuilder sb = new StringBuilder();
        int depth = 0;
        while (next < tokens.size()) {
            String tok = tokens.get(next);
            if (tok.equals("[") || tok.equals("(")) {
                depth++;
            } else if (tok.equals("]") || tok.equals(")")) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            sb.append(tok).append(" ");
            next++;
        }
        return sb.toString();
    }

    // Parses an expression without creating accesses.
    private Expression plain() {
        Expression e = plainBinary(0);
        if (next < tokens.size()) {
            throw error("unexpected '" + tokens.get(next) + "'");
        }
        return e;
    }

    private Expression plainBinary(int min_prec) {
        Expression lhs = plainUnary();
        while (true) {
            String tok = peek();
            BinaryOperator op =
                    (tok == null) ? null : BinaryOperator.fromString(tok);
            if (op == null || op.getPrecedence() < min_prec) {
                return lhs;
            }
            next++;
            Expression rhs = plainBinary(op.getPrecedence() + 1);
            lhs = new BinaryExpression(lhs, op, rhs);
        }
    }

    private Expression plainUnary() {
        String tok = peek();
        if (tok == null) {
            throw error("unexpected end");
        }
        UnaryOperator op = UnaryOperator.fromString(tok);
        if (op != null) {
            next++;
            return new UnaryExpression(op, plainUnary());
        }
        next++;
        if (tok.equals("(")) {
            Expression e = plainBinary(0);
            expect(")");
            e.setParens(true);
            return e;
        }
        if (Character.isDigit(tok.charAt(0))) {
            return literal(tok);
        }
        if (Character.isLetter(tok.charAt(0)) || tok.charAt(0) == '_') {
            return new Identifier(tok);
        }
        throw error("unexpected '" + tok + "' in subscript");
    }

    private Expression literal(String tok) {
        String digits = tok.replaceAll("[uUlL]+$", "");
        if (digits.matches("[0-9]+")) {
            try {
                return new IntegerLiteral(Long.parseLong(digits));
            } catch(NumberFormatException e) {
                throw error("integer literal too large: " + tok);
            }
        }
        return new FloatLiteral(tok);
    }

    /**
    * Builds the relation from the statement domain to the accessed element,
    * or to an unnamed tuple when <var>array</var> is null.
    */
    private Relation accessRelation(String array, List<Expression> index) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("{ ").append(header.name).append("[");
        for (int i = 0; i < header.iterators.size(); i++) {
            sb.append(i > 0 ? ", " : "").append(header.iterators.get(i));
        }
        sb.append("] -> ");
        if (array != null) {
            sb.append(array);
        }
        sb.append("[");
        for (int i = 0; i < index.size(); i++) {
            sb.append(i > 0 ? ", " : "").append(index.get(i));
        }
        sb.append("] }");
        try {
            return RelationReader.readRelation(sb.toString());
        } catch(UnsupportedInput e) {
            throw error("non-affine access " + (array == null ? "" : array) +
                    index + " (" + e.getMessage() + ")");
        }
    }

}
