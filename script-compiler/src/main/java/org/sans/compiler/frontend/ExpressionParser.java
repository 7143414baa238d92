package org.sans.compiler.frontend;

import org.sans.compiler.errors.CompilationError;
import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.expression.BinaryExpression;
import org.sans.compiler.ir.expression.BoolExpression;
import org.sans.compiler.ir.expression.CallExpression;
import org.sans.compiler.ir.expression.ColumnExpression;
import org.sans.compiler.ir.expression.Expression;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.expression.LookupExpression;
import org.sans.compiler.ir.expression.UnaryExpression;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Precedence-climbing parser for the expression language shared by both dialects.
 * From loosest to tightest: or, and, not, comparisons, + -, * /, unary + -. */
public class ExpressionParser {
    static final int OR = 1;
    static final int AND = 2;
    static final int NOT = 3;
    static final int COMPARE = 4;
    static final int ADDITIVE = 5;
    static final int MULTIPLICATIVE = 6;
    static final int UNARY = 7;

    private final String text;
    private final Dialect dialect;
    private final SourcePositionRange range;
    /** Named scalar constants, folded into the expression as literals. */
    private final Map<String, LiteralExpression> constants;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String text, Dialect dialect, SourcePositionRange range,
                            Map<String, LiteralExpression> constants) {
        this.text = text;
        this.dialect = dialect;
        this.range = range;
        this.constants = constants;
        this.tokens = new ExpressionLexer(text, dialect, range).tokenize();
        this.index = 0;
    }

    /** Parse a complete expression. */
    public static Expression parse(String text, Dialect dialect, SourcePositionRange range) {
        return parse(text, dialect, range, Map.of());
    }

    public static Expression parse(String text, Dialect dialect, SourcePositionRange range,
                                   Map<String, LiteralExpression> constants) {
        return new ExpressionParser(text, dialect, range, constants).parseAll();
    }

    CompilationError error(String message) {
        return new CompilationError(ErrorCode.EXPRESSION_ERROR,
                message + " in expression " + this.text.strip(), this.range);
    }

    Token current() {
        return this.tokens.get(this.index);
    }

    Token advance() {
        Token result = this.current();
        if (result.kind != Token.Kind.END)
            this.index++;
        return result;
    }

    void expect(Token.Kind kind, String what) {
        Token token = this.advance();
        if (token.kind != kind)
            throw this.error("Expected " + what + " but found " + token);
    }

    public Expression parseAll() {
        if (this.current().kind == Token.Kind.END)
            throw this.error("Empty expression");
        Expression result = this.parseExpression(OR);
        if (this.current().kind != Token.Kind.END)
            throw this.error("Unexpected " + this.current() + " after expression");
        return result;
    }

    boolean legacy() {
        return this.dialect == Dialect.LEGACY;
    }

    /** Comparison opcode of a token, or null if the token is not a comparison. */
    @Nullable
    BinaryExpression.Opcode comparison(Token token) {
        if (token.kind == Token.Kind.OPERATOR) {
            switch (token.text) {
                case "==": return BinaryExpression.Opcode.EQ;
                case "!=": return BinaryExpression.Opcode.NEQ;
                case "<": return BinaryExpression.Opcode.LT;
                case "<=": return BinaryExpression.Opcode.LTE;
                case ">": return BinaryExpression.Opcode.GT;
                case ">=": return BinaryExpression.Opcode.GTE;
                case "=":
                    if (this.legacy())
                        return BinaryExpression.Opcode.EQ;
                    throw this.error("'=' is not a comparison; use '=='");
                case "^=":
                case "~=":
                    if (this.legacy())
                        return BinaryExpression.Opcode.NEQ;
                    throw this.error("Unsupported operator " + token + "; use '!='");
                case "<>":
                    throw this.error("Unsupported operator '<>'");
                default:
                    return null;
            }
        }
        if (token.kind == Token.Kind.IDENTIFIER && this.legacy()) {
            switch (token.text.toLowerCase()) {
                case "eq": return BinaryExpression.Opcode.EQ;
                case "ne": return BinaryExpression.Opcode.NEQ;
                case "lt": return BinaryExpression.Opcode.LT;
                case "le": return BinaryExpression.Opcode.LTE;
                case "gt": return BinaryExpression.Opcode.GT;
                case "ge": return BinaryExpression.Opcode.GTE;
                default: return null;
            }
        }
        return null;
    }

    /** Precedence of an infix token; 0 if the token is not an infix operator. */
    int precedence(Token token) {
        if (token.isWord("or"))
            return OR;
        if (token.isWord("and"))
            return AND;
        if (this.comparison(token) != null)
            return COMPARE;
        if (token.kind == Token.Kind.OPERATOR) {
            switch (token.text) {
                case "+": case "-": return ADDITIVE;
                case "*": case "/": return MULTIPLICATIVE;
                default: return 0;
            }
        }
        return 0;
    }

    Expression parseExpression(int minPrecedence) {
        Expression left = this.parsePrefix();
        while (true) {
            Token op = this.current();
            int precedence = this.precedence(op);
            if (precedence == 0 || precedence < minPrecedence)
                break;
            this.advance();
            Expression right = this.parseExpression(precedence + 1);
            if (precedence == OR) {
                left = new BoolExpression(BoolExpression.Opcode.OR, List.of(left, right));
            } else if (precedence == AND) {
                left = new BoolExpression(BoolExpression.Opcode.AND, List.of(left, right));
            } else if (precedence == COMPARE) {
                left = new BinaryExpression(this.comparison(op), left, right);
            } else {
                left = new BinaryExpression(arithmetic(op.text), left, right);
            }
        }
        return left;
    }

    static BinaryExpression.Opcode arithmetic(String text) {
        BinaryExpression.Opcode result = BinaryExpression.Opcode.fromText(text);
        if (result == null || !result.isArithmetic())
            throw new CompilationError(ErrorCode.EXPRESSION_ERROR, "Not an arithmetic operator: " + text);
        return result;
    }

    Expression parsePrefix() {
        Token token = this.advance();
        switch (token.kind) {
            case NUMBER:
                return this.number(token);
            case STRING:
                return LiteralExpression.of(token.text);
            case MISSING:
                return LiteralExpression.NULL;
            case LPAREN: {
                Expression inner = this.parseExpression(OR);
                this.expect(Token.Kind.RPAREN, "')'");
                return inner;
            }
            case OPERATOR:
                if (token.text.equals("-"))
                    return new UnaryExpression(UnaryExpression.Opcode.MINUS, this.parseExpression(UNARY));
                if (token.text.equals("+"))
                    return new UnaryExpression(UnaryExpression.Opcode.PLUS, this.parseExpression(UNARY));
                throw this.error("Unexpected operator " + token);
            case IDENTIFIER:
                return this.identifier(token);
            case FORMAT:
                throw this.error("Format name " + token + " outside of put() or input()");
            case END:
                throw this.error("Unexpected end of expression");
            default:
                throw this.error("Unexpected " + token);
        }
    }

    Expression number(Token token) {
        String value = token.text;
        if (value.contains(".")) {
            if (value.endsWith("."))
                value = value.substring(0, value.length() - 1);
            return LiteralExpression.of(new BigDecimal(value));
        }
        try {
            return LiteralExpression.of(Long.parseLong(value));
        } catch (NumberFormatException ex) {
            throw this.error("Integer literal out of range: " + value);
        }
    }

    Expression identifier(Token token) {
        String lower = token.text.toLowerCase();
        if (lower.equals("not"))
            return new UnaryExpression(UnaryExpression.Opcode.NOT, this.parseExpression(NOT));
        if (lower.equals("null"))
            return LiteralExpression.NULL;
        if (!this.legacy()) {
            if (lower.equals("true"))
                return LiteralExpression.of(true);
            if (lower.equals("false"))
                return LiteralExpression.of(false);
        }
        if (this.current().kind == Token.Kind.LPAREN)
            return this.call(lower);
        LiteralExpression constant = this.constants.get(token.text);
        if (constant != null)
            return constant;
        return new ColumnExpression(token.text);
    }

    Expression call(String name) {
        this.expect(Token.Kind.LPAREN, "'('");
        switch (name) {
            case "put": {
                Expression key = this.parseExpression(OR);
                this.expect(Token.Kind.COMMA, "','");
                String format = this.formatName(false);
                this.expect(Token.Kind.RPAREN, "')'");
                return new LookupExpression(format, key);
            }
            case "input": {
                Expression value = this.parseExpression(OR);
                this.expect(Token.Kind.COMMA, "','");
                String informat = this.formatName(true);
                this.expect(Token.Kind.RPAREN, "')'");
                return new CallExpression(CallExpression.Function.INPUT,
                        List.of(value, LiteralExpression.of(informat)));
            }
            case "coalesce":
            case "if": {
                List<Expression> args = new ArrayList<>();
                if (this.current().kind != Token.Kind.RPAREN) {
                    args.add(this.parseExpression(OR));
                    while (this.current().kind == Token.Kind.COMMA) {
                        this.advance();
                        args.add(this.parseExpression(OR));
                    }
                }
                this.expect(Token.Kind.RPAREN, "')'");
                CallExpression.Function function = CallExpression.Function.fromText(name);
                if (function == CallExpression.Function.IF && args.size() != 3)
                    throw this.error("if() requires 3 arguments, got " + args.size());
                if (function == CallExpression.Function.COALESCE && args.isEmpty())
                    throw this.error("coalesce() requires at least one argument");
                return new CallExpression(function, args);
            }
            default:
                throw this.error("Unsupported function '" + name + "'");
        }
    }

    /** The name of a format or informat argument, lowercase, without trailing dot. */
    String formatName(boolean informat) {
        Token token = this.advance();
        switch (token.kind) {
            case FORMAT:
            case IDENTIFIER:
                return token.text.toLowerCase();
            case STRING:
                return token.text.toLowerCase().replaceAll("\\.$", "");
            case NUMBER:
                if (informat)
                    return token.text.replaceAll("\\.$", "");
                break;
            default:
                break;
        }
        throw this.error("Expected a " + (informat ? "informat" : "format") + " name but found " + token);
    }
}
