package org.kidoni.symalg;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.kidoni.symalg.Tokenizer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for fully parenthesized expressions, the format produced by {@link Renderer#render(Expr)}.
 * <p>
 * Grammar:
 * <pre>
 *  Expr: NumExpr | VarExpr | '(' Expr Op Expr ')'
 *  NumExpr: '-'? ( [0-9]+ ('.' [0-9]*)? | '.' [0-9]+ ) ( [eE] [+-]? [0-9]+ )?
 *  VarExpr: [A-Za-z_] [A-Za-z0-9_]*
 *  Op: '+' | '-' | '*' | '/' | '**'
 * </pre>
 * Adjacent operands and operators must be separated by whitespace; parentheses need none, so
 * {@code (y +(x * 2))} is accepted. See {@link Tokenizer}.
 */
public class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private final List<Token> tokens;
    private int position;

    public Parser(final List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public static Expr parse(final String text) {
        return new Parser(Tokenizer.tokenize(text)).parse();
    }

    /**
     * @throws MalformedExpressionException if the tokens are not exactly one expression
     */
    public Expr parse() {
        Expr expr = parseExpr();

        if (position < tokens.size()) {
            Token extra = tokens.get(position);
            throw new MalformedExpressionException("unexpected token '" + extra + "' after end of expression", extra.offset());
        }

        LOG.debug("parsed {} tokens into {}", tokens.size(), expr);
        return expr;
    }

    private Expr parseExpr() {
        Token token = next("expression");

        if (token.text().equals("(")) {
            Expr left = parseExpr();
            Op op = parseOperator();
            Expr right = parseExpr();
            expectClose();
            return Expr.of(op, left, right);
        }

        return parseLeaf(token);
    }

    private Expr parseLeaf(final Token token) {
        String text = token.text();

        if (NUMBER.matcher(text).matches()) {
            try {
                return new Expr.NumExpr(new BigDecimal(text));
            }
            catch (IllegalArgumentException e) {
                // NumberFormatException included: the exponent is outside what BigDecimal can represent
                throw new MalformedExpressionException("number out of range '" + text + "'", token.offset(), e);
            }
        }
        if (Expr.VarExpr.isIdentifier(text)) {
            return new Expr.VarExpr(text);
        }

        throw new MalformedExpressionException("expected a number, variable or '(' but found '" + text + "'", token.offset());
    }

    private Op parseOperator() {
        Token token = next("operator");
        if (token.text().equals(")")) {
            throw new MalformedExpressionException("missing operator", token.offset());
        }

        return Op.fromSymbol(token.text())
                .orElseThrow(() -> new MalformedExpressionException("unknown operator '" + token + "'", token.offset()));
    }

    private void expectClose() {
        Token token = next("')'");
        if (!token.text().equals(")")) {
            throw new MalformedExpressionException("expected ')' but found '" + token + "'", token.offset());
        }
    }

    private Token next(final String expected) {
        if (position >= tokens.size()) {
            throw new MalformedExpressionException("unexpected end of input, expected " + expected);
        }
        return tokens.get(position++);
    }
}
