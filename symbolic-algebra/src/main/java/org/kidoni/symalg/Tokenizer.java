package org.kidoni.symalg;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import static java.lang.Character.isWhitespace;

/**
 * Splits expression text into tokens. Parentheses are always tokens of their own; any other run of
 * characters up to the next whitespace or parenthesis is one token, so {@code "(x*2)"} yields
 * {@code "("}, {@code "x*2"}, {@code ")"}. Whether a token is meaningful is for the {@link Parser} to decide.
 */
public class Tokenizer {
    public record Token(String text, int offset) {
        @Override
        public String toString() {
            return text;
        }
    }

    private final PushbackReader reader;
    private int offset;

    public Tokenizer(final Reader reader) {
        assert reader != null;
        this.reader = new PushbackReader(reader);
    }

    public static List<Token> tokenize(final String text) {
        return new Tokenizer(new StringReader(text)).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        try {
            Token token;
            while ((token = nextToken()) != null) {
                tokens.add(token);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("unable to read expression", e);
        }
        return tokens;
    }

    private Token nextToken() throws IOException {
        skipWhitespace();

        int start = offset;
        int c = read();
        if (c == -1) {
            return null;
        }
        if (isParenthesis(c)) {
            return new Token(String.valueOf((char) c), start);
        }

        StringBuilder buffer = new StringBuilder().append((char) c);
        while ((c = read()) != -1) {
            if (isWhitespace(c) || isParenthesis(c)) {
                unread(c);
                break;
            }
            buffer.append((char) c);
        }

        return new Token(buffer.toString(), start);
    }

    private void skipWhitespace() throws IOException {
        int c;
        while ((c = read()) != -1) {
            if (!isWhitespace(c)) {
                unread(c);
                break;
            }
        }
    }

    private int read() throws IOException {
        int c = reader.read();
        if (c != -1) {
            offset++;
        }
        return c;
    }

    private void unread(final int c) throws IOException {
        reader.unread(c);
        offset--;
    }

    private static boolean isParenthesis(final int c) {
        return c == '(' || c == ')';
    }
}
