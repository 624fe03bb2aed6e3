package io.evalsandbox.core.runtime.datalog;

import io.evalsandbox.core.error.EvalSyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses Datalog program text into {@link Statement}s.
 *
 * <pre>
 * program   := statement*
 * statement := literal ( '.' | '?' | '~' ) | literal ':-' literal ( ',' literal )* '.'
 * literal   := IDENT [ '(' term ( ',' term )* ')' ]
 * term      := VARIABLE | IDENT | STRING | INTEGER
 * </pre>
 *
 * <p>
 * {@code %} starts a comment running to the end of the line. Each {@code _} is a fresh anonymous variable.
 * Besides grammar errors, the parser rejects non-ground facts and retractions, and rules whose head uses a
 * variable that no body literal mentions.
 */
final class DatalogParser {

    private enum TokenType {
        IDENT,
        VARIABLE,
        STRING,
        INTEGER,
        LPAREN,
        RPAREN,
        COMMA,
        DOT,
        QUESTION,
        TILDE,
        IMPLIES,
        EOF
    }

    private record Token(TokenType type, String text, int line, int column) {}

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int anonymousCount;

    private DatalogParser(String source) {
        this.source = source;
    }

    /**
     * Parses a whole program.
     *
     * @throws EvalSyntaxException on the first malformed or unsafe statement
     */
    static List<Statement> parse(String source) {
        DatalogParser parser = new DatalogParser(source);
        parser.tokenize();
        return parser.program();
    }

    // --- Parsing ---

    private List<Statement> program() {
        List<Statement> statements = new ArrayList<>();
        while (peek().type() != TokenType.EOF) {
            statements.add(statement());
        }
        return statements;
    }

    private Statement statement() {
        Token start = peek();
        Literal head = literal();
        Token terminator = next();
        switch (terminator.type()) {
            case DOT -> {
                if (!head.isGround()) {
                    throw error(start, "fact " + head + " must be ground");
                }
                return new Statement(Statement.Kind.ASSERT, new Clause(head, List.of()), start.line(), start.column());
            }
            case QUESTION -> {
                return new Statement(Statement.Kind.QUERY, new Clause(head, List.of()), start.line(), start.column());
            }
            case TILDE -> {
                if (!head.isGround()) {
                    throw error(start, "retraction " + head + " must be ground");
                }
                return new Statement(Statement.Kind.RETRACT, new Clause(head, List.of()), start.line(), start.column());
            }
            case IMPLIES -> {
                List<Literal> body = new ArrayList<>();
                body.add(literal());
                while (peek().type() == TokenType.COMMA) {
                    next();
                    body.add(literal());
                }
                expect(TokenType.DOT, "'.' or ',' in rule body");
                Clause rule = new Clause(head, body);
                checkRangeRestricted(rule, start);
                return new Statement(Statement.Kind.ASSERT, rule, start.line(), start.column());
            }
            default -> throw error(terminator, "expected '.', '?', '~' or ':-' after " + head + " but found "
                    + describe(terminator));
        }
    }

    private Literal literal() {
        Token name = expect(TokenType.IDENT, "predicate name");
        List<Term> args = new ArrayList<>();
        if (peek().type() == TokenType.LPAREN) {
            next();
            args.add(term());
            while (peek().type() == TokenType.COMMA) {
                next();
                args.add(term());
            }
            expect(TokenType.RPAREN, "',' or ')' in argument list");
        }
        return new Literal(name.text(), args);
    }

    private Term term() {
        Token token = next();
        return switch (token.type()) {
            case VARIABLE -> "_".equals(token.text())
                    ? new Term.Var("_G" + (++anonymousCount))
                    : new Term.Var(token.text());
            case IDENT -> new Term.Symbol(token.text());
            case STRING -> new Term.Str(token.text());
            case INTEGER -> {
                try {
                    yield new Term.Int(Long.parseLong(token.text()));
                } catch (NumberFormatException e) {
                    throw error(token, "integer out of range: " + token.text());
                }
            }
            default -> throw error(token, "expected a term but found " + describe(token));
        };
    }

    private static void checkRangeRestricted(Clause rule, Token start) {
        Set<Term.Var> bodyVars = new LinkedHashSet<>();
        for (Literal literal : rule.body()) {
            for (Term arg : literal.args()) {
                if (arg instanceof Term.Var v) {
                    bodyVars.add(v);
                }
            }
        }
        for (Term arg : rule.head().args()) {
            if (arg instanceof Term.Var v && !bodyVars.contains(v)) {
                throw error(start, "unsafe rule: variable " + v + " in head " + rule.head()
                        + " does not occur in the body");
            }
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token token = tokens.get(pos);
        if (token.type() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenType type, String expected) {
        Token token = next();
        if (token.type() != type) {
            throw error(token, "expected " + expected + " but found " + describe(token));
        }
        return token;
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
    }

    private static EvalSyntaxException error(Token at, String message) {
        return new EvalSyntaxException(
                "syntax error at line " + at.line() + ", column " + at.column() + ": " + message,
                at.line(),
                at.column());
    }

    // --- Lexing ---

    private void tokenize() {
        int i = 0;
        int line = 1;
        int lineStart = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            int column = i - lineStart + 1;
            if (c == '\n') {
                line++;
                lineStart = i + 1;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '%') {
                while (i < source.length() && source.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", line, column));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", line, column));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", line, column));
                i++;
            } else if (c == '.') {
                tokens.add(new Token(TokenType.DOT, ".", line, column));
                i++;
            } else if (c == '?') {
                tokens.add(new Token(TokenType.QUESTION, "?", line, column));
                i++;
            } else if (c == '~') {
                tokens.add(new Token(TokenType.TILDE, "~", line, column));
                i++;
            } else if (c == ':' && i + 1 < source.length() && source.charAt(i + 1) == '-') {
                tokens.add(new Token(TokenType.IMPLIES, ":-", line, column));
                i += 2;
            } else if (c == '"') {
                i = lexString(i, line, column);
            } else if (Character.isDigit(c)
                    || (c == '-' && i + 1 < source.length() && Character.isDigit(source.charAt(i + 1)))) {
                int end = i + 1;
                while (end < source.length() && Character.isDigit(source.charAt(end))) {
                    end++;
                }
                tokens.add(new Token(TokenType.INTEGER, source.substring(i, end), line, column));
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i + 1;
                while (end < source.length()
                        && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
                    end++;
                }
                String word = source.substring(i, end);
                TokenType type = Character.isUpperCase(c) || c == '_' ? TokenType.VARIABLE : TokenType.IDENT;
                tokens.add(new Token(type, word, line, column));
                i = end;
            } else {
                throw new EvalSyntaxException(
                        "syntax error at line " + line + ", column " + column + ": unexpected character '" + c + "'",
                        line,
                        column);
            }
        }
        int column = source.length() - lineStart + 1;
        tokens.add(new Token(TokenType.EOF, "", line, column));
    }

    /** Lexes a string literal starting at the opening quote; returns the index after the closing quote. */
    private int lexString(int start, int line, int column) {
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '"') {
                tokens.add(new Token(TokenType.STRING, value.toString(), line, column));
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\' && i + 1 < source.length()) {
                char escaped = source.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '"' -> value.append('"');
                    case '\\' -> value.append('\\');
                    default -> throw new EvalSyntaxException(
                            "syntax error at line " + line + ", column " + (column + i - start)
                                    + ": unknown escape '\\" + escaped + "'",
                            line,
                            column + i - start);
                }
                i += 2;
            } else {
                value.append(c);
                i++;
            }
        }
        throw new EvalSyntaxException(
                "syntax error at line " + line + ", column " + column + ": unterminated string", line, column);
    }
}
