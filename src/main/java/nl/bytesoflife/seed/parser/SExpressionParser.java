package nl.bytesoflife.seed.parser;

import nl.bytesoflife.seed.ast.Ast;
import nl.bytesoflife.seed.ast.AstArena;
import nl.bytesoflife.seed.ast.AstNode;
import nl.bytesoflife.seed.lexer.Lexer;
import nl.bytesoflife.seed.lexer.Source;
import nl.bytesoflife.seed.lexer.SourceException;
import nl.bytesoflife.seed.lexer.SourcePosition;
import nl.bytesoflife.seed.lexer.Token;
import nl.bytesoflife.seed.lexer.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for S-expressions. Every form must start with an
 * identifier or string operator, or be the empty form {@code ()}.
 * The first syntax error ends the parse; nothing partial is returned.
 */
public class SExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(SExpressionParser.class);

    public Ast parse(String text) {
        return parse(Source.of(text));
    }

    public Ast parse(byte[] content) {
        return parse(Source.of(content));
    }

    public Ast parse(Source source) {
        Lexer lexer = new Lexer(source);
        AstArena arena = new AstArena();
        List<Integer> roots = new ArrayList<>();

        while (!lexer.peek().is(TokenType.END_OF_INPUT)) {
            int root = parseExpression(lexer, arena);
            if (log.isTraceEnabled()) {
                log.trace("Parsed top-level form {}: {}", roots.size(), arena.format(root));
            }
            roots.add(root);
        }

        log.debug("Parsed {} top-level forms into {} nodes", roots.size(), arena.size());
        return new Ast(arena, roots);
    }

    /**
     * Parses one parenthesized form starting at the lexer's lookahead and returns
     * its handle. Children are inserted before their parent.
     */
    public int parseExpression(Lexer lexer, AstArena arena) {
        expect(lexer, TokenType.OPEN_PAREN, "expected `(`");

        Token operator = lexer.advance();
        if (operator.is(TokenType.CLOSE_PAREN)) {
            return arena.add(new AstNode.SEmpty());
        }
        if (!operator.is(TokenType.IDENTIFIER) && !operator.is(TokenType.STRING_LITERAL)) {
            throw new ParseException("expected identifier or string", lexer.positionOf(operator));
        }

        List<Integer> children = new ArrayList<>();
        while (!lexer.peek().is(TokenType.CLOSE_PAREN) && !lexer.peek().is(TokenType.END_OF_INPUT)) {
            Token next = lexer.peek();
            switch (next.type()) {
                case OPEN_PAREN -> children.add(parseExpression(lexer, arena));
                case IDENTIFIER -> children.add(arena.add(new AstNode.SIdentifier(lexer.advance())));
                case STRING_LITERAL -> children.add(arena.add(new AstNode.SString(lexer.advance())));
                default -> throw new ParseException("unexpected " + next.type(), lexer.positionOf(next));
            }
        }

        expect(lexer, TokenType.CLOSE_PAREN, "expected `)`");
        return arena.add(new AstNode.SList(operator, children));
    }

    private void expect(Lexer lexer, TokenType expected, String message) {
        Token token = lexer.advance();
        if (token.is(TokenType.END_OF_INPUT)) {
            throw new ParseException(message, lexer.position());
        }
        if (!token.is(expected)) {
            throw new ParseException(message, lexer.positionOf(token));
        }
    }

    public static class ParseException extends SourceException {

        public ParseException(String message, SourcePosition position) {
            super(message, position);
        }
    }
}
