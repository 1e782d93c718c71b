package nl.bytesoflife.seed.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<Token> tokenize(String text) {
        Source source = Source.of(text);
        List<Token> tokens = new ArrayList<>();
        int cursor = 0;
        while (true) {
            Tokenizer.Scan scan = Tokenizer.next(source, cursor);
            tokens.add(scan.token());
            if (scan.token().is(TokenType.END_OF_INPUT)) {
                return tokens;
            }
            cursor = scan.cursor();
        }
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    void classifiesParensIdentifiersAndStrings() {
        List<Token> tokens = tokenize("(add x \"y\")");
        assertEquals(List.of(TokenType.OPEN_PAREN, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                TokenType.STRING_LITERAL, TokenType.CLOSE_PAREN, TokenType.END_OF_INPUT), types(tokens));
        assertEquals("add", tokens.get(1).text());
        assertEquals("x", tokens.get(2).text());
        assertEquals("y", tokens.get(3).text());
    }

    @Test
    void endOfInputLeavesCursorInPlace() {
        Source source = Source.of("  ");
        Tokenizer.Scan first = Tokenizer.next(source, 0);
        assertEquals(TokenType.END_OF_INPUT, first.token().type());
        assertEquals(2, first.cursor());

        Tokenizer.Scan again = Tokenizer.next(source, first.cursor());
        assertEquals(TokenType.END_OF_INPUT, again.token().type());
        assertEquals(2, again.cursor());
    }

    @Test
    void parenAdvancesCursorByOne() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("(a"), 0);
        assertEquals(TokenType.OPEN_PAREN, scan.token().type());
        assertEquals(1, scan.cursor());
    }

    @Test
    void stringKeepsInteriorWhitespaceAndParens() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("\"a (b) c\" rest"), 0);
        assertEquals(TokenType.STRING_LITERAL, scan.token().type());
        assertEquals("a (b) c", scan.token().text());
        assertEquals(9, scan.cursor());
    }

    @Test
    void singleQuotedStringMayContainDoubleQuotes() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("'say \"hi\"'"), 0);
        assertEquals(TokenType.STRING_LITERAL, scan.token().type());
        assertEquals("say \"hi\"", scan.token().text());
    }

    @Test
    void emptyString() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("\"\""), 0);
        assertEquals(TokenType.STRING_LITERAL, scan.token().type());
        assertEquals("", scan.token().text());
        assertEquals(2, scan.cursor());
    }

    @Test
    void identifierStopsAtParenAndWhitespace() {
        List<Token> tokens = tokenize("foo(bar\tbaz)");
        assertEquals("foo", tokens.get(0).text());
        assertEquals(TokenType.OPEN_PAREN, tokens.get(1).type());
        assertEquals("bar", tokens.get(2).text());
        assertEquals("baz", tokens.get(3).text());
        assertEquals(TokenType.CLOSE_PAREN, tokens.get(4).type());
    }

    @Test
    void digitsAreIdentifiers() {
        List<Token> tokens = tokenize("12 -3.5");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("12", tokens.get(0).text());
        assertEquals("-3.5", tokens.get(1).text());
    }

    @Test
    void leadingBackslashIsDroppedFromIdentifier() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("\\foo bar"), 0);
        assertEquals(TokenType.IDENTIFIER, scan.token().type());
        assertEquals("foo", scan.token().text());
        assertEquals(4, scan.cursor());
    }

    @Test
    void backslashBeforeQuoteMakesAnIdentifierNotAString() {
        List<Token> tokens = tokenize("\\\"x y\"");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("\"x", tokens.get(0).text());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals("y\"", tokens.get(1).text());
    }

    @Test
    void quoteInsideIdentifierIsLiteral() {
        List<Token> tokens = tokenize("it's fine");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("it's", tokens.get(0).text());
        assertEquals("fine", tokens.get(1).text());
    }

    @Test
    void skipsAllWhitespaceKinds() {
        List<Token> tokens = tokenize(" \n\t\u000B\f a \n");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.END_OF_INPUT), types(tokens));
        assertEquals("a", tokens.get(0).text());
    }

    @Test
    void carriageReturnIsPartOfIdentifier() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("a\rb c"), 0);
        assertEquals(TokenType.IDENTIFIER, scan.token().type());
        assertEquals("a\rb", scan.token().text());
        assertEquals(3, scan.cursor());
    }

    @Test
    void loneCarriageReturnIsAnIdentifier() {
        List<Token> tokens = tokenize("a \r\n");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_INPUT), types(tokens));
        assertEquals("\r", tokens.get(1).text());
    }

    @Test
    void utf8IdentifierText() {
        List<Token> tokens = tokenize("(π \"grüße\")");
        assertEquals("π", tokens.get(1).text());
        assertEquals("grüße", tokens.get(2).text());
    }

    @Test
    void embeddedNulEndsInput() {
        List<Token> tokens = tokenize("a\u0000b");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.END_OF_INPUT), types(tokens));
        assertEquals("a", tokens.get(0).text());
    }

    @Test
    void controlCharacterStartsIdentifier() {
        Tokenizer.Scan scan = Tokenizer.next(Source.of("\u0001x y"), 0);
        assertEquals(TokenType.IDENTIFIER, scan.token().type());
        assertEquals("\u0001x", scan.token().text());
    }

    @Test
    void controlCharacterInsideIdentifierIsKept() {
        List<Token> tokens = tokenize("ab\u007Fcd)");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.CLOSE_PAREN, TokenType.END_OF_INPUT), types(tokens));
        assertEquals("ab\u007Fcd", tokens.get(0).text());
    }

    @Test
    void invalidUtf8DecodesToReplacementCharacter() {
        Source source = Source.of(new byte[]{'a', (byte) 0xFF, 'b'});
        Tokenizer.Scan scan = Tokenizer.next(source, 0);
        assertEquals(TokenType.IDENTIFIER, scan.token().type());
        assertEquals(3, scan.cursor());
        assertEquals("a\uFFFDb", scan.token().text());
    }

    @Test
    void unterminatedStringIsRejectedAtOpeningQuote() {
        Tokenizer.UnexpectedCharacterException e = assertThrows(
                Tokenizer.UnexpectedCharacterException.class,
                () -> tokenize("(a\n \"never closed)"));
        assertEquals("unterminated string literal", e.getMessage());
        assertEquals('"', e.getCharacter());
        assertEquals("2:2: unterminated string literal", e.getDiagnostic());
    }
}
