package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.config.MarkupOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MarkupTokenizerTest {

    private static TokenizeResult lex(String input) {
        return MarkupTokenizer.tokenize(input, new MarkupOptions());
    }

    private static List<TokenType> types(TokenizeResult r) {
        return r.tokens().stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void emptyInputIsJustEof() {
        TokenizeResult r = lex("");
        assertEquals(1, r.tokens().size());
        Token eof = r.tokens().get(0);
        assertEquals(TokenType.EOF, eof.type());
        assertEquals(new SourceSpan(0, 0, 1, 1), eof.span());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void simpleDocumentProducesOrderedTokens() {
        String html = "<p>Hello <b>world</b></p>";
        TokenizeResult r = lex(html);

        assertEquals(List.of(TokenType.START_TAG, TokenType.TEXT, TokenType.START_TAG, TokenType.TEXT,
                TokenType.END_TAG, TokenType.END_TAG, TokenType.EOF), types(r));
        assertEquals(List.of(0, 3, 9, 12, 17, 21, 25),
                r.tokens().stream().map(Token::start).collect(Collectors.toList()));

        TextToken hello = (TextToken) r.tokens().get(1);
        assertEquals("Hello ", hello.content());
        assertFalse(hello.isWhitespace());
        assertTrue(hello.significant());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void tracksLinesAndColumns() {
        TokenizeResult r = lex("<a>\n  <b>");
        Token b = r.tokens().get(2);
        assertEquals(TokenType.START_TAG, b.type());
        assertEquals(6, b.start());
        assertEquals(2, b.span().line());
        assertEquals(3, b.span().column());

        Token eof = r.tokens().get(r.tokens().size() - 1);
        assertEquals(2, eof.span().line());
        assertEquals(6, eof.span().column());
    }

    @Test
    void attributesAreLowercasedAndLastDuplicateWins() {
        TokenizeResult r = lex("<DIV ID=\"a\" id='b' Class=x disabled>");
        StartTagToken div = (StartTagToken) r.tokens().get(0);

        assertEquals("div", div.name());
        assertEquals(Map.of("id", "b", "class", "x", "disabled", ""), div.attributes());
        assertFalse(div.selfClosing());
        assertNull(div.namespace());
    }

    @Test
    void detectsSelfClosingTags() {
        TokenizeResult r = lex("<br/><img src=\"a.png\" /><a / >");
        StartTagToken br = (StartTagToken) r.tokens().get(0);
        StartTagToken img = (StartTagToken) r.tokens().get(1);
        StartTagToken a = (StartTagToken) r.tokens().get(2);

        assertTrue(br.selfClosing());
        assertTrue(img.selfClosing());
        assertEquals("a.png", img.attributes().get("src"));
        assertFalse(a.selfClosing());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void commentsAreTrimmed() {
        TokenizeResult r = lex("<!--   a note  -->");
        CommentToken c = (CommentToken) r.tokens().get(0);
        assertEquals("a note", c.content());
        assertFalse(c.conditional());
        assertEquals(18, c.end());
    }

    @Test
    void conditionalCommentsCarryTheirCondition() {
        String html = "<!--[if IE]><p>x</p><![endif]-->";
        CommentToken c = (CommentToken) lex(html).tokens().get(0);
        assertTrue(c.conditional());
        assertEquals("if IE", c.condition());

        MarkupOptions off = new MarkupOptions();
        off.setRecognizeConditionalComments(false);
        CommentToken plain = (CommentToken) MarkupTokenizer.tokenize(html, off).tokens().get(0);
        assertFalse(plain.conditional());
        assertEquals("[if IE]><p>x</p><![endif]", plain.content());
    }

    @Test
    void cdataIsKeptVerbatim() {
        TokenizeResult r = lex("<![CDATA[a < b && c]]>");
        CdataToken cdata = (CdataToken) r.tokens().get(0);
        assertEquals("a < b && c", cdata.content());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void cdataCanBeDisabled() {
        MarkupOptions options = new MarkupOptions();
        options.setRecognizeCDATA(false);
        TokenizeResult r = MarkupTokenizer.tokenize("<![CDATA[x]]>", options);

        assertEquals(List.of(TokenType.EOF), types(r));
        assertEquals(1, r.diagnostics().size());
        assertEquals(Severity.ERROR, r.diagnostics().get(0).severity());
    }

    @Test
    void doctypeIsCaseInsensitive() {
        TokenizeResult r = lex("<!doctype html PUBLIC \"x\">");
        DoctypeToken d = (DoctypeToken) r.tokens().get(0);
        assertEquals("html", d.name());
        assertEquals("PUBLIC \"x\"", d.remainder());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void malformedTagReportsAndResynchronizes() {
        TokenizeResult r = lex("<1abc>text");

        assertEquals(List.of(TokenType.TEXT, TokenType.EOF), types(r));
        Diagnostic d = r.diagnostics().get(0);
        assertEquals(Severity.ERROR, d.severity());
        assertEquals(0, d.start());
        assertEquals(6, d.end());
        assertEquals(1, d.line());
        assertEquals(1, d.column());
    }

    @Test
    void endTagWithoutClosingBracketStillEmitsToken() {
        TokenizeResult r = lex("</div foo>x");

        assertEquals(List.of(TokenType.END_TAG, TokenType.TEXT, TokenType.EOF), types(r));
        assertEquals("div", ((EndTagToken) r.tokens().get(0)).name());
        assertEquals(1, r.diagnostics().size());
        assertEquals("x", ((TextToken) r.tokens().get(1)).content());
    }

    @Test
    void nulCharacterInsideTagDoesNotEndAttributes() {
        TokenizeResult r = lex("<a \u0000 b=\"x\">");

        assertEquals(List.of(TokenType.START_TAG, TokenType.EOF), types(r));
        StartTagToken a = (StartTagToken) r.tokens().get(0);
        assertEquals("x", a.attributes().get("b"));
        assertEquals(11, a.end());
        assertTrue(r.diagnostics().isEmpty());
    }

    @Test
    void unterminatedStartTagStopsAtNextTag() {
        TokenizeResult r = lex("<div <p>");

        assertEquals(List.of(TokenType.START_TAG, TokenType.START_TAG, TokenType.EOF), types(r));
        assertEquals("div", ((StartTagToken) r.tokens().get(0)).name());
        assertEquals("p", ((StartTagToken) r.tokens().get(1)).name());
        assertEquals(1, r.diagnostics().size());
    }

    @Test
    void whitespaceRunsAreFlaggedNotDropped() {
        TextToken ws = (TextToken) lex("<a> \n </a>").tokens().get(1);
        assertTrue(ws.isWhitespace());
        assertFalse(ws.significant());

        MarkupOptions preserve = new MarkupOptions();
        preserve.setPreserveWhitespace(true);
        TextToken kept = (TextToken) MarkupTokenizer.tokenize("<a> \n </a>", preserve).tokens().get(1);
        assertTrue(kept.isWhitespace());
        assertTrue(kept.significant());
    }

    @Test
    void xmlModeExposesNamespace() {
        MarkupOptions xml = new MarkupOptions();
        xml.setXmlMode(true);
        TokenizeResult r = MarkupTokenizer.tokenize("<svg:Rect/></svg:rect>", xml);

        StartTagToken start = (StartTagToken) r.tokens().get(0);
        EndTagToken end = (EndTagToken) r.tokens().get(1);
        assertEquals("svg:rect", start.name());
        assertEquals("svg", start.namespace());
        assertEquals("svg", end.namespace());
    }

    @ParameterizedTest
    @ValueSource(strings = {"<", "<<<", "<a", "</", "<!--", "<![CDATA[", "<!DOCTYPE", "<a b='",
            "a < b", "<a =x>", "<!x>", "</>", "<p>\r\n<!-- x -- y -->\n</p", "\u0000<a>\u0000"})
    void alwaysTerminatesWithSingleEofAtEnd(String input) {
        TokenizeResult r = lex(input);
        List<Token> tokens = r.tokens();

        Token last = tokens.get(tokens.size() - 1);
        assertEquals(TokenType.EOF, last.type());
        assertEquals(input.length(), last.start());
        assertEquals(input.length(), last.end());
        assertEquals(1, tokens.stream().filter(t -> t.type() == TokenType.EOF).count());

        int previous = 0;
        for (Token t : tokens) {
            assertTrue(t.start() >= previous, "offsets must not go backwards: " + t);
            previous = t.start();

            String before = input.substring(0, t.start());
            int line = 1 + (int) before.chars().filter(c -> c == '\n').count();
            int column = t.start() - (before.lastIndexOf('\n') + 1) + 1;
            assertEquals(line, t.span().line(), "line of " + t);
            assertEquals(column, t.span().column(), "column of " + t);
        }
    }

    @Test
    void rejectsNullInput() {
        assertThrows(MarkupValidationException.class, () -> MarkupTokenizer.tokenize(null));
    }

    @Test
    void tokenConstructionIsValidated() {
        assertThrows(MarkupValidationException.class, () -> new SourceSpan(-1, 0, 1, 1));
        assertThrows(MarkupValidationException.class, () -> new SourceSpan(5, 2, 1, 1));
        assertThrows(MarkupValidationException.class, () -> new SourceSpan(0, 0, 0, 1));

        SourceSpan span = new SourceSpan(0, 3, 1, 1);
        assertThrows(MarkupValidationException.class, () -> new StartTagToken(span, "", null, Map.of(), false));
        assertThrows(MarkupValidationException.class, () -> new StartTagToken(span, "a", null, null, false));
        assertThrows(MarkupValidationException.class, () -> new EofToken(span));
        assertThrows(MarkupValidationException.class, () -> new CommentToken(span, "x", true, null));
    }

    @Test
    void startTagAttributesAreReadOnly() {
        StartTagToken t = (StartTagToken) lex("<a href=x>").tokens().get(0);
        assertThrows(UnsupportedOperationException.class, () -> t.attributes().put("y", "z"));
    }
}
