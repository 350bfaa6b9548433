package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.config.MarkupOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lexer O(N) de una sola pasada.
 * Convierte el markup crudo en una lista plana de tokens con posición
 * (offset, línea, columna) y una lista paralela de diagnósticos.
 * Nunca lanza excepciones por entrada mal formada: reporta y se resincroniza.
 */
public final class MarkupTokenizer {

    private static final Logger log = LoggerFactory.getLogger(MarkupTokenizer.class);

    private MarkupTokenizer() {}

    public static TokenizeResult tokenize(String input) {
        return tokenize(input, MarkupOptions.defaults());
    }

    public static TokenizeResult tokenize(String input, MarkupOptions options) {
        MarkupValidationException.requireNonNull(input, "input");
        MarkupValidationException.requireNonNull(options, "options");

        Scanner scanner = new Scanner(input, options);
        scanner.run();

        if (log.isDebugEnabled()) {
            log.debug("tokenized {} chars into {} tokens ({} diagnostics)",
                    input.length(), scanner.tokens.size(), scanner.diagnostics.size());
        }
        return new TokenizeResult(scanner.tokens, scanner.diagnostics);
    }

    /**
     * Estado de un solo escaneo. Se crea por llamada y se descarta al terminar.
     */
    private static final class Scanner {
        private final String input;
        private final int len;
        private final MarkupOptions options;

        private final List<Token> tokens = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private int pos = 0;
        private int line = 1;
        private int column = 1;

        // Marca del inicio del token actual
        private int markPos;
        private int markLine;
        private int markColumn;

        Scanner(String input, MarkupOptions options) {
            this.input = input;
            this.len = input.length();
            this.options = options;
        }

        void run() {
            while (pos < len) {
                if (peek() == '<') {
                    scanMarkup();
                } else {
                    scanText();
                }
            }
            mark();
            tokens.add(new EofToken(span()));
        }

        // ==============================================================
        // 1. Texto plano hasta el siguiente '<'
        // ==============================================================
        private void scanText() {
            mark();
            StringBuilder sb = new StringBuilder();
            while (pos < len && peek() != '<') {
                sb.append(advance());
            }
            String content = sb.toString();
            boolean significant = !content.isBlank() || options.isPreserveWhitespace();
            tokens.add(new TextToken(span(), content, significant));
        }

        // ==============================================================
        // 2. Todo lo que empieza por '<'
        // ==============================================================
        private void scanMarkup() {
            mark();
            advance(); // '<'

            if (peek() == '/') {
                scanEndTag();
            } else if (peek() == '!') {
                if (matches("!--")) {
                    scanComment();
                } else if (options.isRecognizeCDATA() && matches("![CDATA[")) {
                    scanCdata();
                } else if (input.regionMatches(true, pos, "!DOCTYPE", 0, 8)) {
                    scanDoctype();
                } else {
                    skipPast('>');
                    error("Malformed markup declaration");
                }
            } else if (isAsciiLetter(peek())) {
                scanStartTag();
            } else {
                skipPast('>');
                error("Malformed tag");
            }
        }

        private void scanEndTag() {
            advance(); // '/'
            String raw = readName();
            if (raw.isEmpty()) {
                skipPast('>');
                error("Malformed end tag");
                return;
            }
            String name = raw.toLowerCase(Locale.ROOT);
            skipWhitespace();
            if (peek() == '>') {
                advance();
            } else {
                skipPast('>');
                error("Expected '>' at end of end tag </" + name + ">");
            }
            tokens.add(new EndTagToken(span(), name, namespaceOf(name)));
        }

        private void scanStartTag() {
            String name = readName().toLowerCase(Locale.ROOT);
            Map<String, String> attributes = readAttributes();

            boolean selfClosing = false;
            if (peek() == '/') {
                advance();
                selfClosing = true;
            }

            if (peek() == '>') {
                advance();
            } else if (pos >= len) {
                error("Unexpected end of input inside <" + name + ">");
            } else {
                // Un '<' dentro del tag: lo dejamos para el siguiente ciclo
                error("Unterminated start tag <" + name + ">");
            }
            tokens.add(new StartTagToken(span(), name, namespaceOf(name), attributes, selfClosing));
        }

        private Map<String, String> readAttributes() {
            Map<String, String> attributes = new LinkedHashMap<>();
            while (pos < len) {
                skipWhitespace();
                char c = peek();
                if (c == '/' && peek(1) != '>' && pos + 1 < len) {
                    advance(); // '/' suelto dentro del tag
                    continue;
                }
                if (pos >= len || c == '>' || c == '/' || c == '<') break;

                String attrName = readAttributeName();
                if (attrName.isEmpty()) break;

                String value = "";
                skipWhitespace();
                if (peek() == '=') {
                    advance();
                    skipWhitespace();
                    value = readAttributeValue();
                }
                // El último duplicado gana
                attributes.put(attrName.toLowerCase(Locale.ROOT), value);
            }
            return attributes;
        }

        private String readAttributeName() {
            StringBuilder sb = new StringBuilder();
            while (pos < len) {
                char c = peek();
                if (Character.isWhitespace(c) || c == '=' || c == '>' || c == '/' || c == '<') break;
                sb.append(advance());
            }
            return sb.toString();
        }

        private String readAttributeValue() {
            char quote = peek();
            StringBuilder sb = new StringBuilder();
            if (quote == '"' || quote == '\'') {
                advance();
                while (pos < len) {
                    if (peek() == quote) {
                        advance();
                        return sb.toString();
                    }
                    sb.append(advance());
                }
                return sb.toString();
            }
            while (pos < len) {
                char c = peek();
                if (Character.isWhitespace(c) || c == '>') break;
                sb.append(advance());
            }
            return sb.toString();
        }

        private void scanComment() {
            advance(3); // '!--'
            StringBuilder sb = new StringBuilder();
            while (pos < len && !matches("-->")) {
                sb.append(advance());
            }
            boolean closed = pos < len;
            if (closed) advance(3);

            String body = sb.toString().trim();
            if (options.isRecognizeConditionalComments() && body.startsWith("[if") && body.indexOf(']') > 0) {
                String condition = body.substring(1, body.indexOf(']')).trim();
                tokens.add(new CommentToken(span(), body, true, condition));
            } else {
                tokens.add(new CommentToken(span(), body));
            }
            if (!closed) error("Unterminated comment");
        }

        private void scanCdata() {
            advance(8); // '![CDATA['
            StringBuilder sb = new StringBuilder();
            while (pos < len && !matches("]]>")) {
                sb.append(advance());
            }
            boolean closed = pos < len;
            if (closed) advance(3);
            tokens.add(new CdataToken(span(), sb.toString()));
            if (!closed) error("Unterminated CDATA section");
        }

        private void scanDoctype() {
            advance(8); // '!DOCTYPE'
            skipWhitespace();
            String name = readName();
            StringBuilder rest = new StringBuilder();
            while (pos < len && peek() != '>') {
                rest.append(advance());
            }
            boolean closed = pos < len;
            if (closed) advance();
            tokens.add(new DoctypeToken(span(), name, rest.toString().trim()));
            if (name.isEmpty()) warning("Doctype without a name");
            if (!closed) error("Unterminated doctype");
        }

        // ==============================================================
        // Utilidades del cursor
        // ==============================================================

        private String readName() {
            StringBuilder sb = new StringBuilder();
            while (pos < len && isNameChar(peek())) {
                sb.append(advance());
            }
            return sb.toString();
        }

        private String namespaceOf(String name) {
            if (!options.isXmlMode()) return null;
            int colon = name.indexOf(':');
            return colon > 0 ? name.substring(0, colon) : null;
        }

        private void skipWhitespace() {
            while (pos < len && Character.isWhitespace(peek())) {
                advance();
            }
        }

        // Avanza hasta pasar el primer '>' (o hasta el final) para no entrar en bucle
        private void skipPast(char target) {
            while (pos < len && peek() != target) {
                advance();
            }
            if (pos < len) advance();
        }

        private boolean matches(String s) {
            return input.startsWith(s, pos);
        }

        private char peek() {
            return peek(0);
        }

        private char peek(int offset) {
            int i = pos + offset;
            return i < len ? input.charAt(i) : 0;
        }

        private char advance() {
            char c = input.charAt(pos);
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
            return c;
        }

        private void advance(int n) {
            for (int i = 0; i < n && pos < len; i++) advance();
        }

        private void mark() {
            markPos = pos;
            markLine = line;
            markColumn = column;
        }

        private SourceSpan span() {
            return new SourceSpan(markPos, pos, markLine, markColumn);
        }

        private void error(String message) {
            report(Diagnostic.error(message, span()));
        }

        private void warning(String message) {
            report(Diagnostic.warning(message, span()));
        }

        private void report(Diagnostic d) {
            diagnostics.add(d);
            log.debug("{} at {}:{} - {}", d.severity(), d.line(), d.column(), d.message());
        }

        private static boolean isAsciiLetter(char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
        }

        private static boolean isNameChar(char c) {
            return isAsciiLetter(c) || (c >= '0' && c <= '9') || c == ':' || c == '-';
        }
    }
}
