package com.ciro.markup.parser;

import com.ciro.markup.ast.DocumentTree;
import com.ciro.markup.ast.MarkupNode;
import com.ciro.markup.ast.NodeType;
import com.ciro.markup.config.MarkupOptions;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Para documentos bien formados la estructura de elementos debe coincidir
 * con la del parser XML de Jsoup.
 */
class JsoupStructureTest {

    private static final String PAGE = """
            <html>
              <head>
                <title>Test Page</title>
              </head>
              <body>
                <!-- Navigation -->
                <nav class="menu">
                  <ul>
                    <li><a href="/">Home</a></li>
                    <li><a href="/about" title='about us'>About</a></li>
                  </ul>
                </nav>
                <div class="content" id="main">
                  <h1>Welcome!</h1>
                  <p>This is a <b>test</b> page.<br/></p>
                  <img src="logo.png" alt="logo"/>
                </div>
              </body>
            </html>
            """;

    @Test
    void elementStructureMatchesJsoup() {
        DocumentTree tree = new MarkupParser(new MarkupOptions()).parse(PAGE);
        assertTrue(tree.diagnostics().isEmpty());

        List<String> ours = new ArrayList<>();
        for (MarkupNode child : tree.root().children()) {
            describe(child, ours);
        }

        Document doc = Jsoup.parse(PAGE, "", Parser.xmlParser());
        List<String> theirs = new ArrayList<>();
        for (Element child : doc.children()) {
            describe(child, theirs);
        }

        assertEquals(theirs, ours);
        assertEquals(theirs.size(), tree.metadata().elementCount());
    }

    private static void describe(MarkupNode node, List<String> out) {
        if (node.type() != NodeType.ELEMENT) return;
        StringBuilder sb = new StringBuilder(node.name());
        node.attributes().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> sb.append(' ').append(e.getKey()).append('=').append(e.getValue()));
        sb.append(" children=").append(node.children().stream().filter(c -> c.type() == NodeType.ELEMENT).count());
        out.add(sb.toString());
        for (MarkupNode child : node.children()) {
            describe(child, out);
        }
    }

    private static void describe(Element el, List<String> out) {
        StringBuilder sb = new StringBuilder(el.tagName());
        el.attributes().asList().stream()
                .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
                .forEach(a -> sb.append(' ').append(a.getKey()).append('=').append(a.getValue()));
        sb.append(" children=").append(el.children().size());
        out.add(sb.toString());
        for (Element child : el.children()) {
            describe(child, out);
        }
    }
}
