package com.ciro.markup.config;

import com.ciro.markup.MarkupValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Opciones del tokenizador y del constructor del árbol.
 * Cada invocación recibe su propia instancia; no hay estado global.
 */
public class MarkupOptions {

    private static final Logger log = LoggerFactory.getLogger(MarkupOptions.class);

    public static final String DEFAULTS_RESOURCE = "markup-defaults.properties";

    public static final String XML_MODE = "markup.tokenizer.xml-mode";
    public static final String RECOGNIZE_CDATA = "markup.tokenizer.recognize-cdata";
    public static final String RECOGNIZE_CONDITIONAL_COMMENTS = "markup.tokenizer.recognize-conditional-comments";
    public static final String PRESERVE_WHITESPACE = "markup.tokenizer.preserve-whitespace";
    public static final String ALLOW_UNCLOSED_TAGS = "markup.parser.allow-unclosed-tags";

    /** Separa {@code ns:local} y expone el prefijo como namespace */
    private boolean xmlMode = false;
    /** Reconoce {@code <![CDATA[ ... ]]>} */
    private boolean recognizeCDATA = true;
    /** Reconoce {@code <!--[if ...]> ... <![endif]-->} */
    private boolean recognizeConditionalComments = true;
    /** Conserva el texto que solo contiene espacios */
    private boolean preserveWhitespace = false;
    /** Si es false, los elementos abiertos al llegar a EOF se reportan como error */
    private boolean allowUnclosedTags = true;

    public boolean isXmlMode() { return xmlMode; }
    public void setXmlMode(boolean xmlMode) { this.xmlMode = xmlMode; }

    public boolean isRecognizeCDATA() { return recognizeCDATA; }
    public void setRecognizeCDATA(boolean recognizeCDATA) { this.recognizeCDATA = recognizeCDATA; }

    public boolean isRecognizeConditionalComments() { return recognizeConditionalComments; }
    public void setRecognizeConditionalComments(boolean recognizeConditionalComments) { this.recognizeConditionalComments = recognizeConditionalComments; }

    public boolean isPreserveWhitespace() { return preserveWhitespace; }
    public void setPreserveWhitespace(boolean preserveWhitespace) { this.preserveWhitespace = preserveWhitespace; }

    public boolean isAllowUnclosedTags() { return allowUnclosedTags; }
    public void setAllowUnclosedTags(boolean allowUnclosedTags) { this.allowUnclosedTags = allowUnclosedTags; }

    /**
     * Opciones por defecto, leídas de {@value #DEFAULTS_RESOURCE} si está en el classpath.
     */
    public static MarkupOptions defaults() {
        MarkupOptions options = new MarkupOptions();
        try (InputStream in = MarkupOptions.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return options;
            }
            Properties props = new Properties();
            props.load(in);
            return options.apply(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    public static MarkupOptions fromProperties(Properties props) {
        return defaults().apply(props);
    }

    /**
     * Sobrescribe solo las claves presentes. Las claves desconocidas se ignoran.
     */
    public MarkupOptions apply(Properties props) {
        MarkupValidationException.requireNonNull(props, "props");
        xmlMode = bool(props, XML_MODE, xmlMode);
        recognizeCDATA = bool(props, RECOGNIZE_CDATA, recognizeCDATA);
        recognizeConditionalComments = bool(props, RECOGNIZE_CONDITIONAL_COMMENTS, recognizeConditionalComments);
        preserveWhitespace = bool(props, PRESERVE_WHITESPACE, preserveWhitespace);
        allowUnclosedTags = bool(props, ALLOW_UNCLOSED_TAGS, allowUnclosedTags);
        return this;
    }

    public MarkupOptions copy() {
        MarkupOptions c = new MarkupOptions();
        c.xmlMode = xmlMode;
        c.recognizeCDATA = recognizeCDATA;
        c.recognizeConditionalComments = recognizeConditionalComments;
        c.preserveWhitespace = preserveWhitespace;
        c.allowUnclosedTags = allowUnclosedTags;
        return c;
    }

    private static boolean bool(Properties props, String key, boolean current) {
        String raw = props.getProperty(key);
        if (raw == null) return current;
        String v = raw.trim();
        if (v.equalsIgnoreCase("true")) return true;
        if (v.equalsIgnoreCase("false")) return false;
        throw new MarkupValidationException("Property " + key + " must be true or false, got '" + raw + "'");
    }

    @Override
    public String toString() {
        return "MarkupOptions{xmlMode=" + xmlMode
                + ", recognizeCDATA=" + recognizeCDATA
                + ", recognizeConditionalComments=" + recognizeConditionalComments
                + ", preserveWhitespace=" + preserveWhitespace
                + ", allowUnclosedTags=" + allowUnclosedTags + '}';
    }
}
