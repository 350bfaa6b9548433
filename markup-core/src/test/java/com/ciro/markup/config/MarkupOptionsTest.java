package com.ciro.markup.config;

import com.ciro.markup.MarkupValidationException;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MarkupOptionsTest {

    @Test
    void defaultsComeFromClasspathResource() {
        MarkupOptions o = MarkupOptions.defaults();
        assertFalse(o.isXmlMode());
        assertTrue(o.isRecognizeCDATA());
        assertTrue(o.isRecognizeConditionalComments());
        assertFalse(o.isPreserveWhitespace());
        assertTrue(o.isAllowUnclosedTags());
    }

    @Test
    void propertiesOverrideOnlyTheGivenKeys() {
        Properties props = new Properties();
        props.setProperty(MarkupOptions.XML_MODE, "TRUE");
        props.setProperty(MarkupOptions.ALLOW_UNCLOSED_TAGS, " false ");
        props.setProperty("markup.tokenizer.unknown", "whatever");

        MarkupOptions o = MarkupOptions.fromProperties(props);
        assertTrue(o.isXmlMode());
        assertFalse(o.isAllowUnclosedTags());
        assertTrue(o.isRecognizeCDATA());
        assertFalse(o.isPreserveWhitespace());
    }

    @Test
    void rejectsNonBooleanValues() {
        Properties props = new Properties();
        props.setProperty(MarkupOptions.PRESERVE_WHITESPACE, "yes");
        assertThrows(MarkupValidationException.class, () -> MarkupOptions.fromProperties(props));
    }

    @Test
    void copyIsIndependent() {
        MarkupOptions o = new MarkupOptions();
        MarkupOptions c = o.copy();
        c.setPreserveWhitespace(true);
        assertFalse(o.isPreserveWhitespace());
        assertTrue(c.isPreserveWhitespace());
    }
}
