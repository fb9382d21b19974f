package com.stackfit.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnswerSequenceTest {

    @Test
    void everyAnswerEndsWithNewline() {
        AnswerSequence a = new AnswerSequence().line("stack.fits").line("").line("%.1f", 4.0);

        assertEquals(List.of("stack.fits", "", "4.0"), a.lines());
        assertEquals("stack.fits\n\n4.0\n", a.text());
    }

    @Test
    void formattingIgnoresDefaultLocale() {
        assertEquals("0.50\n", new AnswerSequence().line("%.2f", 0.5).text());
    }

    @Test
    void rejectsEmbeddedNewlines() {
        assertThrows(IllegalArgumentException.class, () -> new AnswerSequence().line("a\nb"));
    }

    @Test
    void emptySequenceHasNoText() {
        assertEquals("", new AnswerSequence().text());
    }
}
