package com.stackfit.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Respuestas que se teclean a un motor interactivo, una por linea. Siempre termina en
 * salto de linea.
 */
public class AnswerSequence {

    private final List<String> lines = new ArrayList<>();

    public AnswerSequence line(String answer) {
        if (answer.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Una respuesta no puede contener saltos de linea: " + answer);
        }
        lines.add(answer);
        return this;
    }

    public AnswerSequence line(String format, Object... args) {
        return line(String.format(Locale.US, format, args));
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) sb.append(l).append('\n');
        return sb.toString();
    }

    @Override
    public String toString() {
        return text();
    }
}
