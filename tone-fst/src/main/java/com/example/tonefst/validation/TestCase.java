package com.example.tonefst.validation;

import java.util.Objects;

/**
 * Input form and the output the compiled relation is expected to produce for it.
 */
public record TestCase(String form, String expected) {

    public TestCase {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(expected, "expected");
    }
}
