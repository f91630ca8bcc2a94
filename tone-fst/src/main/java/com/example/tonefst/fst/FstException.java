package com.example.tonefst.fst;

/**
 * Exception thrown when an automaton operation cannot be carried out, for example when two
 * operands do not share a symbol table or a composition operand is not arc-sorted.
 */
public class FstException extends RuntimeException {
    public FstException(String message) {
        super(message);
    }

    public FstException(String message, Throwable cause) {
        super(message, cause);
    }
}
