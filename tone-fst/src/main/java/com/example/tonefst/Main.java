package com.example.tonefst;

import com.example.tonefst.cli.RuleCompilerApplication;

/**
 * Entry point of the executable jar.
 */
public final class Main {

    private Main() {
    }

    public static void main(String[] args) {
        RuleCompilerApplication.main(args);
    }
}
