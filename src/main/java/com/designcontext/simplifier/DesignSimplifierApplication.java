package com.designcontext.simplifier;

import com.designcontext.simplifier.cli.SimplifyCommand;
import picocli.CommandLine;

/**
 * Main entry point for the design context simplifier.
 * Reads a design document fetched from the design platform and writes the compact,
 * semantically named form used as model context.
 */
public class DesignSimplifierApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new SimplifyCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
