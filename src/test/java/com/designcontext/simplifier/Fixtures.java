package com.designcontext.simplifier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies files from {@code src/test/resources/fixtures} into a test directory.
 */
public final class Fixtures {

    public static final String DESIGN = "mail-app.json";
    public static final String VARIABLES = "mail-app-variables.json";
    public static final String MAPPINGS = "figma-variables.json";

    private Fixtures() {
    }

    public static Path copy(String name, Path directory) throws IOException {
        return copy(name, directory, name);
    }

    public static Path copy(String name, Path directory, String targetName) throws IOException {
        Path target = directory.resolve(targetName);
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IOException("Missing test fixture: " + name);
            }
            Files.createDirectories(directory);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
