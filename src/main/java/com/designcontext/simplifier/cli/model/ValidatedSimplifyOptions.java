package com.designcontext.simplifier.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Options after validation: paths made absolute and the mapping search path resolved.
 */
@Data
@AllArgsConstructor
public class ValidatedSimplifyOptions {
    private Path input;

    /** Null when the design goes to standard output. */
    private Path outputFile;

    /** {@code --mapping-dir} first, then the default locations. */
    private List<Path> mappingSearchDirectories;
}
