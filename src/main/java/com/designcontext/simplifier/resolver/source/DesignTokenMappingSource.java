package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.DesignTokenParser;
import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.resolver.FileStat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A design-token export read as a mapping source.
 */
public class DesignTokenMappingSource extends FileBackedMappingSource {

    private final DesignTokenParser parser;

    public DesignTokenMappingSource(Path tokenFile, FileStat fileStat) {
        super(List.of(tokenFile), fileStat);
        this.parser = new DesignTokenParser();
    }

    @Override
    protected MappingDocument parse(Path file) throws IOException {
        return parser.parse(file);
    }
}
