package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.MappingFileParser;
import com.designcontext.simplifier.resolver.FileStat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The {@code .figma-variables.json} mapping file, searched in the configured directories.
 */
public class LocalFileMappingSource extends FileBackedMappingSource {

    private final MappingFileParser parser;

    public LocalFileMappingSource(List<Path> candidates, FileStat fileStat) {
        this(candidates, fileStat, new MappingFileParser());
    }

    public LocalFileMappingSource(List<Path> candidates, FileStat fileStat, MappingFileParser parser) {
        super(candidates, fileStat);
        this.parser = parser;
    }

    @Override
    protected MappingDocument parse(Path file) throws IOException {
        return parser.parse(file);
    }
}
