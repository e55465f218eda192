package com.designcontext.simplifier.mapping;

import com.designcontext.simplifier.util.JsonMappers;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes variable mappings in the local mapping-file layout read back by {@link MappingFileParser}.
 */
public class MappingFileWriter {
    private static final Logger log = LoggerFactory.getLogger(MappingFileWriter.class);

    private final ObjectMapper mapper;

    public MappingFileWriter() {
        this(JsonMappers.prettyPrinting());
    }

    public MappingFileWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(Path target, List<VariableMapping> mappings, String sourceFile, Instant syncedAt) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put("lastSynced", syncedAt.toString());
        if (sourceFile != null) {
            root.put("sourceFile", sourceFile);
        }
        ArrayNode entries = root.putArray("variableMappings");
        for (VariableMapping mapping : mappings) {
            ObjectNode entry = entries.addObject();
            entry.put("id", mapping.getId());
            entry.put("name", mapping.getName());
            entry.put("description", mapping.getDescription() == null ? "" : mapping.getDescription());
        }

        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), root);
        log.info("Wrote {} variable mappings to {}", mappings.size(), target);
    }
}
