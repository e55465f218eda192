package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;

/**
 * One place variable mappings can come from.
 */
public interface MappingSource {

    /**
     * Short label used in log lines.
     */
    String describe();

    /**
     * Loads the current mappings. May block on I/O.
     *
     * @throws MappingSourceException when the source exists but cannot be read
     */
    MappingDocument load();
}
