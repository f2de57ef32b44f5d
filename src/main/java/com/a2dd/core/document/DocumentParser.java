package com.a2dd.core.document;

import java.nio.file.Path;

/**
 * Reads source documents into plain ordered maps, lists and scalars.
 */
public interface DocumentParser {

    /**
     * @return the document root, or null for an empty document
     * @throws com.a2dd.core.conversion.UnsupportedConstructException if the file can not be read or parsed
     */
    Object parse(Path path);

    Object parse(String text);
}
