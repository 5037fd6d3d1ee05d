package com.vidnyan.conclint.application.port.out;

import com.vidnyan.conclint.domain.ast.MalformedTreeException;
import com.vidnyan.conclint.domain.ast.SyntaxTree;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port for turning a host's serialized syntax tree into the engine's tree.
 * Implemented by adapters (e.g., the JSON exchange format reader).
 */
public interface SyntaxTreeReader {

    /**
     * Read one compilation unit.
     * @throws IOException if the file cannot be read
     * @throws MalformedTreeException if the content violates the node contract
     */
    SyntaxTree read(Path file) throws IOException;

    /**
     * Parse one compilation unit from its serialized form.
     * @param fallbackPath file path used when the content does not name one
     */
    SyntaxTree parse(String content, String fallbackPath);
}
