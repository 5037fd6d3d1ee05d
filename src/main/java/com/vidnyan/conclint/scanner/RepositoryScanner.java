package com.vidnyan.conclint.scanner;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans a directory for serialized syntax trees.
 * Discovers all {@code .ast.json} files below the root, in a stable order.
 */
@Component
public class RepositoryScanner {

    public static final String TREE_SUFFIX = ".ast.json";

    /**
     * Scan and return all tree files, sorted by path.
     */
    public List<Path> scanSourceFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(TREE_SUFFIX))
                    .sorted()
                    .toList();
        }
    }
}
