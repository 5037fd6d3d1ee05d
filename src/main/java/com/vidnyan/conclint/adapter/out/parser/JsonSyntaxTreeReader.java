package com.vidnyan.conclint.adapter.out.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.conclint.application.port.out.SyntaxTreeReader;
import com.vidnyan.conclint.domain.ast.MalformedTreeException;
import com.vidnyan.conclint.domain.ast.Modifier;
import com.vidnyan.conclint.domain.ast.NodeData;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.Role;
import com.vidnyan.conclint.domain.ast.Span;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the flat JSON exchange format a host parser emits:
 * <pre>
 * { "file": "src/Main.kt",
 *   "nodes": [ { "id": "1", "parent": null, "kind": "FILE" },
 *              { "id": "2", "parent": "1", "kind": "CALL_EXPRESSION", "role": "STATEMENT",
 *                "name": "launch", "span": { "startLine": 3, "startCol": 5 } } ] }
 * </pre>
 * Kind, role and modifier names are accepted in UPPER_SNAKE or CamelCase.
 * Children keep the order of the node list.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonSyntaxTreeReader implements SyntaxTreeReader {

    private final ObjectMapper objectMapper;

    @Override
    public SyntaxTree read(Path file) throws IOException {
        log.debug("Reading syntax tree: {}", file);
        return parse(Files.readString(file), file.toString());
    }

    @Override
    public SyntaxTree parse(String content, String fallbackPath) {
        TreeDto dto;
        try {
            dto = objectMapper.readValue(content, TreeDto.class);
        } catch (JsonProcessingException e) {
            throw new MalformedTreeException(fallbackPath, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (dto == null || dto.nodes == null) {
            throw new MalformedTreeException(fallbackPath, "missing 'nodes' array");
        }

        String filePath = dto.file != null && !dto.file.isBlank() ? dto.file : fallbackPath;
        SyntaxTree.Builder builder = SyntaxTree.builder(filePath);
        for (NodeDto node : dto.nodes) {
            if (node == null) {
                throw new MalformedTreeException(filePath, "null entry in 'nodes'");
            }
            builder.add(node.id, node.parent,
                    mapKind(filePath, node),
                    mapRole(filePath, node),
                    new NodeData(node.name, node.typeName, node.text,
                            mapModifiers(filePath, node),
                            requireElements(filePath, node, "annotations", node.annotations),
                            requireElements(filePath, node, "supertypes", node.supertypes)),
                    mapSpan(node.span));
        }
        return builder.build();
    }

    private NodeKind mapKind(String filePath, NodeDto node) {
        if (node.kind == null || node.kind.isBlank()) {
            throw new MalformedTreeException(filePath, "node '" + node.id + "' has no kind");
        }
        try {
            return NodeKind.valueOf(normalize(node.kind));
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException(filePath, "node '" + node.id + "' has unknown kind '" + node.kind + "'", e);
        }
    }

    private Role mapRole(String filePath, NodeDto node) {
        if (node.role == null || node.role.isBlank()) {
            return node.parent == null ? Role.ROOT : Role.OTHER;
        }
        try {
            return Role.valueOf(normalize(node.role));
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException(filePath, "node '" + node.id + "' has unknown role '" + node.role + "'", e);
        }
    }

    private Set<Modifier> mapModifiers(String filePath, NodeDto node) {
        if (node.modifiers == null || node.modifiers.isEmpty()) {
            return Set.of();
        }
        Set<Modifier> result = EnumSet.noneOf(Modifier.class);
        for (String modifier : requireElements(filePath, node, "modifiers", node.modifiers)) {
            try {
                result.add(Modifier.valueOf(normalize(modifier)));
            } catch (IllegalArgumentException e) {
                // modifiers the rules never look at are dropped
                log.trace("Ignoring modifier '{}' on node '{}' in {}", modifier, node.id, filePath);
            }
        }
        return result;
    }

    private List<String> requireElements(String filePath, NodeDto node, String field, List<String> values) {
        if (values == null) {
            return List.of();
        }
        for (String value : values) {
            if (value == null) {
                throw new MalformedTreeException(filePath, "node '" + node.id + "' has a null entry in '" + field + "'");
            }
        }
        return values;
    }

    private Span mapSpan(SpanDto span) {
        if (span == null || span.startLine == null) {
            return null;
        }
        int startColumn = span.startCol != null ? span.startCol : 1;
        int endLine = span.endLine != null ? span.endLine : span.startLine;
        int endColumn = span.endCol != null ? span.endCol : startColumn;
        return new Span(span.startLine, startColumn, endLine, endColumn);
    }

    /**
     * {@code CallExpression}, {@code call-expression} and {@code CALL_EXPRESSION} all map to CALL_EXPRESSION.
     */
    static String normalize(String value) {
        String trimmed = value.trim();
        if (trimmed.equals(trimmed.toUpperCase(Locale.ROOT))) {
            return trimmed.replace('-', '_');
        }
        return trimmed
                .replace('-', '_')
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toUpperCase(Locale.ROOT);
    }

    // DTO classes for JSON deserialization
    static class TreeDto {
        public String file;
        public List<NodeDto> nodes;
    }

    static class NodeDto {
        public String id;
        public String parent;
        public String kind;
        public String role;
        public String name;
        public String typeName;
        public String text;
        public List<String> modifiers;
        public List<String> annotations;
        public List<String> supertypes;
        public SpanDto span;
    }

    static class SpanDto {
        public Integer startLine;
        public Integer startCol;
        public Integer endLine;
        public Integer endCol;
    }
}
