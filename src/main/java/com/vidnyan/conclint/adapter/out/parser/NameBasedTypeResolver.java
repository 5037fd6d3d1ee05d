package com.vidnyan.conclint.adapter.out.parser;

import com.vidnyan.conclint.application.port.out.TypeResolver;
import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of TypeResolver using only what the tree spells out.
 * Supertypes come from the declaration's own list; no symbol table is consulted.
 */
@Slf4j
@Component
public class NameBasedTypeResolver implements TypeResolver {

    @Override
    public Optional<SyntaxNode> enclosingFunction(SyntaxNode node) {
        for (SyntaxNode ancestor : node.ancestors()) {
            if (ancestor.is(NodeKind.FUNCTION_DECLARATION)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<String> supertypes(SyntaxNode classDeclaration) {
        if (!classDeclaration.is(NodeKind.CLASS_DECLARATION)) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String supertype : classDeclaration.supertypes()) {
            String bare = stripTypeSyntax(supertype);
            if (!bare.isEmpty()) {
                result.add(bare);
            }
        }
        return result;
    }

    /**
     * {@code kotlinx.coroutines.CancellationException("x")} and {@code Base<T>()} become
     * {@code kotlinx.coroutines.CancellationException} and {@code Base}.
     */
    static String stripTypeSyntax(String supertype) {
        if (supertype == null) {
            return "";
        }
        String bare = supertype.trim();
        int paren = bare.indexOf('(');
        if (paren >= 0) {
            bare = bare.substring(0, paren);
        }
        int generic = bare.indexOf('<');
        if (generic >= 0) {
            bare = bare.substring(0, generic);
        }
        return bare.trim();
    }
}
