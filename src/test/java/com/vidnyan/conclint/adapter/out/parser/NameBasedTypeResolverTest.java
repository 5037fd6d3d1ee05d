package com.vidnyan.conclint.adapter.out.parser;

import com.vidnyan.conclint.domain.ast.NodeKind;
import com.vidnyan.conclint.domain.ast.SyntaxNode;
import com.vidnyan.conclint.domain.ast.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.conclint.TestTrees.*;
import static com.vidnyan.conclint.domain.ast.NodeSpec.*;
import static org.junit.jupiter.api.Assertions.*;

class NameBasedTypeResolverTest {

    private final NameBasedTypeResolver resolver = new NameBasedTypeResolver();

    @Test
    void supertypes_ShouldStripConstructorCallsAndTypeArguments() {
        SyntaxTree tree = tree(classDecl("Signal")
                .supertypes("kotlinx.coroutines.CancellationException(\"stop\")", "Comparable<Signal>", " "));
        SyntaxNode declaration = tree.nodesOfKind(NodeKind.CLASS_DECLARATION).get(0);

        assertEquals(List.of("kotlinx.coroutines.CancellationException", "Comparable"),
                resolver.supertypes(declaration));
        assertEquals(List.of(), resolver.supertypes(tree.root()));
    }

    @Test
    void enclosingFunction_ShouldReturnNearestDeclaration() {
        SyntaxTree tree = tree(
                fun("outer", launchOn("scope", "launch", call("work"))),
                call("topLevel"));
        List<SyntaxNode> calls = tree.nodesOfKind(NodeKind.CALL_EXPRESSION);

        SyntaxNode work = calls.stream().filter(c -> c.isCall("work")).findFirst().orElseThrow();
        SyntaxNode topLevel = calls.stream().filter(c -> c.isCall("topLevel")).findFirst().orElseThrow();

        assertEquals("outer", resolver.enclosingFunction(work).orElseThrow().name());
        assertTrue(resolver.enclosingFunction(topLevel).isEmpty());
    }
}
