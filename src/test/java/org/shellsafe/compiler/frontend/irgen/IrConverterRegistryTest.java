package org.shellsafe.compiler.frontend.irgen;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.frontend.parser.ast.AstNode;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.NodeId;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the converter lookup of {@link IrConverterRegistry}.
 */
public class IrConverterRegistryTest {

    private static final BreakNode BREAK = new BreakNode(new NodeId(7), new SourceSpan("test.rs", 3, 5, 5));

    /**
     * Verifies that a converter registered for the concrete class wins over one for an interface.
     */
    @Test
    @Tag("unit")
    void testConcreteClassWins() {
        // Arrange
        IrConverterRegistry registry = IrConverterRegistry.initialize(new DefaultAstNodeToIrConverter());
        IAstNodeToIrConverter<StmtNode> statements = (node, ctx) -> { };
        IAstNodeToIrConverter<BreakNode> breaks = (node, ctx) -> { };
        registry.register(StmtNode.class, statements);
        registry.register(BreakNode.class, breaks);

        // Act
        IAstNodeToIrConverter<AstNode> resolved = registry.resolve(BREAK);

        // Assert
        assertThat((Object) resolved).isSameAs(breaks);
    }

    /**
     * Verifies that the node interfaces are searched when the class has no converter.
     */
    @Test
    @Tag("unit")
    void testInterfaceFallback() {
        // Arrange
        IrConverterRegistry registry = IrConverterRegistry.initialize(new DefaultAstNodeToIrConverter());
        IAstNodeToIrConverter<AstNode> any = (node, ctx) -> { };
        registry.register(AstNode.class, any);

        // Act & Assert
        assertThat((Object) registry.resolve(BREAK)).isSameAs(any);
    }

    /**
     * Verifies that a node without any converter fails with an internal lowering error at its span.
     */
    @Test
    @Tag("unit")
    void testDefaultConverterFails() {
        // Arrange
        IrConverterRegistry registry = IrConverterRegistry.initialize(new DefaultAstNodeToIrConverter());

        // Act
        LoweringException e = catchThrowableOfType(() -> registry.resolve(BREAK).convert(BREAK, null),
                LoweringException.class);

        // Assert
        assertThat(e).isNotNull();
        assertThat(e.diagnostic().code()).isEqualTo(CompilerErrorCode.MISSING_LOWERING_RULE);
        assertThat(e.diagnostic().message()).contains("BreakNode");
        assertThat(e.diagnostic().span().line()).isEqualTo(3);
    }
}
