package io.github.cyfko.filterexpr.core.ast;

import io.github.cyfko.filterexpr.core.token.Kind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;

import static io.github.cyfko.filterexpr.core.ast.Exprs.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Visitor Walk Tests")
class VisitorTest {

    @Mock
    private Visitor visitor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    @DisplayName("Should visit nodes depth-first, left before right")
    void shouldVisitDepthFirst() {
        // Given
        when(visitor.visit(any())).thenReturn(visitor);
        BinaryExpr left = eq("a", 1);
        BinaryExpr right = gt("b", 2);
        BinaryExpr root = and(left, right);

        // When
        Visitor.walk(visitor, root);

        // Then
        InOrder order = inOrder(visitor);
        order.verify(visitor).visit(root);
        order.verify(visitor).visit(left);
        order.verify(visitor).visit(ident("a"));
        order.verify(visitor).visit(literal(1));
        order.verify(visitor).visit(right);
        order.verify(visitor).visit(ident("b"));
        order.verify(visitor).visit(literal(2));
        verifyNoMoreInteractions(visitor);
    }

    @Test
    @DisplayName("Should skip children when visit returns null")
    void shouldSkipChildrenOnNull() {
        // Given
        when(visitor.visit(any())).thenReturn(null);
        BinaryExpr root = and(eq("a", 1), eq("b", 2));

        // When
        Visitor.walk(visitor, root);

        // Then
        verify(visitor).visit(root);
        verifyNoMoreInteractions(visitor);
    }

    @Test
    @DisplayName("Should visit list elements and index operands")
    void shouldVisitListsAndIndexes() {
        // Given
        List<Expr> visited = new ArrayList<>();
        Visitor recorder = new Visitor() {
            @Override
            public Visitor visit(Expr expr) {
                visited.add(expr);
                return this;
            }
        };

        // When
        Visitor.walk(recorder, in(index("tags", 0), "x", "y"));

        // Then
        assertEquals(7, visited.size());
        assertInstanceOf(BinaryExpr.class, visited.get(0));
        assertInstanceOf(IndexExpr.class, visited.get(1));
        assertEquals(ident("tags"), visited.get(2));
        assertEquals(literal(0), visited.get(3));
        assertInstanceOf(ListLiteral.class, visited.get(4));
        assertEquals(literal("x"), visited.get(5));
        assertEquals(literal("y"), visited.get(6));
    }

    @Test
    @DisplayName("Should prune only the subtree whose visit returned null")
    void shouldPruneSelectively() {
        // Given
        List<Expr> visited = new ArrayList<>();
        Visitor skipNot = new Visitor() {
            @Override
            public Visitor visit(Expr expr) {
                visited.add(expr);
                return expr instanceof UnaryExpr unary && unary.op().is(Kind.NOT) ? null : this;
            }
        };

        // When
        Visitor.walk(skipNot, or(not(eq("a", 1)), paren(eq("b", 2))));

        // Then
        assertEquals(6, visited.size());
        assertInstanceOf(UnaryExpr.class, visited.get(1));
        assertInstanceOf(ParenExpr.class, visited.get(2));
    }

    @Test
    @DisplayName("Should pass a null root to the visitor once")
    void shouldVisitNullRoot() {
        when(visitor.visit(any())).thenReturn(visitor);

        Visitor.walk(visitor, null);

        verify(visitor, times(1)).visit(null);
        verifyNoMoreInteractions(visitor);
    }

    @Test
    void shouldRequireVisitor() {
        assertThrows(NullPointerException.class, () -> Visitor.walk(null, ident("a")));
    }
}
