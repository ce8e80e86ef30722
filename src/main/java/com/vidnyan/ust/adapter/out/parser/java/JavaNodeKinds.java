package com.vidnyan.ust.adapter.out.parser.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.VoidType;
import com.vidnyan.ust.domain.model.NodeType;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Class-keyed mapping from JavaParser node classes to universal node types.
 * Lookups walk the superclass chain, so abstract parents (literals, annotations,
 * types) cover their concrete subclasses.
 */
final class JavaNodeKinds {

    static final Map<Class<? extends Node>, NodeType> MAPPING = Map.ofEntries(
            entry(CompilationUnit.class, NodeType.PROGRAM),

            // declarations
            entry(MethodDeclaration.class, NodeType.FUNCTION_DECLARATION),
            entry(ConstructorDeclaration.class, NodeType.FUNCTION_DECLARATION),
            entry(LambdaExpr.class, NodeType.FUNCTION_DECLARATION),
            entry(ClassOrInterfaceDeclaration.class, NodeType.CLASS_DECLARATION),
            entry(EnumDeclaration.class, NodeType.CLASS_DECLARATION),
            entry(RecordDeclaration.class, NodeType.CLASS_DECLARATION),
            entry(AnnotationDeclaration.class, NodeType.INTERFACE_DECLARATION),
            entry(VariableDeclarator.class, NodeType.VARIABLE_DECLARATION),
            entry(ImportDeclaration.class, NodeType.IMPORT_DECLARATION),
            entry(AnnotationExpr.class, NodeType.ANNOTATION),

            // statements
            entry(ExpressionStmt.class, NodeType.EXPRESSION_STATEMENT),
            entry(BlockStmt.class, NodeType.BLOCK_STATEMENT),
            entry(TryStmt.class, NodeType.BLOCK_STATEMENT),
            entry(IfStmt.class, NodeType.IF_STATEMENT),
            entry(ConditionalExpr.class, NodeType.IF_STATEMENT),
            entry(WhileStmt.class, NodeType.WHILE_STATEMENT),
            entry(DoStmt.class, NodeType.WHILE_STATEMENT),
            entry(ForStmt.class, NodeType.FOR_STATEMENT),
            entry(ForEachStmt.class, NodeType.FOR_STATEMENT),
            entry(ReturnStmt.class, NodeType.RETURN_STATEMENT),
            entry(BreakStmt.class, NodeType.BREAK_STATEMENT),
            entry(ContinueStmt.class, NodeType.CONTINUE_STATEMENT),

            // expressions
            entry(LiteralExpr.class, NodeType.LITERAL),
            entry(NameExpr.class, NodeType.IDENTIFIER),
            entry(Name.class, NodeType.IDENTIFIER),
            entry(SimpleName.class, NodeType.IDENTIFIER),
            entry(BinaryExpr.class, NodeType.BINARY_EXPRESSION),
            entry(UnaryExpr.class, NodeType.UNARY_EXPRESSION),
            entry(AssignExpr.class, NodeType.ASSIGNMENT_EXPRESSION),
            entry(MethodCallExpr.class, NodeType.CALL_EXPRESSION),
            entry(ObjectCreationExpr.class, NodeType.CALL_EXPRESSION),
            entry(FieldAccessExpr.class, NodeType.MEMBER_EXPRESSION),
            entry(ArrayAccessExpr.class, NodeType.MEMBER_EXPRESSION),

            // types
            entry(PrimitiveType.class, NodeType.PRIMITIVE_TYPE),
            entry(VoidType.class, NodeType.PRIMITIVE_TYPE),
            entry(ArrayType.class, NodeType.ARRAY_TYPE),
            entry(Type.class, NodeType.OBJECT_TYPE)
    );

    private JavaNodeKinds() {
    }

    static NodeType typeOf(Node node) {
        if (node instanceof ClassOrInterfaceDeclaration declaration && declaration.isInterface()) {
            return NodeType.INTERFACE_DECLARATION;
        }
        NodeType type = lookup(MAPPING, node.getClass());
        return type != null ? type : NodeType.FALLBACK;
    }

    static boolean isMapped(Node node) {
        return lookup(MAPPING, node.getClass()) != null;
    }

    /**
     * Converted as leaves; their inner name and type nodes are not walked.
     */
    static boolean isAtomic(Node node) {
        return node instanceof NameExpr || node instanceof Name
                || node instanceof LiteralExpr || node instanceof Type;
    }

    /**
     * Captured as attributes of their owner instead of as nodes.
     */
    static boolean isSkipped(Node node) {
        return node instanceof Modifier;
    }

    static <V> V lookup(Map<Class<? extends Node>, V> table, Class<?> type) {
        for (Class<?> c = type; c != null && Node.class.isAssignableFrom(c); c = c.getSuperclass()) {
            V value = table.get(c);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
