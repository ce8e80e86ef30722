package com.vidnyan.ust.adapter.out.parser.java;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.AstNodes;
import com.vidnyan.ust.domain.model.DataType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

import static java.util.Map.entry;

/**
 * Class-keyed attribute extractors for JavaParser nodes.
 * Attribute names follow the ones the other adapters emit, so the analyzer reads them uniformly.
 */
final class JavaAttributeExtractors {

    @FunctionalInterface
    interface AttributeExtractor {
        void extract(Node node, AstNode target);
    }

    static final Map<Class<? extends Node>, AttributeExtractor> EXTRACTORS = Map.ofEntries(
            on(CompilationUnit.class, (unit, target) ->
                    unit.getPackageDeclaration().ifPresent(p -> target.setAttribute("package", p.getNameAsString()))),

            // declarations
            on(MethodDeclaration.class, (method, target) -> {
                function(method.getNameAsString(), method.getParameters(), target);
                target.setAttribute("return_type", method.getType().asString());
                modifiersAndAnnotations(method, method, target);
            }),
            on(ConstructorDeclaration.class, (constructor, target) -> {
                function(constructor.getNameAsString(), constructor.getParameters(), target);
                target.setAttribute("is_constructor", true);
                modifiersAndAnnotations(constructor, constructor, target);
            }),
            on(LambdaExpr.class, (lambda, target) -> {
                function("lambda", lambda.getParameters(), target);
                target.setAttribute("is_lambda", true);
            }),
            on(ClassOrInterfaceDeclaration.class, (type, target) -> {
                target.setAttribute("name", type.getNameAsString());
                List<String> bases = typeNames(type.getExtendedTypes());
                bases.addAll(typeNames(type.getImplementedTypes()));
                target.setAttribute("base_classes", bases);
                modifiersAndAnnotations(type, type, target);
            }),
            on(EnumDeclaration.class, (type, target) -> {
                target.setAttribute("name", type.getNameAsString());
                target.setAttribute("kind", "enum");
                target.setAttribute("base_classes", typeNames(type.getImplementedTypes()));
                modifiersAndAnnotations(type, type, target);
            }),
            on(RecordDeclaration.class, (type, target) -> {
                target.setAttribute("name", type.getNameAsString());
                target.setAttribute("kind", "record");
                target.setAttribute("base_classes", typeNames(type.getImplementedTypes()));
                target.setAttribute("parameters", parameterNames(type.getParameters()));
                modifiersAndAnnotations(type, type, target);
            }),
            on(AnnotationDeclaration.class, (type, target) -> {
                target.setAttribute("name", type.getNameAsString());
                target.setAttribute("kind", "annotation");
            }),
            on(VariableDeclarator.class, JavaAttributeExtractors::variable),
            on(ImportDeclaration.class, JavaAttributeExtractors::importDeclaration),
            on(AnnotationExpr.class, (annotation, target) -> target.setAttribute("name", annotation.getNameAsString())),

            // statements
            on(BreakStmt.class, (stmt, target) ->
                    stmt.getLabel().ifPresent(label -> target.setAttribute("label", label.getIdentifier()))),
            on(ContinueStmt.class, (stmt, target) ->
                    stmt.getLabel().ifPresent(label -> target.setAttribute("label", label.getIdentifier()))),

            // expressions
            on(NameExpr.class, (name, target) -> target.setAttribute("name", name.getNameAsString())),
            on(Name.class, (name, target) -> target.setAttribute("name", name.asString())),
            on(SimpleName.class, (name, target) -> target.setAttribute("name", name.getIdentifier())),
            on(BinaryExpr.class, (expr, target) -> target.setAttribute("operator", expr.getOperator().asString())),
            on(UnaryExpr.class, (expr, target) -> target.setAttribute("operator", expr.getOperator().asString())),
            on(AssignExpr.class, (expr, target) -> target.setAttribute("operator", expr.getOperator().asString())),
            on(MethodCallExpr.class, (call, target) -> target.setAttribute("function_name", call.getNameAsString())),
            on(ObjectCreationExpr.class, (creation, target) -> {
                target.setAttribute("function_name", creation.getType().getNameAsString());
                target.setAttribute("is_new", true);
            }),
            on(FieldAccessExpr.class, (access, target) -> target.setAttribute("attribute", access.getNameAsString())),

            // literals
            on(IntegerLiteralExpr.class, (literal, target) -> integral(literal.getValue(), target)),
            on(LongLiteralExpr.class, (literal, target) -> integral(literal.getValue(), target)),
            on(DoubleLiteralExpr.class, JavaAttributeExtractors::floating),
            on(StringLiteralExpr.class, (literal, target) -> literal(target, literal.asString(), DataType.STRING)),
            on(TextBlockLiteralExpr.class, (literal, target) -> literal(target, literal.asString(), DataType.STRING)),
            on(CharLiteralExpr.class, (literal, target) ->
                    literal(target, String.valueOf(literal.asChar()), DataType.STRING)),
            on(BooleanLiteralExpr.class, (literal, target) -> literal(target, literal.getValue(), DataType.BOOLEAN)),
            on(NullLiteralExpr.class, (literal, target) -> literal(target, null, DataType.NULL)),

            // types
            on(Type.class, (type, target) -> target.setAttribute("name", type.asString()))
    );

    private JavaAttributeExtractors() {
    }

    static void apply(Node node, AstNode target) {
        AttributeExtractor extractor = JavaNodeKinds.lookup(EXTRACTORS, node.getClass());
        if (extractor != null) {
            extractor.extract(node, target);
        }
    }

    private static <T extends Node> Map.Entry<Class<? extends Node>, AttributeExtractor> on(
            Class<T> type, BiConsumer<T, AstNode> extractor) {
        return entry(type, (node, target) -> extractor.accept(type.cast(node), target));
    }

    private static void function(String name, NodeList<Parameter> parameters, AstNode target) {
        target.setAttribute("name", name);
        target.setAttribute("parameters", parameterNames(parameters));
        target.setAttribute("is_async", false);
    }

    private static List<String> parameterNames(NodeList<Parameter> parameters) {
        List<String> names = new ArrayList<>();
        for (Parameter parameter : parameters) {
            names.add(parameter.getNameAsString());
        }
        return names;
    }

    private static List<String> typeNames(NodeList<ClassOrInterfaceType> types) {
        List<String> names = new ArrayList<>();
        for (ClassOrInterfaceType type : types) {
            names.add(type.getNameAsString());
        }
        return names;
    }

    private static void modifiersAndAnnotations(NodeWithModifiers<?> withModifiers,
                                                NodeWithAnnotations<?> withAnnotations,
                                                AstNode target) {
        List<String> modifiers = new ArrayList<>();
        for (Modifier modifier : withModifiers.getModifiers()) {
            modifiers.add(modifier.getKeyword().asString());
        }
        if (!modifiers.isEmpty()) {
            target.setAttribute("modifiers", modifiers);
        }
        List<String> annotations = new ArrayList<>();
        for (AnnotationExpr annotation : withAnnotations.getAnnotations()) {
            annotations.add(annotation.getNameAsString());
        }
        if (!annotations.isEmpty()) {
            target.setAttribute("decorators", annotations);
        }
    }

    private static void variable(VariableDeclarator declarator, AstNode target) {
        target.setAttribute("name", declarator.getNameAsString());
        target.setAttribute("type", declarator.getType().asString());

        Node parent = declarator.getParentNode().orElse(null);
        if (parent instanceof FieldDeclaration field) {
            target.setAttribute("kind", field.isStatic() ? "static_field" : "field");
        } else if (parent instanceof VariableDeclarationExpr local) {
            target.setAttribute("kind", local.isFinal() ? "final" : "local");
        }
    }

    private static void importDeclaration(ImportDeclaration declaration, AstNode target) {
        Name name = declaration.getName();
        Map<String, Object> imported = new LinkedHashMap<>();
        if (declaration.isAsterisk()) {
            target.setAttribute("module", name.asString());
            imported.put("name", "*");
        } else {
            target.setAttribute("module", name.getQualifier().map(Name::asString).orElse(null));
            imported.put("name", name.getIdentifier());
        }
        target.setAttribute("names", List.of(imported));
        target.setAttribute("is_static", declaration.isStatic());
    }

    /**
     * Java integer literal text: optional 0x / 0b / leading-zero octal prefix, underscores, L suffix.
     */
    static void integral(String raw, AstNode target) {
        String digits = raw.replace("_", "");
        if (digits.endsWith("L") || digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        int radix = 10;
        String lower = digits.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            radix = 16;
            digits = digits.substring(2);
        } else if (lower.startsWith("0b")) {
            radix = 2;
            digits = digits.substring(2);
        } else if (digits.length() > 1 && digits.startsWith("0")) {
            radix = 8;
            digits = digits.substring(1);
        }
        try {
            literal(target, AstNodes.parseInteger(digits, radix), DataType.INTEGER);
        } catch (NumberFormatException e) {
            literal(target, raw, DataType.ANY);
        }
    }

    private static void floating(DoubleLiteralExpr literal, AstNode target) {
        double value;
        try {
            value = literal.asDouble();
        } catch (NumberFormatException e) {
            literal(target, literal.getValue(), DataType.ANY);
            return;
        }
        if (Double.isFinite(value)) {
            literal(target, value, DataType.FLOAT);
        } else {
            literal(target, literal.getValue(), DataType.ANY);
        }
    }

    private static void literal(AstNode target, Object value, DataType dataType) {
        target.setAttribute("value", AstNodes.normalizeNumber(value));
        target.setAttribute("data_type", dataType.value());
    }
}
