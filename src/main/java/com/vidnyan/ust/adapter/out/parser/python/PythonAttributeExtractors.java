package com.vidnyan.ust.adapter.out.parser.python;

import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.AstNodes;
import com.vidnyan.ust.domain.model.DataType;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Kind-keyed attribute extractors for the tree-sitter Python grammar.
 * Kinds without an extractor get no attributes beyond their type tag.
 */
final class PythonAttributeExtractors {

    @FunctionalInterface
    interface AttributeExtractor {
        void extract(TSNode node, SourceText text, AstNode target);
    }

    private static final Set<String> COMPARISON_OPERATORS = Set.of(
            "<", "<=", "==", "!=", ">=", ">", "<>", "in", "not in", "is", "is not"
    );

    static final Map<String, AttributeExtractor> EXTRACTORS = Map.ofEntries(
            on("module", (node, text, target) -> target.setAttribute("type", "module")),
            on("function_definition", PythonAttributeExtractors::function),
            on("class_definition", PythonAttributeExtractors::classDefinition),
            on("decorator", (node, text, target) -> target.setAttribute("name", decoratorName(node, text))),
            on("identifier", (node, text, target) -> target.setAttribute("name", text.of(node))),
            on("string", (node, text, target) -> stringLiteral(text.of(node), target)),
            on("concatenated_string", PythonAttributeExtractors::concatenatedString),
            on("integer", (node, text, target) -> integerLiteral(text.of(node), target)),
            on("float", (node, text, target) -> floatLiteral(text.of(node), target)),
            on("true", (node, text, target) -> literal(target, true, DataType.BOOLEAN)),
            on("false", (node, text, target) -> literal(target, false, DataType.BOOLEAN)),
            on("none", (node, text, target) -> literal(target, null, DataType.NULL)),
            on("list", PythonAttributeExtractors::collection),
            on("tuple", PythonAttributeExtractors::collection),
            on("dictionary", PythonAttributeExtractors::collection),
            on("set", PythonAttributeExtractors::collection),
            on("binary_operator", PythonAttributeExtractors::fieldOperator),
            on("boolean_operator", PythonAttributeExtractors::fieldOperator),
            on("unary_operator", PythonAttributeExtractors::fieldOperator),
            on("not_operator", (node, text, target) -> target.setAttribute("operator", "not")),
            on("comparison_operator", PythonAttributeExtractors::comparison),
            on("call", PythonAttributeExtractors::call),
            on("attribute", (node, text, target) ->
                    target.setAttribute("attribute", text.of(node.getChildByFieldName("attribute")))),
            on("import_statement", PythonAttributeExtractors::importStatement),
            on("import_from_statement", PythonAttributeExtractors::importFrom),
            on("future_import_statement", PythonAttributeExtractors::futureImport),
            on("assignment", PythonAttributeExtractors::assignment),
            on("augmented_assignment", PythonAttributeExtractors::fieldOperator)
    );

    private PythonAttributeExtractors() {
    }

    private static Map.Entry<String, AttributeExtractor> on(String kind, AttributeExtractor extractor) {
        return entry(kind, extractor);
    }

    static void apply(TSNode node, SourceText text, AstNode target) {
        AttributeExtractor extractor = EXTRACTORS.get(node.getType());
        if (extractor != null) {
            extractor.extract(node, text, target);
        }
    }

    // ---- declarations ----

    private static void function(TSNode node, SourceText text, AstNode target) {
        target.setAttribute("name", text.of(node.getChildByFieldName("name")));
        target.setAttribute("is_async", node.getChildCount() > 0 && "async".equals(node.getChild(0).getType()));
        target.setAttribute("parameters", parameterNames(node.getChildByFieldName("parameters"), text));

        TSNode returnType = node.getChildByFieldName("return_type");
        if (present(returnType)) {
            target.setAttribute("return_type", text.of(returnType));
        }
        List<String> decorators = decorators(node, text);
        if (!decorators.isEmpty()) {
            target.setAttribute("decorators", decorators);
        }
    }

    private static void classDefinition(TSNode node, SourceText text, AstNode target) {
        target.setAttribute("name", text.of(node.getChildByFieldName("name")));

        List<String> bases = new ArrayList<>();
        TSNode superclasses = node.getChildByFieldName("superclasses");
        if (present(superclasses)) {
            for (int i = 0; i < superclasses.getNamedChildCount(); i++) {
                TSNode base = superclasses.getNamedChild(i);
                String kind = base.getType();
                if ("identifier".equals(kind) || "attribute".equals(kind)) {
                    bases.add(text.of(base));
                }
            }
        }
        target.setAttribute("base_classes", bases);

        List<String> decorators = decorators(node, text);
        if (!decorators.isEmpty()) {
            target.setAttribute("decorators", decorators);
        }
    }

    /**
     * Plain positional names: *args, **kwargs and separators are left out.
     */
    private static List<String> parameterNames(TSNode parameters, SourceText text) {
        List<String> names = new ArrayList<>();
        if (!present(parameters)) {
            return names;
        }
        for (int i = 0; i < parameters.getNamedChildCount(); i++) {
            TSNode param = parameters.getNamedChild(i);
            switch (param.getType()) {
                case "identifier" -> names.add(text.of(param));
                case "typed_parameter" -> {
                    TSNode first = param.getNamedChild(0);
                    if (present(first) && "identifier".equals(first.getType())) {
                        names.add(text.of(first));
                    }
                }
                case "default_parameter", "typed_default_parameter" ->
                        names.add(text.of(param.getChildByFieldName("name")));
                default -> { }
            }
        }
        return names;
    }

    /**
     * Decorators sit on the wrapping decorated_definition, not on the definition itself.
     */
    private static List<String> decorators(TSNode definition, SourceText text) {
        List<String> names = new ArrayList<>();
        TSNode parent = definition.getParent();
        if (!present(parent) || !"decorated_definition".equals(parent.getType())) {
            return names;
        }
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            TSNode child = parent.getNamedChild(i);
            if ("decorator".equals(child.getType())) {
                names.add(decoratorName(child, text));
            }
        }
        return names;
    }

    private static String decoratorName(TSNode decorator, SourceText text) {
        TSNode expression = decorator.getNamedChild(0);
        return calleeName(expression, text);
    }

    /**
     * Short name of a callee: the identifier itself, or the last attribute of a dotted access.
     */
    private static String calleeName(TSNode expression, SourceText text) {
        if (!present(expression)) {
            return "";
        }
        return switch (expression.getType()) {
            case "identifier" -> text.of(expression);
            case "attribute" -> text.of(expression.getChildByFieldName("attribute"));
            case "call" -> calleeName(expression.getChildByFieldName("function"), text);
            default -> text.of(expression);
        };
    }

    // ---- expressions ----

    private static void fieldOperator(TSNode node, SourceText text, AstNode target) {
        TSNode operator = node.getChildByFieldName("operator");
        if (present(operator)) {
            target.setAttribute("operator", text.of(operator));
        }
    }

    private static void comparison(TSNode node, SourceText text, AstNode target) {
        List<String> operators = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            String token = node.getChild(i).getType();
            if (COMPARISON_OPERATORS.contains(token)) {
                operators.add(token);
            }
        }
        if (!operators.isEmpty()) {
            target.setAttribute("operator", operators.get(0));
        }
        if (operators.size() > 1) {
            target.setAttribute("operators", operators);
        }
    }

    private static void call(TSNode node, SourceText text, AstNode target) {
        TSNode function = node.getChildByFieldName("function");
        if (present(function) && ("identifier".equals(function.getType()) || "attribute".equals(function.getType()))) {
            target.setAttribute("function_name", calleeName(function, text));
        }
    }

    private static void assignment(TSNode node, SourceText text, AstNode target) {
        TSNode type = node.getChildByFieldName("type");
        if (present(type)) {
            target.setAttribute("annotation", text.of(type));
        }
    }

    // ---- imports ----

    private static void importStatement(TSNode node, SourceText text, AstNode target) {
        target.setAttribute("type", "import");
        List<Map<String, Object>> names = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            addImportName(node.getNamedChild(i), text, names);
        }
        target.setAttribute("names", names);
    }

    private static void importFrom(TSNode node, SourceText text, AstNode target) {
        TSNode moduleName = node.getChildByFieldName("module_name");
        String module = null;
        int level = 0;
        if (present(moduleName)) {
            if ("relative_import".equals(moduleName.getType())) {
                String relative = text.of(moduleName);
                while (level < relative.length() && relative.charAt(level) == '.') {
                    level++;
                }
                String rest = relative.substring(level).trim();
                module = rest.isEmpty() ? null : rest;
            } else {
                module = text.of(moduleName);
            }
        }
        target.setAttribute("type", "from");
        target.setAttribute("module", module);
        target.setAttribute("level", level);

        List<Map<String, Object>> names = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (present(moduleName) && child.getStartByte() == moduleName.getStartByte()) {
                continue;
            }
            addImportName(child, text, names);
        }
        target.setAttribute("names", names);
    }

    private static void futureImport(TSNode node, SourceText text, AstNode target) {
        importStatement(node, text, target);
        target.setAttribute("type", "from");
        target.setAttribute("module", "__future__");
        target.setAttribute("level", 0);
    }

    private static void addImportName(TSNode child, SourceText text, List<Map<String, Object>> names) {
        Map<String, Object> name = new LinkedHashMap<>();
        switch (child.getType()) {
            case "dotted_name" -> name.put("name", text.of(child));
            case "aliased_import" -> {
                name.put("name", text.of(child.getChildByFieldName("name")));
                name.put("alias", text.of(child.getChildByFieldName("alias")));
            }
            case "wildcard_import" -> name.put("name", "*");
            default -> {
                return;
            }
        }
        names.add(name);
    }

    // ---- literals ----

    private static void literal(AstNode target, Object value, DataType dataType) {
        target.setAttribute("value", AstNodes.normalizeNumber(value));
        target.setAttribute("data_type", dataType.value());
    }

    private static void collection(TSNode node, SourceText text, AstNode target) {
        target.setAttribute("collection", node.getType());
    }

    static void integerLiteral(String raw, AstNode target) {
        String digits = raw.replace("_", "").toLowerCase(Locale.ROOT);
        if (digits.endsWith("j")) {
            literal(target, raw, DataType.ANY);
            return;
        }
        if (digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        int radix = 10;
        if (digits.startsWith("0x")) {
            radix = 16;
        } else if (digits.startsWith("0o")) {
            radix = 8;
        } else if (digits.startsWith("0b")) {
            radix = 2;
        }
        if (radix != 10) {
            digits = digits.substring(2);
        }
        try {
            literal(target, AstNodes.parseInteger(digits, radix), DataType.INTEGER);
        } catch (NumberFormatException e) {
            literal(target, raw, DataType.ANY);
        }
    }

    static void floatLiteral(String raw, AstNode target) {
        String digits = raw.replace("_", "");
        if (digits.toLowerCase(Locale.ROOT).endsWith("j")) {
            literal(target, raw, DataType.ANY);
            return;
        }
        double value;
        try {
            value = Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            literal(target, raw, DataType.ANY);
            return;
        }
        // out-of-range literals overflow to infinity, which JSON cannot carry as a number
        if (Double.isFinite(value)) {
            literal(target, value, DataType.FLOAT);
        } else {
            literal(target, raw, DataType.ANY);
        }
    }

    static void stringLiteral(String raw, AstNode target) {
        int prefixEnd = 0;
        while (prefixEnd < raw.length() && Character.isLetter(raw.charAt(prefixEnd))) {
            prefixEnd++;
        }
        String prefix = raw.substring(0, prefixEnd).toLowerCase(Locale.ROOT);
        String quoted = raw.substring(prefixEnd);

        int quote = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        String body = quoted.length() >= 2 * quote ? quoted.substring(quote, quoted.length() - quote) : "";
        if (!prefix.contains("r")) {
            body = unescape(body);
        }
        // bytes are not text
        literal(target, body, prefix.contains("b") ? DataType.ANY : DataType.STRING);
    }

    private static void concatenatedString(TSNode node, SourceText text, AstNode target) {
        StringBuilder value = new StringBuilder();
        AstNode part = new AstNode(target.getType());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if ("string".equals(child.getType())) {
                stringLiteral(text.of(child), part);
                value.append(part.getAttribute("value"));
            }
        }
        literal(target, value.toString(), DataType.STRING);
    }

    private static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case '\\', '\'', '"' -> sb.append(next);
                case '\n' -> { }
                default -> sb.append('\\').append(next);
            }
        }
        return sb.toString();
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }
}
