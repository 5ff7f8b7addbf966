package ai.lintal.treesitter;

/** Constants for the tree-sitter Java grammar node kinds and field names used by the rules. */
public final class JavaNodeTypes {

    // ===== FILE LEVEL =====
    public static final String PROGRAM = "program";
    public static final String PACKAGE_DECLARATION = "package_declaration";
    public static final String IMPORT_DECLARATION = "import_declaration";

    // ===== TYPE DECLARATIONS AND BODIES =====
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String ANNOTATION_TYPE_DECLARATION = "annotation_type_declaration";
    public static final String CLASS_BODY = "class_body";
    public static final String INTERFACE_BODY = "interface_body";
    public static final String ENUM_BODY = "enum_body";
    public static final String ENUM_CONSTANT = "enum_constant";
    public static final String ENUM_BODY_DECLARATIONS = "enum_body_declarations";
    public static final String ANNOTATION_TYPE_BODY = "annotation_type_body";

    // ===== MEMBERS =====
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";
    public static final String COMPACT_CONSTRUCTOR_DECLARATION = "compact_constructor_declaration";
    public static final String CONSTRUCTOR_BODY = "constructor_body";
    public static final String STATIC_INITIALIZER = "static_initializer";
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String CONSTANT_DECLARATION = "constant_declaration";
    public static final String FORMAL_PARAMETERS = "formal_parameters";
    public static final String FORMAL_PARAMETER = "formal_parameter";
    public static final String SPREAD_PARAMETER = "spread_parameter";
    public static final String INFERRED_PARAMETERS = "inferred_parameters";

    // ===== DECLARATIONS =====
    public static final String LOCAL_VARIABLE_DECLARATION = "local_variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String MODIFIERS = "modifiers";
    public static final String FINAL = "final";

    // ===== STATEMENTS =====
    public static final String BLOCK = "block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String ENHANCED_FOR_STATEMENT = "enhanced_for_statement";
    public static final String SWITCH_EXPRESSION = "switch_expression";
    public static final String SWITCH_BLOCK = "switch_block";
    public static final String SWITCH_BLOCK_STATEMENT_GROUP = "switch_block_statement_group";
    public static final String SWITCH_RULE = "switch_rule";
    public static final String SWITCH_LABEL = "switch_label";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String TRY_WITH_RESOURCES_STATEMENT = "try_with_resources_statement";
    public static final String RESOURCE_SPECIFICATION = "resource_specification";
    public static final String RESOURCE = "resource";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String CATCH_FORMAL_PARAMETER = "catch_formal_parameter";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String LABELED_STATEMENT = "labeled_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String YIELD_STATEMENT = "yield_statement";
    public static final String SYNCHRONIZED_STATEMENT = "synchronized_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";
    public static final String EXPLICIT_CONSTRUCTOR_INVOCATION = "explicit_constructor_invocation";

    // ===== EXPRESSIONS =====
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String UPDATE_EXPRESSION = "update_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String TERNARY_EXPRESSION = "ternary_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String LAMBDA_EXPRESSION = "lambda_expression";
    public static final String INSTANCEOF_EXPRESSION = "instanceof_expression";
    public static final String TYPE_PATTERN = "type_pattern";
    public static final String RECORD_PATTERN_COMPONENT = "record_pattern_component";
    public static final String IDENTIFIER = "identifier";
    public static final String TYPE_IDENTIFIER = "type_identifier";
    public static final String SCOPED_IDENTIFIER = "scoped_identifier";
    public static final String UNDERSCORE_PATTERN = "underscore_pattern";
    public static final String TRUE = "true";

    // ===== EXTRAS =====
    public static final String LINE_COMMENT = "line_comment";
    public static final String BLOCK_COMMENT = "block_comment";

    // ===== FIELD NAMES =====
    public static final String FIELD_NAME = "name";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_OPERATOR = "operator";
    public static final String FIELD_RESOURCES = "resources";

    private JavaNodeTypes() {}

    public static boolean isComment(String kind) {
        return LINE_COMMENT.equals(kind) || BLOCK_COMMENT.equals(kind);
    }
}
