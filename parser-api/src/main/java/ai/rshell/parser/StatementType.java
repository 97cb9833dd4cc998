package ai.rshell.parser;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Closed set of node kinds the session layer cares about. Grammar node types outside this set map to
 * {@link #OTHER}.
 */
public enum StatementType {
    PROGRAM("program", false, null),
    COMMAND("command", true, null),
    PIPELINE("pipeline", true, null),
    LIST("list", true, null),
    SUBSHELL("subshell", true, null),
    COMPOUND_STATEMENT("compound_statement", true, null),
    IF_STATEMENT("if_statement", true, Opener.IF),
    FOR_STATEMENT("for_statement", true, Opener.FOR),
    C_STYLE_FOR_STATEMENT("c_style_for_statement", true, Opener.FOR),
    WHILE_STATEMENT("while_statement", true, Opener.WHILE),
    UNTIL_STATEMENT("until_statement", true, Opener.UNTIL),
    CASE_STATEMENT("case_statement", true, Opener.CASE),
    FUNCTION_DEFINITION("function_definition", true, null),
    DECLARATION_COMMAND("declaration_command", true, null),
    UNSET_COMMAND("unset_command", true, null),
    TEST_COMMAND("test_command", true, null),
    NEGATED_COMMAND("negated_command", true, null),
    REDIRECTED_STATEMENT("redirected_statement", true, null),
    VARIABLE_ASSIGNMENT("variable_assignment", true, null),
    VARIABLE_ASSIGNMENTS("variable_assignments", true, null),
    COMMENT("comment", false, null),
    ERROR("ERROR", false, null),
    OTHER("", false, null);

    private static final Map<String, StatementType> BY_GRAMMAR_TYPE = new HashMap<>();

    static {
        for (var type : values()) {
            if (type != OTHER) {
                BY_GRAMMAR_TYPE.put(type.grammarType, type);
            }
        }
    }

    private final String grammarType;
    private final boolean executable;
    private final @Nullable Opener opener;

    StatementType(String grammarType, boolean executable, @Nullable Opener opener) {
        this.grammarType = grammarType;
        this.executable = executable;
        this.opener = opener;
    }

    public static StatementType fromGrammarType(String grammarType) {
        return BY_GRAMMAR_TYPE.getOrDefault(grammarType, OTHER);
    }

    public String grammarType() {
        return grammarType;
    }

    /** Whether a top-level node of this type can be handed to the execution engine. */
    public boolean isExecutable() {
        return executable;
    }

    /** True for the if/for/while/until/case statements, which need a closing keyword. */
    public boolean isCompound() {
        return opener != null;
    }

    public @Nullable Opener opener() {
        return opener;
    }
}
