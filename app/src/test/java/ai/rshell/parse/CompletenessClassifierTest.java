package ai.rshell.parse;

import static org.junit.jupiter.api.Assertions.*;

import ai.rshell.parser.Opener;
import ai.rshell.parser.SourceRange;
import ai.rshell.parser.SyntaxNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompletenessClassifierTest {

    private static SyntaxNode node(String type, int startRow, int endRow, String text, SyntaxNode... children) {
        return SyntaxNode.of(type, new SourceRange(startRow, 0, endRow, text.length()), text, List.of(children));
    }

    private static SyntaxNode program(SyntaxNode... children) {
        return node("program", 0, 5, "", children);
    }

    @Test
    void cleanTreeIsComplete() {
        var result = CompletenessClassifier.classify(program(node("command", 0, 0, "ls")), false);
        assertInstanceOf(Classification.Complete.class, result);
        assertEquals(Classification.Kind.COMPLETE, result.kind());
    }

    @Test
    void emptyProgramIsComplete() {
        assertEquals(Classification.Kind.COMPLETE, CompletenessClassifier.classify(program(), false).kind());
    }

    @Test
    void flaggedTreeUsesLastCompoundStatement() {
        var root = program(
                node("if_statement", 0, 0, "if a; then b; fi"),
                node("command", 1, 1, "ls"),
                node("while_statement", 2, 3, "while true; do"),
                node("command", 4, 4, "echo"));
        var result = CompletenessClassifier.classify(root, true);
        var incomplete = assertInstanceOf(Classification.Incomplete.class, result);
        assertEquals(Opener.WHILE, incomplete.opener());
        assertEquals("done", incomplete.expectedCloser());
    }

    @Test
    void everyCompoundTypeMapsToItsCloser() {
        assertEquals("fi", closerFor("if_statement"));
        assertEquals("done", closerFor("for_statement"));
        assertEquals("done", closerFor("c_style_for_statement"));
        assertEquals("done", closerFor("until_statement"));
        assertEquals("esac", closerFor("case_statement"));
    }

    private static String closerFor(String type) {
        var result = CompletenessClassifier.classify(program(node(type, 0, 1, "x")), true);
        return ((Classification.Incomplete) result).expectedCloser();
    }

    @Test
    void flaggedTreeWithoutCompoundIsUnknown() {
        var result = CompletenessClassifier.classify(program(node("command", 0, 0, "echo")), true);
        var incomplete = assertInstanceOf(Classification.Incomplete.class, result);
        assertEquals(Opener.UNKNOWN, incomplete.opener());
        assertEquals("unknown", incomplete.expectedCloser());
    }

    @Test
    void errorNodeWinsOverEverything() {
        var error = node("ERROR", 2, 2, "then fi");
        var root = program(node("if_statement", 0, 1, "if a; then"), error);
        var result = CompletenessClassifier.classify(root, true);
        var syntaxError = assertInstanceOf(Classification.SyntaxError.class, result);
        assertSame(error, syntaxError.errorNode());
        assertEquals("syntax error at line 3, column 1 near 'then fi'", syntaxError.message());
    }

    @Test
    void errorNodeWinsEvenWithoutTheFlag() {
        var root = program(node("command", 0, 0, "x", node("ERROR", 0, 0, ")")));
        assertEquals(Classification.Kind.SYNTAX_ERROR, CompletenessClassifier.classify(root, false).kind());
    }

    @Test
    void nestedErrorNarrowsToInnermost() {
        var inner = node("ERROR", 1, 1, "fi");
        var outer = node("ERROR", 0, 1, "if then fi", node("word", 0, 0, "then"), inner);
        var root = program(outer, node("ERROR", 3, 3, "esac"));
        assertSame(inner, CompletenessClassifier.smallestErrorNode(root).orElseThrow());
    }

    @Test
    void firstErrorInPreOrderIsChosen() {
        var first = node("ERROR", 0, 0, ";;");
        var root = program(node("command", 0, 0, "a", first), node("ERROR", 1, 1, "done"));
        assertSame(first, CompletenessClassifier.smallestErrorNode(root).orElseThrow());
    }
}
