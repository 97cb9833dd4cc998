package ai.rshell.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class OpenerTest {

    @Test
    void keywordsMapToClosers() {
        assertEquals("fi", Opener.IF.closer());
        assertEquals("done", Opener.FOR.closer());
        assertEquals("done", Opener.WHILE.closer());
        assertEquals("done", Opener.UNTIL.closer());
        assertEquals("esac", Opener.CASE.closer());
        assertEquals("unknown", Opener.UNKNOWN.closer());
    }

    @Test
    void fromKeywordIgnoresUnknown() {
        assertEquals(Optional.of(Opener.WHILE), Opener.fromKeyword("while"));
        assertEquals(Optional.empty(), Opener.fromKeyword("unknown"));
        assertEquals(Optional.empty(), Opener.fromKeyword("fi"));
    }

    @Test
    void unknownIsNeverClosed() {
        assertTrue(Opener.CASE.closedBy("esac"));
        assertFalse(Opener.CASE.closedBy("done"));
        assertFalse(Opener.UNKNOWN.closedBy("unknown"));
    }

    @Test
    void statementTypesCarryOpeners() {
        assertEquals(Opener.FOR, StatementType.C_STYLE_FOR_STATEMENT.opener());
        assertEquals(Opener.IF, StatementType.fromGrammarType("if_statement").opener());
        assertTrue(StatementType.CASE_STATEMENT.isCompound());
        assertFalse(StatementType.PIPELINE.isCompound());
        assertFalse(StatementType.COMMENT.isExecutable());
        assertFalse(StatementType.ERROR.isExecutable());
        assertEquals(StatementType.OTHER, StatementType.fromGrammarType("word"));
        assertEquals(StatementType.OTHER, StatementType.fromGrammarType(""));
    }
}
