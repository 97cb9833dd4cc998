package ai.rshell.parse;

import ai.rshell.parser.Opener;
import ai.rshell.parser.SyntaxNode;

/** Completeness of a parsed buffer. */
public sealed interface Classification permits Classification.Complete, Classification.Incomplete, Classification.SyntaxError {

    Kind kind();

    enum Kind {
        COMPLETE,
        INCOMPLETE,
        SYNTAX_ERROR
    }

    /** Every statement in the buffer is finished and valid. */
    record Complete() implements Classification {
        @Override
        public Kind kind() {
            return Kind.COMPLETE;
        }
    }

    /** Valid so far, waiting for the closing keyword of {@code opener}. */
    record Incomplete(Opener opener) implements Classification {
        @Override
        public Kind kind() {
            return Kind.INCOMPLETE;
        }

        public String expectedCloser() {
            return opener.closer();
        }
    }

    /**
     * The buffer cannot be completed into valid input.
     *
     * @param errorNode the smallest error node enclosing the offending text
     */
    record SyntaxError(SyntaxNode errorNode) implements Classification {
        @Override
        public Kind kind() {
            return Kind.SYNTAX_ERROR;
        }

        public String message() {
            var range = errorNode.range();
            return "syntax error at line %d, column %d near '%s'"
                    .formatted(range.startRow() + 1, range.startColumn() + 1, errorNode.text().strip());
        }
    }
}
