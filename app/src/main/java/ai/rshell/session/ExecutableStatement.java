package ai.rshell.session;

import ai.rshell.parser.SyntaxNode;

/**
 * A top-level statement ready for the execution engine.
 *
 * @param node the statement node, a direct child of the session's root
 * @param sequence 1-based position in the session's emission order; restarts at 1 after a reset
 */
public record ExecutableStatement(SyntaxNode node, int sequence) {}
