package ai.rshell.treesitter;

import ai.rshell.parser.SourceRange;
import ai.rshell.parser.StatementType;
import ai.rshell.parser.SyntaxNode;
import ai.rshell.parser.TreeConverter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * Converts a Tree-sitter tree into {@link SyntaxNode}s. Anonymous nodes (keywords, punctuation) are dropped; named
 * children keep their order and, where the grammar labels them, their field name.
 */
public final class TreeSitterConverter implements TreeConverter<TSTree> {

    @Override
    public SyntaxNode convert(TSTree tree, String source) {
        var root = tree.getRootNode();
        if (root.isNull()) {
            throw new IllegalArgumentException("Tree has a null root node");
        }
        return convertNode(root, new SourceText(source));
    }

    private SyntaxNode convertNode(TSNode node, SourceText source) {
        var children = new ArrayList<SyntaxNode>();
        Map<String, List<SyntaxNode>> fields = new LinkedHashMap<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child == null || child.isNull() || !child.isNamed()) {
                continue;
            }
            var converted = convertNode(child, source);
            children.add(converted);
            var fieldName = node.getFieldNameForChild(i);
            if (fieldName != null) {
                fields.computeIfAbsent(fieldName, k -> new ArrayList<>()).add(converted);
            }
        }

        var type = node.getType();
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        var range = new SourceRange(start.getRow(), start.getColumn(), end.getRow(), end.getColumn());
        return new SyntaxNode(
                type,
                StatementType.fromGrammarType(type),
                range,
                source.slice(node.getStartByte(), node.getEndByte()),
                children,
                fields);
    }
}
