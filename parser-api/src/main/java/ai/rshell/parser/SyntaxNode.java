package ai.rshell.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;

/**
 * A parse tree node, independent of the engine that produced it.
 *
 * @param type the grammar node type; {@value #ERROR_TYPE} marks input the grammar could not fit
 * @param statementType the closed classification of {@code type}
 * @param range source span
 * @param text raw source text covered by the node
 * @param children named children in source order
 * @param fields the subset of {@code children} that the grammar labels with a field name
 */
public record SyntaxNode(
        String type,
        StatementType statementType,
        SourceRange range,
        String text,
        List<SyntaxNode> children,
        Map<String, List<SyntaxNode>> fields) {

    public static final String ERROR_TYPE = "ERROR";

    public SyntaxNode {
        children = ImmutableList.copyOf(children);
        var fieldsCopy = ImmutableMap.<String, List<SyntaxNode>>builder();
        fields.forEach((name, nodes) -> fieldsCopy.put(name, ImmutableList.copyOf(nodes)));
        fields = fieldsCopy.build();
    }

    public static SyntaxNode of(String type, SourceRange range, String text, List<SyntaxNode> children) {
        return new SyntaxNode(type, StatementType.fromGrammarType(type), range, text, children, Map.of());
    }

    /**
     * Identifier that stays the same across re-parses as long as the node keeps its type and position.
     */
    public String id() {
        return type + "@" + range;
    }

    public boolean isError() {
        return ERROR_TYPE.equals(type);
    }

    public int endRow() {
        return range.endRow();
    }

    public List<SyntaxNode> field(String name) {
        return fields.getOrDefault(name, List.of());
    }

    public @Nullable SyntaxNode firstField(String name) {
        var nodes = field(name);
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /** Pre-order search. */
    public Optional<SyntaxNode> findFirst(Predicate<SyntaxNode> predicate) {
        if (predicate.test(this)) {
            return Optional.of(this);
        }
        for (var child : children) {
            var found = child.findFirst(predicate);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public List<SyntaxNode> findAll(Predicate<SyntaxNode> predicate) {
        var results = new ArrayList<SyntaxNode>();
        walk(node -> {
            if (predicate.test(node)) {
                results.add(node);
            }
        });
        return results;
    }

    public boolean containsError() {
        return findFirst(SyntaxNode::isError).isPresent();
    }

    /** Visits this node and its descendants in pre-order. */
    public void walk(Consumer<SyntaxNode> visitor) {
        visitor.accept(this);
        for (var child : children) {
            child.walk(visitor);
        }
    }

    @Override
    public String toString() {
        return "SyntaxNode[" + id() + ", children=" + children.size() + "]";
    }
}
