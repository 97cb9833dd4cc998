package ai.rshell.parse;

import ai.rshell.parser.SyntaxNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;

/**
 * JSON rendering of {@link SyntaxNode} trees for trace logs and diagnostics.
 *
 * <p>Each node becomes {@code {type, statement_type, start_row, start_col, end_row, end_col, text, fields,
 * children}}; {@code fields} maps a field name to the ids of the children carrying it.
 */
public final class SyntaxTreeJson {
    private static final ObjectMapper objectMapper =
            new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, false);

    private SyntaxTreeJson() {}

    public static ObjectNode toJson(SyntaxNode node) {
        var json = objectMapper.createObjectNode();
        var range = node.range();
        json.put("type", node.type());
        json.put("statement_type", node.statementType().name());
        json.put("start_row", range.startRow());
        json.put("start_col", range.startColumn());
        json.put("end_row", range.endRow());
        json.put("end_col", range.endColumn());
        json.put("text", node.text());

        var fields = json.putObject("fields");
        node.fields().forEach((name, nodes) -> {
            var ids = fields.putArray(name);
            nodes.forEach(n -> ids.add(n.id()));
        });

        var children = json.putArray("children");
        for (var child : node.children()) {
            children.add(toJson(child));
        }
        return json;
    }

    public static String render(SyntaxNode node) {
        try {
            return objectMapper.writeValueAsString(toJson(node));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
