package com.sassextend.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.sassextend.node.Node;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public class NodeFormatter {
    public static final String SELECTOR_FIELD = "selector";
    public static final String COMBINATOR_FIELD = "combinator";

    private final boolean prettyPrint;
    private final JsonFactory factory = new JsonFactory();

    public NodeFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(Node node) {
        StringBuilder sb = new StringBuilder();
        if (prettyPrint) {
            formatPretty(node, 0, sb);
        } else {
            sb.append(node);
        }
        return sb.toString();
    }

    private void formatPretty(Node node, int indent, StringBuilder sb) {
        if (!(node instanceof Node.CollectionNode collection)) {
            sb.append(node);
            return;
        }
        if (collection.isEmpty()) {
            sb.append("[]");
            return;
        }

        String indentStr = " ".repeat(indent);
        sb.append("[\n");
        boolean first = true;
        for (Node child : collection.children()) {
            if (!first) {
                sb.append(",\n");
            }
            first = false;

            sb.append(indentStr).append("  ");
            formatPretty(child, indent + 2, sb);
        }
        sb.append("\n").append(indentStr).append("]");
    }

    /**
     * Writes {@code node} as JSON: collections as arrays, nil as {@code null}, and selectors and combinators
     * as single-field objects, e.g. {@code [{"selector":".a"},{"combinator":">"},{"selector":".b"}]}.
     */
    public String formatJson(Node node) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(writer)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            writeJson(node, generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write node as JSON", e);
        }
        return writer.toString();
    }

    private void writeJson(Node node, JsonGenerator generator) throws IOException {
        if (node instanceof Node.CollectionNode collection) {
            generator.writeStartArray();
            for (Node child : collection.children()) {
                writeJson(child, generator);
            }
            generator.writeEndArray();
        } else if (node instanceof Node.SelectorNode selector) {
            generator.writeStartObject();
            generator.writeStringField(SELECTOR_FIELD, selector.selector().toCss());
            generator.writeEndObject();
        } else if (node instanceof Node.CombinatorNode combinator) {
            generator.writeStartObject();
            generator.writeStringField(COMBINATOR_FIELD, combinator.combinator().symbol());
            generator.writeEndObject();
        } else {
            generator.writeNull();
        }
    }
}
