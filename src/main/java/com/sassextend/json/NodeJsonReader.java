package com.sassextend.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.sassextend.context.Context;
import com.sassextend.node.Node;
import com.sassextend.output.NodeFormatter;
import com.sassextend.selector.Combinator;
import com.sassextend.selector.SelectorParser;
import com.sassextend.selector.SelectorSyntaxException;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the JSON form written by {@link NodeFormatter#formatJson(Node)} back into a node tree.
 */
public class NodeJsonReader {
    private final JsonFactory factory = new JsonFactory();
    private final SelectorParser selectorParser = new SelectorParser();

    public Node parse(InputStream input, Context ctx) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseDocument(parser, ctx);
        }
    }

    public Node parse(String json, Context ctx) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseDocument(parser, ctx);
        }
    }

    private Node parseDocument(JsonParser parser, Context ctx) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            throw new IOException("Empty JSON input");
        }
        Node node = parseValue(parser, token, ctx);
        if (parser.nextToken() != null) {
            throw new IOException("Unexpected content after the node tree at " + parser.getCurrentLocation());
        }
        return node;
    }

    private Node parseValue(JsonParser parser, JsonToken token, Context ctx) throws IOException {
        return switch (token) {
            case START_ARRAY -> parseCollection(parser, ctx);
            case START_OBJECT -> parseLeaf(parser, ctx);
            case VALUE_NULL -> Node.createNil();
            default -> throw new IOException("Unexpected JSON token: " + token + " at " + parser.getCurrentLocation());
        };
    }

    private Node.CollectionNode parseCollection(JsonParser parser, Context ctx) throws IOException {
        var children = Lists.mutable.<Node>empty();

        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token == null) {
                throw new IOException("Unterminated JSON array");
            }
            children.add(parseValue(parser, token, ctx));
        }

        return Node.createCollection(children);
    }

    private Node parseLeaf(JsonParser parser, Context ctx) throws IOException {
        if (parser.nextToken() != JsonToken.FIELD_NAME) {
            throw new IOException("Expected a \"selector\" or \"combinator\" field at " + parser.getCurrentLocation());
        }
        String fieldName = parser.getCurrentName();
        if (parser.nextToken() != JsonToken.VALUE_STRING) {
            throw new IOException("Field \"" + fieldName + "\" must be a string");
        }
        String text = parser.getText();

        Node leaf;
        if (NodeFormatter.SELECTOR_FIELD.equals(fieldName)) {
            try {
                leaf = Node.createSelector(ctx.newCompound(selectorParser.parseCompound(text).simpleSelectors()));
            } catch (SelectorSyntaxException e) {
                throw new IOException("Invalid compound selector \"" + text + "\": " + e.getMessage(), e);
            }
        } else if (NodeFormatter.COMBINATOR_FIELD.equals(fieldName)) {
            try {
                leaf = Node.createCombinator(Combinator.fromSymbol(text));
            } catch (IllegalArgumentException e) {
                throw new IOException(e.getMessage(), e);
            }
        } else {
            throw new IOException("Unknown node field: " + fieldName);
        }

        if (parser.nextToken() != JsonToken.END_OBJECT) {
            throw new IOException("Node objects must have exactly one field");
        }
        return leaf;
    }
}
