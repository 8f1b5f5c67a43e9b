package com.sassextend.output;

import com.sassextend.context.Context;
import com.sassextend.node.Node;
import com.sassextend.node.NodeConversion;
import com.sassextend.selector.Combinator;
import com.sassextend.selector.ComplexSelector;
import com.sassextend.selector.SelectorParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NodeFormatterTest {

    private final Context ctx = new Context();
    private final SelectorParser parser = new SelectorParser();

    private Node sel(String compound) {
        return Node.createSelector(ComplexSelector.of(parser.parseCompound(compound)), ctx);
    }

    @Test
    public void testCompactText() {
        Node node = NodeConversion.chainToNode(parser.parse(".a .b > .c"), ctx);
        assertEquals("[.a, ' ', .b, >, .c]", new NodeFormatter(false).format(node));
        assertEquals(node.toString(), new NodeFormatter(false).format(node));
    }

    @Test
    public void testLeaves() {
        NodeFormatter formatter = new NodeFormatter(true);
        assertEquals("a.b:hover", formatter.format(sel("a.b:hover")));
        assertEquals("~", formatter.format(Node.createCombinator(Combinator.GENERAL_SIBLING)));
        assertEquals("nil", formatter.format(Node.createNil()));
        assertEquals("[]", formatter.format(Node.createCollection()));
    }

    @Test
    public void testPrettyTextIndentsNestedCollections() {
        Node node = Node.createCollection(Node.createCollection(sel(".a")), Node.createNil(), Node.createCollection());

        String expected = """
                [
                  [
                    .a
                  ],
                  nil,
                  []
                ]""";
        assertEquals(expected, new NodeFormatter(true).format(node));
    }

    @Test
    public void testCompactJson() {
        Node node = Node.createCollection(
                sel(".a"), Node.createCombinator(Combinator.DESCENDANT), sel(".b"), Node.createNil(),
                Node.createCollection(Node.createCombinator(Combinator.CHILD)));

        assertEquals("[{\"selector\":\".a\"},{\"combinator\":\" \"},{\"selector\":\".b\"},null,[{\"combinator\":\">\"}]]",
                new NodeFormatter(false).formatJson(node));
    }

    @Test
    public void testPrettyJsonSpansLines() {
        String json = new NodeFormatter(true).formatJson(Node.createCollection(sel(".a"), sel(".b")));
        assertTrue(json.contains("\n"), json);
        assertTrue(json.contains("\"selector\" : \".a\""), json);
    }

    @Test
    public void testJsonOfLeafNodes() {
        NodeFormatter formatter = new NodeFormatter(false);
        assertEquals("null", formatter.formatJson(Node.createNil()));
        assertEquals("{\"selector\":\"#x\"}", formatter.formatJson(sel("#x")));
    }
}
