package com.sassextend.json;

import com.sassextend.context.Context;
import com.sassextend.node.Node;
import com.sassextend.output.NodeFormatter;
import com.sassextend.selector.Combinator;
import com.sassextend.selector.ComplexSelector;
import com.sassextend.selector.SelectorParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class NodeJsonReaderTest {

    private final Context ctx = new Context();
    private final SelectorParser parser = new SelectorParser();
    private final NodeJsonReader reader = new NodeJsonReader();

    private Node sel(String compound) {
        return Node.createSelector(ComplexSelector.of(parser.parseCompound(compound)), ctx);
    }

    @Test
    public void testReadsAllVariants() throws IOException {
        String json = "[{\"selector\":\".a.b\"}, {\"combinator\":\">\"}, [null, {\"combinator\":\" \"}], []]";

        Node node = reader.parse(json, ctx);

        assertEquals(Node.createCollection(
                sel(".a.b"),
                Node.createCombinator(Combinator.CHILD),
                Node.createCollection(Node.createNil(), Node.createCombinator(Combinator.DESCENDANT)),
                Node.createCollection()), node);
    }

    @Test
    public void testReadsFromStream() throws IOException {
        byte[] bytes = "{\"selector\":\"#main\"}".getBytes(StandardCharsets.UTF_8);
        assertEquals(sel("#main"), reader.parse(new ByteArrayInputStream(bytes), ctx));
    }

    @Test
    public void testReadsWhatTheFormatterWrites() throws IOException {
        Node node = Node.createCollection(
                Node.createCollection(sel("a:hover"), Node.createCombinator(Combinator.ADJACENT_SIBLING), sel("%p")),
                Node.createNil());

        for (boolean pretty : new boolean[] {false, true}) {
            String json = new NodeFormatter(pretty).formatJson(node);
            assertEquals(node, reader.parse(json, ctx));
        }
    }

    @Test
    public void testSelectorsAreAllocatedThroughContext() throws IOException {
        long before = ctx.allocationCount();
        reader.parse("[{\"selector\":\".a\"},{\"selector\":\".b\"}]", ctx);
        assertEquals(before + 2, ctx.allocationCount());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "42",
            "\"x\"",
            "[1]",
            "{}",
            "{\"color\":\"red\"}",
            "{\"selector\":1}",
            "{\"selector\":\".a\",\"combinator\":\">\"}",
            "{\"combinator\":\"|\"}",
            "{\"combinator\":\"\"}",
            "{\"selector\":\"..a\"}",
            "[{\"selector\":\".a\"}",
            "[] []"
    })
    public void testRejectsInvalidInput(String json) {
        assertThrows(IOException.class, () -> reader.parse(json, ctx));
    }
}
