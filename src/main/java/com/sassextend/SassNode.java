package com.sassextend;

import com.sassextend.context.Context;
import com.sassextend.json.NodeJsonReader;
import com.sassextend.node.Node;
import com.sassextend.node.NodeConversion;
import com.sassextend.node.NodeException;
import com.sassextend.output.NodeFormatter;
import com.sassextend.selector.ComplexSelector;
import com.sassextend.selector.SelectorParser;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "sass-node", mixinStandardHelpOptions = true, version = "1.0",
         description = "Convert selectors to the node trees used by @extend weaving, and back")
public class SassNode implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(SassNode.class);

    static final int EXIT_USER_ERROR = 1;
    static final int EXIT_INTERNAL_ERROR = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "A selector list, or a JSON node tree with --reverse")
    private String input;

    @ArgGroup(exclusive = true, multiplicity = "0..1")
    private Mode mode;

    /** What to do with the input; the three modes can't be combined. */
    static class Mode {
        @Option(names = {"-r", "--reverse"}, description = "Read a JSON node tree and print the selector it describes")
        boolean reverse;

        @ArgGroup(exclusive = false)
        ContainsOptions contains;

        @ArgGroup(exclusive = false)
        OutputOptions output;
    }

    static class ContainsOptions {
        @Option(names = "--contains", paramLabel = "SELECTOR", required = true,
                description = "Print whether the input selector list contains this selector")
        String selector;

        @Option(names = "--ignore-order", description = "With --contains, ignore the order of simple selectors")
        boolean ignoreOrder;
    }

    static class OutputOptions {
        @Option(names = {"-j", "--json"}, description = "Print node trees as JSON")
        boolean json;

        @Option(names = {"-p", "--pretty"}, description = "Spread node trees over several lines")
        boolean pretty;
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line whose usage errors exit with {@link #EXIT_USER_ERROR}, keeping
     * {@link #EXIT_INTERNAL_ERROR} for broken invariants.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new SassNode());
        CommandLine.IParameterExceptionHandler usageHandler = cmd.getParameterExceptionHandler();
        cmd.setParameterExceptionHandler((ex, args) -> {
            usageHandler.handleParseException(ex, args);
            return EXIT_USER_ERROR;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Context ctx = new Context("sass-node");
        try {
            boolean reverse = mode != null && mode.reverse;
            ContainsOptions contains = mode != null ? mode.contains : null;
            OutputOptions output = mode != null && mode.output != null ? mode.output : new OutputOptions();
            if (reverse) {
                Node node = new NodeJsonReader().parse(input, ctx);
                ComplexSelector chain = NodeConversion.nodeToChain(node, ctx);
                out.println(chain.toCss());
            } else {
                SelectorParser parser = new SelectorParser();
                MutableList<ComplexSelector> selectors = parser.parseList(input);
                MutableList<Node> trees = selectors.<Node>collect(selector -> NodeConversion.chainToNode(selector, ctx));

                if (contains != null) {
                    Node sought = NodeConversion.chainToNode(parser.parse(contains.selector), ctx);
                    out.println(Node.createCollection(trees).contains(sought, !contains.ignoreOrder));
                } else {
                    NodeFormatter formatter = new NodeFormatter(output.pretty);
                    for (Node tree : trees) {
                        out.println(output.json ? formatter.formatJson(tree) : formatter.format(tree));
                    }
                }
            }
            out.flush();
            LOG.debug("Finished with {}", ctx);
            return 0;
        } catch (NodeException e) {
            LOG.error("Internal error while processing '{}'", input, e);
            err.println("Internal error: " + e.getMessage());
            return EXIT_INTERNAL_ERROR;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USER_ERROR;
        }
    }
}
