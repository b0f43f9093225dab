package util.print;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;

/**
 * Write out a control flow graph for a function body in graphviz dot format. Blocks containing findings can be
 * highlighted.
 */
public class CFGWriter {

    /**
     * Code for the function to be written
     */
    private final FunctionBody body;
    /**
     * Ids of blocks drawn highlighted
     */
    private final Set<Integer> highlighted;
    /**
     * If true then code will be included in CFG, otherwise it will just be basic block numbers
     */
    private boolean verbose;
    /**
     * Holds the string representation of the basic blocks
     */
    private final Map<BasicBlock, String> bbStrings = new HashMap<>();
    /**
     * String to prepend to statements
     */
    private String prefix;
    /**
     * String to append to statements
     */
    private String postfix;

    /**
     * Create a writer for the given body
     *
     * @param body
     *            function to be printed
     */
    public CFGWriter(FunctionBody body) {
        this(body, Collections.<Integer> emptySet());
    }

    /**
     * Create a writer for the given body that highlights some blocks
     *
     * @param body
     *            function to be printed
     * @param highlighted
     *            ids of the blocks to highlight
     */
    public CFGWriter(FunctionBody body, Set<Integer> highlighted) {
        assert body != null : "Cannot print CFG for null body";
        this.body = body;
        this.highlighted = highlighted;
    }

    /**
     * Write out the graph to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @param prefix
     *            prepended to each statement (e.g. "\t" to indent)
     * @param postfix
     *            append this string to each statement (e.g. "\\l" to left justify each statement on its own line)
     * @throws IOException
     *             writer issues
     */
    public final void write(Writer writer, String prefix, String postfix) throws IOException {
        this.prefix = prefix;
        this.postfix = postfix;
        double spread = 1.0;
        writer.write("digraph G {\n" + "node [shape=record];\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread
                + ";\n" + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n" + "edge [fontsize=10]"
                + ";\n");

        writeGraph(writer);

        writer.write("\n};\n");
    }

    /**
     * Write out the control flow graph with the code for the basic block written on each node.
     *
     * @param writer
     *            writer to write the graph to
     * @param prefix
     *            prepended to each statement
     * @param postfix
     *            appended to each statement
     * @throws IOException
     *             writer issues
     */
    public final void writeVerbose(Writer writer, String prefix, String postfix) throws IOException {
        this.verbose = true;
        write(writer, prefix, postfix);
    }

    /**
     * Write the cfg for the given body to a dot file in the given directory with the filename equal to the function
     * name prepended with "cfg_" and followed by the function's position in its input, so that functions whose
     * names sanitize to the same string get distinct files
     *
     * @param body
     *            to write
     * @param highlighted
     *            ids of the blocks to highlight
     * @param dir
     *            output directory
     * @param index
     *            position of the function in its input
     * @return name of the file written, null if it could not be written
     */
    public static final String writeToFile(FunctionBody body, Set<Integer> highlighted, String dir, int index) {
        CFGWriter cfg = new CFGWriter(body, highlighted);
        String fullFilename = dir + File.separator + "cfg_" + fileNameFor(body.getName(), index) + ".dot";
        try (Writer out = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(fullFilename),
                                                                    StandardCharsets.UTF_8))) {
            cfg.writeVerbose(out, "", "\\l");
            System.err.println("DOT written to: " + fullFilename);
            return fullFilename;
        } catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
            return null;
        }
    }

    /**
     * Replace characters that are awkward in file names (path separators, generics, spaces)
     *
     * @param functionName
     *            function name
     * @param index
     *            position of the function in its input
     * @return string safe to use in a file name
     */
    static String fileNameFor(String functionName, int index) {
        return functionName.replaceAll("[^A-Za-z0-9_.-]", "_") + "_" + index;
    }

    /**
     * Write all the nodes and edges in the CFG to the given writer
     *
     * @param writer
     *            writer to write the graph to
     * @throws IOException
     *             writer issues
     */
    private void writeGraph(Writer writer) throws IOException {
        for (BasicBlock current : body.getBlocks()) {
            String currentString = getStringForBasicBlock(current);
            if (highlighted.contains(current.getId())) {
                writer.write("\t\"" + currentString + "\" [color=red, fontcolor=red];\n");
            }
            Terminator t = current.getTerminator();
            List<Integer> normal = t.getNormalSuccessors();
            for (int i = 0; i < normal.size(); i++) {
                String succString = getStringForBasicBlock(body.getBlock(normal.get(i)));
                String edgeLabel = "[label=\"" + getNormalEdgeLabel(t, i) + "\"]";
                writer.write("\t\"" + currentString + "\" -> \"" + succString + "\" " + edgeLabel + ";\n");
            }
            if (t.getUnwindSuccessor() != null) {
                String succString = getStringForBasicBlock(body.getBlock(t.getUnwindSuccessor()));
                writer.write("\t\"" + currentString + "\" -> \"" + succString + "\" [label=\"UNWIND\", style=dashed];\n");
            }
        }
    }

    /**
     * Get the string representation of the basic block
     *
     * @param bb
     *            basic block to get a string for
     * @return string for <code>bb</code>
     */
    private String getStringForBasicBlock(BasicBlock bb) {
        String bbString = bbStrings.get(bb);
        if (bbString == null) {
            StringBuilder sb = new StringBuilder();
            sb.append("BB" + bb.getId() + "\\l");
            if (bb.getId() == body.getEntryId()) {
                sb.append("ENTRY\\l");
            }
            if (verbose) {
                for (Statement s : bb.getStatements()) {
                    sb.append(prefix + PrettyPrinter.statementString(s) + postfix);
                }
                sb.append(prefix + PrettyPrinter.terminatorString(bb.getTerminator()) + postfix);
            }
            bbString = escapeDot(sb.toString());
            bbStrings.put(bb, bbString);
        }
        return bbString;
    }

    /**
     * Properly escape the string so it will be properly formatted in dot
     *
     * @param s
     *            string to escape
     * @return dot-safe string
     */
    private static String escapeDot(String s) {
        String escaped = s.replace("\"", "\\\"").replace("\n", "\\l");
        // record-shaped nodes give these characters a meaning
        for (String c : new String[] { "{", "}", "<", ">", "|" }) {
            escaped = escaped.replace(c, "\\" + c);
        }
        return escaped;
    }

    /**
     * Label for the i-th normal successor edge of a terminator
     *
     * @param t
     *            terminator
     * @param i
     *            index of the successor
     * @return edge label
     */
    protected String getNormalEdgeLabel(Terminator t, int i) {
        if (t.getKind() == Terminator.Kind.SWITCH) {
            return "CASE " + i;
        }
        return "NORMAL";
    }
}
