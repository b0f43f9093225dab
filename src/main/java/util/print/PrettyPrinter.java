package util.print;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Iterator;
import java.util.List;

import analysis.lifetime.ir.BasicBlock;
import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Operand;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Rvalue;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.ir.Variable;
import analysis.lifetime.place.PlaceIdEncoder;

/**
 * Pretty printer for function bodies. Places are written in their canonical form (e.g. <code>(*x).0</code>) so the
 * printed code matches the places named in findings.
 */
public class PrettyPrinter {

    /**
     * Get a string for the basic block
     *
     * @param bb
     *            Basic block to write out
     * @param prefix
     *            prepend this string to each statement (e.g. "\t" for indentation)
     * @param postfix
     *            append this string to each statement (e.g. "\n" to place each statement on a new line)
     * @return String for pretty printed basic block
     */
    public static String basicBlockString(BasicBlock bb, String prefix, String postfix) {
        try (StringWriter sw = new StringWriter()) {
            writeBasicBlock(bb, sw, prefix, postfix);
            return sw.toString();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Get a string for a whole function body, declarations first
     *
     * @param body
     *            function to write out
     * @param prefix
     *            prepend this string to each line
     * @param postfix
     *            append this string to each line
     * @return String for pretty printed body
     */
    public static String bodyString(FunctionBody body, String prefix, String postfix) {
        try (StringWriter sw = new StringWriter()) {
            writeBody(body, sw, prefix, postfix);
            return sw.toString();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     * Write out the declarations and blocks of a function body
     *
     * @param body
     *            function to write out
     * @param writer
     *            writer to write to
     * @param prefix
     *            prepend this string to each line
     * @param postfix
     *            append this string to each line
     * @throws IOException
     *             writer issues
     */
    public static void writeBody(FunctionBody body, Writer writer, String prefix, String postfix)
                                                                                                throws IOException {
        writer.write(prefix + "fn " + body.getName() + " (entry bb" + body.getEntryId() + ")" + postfix);
        for (Variable v : body.getVariables().values()) {
            writer.write(prefix + "let " + variableString(v) + postfix);
        }
        for (BasicBlock bb : body.getBlocks()) {
            writer.write(prefix + "bb" + bb.getId() + ":" + postfix);
            writeBasicBlock(bb, writer, prefix + "    ", postfix);
        }
    }

    /**
     * Write out the statements and terminator of a basic block
     *
     * @param bb
     *            Basic block to write out
     * @param writer
     *            writer to write to
     * @param prefix
     *            prepend this string to each statement
     * @param postfix
     *            append this string to each statement
     * @throws IOException
     *             writer issues
     */
    public static void writeBasicBlock(BasicBlock bb, Writer writer, String prefix, String postfix)
                                                                                                   throws IOException {
        for (Statement s : bb.getStatements()) {
            writer.write(prefix + statementString(s) + postfix);
        }
        writer.write(prefix + terminatorString(bb.getTerminator()) + postfix);
    }

    public static String variableString(Variable v) {
        return (v.isStatic() ? "static " : "") + v.getName() + ": " + v.getType().getName();
    }

    /**
     * Canonical string for a place
     *
     * @param p
     *            place
     * @return e.g. <code>x</code>, <code>**x</code> or <code>(x as 1).0</code>
     */
    public static String placeString(Place p) {
        return PlaceIdEncoder.encode(p.getBase(), p.getProjections()).toString();
    }

    public static String operandString(Operand o) {
        switch (o.getKind()) {
        case MOVE:
            return "move " + placeString(o.getPlace());
        case COPY:
            return placeString(o.getPlace());
        default:
            return "const " + o.getConstant();
        }
    }

    public static String rvalueString(Rvalue rv) {
        switch (rv.getKind()) {
        case MOVE:
            return "move " + placeString(rv.getSource());
        case COPY:
            return placeString(rv.getSource());
        case BORROW:
            return "&" + placeString(rv.getSource());
        default:
            return rv.getOperator() + "(" + operandsString(rv.getOperands()) + ")";
        }
    }

    public static String statementString(Statement s) {
        return placeString(s.getTarget()) + " = " + rvalueString(s.getRvalue());
    }

    /**
     * String for a terminator, including its successors
     *
     * @param t
     *            terminator
     * @return pretty printed terminator
     */
    public static String terminatorString(Terminator t) {
        String unwind = t.getUnwindSuccessor() == null ? "" : ", unwind bb" + t.getUnwindSuccessor();
        switch (t.getKind()) {
        case GOTO:
            return "goto -> bb" + ((Terminator.Goto) t).getTarget();
        case SWITCH:
            Terminator.Switch sw = (Terminator.Switch) t;
            String disc = sw.getDiscriminant() == null ? "const" : placeString(sw.getDiscriminant());
            return "switch(" + disc + ") -> " + blockList(sw.getNormalSuccessors());
        case CALL:
            Terminator.Call call = (Terminator.Call) t;
            StringBuilder sb = new StringBuilder();
            if (call.getDestination() != null) {
                sb.append(placeString(call.getDestination())).append(" = ");
            }
            sb.append(call.getCallee()).append("(").append(operandsString(call.getArgs())).append(")");
            sb.append(" -> ");
            sb.append(call.getNormalNext() == null ? "diverges" : "bb" + call.getNormalNext());
            sb.append(unwind);
            return sb.toString();
        case RELEASE:
            Terminator.Release r = (Terminator.Release) t;
            return "release(" + placeString(r.getPlace()) + ") -> bb" + r.getNext() + unwind;
        case RETURN:
            return "return";
        case UNREACHABLE:
            return "unreachable";
        default:
            throw new RuntimeException("Unhandled terminator kind " + t.getKind());
        }
    }

    private static String operandsString(List<Operand> ops) {
        StringBuilder sb = new StringBuilder();
        Iterator<Operand> iter = ops.iterator();
        while (iter.hasNext()) {
            sb.append(operandString(iter.next()));
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.toString();
    }

    private static String blockList(List<Integer> ids) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<Integer> iter = ids.iterator();
        while (iter.hasNext()) {
            sb.append("bb").append(iter.next());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append("]").toString();
    }
}
