package util.print;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import analysis.lifetime.ir.FunctionBody;
import analysis.lifetime.ir.Operand;
import analysis.lifetime.ir.Place;
import analysis.lifetime.ir.Projection;
import analysis.lifetime.ir.Rvalue;
import analysis.lifetime.ir.Statement;
import analysis.lifetime.ir.Terminator;
import analysis.lifetime.ir.TypeDescriptor;
import analysis.lifetime.ir.Variable;

public class PrettyPrinterTest {

    @Test
    public void testStatements() {
        Place fieldOfDeref = Place.of("b", Projection.deref(), Projection.field(1));
        assertEquals("x = (*b).1", PrettyPrinter.statementString(new Statement(Place.of("x"),
                                                                               Rvalue.copy(fieldOfDeref))));
        assertEquals("r = &(o as 1).0",
                     PrettyPrinter.statementString(new Statement(Place.of("r"),
                                                                 Rvalue.borrow(Place.of("o", Projection.downcast(1),
                                                                                        Projection.field(0))))));
        assertEquals("Add(move a, c, const 1)",
                     PrettyPrinter.rvalueString(Rvalue.other("Add", Arrays.asList(Operand.move(Place.of("a")),
                                                                                  Operand.copy(Place.of("c")),
                                                                                  Operand.constant("1")))));
    }

    @Test
    public void testTerminators() {
        assertEquals("goto -> bb4", PrettyPrinter.terminatorString(new Terminator.Goto(4, null)));
        assertEquals("switch(d) -> [bb1, bb2]",
                     PrettyPrinter.terminatorString(new Terminator.Switch(Place.of("d"), Arrays.asList(1, 2), null)));
        assertEquals("core::mem::drop(move v) -> bb2, unwind bb3",
                     PrettyPrinter.terminatorString(new Terminator.Call("core::mem::drop",
                                                                        Arrays.asList(Operand.move(Place.of("v"))),
                                                                        null, 2, 3, null)));
        assertEquals("abort() -> diverges",
                     PrettyPrinter.terminatorString(new Terminator.Call("abort", Collections.<Operand> emptyList(),
                                                                        null, null, null, null)));
        assertEquals("release(*p) -> bb1", PrettyPrinter.terminatorString(new Terminator.Release(Place.deref("p"), 1,
                                                                                                  null, null)));
    }

    @Test
    public void testBody() {
        FunctionBody body = new FunctionBody.Builder("f")
                .variable(Variable.staticItem("G", TypeDescriptor.scalar("u32")))
                .local("x")
                .block(0, new Terminator.Release(Place.of("x"), 1, null, null))
                .block(1, new Terminator.Return(null))
                .build();
        String expected = "fn f (entry bb0)\n" + "let static G: u32\n" + "let x: ?\n" + "bb0:\n"
                + "    release(x) -> bb1\n" + "bb1:\n" + "    return\n";
        assertEquals(expected, PrettyPrinter.bodyString(body, "", "\n"));
    }
}
