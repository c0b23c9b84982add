package pardir.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import java.util.Arrays;

import org.junit.Test;

import pardir.hir.*;

public class TestVariablesAccessInfo {

    private final Symbol a = array("a", 1);
    private final Symbol i = scalar("i");
    private final Symbol n = scalar("n");
    private final Symbol s = real("s");

    @Test
    public void testProgramOrder() {
        Loop loop = loop(i, lit(1), ref(n),
                assign(ref(s), add(ref(s), aref(a, ref(i)))));
        VariablesAccessInfo info = new VariablesAccessInfo(loop);
        assertEquals(Arrays.asList(new Signature("i"), new Signature("n"),
                new Signature("s"), new Signature("a")),
                info.getSignatures());

        VariableAccesses loop_var = info.get(new Signature("i"));
        assertEquals(AccessType.WRITE, loop_var.getFirst().getAccessType());
        assertSame(loop, loop_var.getFirst().getNode());
        assertSame(loop, loop_var.getFirst().getEnclosingLoop(null));

        VariableAccesses sum = info.get(new Signature("s"));
        assertEquals(2, sum.size());
        assertEquals(AccessType.READ, sum.getFirst().getAccessType());
        assertTrue(sum.isWritten() && sum.isRead());
        assertTrue(info.get(new Signature("a")).isArray());
    }

    @Test
    public void testIndexReadBeforeTargetWrite() {
        Assignment assign = assign(aref(a, ref(i)), lit(0));
        VariablesAccessInfo info = new VariablesAccessInfo(assign);
        assertEquals(Arrays.asList(new Signature("i"), new Signature("a")),
                info.getSignatures());
        assertFalse(info.get(new Signature("i")).isWritten());
        assertEquals(AccessType.WRITE,
                info.get(new Signature("a")).getFirst().getAccessType());
    }

    @Test
    public void testStructureSignature() {
        Symbol grid = new Symbol("grid", new StructureType("grid_type"));
        Assignment assign = assign(new StructureReference(grid,
                new Member("NX")), lit(4));
        VariablesAccessInfo info = new VariablesAccessInfo(assign);
        Signature sig = new Signature(Arrays.asList("grid", "nx"));
        assertTrue(info.contains(sig));
        assertTrue(sig.isStructure());
        assertEquals("grid%nx", sig.toString());
    }

    @Test
    public void testKernelArgumentsAreReadWrite() {
        KernelCall call = new KernelCall("compute",
                Arrays.asList(aref(a, ref(i)), add(ref(n), lit(1))));
        VariablesAccessInfo info = new VariablesAccessInfo(call);
        assertEquals(AccessType.READWRITE,
                info.get(new Signature("a")).getFirst().getAccessType());
        assertEquals(AccessType.READ,
                info.get(new Signature("i")).getFirst().getAccessType());
        assertEquals(AccessType.READ,
                info.get(new Signature("n")).getFirst().getAccessType());
    }

    @Test
    public void testEnclosingLoopStopsAtBoundary() {
        Assignment inner = assign(ref(s), lit(0));
        Loop loop = loop(i, lit(1), ref(n), inner);
        Directive region = region(DirectiveKind.PARALLEL, loop);
        VariablesAccessInfo info = new VariablesAccessInfo(region.getBody());
        AccessInfo write = info.get(new Signature("s")).getFirst();
        assertSame(loop, write.getEnclosingLoop(region));
        assertEquals(null, write.getEnclosingLoop(loop.getBody()));
    }

}
