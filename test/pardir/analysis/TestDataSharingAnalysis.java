package pardir.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pardir.hir.*;

public class TestDataSharingAnalysis {

    private final Symbol a = array("a", 1);
    private final Symbol b = array("b", 1);
    private final Symbol i = scalar("i");
    private final Symbol k = scalar("k");
    private final Symbol n = scalar("n");
    private final Symbol s = real("s");
    private final Symbol tmp = real("tmp");

    private Directive parallel(Statement... body) {
        Directive region = region(DirectiveKind.PARALLEL, body);
        routine("work", symbols(a, b, i, k, n, s, tmp), region);
        return region;
    }

    private static void assertDisjoint(ClassificationResult result) {
        List<String> all = new ArrayList<String>();
        all.addAll(result.getPrivate());
        all.addAll(result.getFirstprivate());
        all.addAll(result.getShared());
        for (String name : all) {
            assertEquals(name + " appears in two lists", 1,
                    Collections.frequency(all, name));
        }
    }

    /*
     * k = 5
     * do i = 1, n
     *   tmp = a(i)
     *   b(i) = tmp * k
     * enddo
     */
    @Test
    public void testScalarWrittenBeforeLoopAndTemporaryInLoop() {
        Directive region = parallel(
                assign(ref(k), lit(5)),
                loop(i, lit(1), ref(n),
                        assign(ref(tmp), aref(a, ref(i))),
                        assign(aref(b, ref(i)), mul(ref(tmp), ref(k)))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(Arrays.asList("i", "tmp"), result.getPrivate());
        assertEquals(Arrays.asList("k", "n"), result.getShared());
        assertEquals(Arrays.asList("a", "b"), result.getSharedArrays());
        assertTrue(result.getFirstprivate().isEmpty());
        assertDisjoint(result);
        assertEquals("default(shared), private(i, tmp), shared(a, b, k, n)",
                result.toAnnotation().toString());
    }

    @Test
    public void testAccumulatorStaysShared() {
        Directive region = parallel(loop(i, lit(1), ref(n),
                assign(ref(s), add(ref(s), aref(a, ref(i))))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(Arrays.asList("i"), result.getPrivate());
        assertEquals(Arrays.asList("n", "s"), result.getShared());
    }

    @Test
    public void testSingleAccessIsShared() {
        Directive region = parallel(loop(i, lit(1), ref(n),
                assign(ref(tmp), lit(0))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertTrue(result.getShared().contains("tmp"));
        assertFalse(result.getPrivate().contains("tmp"));
    }

    @Test
    public void testWriteOutsideLoopIsShared() {
        Directive region = parallel(assign(ref(tmp), lit(0)),
                assign(aref(a, lit(1)), ref(tmp)));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(Arrays.asList("tmp"), result.getShared());
        assertTrue(result.getPrivate().isEmpty());
    }

    @Test
    public void testKernelLocalsArePrivate() {
        KernelCall call = new KernelCall("compute",
                Arrays.asList(ref(a), ref(n)), Arrays.asList("W", "a"));
        Directive region = parallel(loop(i, lit(1), ref(n), call,
                assign(aref(b, ref(i)), lit(0))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(Arrays.asList("a", "i", "w"), result.getPrivate());
        assertEquals(Arrays.asList("b"), result.getSharedArrays());
        assertDisjoint(result);
    }

    @Test(expected = InternalConsistencyError.class)
    public void testEmptyKernelLocalName() {
        KernelCall call = new KernelCall("compute", Arrays.asList(ref(a)),
                Arrays.asList(""));
        DataSharingAnalysis.classifyParallel(parallel(call));
    }

    @Test
    public void testConstantsAreLeftOut() {
        Symbol c = constant("nx", "64");
        Directive region = parallel(loop(i, lit(1), ref(c),
                assign(aref(a, ref(i)), ref(c))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertFalse(result.getShared().contains("nx"));
        assertFalse(result.getPrivate().contains("nx"));
        assertEquals(Arrays.asList("a"), result.getSharedArrays());
    }

    @Test
    public void testStructureComponentsAreShared() {
        Symbol grid = new Symbol("grid", new StructureType("grid_type"));
        Directive region = parallel(loop(i, lit(1), ref(n),
                assign(new StructureReference(grid, new Member("sum")),
                        lit(0)),
                assign(aref(a, ref(i)),
                        new StructureReference(grid, new Member("sum")))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertTrue(result.getShared().contains("grid"));
        assertFalse(result.getPrivate().contains("grid"));
    }

    @Test
    public void testStructureWithArrayComponentListedOnce() {
        Symbol grid = new Symbol("grid",
                new StructureType("grid_type")
                        .addComponent("data",
                                new ArrayType(ScalarType.REAL_TYPE, 1))
                        .addComponent("nx", ScalarType.INTEGER_TYPE));
        Directive region = parallel(loop(i, lit(1), ref(n),
                assign(new StructureReference(grid, new ArrayMember("data",
                                Arrays.<Expression>asList(ref(i)))),
                        new StructureReference(grid, new Member("nx")))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(Arrays.asList("grid"), result.getSharedArrays());
        assertFalse(result.getShared().contains("grid"));
        assertEquals("default(shared), private(i), shared(grid, n)",
                result.toAnnotation().toString());
    }

    @Test
    public void testSymbolTableResolvesNames() {
        Symbol declared = array("tmp", 1);
        SymbolTable table = new Routine("scope").getSymbolTable();
        table.add(declared);
        Directive region = region(DirectiveKind.PARALLEL,
                loop(i, lit(1), ref(n), assign(ref(tmp), lit(0)),
                        assign(aref(a, ref(i)), ref(tmp))));
        ClassificationResult result =
                DataSharingAnalysis.classifyParallel(region, table);
        assertEquals(Arrays.asList("a", "tmp"), result.getSharedArrays());
        assertEquals(Arrays.asList("i"), result.getPrivate());
    }

    @Test
    public void testAnalysisDoesNotModifyTree() {
        Directive region = parallel(loop(i, lit(1), ref(n),
                assign(ref(tmp), aref(a, ref(i))),
                assign(aref(b, ref(i)), ref(tmp))));
        String before = region.toString();
        ClassificationResult first =
                DataSharingAnalysis.classifyParallel(region);
        ClassificationResult second =
                DataSharingAnalysis.classifyParallel(region);
        assertEquals(before, region.toString());
        assertEquals(first.toString(), second.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStandaloneDirectiveHasNoRegion() {
        DataSharingAnalysis.classifyParallel(standalone(DirectiveKind.BARRIER));
    }

}
