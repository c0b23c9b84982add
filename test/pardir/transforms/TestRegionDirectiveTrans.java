package pardir.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static pardir.hir.IRFixtures.*;

import java.util.Arrays;

import org.junit.Test;

import pardir.analysis.NestingError;
import pardir.analysis.NestingRule;
import pardir.analysis.UnsupportedPatternError;
import pardir.hir.*;

public class TestRegionDirectiveTrans {

    private final Symbol a = array("a", 1);
    private final Symbol c = array("c", 2);
    private final Symbol i = scalar("i");
    private final Symbol j = scalar("j");
    private final Symbol k = scalar("k");
    private final Symbol n = scalar("n");
    private final Symbol tmp = real("tmp");

    @Test
    public void testParallelRegionGetsClauses() {
        Assignment init = assign(ref(k), lit(5));
        Loop loop = loop(i, lit(1), ref(n),
                assign(ref(tmp), aref(a, ref(i))),
                assign(aref(a, ref(i)), mul(ref(tmp), ref(k))));
        Routine routine = routine("work", symbols(a, i, k, n, tmp), init, loop);

        Directive parallel = new RegionDirectiveTrans(DirectiveKind.PARALLEL)
                .apply(Arrays.asList(init, loop));

        assertEquals(1, routine.countStatements());
        assertSame(parallel, routine.getStatement(0));
        assertEquals(Arrays.asList(init, loop),
                parallel.getBody().getStatements());
        assertSame(parallel.getBody(), loop.getParent());
        assertEquals("omp parallel default(shared), private(i, tmp), " +
                "shared(a, k, n)", parallel.getBeginString());
        assertTrue(IRTools.checkConsistency(routine));
    }

    @Test
    public void testCollapsedCombinedRegion() {
        Loop nest = loop(i, lit(1), ref(n),
                loop(j, lit(1), ref(n), assign(aref(c, ref(i), ref(j)),
                        lit(0))));
        routine("work", symbols(c, i, j, n), nest);
        Directive directive =
                new RegionDirectiveTrans(DirectiveKind.PARALLEL_DO)
                        .setCollapse(2).apply(Arrays.asList(nest));
        assertEquals("omp parallel do collapse(2) default(shared), " +
                "private(i, j), shared(c, n)", directive.getBeginString());
        assertEquals("omp end parallel do", directive.getEndString());
    }

    @Test
    public void testTaskGetsDependences() {
        Loop loop = loop(i, lit(1), ref(n),
                assign(aref(a, ref(i)), aref(a, sub(ref(i), lit(1)))));
        Directive single = region(DirectiveKind.SINGLE, loop);
        routine("work", symbols(a, i, n),
                region(DirectiveKind.PARALLEL, single));
        Directive task = new RegionDirectiveTrans(DirectiveKind.TASK)
                .apply(Arrays.asList(loop));
        assertSame(task, single.getBody().getStatement(0));
        assertEquals("omp task private(i), firstprivate(n), shared(a), " +
                "depend(in: a(i - (n - 1))), depend(out: a(i))",
                task.getBeginString());
    }

    @Test
    public void testFailedClausesRestoreTree() {
        Assignment write = assign(aref(a, ref(j)), lit(0));
        Loop loop = loop(i, lit(1), ref(n), write);
        Directive single = region(DirectiveKind.SINGLE, loop);
        Routine routine = routine("work", symbols(a, i, j, n),
                assign(ref(j), lit(1)), region(DirectiveKind.PARALLEL, single));
        String before = routine.toString();
        try {
            new RegionDirectiveTrans(DirectiveKind.TASK)
                    .apply(Arrays.asList(loop));
            fail("a shared index cannot be used in a task");
        } catch (UnsupportedPatternError e) {
            // expected
        }
        assertEquals(before, routine.toString());
        assertSame(single.getBody(), loop.getParent());
        assertEquals(1, single.getBody().countStatements());
        assertFalse(hasTask(routine));
        assertTrue(IRTools.checkConsistency(routine));
    }

    private static boolean hasTask(Traversable t) {
        DFIterator<Directive> iter = new DFIterator<Directive>(t,
                Directive.class);
        while (iter.hasNext()) {
            if (iter.next().getKind() == DirectiveKind.TASK) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void testNestingIsCheckedBeforeChange() {
        Loop loop = loop(i, lit(1), ref(n), assign(aref(a, ref(i)), lit(0)));
        Routine routine = routine("work", symbols(a, i, n), loop);
        String before = routine.toString();
        try {
            new RegionDirectiveTrans(DirectiveKind.SINGLE)
                    .apply(Arrays.asList(loop));
            fail("single needs a parallel region");
        } catch (NestingError e) {
            assertEquals(NestingRule.SERIAL_NEEDS_PARALLEL, e.getRule());
        }
        assertEquals(before, routine.toString());
        assertSame(routine, loop.getParent());
    }

    @Test
    public void testEnclosedDirectivesAreChecked() {
        Directive inner = region(DirectiveKind.PARALLEL,
                loop(i, lit(1), ref(n), assign(aref(a, ref(i)), lit(0))));
        Routine routine = routine("work", symbols(a, i, n), inner);
        try {
            new RegionDirectiveTrans(DirectiveKind.PARALLEL)
                    .apply(Arrays.asList(inner));
            fail("parallel regions cannot be nested");
        } catch (NestingError e) {
            assertEquals(NestingRule.PARALLEL_IN_PARALLEL, e.getRule());
        }
        assertSame(routine, inner.getParent());
    }

    @Test(expected = TransformationError.class)
    public void testStatementsMustBeContiguous() {
        Assignment first = assign(ref(k), lit(1));
        Assignment second = assign(ref(tmp), lit(2));
        Assignment third = assign(ref(n), lit(3));
        routine("work", symbols(k, tmp, n), first, second, third);
        new RegionDirectiveTrans(DirectiveKind.PARALLEL)
                .apply(Arrays.asList(first, third));
    }

    @Test(expected = TransformationError.class)
    public void testStatementsMustBeInSchedule() {
        new RegionDirectiveTrans(DirectiveKind.PARALLEL)
                .validate(Arrays.asList(assign(ref(k), lit(1))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStandaloneKindIsRejected() {
        new RegionDirectiveTrans(DirectiveKind.BARRIER);
    }

}
