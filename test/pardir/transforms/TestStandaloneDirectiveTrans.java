package pardir.transforms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static pardir.hir.IRFixtures.*;

import org.junit.Test;

import pardir.analysis.NestingError;
import pardir.analysis.NestingRule;
import pardir.hir.*;

public class TestStandaloneDirectiveTrans {

    private final Symbol x = scalar("x");
    private final Symbol y = scalar("y");

    @Test
    public void testInsertBeforeStatement() {
        Assignment first = assign(ref(x), lit(1));
        Assignment second = assign(ref(y), ref(x));
        Directive parallel = region(DirectiveKind.PARALLEL, first, second);
        Directive barrier = new StandaloneDirectiveTrans(DirectiveKind.BARRIER)
                .apply(second);
        assertEquals(3, parallel.getBody().countStatements());
        assertSame(barrier, parallel.getBody().getStatement(1));
        assertEquals("omp barrier", barrier.getBeginString());
    }

    @Test
    public void testNoInsertWithoutParallel() {
        Assignment stmt = assign(ref(x), lit(1));
        Routine routine = routine("work", symbols(x), stmt);
        try {
            new StandaloneDirectiveTrans(DirectiveKind.TASKWAIT).apply(stmt);
            fail("taskwait needs a parallel region");
        } catch (NestingError e) {
            // expected
        }
        assertEquals(1, routine.countStatements());
    }

    @Test
    public void testDeclareTargetOnlyAtRoutineStart() {
        Assignment first = assign(ref(x), lit(1));
        Assignment second = assign(ref(y), ref(x));
        Routine routine = routine("kernel", symbols(x, y), first, second);
        StandaloneDirectiveTrans trans =
                new StandaloneDirectiveTrans(DirectiveKind.DECLARE_TARGET);
        try {
            trans.apply(second);
            fail("declare target must open the routine");
        } catch (NestingError e) {
            assertEquals(NestingRule.FIRST_IN_ROUTINE, e.getRule());
        }
        Directive declare = trans.apply(first);
        assertSame(declare, routine.getStatement(0));
        assertEquals(3, routine.countStatements());
    }

    @Test(expected = TransformationError.class)
    public void testStatementMustBeInSchedule() {
        new StandaloneDirectiveTrans(DirectiveKind.BARRIER)
                .apply(assign(ref(x), lit(1)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegionKindIsRejected() {
        new StandaloneDirectiveTrans(DirectiveKind.PARALLEL);
    }

}
