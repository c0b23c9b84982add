package pardir.hir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import java.util.Arrays;

import org.junit.Test;

public class TestDirective {

    @Test
    public void testBeginAndEndStrings() {
        assertEquals("omp do schedule(static)",
                region(DirectiveKind.DO).setSchedule("static").getBeginString());
        assertEquals("omp loop collapse(2)",
                region(DirectiveKind.LOOP).setCollapse(2).getBeginString());
        assertEquals("omp taskloop grainsize(32) nogroup",
                region(DirectiveKind.TASKLOOP).setGrainsize(32)
                        .setNogroup(true).getBeginString());
        assertEquals("omp single nowait",
                region(DirectiveKind.SINGLE).setNowait(true).getBeginString());
        assertEquals("omp end parallel do",
                region(DirectiveKind.PARALLEL_DO).getEndString());
        assertEquals("omp taskwait",
                standalone(DirectiveKind.TASKWAIT).getBeginString());
        assertNull(standalone(DirectiveKind.BARRIER).getEndString());
    }

    @Test
    public void testClausesAreAppended() {
        Directive parallel = region(DirectiveKind.PARALLEL);
        OmpAnnotation clauses = new OmpAnnotation(OmpAnnotation.DEFAULT,
                "shared");
        clauses.put(OmpAnnotation.PRIVATE, Arrays.asList("a", "b"));
        clauses.put(OmpAnnotation.FIRSTPRIVATE, Arrays.<String>asList());
        parallel.setClauses(clauses);
        assertEquals("omp parallel default(shared), private(a, b)",
                parallel.getBeginString());
        assertEquals(parallel, clauses.getAnnotatable());
    }

    @Test(expected = StructuralError.class)
    public void testGrainsizeExcludesNumTasks() {
        region(DirectiveKind.TASKLOOP).setGrainsize(8).setNumTasks(4);
    }

    @Test(expected = StructuralError.class)
    public void testCollapseMustBePositive() {
        region(DirectiveKind.DO).setCollapse(0);
    }

    @Test(expected = StructuralError.class)
    public void testKindMustAcceptParameter() {
        region(DirectiveKind.PARALLEL).setNowait(true);
    }

    @Test(expected = StructuralError.class)
    public void testStandaloneKindHasNoBody() {
        new Directive(DirectiveKind.BARRIER, new Schedule());
    }

    @Test
    public void testCapabilities() {
        assertTrue(DirectiveKind.PARALLEL_DO.hasCapability(
                DirectiveCapability.COMBINED));
        assertTrue(DirectiveKind.TASKLOOP.hasCapability(
                DirectiveCapability.TASK_UNIT));
        assertTrue(!DirectiveKind.BARRIER.hasBody());
        assertEquals(1, region(DirectiveKind.DO).getCollapse());
    }

    @Test
    public void testCloneCopiesParameters() {
        Directive loop = region(DirectiveKind.DO).setCollapse(2);
        Directive copy = loop.clone();
        copy.setNowait(true);
        assertEquals("omp do collapse(2)", loop.getBeginString());
        assertEquals("omp do collapse(2) nowait", copy.getBeginString());
    }

}
