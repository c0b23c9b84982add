package pardir.hir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static pardir.hir.IRFixtures.*;

import org.junit.Test;

/**
 * Structural rules of the tree: every change is checked before it is
 * committed and the parent links follow the child lists.
 */
public class TestNode {

    @Test
    public void testAssignmentLinksChildren() {
        Symbol a = array("a", 1);
        Symbol i = scalar("i");
        Assignment assign = assign(aref(a, ref(i)), add(ref(i), lit(1)));
        assertSame(assign, assign.getLHS().getParent());
        assertSame(assign, assign.getRHS().getParent());
        assertEquals("a(i) = i + 1", assign.toString());
        assertTrue(IRTools.checkConsistency(assign));
    }

    @Test
    public void testInvalidChildLeavesNodeUnchanged() {
        Symbol x = scalar("x");
        Assignment assign = assign(ref(x), lit(1));
        Expression old_rhs = assign.getRHS();
        try {
            assign.setRHS(new Range(lit(1), lit(2)));
            fail("a range is not a value");
        } catch (StructuralError e) {
            // expected
        }
        assertSame(old_rhs, assign.getRHS());
        assertSame(assign, old_rhs.getParent());
    }

    @Test(expected = NotAnOrphanException.class)
    public void testChildWithParentIsRejected() {
        Symbol x = scalar("x");
        Literal one = lit(1);
        assign(ref(x), one);
        assign(ref(x), one);
    }

    @Test
    public void testSetChildDetachesOldChild() {
        Symbol x = scalar("x");
        Assignment assign = assign(ref(x), lit(1));
        Expression old_rhs = assign.getRHS();
        assign.setRHS(lit(2));
        assertNull(old_rhs.getParent());
        assertEquals("x = 2", assign.toString());
    }

    @Test(expected = StructuralError.class)
    public void testRoutineCannotBeNestedInSchedule() {
        schedule(new Routine("inner"));
    }

    @Test(expected = StructuralError.class)
    public void testLoopVariableMustBeScalar() {
        loop(array("a", 1), lit(1), lit(10));
    }

    @Test(expected = StructuralError.class)
    public void testArrayReferenceNeedsIndex() {
        aref(array("a", 1));
    }

    @Test
    public void testScheduleInsertAndRemove() {
        Symbol x = scalar("x");
        Assignment first = assign(ref(x), lit(1));
        Assignment second = assign(ref(x), lit(2));
        Schedule sched = schedule(second);
        sched.addStatement(0, first);
        assertEquals(2, sched.countStatements());
        assertEquals(0, first.getPosition());
        assertEquals(1, second.getPosition());
        second.detach();
        assertEquals(1, sched.countStatements());
        assertNull(second.getParent());
    }

    @Test
    public void testCloneIsDetachedDeepCopy() {
        Symbol a = array("a", 1);
        Symbol i = scalar("i");
        Loop loop = loop(i, lit(1), lit(10), assign(aref(a, ref(i)), lit(0)));
        Schedule sched = schedule(loop);
        Loop copy = loop.clone();
        assertNull(copy.getParent());
        assertSame(sched, loop.getParent());
        assertEquals(loop.toString(), copy.toString());
        assertTrue(copy.getBody() != loop.getBody());
        assertSame(copy, copy.getBody().getParent());
        copy.verify();
    }

    @Test
    public void testStatementsUseIdentityEquality() {
        Symbol x = scalar("x");
        Assignment one = assign(ref(x), lit(1));
        Assignment two = assign(ref(x), lit(1));
        assertTrue(!one.equals(two));
        assertEquals(one.getRHS(), two.getRHS());
    }

    @Test
    public void testStructureAccessSignature() {
        Symbol grid = new Symbol("grid",
                new StructureType("grid_type").addComponent("data",
                        new ArrayType(ScalarType.REAL_TYPE, 1)));
        Symbol i = scalar("i");
        StructureReference sref = new StructureReference(grid,
                new ArrayMember("data", java.util.Arrays.asList(ref(i))));
        assertEquals("grid%data(i)", sref.toString());
        assertEquals(java.util.Arrays.asList("grid", "data"),
                sref.getSignature());
        assertEquals(1, sref.getComponentIndices().get(1).size());
        assertSame(sref, sref.getMember().getParentReference());
        assertEquals(1, sref.getMember().getDepth());
    }

}
