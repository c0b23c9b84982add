package pardir.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import java.util.Arrays;

import org.junit.Test;

import pardir.hir.*;

public class TestArrayAccessModel {

    private final Symbol a = array("a", 2);
    private final Symbol b = array("b", 2);
    private final Symbol i = scalar("i");

    @Test
    public void testFullRange() {
        ArrayReference access = aref(a, fullRange(ref(a), 1), ref(i));
        assertTrue(ArrayAccessModel.isFullRange(access, 0));
        assertTrue(ArrayAccessModel.isLowerBound(access, 0));
        assertTrue(ArrayAccessModel.isUpperBound(access, 0));
        assertFalse(ArrayAccessModel.isFullRange(access, 1));
        assertEquals("a(LBOUND(a, 1):UBOUND(a, 1):1, i)", access.toString());
    }

    @Test
    public void testStepOtherThanOneIsNotFull() {
        Range range = new Range(BinaryOperation.lbound(ref(a), 1),
                BinaryOperation.ubound(ref(a), 1), lit(2));
        ArrayReference access = aref(a, range, ref(i));
        assertTrue(ArrayAccessModel.isLowerBound(access, 0));
        assertTrue(ArrayAccessModel.isUpperBound(access, 0));
        assertFalse(ArrayAccessModel.isFullRange(access, 0));
    }

    @Test
    public void testBoundsOfAnotherArray() {
        ArrayReference access = aref(a, fullRange(ref(b), 1), ref(i));
        assertFalse(ArrayAccessModel.isLowerBound(access, 0));
        assertFalse(ArrayAccessModel.isFullRange(access, 0));
    }

    @Test
    public void testBoundOfWrongDimension() {
        ArrayReference access = aref(a, ref(i), fullRange(ref(a), 1));
        assertFalse(ArrayAccessModel.isFullRange(access, 1));
        ArrayReference second = aref(a, ref(i), fullRange(ref(a), 2));
        assertTrue(ArrayAccessModel.isFullRange(second, 1));
    }

    @Test
    public void testHalfRange() {
        Range range = new Range(BinaryOperation.lbound(ref(a), 1), lit(5),
                lit(1));
        ArrayReference access = aref(a, range, ref(i));
        assertTrue(ArrayAccessModel.isLowerBound(access, 0));
        assertFalse(ArrayAccessModel.isUpperBound(access, 0));
        assertFalse(ArrayAccessModel.isFullRange(access, 0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDimensionOutOfRange() {
        ArrayAccessModel.isFullRange(aref(a, ref(i), ref(i)), 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDimension() {
        ArrayAccessModel.isLowerBound(aref(a, ref(i), ref(i)), -1);
    }

    /** Builds {@code s(outer)%b%c} with {@code c} not indexed. */
    private static ArrayOfStructuresReference boundAccess(Symbol s,
            long outer, String middle) {
        return new ArrayOfStructuresReference(s,
                new StructureMember(middle, new Member("c")),
                Arrays.asList(lit(outer)));
    }

    private static ArrayMember memberC(ArrayOfStructuresReference access) {
        StructureMember middle = (StructureMember)access.getMember();
        return (ArrayMember)middle.getMember();
    }

    private static ArrayOfStructuresReference structureAccess(Symbol s,
            Reference bound_ref) {
        Range range = new Range(BinaryOperation.lbound(bound_ref, 1),
                BinaryOperation.ubound(bound_ref.clone(), 1), lit(1));
        return new ArrayOfStructuresReference(s,
                new StructureMember("b",
                        new ArrayMember("c", Arrays.asList(range))),
                Arrays.asList(lit(3)));
    }

    @Test
    public void testMemberFullRange() {
        Symbol s = new Symbol("s", new ArrayType(
                new StructureType("grid_type"), 1));
        ArrayOfStructuresReference access =
                structureAccess(s, boundAccess(s, 3, "b"));
        assertEquals("s(3)%b%c(LBOUND(s(3)%b%c, 1):UBOUND(s(3)%b%c, 1):1)",
                access.toString());
        assertTrue(ArrayAccessModel.isFullRange(memberC(access), 0));
    }

    @Test
    public void testMemberWithDifferentOuterIndex() {
        Symbol s = new Symbol("s", new ArrayType(
                new StructureType("grid_type"), 1));
        ArrayOfStructuresReference access =
                structureAccess(s, boundAccess(s, 2, "b"));
        assertFalse(ArrayAccessModel.isFullRange(memberC(access), 0));
    }

    @Test
    public void testMemberWithDifferentComponent() {
        Symbol s = new Symbol("s", new ArrayType(
                new StructureType("grid_type"), 1));
        ArrayOfStructuresReference access =
                structureAccess(s, boundAccess(s, 3, "b2"));
        assertFalse(ArrayAccessModel.isFullRange(memberC(access), 0));
    }

    @Test
    public void testResolve() {
        ArrayReference access = aref(a, fullRange(ref(a), 1), add(ref(i), lit(1)));
        ArrayAccessDescriptor descriptor = ArrayAccessModel.resolve(access);
        assertEquals(2, descriptor.getNumDimensions());
        assertTrue(descriptor.isRange(0));
        assertFalse(descriptor.isRange(1));
        assertEquals(a, descriptor.getBaseSymbol());
    }

    @Test(expected = StructuralError.class)
    public void testResolveRankMismatch() {
        ArrayAccessModel.resolve(aref(a, ref(i)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testResolveScalar() {
        ArrayAccessModel.resolve(ref(i));
    }

}
