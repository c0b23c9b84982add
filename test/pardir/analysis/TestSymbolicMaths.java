package pardir.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import org.junit.Test;

import pardir.hir.*;

public class TestSymbolicMaths {

    private final SymbolicMaths maths = new SymbolicMaths();
    private final Symbol n = scalar("n");

    @Test
    public void testFoldLiterals() {
        Expression e = add(mul(lit(2), lit(3)), sub(lit(10), lit(4)));
        assertEquals(Long.valueOf(12), maths.getIntValue(e));
        assertEquals("12", maths.fold(e).toString());
        assertEquals("(2 * 3) + (10 - 4)", e.toString());
    }

    @Test
    public void testFoldKeepsSymbols() {
        Expression e = add(ref(n), sub(lit(3), lit(1)));
        assertEquals("n + 2", maths.fold(e).toString());
        assertNull(maths.getIntValue(e));
    }

    @Test
    public void testUnaryMinus() {
        Expression e = new UnaryOperation(UnaryOperation.Operator.MINUS,
                add(lit(1), lit(2)));
        assertEquals(Long.valueOf(-3), maths.getIntValue(e));
    }

    @Test
    public void testSubtractFoldsBounds() {
        assertEquals("9", maths.subtract(lit(10), lit(1)).toString());
        assertEquals("n - 1", maths.subtract(ref(n), lit(1)).toString());
    }

    @Test
    public void testInputIsNotModified() {
        Expression e = sub(lit(10), lit(1));
        maths.fold(e);
        assertEquals("10 - 1", e.toString());
    }

    @Test
    public void testEqualAfterFolding() {
        assertTrue(maths.equal(add(ref(n), lit(2)),
                add(ref(n), add(lit(1), lit(1)))));
        assertFalse(maths.equal(add(ref(n), lit(2)), add(lit(2), ref(n))));
    }

    @Test
    public void testOverflowIsLeftUnfolded() {
        Expression e = add(lit(Long.MAX_VALUE), lit(1));
        assertEquals(Long.MAX_VALUE + " + 1", maths.fold(e).toString());
        assertNull(maths.getIntValue(e));
        assertNull(maths.getIntValue(mul(lit(Long.MAX_VALUE), lit(2))));
        assertEquals(Long.MIN_VALUE + " - 1",
                maths.subtract(lit(Long.MIN_VALUE), lit(1)).toString());
    }

    @Test
    public void testLongLiteralIsLeftUnfolded() {
        Literal big = new Literal("123456789012345678901234",
                ScalarType.INTEGER_TYPE);
        assertSame(ScalarType.INTEGER_TYPE, big.getType());
        Expression e = sub(big, lit(1));
        assertEquals("123456789012345678901234 - 1", maths.fold(e).toString());
        assertNull(maths.getIntValue(big));
        assertEquals(Long.valueOf(4),
                maths.getIntValue(add(lit(2), lit(2))));
    }

}
