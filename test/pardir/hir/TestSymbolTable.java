package pardir.hir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static pardir.hir.IRFixtures.*;

import org.junit.Test;

public class TestSymbolTable {

    @Test
    public void testLookupWalksOutward() {
        Symbol n = scalar("n");
        Symbol tmp = scalar("tmp");
        Schedule inner = schedule(assign(ref(tmp), ref(n)));
        inner.getSymbolTable().add(tmp);
        Routine routine = routine("work", symbols(n), inner);
        Container container = new Container("mod");
        container.addRoutine(routine);

        assertSame(tmp, inner.getSymbolTable().lookup("tmp"));
        assertSame(n, inner.getSymbolTable().lookup("N"));
        assertNull(inner.getSymbolTable().lookupLocal("n"));
        assertNull(routine.getSymbolTable().lookup("tmp"));
        assertEquals(2, inner.getSymbolTable().getParentTables().size());
        assertSame(container.getSymbolTable(),
                routine.getSymbolTable().getParentTable());
    }

    @Test(expected = DuplicateSymbolException.class)
    public void testNamesAreUniquePerScope() {
        Routine routine = new Routine("work");
        routine.getSymbolTable().add(scalar("x"));
        routine.getSymbolTable().add(real("X"));
    }

    @Test
    public void testShadowingInInnerScope() {
        Symbol outer = scalar("x");
        Symbol shadow = real("x");
        Schedule inner = new Schedule();
        inner.getSymbolTable().add(shadow);
        Routine routine = routine("work", symbols(outer), inner);
        assertSame(shadow, inner.getSymbolTable().lookup("x"));
        assertSame(outer, routine.getSymbolTable().lookup("x"));
    }

    @Test
    public void testSymbolInterfaces() {
        Symbol c = constant("nx", "10");
        Symbol arg = new Symbol("field", new ArrayType(ScalarType.REAL_TYPE, 2),
                new SymbolInterface.Argument());
        Symbol imported = new Symbol("dt", ScalarType.REAL_TYPE,
                new SymbolInterface.Imported("constants_mod"));
        assertTrue(c.isConstant() && c.isScalar());
        assertTrue(arg.isArgument() && arg.isArray());
        assertEquals(2, arg.getRank());
        assertTrue(imported.isImported() && !imported.isArray());
    }

}
