package pardir.hir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for the trees used by the tests.
 */
public final class IRFixtures {

    private IRFixtures() {
    }

    public static Symbol scalar(String name) {
        return new Symbol(name, ScalarType.INTEGER_TYPE);
    }

    public static Symbol real(String name) {
        return new Symbol(name, ScalarType.REAL_TYPE);
    }

    public static Symbol array(String name, int rank) {
        return new Symbol(name, new ArrayType(ScalarType.REAL_TYPE, rank));
    }

    public static Symbol constant(String name, String value) {
        return new Symbol(name, ScalarType.INTEGER_TYPE,
                new SymbolInterface.Constant(value));
    }

    public static Reference ref(Symbol symbol) {
        return new Reference(symbol);
    }

    public static Literal lit(long value) {
        return new Literal(value);
    }

    public static BinaryOperation add(Expression lhs, Expression rhs) {
        return new BinaryOperation(BinaryOperation.Operator.ADD, lhs, rhs);
    }

    public static BinaryOperation sub(Expression lhs, Expression rhs) {
        return new BinaryOperation(BinaryOperation.Operator.SUB, lhs, rhs);
    }

    public static BinaryOperation mul(Expression lhs, Expression rhs) {
        return new BinaryOperation(BinaryOperation.Operator.MUL, lhs, rhs);
    }

    public static ArrayReference aref(Symbol symbol, Expression... indices) {
        return new ArrayReference(symbol, Arrays.asList(indices));
    }

    /** Returns {@code LBOUND(ref, dim):UBOUND(ref, dim):1}. */
    public static Range fullRange(Reference base, int dim) {
        return new Range(BinaryOperation.lbound(base.clone(), dim),
                BinaryOperation.ubound(base.clone(), dim), lit(1));
    }

    public static Assignment assign(Reference lhs, Expression rhs) {
        return new Assignment(lhs, rhs);
    }

    public static Schedule schedule(Statement... stmts) {
        return new Schedule(Arrays.asList(stmts));
    }

    public static Loop loop(Symbol var, Expression start, Expression stop,
                            Statement... body) {
        return new Loop(var, start, stop, lit(1), schedule(body));
    }

    public static Directive region(DirectiveKind kind, Statement... body) {
        return new Directive(kind, schedule(body));
    }

    public static Directive standalone(DirectiveKind kind) {
        return new Directive(kind);
    }

    /** Builds a routine holding the statements and declaring the symbols. */
    public static Routine routine(String name, List<Symbol> symbols,
                                  Statement... body) {
        Routine routine = new Routine(name, Arrays.asList(body));
        for (Symbol symbol : symbols) {
            routine.getSymbolTable().add(symbol);
        }
        return routine;
    }

    public static List<Symbol> symbols(Symbol... symbols) {
        return new ArrayList<Symbol>(Arrays.asList(symbols));
    }

}
