package pardir.hir;

import java.io.PrintWriter;
import java.util.List;

/**
* A subroutine or the main program.
*/
public class Routine extends Schedule {

    private final String name;

    private final boolean is_program;

    public Routine(String name) {
        this(name, false);
    }

    public Routine(String name, boolean is_program) {
        super();
        if (name == null || name.length() == 0) {
            throw new IllegalArgumentException("routine needs a name");
        }
        this.name = name;
        this.is_program = is_program;
    }

    public Routine(String name, List<? extends Statement> statements) {
        this(name, false);
        setStatements(statements);
    }

    public String getName() {
        return name;
    }

    public boolean isProgram() {
        return is_program;
    }

    @Override
    public void print(PrintWriter o) {
        String kind = (is_program) ? "program" : "subroutine";
        o.println(kind + " " + name);
        super.print(o);
        o.print("end " + kind + " " + name);
    }

    @Override
    public Routine clone() {
        return (Routine)super.clone();
    }

}
