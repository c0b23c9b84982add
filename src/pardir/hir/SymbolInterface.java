package pardir.hir;

/**
* Describes how a symbol is brought into its scope.
*/
public abstract class SymbolInterface {

    protected SymbolInterface() {
    }

    /** Symbol declared in the scope that owns it. */
    public static final class Local extends SymbolInterface {
        @Override
        public String toString() {
            return "Local";
        }
    }

    /** Symbol passed in as a routine argument. */
    public static final class Argument extends SymbolInterface {
        @Override
        public String toString() {
            return "Argument";
        }
    }

    /** Symbol imported from a module. */
    public static final class Imported extends SymbolInterface {

        private final String module;

        public Imported(String module) {
            this.module = module;
        }

        public String getModule() {
            return module;
        }

        @Override
        public String toString() {
            return "Imported(" + module + ")";
        }
    }

    /** Compile-time constant with a folded value. */
    public static final class Constant extends SymbolInterface {

        private final String value;

        public Constant(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return "Constant(" + value + ")";
        }
    }

}
