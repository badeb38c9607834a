package polyalgebra;

/**
 * Named function applied to a single argument, e.g. {@code sin(x)}.
 * Polynomial code treats it as an opaque indeterminate.
 */
public final class Function extends Expression {
    private final String functionName;
    private final Expression argument;

    Function(String functionName, Expression argument) {
        this.functionName = functionName;
        this.argument = argument;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Expression getArgument() {
        return argument;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Function)) {
            return false;
        }
        Function function = (Function) o;
        return functionName.equals(function.functionName) && argument.equals(function.argument);
    }

    @Override
    public int hashCode() {
        return 31 * functionName.hashCode() + argument.hashCode();
    }

    @Override
    public String toString() {
        return functionName + "(" + argument + ")";
    }
}
