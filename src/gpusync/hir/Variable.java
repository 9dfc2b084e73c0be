package gpusync.hir;

/**
* An integer scalar variable: a loop index, a thread index, or a symbolic
* size parameter such as a kernel argument.
*/
public class Variable implements Symbol {

    private final String name;

    public Variable(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("variable name is empty");
        }
        this.name = name;
    }

    public String getSymbolName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
