package gpusync.hir;

import java.util.List;

/**
* A call to a named function or compiler intrinsic. A buffer argument, as in
* {@code access_ptr}, is referenced through {@link #getBufferArgument}.
*/
public class FunctionCall extends Expression {

    private final String name;

    /** Buffer operand of pointer intrinsics, or null. */
    private final Buffer buffer;

    /**
    * Creates a call without a buffer operand.
    *
    * @param name the callee name.
    * @param args the arguments; they must be orphans.
    */
    public FunctionCall(String name, List<Expression> args) {
        this(name, null, args);
    }

    /**
    * Creates a call with a buffer operand, printed before the other
    * arguments.
    *
    * @param name the callee name.
    * @param buffer the buffer operand, may be null.
    * @param args the remaining arguments.
    */
    public FunctionCall(String name, Buffer buffer, List<Expression> args) {
        super();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("function name is empty");
        }
        this.name = name;
        this.buffer = buffer;
        if (args != null) {
            for (Expression arg : args) {
                addChild(arg);
            }
        }
    }

    public String getName() {
        return name;
    }

    public Buffer getBufferArgument() {
        return buffer;
    }

    public int getNumArguments() {
        return children.size();
    }

    public Expression getArgument(int n) {
        return getChild(n);
    }

    @Override
    public FunctionCall clone() {
        return (FunctionCall)super.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o)
            && name.equals(((FunctionCall)o).name)
            && buffer == ((FunctionCall)o).buffer;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(32);
        sb.append(name).append("(");
        boolean first = true;
        if (buffer != null) {
            sb.append(buffer.getSymbolName());
            first = false;
        }
        for (Traversable child : children) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(child);
            first = false;
        }
        sb.append(")");
        return sb.toString();
    }

    @Override
    public void accept(TraversableVisitor v) { v.visit(this); }
}
