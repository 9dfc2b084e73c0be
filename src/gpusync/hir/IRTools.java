package gpusync.hir;

import java.util.ArrayList;
import java.util.List;

/**
* Utility methods for searching and modifying the kernel IR.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Returns a copy of the expression where every reference to the variable
    * is replaced by a copy of <b>with</b>.
    *
    * @param e the original expression, which is not modified.
    * @param v the variable to be replaced.
    * @param with the replacing expression.
    * @return the substituted orphan expression.
    */
    public static Expression replaceSymbol(Expression e, Variable v,
                                           Expression with) {
        if (e instanceof Identifier && ((Identifier)e).getVariable() == v) {
            return with.clone();
        }
        Expression ret = e.clone();
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(ret);
        List<Identifier> ids = iter.getList(Identifier.class);
        for (Identifier id : ids) {
            if (id.getVariable() == v) {
                Traversable parent = id.getParent();
                int index = Tools.identityIndexOf(parent.getChildren(), id);
                id.setParent(null);
                parent.setChild(index, with.clone());
            }
        }
        return ret;
    }

    /** Checks if the subtree references the given symbol. */
    public static boolean containsSymbol(Traversable t, Symbol s) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        while (iter.hasNext()) {
            Traversable o = iter.next();
            if (o instanceof Identifier
                && ((Identifier)o).getVariable() == s) {
                return true;
            } else if (o instanceof BufferLoad
                && ((BufferLoad)o).getBuffer() == s) {
                return true;
            } else if (o instanceof FunctionCall
                && ((FunctionCall)o).getBufferArgument() == s) {
                return true;
            } else if (o instanceof BufferStore
                && ((BufferStore)o).getBuffer() == s) {
                return true;
            }
        }
        return false;
    }

    /**
    * Returns every call to a function of the given name in the subtree, in
    * program order.
    */
    public static List<FunctionCall> getFunctionCalls(Traversable t,
                                                      String name) {
        List<FunctionCall> ret = new ArrayList<FunctionCall>();
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        for (FunctionCall call : iter.getList(FunctionCall.class)) {
            if (call.getName().equals(name)) {
                ret.add(call);
            }
        }
        return ret;
    }

    /**
    * Checks if the call is an intrinsic with the given name.
    */
    public static boolean isIntrinsic(Expression e, String name) {
        return (e instanceof FunctionCall)
            && ((FunctionCall)e).getName().equals(name);
    }

    /**
    * Inserts a statement immediately before a reference statement. If the
    * reference is not directly inside a block, it is first wrapped in a new
    * block that takes its place.
    *
    * @param ref the statement that must stay attached to the tree.
    * @param stmt the orphan statement to insert.
    * @throws NotAChildException if <b>ref</b> has no parent.
    */
    public static void insertBefore(Statement ref, Statement stmt) {
        Traversable parent = ref.getParent();
        if (parent == null) {
            throw new NotAChildException("statement has no parent");
        }
        if (parent instanceof CompoundStatement) {
            ((CompoundStatement)parent).addStatementBefore(ref, stmt);
            return;
        }
        int index = Tools.identityIndexOf(parent.getChildren(), ref);
        CompoundStatement block = new CompoundStatement();
        // detach before re-attaching below the new block
        parent.setChild(index, block);
        block.addStatement(stmt);
        block.addStatement(ref);
    }

    /**
    * Checks that every node below the root names its actual parent.
    */
    public static boolean checkConsistency(Traversable root) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(root);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            List<Traversable> children = t.getChildren();
            for (int i = 0; i < children.size(); i++) {
                Traversable child = children.get(i);
                if (child != null && child.getParent() != t) {
                    return false;
                }
            }
        }
        return true;
    }
}
