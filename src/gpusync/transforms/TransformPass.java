package gpusync.transforms;

import gpusync.hir.IRTools;
import gpusync.hir.PrintTools;
import gpusync.hir.Program;
import gpusync.hir.Tools;

/**
* Base class of all transformation passes. A pass is constructed with the
* program it transforms and executed through {@link #run}, which logs the
* pass boundaries and checks the consistency of the IR afterwards.
*/
public abstract class TransformPass {

    /** The associated program. */
    protected Program program;

    /** Constructs a transformation pass with the given program. */
    protected TransformPass(Program program) {
        this.program = program;
    }

    /** Returns the name of the transformation pass. */
    public abstract String getPassName();

    /**
    * Runs the specified pass on the program associated with the pass.
    *
    * @param pass the pass to be executed.
    * @throws InternalError if the pass leaves a node whose parent does not
    *         list it as a child.
    */
    public static void run(TransformPass pass) {
        double timer = Tools.getTime();
        PrintTools.println(pass.getPassName() + " begin", 0);
        pass.start();
        PrintTools.println(pass.getPassName() + " end in "
                + String.format("%.2f seconds", Tools.getTime(timer)), 0);
        if (!IRTools.checkConsistency(pass.program)) {
            throw new InternalError("Inconsistent IR after "
                    + pass.getPassName());
        }
    }

    /** Starts the transformation; implemented by every pass. */
    public abstract void start();
}
