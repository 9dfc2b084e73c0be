package gpusync.hir;

/**
* How the iterations of a {@link ForLoop} are executed.
*/
public enum LoopKind {
    /** Iterations run one after another in the same thread. */
    SERIAL,
    /** Iterations are distributed over parallel workers. */
    PARALLEL,
    /** Iterations are mapped to vector lanes. */
    VECTORIZED,
    /** The loop is fully unrolled. */
    UNROLLED,
    /** The first and last iterations are peeled off. */
    PEELED
}
