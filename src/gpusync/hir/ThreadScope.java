package gpusync.hir;

/**
* The position of a thread index in the launch hierarchy, derived from a
* thread tag. {@code blockIdx.x} has rank 0 and dimension 0,
* {@code threadIdx.y} has rank 1 and dimension 1, and virtual threads
* ({@code vthread}, {@code cthread}) have rank 1 and dimension -1.
*/
public final class ThreadScope {

    /** Rank of block indices. */
    public static final int BLOCK = 0;
    /** Rank of thread indices within a block. */
    public static final int THREAD = 1;
    /** Dimension of virtual threads, which are serialized by code generation. */
    public static final int VIRTUAL_DIM = -1;

    private final int rank;
    private final int dimIndex;

    private ThreadScope(int rank, int dimIndex) {
        this.rank = rank;
        this.dimIndex = dimIndex;
    }

    /**
    * Parses a thread tag.
    *
    * @param tag the thread tag, such as {@code threadIdx.x}.
    * @return the thread scope of the tag.
    * @throws IllegalArgumentException if the tag is not a known thread tag.
    */
    public static ThreadScope parse(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("thread tag is null");
        }
        if (tag.equals("vthread") || tag.startsWith("vthread.")
            || tag.equals("cthread") || tag.startsWith("cthread.")) {
            return new ThreadScope(THREAD, VIRTUAL_DIM);
        }
        int rank;
        String dim;
        if (tag.startsWith("blockIdx.")) {
            rank = BLOCK;
            dim = tag.substring("blockIdx.".length());
        } else if (tag.startsWith("threadIdx.")) {
            rank = THREAD;
            dim = tag.substring("threadIdx.".length());
        } else {
            throw new IllegalArgumentException("unknown thread tag: " + tag);
        }
        if (dim.length() != 1 || dim.charAt(0) < 'x' || dim.charAt(0) > 'z') {
            throw new IllegalArgumentException("unknown thread tag: " + tag);
        }
        return new ThreadScope(rank, dim.charAt(0) - 'x');
    }

    public int getRank() {
        return rank;
    }

    public int getDimIndex() {
        return dimIndex;
    }

    /** Checks if the tag names a virtual thread. */
    public boolean isVirtual() {
        return dimIndex == VIRTUAL_DIM;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ThreadScope)) {
            return false;
        }
        ThreadScope other = (ThreadScope)o;
        return rank == other.rank && dimIndex == other.dimIndex;
    }

    @Override
    public int hashCode() {
        return rank * 7 + dimIndex;
    }

    @Override
    public String toString() {
        return "rank " + rank + ", dim " + dimIndex;
    }
}
