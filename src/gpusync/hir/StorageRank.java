package gpusync.hir;

/**
* Levels of the memory hierarchy, from the widest to the narrowest visibility.
*/
public enum StorageRank {

    /** Device memory visible to every thread of a launch. */
    GLOBAL("global"),
    /** Memory shared by the threads of one block. */
    SHARED("shared"),
    /** Memory shared by the lanes of one warp. */
    WARP("warp"),
    /** Private memory of one thread. */
    LOCAL("local");

    private final String keyword;

    private StorageRank(String keyword) {
        this.keyword = keyword;
    }

    /** Returns the name used in scope strings. */
    public String getKeyword() {
        return keyword;
    }

    /**
    * Returns the rank named by the given keyword.
    *
    * @throws IllegalArgumentException if the keyword names no rank.
    */
    public static StorageRank fromKeyword(String keyword) {
        for (StorageRank rank : values()) {
            if (rank.keyword.equals(keyword)) {
                return rank;
            }
        }
        throw new IllegalArgumentException(
                "unknown storage scope rank: " + keyword);
    }
}
