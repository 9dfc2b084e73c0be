package gpusync.hir;

/**
* A storage scope: a {@link StorageRank} plus an optional tag that further
* distinguishes allocations of the same rank, written {@code rank[.tag]}
* (for example {@code shared.dyn}).
*/
public final class StorageScope {

    public static final StorageScope GLOBAL =
            new StorageScope(StorageRank.GLOBAL, "");
    public static final StorageScope SHARED =
            new StorageScope(StorageRank.SHARED, "");
    public static final StorageScope WARP =
            new StorageScope(StorageRank.WARP, "");
    public static final StorageScope LOCAL =
            new StorageScope(StorageRank.LOCAL, "");

    private final StorageRank rank;
    private final String tag;

    public StorageScope(StorageRank rank, String tag) {
        if (rank == null) {
            throw new IllegalArgumentException("storage rank is null");
        }
        this.rank = rank;
        this.tag = (tag == null) ? "" : tag;
    }

    /**
    * Parses a scope string such as {@code global}, {@code shared} or
    * {@code shared.dyn}.
    *
    * @param s the scope string.
    * @return the parsed scope.
    * @throws IllegalArgumentException if the rank part is unknown.
    */
    public static StorageScope parse(String s) {
        if (s == null) {
            throw new IllegalArgumentException("storage scope is null");
        }
        String trimmed = s.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            return new StorageScope(StorageRank.fromKeyword(trimmed), "");
        }
        return new StorageScope(
                StorageRank.fromKeyword(trimmed.substring(0, dot)),
                trimmed.substring(dot));
    }

    public StorageRank getRank() {
        return rank;
    }

    /** Returns the tag including its leading dot, or an empty string. */
    public String getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StorageScope)) {
            return false;
        }
        StorageScope other = (StorageScope)o;
        return rank == other.rank && tag.equals(other.tag);
    }

    @Override
    public int hashCode() {
        return rank.hashCode() * 31 + tag.hashCode();
    }

    @Override
    public String toString() {
        return rank.getKeyword() + tag;
    }
}
