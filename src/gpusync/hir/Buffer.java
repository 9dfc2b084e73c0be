package gpusync.hir;

/**
* A buffer allocated at one level of the memory hierarchy. Accesses to the
* same buffer object refer to the same storage; the storage scope is part of
* the buffer declaration, as the {@code __shared__} specifier is in CUDA.
*/
public class Buffer implements Symbol {

    private final String name;
    private final String dtype;
    private final StorageScope scope;

    /**
    * Creates a buffer living in global memory.
    *
    * @param name the buffer name.
    * @param dtype the element type, such as {@code float32}.
    */
    public Buffer(String name, String dtype) {
        this(name, dtype, StorageScope.GLOBAL);
    }

    /**
    * Creates a buffer with the given storage scope.
    *
    * @param name the buffer name.
    * @param dtype the element type.
    * @param scope the storage scope; null means global.
    */
    public Buffer(String name, String dtype, StorageScope scope) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("buffer name is empty");
        }
        this.name = name;
        this.dtype = dtype;
        this.scope = (scope == null) ? StorageScope.GLOBAL : scope;
    }

    public String getSymbolName() {
        return name;
    }

    /** Returns the element type. */
    public String getDataType() {
        return dtype;
    }

    /** Returns the storage scope the buffer is declared in. */
    public StorageScope getScope() {
        return scope;
    }

    @Override
    public String toString() {
        return name;
    }
}
