package gpusync.hir;

/**
* A named entity referenced from expressions. Symbols are compared by
* identity: two distinct symbol objects never denote the same storage even if
* they share a name.
*/
public interface Symbol {

    /** Returns the name of the symbol as printed in the IR. */
    String getSymbolName();
}
