package gpusync.hir;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public class ScopeTest {

    @Test
    public void parsesStorageScopes() {
        assertEquals(StorageScope.GLOBAL, StorageScope.parse("global"));
        assertEquals(StorageScope.SHARED, StorageScope.parse("shared"));
        StorageScope dyn = StorageScope.parse("shared.dyn");
        assertEquals(StorageRank.SHARED, dyn.getRank());
        assertEquals(".dyn", dyn.getTag());
        assertEquals("shared.dyn", dyn.toString());
        assertNotEquals(StorageScope.SHARED, dyn);
    }

    @Test
    public void rejectsUnknownStorageScope() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() throws Throwable {
                StorageScope.parse("texture");
            }
        });
    }

    @Test
    public void ranksThreadTags() {
        assertEquals(ThreadScope.BLOCK, ThreadScope.parse("blockIdx.x").getRank());
        assertEquals(ThreadScope.THREAD, ThreadScope.parse("threadIdx.y").getRank());
        assertEquals(1, ThreadScope.parse("threadIdx.y").getDimIndex());
        assertEquals(ThreadScope.THREAD, ThreadScope.parse("vthread").getRank());
        assertTrue(ThreadScope.parse("vthread").isVirtual());
        assertEquals(ThreadScope.VIRTUAL_DIM, ThreadScope.parse("cthread").getDimIndex());
        assertFalse(ThreadScope.parse("threadIdx.x").isVirtual());
    }

    @Test
    public void rejectsUnknownThreadTag() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() throws Throwable {
                ThreadScope.parse("warpIdx.x");
            }
        });
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() throws Throwable {
                ThreadScope.parse("threadIdx.w");
            }
        });
    }

    @Test
    public void defaultsBuffersToGlobal() {
        assertEquals(StorageScope.GLOBAL, new Buffer("A", "int32").getScope());
        assertEquals(StorageScope.GLOBAL, new Buffer("A", "int32", null).getScope());
    }
}
