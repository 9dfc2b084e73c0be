package gpusync.hir;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public class IRToolsTest {

    private final Buffer b = new Buffer("B", "float32", StorageScope.SHARED);
    private final Variable tx = new Variable("tx");
    private final Variable k = new Variable("k");

    @Test
    public void insertsBeforeStatementInBlock() {
        BufferStore s1 = store(b, id(tx), lit(1));
        BufferStore s2 = store(b, add(tx, 1), lit(2));
        CompoundStatement body = block(s1, s2);
        ExpressionStatement barrier = KernelIntrinsics.storageSync(StorageScope.SHARED);

        IRTools.insertBefore(s2, barrier);

        assertEquals(3, body.countStatements());
        assertSame(barrier, body.getStatements().get(1));
        assertSame(body, barrier.getParent());
        assertTrue(IRTools.checkConsistency(body));
    }

    @Test
    public void wrapsStatementOutsideBlock() {
        BufferStore s1 = store(b, id(k), lit(1));
        ForLoop loop = new ForLoop(k, lit(0), lit(8), LoopKind.SERIAL, s1);
        ExpressionStatement barrier = KernelIntrinsics.storageSync(StorageScope.SHARED);

        IRTools.insertBefore(s1, barrier);

        assertTrue(loop.getBody() instanceof CompoundStatement);
        CompoundStatement body = (CompoundStatement)loop.getBody();
        assertEquals(2, body.countStatements());
        assertSame(barrier, body.getStatements().get(0));
        assertSame(s1, body.getStatements().get(1));
        assertTrue(IRTools.checkConsistency(loop));
    }

    @Test
    public void insertBeforeOrphanFails() {
        BufferStore s1 = store(b, id(tx), lit(1));
        assertThrows(NotAChildException.class, new Executable() {
            public void execute() throws Throwable {
                IRTools.insertBefore(s1, KernelIntrinsics.storageSync(StorageScope.SHARED));
            }
        });
    }

    @Test
    public void replacesSymbolInCopy() {
        Expression e = add(id(k), bin(id(k), BinaryOperator.MULTIPLY, lit(2)));
        Expression r = IRTools.replaceSymbol(e, k, add(k, 1));

        assertEquals("(k + (k * 2))", e.toString());
        assertEquals("((k + 1) + ((k + 1) * 2))", r.toString());
        assertNull(r.getParent());
        assertTrue(IRTools.checkConsistency(r));
        assertTrue(IRTools.containsSymbol(r, k));
        assertFalse(IRTools.containsSymbol(r, tx));
    }

    @Test
    public void findsIntrinsicCalls() {
        CompoundStatement body = block(
                accessPtr(b, lit(0), 4, KernelIntrinsics.ACCESS_READ),
                KernelIntrinsics.storageSync(StorageScope.SHARED),
                store(b, lit(0), lit(0)));
        assertEquals(1, IRTools.getFunctionCalls(body, KernelIntrinsics.STORAGE_SYNC).size());
        assertEquals(1, IRTools.getFunctionCalls(body, KernelIntrinsics.ACCESS_PTR).size());
        assertTrue(IRTools.containsSymbol(body, b));
    }
}
