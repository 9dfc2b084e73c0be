package gpusync.hir;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public class ProgramTest {

    private final Buffer b = new Buffer("B", "float32", StorageScope.SHARED);
    private final Variable tx = new Variable("tx");

    @Test
    public void numbersStatementsInPreOrder() {
        BufferStore s1 = store(b, id(tx), lit(1));
        BufferStore s2 = store(b, add(tx, 1), lit(2));
        CompoundStatement body = block(s1, s2);
        ThreadExtentStatement te = threads(tx, "threadIdx.x", 64, body);
        Program program = new Program("k", te);

        assertEquals(4, program.number());
        assertEquals(0, te.getId());
        assertEquals(1, body.getId());
        assertEquals(2, s1.getId());
        assertEquals(3, s2.getId());
        assertSame(s2, program.getStatement(3));
    }

    @Test
    public void keepsIdentitiesWhenStatementsAreInserted() {
        BufferStore s1 = store(b, id(tx), lit(1));
        BufferStore s2 = store(b, add(tx, 1), lit(2));
        CompoundStatement body = block(s1, s2);
        Program program = new Program("k", body);
        program.number();

        ExpressionStatement barrier = KernelIntrinsics.storageSync(StorageScope.SHARED);
        IRTools.insertBefore(s2, barrier);
        assertEquals(Statement.NO_ID, barrier.getId());

        assertEquals(4, program.number());
        assertEquals(1, s1.getId());
        assertEquals(2, s2.getId());
        assertEquals(3, barrier.getId());
        assertSame(barrier, program.getStatement(3));
    }

    @Test
    public void rejectsStatementsNumberedByAnotherProgram() {
        BufferStore s1 = store(b, id(tx), lit(1));
        Program first = new Program("first", block(s1));
        first.number();
        CompoundStatement holder = (CompoundStatement)first.getBody();
        holder.setChild(0, store(b, lit(0), lit(0)));

        Program second = new Program("second", block(store(b, lit(3), lit(3)), s1));
        assertThrows(IllegalStateException.class, second::number);
    }

    @Test
    public void rejectsBodyWithParent() {
        BufferStore s1 = store(b, id(tx), lit(1));
        block(s1);
        assertThrows(NotAnOrphanException.class, new Executable() {
            public void execute() throws Throwable {
                new Program("k", s1);
            }
        });
    }
}
