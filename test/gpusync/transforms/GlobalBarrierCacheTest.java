package gpusync.transforms;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import gpusync.analysis.RangeDomain;
import gpusync.analysis.SyncSet;
import gpusync.analysis.ThreadSyncException;
import gpusync.analysis.ThreadSyncPlanner;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Buffer;
import gpusync.hir.Program;
import gpusync.hir.StorageScope;
import gpusync.hir.ThreadExtentStatement;
import gpusync.hir.Variable;

public class GlobalBarrierCacheTest {
	private final Variable vt = new Variable("vt");
	private final Variable bx = new Variable("bx");
	private final Variable by = new Variable("by");
	private final Variable tx = new Variable("tx");

	private ThreadExtentStatement scope(Variable v, String tag, long extent) {
		return threads(v, tag, extent, block());
	}

	@Test
	public void multipliesBlockExtentsAndLeadsWithVirtualThreadZero() {
		List<ThreadExtentStatement> nest = Arrays.asList(
				scope(vt, "vthread", 2),
				scope(bx, "blockIdx.x", 8),
				scope(by, "blockIdx.y", 4),
				scope(tx, "threadIdx.x", 64));
		GlobalBarrierCache cache = new GlobalBarrierCache();

		assertEquals("(4 * 8)", cache.getNumBlocks(nest).toString());
		assertEquals("((vt == 0) && (tx == 0))", cache.getIsLead(nest).toString());
		assertEquals(1, cache.getDerivationCount());
	}

	@Test
	public void reusesOperandsForSameDepth() {
		List<ThreadExtentStatement> nest = Arrays.asList(
				scope(bx, "blockIdx.x", 8), scope(tx, "threadIdx.x", 64));
		GlobalBarrierCache cache = new GlobalBarrierCache();

		assertSame(cache.getNumBlocks(nest), cache.getNumBlocks(nest));
		assertEquals(1, cache.getDerivationCount());
		assertThrows(ThreadSyncException.class, new Executable() {
			public void execute() throws Throwable {
				cache.getIsLead(nest.subList(0, 1));
			}
		});

		cache.reset();
		assertTrue(cache.isEmpty());
		assertEquals(lit(1), cache.getIsLead(nest.subList(0, 1)));
		assertEquals(2, cache.getDerivationCount());
	}

	@Test
	public void derivesOnceForBarriersOfOneKernel() {
		Buffer g = new Buffer("G", "float32");
		Buffer l = new Buffer("L", "float32", StorageScope.LOCAL);
		Program program = new Program("k", threads(bx, "blockIdx.x", 8,
				threads(tx, "threadIdx.x", 64, block(
						store(g, id(tx), lit(1)),
						store(l, lit(0), load(g, bin(lit(63), BinaryOperator.SUBTRACT, id(tx)))),
						store(g, id(tx), lit(2))))));
		SyncSet syncs = new ThreadSyncPlanner(StorageScope.GLOBAL, new RangeDomain()).plan(program);
		ThreadSyncInserter inserter = new ThreadSyncInserter(StorageScope.GLOBAL, syncs);

		assertEquals(2, inserter.insert(program));
		assertEquals(1, inserter.getContext().getBarrierCache().getDerivationCount());
		assertTrue(inserter.getContext().getBarrierCache().isEmpty());
		assertTrue(inserter.getContext().getStatistics().isEmpty());
		assertFalse(inserter.getContext().inThreadEnv());
		assertEquals(2, barriers(program).size());
		assertNotSame(barriers(program).get(0).getArgument(2),
				barriers(program).get(1).getArgument(2));
	}
}
