package gpusync.transforms;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import gpusync.hir.Buffer;
import gpusync.hir.KernelIntrinsics;
import gpusync.hir.Program;
import gpusync.hir.StorageScope;
import gpusync.hir.Variable;

public class ThreadSyncPassTest {

	@Test
	public void runsAsNamedPass() {
		Variable tx = new Variable("tx");
		Buffer b = new Buffer("B", "float32", StorageScope.parse("shared.dyn"));
		Buffer g = new Buffer("G", "float32");
		Program program = new Program("k", threads(tx, "threadIdx.x", 64, block(
				accessPtr(b, lit(0), 64, KernelIntrinsics.ACCESS_WRITE),
				store(g, id(tx), load(b, sub(tx, 1))))));
		ThreadSyncPass pass = new ThreadSyncPass(program, StorageScope.parse("shared.dyn"));

		assertEquals("[ThreadSync:shared.dyn]", pass.getPassName());
		TransformPass.run(pass);

		assertEquals(1, barriers(program).size());
		assertEquals("shared.dyn", barrierScopes(program).get(0));
	}

	@Test
	public void taggedScopeIsDistinctFromPlainScope() {
		Variable tx = new Variable("tx");
		Buffer b = new Buffer("B", "float32", StorageScope.parse("shared.dyn"));
		Buffer g = new Buffer("G", "float32");
		Program program = new Program("k", threads(tx, "threadIdx.x", 64, block(
				accessPtr(b, lit(0), 64, KernelIntrinsics.ACCESS_WRITE),
				store(g, id(tx), load(b, sub(tx, 1))))));

		TransformPass.run(new ThreadSyncPass(program, StorageScope.SHARED));

		assertTrue(barriers(program).isEmpty());
	}
}
