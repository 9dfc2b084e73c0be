package gpusync.analysis;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import gpusync.hir.AttributeStatement;
import gpusync.hir.BinaryOperator;
import gpusync.hir.Buffer;
import gpusync.hir.BufferStore;
import gpusync.hir.Expression;
import gpusync.hir.ForLoop;
import gpusync.hir.IfStatement;
import gpusync.hir.KernelIntrinsics;
import gpusync.hir.LoopKind;
import gpusync.hir.Program;
import gpusync.hir.Statement;
import gpusync.hir.StorageScope;
import gpusync.hir.Symbolic;
import gpusync.hir.Variable;

public class ThreadSyncPlannerTest {
	private final Variable tx = new Variable("tx");
	private final Variable k = new Variable("k");
	private final Buffer b = new Buffer("B", "float32", StorageScope.SHARED);
	private final Buffer out = new Buffer("out", "float32");

	private SyncSet plan(Statement... stmts) {
		Program program = new Program("k",
				threads(tx, "threadIdx.x", 64, block(stmts)));
		return new ThreadSyncPlanner(StorageScope.SHARED, new RangeDomain()).plan(program);
	}

	private Expression mirrored() {
		return bin(lit(63), BinaryOperator.SUBTRACT, id(tx));
	}

	@Test
	public void sameIndexNeedsNoBarrier() {
		SyncSet syncs = plan(
				store(b, id(tx), lit(1)),
				store(out, id(tx), load(b, id(tx))));
		assertTrue(syncs.isEmpty());
	}

	@Test
	public void rangeWriteThenNeighbourReadNeedsOneBarrier() {
		Statement write = accessPtr(b, lit(0), 64, KernelIntrinsics.ACCESS_WRITE);
		BufferStore read = store(out, id(tx), load(b, sub(tx, 1)));
		SyncSet syncs = plan(write, read);
		assertEquals(Collections.singletonList(read.getId()), syncs.toList());
	}

	@Test
	public void disjointRangesNeedNoBarrier() {
		SyncSet syncs = plan(
				accessPtr(b, lit(0), 64, KernelIntrinsics.ACCESS_WRITE),
				store(out, id(tx), load(b, add(tx, 64))));
		assertTrue(syncs.isEmpty());
	}

	@Test
	public void barrierClearsPendingAccesses() {
		BufferStore s1 = store(b, id(tx), lit(1));
		BufferStore s2 = store(out, id(tx), load(b, mirrored()));
		BufferStore s3 = store(out, mirrored(), load(b, mirrored()));
		BufferStore s4 = store(b, id(tx), lit(2));
		SyncSet syncs = plan(s1, s2, s3, s4);
		// s3 reads after the barrier before s2; s4 overwrites what s2 and s3 read
		assertEquals(Arrays.asList(s2.getId(), s4.getId()), syncs.toList());
	}

	@Test
	public void existingBarrierSuppressesNewOne() {
		SyncSet syncs = plan(
				store(b, id(tx), lit(1)),
				KernelIntrinsics.storageSync(StorageScope.SHARED),
				store(out, id(tx), load(b, mirrored())));
		assertTrue(syncs.isEmpty());
	}

	@Test
	public void barrierOfOtherScopeDoesNotCount() {
		BufferStore read = store(out, id(tx), load(b, mirrored()));
		SyncSet syncs = plan(
				store(b, id(tx), lit(1)),
				KernelIntrinsics.storageSync(StorageScope.WARP),
				read);
		assertEquals(Collections.singletonList(read.getId()), syncs.toList());
	}

	@Test
	public void serialLoopCarriedReadNeedsBarrier() {
		Statement readNext = accessPtr(b, id(k), 2, KernelIntrinsics.ACCESS_READ);
		BufferStore write = store(b, add(k, 2), lit(0));
		ForLoop loop = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL,
				block(readNext, write));
		SyncSet syncs = plan(loop);
		assertEquals(Collections.singletonList(readNext.getId()), syncs.toList());
	}

	@Test
	public void nextIterationPointReadIsTreatedAsSameThreadAccess() {
		// B[k] = 0; out[tx] = B[k + 1]: next iteration writes the point read now
		ForLoop uniform = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL, block(
				store(b, id(k), lit(0)),
				store(out, id(tx), load(b, add(k, 1)))));
		assertTrue(plan(uniform).isEmpty());

		ForLoop perThread = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL, block(
				store(b, add(id(tx), id(k)), lit(0)),
				store(out, id(tx), load(b, add(add(id(tx), id(k)), lit(1))))));
		assertTrue(plan(perThread).isEmpty());
	}

	@Test
	public void parallelLoopIsNotShifted() {
		Statement readNext = accessPtr(b, id(k), 2, KernelIntrinsics.ACCESS_READ);
		BufferStore write = store(b, add(k, 2), lit(0));
		ForLoop loop = new ForLoop(k, lit(0), lit(16), LoopKind.PARALLEL,
				block(readNext, write));
		assertTrue(plan(loop).isEmpty());
	}

	@Test
	public void projectsSerialLoopsOneIterationAhead() {
		ForLoop serial = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL, store(b, id(k), lit(0)));
		ForLoop unrolled = new ForLoop(k, lit(0), lit(16), LoopKind.UNROLLED, store(b, id(k), lit(0)));
		AccessEntry acc = AccessEntry.access(b, AccessType.READ,
				AccessRange.interval(id(k), add(k, 1)),
				Collections.<ThreadBinding>emptyList());

		AccessEntry next = ThreadSyncPlanner.projectToNextIteration(acc, serial);
		assertTrue(Symbolic.isEqual(add(k, 1), next.getTouched().getMin()));
		assertTrue(Symbolic.isEqual(add(k, 2), next.getTouched().getMax()));
		assertSame(acc, ThreadSyncPlanner.projectToNextIteration(acc, unrolled));
	}

	@Test
	public void barrierAtLoopHeadCoversNextIteration() {
		BufferStore write = store(b, id(tx), lit(0));
		BufferStore read = store(out, id(tx), load(b, mirrored()));
		ForLoop loop = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL,
				block(KernelIntrinsics.storageSync(StorageScope.SHARED), write, read));
		SyncSet syncs = plan(loop);
		assertEquals(Collections.singletonList(read.getId()), syncs.toList());
	}

	@Test
	public void loopCarriedWriteAfterReadNeedsBarrierAtLoopHead() {
		BufferStore write = store(b, id(tx), lit(0));
		BufferStore read = store(out, id(tx), load(b, mirrored()));
		BufferStore rest = store(out, id(tx), lit(1));
		ForLoop loop = new ForLoop(k, lit(0), lit(16), LoopKind.SERIAL,
				block(write, read, rest));
		SyncSet syncs = plan(loop);
		assertTrue(syncs.contains(read.getId()));
		assertTrue(syncs.contains(write.getId()));
		assertFalse(syncs.contains(rest.getId()));
	}

	@Test
	public void barrierInsideBranchAborts() {
		IfStatement branch = new IfStatement(
				bin(id(tx), BinaryOperator.COMPARE_LT, lit(32)),
				block(store(b, id(tx), lit(1)),
						store(out, id(tx), load(b, mirrored()))));
		ThreadSyncException e = assertThrows(ThreadSyncException.class, new Executable() {
			public void execute() throws Throwable {
				plan(branch);
			}
		});
		assertEquals(ThreadSyncException.Kind.SYNC_INSIDE_CONDITION, e.getKind());
	}

	@Test
	public void barrierBeforeBranchIsAllowed() {
		IfStatement branch = new IfStatement(
				bin(id(tx), BinaryOperator.COMPARE_LT, lit(32)),
				store(out, id(tx), load(b, mirrored())));
		SyncSet syncs = plan(store(b, id(tx), lit(1)), branch);
		assertEquals(Collections.singletonList(branch.getId()), syncs.toList());
	}

	@Test
	public void doubleBufferWriteIsNotSynchronizedWithinIteration() {
		AttributeStatement attr = new AttributeStatement(b,
				AttributeStatement.DOUBLE_BUFFER_WRITE, lit(1), store(b, id(tx), lit(1)));
		SyncSet syncs = plan(attr, store(out, id(tx), load(b, mirrored())));
		assertTrue(syncs.isEmpty());
	}
}
