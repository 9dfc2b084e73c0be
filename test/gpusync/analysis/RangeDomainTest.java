package gpusync.analysis;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import gpusync.hir.BinaryOperator;
import gpusync.hir.Expression;
import gpusync.hir.IntegerLiteral;
import gpusync.hir.Variable;

public class RangeDomainTest {
	private final Variable tx = new Variable("tx");
	private final Variable k = new Variable("k");
	private final Variable n = new Variable("n");
	private RangeDomain rd;

	@BeforeEach
	public void setUp() {
		rd = new RangeDomain();
		rd.bind(tx, lit(0), lit(64));
	}

	@Test
	public void provesComparisonsOverBoundVariable() {
		assertTrue(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_LT, lit(64))));
		assertTrue(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_LE, lit(63))));
		assertTrue(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_GE, lit(0))));
		assertFalse(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_LT, lit(63))));
		assertFalse(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_GT, lit(0))));
	}

	@Test
	public void provesRelationsBetweenShiftedIndices() {
		assertTrue(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_LT, add(tx, 1))));
		assertTrue(rd.canProve(bin(add(tx, 1), BinaryOperator.COMPARE_NE, id(tx))));
		assertTrue(rd.canProve(bin(add(tx, 2), BinaryOperator.COMPARE_EQ, add(add(tx, 1), lit(1)))));
		assertFalse(rd.canProve(bin(add(tx, 1), BinaryOperator.COMPARE_LT, id(tx))));
	}

	@Test
	public void provesWithSymbolicBounds() {
		rd.bind(k, lit(0), id(n));
		// k <= n - 1 < n
		assertTrue(rd.canProve(bin(id(k), BinaryOperator.COMPARE_LT, id(n))));
		assertFalse(rd.canProve(bin(id(k), BinaryOperator.COMPARE_LT, sub(n, 1))));
	}

	@Test
	public void handlesConjunctionAndDisjunction() {
		Expression t = bin(id(tx), BinaryOperator.COMPARE_LT, lit(64));
		Expression f = bin(id(tx), BinaryOperator.COMPARE_LT, lit(10));
		assertTrue(rd.canProve(bin(t, BinaryOperator.LOGICAL_OR, f)));
		assertFalse(rd.canProve(bin(t.clone(), BinaryOperator.LOGICAL_AND, f.clone())));
	}

	@Test
	public void computesBounds() {
		assertEquals(new IntegerLiteral(1), rd.getLowerBound(add(tx, 1)));
		assertEquals(new IntegerLiteral(64), rd.getUpperBound(add(tx, 1)));
		assertEquals(new IntegerLiteral(-63), rd.getLowerBound(bin(lit(0), BinaryOperator.SUBTRACT, id(tx))));
	}

	@Test
	public void refusesBoundsThroughOpaqueTerms() {
		Expression e = bin(id(tx), BinaryOperator.DIVIDE, lit(2));
		assertNull(rd.getUpperBound(e));
		assertFalse(rd.canProve(bin(e.clone(), BinaryOperator.COMPARE_LT, lit(64))));
	}

	@Test
	public void forgetsRangesOnClear() {
		rd.clear();
		assertFalse(rd.isBound(tx));
		assertFalse(rd.canProve(bin(id(tx), BinaryOperator.COMPARE_LT, lit(64))));
		assertEquals(id(tx), rd.getUpperBound(id(tx)));
	}
}
