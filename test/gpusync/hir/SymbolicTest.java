package gpusync.hir;

import static gpusync.KernelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class SymbolicTest {

    private final Variable i = new Variable("i");
    private final Variable n = new Variable("n");

    @Test
    public void combinesLikeTerms() {
        Expression e = add(add(id(i), lit(3)), sub(i, 1));
        assertEquals("((2 * i) + 2)", Symbolic.simplify(e).toString());
    }

    @Test
    public void foldsConstants() {
        Expression e = bin(bin(lit(6), BinaryOperator.MULTIPLY, lit(7)),
                           BinaryOperator.SUBTRACT, lit(2));
        assertEquals(new IntegerLiteral(40), Symbolic.simplify(e));
    }

    @Test
    public void ordersAtomsByName() {
        Expression e1 = add(id(n), id(i));
        Expression e2 = add(id(i), id(n));
        assertEquals(Symbolic.simplify(e1), Symbolic.simplify(e2));
        assertTrue(Symbolic.isEqual(e1, e2));
    }

    @Test
    public void keepsNonAffineTermsOpaque() {
        Expression e = bin(id(i), BinaryOperator.DIVIDE, lit(2));
        LinearForm f = LinearForm.of(e);
        assertFalse(f.isConstant());
        assertEquals(0, f.getCoefficient(i));
        assertTrue(f.dependsOn(i));
        assertFalse(f.dependsOn(n));
    }

    @Test
    public void substitutesVariables() {
        LinearForm f = LinearForm.of(add(bin(lit(2), BinaryOperator.MULTIPLY, id(i)), id(n)));
        LinearForm g = f.substitute(i, LinearForm.of(add(n, 1)));
        assertEquals(3, g.getCoefficient(n));
        assertEquals(2, g.getConstant());
        assertEquals("((3 * n) + 2)", g.toString());
    }

    @Test
    public void cancelsToConstant() {
        Expression e = Symbolic.subtract(add(n, 5), add(n, 2));
        assertEquals(new IntegerLiteral(3), e);
    }
}
