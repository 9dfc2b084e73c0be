package gpusync.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
* Affine normal form of an integer expression: a constant plus a sum of
* coefficient-weighted atoms. An atom is either a {@link Variable} or an
* opaque sub-expression the normal form cannot see through (a division, a
* load, a call); opaque atoms are compared structurally.
*
* <p>
* Instances are immutable; every operation returns a new form.
* </p>
*/
public final class LinearForm {

    /** Atom to non-zero coefficient, in insertion order. */
    private final Map<Object, Long> terms;
    private final long constant;

    private LinearForm(Map<Object, Long> terms, long constant) {
        this.terms = terms;
        this.constant = constant;
    }

    /** Returns the form of a constant. */
    public static LinearForm constant(long c) {
        return new LinearForm(new LinkedHashMap<Object, Long>(), c);
    }

    /** Returns the form of a single variable. */
    public static LinearForm variable(Variable v) {
        Map<Object, Long> terms = new LinkedHashMap<Object, Long>();
        terms.put(v, 1L);
        return new LinearForm(terms, 0);
    }

    private static LinearForm opaque(Expression e) {
        Map<Object, Long> terms = new LinkedHashMap<Object, Long>();
        terms.put(e, 1L);
        return new LinearForm(terms, 0);
    }

    /**
    * Computes the normal form of the given expression.
    *
    * @param e an integer expression.
    * @return its affine normal form.
    */
    public static LinearForm of(Expression e) {
        if (e instanceof IntegerLiteral) {
            return constant(((IntegerLiteral)e).getValue());
        } else if (e instanceof Identifier) {
            return variable(((Identifier)e).getVariable());
        } else if (e instanceof BinaryExpression) {
            return ofBinary((BinaryExpression)e);
        } else if (e instanceof BufferLoad) {
            BufferLoad load = (BufferLoad)e;
            return opaque(new BufferLoad(load.getBuffer(),
                                         of(load.getIndex()).toExpression()));
        }
        return opaque(e.clone());
    }

    private static LinearForm ofBinary(BinaryExpression be) {
        LinearForm lhs = of(be.getLHS());
        LinearForm rhs = of(be.getRHS());
        switch (be.getOperator()) {
        case ADD:
            return lhs.add(rhs);
        case SUBTRACT:
            return lhs.subtract(rhs);
        case MULTIPLY:
            if (lhs.isConstant()) {
                return rhs.scale(lhs.constant);
            } else if (rhs.isConstant()) {
                return lhs.scale(rhs.constant);
            }
            break;
        case DIVIDE:
            if (lhs.isConstant() && rhs.isConstant() && rhs.constant != 0) {
                return constant(lhs.constant / rhs.constant);
            }
            break;
        case MODULUS:
            if (lhs.isConstant() && rhs.isConstant() && rhs.constant != 0) {
                return constant(lhs.constant % rhs.constant);
            }
            break;
        case MIN:
            if (lhs.isConstant() && rhs.isConstant()) {
                return constant(Math.min(lhs.constant, rhs.constant));
            } else if (lhs.equals(rhs)) {
                return lhs;
            }
            break;
        case MAX:
            if (lhs.isConstant() && rhs.isConstant()) {
                return constant(Math.max(lhs.constant, rhs.constant));
            } else if (lhs.equals(rhs)) {
                return lhs;
            }
            break;
        default:
            break;
        }
        return opaque(new BinaryExpression(lhs.toExpression(),
                                           be.getOperator(),
                                           rhs.toExpression()));
    }

    /** Checks if the form has no atoms. */
    public boolean isConstant() {
        return terms.isEmpty();
    }

    /** Returns the constant part. */
    public long getConstant() {
        return constant;
    }

    /** Returns the coefficient of the atom, zero if absent. */
    public long getCoefficient(Object atom) {
        Long c = terms.get(atom);
        return (c == null) ? 0 : c.longValue();
    }

    /** Returns the atoms with non-zero coefficients. */
    public Set<Object> getAtoms() {
        return Collections.unmodifiableSet(terms.keySet());
    }

    /**
    * Checks if the form mentions the variable, directly or inside an opaque
    * atom.
    */
    public boolean dependsOn(Variable v) {
        for (Object atom : terms.keySet()) {
            if (atom == v) {
                return true;
            }
            if (atom instanceof Expression
                && IRTools.containsSymbol((Expression)atom, v)) {
                return true;
            }
        }
        return false;
    }

    public LinearForm add(LinearForm other) {
        Map<Object, Long> sum = new LinkedHashMap<Object, Long>(terms);
        for (Map.Entry<Object, Long> term : other.terms.entrySet()) {
            Long c = sum.get(term.getKey());
            long value = term.getValue() + ((c == null) ? 0 : c);
            if (value == 0) {
                sum.remove(term.getKey());
            } else {
                sum.put(term.getKey(), value);
            }
        }
        return new LinearForm(sum, constant + other.constant);
    }

    public LinearForm subtract(LinearForm other) {
        return add(other.scale(-1));
    }

    public LinearForm scale(long factor) {
        if (factor == 0) {
            return constant(0);
        }
        Map<Object, Long> scaled = new LinkedHashMap<Object, Long>();
        for (Map.Entry<Object, Long> term : terms.entrySet()) {
            scaled.put(term.getKey(), term.getValue() * factor);
        }
        return new LinearForm(scaled, constant * factor);
    }

    /**
    * Replaces a variable atom with another form.
    *
    * @param v the variable to be replaced.
    * @param with the replacing form.
    * @return the substituted form.
    */
    public LinearForm substitute(Variable v, LinearForm with) {
        long c = getCoefficient(v);
        if (c == 0) {
            return this;
        }
        Map<Object, Long> rest = new LinkedHashMap<Object, Long>(terms);
        rest.remove(v);
        return new LinearForm(rest, constant).add(with.scale(c));
    }

    /**
    * Converts the form back into an expression. Atoms are ordered by their
    * printed name so that equal forms print equally.
    */
    public Expression toExpression() {
        List<Map.Entry<Object, Long>> sorted =
                new ArrayList<Map.Entry<Object, Long>>(terms.entrySet());
        Collections.sort(sorted, new Comparator<Map.Entry<Object, Long>>() {
            public int compare(Map.Entry<Object, Long> a,
                               Map.Entry<Object, Long> b) {
                return a.getKey().toString().compareTo(b.getKey().toString());
            }
        });
        Expression ret = null;
        for (Map.Entry<Object, Long> term : sorted) {
            long c = term.getValue();
            Expression atom = atomToExpression(term.getKey());
            if (ret == null) {
                ret = (c == 1) ? atom : new BinaryExpression(
                        new IntegerLiteral(c), BinaryOperator.MULTIPLY, atom);
            } else {
                long abs = Math.abs(c);
                Expression t = (abs == 1) ? atom : new BinaryExpression(
                        new IntegerLiteral(abs), BinaryOperator.MULTIPLY, atom);
                ret = new BinaryExpression(ret, (c > 0) ?
                        BinaryOperator.ADD : BinaryOperator.SUBTRACT, t);
            }
        }
        if (ret == null) {
            return new IntegerLiteral(constant);
        } else if (constant > 0) {
            return new BinaryExpression(ret, BinaryOperator.ADD,
                                        new IntegerLiteral(constant));
        } else if (constant < 0) {
            return new BinaryExpression(ret, BinaryOperator.SUBTRACT,
                                        new IntegerLiteral(-constant));
        }
        return ret;
    }

    private static Expression atomToExpression(Object atom) {
        if (atom instanceof Variable) {
            return new Identifier((Variable)atom);
        }
        return ((Expression)atom).clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LinearForm)) {
            return false;
        }
        LinearForm other = (LinearForm)o;
        return constant == other.constant && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode() * 31 + Long.valueOf(constant).hashCode();
    }

    @Override
    public String toString() {
        return toExpression().toString();
    }
}
