package org.qed.algebra.handle;

import com.google.common.base.Preconditions;
import kala.control.Result;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.qed.algebra.Basic;
import org.qed.algebra.Expr;
import org.qed.algebra.Int;
import org.qed.algebra.Rational;
import org.qed.algebra.Symbol;
import org.qed.algebra.SymbolicException;

import java.math.BigInteger;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * A mutable slot holding one expression, for callers that work with handles rather than with expression values.
 * A handle is obtained from {@link #create()}, receives values through the setters and the arithmetic operations,
 * and must not be used after {@link #free()}. Assignment shares the held expression, it does not copy it.
 * <p>
 * Operations that the caller may legitimately get wrong report failure by returning {@code false} and leave the
 * handle unchanged.
 */
public final class BasicHandle {
    private static final Logger LOGGER = Logger.getLogger(BasicHandle.class.getName());

    private @Nullable Basic value;

    private BasicHandle() {
        value = Int.ZERO;
    }

    public static BasicHandle create() {
        return new BasicHandle();
    }

    public Basic get() {
        Preconditions.checkState(value != null, "Handle used after being freed");
        return value;
    }

    public void assign(BasicHandle other) {
        set(other.get());
    }

    public void free() {
        get();
        value = null;
    }

    private void set(Basic expr) {
        get();
        value = expr;
    }

    public void setSymbol(String name) {
        set(Symbol.of(name));
    }

    public void setInteger(long i) {
        set(Int.of(i));
    }

    public void setUnsignedInteger(long i) {
        set(Int.of(new BigInteger(Long.toUnsignedString(i))));
    }

    public void setInteger(BigInteger i) {
        set(Int.of(i));
    }

    /**
     * @return false if the text is not a base-10 integer
     */
    public boolean setIntegerString(String text) {
        get();
        try {
            set(Int.parse(text));
            return true;
        } catch (NumberFormatException e) {
            LOGGER.fine(() -> String.format("Rejected integer literal \"%s\"", text));
            return false;
        }
    }

    public long getLong() {
        var i = integer().getValue();
        Preconditions.checkState(i.bitLength() < Long.SIZE, "%s does not fit in a long", i);
        return i.longValue();
    }

    /**
     * The value as an unsigned 64-bit integer, returned in the bits of a long.
     */
    public long getUnsignedLong() {
        var i = integer().getValue();
        Preconditions.checkState(i.signum() >= 0 && i.bitLength() <= Long.SIZE, "%s does not fit in an unsigned long", i);
        return i.longValue();
    }

    public BigInteger getBigInteger() {
        return integer().getValue();
    }

    private Int integer() {
        Preconditions.checkState(isInteger(), "Handle holds %s, not an integer", value);
        return (Int) get();
    }

    /**
     * @return false unless both handles hold integers and the denominator is not zero
     */
    public boolean setRational(BasicHandle numerator, BasicHandle denominator) {
        return updateFrom(Rational.from(numerator.get(), denominator.get()).map(r -> r), "rational");
    }

    public boolean setRational(long numerator, long denominator) {
        return update(() -> Rational.of(numerator, denominator), "rational");
    }

    public boolean setUnsignedRational(long numerator, long denominator) {
        return update(() -> Rational.of(new BigInteger(Long.toUnsignedString(numerator)),
                new BigInteger(Long.toUnsignedString(denominator))), "rational");
    }

    public boolean setRational(BigInteger numerator, BigInteger denominator) {
        return update(() -> Rational.of(numerator, denominator), "rational");
    }

    public boolean add(BasicHandle left, BasicHandle right) {
        return update(() -> Expr.add(left.get(), right.get()), "add");
    }

    public boolean sub(BasicHandle left, BasicHandle right) {
        return update(() -> Expr.sub(left.get(), right.get()), "sub");
    }

    public boolean mul(BasicHandle left, BasicHandle right) {
        return update(() -> Expr.mul(left.get(), right.get()), "mul");
    }

    public boolean div(BasicHandle left, BasicHandle right) {
        return update(() -> Expr.div(left.get(), right.get()), "div");
    }

    public boolean pow(BasicHandle base, BasicHandle exponent) {
        return update(() -> Expr.pow(base.get(), exponent.get()), "pow");
    }

    public boolean neg(BasicHandle arg) {
        return update(() -> Expr.neg(arg.get()), "neg");
    }

    public boolean abs(BasicHandle arg) {
        return updateFrom(Expr.abs(arg.get()), "abs");
    }

    public boolean expand(BasicHandle arg) {
        return update(() -> Expr.expand(arg.get()), "expand");
    }

    /**
     * @return false if the symbol handle does not hold a symbol
     */
    public boolean diff(BasicHandle expr, BasicHandle symbol) {
        return updateFrom(Expr.diff(expr.get(), symbol.get()), "diff");
    }

    private boolean update(Supplier<Basic> operation, String name) {
        get();
        try {
            value = operation.get();
            return true;
        } catch (SymbolicException e) {
            LOGGER.fine(() -> String.format("Operation %s failed: %s", name, e.getMessage()));
            return false;
        }
    }

    private boolean updateFrom(Result<Basic, String> result, String name) {
        get();
        if (result.isErr()) {
            LOGGER.fine(() -> String.format("Operation %s failed: %s", name, result.getErr()));
            return false;
        }
        value = result.get();
        return true;
    }

    public String str() {
        return get().toString();
    }

    public boolean isInteger() {
        return get() instanceof Int;
    }

    public boolean isRational() {
        return get() instanceof Rational;
    }

    public boolean isSymbol() {
        return get() instanceof Symbol;
    }

    @Override
    public String toString() {
        return value == null ? "<freed>" : value.toString();
    }
}
