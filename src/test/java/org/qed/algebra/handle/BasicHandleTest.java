package org.qed.algebra.handle;

import org.junit.jupiter.api.Test;
import org.qed.algebra.Int;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BasicHandleTest {
    private static BasicHandle integer(long value) {
        var handle = BasicHandle.create();
        handle.setInteger(value);
        return handle;
    }

    private static BasicHandle symbol(String name) {
        var handle = BasicHandle.create();
        handle.setSymbol(name);
        return handle;
    }

    @Test
    void freshHandleHoldsZero() {
        var handle = BasicHandle.create();
        assertThat(handle.str()).isEqualTo("0");
        assertThat(handle.get()).isSameAs(Int.ZERO);
        assertThat(handle.isInteger()).isTrue();
    }

    @Test
    void integerStrings() {
        var handle = BasicHandle.create();
        assertThat(handle.setIntegerString("-123")).isTrue();
        assertThat(handle.getLong()).isEqualTo(-123L);
        assertThat(handle.setIntegerString("12a")).isFalse();
        assertThat(handle.setIntegerString("")).isFalse();
        assertThat(handle.str()).isEqualTo("-123");
    }

    @Test
    void unsignedValues() {
        var handle = BasicHandle.create();
        handle.setUnsignedInteger(-1L);
        assertThat(handle.str()).isEqualTo("18446744073709551615");
        assertThat(handle.getBigInteger()).isEqualTo(new BigInteger("18446744073709551615"));
        assertThat(handle.getUnsignedLong()).isEqualTo(-1L);
        assertThat(handle.setUnsignedRational(-1L, 5L)).isTrue();
        assertThat(handle.str()).isEqualTo("3689348814741910323");
    }

    @Test
    void rationals() {
        var handle = BasicHandle.create();
        assertThat(handle.setRational(4, 2)).isTrue();
        assertThat(handle.isInteger()).isTrue();
        assertThat(handle.getLong()).isEqualTo(2L);
        assertThat(handle.setRational(BigInteger.valueOf(3), BigInteger.valueOf(-6))).isTrue();
        assertThat(handle.isRational()).isTrue();
        assertThat(handle.str()).isEqualTo("-1/2");
        assertThat(handle.setRational(1, 0)).isFalse();
        assertThat(handle.str()).isEqualTo("-1/2");
        assertThat(handle.setRational(integer(6), integer(9))).isTrue();
        assertThat(handle.str()).isEqualTo("2/3");
        assertThat(handle.setRational(symbol("x"), integer(2))).isFalse();
        assertThat(handle.setRational(integer(1), integer(0))).isFalse();
        assertThat(handle.str()).isEqualTo("2/3");
    }

    @Test
    void arithmetic() {
        var x = symbol("x");
        var result = BasicHandle.create();
        assertThat(result.add(x, x)).isTrue();
        assertThat(result.str()).isEqualTo("2*x");
        assertThat(result.mul(result, x)).isTrue();
        assertThat(result.str()).isEqualTo("2*x**2");
        assertThat(result.sub(x, x)).isTrue();
        assertThat(result.get()).isSameAs(Int.ZERO);
        assertThat(result.neg(x)).isTrue();
        assertThat(result.str()).isEqualTo("-x");
        assertThat(result.pow(x, integer(3))).isTrue();
        assertThat(result.str()).isEqualTo("x**3");
        assertThat(result.div(integer(3), integer(6))).isTrue();
        assertThat(result.str()).isEqualTo("1/2");
    }

    @Test
    void failedOperationsLeaveTheValue() {
        var result = integer(7);
        assertThat(result.div(integer(1), integer(0))).isFalse();
        assertThat(result.pow(integer(0), integer(-1))).isFalse();
        assertThat(result.diff(symbol("x"), integer(1))).isFalse();
        assertThat(result.abs(symbol("x"))).isFalse();
        assertThat(result.getLong()).isEqualTo(7L);
    }

    @Test
    void outOfRangeExponentsFail() {
        var result = integer(5);
        assertThat(result.pow(integer(2), integer(Integer.MIN_VALUE))).isFalse();
        assertThat(result.getLong()).isEqualTo(5L);

        var sum = BasicHandle.create();
        sum.add(symbol("x"), integer(1));
        var huge = BasicHandle.create();
        assertThat(huge.pow(sum, integer(1L << 40))).isTrue();
        assertThat(result.expand(huge)).isFalse();
        assertThat(result.getLong()).isEqualTo(5L);
    }

    @Test
    void nestedPowersMultiplyAndDifferentiate() {
        var x = symbol("x");
        var half = BasicHandle.create();
        half.setRational(1, 2);
        var square = BasicHandle.create();
        square.pow(x, integer(2));
        var root = BasicHandle.create();
        assertThat(root.pow(square, half)).isTrue();
        var result = BasicHandle.create();
        assertThat(result.mul(integer(2), root)).isTrue();
        assertThat(result.str()).isEqualTo("2*(x**2)**(1/2)");
        assertThat(result.diff(root, x)).isTrue();
        assertThat(result.str()).isEqualTo("x*(x**2)**(-1/2)");
    }

    @Test
    void calculus() {
        var x = symbol("x");
        var square = BasicHandle.create();
        square.pow(x, integer(2));
        var result = BasicHandle.create();
        assertThat(result.diff(square, x)).isTrue();
        assertThat(result.str()).isEqualTo("2*x");
        var sum = BasicHandle.create();
        sum.add(x, integer(1));
        assertThat(result.pow(sum, integer(2))).isTrue();
        assertThat(result.expand(result)).isTrue();
        assertThat(result.str()).isEqualTo("1 + 2*x + x**2");
        assertThat(result.abs(integer(-4))).isTrue();
        assertThat(result.str()).isEqualTo("4");
    }

    @Test
    void assignmentShares() {
        var source = symbol("y");
        var target = BasicHandle.create();
        target.assign(source);
        assertThat(target.get()).isSameAs(source.get());
        assertThat(target.isSymbol()).isTrue();
    }

    @Test
    void freedHandlesCannotBeUsed() {
        var handle = integer(3);
        handle.free();
        assertThat(handle.toString()).isEqualTo("<freed>");
        assertThatThrownBy(handle::get).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> handle.setInteger(1)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(handle::free).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void integerAccessorsNeedAnInteger() {
        assertThatThrownBy(() -> symbol("x").getLong()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void integerAccessorsCheckTheRange() {
        assertThatThrownBy(() -> integer(-1).getUnsignedLong()).isInstanceOf(IllegalStateException.class);
        var unsigned = BasicHandle.create();
        unsigned.setUnsignedInteger(-1L);
        assertThatThrownBy(unsigned::getLong).isInstanceOf(IllegalStateException.class);
        assertThat(integer(Long.MIN_VALUE).getLong()).isEqualTo(Long.MIN_VALUE);
        assertThat(integer(Long.MAX_VALUE).getUnsignedLong()).isEqualTo(Long.MAX_VALUE);
    }
}
