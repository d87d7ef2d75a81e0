package org.qed.algebra;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.qed.algebra.Expr.*;

class ExpanderTest {
    private static final Symbol x = symbol("x");
    private static final Symbol y = symbol("y");

    @Test
    void squareOfASum() {
        var expanded = expand(pow(add(x, integer(1)), integer(2)));
        assertThat(expanded).isEqualTo(add(pow(x, integer(2)), mul(integer(2), x), integer(1)));
        assertThat(expanded.toString()).isEqualTo("1 + 2*x + x**2");
    }

    @Test
    void productOverASum() {
        assertThat(expand(mul(x, add(y, integer(1))))).isEqualTo(add(x, mul(x, y)));
    }

    @Test
    void differenceOfSquares() {
        var product = mul(sub(x, y), add(x, y));
        assertThat(product).isInstanceOf(Mul.class);
        assertThat(expand(product)).isEqualTo(sub(pow(x, integer(2)), pow(y, integer(2))));
    }

    @Test
    void expandsInsideFunctions() {
        var inner = mul(x, add(y, integer(1)));
        assertThat(expand(sin(inner))).isEqualTo(sin(add(x, mul(x, y))));
        assertThat(expand(function("f", inner))).isEqualTo(function("f", add(x, mul(x, y))));
    }

    @Test
    void leavesOtherPowersAlone() {
        var inverse = pow(add(x, integer(1)), integer(-1));
        assertThat(expand(inverse)).isEqualTo(inverse);
        var root = pow(add(x, integer(1)), rational(1, 2));
        assertThat(expand(root)).isEqualTo(root);
    }

    @Test
    void expandIsIdempotent() {
        var expanded = expand(pow(add(x, y, integer(2)), integer(3)));
        assertThat(expand(expanded)).isEqualTo(expanded);
        assertThat(expanded.subs(java.util.Map.of(x, integer(1), y, integer(1)))).isEqualTo(integer(64));
    }

    @Test
    void hugePowersOfSumsAreRejected() {
        var huge = pow(add(x, integer(1)), integer(1L << 40));
        assertThat(huge).isInstanceOf(Pow.class);
        assertThatThrownBy(() -> expand(huge)).isInstanceOf(SymbolicException.class);
    }

    @Test
    void atomsAreReturnedAsIs() {
        assertThat(expand(x)).isSameAs(x);
        var half = rational(1, 2);
        assertThat(expand(half)).isSameAs(half);
        var s = sin(x);
        assertThat(expand(s)).isSameAs(s);
    }
}
