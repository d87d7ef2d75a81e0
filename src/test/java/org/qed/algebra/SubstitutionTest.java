package org.qed.algebra;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.qed.algebra.Expr.*;

class SubstitutionTest {
    private static final Symbol x = symbol("x");
    private static final Symbol y = symbol("y");
    private static final Symbol z = symbol("z");

    @Test
    void unchangedTreeKeepsIdentity() {
        var expr = add(mul(integer(2), x, y), pow(x, integer(3)), sin(add(x, y)), function("f", x));
        var mapping = Map.<Basic, Basic>of(z, integer(1));
        assertThat(expr.subs(mapping)).isSameAs(expr);
        assertThat(subs(expr, Map.of())).isSameAs(expr);
    }

    @Test
    void symbolsAreReplacedAndResultIsCanonical() {
        assertThat(mul(x, y).subs(Map.of(y, x))).isEqualTo(pow(x, integer(2)));
        assertThat(add(x, y).subs(Map.of(y, neg(x)))).isSameAs(Int.ZERO);
        assertThat(sin(x).subs(Map.of(x, integer(0)))).isSameAs(Int.ZERO);
        assertThat(cos(x).subs(Map.of(x, integer(0)))).isSameAs(Int.ONE);
        assertThat(pow(x, y).subs(Map.of(y, integer(1)))).isEqualTo(x);
        assertThat(add(pow(x, integer(2)), integer(1)).subs(Map.of(x, integer(3)))).isEqualTo(integer(10));
    }

    @Test
    void wholeNodeMatchesBeforeItsOperands() {
        var mapping = Map.<Basic, Basic>of(sin(x), y, x, z);
        assertThat(sin(x).subs(mapping)).isEqualTo(y);
        assertThat(add(sin(x), x).subs(mapping)).isEqualTo(add(y, z));
    }

    @Test
    void substitutionIsSimultaneous() {
        var swapped = sub(x, y).subs(Map.of(x, y, y, x));
        assertThat(swapped).isEqualTo(sub(y, x));
    }

    @Test
    void derivativeSymbolsAreRenamed() {
        var d = function("f", x).diff(x);
        assertThat(d.subs(Map.of(x, z))).isEqualTo(function("f", z).diff(z));
        assertThatThrownBy(() -> d.subs(Map.of(x, integer(1))))
                .isInstanceOf(SymbolicException.class)
                .hasMessageContaining("differentiation symbol");
        assertThat(d.subs(Map.of(d, y))).isEqualTo(y);
    }

    @Test
    void substitutingZeroIntoANegativePowerFails() {
        assertThatThrownBy(() -> div(integer(1), x).subs(Map.of(x, integer(0))))
                .isInstanceOf(SymbolicException.class);
    }
}
