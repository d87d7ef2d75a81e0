package org.qed.algebra;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.qed.algebra.Expr.*;

class ExprJSONSerializerTest {
    private static final Symbol x = symbol("x");

    @Test
    void numbers() {
        var five = ExprJSONSerializer.serialize(integer(5));
        assertThat(five.get("kind").asText()).isEqualTo("integer");
        assertThat(five.get("value").bigIntegerValue()).isEqualTo(BigInteger.valueOf(5));

        var half = ExprJSONSerializer.serialize(rational(-1, 2));
        assertThat(half.get("kind").asText()).isEqualTo("rational");
        assertThat(half.get("numerator").bigIntegerValue()).isEqualTo(BigInteger.valueOf(-1));
        assertThat(half.get("denominator").bigIntegerValue()).isEqualTo(BigInteger.TWO);
    }

    @Test
    void operandsFollowCanonicalOrder() {
        var sum = ExprJSONSerializer.serialize(add(x, integer(1)));
        assertThat(sum.get("kind").asText()).isEqualTo("add");
        var args = sum.get("args");
        assertThat(args.size()).isEqualTo(2);
        assertThat(args.get(0).get("kind").asText()).isEqualTo("integer");
        assertThat(args.get(1).get("name").asText()).isEqualTo("x");
    }

    @Test
    void functionsAndDerivatives() {
        var d = ExprJSONSerializer.serialize(function("f", x).diff(x).diff(x));
        assertThat(d.get("kind").asText()).isEqualTo("derivative");
        assertThat(d.get("symbols").size()).isEqualTo(2);
        assertThat(d.get("symbols").get(1).asText()).isEqualTo("x");
        var f = d.get("args").get(0);
        assertThat(f.get("kind").asText()).isEqualTo("function_symbol");
        assertThat(f.get("name").asText()).isEqualTo("f");
    }

    @Test
    void dumpIsPrettyPrinted() {
        var text = ExprJSONSerializer.dump(sin(x));
        assertThat(text).contains("\"kind\" : \"sin\"").contains("\"name\" : \"x\"").contains("\n");
    }
}
