package org.qed.algebra;

import kala.collection.immutable.ImmutableSeq;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Distributes products over sums, recursively, so that the result is a sum of products.
 */
public final class Expander {
    private static final Logger LOGGER = Logger.getLogger(Expander.class.getName());

    private Expander() {
    }

    /**
     * @throws SymbolicException when a sum is raised to a power too large to multiply out
     */
    public static Basic expand(Basic expr) {
        var expanded = expandNode(expr);
        LOGGER.finer(() -> "Expanded " + expr + " into " + expanded);
        return expanded;
    }

    private static Basic expandNode(Basic expr) {
        if (expr instanceof Add add) {
            return Add.of(add.getArgs().map(Expander::expandNode));
        }
        if (expr instanceof Mul mul) {
            var product = List.<Basic>of(mul.getCoefficient());
            for (var entry : mul.getFactors().entrySet()) {
                product = multiply(product, summands(expandPower(entry.getKey(), entry.getValue())));
            }
            return Add.of(product);
        }
        if (expr instanceof Pow pow) {
            return expandPower(pow.getBase(), pow.getExponent());
        }
        if (expr instanceof TrigFunction trig) {
            var arg = expandNode(trig.getArg());
            return arg == trig.getArg() ? trig : trig.rebuild(arg);
        }
        if (expr instanceof FunctionSymbol function) {
            var arg = expandNode(function.getArg());
            return arg == function.getArg() ? function : FunctionSymbol.of(function.getName(), arg);
        }
        if (expr instanceof Derivative derivative) {
            var arg = expandNode(derivative.getArg());
            return arg == derivative.getArg() ? derivative : Derivative.of(arg, derivative.getSymbols());
        }
        return expr;
    }

    private static Basic expandPower(Basic base, Basic exponent) {
        var b = expandNode(base);
        var e = expandNode(exponent);
        if (b instanceof Add add && e instanceof Int n && n.isPositive()) {
            int times;
            try {
                times = n.getValue().intValueExact();
            } catch (ArithmeticException ex) {
                throw new SymbolicException(String.format("Cannot expand %s to the power %s", add, n));
            }
            var terms = summands(add);
            var product = terms;
            for (int i = 1; i < times; i++) {
                product = multiply(product, terms);
            }
            return Add.of(product);
        }
        return Pow.of(b, e);
    }

    private static List<Basic> summands(Basic expr) {
        return expr instanceof Add add ? add.getArgs().asJava() : List.of(expr);
    }

    private static List<Basic> multiply(List<Basic> left, List<Basic> right) {
        var product = new ArrayList<Basic>(left.size() * right.size());
        for (var l : left) {
            for (var r : right) {
                product.add(Mul.of(l, r));
            }
        }
        return product;
    }
}
