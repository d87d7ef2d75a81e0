package org.qed.algebra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import kala.collection.Map;
import kala.collection.Seq;

import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Dumps the structure of an expression as a JSON tree, for diagnostics only: there is no way back from JSON.
 */
public record ExprJSONSerializer() {
    private final static ObjectMapper mapper = new ObjectMapper();

    public static JsonNode serialize(Basic expr) {
        var kind = string(expr.getTypeID().name().toLowerCase(Locale.ROOT));
        if (expr instanceof Int i) {
            return object(Map.of("kind", kind, "value", integer(i.getValue())));
        }
        if (expr instanceof Rational r) {
            return object(Map.of("kind", kind, "numerator", integer(r.getNumerator()), "denominator",
                    integer(r.getDenominator())));
        }
        if (expr instanceof Symbol symbol) {
            return object(Map.of("kind", kind, "name", string(symbol.getName())));
        }
        if (expr instanceof FunctionSymbol function) {
            return object(Map.of("kind", kind, "name", string(function.getName()), "args",
                    array(Seq.of(serialize(function.getArg())))));
        }
        if (expr instanceof Derivative derivative) {
            return object(Map.of("kind", kind, "args", array(Seq.of(serialize(derivative.getArg()))), "symbols",
                    array(derivative.getSymbols().map(symbol -> string(symbol.getName())))));
        }
        return object(Map.of("kind", kind, "args", array(expr.getArgs().map(ExprJSONSerializer::serialize))));
    }

    public static String dump(Basic expr) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(serialize(expr));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ArrayNode array(Seq<? extends JsonNode> objs) {
        return new ArrayNode(mapper.getNodeFactory(), objs.<JsonNode>map(o -> o).asJava());
    }

    private static ObjectNode object(Map<String, JsonNode> fields) {
        return new ObjectNode(mapper.getNodeFactory(), fields.asJava());
    }

    private static TextNode string(String s) {
        return new TextNode(s);
    }

    private static BigIntegerNode integer(BigInteger i) {
        return new BigIntegerNode(i);
    }
}
