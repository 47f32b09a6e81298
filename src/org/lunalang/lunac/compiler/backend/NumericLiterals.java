
package org.lunalang.lunac.compiler.backend;

import java.math.BigInteger;
import java.util.Map;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

public class NumericLiterals {

    private NumericLiterals() {}

    // all unsigned widths share 'uint'
    public static final Map<String, String> SUFFIXES = Map.ofEntries(
        Map.entry("integer", "integer"),
        Map.entry("number",  "number"),
        Map.entry("b",       "byte"),    Map.entry("byte",    "byte"),
        Map.entry("c",       "char"),    Map.entry("char",    "char"),
        Map.entry("i",       "int"),     Map.entry("int",     "int"),
        Map.entry("i8",      "int8"),    Map.entry("int8",    "int8"),
        Map.entry("i16",     "int16"),   Map.entry("int16",   "int16"),
        Map.entry("i32",     "int32"),   Map.entry("int32",   "int32"),
        Map.entry("i64",     "int64"),   Map.entry("int64",   "int64"),
        Map.entry("u",       "uint"),    Map.entry("uint",    "uint"),
        Map.entry("u8",      "uint"),    Map.entry("uint8",   "uint"),
        Map.entry("u16",     "uint"),    Map.entry("uint16",  "uint"),
        Map.entry("u32",     "uint"),    Map.entry("uint32",  "uint"),
        Map.entry("u64",     "uint"),    Map.entry("uint64",  "uint"),
        Map.entry("f32",     "float32"), Map.entry("float32", "float32"),
        Map.entry("f64",     "float64"), Map.entry("float64", "float64"),
        Map.entry("pointer", "pointer")
    );

    public static final Map<String, String> PRINTF_FORMATS = Map.ofEntries(
        Map.entry("integer", "%lli"),
        Map.entry("number",  "%lf"),
        Map.entry("byte",    "%hhi"),
        Map.entry("char",    "%c"),
        Map.entry("float64", "%f"),
        Map.entry("float32", "%lf"),
        Map.entry("pointer", "%p"),
        Map.entry("int",     "%ti"),
        Map.entry("int8",    "%hhi"),
        Map.entry("int16",   "%hi"),
        Map.entry("int32",   "%li"),
        Map.entry("int64",   "%lli"),
        Map.entry("uint",    "%tu"),
        Map.entry("uint8",   "%hhu"),
        Map.entry("uint16",  "%hu"),
        Map.entry("uint32",  "%lu"),
        Map.entry("uint64",  "%llu")
    );


    /**
     * Determines the canonical type of a number literal, either from its
     * suffix or from its syntactic form.
     */
    public static String canonicalType(AstNode node) throws ErrorException {
        AstNode.NumberLiteral data = node.getValue();
        if(data.suffix().isPresent()) {
            String suffix = data.suffix().get();
            String type = SUFFIXES.get(suffix);
            if(type == null) {
                throw node.error(
                    "Number literal suffix '" + suffix + "' is not defined"
                );
            }
            return type;
        }
        switch(data.form()) {
            case INTEGER:
                return PrimitiveTypes.INT;
            case DECIMAL:
            case SCIENTIFIC:
                return PrimitiveTypes.NUMBER;
            case HEXADECIMAL:
            case BINARY:
                return PrimitiveTypes.UINT;
            default:
                throw new IllegalArgumentException(
                    "Unhandled number form " + data.form()
                );
        }
    }


    public static String spelling(AstNode node) throws ErrorException {
        AstNode.NumberLiteral data = node.getValue();
        switch(data.form()) {
            case INTEGER:
            case DECIMAL:
                return data.value();
            case SCIENTIFIC:
                if(data.exponent().isEmpty()) {
                    throw node.error(
                        "Scientific number literal is missing its exponent"
                    );
                }
                return data.value() + "e" + data.exponent().get();
            case HEXADECIMAL:
                return "0x" + data.value() + "u";
            case BINARY:
                try {
                    return new BigInteger(data.value(), 2).toString() + "u";
                } catch(NumberFormatException e) {
                    throw node.error(
                        "'" + data.value() + "' is not a binary number"
                    );
                }
            default:
                throw new IllegalArgumentException(
                    "Unhandled number form " + data.form()
                );
        }
    }

}
