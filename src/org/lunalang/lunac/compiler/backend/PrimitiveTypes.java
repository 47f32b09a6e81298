
package org.lunalang.lunac.compiler.backend;

import java.util.Map;

public class PrimitiveTypes {

    private PrimitiveTypes() {}

    private static final String STDINT = "<stdint.h>";
    private static final String STDBOOL = "<stdbool.h>";

    public static final String INTEGER = "integer";
    public static final String INT = "int";
    public static final String NUMBER = "number";
    public static final String UINT = "uint";
    public static final String BOOLEAN = "boolean";

    public static final Map<String, CType> C_TYPES = Map.ofEntries(
        Map.entry(INTEGER,   new CType("int64_t", STDINT)),
        Map.entry(NUMBER,    new CType("double")),
        Map.entry("byte",    new CType("unsigned char")),
        Map.entry("char",    new CType("char")),
        Map.entry("float64", new CType("double")),
        Map.entry("float32", new CType("float")),
        Map.entry("pointer", new CType("void*")),
        Map.entry(INT,       new CType("intptr_t", STDINT)),
        Map.entry("int8",    new CType("int8_t", STDINT)),
        Map.entry("int16",   new CType("int16_t", STDINT)),
        Map.entry("int32",   new CType("int32_t", STDINT)),
        Map.entry("int64",   new CType("int64_t", STDINT)),
        Map.entry(UINT,      new CType("uintptr_t", STDINT)),
        Map.entry("uint8",   new CType("uint8_t", STDINT)),
        Map.entry("uint16",  new CType("uint16_t", STDINT)),
        Map.entry("uint32",  new CType("uint32_t", STDINT)),
        Map.entry("uint64",  new CType("uint64_t", STDINT)),
        Map.entry(BOOLEAN,   new CType("bool", STDBOOL)),
        Map.entry("bool",    new CType("bool", STDBOOL))
    );

}
