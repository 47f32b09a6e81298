
package org.lunalang.lunac.compiler.backend;

import java.util.HashMap;
import java.util.Map;

import org.lunalang.lunac.compiler.ErrorException;

/**
 * Support code that is only emitted once something in the program needs it.
 */
public class BuiltIns {

    private BuiltIns() {}

    @FunctionalInterface
    public static interface Materializer {
        void materialize(GeneratorContext context) throws ErrorException;
    }

    public static final String STRING = "luna_string_t";

    private static final String STRING_DECLARATION = """
        typedef struct luna_string_t {
            uintptr_t len;
            uintptr_t res;
            char data[];
        } luna_string_t;
        """;

    public static Map<String, Materializer> materializers() {
        Map<String, Materializer> materializers = new HashMap<>();
        materializers.put(STRING, context -> {
            context.addInclude("<stdint.h>");
            context.builtInDeclarations().add(STRING_DECLARATION);
        });
        return materializers;
    }

}
