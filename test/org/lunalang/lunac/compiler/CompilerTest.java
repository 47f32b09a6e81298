
package org.lunalang.lunac.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.lunalang.lunac.compiler.backend.CCodeGen;
import org.lunalang.lunac.compiler.frontend.AstNode;
import org.lunalang.lunac.compiler.frontend.Nodes;

class CompilerTest {

    @Test
    void successfulRunsHoldTheProgram() {
        Nodes n = new Nodes();
        Result<String> result = Compiler.compile(n.block());
        assertTrue(result.isValue());
        assertFalse(result.isError());
        assertEquals("int main() {\n    return 0;\n}\n", result.getValue());
        assertThrows(IllegalStateException.class, result::getError);
    }

    @Test
    void failedRunsHoldTheError() {
        Nodes n = new Nodes();
        AstNode nil = n.nil();
        Result<String> result = Compiler.compile(n.block(n.local(
            n.typedId("x"), nil
        )));
        assertTrue(result.isError());
        assertFalse(result.isValue());
        assertEquals(1, result.getError().size());
        assertEquals(
            nil.source, result.getError().get(0).markings()[0].location()
        );
        assertThrows(IllegalStateException.class, result::getValue);
    }

    @Test
    void customGeneratorsAreUsed() {
        Nodes n = new Nodes();
        Result<String> result = Compiler.compile(n.block(), new CCodeGen("\t"));
        assertEquals("int main() {\n\treturn 0;\n}\n", result.getValue());
    }

}
