
package org.lunalang.lunac.compiler;

import org.lunalang.lunac.compiler.backend.CCodeGen;
import org.lunalang.lunac.compiler.backend.CodeGen;
import org.lunalang.lunac.compiler.frontend.AstNode;

public class Compiler {

    private Compiler() {}

    public static Result<String> compile(AstNode root) {
        return Compiler.compile(root, new CCodeGen());
    }

    public static Result<String> compile(AstNode root, CodeGen codeGen) {
        try {
            return Result.ofValue(codeGen.generate(root));
        } catch(ErrorException e) {
            return Result.ofError(e.error);
        }
    }

}
