
package org.lunalang.lunac.compiler.backend;

import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.frontend.AstNode;

public interface CodeGen {

    String generate(AstNode root) throws ErrorException;

}
