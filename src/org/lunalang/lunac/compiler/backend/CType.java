
package org.lunalang.lunac.compiler.backend;

import java.util.Optional;

/**
 * The C spelling of a primitive type and the header declaring it.
 */
public record CType(String spelling, Optional<String> include) {

    public CType(String spelling) {
        this(spelling, Optional.empty());
    }

    public CType(String spelling, String include) {
        this(spelling, Optional.of(include));
    }

}
