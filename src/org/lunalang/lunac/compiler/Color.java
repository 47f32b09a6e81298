
package org.lunalang.lunac.compiler;

public class Color {

    public static final String BOLD = "1";

    public static final String RED = "31";

    public static final String GRAY = "90";
    public static final String BRIGHT_BLUE = "94";

    public static String from(String... properties) {
        return "\033[0"
            + (properties.length > 0? ";" : "")
            + String.join(";", properties)
            + "m";
    }

    private Color() {}

}
