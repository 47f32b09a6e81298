
package org.lunalang.lunac.compiler.frontend;

import java.util.List;
import java.util.Optional;

import org.lunalang.lunac.compiler.Error;
import org.lunalang.lunac.compiler.ErrorException;
import org.lunalang.lunac.compiler.Source;

/**
 * A node of a parsed and checked Luna program.
 * The arguments of a node are held by the record matching its type
 * (see the comments on {@link Type}); nodes without arguments hold
 * {@code null}.
 */
public class AstNode {

    public enum NumberForm {
        INTEGER,     // 10
        DECIMAL,     // 1.5
        SCIENTIFIC,  // 1.5e10
        HEXADECIMAL, // 0xff
        BINARY       // 0b101
    }

    public static record Block(
        List<AstNode> statements
    ) {}

    public static record NumberLiteral(
        NumberForm form,
        String value,
        Optional<String> exponent,
        Optional<String> suffix
    ) {}

    public static record StringLiteral(
        String value,
        Optional<String> suffix
    ) {}

    public static record BooleanLiteral(
        boolean value
    ) {}

    public static record Name(
        String name
    ) {}

    public static record Paren(
        AstNode value
    ) {}

    public static record TypedId(
        String name,
        Optional<AstNode> type
    ) {}

    public static record DotIndex(
        String name,
        AstNode accessed
    ) {}

    public static record ArrayIndex(
        AstNode index,
        AstNode accessed
    ) {}

    public static record Call(
        AstNode called,
        List<AstNode> arguments,
        boolean isStatement
    ) {}

    public static record MethodCall(
        String name,
        AstNode called,
        List<AstNode> arguments,
        boolean isStatement
    ) {}

    public static record FunctionArgument(
        String name,
        Optional<String> mutability,
        AstNode type
    ) {}

    public static record Return(
        List<AstNode> values
    ) {}

    public static record IfBranch(
        AstNode condition,
        AstNode body
    ) {}

    public static record If(
        List<IfBranch> branches,
        Optional<AstNode> elseBody
    ) {}

    public static record SwitchCase(
        AstNode value,
        AstNode body
    ) {}

    public static record Switch(
        AstNode value,
        List<SwitchCase> cases,
        Optional<AstNode> elseBody
    ) {}

    public static record Do(
        AstNode body
    ) {}

    public static record While(
        AstNode condition,
        AstNode body
    ) {}

    public static record Repeat(
        AstNode body,
        AstNode condition
    ) {}

    public static record NumericFor(
        AstNode variable,
        AstNode begin,
        String comparator,
        AstNode end,
        Optional<AstNode> step,
        AstNode body
    ) {}

    public static record GenericFor(
        List<AstNode> variables,
        List<AstNode> iterated,
        AstNode body
    ) {}

    public static record VariableDeclaration(
        String scope,
        String mutability,
        List<AstNode> variables,
        Optional<List<AstNode>> values
    ) {}

    public static record Assignment(
        List<AstNode> targets,
        List<AstNode> values
    ) {}

    public static record FunctionDefinition(
        String scope,
        String name,
        List<AstNode> arguments,
        List<AstNode> returnTypes,
        AstNode body
    ) {}

    public static record Function(
        List<AstNode> arguments,
        List<AstNode> returnTypes,
        AstNode body
    ) {}

    public static record Table(
        List<AstNode> entries
    ) {}

    public static record Pair(
        AstNode key,
        AstNode value
    ) {}

    public static record UnaryOp(
        String operator,
        AstNode value
    ) {}

    public static record BinaryOp(
        String operator,
        AstNode left,
        AstNode right
    ) {}

    public static record TernaryOp(
        String operator,
        AstNode left,
        AstNode middle,
        AstNode right
    ) {}

    public enum Type {
        BLOCK,          // Block
        NUMBER,         // NumberLiteral
        STRING,         // StringLiteral
        BOOLEAN,        // BooleanLiteral
        NIL,            // = null
        VARARGS,        // = null
        TABLE,          // Table
        PAIR,           // Pair
        FUNCTION,       // Function
        ID,             // Name
        PAREN,          // Paren
        TYPE,           // Name
        TYPED_ID,       // TypedId
        DOT_INDEX,      // DotIndex
        COLON_INDEX,    // DotIndex
        ARRAY_INDEX,    // ArrayIndex
        CALL,           // Call
        METHOD_CALL,    // MethodCall
        FUNC_ARG,       // FunctionArgument
        RETURN,         // Return
        IF,             // If
        SWITCH,         // Switch
        DO,             // Do
        WHILE,          // While
        REPEAT,         // Repeat
        FOR_NUM,        // NumericFor
        FOR_IN,         // GenericFor
        BREAK,          // = null
        CONTINUE,       // = null
        LABEL,          // Name
        GOTO,           // Name
        VAR_DECL,       // VariableDeclaration
        ASSIGN,         // Assignment
        FUNC_DEF,       // FunctionDefinition
        UNARY_OP,       // UnaryOp
        BINARY_OP,      // BinaryOp
        TERNARY_OP      // TernaryOp
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public AstNode(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public boolean isOperator() {
        switch(this.type) {
            case UNARY_OP:
            case BINARY_OP:
            case TERNARY_OP:
                return true;
            default:
                return false;
        }
    }

    /**
     * Creates the fatal diagnostic for a rule violated by this node.
     */
    public ErrorException error(String message) {
        return new ErrorException(new Error(
            message,
            Error.Marking.error(this.source, "here")
        ));
    }

    public void check(boolean condition, String message)
            throws ErrorException {
        if(!condition) {
            throw this.error(message);
        }
    }

}
