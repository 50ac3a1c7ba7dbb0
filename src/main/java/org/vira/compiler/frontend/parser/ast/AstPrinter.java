package org.vira.compiler.frontend.parser.ast;

import org.vira.compiler.frontend.lexer.Token;

/**
 * Renders an AST as an indented listing, two spaces per level:
 * <pre>
 * Program:
 *   VarDecl: x
 *     Binary: +
 *       Number: 5
 *       Number: 3
 * </pre>
 */
public final class AstPrinter {

    private AstPrinter() {}

    /**
     * @param program The program to render.
     * @return The listing, each line terminated by {@code \n}.
     */
    public static String print(Program program) {
        StringBuilder sb = new StringBuilder("Program:\n");
        for (Statement statement : program.statements()) {
            print(statement, 2, sb);
        }
        return sb.toString();
    }

    private static void print(AstNode node, int indent, StringBuilder sb) {
        if (node instanceof VariableDeclaration decl) {
            line(sb, indent, "VarDecl: " + decl.name().text());
            if (decl.initializer() != null) print(decl.initializer(), indent + 2, sb);
        } else if (node instanceof FunctionDefinition func) {
            line(sb, indent, "FuncDef: " + func.name().text());
            line(sb, indent + 2, "Params:");
            for (Token param : func.parameters()) {
                line(sb, indent + 4, param.text());
            }
            line(sb, indent + 2, "Body:");
            for (Statement statement : func.body()) {
                print(statement, indent + 4, sb);
            }
        } else if (node instanceof ImportStatement imp) {
            line(sb, indent, "Import: " + imp.libraryName());
        } else if (node instanceof WriteStatement write) {
            line(sb, indent, "Write:");
            print(write.expression(), indent + 2, sb);
        } else if (node instanceof ReturnStatement ret) {
            line(sb, indent, "Return:");
            print(ret.expression(), indent + 2, sb);
        } else if (node instanceof ExpressionStatement stmt) {
            line(sb, indent, "ExprStmt:");
            print(stmt.expression(), indent + 2, sb);
        } else if (node instanceof NumberLiteral number) {
            line(sb, indent, "Number: " + number.value());
        } else if (node instanceof StringLiteral string) {
            line(sb, indent, "String: \"" + string.value() + "\"");
        } else if (node instanceof IdentifierReference id) {
            line(sb, indent, "Identifier: " + id.name().text());
        } else if (node instanceof BinaryOperation binary) {
            line(sb, indent, "Binary: " + binary.operator().symbol());
            print(binary.left(), indent + 2, sb);
            print(binary.right(), indent + 2, sb);
        } else if (node instanceof CallExpression call) {
            line(sb, indent, "Call: " + call.callee().text());
            for (Expression arg : call.arguments()) {
                print(arg, indent + 2, sb);
            }
        } else {
            line(sb, indent, node.getClass().getSimpleName());
        }
    }

    private static void line(StringBuilder sb, int indent, String text) {
        sb.append(" ".repeat(indent)).append(text).append('\n');
    }
}
