package org.kaleidoscope.compiler.frontend.parser;

import org.kaleidoscope.compiler.frontend.lexer.Lexer;
import org.kaleidoscope.compiler.frontend.lexer.Token;
import org.kaleidoscope.compiler.frontend.lexer.TokenType;
import org.kaleidoscope.compiler.frontend.parser.ast.BinaryOpNode;
import org.kaleidoscope.compiler.frontend.parser.ast.CallNode;
import org.kaleidoscope.compiler.frontend.parser.ast.ExprNode;
import org.kaleidoscope.compiler.frontend.parser.ast.FunctionNode;
import org.kaleidoscope.compiler.frontend.parser.ast.NumberLiteralNode;
import org.kaleidoscope.compiler.frontend.parser.ast.PrototypeNode;
import org.kaleidoscope.compiler.frontend.parser.ast.VariableRefNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A recursive-descent parser with one token of lookahead. Binary expressions are parsed by
 * operator-precedence climbing over a {@link PrecedenceTable}.
 * <p>
 * Every parse method expects {@link #current()} to hold the first token of its construct and
 * leaves the first token after the construct there on success. On failure the method returns a
 * {@link ParseResult.Failure}; no partial tree escapes and nothing is logged here. Reporting is
 * left to the caller.
 * <p>
 * The parser owns its lexer and lookahead and is not thread-safe.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final PrecedenceTable precedence;
    private Token current;

    /**
     * Constructs a new Parser and reads the first token.
     * @param lexer The lexer to pull tokens from.
     * @param precedence The binary operator table consulted while parsing.
     */
    public Parser(Lexer lexer, PrecedenceTable precedence) {
        this.lexer = lexer;
        this.precedence = precedence;
        this.current = lexer.nextToken();
    }

    /**
     * @return The current lookahead token.
     */
    public Token current() {
        return current;
    }

    /**
     * Reads the next token from the lexer and makes it the current one.
     * @return The new current token.
     */
    public Token advance() {
        current = lexer.nextToken();
        return current;
    }

    /**
     * Parses an expression.
     * <pre>expression ::= primary binoprhs</pre>
     * @return The expression, or the error that aborted it.
     */
    public ParseResult<ExprNode> parseExpression() {
        ParseResult<ExprNode> lhs = parsePrimary();
        if (lhs.isFailure()) return lhs;
        return parseBinOpRhs(0, lhs.value());
    }

    /**
     * Parses a primary expression.
     * <pre>primary ::= identifierexpr | numberexpr | parenexpr</pre>
     * @return The expression, or the error that aborted it.
     */
    public ParseResult<ExprNode> parsePrimary() {
        switch (current.type()) {
            case IDENTIFIER:
                return parseIdentifierExpr();
            case NUMBER:
                return parseNumberExpr();
            default:
                if (current.isCharacter('(')) {
                    return parseParenExpr();
                }
                return fail(SyntaxErrorKind.UNKNOWN_TOKEN);
        }
    }

    /**
     * Parses a function prototype.
     * <pre>prototype ::= id '(' id* ')'</pre>
     * @return The prototype, or the error that aborted it.
     */
    public ParseResult<PrototypeNode> parsePrototype() {
        if (current.type() != TokenType.IDENTIFIER) {
            return fail(SyntaxErrorKind.EXPECTED_FUNCTION_NAME);
        }

        String functionName = current.text();
        advance();

        if (!current.isCharacter('(')) {
            return fail(SyntaxErrorKind.EXPECTED_PROTOTYPE_OPEN_PAREN);
        }

        // Duplicate names are accepted as they are.
        List<String> parameters = new ArrayList<>();
        while (advance().type() == TokenType.IDENTIFIER) {
            parameters.add(current.text());
        }
        if (!current.isCharacter(')')) {
            return fail(SyntaxErrorKind.EXPECTED_PROTOTYPE_CLOSE_PAREN);
        }
        advance(); // eat ')'

        return ParseResult.success(new PrototypeNode(functionName, parameters));
    }

    /**
     * Parses a function definition.
     * <pre>definition ::= 'def' prototype expression</pre>
     * @return The function, or the error that aborted it.
     */
    public ParseResult<FunctionNode> parseDefinition() {
        advance(); // eat 'def'
        ParseResult<PrototypeNode> prototype = parsePrototype();
        if (prototype.isFailure()) return prototype.propagate();

        ParseResult<ExprNode> body = parseExpression();
        if (body.isFailure()) return body.propagate();

        LOG.debug("Parsed definition of '{}'", prototype.value().name());
        return ParseResult.success(new FunctionNode(prototype.value(), body.value()));
    }

    /**
     * Parses an external declaration.
     * <pre>external ::= 'extern' prototype</pre>
     * @return The declared prototype, or the error that aborted it.
     */
    public ParseResult<PrototypeNode> parseExtern() {
        advance(); // eat 'extern'
        return parsePrototype();
    }

    /**
     * Parses a bare expression and wraps it in an anonymous function with no parameters.
     * <pre>toplevelexpr ::= expression</pre>
     * @return The anonymous function, or the error that aborted it.
     */
    public ParseResult<FunctionNode> parseTopLevelExpr() {
        return parseExpression().map(body -> new FunctionNode(PrototypeNode.anonymous(), body));
    }

    // numberexpr ::= number
    private ParseResult<ExprNode> parseNumberExpr() {
        ExprNode result = new NumberLiteralNode(current.numberValue());
        advance(); // eat the number
        return ParseResult.success(result);
    }

    // parenexpr ::= '(' expression ')'
    private ParseResult<ExprNode> parseParenExpr() {
        advance(); // eat '('
        ParseResult<ExprNode> inner = parseExpression();
        if (inner.isFailure()) return inner;

        if (!current.isCharacter(')')) {
            return fail(SyntaxErrorKind.EXPECTED_CLOSING_PAREN);
        }
        advance(); // eat ')'
        return inner;
    }

    // identifierexpr ::= identifier | identifier '(' (expression (',' expression)*)? ')'
    private ParseResult<ExprNode> parseIdentifierExpr() {
        String name = current.text();
        advance(); // eat identifier

        if (!current.isCharacter('(')) {
            return ParseResult.success(new VariableRefNode(name));
        }

        advance(); // eat '('
        List<ExprNode> arguments = new ArrayList<>();
        if (!current.isCharacter(')')) {
            while (true) {
                ParseResult<ExprNode> argument = parseExpression();
                if (argument.isFailure()) return argument;
                arguments.add(argument.value());

                if (current.isCharacter(')')) {
                    break;
                }
                if (!current.isCharacter(',')) {
                    return fail(SyntaxErrorKind.EXPECTED_ARGUMENT_SEPARATOR);
                }
                advance(); // eat ','
            }
        }
        advance(); // eat ')'

        return ParseResult.success(new CallNode(name, arguments));
    }

    // binoprhs ::= (binop primary)*
    private ParseResult<ExprNode> parseBinOpRhs(int minPrecedence, ExprNode lhs) {
        while (true) {
            int tokenPrecedence = currentPrecedence();

            // Stop unless this is a binop that binds at least as tightly as required.
            if (tokenPrecedence == PrecedenceTable.NOT_AN_OPERATOR || tokenPrecedence < minPrecedence) {
                return ParseResult.success(lhs);
            }

            char operator = current.character();
            advance(); // eat binop

            ParseResult<ExprNode> rhs = parsePrimary();
            if (rhs.isFailure()) return rhs;

            // A tighter operator after the rhs takes the rhs as its own lhs. Equal precedence
            // does not, which makes operators left-associative.
            int nextPrecedence = currentPrecedence();
            if (tokenPrecedence < nextPrecedence) {
                rhs = parseBinOpRhs(tokenPrecedence + 1, rhs.value());
                if (rhs.isFailure()) return rhs;
            }

            lhs = new BinaryOpNode(operator, lhs, rhs.value());
        }
    }

    private int currentPrecedence() {
        if (current.type() != TokenType.CHARACTER) return PrecedenceTable.NOT_AN_OPERATOR;
        return precedence.precedenceOf(current.character());
    }

    private <T> ParseResult<T> fail(SyntaxErrorKind kind) {
        return ParseResult.failure(SyntaxError.at(kind, current));
    }
}
