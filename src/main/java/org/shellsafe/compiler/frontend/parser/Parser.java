package org.shellsafe.compiler.frontend.parser;

import org.shellsafe.compiler.api.CompilerErrorCode;
import org.shellsafe.compiler.api.SourceSpan;
import org.shellsafe.compiler.diagnostics.DiagnosticsEngine;
import org.shellsafe.compiler.frontend.lexer.Token;
import org.shellsafe.compiler.frontend.lexer.TokenType;
import org.shellsafe.compiler.frontend.parser.ast.AssignNode;
import org.shellsafe.compiler.frontend.parser.ast.BinaryExpr;
import org.shellsafe.compiler.frontend.parser.ast.BlockNode;
import org.shellsafe.compiler.frontend.parser.ast.BoolLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.BreakNode;
import org.shellsafe.compiler.frontend.parser.ast.CallExpr;
import org.shellsafe.compiler.frontend.parser.ast.ContinueNode;
import org.shellsafe.compiler.frontend.parser.ast.ExprNode;
import org.shellsafe.compiler.frontend.parser.ast.ExprStmtNode;
import org.shellsafe.compiler.frontend.parser.ast.ForNode;
import org.shellsafe.compiler.frontend.parser.ast.FormatMacroExpr;
import org.shellsafe.compiler.frontend.parser.ast.FunctionNode;
import org.shellsafe.compiler.frontend.parser.ast.IfNode;
import org.shellsafe.compiler.frontend.parser.ast.IndexExpr;
import org.shellsafe.compiler.frontend.parser.ast.IntLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.LetNode;
import org.shellsafe.compiler.frontend.parser.ast.LiteralPatternNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchArmNode;
import org.shellsafe.compiler.frontend.parser.ast.MatchNode;
import org.shellsafe.compiler.frontend.parser.ast.NodeId;
import org.shellsafe.compiler.frontend.parser.ast.ParameterNode;
import org.shellsafe.compiler.frontend.parser.ast.PatternNode;
import org.shellsafe.compiler.frontend.parser.ast.ProgramNode;
import org.shellsafe.compiler.frontend.parser.ast.RangeExpr;
import org.shellsafe.compiler.frontend.parser.ast.RangePatternNode;
import org.shellsafe.compiler.frontend.parser.ast.ReturnNode;
import org.shellsafe.compiler.frontend.parser.ast.SourceType;
import org.shellsafe.compiler.frontend.parser.ast.StmtNode;
import org.shellsafe.compiler.frontend.parser.ast.StringLiteralExpr;
import org.shellsafe.compiler.frontend.parser.ast.UnaryExpr;
import org.shellsafe.compiler.frontend.parser.ast.VariableExpr;
import org.shellsafe.compiler.frontend.parser.ast.VecMacroExpr;
import org.shellsafe.compiler.frontend.parser.ast.WhileNode;
import org.shellsafe.compiler.frontend.parser.ast.WildcardPatternNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * The parser for the accepted language subset. It consumes the tokens produced by the
 * {@link org.shellsafe.compiler.frontend.lexer.Lexer} and produces a {@link ProgramNode}.
 * <p>
 * Constructs outside of the subset are reported as {@link CompilerErrorCode#UNSUPPORTED_CONSTRUCT}
 * and skipped, so that one run reports every violation up to the diagnostics bound. Compound
 * assignments are desugared here; no later stage ever sees them.
 */
public class Parser {

    /** Maximum nesting of expressions (parentheses, unary operators, call arguments). */
    public static final int MAX_EXPRESSION_DEPTH = 30;
    /** Maximum nesting of blocks. */
    public static final int MAX_BLOCK_DEPTH = 30;

    private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
            TokenType.LET, TokenType.IF, TokenType.MATCH, TokenType.FOR, TokenType.WHILE, TokenType.RETURN,
            TokenType.BREAK, TokenType.CONTINUE, TokenType.LOOP);

    private static final Set<TokenType> ITEM_STARTS = EnumSet.of(
            TokenType.FN, TokenType.ASYNC, TokenType.UNSAFE, TokenType.TRAIT, TokenType.IMPL, TokenType.STRUCT,
            TokenType.ENUM, TokenType.MOD, TokenType.USE, TokenType.STATIC, TokenType.CONST, TokenType.TYPE,
            TokenType.EXTERN, TokenType.PUB, TokenType.HASH);

    private static final Map<TokenType, BinaryExpr.Operator> COMPOUND_ASSIGNMENTS = Map.of(
            TokenType.PLUS_EQUAL, BinaryExpr.Operator.ADD,
            TokenType.MINUS_EQUAL, BinaryExpr.Operator.SUB,
            TokenType.STAR_EQUAL, BinaryExpr.Operator.MUL,
            TokenType.SLASH_EQUAL, BinaryExpr.Operator.DIV,
            TokenType.PERCENT_EQUAL, BinaryExpr.Operator.REM,
            TokenType.AMPERSAND_EQUAL, BinaryExpr.Operator.BIT_AND,
            TokenType.PIPE_EQUAL, BinaryExpr.Operator.BIT_OR,
            TokenType.CARET_EQUAL, BinaryExpr.Operator.BIT_XOR,
            TokenType.SHL_EQUAL, BinaryExpr.Operator.SHL,
            TokenType.SHR_EQUAL, BinaryExpr.Operator.SHR);

    private static final Set<String> INTEGER_TYPES = Set.of(
            "u8", "u16", "u32", "u64", "usize", "i8", "i16", "i32", "i64", "isize");

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final Set<NodeId> tailExpressions = new HashSet<>();
    private int current = 0;
    private int nextId = 0;
    private int expressionDepth = 0;
    private int blockDepth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The program; functions that failed to parse are left out.
     */
    public ProgramNode parse() {
        NodeId programId = newId();
        SourceSpan programSpan = SourceSpan.startOf(peek().fileName());
        List<FunctionNode> functions = new ArrayList<>();
        while (!isAtEnd() && !diagnostics.limitReached()) {
            FunctionNode function = declaration();
            if (function != null) {
                functions.add(function);
            }
        }
        return new ProgramNode(programId, programSpan, functions);
    }

    /**
     * Parses a single top-level item. Only functions are accepted; every other item kind is
     * reported and skipped.
     * @return The parsed function, or null if the item was rejected or malformed.
     */
    private FunctionNode declaration() {
        try {
            if (check(TokenType.HASH)) {
                Token hash = advance();
                match(TokenType.BANG);
                unsupported(hash, "attributes");
                if (check(TokenType.LEFT_BRACKET)) skipBalanced();
                return null;
            }
            match(TokenType.PUB);
            if (check(TokenType.FN)) {
                return function();
            }
            Token token = peek();
            String feature = switch (token.type()) {
                case ASYNC -> "async functions";
                case UNSAFE -> "unsafe code";
                case TRAIT -> "traits";
                case IMPL -> "impl blocks";
                case STRUCT -> "structs";
                case ENUM -> "enums";
                case MOD -> "modules";
                case USE -> "use declarations";
                case STATIC -> "static items";
                case CONST -> "const items";
                case TYPE -> "type aliases";
                case EXTERN -> "extern blocks";
                default -> null;
            };
            if (feature == null && isMacroRules()) {
                feature = "macro_rules! definitions";
            }
            if (feature != null) {
                unsupported(token, feature);
                skipItem();
                return null;
            }
            throw error(token, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected a function definition, found '" + token.text() + "'.");
        } catch (ParseException ex) {
            synchronizeItem();
            return null;
        }
    }

    private FunctionNode function() {
        consume(TokenType.FN, "Expected 'fn'.");
        NodeId id = newId();
        Token name = consume(TokenType.IDENTIFIER, "Expected a function name.");
        if (check(TokenType.LESS)) {
            unsupported(peek(), "generic parameters");
            skipItem();
            return null;
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after the function name.");
        List<ParameterNode> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (check(TokenType.RIGHT_PAREN)) break;
                parameters.add(parameter());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after the parameter list.");
        SourceType returnType = match(TokenType.ARROW) ? type() : SourceType.UNIT;
        if (check(TokenType.WHERE)) {
            unsupported(peek(), "where clauses");
            while (!check(TokenType.LEFT_BRACE) && !isAtEnd()) advance();
        }
        BlockNode body = block();
        if (returnType != SourceType.UNIT) {
            body = returnTail(body);
        }
        return new FunctionNode(id, name.span(), name.text(), parameters, returnType, body);
    }

    private ParameterNode parameter() {
        NodeId id = newId();
        boolean mutable = match(TokenType.MUT);
        if (check(TokenType.SELF) || check(TokenType.AMPERSAND) && checkNext(TokenType.SELF)) {
            unsupported(peek(), "methods (self parameters)");
            throw new ParseException("self parameter");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a parameter name.");
        consume(TokenType.COLON, "Expected ':' and a type after parameter '" + name.text() + "'.");
        SourceType type = type();
        if (type == SourceType.VECTOR) {
            diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_TYPE, "Vectors cannot be passed as parameters.", name.span(),
                    "pass the elements individually");
        }
        return new ParameterNode(id, name.span(), name.text(), mutable, type);
    }

    private SourceType type() {
        Token token = peek();
        if (match(TokenType.AMPERSAND)) {
            match(TokenType.MUT);
            if (check(TokenType.IDENTIFIER) && peek().text().equals("str")) {
                advance();
                return SourceType.STRING;
            }
            unsupported(token, "references other than &str");
            type();
            return SourceType.UNIT;
        }
        if (match(TokenType.LEFT_PAREN)) {
            if (match(TokenType.RIGHT_PAREN)) return SourceType.UNIT;
            unsupported(token, "tuple types");
            skipUntilClosing(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
            return SourceType.UNIT;
        }
        if (check(TokenType.IMPL) || check(TokenType.DYN)) {
            unsupported(token, "trait object types");
            advance();
            type();
            return SourceType.UNIT;
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a type.");
        String text = name.text();
        if (INTEGER_TYPES.contains(text)) return SourceType.INTEGER;
        if (text.equals("bool")) return SourceType.BOOLEAN;
        if (text.equals("String") || text.equals("str")) return SourceType.STRING;
        if (text.equals("Vec") && check(TokenType.LESS)) {
            skipGenericArguments();
            return SourceType.VECTOR;
        }
        diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_TYPE, "Unsupported type '" + text + "'.", name.span(),
                "use an integer type, bool, &str or String");
        if (check(TokenType.LESS)) skipGenericArguments();
        return SourceType.UNIT;
    }

    private void skipGenericArguments() {
        int depth = 0;
        do {
            Token t = advance();
            if (t.type() == TokenType.LESS) depth++;
            else if (t.type() == TokenType.GREATER) depth--;
            else if (t.type() == TokenType.SHR) depth -= 2;
        } while (depth > 0 && !isAtEnd());
    }

    // --- Statements ---

    private BlockNode block() {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{'.");
        NodeId id = newId();
        if (++blockDepth > MAX_BLOCK_DEPTH) {
            blockDepth--;
            throw error(brace, CompilerErrorCode.NESTING_TOO_DEEP, "Blocks are nested deeper than " + MAX_BLOCK_DEPTH + " levels.");
        }
        try {
            List<StmtNode> statements = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd() && !diagnostics.limitReached()) {
                StmtNode statement = statementWithRecovery();
                if (statement != null) {
                    statements.add(statement);
                }
            }
            consume(TokenType.RIGHT_BRACE, "Expected '}' to close the block.");
            return new BlockNode(id, brace.span(), statements);
        } finally {
            blockDepth--;
        }
    }

    private StmtNode statementWithRecovery() {
        try {
            return statement();
        } catch (ParseException ex) {
            synchronizeStatement();
            return null;
        }
    }

    private StmtNode statement() {
        Token token = peek();
        switch (token.type()) {
            case LET: return letStatement();
            case IF: return ifStatement();
            case MATCH: return matchStatement();
            case FOR: return forStatement();
            case WHILE: return whileStatement();
            case RETURN: return returnStatement();
            case BREAK:
                advance();
                skipLoopLabel();
                endStatement();
                return new BreakNode(newId(), token.span());
            case CONTINUE:
                advance();
                skipLoopLabel();
                endStatement();
                return new ContinueNode(newId(), token.span());
            case SEMICOLON:
                advance();
                return null;
            case LOOP:
                unsupported(token, "loop", "use 'while true { ... }' with an explicit break");
                skipItem();
                return null;
            case UNSAFE:
                unsupported(token, "unsafe code");
                skipItem();
                return null;
            case FN:
                unsupported(token, "nested functions", "move the function to the top level");
                skipItem();
                return null;
            case LEFT_BRACE:
                unsupported(token, "block expressions");
                skipBalanced();
                return null;
            case CONST: case STATIC: case USE: case STRUCT: case ENUM: case IMPL: case TRAIT:
                unsupported(token, "items inside function bodies");
                skipItem();
                return null;
            default:
                break;
        }
        if (check(TokenType.IDENTIFIER) && (checkNext(TokenType.EQUAL) || COMPOUND_ASSIGNMENTS.containsKey(peekNext().type()))) {
            return assignment();
        }

        NodeId id = newId();
        ExprNode expression = expression();
        if (check(TokenType.EQUAL) || COMPOUND_ASSIGNMENTS.containsKey(peek().type())) {
            unsupported(peek(), "assignment to anything but a plain variable");
            throw new ParseException("complex assignment target");
        }
        if (match(TokenType.SEMICOLON)) {
            return new ExprStmtNode(id, expression.span(), expression);
        }
        if (check(TokenType.RIGHT_BRACE)) {
            tailExpressions.add(id);
            return new ExprStmtNode(id, expression.span(), expression);
        }
        throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, "Expected ';' after the expression, found '" + peek().text() + "'.");
    }

    private StmtNode letStatement() {
        consume(TokenType.LET, "Expected 'let'.");
        NodeId id = newId();
        boolean mutable = match(TokenType.MUT);
        if (check(TokenType.LEFT_PAREN)) {
            unsupported(peek(), "destructuring patterns");
            throw new ParseException("destructuring let");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a variable name after 'let'.");
        SourceType declared = match(TokenType.COLON) ? type() : null;
        if (!match(TokenType.EQUAL)) {
            throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, "A 'let' binding needs an initializer.");
        }
        ExprNode initializer = expression();
        endStatement();
        return new LetNode(id, name.span(), name.text(), mutable, declared, initializer);
    }

    private StmtNode assignment() {
        NodeId id = newId();
        Token target = advance();
        Token operator = advance();
        ExprNode value = expression();
        endStatement();
        BinaryExpr.Operator compound = COMPOUND_ASSIGNMENTS.get(operator.type());
        if (compound != null) {
            // a op= b  =>  a = a op b
            value = new BinaryExpr(newId(), operator.span(), compound, new VariableExpr(newId(), target.span(), target.text()), value);
        }
        return new AssignNode(id, target.span(), target.text(), value);
    }

    private IfNode ifStatement() {
        Token keyword = consume(TokenType.IF, "Expected 'if'.");
        NodeId id = newId();
        if (check(TokenType.LET)) {
            unsupported(peek(), "if let");
            throw new ParseException("if let");
        }
        ExprNode condition = expression();
        BlockNode thenBlock = block();
        BlockNode elseBlock = null;
        if (match(TokenType.ELSE)) {
            if (check(TokenType.IF)) {
                Token elseIfToken = peek();
                NodeId wrapperId = newId();
                IfNode nested = ifStatement();
                elseBlock = new BlockNode(wrapperId, elseIfToken.span(), List.of(nested));
            } else {
                elseBlock = block();
            }
        }
        return new IfNode(id, keyword.span(), condition, thenBlock, elseBlock);
    }

    private MatchNode matchStatement() {
        Token keyword = consume(TokenType.MATCH, "Expected 'match'.");
        NodeId id = newId();
        ExprNode scrutinee = expression();
        consume(TokenType.LEFT_BRACE, "Expected '{' after the match value.");
        List<MatchArmNode> arms = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            arms.add(matchArm());
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close the match.");
        return new MatchNode(id, keyword.span(), scrutinee, arms);
    }

    private MatchArmNode matchArm() {
        NodeId id = newId();
        Token first = peek();
        match(TokenType.PIPE);
        List<PatternNode> patterns = new ArrayList<>();
        do {
            patterns.add(pattern());
        } while (match(TokenType.PIPE));
        if (check(TokenType.IF)) {
            unsupported(peek(), "match guards", "use an if/else chain instead");
            while (!check(TokenType.FAT_ARROW) && !isAtEnd()) advance();
        }
        consume(TokenType.FAT_ARROW, "Expected '=>' after the pattern.");
        BlockNode body;
        if (check(TokenType.LEFT_BRACE)) {
            body = block();
            match(TokenType.COMMA);
        } else {
            Token start = peek();
            NodeId blockId = newId();
            NodeId stmtId = newId();
            ExprNode expression = expression();
            tailExpressions.add(stmtId);
            body = new BlockNode(blockId, start.span(), List.of(new ExprStmtNode(stmtId, expression.span(), expression)));
            if (!match(TokenType.COMMA) && !check(TokenType.RIGHT_BRACE)) {
                throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, "Expected ',' after the match arm.");
            }
        }
        return new MatchArmNode(id, first.span(), patterns, body);
    }

    private PatternNode pattern() {
        Token token = peek();
        NodeId id = newId();
        if (check(TokenType.IDENTIFIER) && token.text().equals("_")) {
            advance();
            return new WildcardPatternNode(id, token.span());
        }
        if (check(TokenType.INTEGER) || check(TokenType.MINUS)) {
            long low = patternInteger();
            if (check(TokenType.DOT_DOT) || check(TokenType.DOT_DOT_EQ)) {
                boolean inclusive = advance().type() == TokenType.DOT_DOT_EQ;
                long high = patternInteger();
                return new RangePatternNode(id, token.span(), low, high, inclusive);
            }
            return new LiteralPatternNode(id, token.span(), low);
        }
        if (match(TokenType.STRING)) {
            return new LiteralPatternNode(id, token.span(), token.value());
        }
        if (match(TokenType.TRUE) || match(TokenType.FALSE)) {
            return new LiteralPatternNode(id, token.span(), token.type() == TokenType.TRUE);
        }
        String feature = switch (token.type()) {
            case LEFT_PAREN -> "tuple patterns";
            case CHAR -> "char literals";
            case IDENTIFIER -> checkNext(TokenType.LEFT_BRACE) || checkNext(TokenType.LEFT_PAREN) || checkNext(TokenType.DOUBLE_COLON)
                    ? "struct and enum patterns" : "binding patterns";
            default -> null;
        };
        if (feature != null) {
            unsupported(token, feature, "match on literals, ranges or '_'");
            while (!check(TokenType.FAT_ARROW) && !check(TokenType.PIPE) && !isAtEnd()) {
                if (check(TokenType.LEFT_PAREN) || check(TokenType.LEFT_BRACE)) skipBalanced(); else advance();
            }
            return new WildcardPatternNode(id, token.span());
        }
        throw error(token, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected a pattern, found '" + token.text() + "'.");
    }

    private long patternInteger() {
        boolean negative = match(TokenType.MINUS);
        Token number = consume(TokenType.INTEGER, "Expected an integer in the pattern.");
        if (!negative && isMinimumMagnitude(number)) {
            throw error(number, CompilerErrorCode.INVALID_NUMBER, "Integer literal out of range: " + number.text());
        }
        long value = (Long) number.value();
        return negative ? -value : value;
    }

    /**
     * The lexer hands 2^63 over as {@link Long#MIN_VALUE}; it is a valid literal only when negated.
     */
    private static boolean isMinimumMagnitude(Token token) {
        return token.type() == TokenType.INTEGER && Long.valueOf(Long.MIN_VALUE).equals(token.value());
    }

    private ForNode forStatement() {
        Token keyword = consume(TokenType.FOR, "Expected 'for'.");
        NodeId id = newId();
        if (check(TokenType.LEFT_PAREN)) {
            unsupported(peek(), "destructuring patterns");
            throw new ParseException("destructuring for");
        }
        Token variable = consume(TokenType.IDENTIFIER, "Expected a loop variable.");
        consume(TokenType.IN, "Expected 'in' after the loop variable.");
        ExprNode iterable = expression();
        if (check(TokenType.DOT_DOT) || check(TokenType.DOT_DOT_EQ)) {
            Token operator = advance();
            ExprNode end = expression();
            iterable = new RangeExpr(newId(), operator.span(), iterable, end, operator.type() == TokenType.DOT_DOT_EQ);
        }
        BlockNode body = block();
        return new ForNode(id, keyword.span(), variable.text(), iterable, body);
    }

    private WhileNode whileStatement() {
        Token keyword = consume(TokenType.WHILE, "Expected 'while'.");
        NodeId id = newId();
        if (check(TokenType.LET)) {
            unsupported(peek(), "while let");
            throw new ParseException("while let");
        }
        ExprNode condition = expression();
        BlockNode body = block();
        return new WhileNode(id, keyword.span(), condition, body);
    }

    private ReturnNode returnStatement() {
        Token keyword = consume(TokenType.RETURN, "Expected 'return'.");
        NodeId id = newId();
        ExprNode value = null;
        if (!check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE)) {
            value = expression();
        }
        endStatement();
        return new ReturnNode(id, keyword.span(), value);
    }

    private void endStatement() {
        if (match(TokenType.SEMICOLON) || check(TokenType.RIGHT_BRACE)) {
            return;
        }
        throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, "Expected ';', found '" + peek().text() + "'.");
    }

    private void skipLoopLabel() {
        if (check(TokenType.CHAR) || (check(TokenType.IDENTIFIER) && !checkNext(TokenType.LEFT_PAREN))) {
            unsupported(peek(), "loop labels and break values");
            advance();
        }
    }

    /**
     * Turns the tail expression of a value-returning function into a {@link ReturnNode}. Tails of
     * trailing {@code if/else} and {@code match} statements are converted recursively.
     */
    private BlockNode returnTail(BlockNode block) {
        if (block.statements().isEmpty()) {
            return block;
        }
        List<StmtNode> statements = new ArrayList<>(block.statements());
        StmtNode last = statements.get(statements.size() - 1);
        StmtNode replacement = last;
        if (last instanceof ExprStmtNode expr && tailExpressions.contains(expr.id())) {
            replacement = new ReturnNode(expr.id(), expr.span(), expr.expression());
        } else if (last instanceof IfNode ifNode && ifNode.elseBlock() != null) {
            replacement = new IfNode(ifNode.id(), ifNode.span(), ifNode.condition(),
                    returnTail(ifNode.thenBlock()), returnTail(ifNode.elseBlock()));
        } else if (last instanceof MatchNode matchNode) {
            List<MatchArmNode> arms = new ArrayList<>();
            for (MatchArmNode arm : matchNode.arms()) {
                arms.add(new MatchArmNode(arm.id(), arm.span(), arm.patterns(), returnTail(arm.body())));
            }
            replacement = new MatchNode(matchNode.id(), matchNode.span(), matchNode.scrutinee(), arms);
        }
        if (replacement == last) {
            return block;
        }
        statements.set(statements.size() - 1, replacement);
        return new BlockNode(block.id(), block.span(), statements);
    }

    // --- Expressions ---

    private ExprNode expression() {
        Token start = peek();
        if (++expressionDepth > MAX_EXPRESSION_DEPTH) {
            expressionDepth--;
            throw error(start, CompilerErrorCode.NESTING_TOO_DEEP, "Expression is nested deeper than " + MAX_EXPRESSION_DEPTH + " levels.");
        }
        try {
            return or();
        } finally {
            expressionDepth--;
        }
    }

    private ExprNode or() {
        ExprNode expr = and();
        while (check(TokenType.OR_OR)) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), BinaryExpr.Operator.OR, expr, and());
        }
        return expr;
    }

    private ExprNode and() {
        ExprNode expr = comparison();
        while (check(TokenType.AND_AND)) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), BinaryExpr.Operator.AND, expr, comparison());
        }
        return expr;
    }

    private ExprNode comparison() {
        ExprNode expr = bitOr();
        BinaryExpr.Operator op = comparisonOperator(peek().type());
        if (op != null) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), op, expr, bitOr());
            if (comparisonOperator(peek().type()) != null) {
                throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, "Comparison operators cannot be chained; use '&&'.");
            }
        }
        return expr;
    }

    private static BinaryExpr.Operator comparisonOperator(TokenType type) {
        return switch (type) {
            case EQUAL_EQUAL -> BinaryExpr.Operator.EQ;
            case BANG_EQUAL -> BinaryExpr.Operator.NE;
            case LESS -> BinaryExpr.Operator.LT;
            case LESS_EQUAL -> BinaryExpr.Operator.LE;
            case GREATER -> BinaryExpr.Operator.GT;
            case GREATER_EQUAL -> BinaryExpr.Operator.GE;
            default -> null;
        };
    }

    private ExprNode bitOr() {
        ExprNode expr = bitXor();
        while (check(TokenType.PIPE)) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), BinaryExpr.Operator.BIT_OR, expr, bitXor());
        }
        return expr;
    }

    private ExprNode bitXor() {
        ExprNode expr = bitAnd();
        while (check(TokenType.CARET)) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), BinaryExpr.Operator.BIT_XOR, expr, bitAnd());
        }
        return expr;
    }

    private ExprNode bitAnd() {
        ExprNode expr = shift();
        while (check(TokenType.AMPERSAND)) {
            Token operator = advance();
            expr = new BinaryExpr(newId(), operator.span(), BinaryExpr.Operator.BIT_AND, expr, shift());
        }
        return expr;
    }

    private ExprNode shift() {
        ExprNode expr = term();
        while (check(TokenType.SHL) || check(TokenType.SHR)) {
            Token operator = advance();
            BinaryExpr.Operator op = operator.type() == TokenType.SHL ? BinaryExpr.Operator.SHL : BinaryExpr.Operator.SHR;
            expr = new BinaryExpr(newId(), operator.span(), op, expr, term());
        }
        return expr;
    }

    private ExprNode term() {
        ExprNode expr = factor();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            Token operator = advance();
            BinaryExpr.Operator op = operator.type() == TokenType.PLUS ? BinaryExpr.Operator.ADD : BinaryExpr.Operator.SUB;
            expr = new BinaryExpr(newId(), operator.span(), op, expr, factor());
        }
        return expr;
    }

    private ExprNode factor() {
        ExprNode expr = cast();
        while (check(TokenType.STAR) || check(TokenType.SLASH) || check(TokenType.PERCENT)) {
            Token operator = advance();
            BinaryExpr.Operator op = switch (operator.type()) {
                case STAR -> BinaryExpr.Operator.MUL;
                case SLASH -> BinaryExpr.Operator.DIV;
                default -> BinaryExpr.Operator.REM;
            };
            expr = new BinaryExpr(newId(), operator.span(), op, expr, cast());
        }
        return expr;
    }

    private ExprNode cast() {
        ExprNode expr = unary();
        while (check(TokenType.AS)) {
            unsupported(advance(), "'as' casts");
            type();
        }
        return expr;
    }

    private ExprNode unary() {
        Token token = peek();
        if (match(TokenType.BANG) || match(TokenType.MINUS)) {
            UnaryExpr.Operator op = token.type() == TokenType.BANG ? UnaryExpr.Operator.NOT : UnaryExpr.Operator.NEGATE;
            NodeId id = newId();
            if (op == UnaryExpr.Operator.NEGATE && isMinimumMagnitude(peek())) {
                advance();
                return new IntLiteralExpr(id, token.span(), Long.MIN_VALUE);
            }
            ExprNode operand = nested(this::unary);
            if (op == UnaryExpr.Operator.NEGATE && operand instanceof IntLiteralExpr literal) {
                return new IntLiteralExpr(id, token.span(), -literal.value());
            }
            return new UnaryExpr(id, token.span(), op, operand);
        }
        if (match(TokenType.AMPERSAND) || match(TokenType.AND_AND)) {
            match(TokenType.MUT);
            unsupported(token, "references and borrows", "remove the '&'; values are passed by copy");
            return nested(this::unary);
        }
        if (match(TokenType.STAR)) {
            unsupported(token, "dereferencing");
            return nested(this::unary);
        }
        return postfix(primary());
    }

    private ExprNode postfix(ExprNode expr) {
        while (true) {
            Token token = peek();
            if (match(TokenType.LEFT_BRACKET)) {
                NodeId id = newId();
                ExprNode index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after the index.");
                expr = new IndexExpr(id, token.span(), expr, index);
            } else if (match(TokenType.QUESTION)) {
                unsupported(token, "the '?' operator", "handle errors explicitly with if/else");
            } else if (check(TokenType.DOT)) {
                advance();
                Token member = advance();
                if (member.type() == TokenType.AWAIT) {
                    unsupported(member, "async/await");
                } else if (check(TokenType.LEFT_PAREN) || check(TokenType.DOUBLE_COLON)) {
                    unsupported(member, "method calls", methodHint(member.text()));
                    if (match(TokenType.DOUBLE_COLON)) skipGenericArguments();
                    skipBalanced();
                } else {
                    unsupported(member, "field access");
                }
            } else {
                return expr;
            }
        }
    }

    private static String methodHint(String method) {
        return switch (method) {
            case "len" -> "use string_len(s) or array_len(v)";
            case "trim" -> "use string_trim(s)";
            case "to_uppercase" -> "use string_to_upper(s)";
            case "to_lowercase" -> "use string_to_lower(s)";
            case "contains" -> "use string_contains(s, needle)";
            case "starts_with" -> "use string_starts_with(s, prefix)";
            case "ends_with" -> "use string_ends_with(s, suffix)";
            case "join" -> "use array_join(v, separator)";
            case "to_string", "to_owned", "clone", "into" -> "string literals and variables can be used directly";
            default -> null;
        };
    }

    private ExprNode primary() {
        Token token = peek();
        switch (token.type()) {
            case INTEGER:
                advance();
                if (isMinimumMagnitude(token)) {
                    throw error(token, CompilerErrorCode.INVALID_NUMBER, "Integer literal out of range: " + token.text());
                }
                return new IntLiteralExpr(newId(), token.span(), (Long) token.value());
            case STRING:
                advance();
                return new StringLiteralExpr(newId(), token.span(), (String) token.value());
            case TRUE:
            case FALSE:
                advance();
                return new BoolLiteralExpr(newId(), token.span(), token.type() == TokenType.TRUE);
            case IDENTIFIER:
                return identifierExpression();
            case LEFT_PAREN:
                advance();
                if (match(TokenType.RIGHT_PAREN)) {
                    unsupported(token, "unit values");
                    return new BoolLiteralExpr(newId(), token.span(), false);
                }
                ExprNode inner = expression();
                if (check(TokenType.COMMA)) {
                    unsupported(peek(), "tuples");
                    skipUntilClosing(TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN);
                    return inner;
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after the expression.");
                return inner;
            case LEFT_BRACKET:
                advance();
                return new VecMacroExpr(newId(), token.span(), delimitedExpressions(TokenType.RIGHT_BRACKET));
            case CHAR:
                advance();
                unsupported(token, "char literals", "use a one-character string");
                return new StringLiteralExpr(newId(), token.span(), "");
            case PIPE:
            case OR_OR:
            case MOVE:
                unsupported(token, "closures");
                throw new ParseException("closure");
            case IF:
                unsupported(token, "if expressions", "assign the value in both branches of an if statement");
                throw new ParseException("if expression");
            case MATCH:
                unsupported(token, "match expressions", "assign the value in each arm of a match statement");
                throw new ParseException("match expression");
            case LOOP:
            case LEFT_BRACE:
                unsupported(token, "block expressions");
                throw new ParseException("block expression");
            case ASYNC:
            case UNSAFE:
                unsupported(token, token.type() == TokenType.ASYNC ? "async blocks" : "unsafe code");
                throw new ParseException("async/unsafe block");
            default:
                throw error(token, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected an expression, found '" + (token.type() == TokenType.END_OF_FILE ? "end of file" : token.text()) + "'.");
        }
    }

    private ExprNode identifierExpression() {
        Token name = advance();
        if (check(TokenType.BANG) && (checkNext(TokenType.LEFT_PAREN) || checkNext(TokenType.LEFT_BRACKET) || checkNext(TokenType.LEFT_BRACE))) {
            advance();
            return macro(name);
        }
        if (check(TokenType.DOUBLE_COLON)) {
            unsupported(name, "paths and associated functions", "call allow-listed functions such as env() directly");
            while (match(TokenType.DOUBLE_COLON)) {
                if (check(TokenType.LESS)) skipGenericArguments(); else advance();
            }
            if (check(TokenType.LEFT_PAREN)) skipBalanced();
            return new StringLiteralExpr(newId(), name.span(), "");
        }
        if (check(TokenType.LEFT_PAREN)) {
            NodeId id = newId();
            advance();
            List<ExprNode> arguments = delimitedExpressions(TokenType.RIGHT_PAREN);
            return new CallExpr(id, name.span(), name.text(), arguments);
        }
        return new VariableExpr(newId(), name.span(), name.text());
    }

    private List<ExprNode> delimitedExpressions(TokenType closing) {
        List<ExprNode> expressions = new ArrayList<>();
        if (!check(closing)) {
            do {
                if (check(closing)) break;
                expressions.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(closing, "Expected '" + (closing == TokenType.RIGHT_PAREN ? ")" : "]") + "' to close the list.");
        return expressions;
    }

    private ExprNode macro(Token name) {
        String macroName = name.text();
        if (macroName.equals("vec")) {
            Token open = advance();
            if (open.type() != TokenType.LEFT_BRACKET && open.type() != TokenType.LEFT_PAREN) {
                throw error(open, CompilerErrorCode.UNEXPECTED_TOKEN, "Expected '[' after vec!.");
            }
            NodeId id = newId();
            List<ExprNode> elements = delimitedExpressions(open.type() == TokenType.LEFT_BRACKET ? TokenType.RIGHT_BRACKET : TokenType.RIGHT_PAREN);
            return new VecMacroExpr(id, name.span(), elements);
        }
        FormatMacroExpr.Kind kind = switch (macroName) {
            case "format" -> FormatMacroExpr.Kind.FORMAT;
            case "println" -> FormatMacroExpr.Kind.PRINTLN;
            case "eprintln" -> FormatMacroExpr.Kind.EPRINTLN;
            case "print" -> FormatMacroExpr.Kind.PRINT;
            case "eprint" -> FormatMacroExpr.Kind.EPRINT;
            default -> null;
        };
        if (kind == null) {
            diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_MACRO, "Macro '" + macroName + "!' is not supported.", name.span(),
                    "allowed macros are format!, println!, eprintln!, print!, eprint! and vec!");
            skipBalanced();
            return new StringLiteralExpr(newId(), name.span(), "");
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after " + macroName + "!.");
        NodeId id = newId();
        if (match(TokenType.RIGHT_PAREN)) {
            if (kind == FormatMacroExpr.Kind.FORMAT) {
                throw error(name, CompilerErrorCode.INVALID_FORMAT_STRING, "format! requires a format string.");
            }
            return new FormatMacroExpr(id, name.span(), kind, List.of(""), List.of());
        }
        Token formatToken = consume(TokenType.STRING, macroName + "! expects a string literal as its first argument.");
        List<ExprNode> explicitArguments = new ArrayList<>();
        while (match(TokenType.COMMA)) {
            if (check(TokenType.RIGHT_PAREN)) break;
            explicitArguments.add(expression());
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' to close " + macroName + "!.");
        return splitFormatString(id, name, kind, formatToken, explicitArguments);
    }

    private FormatMacroExpr splitFormatString(NodeId id, Token name, FormatMacroExpr.Kind kind, Token formatToken, List<ExprNode> explicitArguments) {
        String format = (String) formatToken.value();
        List<String> pieces = new ArrayList<>();
        List<ExprNode> arguments = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        int nextPositional = 0;
        boolean[] used = new boolean[explicitArguments.size()];
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c == '{' && i + 1 < format.length() && format.charAt(i + 1) == '{') {
                piece.append('{');
                i++;
            } else if (c == '}' && i + 1 < format.length() && format.charAt(i + 1) == '}') {
                piece.append('}');
                i++;
            } else if (c == '{') {
                int close = format.indexOf('}', i);
                if (close < 0) {
                    throw error(formatToken, CompilerErrorCode.INVALID_FORMAT_STRING, "Unclosed '{' in format string.");
                }
                String placeholder = format.substring(i + 1, close);
                ExprNode argument;
                if (placeholder.isEmpty()) {
                    if (nextPositional >= explicitArguments.size()) {
                        throw error(formatToken, CompilerErrorCode.INVALID_FORMAT_STRING,
                                "Format string has more placeholders than arguments.");
                    }
                    used[nextPositional] = true;
                    argument = explicitArguments.get(nextPositional++);
                } else if (placeholder.matches("[0-9]+")) {
                    // more than nine digits cannot name an argument and would overflow an int
                    int index = placeholder.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(placeholder);
                    if (index >= explicitArguments.size()) {
                        throw error(formatToken, CompilerErrorCode.INVALID_FORMAT_STRING,
                                "Format argument index " + placeholder + " is out of range.");
                    }
                    used[index] = true;
                    argument = explicitArguments.get(index);
                } else if (placeholder.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                    argument = new VariableExpr(newId(), formatToken.span(), placeholder);
                } else {
                    throw error(formatToken, CompilerErrorCode.INVALID_FORMAT_STRING,
                            "Format specification '{" + placeholder + "}' is not supported; use '{}'.");
                }
                pieces.add(piece.toString());
                piece.setLength(0);
                arguments.add(argument);
                i = close;
            } else if (c == '}') {
                throw error(formatToken, CompilerErrorCode.INVALID_FORMAT_STRING, "Unmatched '}' in format string; write '}}'.");
            } else {
                piece.append(c);
            }
        }
        pieces.add(piece.toString());
        for (int i = 0; i < used.length; i++) {
            if (!used[i]) {
                throw error(explicitArguments.get(i).span(), CompilerErrorCode.INVALID_FORMAT_STRING,
                        "Argument " + (i + 1) + " of " + kind.macroName() + "! is never used by the format string.");
            }
        }
        return new FormatMacroExpr(id, name.span(), kind, pieces, arguments);
    }

    // --- Error reporting and recovery ---

    private void unsupported(Token token, String feature) {
        unsupported(token, feature, null);
    }

    private void unsupported(Token token, String feature, String fixIt) {
        diagnostics.reportError(CompilerErrorCode.UNSUPPORTED_CONSTRUCT, "Unsupported feature: " + feature + ".", token.span(), fixIt);
    }

    private ParseException error(Token token, CompilerErrorCode code, String message) {
        return error(token.span(), code, message);
    }

    private ParseException error(SourceSpan span, CompilerErrorCode code, String message) {
        diagnostics.reportError(code, message, span);
        return new ParseException(message);
    }

    private boolean isMacroRules() {
        return check(TokenType.IDENTIFIER) && peek().text().equals("macro_rules") && checkNext(TokenType.BANG);
    }

    /**
     * Skips an item or statement: everything up to a top-level ';' or the end of the first
     * balanced brace group.
     */
    private void skipItem() {
        while (!isAtEnd()) {
            if (check(TokenType.LEFT_BRACE)) {
                skipBalanced();
                match(TokenType.SEMICOLON);
                return;
            }
            if (check(TokenType.LEFT_PAREN) || check(TokenType.LEFT_BRACKET)) {
                skipBalanced();
                continue;
            }
            if (match(TokenType.SEMICOLON) || check(TokenType.RIGHT_BRACE)) {
                return;
            }
            advance();
        }
    }

    /** Skips one balanced (), [] or {} group starting at the current token. */
    private void skipBalanced() {
        TokenType open = peek().type();
        TokenType close = switch (open) {
            case LEFT_PAREN -> TokenType.RIGHT_PAREN;
            case LEFT_BRACKET -> TokenType.RIGHT_BRACKET;
            case LEFT_BRACE -> TokenType.RIGHT_BRACE;
            default -> null;
        };
        if (close == null) {
            advance();
            return;
        }
        advance();
        skipUntilClosing(open, close);
    }

    /** Skips to just past the token closing an already opened group. */
    private void skipUntilClosing(TokenType open, TokenType close) {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            Token t = advance();
            if (t.type() == open) depth++;
            else if (t.type() == close) depth--;
        }
    }

    private void synchronizeStatement() {
        int depth = 0;
        while (!isAtEnd()) {
            if (depth == 0 && previousIs(TokenType.SEMICOLON)) return;
            TokenType type = peek().type();
            if (type == TokenType.LEFT_BRACE) {
                depth++;
            } else if (type == TokenType.RIGHT_BRACE) {
                if (depth == 0) return;
                depth--;
                if (depth == 0) {
                    advance();
                    return;
                }
            } else if (depth == 0 && STATEMENT_STARTS.contains(type)) {
                return;
            }
            advance();
        }
    }

    private void synchronizeItem() {
        int depth = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type();
            if (depth == 0 && ITEM_STARTS.contains(type)) return;
            if (type == TokenType.LEFT_BRACE) depth++;
            if (type == TokenType.RIGHT_BRACE && depth > 0) depth--;
            advance();
        }
    }

    // --- Token stream helpers ---

    private ExprNode nested(Supplier<ExprNode> parser) {
        Token start = peek();
        if (++expressionDepth > MAX_EXPRESSION_DEPTH) {
            expressionDepth--;
            throw error(start, CompilerErrorCode.NESTING_TOO_DEEP, "Expression is nested deeper than " + MAX_EXPRESSION_DEPTH + " levels.");
        }
        try {
            return parser.get();
        } finally {
            expressionDepth--;
        }
    }

    private NodeId newId() {
        return new NodeId(nextId++);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        throw error(peek(), CompilerErrorCode.UNEXPECTED_TOKEN, errorMessage);
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        return peekNext().type() == type;
    }

    private boolean previousIs(TokenType type) {
        return current > 0 && tokens.get(current - 1).type() == type;
    }

    private Token advance() {
        if (isAtEnd()) return peek();
        return tokens.get(current++);
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        if (current + 1 >= tokens.size()) return tokens.get(tokens.size() - 1);
        return tokens.get(current + 1);
    }
}
