package com.mqparser.engine;

import com.mqparser.ast.ArrayWrapper;
import com.mqparser.ast.BinOpExpression;
import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.Constant;
import com.mqparser.ast.ConstantKind;
import com.mqparser.ast.Csv;
import com.mqparser.ast.ErrorHandlingExpression;
import com.mqparser.ast.FieldSpecification;
import com.mqparser.ast.FieldSpecificationList;
import com.mqparser.ast.FunctionExpression;
import com.mqparser.ast.FunctionType;
import com.mqparser.ast.GeneralizedIdentifier;
import com.mqparser.ast.Identifier;
import com.mqparser.ast.IdentifierContextKind;
import com.mqparser.ast.IdentifierExpression;
import com.mqparser.ast.IfExpression;
import com.mqparser.ast.KeyValuePair;
import com.mqparser.ast.LetExpression;
import com.mqparser.ast.LiteralExpression;
import com.mqparser.ast.LiteralKind;
import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;
import com.mqparser.ast.NotImplementedExpression;
import com.mqparser.ast.PairedConstant;
import com.mqparser.ast.Parameter;
import com.mqparser.ast.PrimitiveType;
import com.mqparser.ast.PrimitiveTypeKind;
import com.mqparser.ast.RangeExpression;
import com.mqparser.ast.RecordType;
import com.mqparser.ast.RecursivePrimaryExpression;
import com.mqparser.ast.Section;
import com.mqparser.ast.SectionMember;
import com.mqparser.ast.UnaryExpression;
import com.mqparser.ast.Wrapped;
import com.mqparser.error.ExpectedAnyTokenKindException;
import com.mqparser.error.ExpectedClosingTokenKindException;
import com.mqparser.error.ExpectedCsvContinuationException;
import com.mqparser.error.ExpectedGeneralizedIdentifierException;
import com.mqparser.error.ExpectedTokenKindException;
import com.mqparser.error.InvalidCatchFunctionException;
import com.mqparser.error.InvalidPrimitiveTypeException;
import com.mqparser.error.InvariantException;
import com.mqparser.error.ParseException;
import com.mqparser.error.RequiredParameterAfterOptionalParameterException;
import com.mqparser.error.UnterminatedSequenceException;
import com.mqparser.error.UnusedTokensRemainException;
import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;
import com.mqparser.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Recursive descent parser for the M formula language.
 * <p>
 * One read method per grammar production. Each method opens a context in the shared
 * {@link NodeRegistry}, reads its sub-productions in grammar order and promotes the finished node.
 * This parser defines the reference tree shape and error positions; {@link CombinatorialParser}
 * overrides the binary-expression entry points and must agree with it.
 */
public class NaiveParser {
    private static final Logger LOGGER = LoggerFactory.getLogger(NaiveParser.class);

    static final List<BracketDisambiguation> PRIMARY_BRACKET_VARIANTS = List.of(
        BracketDisambiguation.FIELD_PROJECTION,
        BracketDisambiguation.FIELD_SELECTION,
        BracketDisambiguation.RECORD);

    private static final List<BracketDisambiguation> SUFFIX_BRACKET_VARIANTS = List.of(
        BracketDisambiguation.FIELD_PROJECTION,
        BracketDisambiguation.FIELD_SELECTION);

    private static final List<ParenthesisDisambiguation> PARENTHESIS_VARIANTS = List.of(
        ParenthesisDisambiguation.FUNCTION_EXPRESSION,
        ParenthesisDisambiguation.PARENTHESIZED_EXPRESSION);

    private static final List<TokenKind> LITERAL_TOKEN_KINDS = List.of(
        TokenKind.HEX_LITERAL,
        TokenKind.KEYWORD_FALSE,
        TokenKind.KEYWORD_HASH_INFINITY,
        TokenKind.KEYWORD_HASH_NAN,
        TokenKind.KEYWORD_TRUE,
        TokenKind.NUMERIC_LITERAL,
        TokenKind.NULL_LITERAL,
        TokenKind.TEXT_LITERAL);

    private static final List<TokenKind> PRIMITIVE_TYPE_TOKEN_KINDS = List.of(
        TokenKind.IDENTIFIER,
        TokenKind.KEYWORD_TYPE,
        TokenKind.NULL_LITERAL);

    static final Set<TokenKind> HASH_KEYWORD_EXPRESSIONS = EnumSet.of(
        TokenKind.KEYWORD_HASH_SECTIONS,
        TokenKind.KEYWORD_HASH_SHARED,
        TokenKind.KEYWORD_HASH_BINARY,
        TokenKind.KEYWORD_HASH_DATE,
        TokenKind.KEYWORD_HASH_DATE_TIME,
        TokenKind.KEYWORD_HASH_DATE_TIME_ZONE,
        TokenKind.KEYWORD_HASH_DURATION,
        TokenKind.KEYWORD_HASH_TABLE,
        TokenKind.KEYWORD_HASH_TIME);

    private static final Set<TokenKind> GENERALIZED_IDENTIFIER_TERMINATORS = EnumSet.of(
        TokenKind.COMMA,
        TokenKind.EQUAL,
        TokenKind.RIGHT_BRACKET);

    private static final Set<TokenKind> TABLE_ROW_TYPE_STARTS = EnumSet.of(
        TokenKind.LEFT_BRACKET,
        TokenKind.LEFT_PARENTHESIS,
        TokenKind.AT_SIGN,
        TokenKind.IDENTIFIER);

    // Equality, relational, additive and multiplicative levels, loosest first
    private static final List<Integer> OPERATOR_LEVELS = BinOpOperator.precedencesOf(
        NodeKind.EQUALITY_EXPRESSION,
        NodeKind.RELATIONAL_EXPRESSION,
        NodeKind.ARITHMETIC_EXPRESSION);

    private enum Wrapper {
        BRACE(TokenKind.LEFT_BRACE, ConstantKind.LEFT_BRACE, TokenKind.RIGHT_BRACE, ConstantKind.RIGHT_BRACE),
        BRACKET(TokenKind.LEFT_BRACKET, ConstantKind.LEFT_BRACKET, TokenKind.RIGHT_BRACKET, ConstantKind.RIGHT_BRACKET),
        PARENTHESIS(TokenKind.LEFT_PARENTHESIS, ConstantKind.LEFT_PARENTHESIS,
            TokenKind.RIGHT_PARENTHESIS, ConstantKind.RIGHT_PARENTHESIS);

        final TokenKind open;
        final ConstantKind openConstant;
        final TokenKind close;
        final ConstantKind closeConstant;

        Wrapper(TokenKind open, ConstantKind openConstant, TokenKind close, ConstantKind closeConstant) {
            this.open = open;
            this.openConstant = openConstant;
            this.close = close;
            this.closeConstant = closeConstant;
        }
    }

    protected final ParseState state;

    public NaiveParser(ParseState state) {
        this.state = state;
    }

    public ParseState state() {
        return state;
    }

    // ========================================================================
    // Documents
    // ========================================================================

    /**
     * Reads either an expression document or a section document, whichever parses.
     * When both fail, the error of the attempt that got further wins; ties go to the section document.
     */
    public Node readDocument() {
        state.checkCancellation();
        Checkpoint start = state.checkpoint();

        int expressionReached;
        try {
            Node expression = readExpression();
            expectNoMoreTokens();
            return expression;
        } catch (ParseException expressionError) {
            expressionReached = expressionError.getTokenIndex();
            LOGGER.debug("Expression document failed at token {} ({}), trying a section document",
                expressionReached, expressionError.getMessage());
        }

        state.restore(start);
        try {
            Section section = readSectionDocument();
            expectNoMoreTokens();
            return section;
        } catch (ParseException sectionError) {
            if (expressionReached <= sectionError.getTokenIndex()) {
                throw sectionError;
            }
            LOGGER.debug("Section document failed at token {}, replaying the expression document",
                sectionError.getTokenIndex());
        }

        state.restore(start);
        readExpression();
        expectNoMoreTokens();
        throw new InvariantException("Replayed expression document parsed without the original error");
    }

    public void expectNoMoreTokens() {
        if (!state.isAtEnd()) {
            throw new UnusedTokensRemainException(state.currentToken(), state.tokenIndex(), state.currentPosition());
        }
    }

    public Section readSectionDocument() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.SECTION);

        Wrapped literalAttributes = maybeReadLiteralAttributes();
        Constant sectionConstant = readTokenKindAsConstant(TokenKind.KEYWORD_SECTION, ConstantKind.SECTION);
        Identifier name = state.isOn(TokenKind.IDENTIFIER) ? readIdentifier(IdentifierContextKind.KEY) : skipAttribute();
        Constant semicolonConstant = readTokenKindAsConstant(TokenKind.SEMICOLON, ConstantKind.SEMICOLON);
        ArrayWrapper sectionMembers = readSectionMembers();

        return state.endContext(new Section(id, state.tokenRange(id), literalAttributes, sectionConstant, name,
            semicolonConstant, sectionMembers));
    }

    protected ArrayWrapper readSectionMembers() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.ARRAY_WRAPPER);
        List<Node> members = new ArrayList<>();
        while (!state.isAtEnd()) {
            members.add(readSectionMember());
        }
        return state.endContext(new ArrayWrapper(id, state.tokenRange(id), members));
    }

    protected SectionMember readSectionMember() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.SECTION_MEMBER);

        Wrapped literalAttributes = maybeReadLiteralAttributes();
        Constant sharedConstant = maybeReadTokenKindAsConstant(TokenKind.KEYWORD_SHARED, ConstantKind.SHARED);
        KeyValuePair namePairedExpression = readIdentifierPairedExpression();
        Constant semicolonConstant = readTokenKindAsConstant(TokenKind.SEMICOLON, ConstantKind.SEMICOLON);

        return state.endContext(new SectionMember(id, state.tokenRange(id), literalAttributes, sharedConstant,
            namePairedExpression, semicolonConstant));
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public Node readExpression() {
        state.checkCancellation();
        TokenKind kind = state.currentTokenKind();
        if (kind == null) {
            return readNullCoalescing();
        }
        return switch (kind) {
            case KEYWORD_EACH -> readEachExpression();
            case KEYWORD_LET -> readLetExpression();
            case KEYWORD_IF -> readIfExpression();
            case KEYWORD_ERROR -> readErrorRaisingExpression();
            case KEYWORD_TRY -> readErrorHandlingExpression();
            case LEFT_PARENTHESIS -> readAmbiguousParenthesis();
            default -> readNullCoalescing();
        };
    }

    // a ?? b ?? c nests to the right
    protected Node readNullCoalescing() {
        state.checkCancellation();
        Node left = readLogical();
        if (!state.isOn(TokenKind.NULL_COALESCING_OPERATOR)) {
            return left;
        }

        int id = state.startContextAsParent(NodeKind.NULL_COALESCING_EXPRESSION, left.id());
        Constant operatorConstant = readTokenKindAsConstant(TokenKind.NULL_COALESCING_OPERATOR,
            ConstantKind.NULL_COALESCING);
        Node right = readNullCoalescing();
        return state.endContext(new BinOpExpression(id, NodeKind.NULL_COALESCING_EXPRESSION, state.tokenRange(id),
            left, operatorConstant, right));
    }

    protected Node readLogical() {
        return readLeftAssociative(operator -> operator == BinOpOperator.OR, this::readLogicalAnd, this::readLogicalAnd);
    }

    private Node readLogicalAnd() {
        return readLeftAssociative(operator -> operator == BinOpOperator.AND, this::readIs, this::readIs);
    }

    protected Node readIs() {
        return readLeftAssociative(operator -> operator == BinOpOperator.IS, this::readAs,
            this::readNullablePrimitiveType);
    }

    protected Node readAs() {
        return readLeftAssociative(operator -> operator == BinOpOperator.AS, this::readEquality,
            this::readNullablePrimitiveType);
    }

    protected Node readEquality() {
        return readOperatorLevel(BinOpOperator.EQUAL_TO.precedence());
    }

    protected Node readRelational() {
        return readOperatorLevel(BinOpOperator.LESS_THAN.precedence());
    }

    protected Node readArithmetic() {
        return readOperatorLevel(BinOpOperator.ADDITION.precedence());
    }

    private Node readOperatorLevel(int precedence) {
        int level = OPERATOR_LEVELS.indexOf(precedence);
        Supplier<Node> operandReader = level + 1 < OPERATOR_LEVELS.size()
            ? () -> readOperatorLevel(OPERATOR_LEVELS.get(level + 1))
            : this::readMetadata;
        return readLeftAssociative(operator -> operator.precedence() == precedence, operandReader, operandReader);
    }

    /**
     * Reads {@code left (op right)*} for the accepted operators, folding to the left.
     */
    private Node readLeftAssociative(Predicate<BinOpOperator> accepts, Supplier<Node> leftReader,
                                     Supplier<Node> rightReader) {
        state.checkCancellation();
        Node left = leftReader.get();

        BinOpOperator operator = BinOpOperator.fromTokenKind(state.currentTokenKind());
        while (operator != null && accepts.test(operator)) {
            NodeKind kind = operator.nodeKind();
            int id = state.startContextAsParent(kind, left.id());
            Constant operatorConstant = readTokenKindAsConstant(operator.tokenKind(), operator.constantKind());
            Node right = rightReader.get();
            left = state.endContext(new BinOpExpression(id, kind, state.tokenRange(id), left, operatorConstant, right));
            operator = BinOpOperator.fromTokenKind(state.currentTokenKind());
        }
        return left;
    }

    // A single meta: a meta b meta c leaves the second meta unread
    protected Node readMetadata() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.METADATA_EXPRESSION);

        Node left = readUnary();
        if (!state.isOn(TokenKind.KEYWORD_META)) {
            state.deleteContext(id);
            return left;
        }
        Constant metaConstant = readTokenKindAsConstant(TokenKind.KEYWORD_META, ConstantKind.META);
        Node right = readUnary();
        return state.endContext(new BinOpExpression(id, NodeKind.METADATA_EXPRESSION, state.tokenRange(id), left,
            metaConstant, right));
    }

    protected Node readUnary() {
        state.checkCancellation();
        ConstantKind operator = unaryOperator(state.currentTokenKind());
        if (operator == null) {
            return readTypeExpression();
        }

        int id = state.startContext(NodeKind.UNARY_EXPRESSION);
        int operatorsId = state.startContext(NodeKind.ARRAY_WRAPPER);
        List<Node> operatorConstants = new ArrayList<>();
        while (operator != null) {
            operatorConstants.add(readTokenKindAsConstant(state.currentTokenKind(), operator));
            operator = unaryOperator(state.currentTokenKind());
        }
        ArrayWrapper operators = state.endContext(new ArrayWrapper(operatorsId, state.tokenRange(operatorsId),
            operatorConstants));

        Node typeExpression = readTypeExpression();
        return state.endContext(new UnaryExpression(id, state.tokenRange(id), operators, typeExpression));
    }

    private static ConstantKind unaryOperator(TokenKind kind) {
        if (kind == null) {
            return null;
        }
        return switch (kind) {
            case PLUS -> ConstantKind.POSITIVE;
            case MINUS -> ConstantKind.NEGATIVE;
            case KEYWORD_NOT -> ConstantKind.NOT;
            default -> null;
        };
    }

    protected Node readTypeExpression() {
        state.checkCancellation();
        if (state.isOn(TokenKind.KEYWORD_TYPE)) {
            return readPairedConstant(NodeKind.TYPE_PRIMARY_TYPE,
                () -> readTokenKindAsConstant(TokenKind.KEYWORD_TYPE, ConstantKind.TYPE),
                this::readPrimaryType);
        }
        return readPrimaryExpression();
    }

    // ========================================================================
    // Primary expressions
    // ========================================================================

    protected Node readPrimaryExpression() {
        state.checkCancellation();
        TokenKind kind = state.currentTokenKind();
        Node head;
        if (kind == null) {
            head = readLiteralExpression();
        } else if (HASH_KEYWORD_EXPRESSIONS.contains(kind)) {
            head = readKeyword();
        } else {
            head = switch (kind) {
                case AT_SIGN, IDENTIFIER -> readIdentifierExpression();
                case LEFT_PARENTHESIS -> readParenthesizedExpression();
                case LEFT_BRACKET -> readBracketDisambiguation(PRIMARY_BRACKET_VARIANTS);
                case LEFT_BRACE -> readListExpression();
                case ELLIPSIS -> readNotImplementedExpression();
                default -> readLiteralExpression();
            };
        }
        return readRecursiveSuffixes(head);
    }

    /**
     * Wraps {@code head} in a recursive primary expression when an invoke, item access or field
     * access follows it.
     */
    protected Node readRecursiveSuffixes(Node head) {
        if (isRecursivePrimaryExpressionNext()) {
            return readRecursivePrimaryExpression(head);
        }
        return head;
    }

    protected boolean isRecursivePrimaryExpressionNext() {
        return state.isOn(TokenKind.LEFT_PARENTHESIS)
            || state.isOn(TokenKind.LEFT_BRACE)
            || state.isOn(TokenKind.LEFT_BRACKET);
    }

    protected RecursivePrimaryExpression readRecursivePrimaryExpression(Node head) {
        state.checkCancellation();
        int id = state.startContextAsParent(NodeKind.RECURSIVE_PRIMARY_EXPRESSION, head.id());

        int suffixesId = state.startContext(NodeKind.ARRAY_WRAPPER);
        List<Node> suffixes = new ArrayList<>();
        while (true) {
            if (state.isOn(TokenKind.LEFT_PARENTHESIS)) {
                suffixes.add(readInvokeExpression());
            } else if (state.isOn(TokenKind.LEFT_BRACE)) {
                suffixes.add(readItemAccessExpression());
            } else if (state.isOn(TokenKind.LEFT_BRACKET)) {
                suffixes.add(readBracketDisambiguation(SUFFIX_BRACKET_VARIANTS));
            } else {
                break;
            }
        }
        ArrayWrapper recursiveExpressions = state.endContext(new ArrayWrapper(suffixesId,
            state.tokenRange(suffixesId), suffixes));

        return state.endContext(new RecursivePrimaryExpression(id, state.tokenRange(id), head, recursiveExpressions));
    }

    protected LiteralExpression readLiteralExpression() {
        state.checkCancellation();
        LiteralKind literalKind = literalKind(state.currentTokenKind());
        if (literalKind == null) {
            throw new ExpectedAnyTokenKindException(LITERAL_TOKEN_KINDS, state.currentToken(), state.tokenIndex(),
                state.currentPosition());
        }

        int id = state.startContext(NodeKind.LITERAL_EXPRESSION);
        String literal = state.advance().data();
        return state.endContext(new LiteralExpression(id, state.tokenRange(id), literal, literalKind));
    }

    private static LiteralKind literalKind(TokenKind kind) {
        if (kind == null) {
            return null;
        }
        return switch (kind) {
            case HEX_LITERAL, NUMERIC_LITERAL, KEYWORD_HASH_INFINITY, KEYWORD_HASH_NAN -> LiteralKind.NUMERIC;
            case KEYWORD_TRUE, KEYWORD_FALSE -> LiteralKind.LOGICAL;
            case NULL_LITERAL -> LiteralKind.NULL;
            case TEXT_LITERAL -> LiteralKind.TEXT;
            default -> null;
        };
    }

    protected IdentifierExpression readIdentifierExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.IDENTIFIER_EXPRESSION);

        Constant inclusiveConstant = maybeReadTokenKindAsConstant(TokenKind.AT_SIGN, ConstantKind.AT_SIGN);
        Identifier identifier = readIdentifier(IdentifierContextKind.VALUE);

        return state.endContext(new IdentifierExpression(id, state.tokenRange(id), inclusiveConstant, identifier));
    }

    /**
     * {@code #sections}, {@code #date} and friends, read as an identifier expression.
     */
    protected IdentifierExpression readKeyword() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.IDENTIFIER_EXPRESSION);
        // Keywords never take the @ prefix
        state.incrementAttributeCounter();

        int identifierId = state.startContext(NodeKind.IDENTIFIER);
        String literal = state.advance().data();
        Identifier identifier = state.endContext(new Identifier(identifierId, state.tokenRange(identifierId),
            IdentifierContextKind.KEYWORD, literal));

        return state.endContext(new IdentifierExpression(id, state.tokenRange(id), null, identifier));
    }

    protected Identifier readIdentifier(IdentifierContextKind contextKind) {
        state.checkCancellation();
        expectTokenKind(TokenKind.IDENTIFIER);
        int id = state.startContext(NodeKind.IDENTIFIER);
        String literal = state.advance().data();
        return state.endContext(new Identifier(id, state.tokenRange(id), contextKind, literal));
    }

    /**
     * Field names may span several tokens ({@code [Date Time = 1]}); the literal is the covered source text.
     */
    protected GeneralizedIdentifier readGeneralizedIdentifier() {
        state.checkCancellation();
        int tokenIndexStart = state.tokenIndex();
        if (!isOnGeneralizedIdentifierPart()) {
            throw new ExpectedGeneralizedIdentifierException(state.currentToken(), tokenIndexStart,
                state.currentPosition());
        }

        int id = state.startContext(NodeKind.GENERALIZED_IDENTIFIER);
        while (isOnGeneralizedIdentifierPart()) {
            state.advance();
        }
        String literal = state.lexerSnapshot().slice(tokenIndexStart, state.tokenIndex() - 1);
        return state.endContext(new GeneralizedIdentifier(id, state.tokenRange(id), literal));
    }

    private boolean isOnGeneralizedIdentifierPart() {
        TokenKind kind = state.currentTokenKind();
        return kind != null && !GENERALIZED_IDENTIFIER_TERMINATORS.contains(kind);
    }

    protected Wrapped readParenthesizedExpression() {
        return readWrapped(NodeKind.PARENTHESIZED_EXPRESSION, Wrapper.PARENTHESIS, this::readExpression, false);
    }

    protected NotImplementedExpression readNotImplementedExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.NOT_IMPLEMENTED_EXPRESSION);
        Constant ellipsisConstant = readTokenKindAsConstant(TokenKind.ELLIPSIS, ConstantKind.ELLIPSIS);
        return state.endContext(new NotImplementedExpression(id, state.tokenRange(id), ellipsisConstant));
    }

    protected Wrapped readInvokeExpression() {
        return readWrapped(NodeKind.INVOKE_EXPRESSION, Wrapper.PARENTHESIS,
            () -> readCsvArray(this::readExpression, !state.isOn(TokenKind.RIGHT_PARENTHESIS),
                danglingCommaCheck(TokenKind.RIGHT_PARENTHESIS)),
            false);
    }

    protected Wrapped readListExpression() {
        return readWrapped(NodeKind.LIST_EXPRESSION, Wrapper.BRACE,
            () -> readCsvArray(this::readListItem, !state.isOn(TokenKind.RIGHT_BRACE),
                danglingCommaCheck(TokenKind.RIGHT_BRACE)),
            false);
    }

    protected Node readListItem() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.RANGE_EXPRESSION);

        Node left = readExpression();
        if (!state.isOn(TokenKind.DOT_DOT)) {
            state.deleteContext(id);
            return left;
        }
        Constant rangeConstant = readTokenKindAsConstant(TokenKind.DOT_DOT, ConstantKind.DOT_DOT);
        Node right = readExpression();
        return state.endContext(new RangeExpression(id, state.tokenRange(id), left, rangeConstant, right));
    }

    protected Wrapped readRecordExpression() {
        return readWrapped(NodeKind.RECORD_EXPRESSION, Wrapper.BRACKET,
            () -> readCsvArray(
                () -> readKeyValuePair(NodeKind.GENERALIZED_IDENTIFIER_PAIRED_EXPRESSION,
                    this::readGeneralizedIdentifier, this::readExpression),
                !state.isOn(TokenKind.RIGHT_BRACKET),
                danglingCommaCheck(TokenKind.RIGHT_BRACKET)),
            false);
    }

    protected Wrapped readItemAccessExpression() {
        return readWrapped(NodeKind.ITEM_ACCESS_EXPRESSION, Wrapper.BRACE, this::readExpression, true);
    }

    protected Wrapped readFieldSelection() {
        return readFieldSelector(true);
    }

    protected Wrapped readFieldSelector(boolean allowOptional) {
        return readWrapped(NodeKind.FIELD_SELECTOR, Wrapper.BRACKET, this::readGeneralizedIdentifier, allowOptional);
    }

    protected Wrapped readFieldProjection() {
        return readWrapped(NodeKind.FIELD_PROJECTION, Wrapper.BRACKET,
            () -> readCsvArray(() -> readFieldSelector(false), true, danglingCommaCheck(TokenKind.RIGHT_BRACKET)),
            true);
    }

    // ========================================================================
    // Function, each, let, if, error
    // ========================================================================

    protected FunctionExpression readFunctionExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.FUNCTION_EXPRESSION);

        Wrapped parameters = readParameterList(this::maybeReadAsNullablePrimitiveType);
        PairedConstant functionReturnType = maybeReadAsNullablePrimitiveType();
        Constant fatArrowConstant = readTokenKindAsConstant(TokenKind.FAT_ARROW, ConstantKind.FAT_ARROW);
        Node expression = readExpression();

        return state.endContext(new FunctionExpression(id, state.tokenRange(id), parameters, functionReturnType,
            fatArrowConstant, expression));
    }

    private PairedConstant maybeReadAsNullablePrimitiveType() {
        return maybeReadPairedConstant(NodeKind.AS_NULLABLE_PRIMITIVE_TYPE, state.isOn(TokenKind.KEYWORD_AS),
            () -> readTokenKindAsConstant(TokenKind.KEYWORD_AS, ConstantKind.AS),
            this::readNullablePrimitiveType);
    }

    protected PairedConstant readAsType() {
        return readPairedConstant(NodeKind.AS_TYPE,
            () -> readTokenKindAsConstant(TokenKind.KEYWORD_AS, ConstantKind.AS),
            this::readType);
    }

    /**
     * {@code (a, optional b as number)}. Once an optional parameter is seen every later one must be optional.
     */
    protected Wrapped readParameterList(Supplier<PairedConstant> typeReader) {
        state.checkCancellation();
        int id = state.startContext(NodeKind.PARAMETER_LIST);
        Constant openConstant = readTokenKindAsConstant(TokenKind.LEFT_PARENTHESIS, ConstantKind.LEFT_PARENTHESIS);

        int arrayId = state.startContext(NodeKind.ARRAY_WRAPPER);
        List<Node> parameters = new ArrayList<>();
        boolean continueReading = !state.isOn(TokenKind.RIGHT_PARENTHESIS);
        boolean reachedOptional = false;
        while (continueReading) {
            int csvId = state.startContext(NodeKind.CSV);
            if (!parameters.isEmpty()) {
                danglingCommaCheck(TokenKind.RIGHT_PARENTHESIS).run();
            }

            int parameterId = state.startContext(NodeKind.PARAMETER);
            boolean isOptional = isOnContextualIdentifier(ConstantKind.OPTIONAL)
                && state.tokenKindAt(state.tokenIndex() + 1) == TokenKind.IDENTIFIER;
            Constant optionalConstant = isOptional
                ? readContextualConstant(ConstantKind.OPTIONAL)
                : skipAttribute();
            if (optionalConstant != null) {
                reachedOptional = true;
            } else if (reachedOptional) {
                throw new RequiredParameterAfterOptionalParameterException(state.currentToken(), state.tokenIndex(),
                    state.currentPosition());
            }
            Identifier name = readIdentifier(IdentifierContextKind.PARAMETER);
            PairedConstant parameterType = typeReader.get();
            Parameter parameter = state.endContext(new Parameter(parameterId, state.tokenRange(parameterId),
                optionalConstant, name, parameterType));

            Constant commaConstant = maybeReadTokenKindAsConstant(TokenKind.COMMA, ConstantKind.COMMA);
            continueReading = commaConstant != null;
            parameters.add(state.endContext(new Csv(csvId, state.tokenRange(csvId), parameter, commaConstant)));
        }
        ArrayWrapper content = state.endContext(new ArrayWrapper(arrayId, state.tokenRange(arrayId), parameters));

        Constant closeConstant = readClosingConstant(TokenKind.RIGHT_PARENTHESIS, ConstantKind.RIGHT_PARENTHESIS);
        return state.endContext(new Wrapped(id, NodeKind.PARAMETER_LIST, state.tokenRange(id), openConstant, content,
            closeConstant, null));
    }

    protected PairedConstant readEachExpression() {
        return readPairedConstant(NodeKind.EACH_EXPRESSION,
            () -> readTokenKindAsConstant(TokenKind.KEYWORD_EACH, ConstantKind.EACH),
            this::readExpression);
    }

    protected LetExpression readLetExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.LET_EXPRESSION);

        Constant letConstant = readTokenKindAsConstant(TokenKind.KEYWORD_LET, ConstantKind.LET);
        ArrayWrapper variableList = readCsvArray(this::readIdentifierPairedExpression, true,
            this::letContinuationCheck);
        Constant inConstant = readTokenKindAsConstant(TokenKind.KEYWORD_IN, ConstantKind.IN);
        Node expression = readExpression();

        return state.endContext(new LetExpression(id, state.tokenRange(id), letConstant, variableList, inConstant,
            expression));
    }

    private void letContinuationCheck() {
        if (state.isOn(TokenKind.KEYWORD_IN)) {
            throw new ExpectedCsvContinuationException(ExpectedCsvContinuationException.Kind.LET_EXPRESSION,
                state.currentToken(), state.tokenIndex(), state.currentPosition());
        }
    }

    protected IfExpression readIfExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.IF_EXPRESSION);

        Constant ifConstant = readTokenKindAsConstant(TokenKind.KEYWORD_IF, ConstantKind.IF);
        Node condition = readExpression();
        Constant thenConstant = readTokenKindAsConstant(TokenKind.KEYWORD_THEN, ConstantKind.THEN);
        Node trueExpression = readExpression();
        Constant elseConstant = readTokenKindAsConstant(TokenKind.KEYWORD_ELSE, ConstantKind.ELSE);
        Node falseExpression = readExpression();

        return state.endContext(new IfExpression(id, state.tokenRange(id), ifConstant, condition, thenConstant,
            trueExpression, elseConstant, falseExpression));
    }

    protected PairedConstant readErrorRaisingExpression() {
        return readPairedConstant(NodeKind.ERROR_RAISING_EXPRESSION,
            () -> readTokenKindAsConstant(TokenKind.KEYWORD_ERROR, ConstantKind.ERROR),
            this::readExpression);
    }

    protected ErrorHandlingExpression readErrorHandlingExpression() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.ERROR_HANDLING_EXPRESSION);

        Constant tryConstant = readTokenKindAsConstant(TokenKind.KEYWORD_TRY, ConstantKind.TRY);
        Node protectedExpression = readExpression();

        PairedConstant handler;
        if (state.isOn(TokenKind.KEYWORD_OTHERWISE)) {
            handler = readPairedConstant(NodeKind.OTHERWISE_EXPRESSION,
                () -> readTokenKindAsConstant(TokenKind.KEYWORD_OTHERWISE, ConstantKind.OTHERWISE),
                this::readExpression);
        } else if (isOnContextualIdentifier(ConstantKind.CATCH)) {
            handler = readPairedConstant(NodeKind.CATCH_EXPRESSION,
                () -> readContextualConstant(ConstantKind.CATCH),
                this::readCatchFunction);
        } else {
            handler = skipAttribute();
        }

        return state.endContext(new ErrorHandlingExpression(id, state.tokenRange(id), tryConstant,
            protectedExpression, handler));
    }

    // catch (e) => ...: at most one untyped parameter and no return type
    private FunctionExpression readCatchFunction() {
        Token functionStart = state.currentToken();
        int tokenIndexStart = state.tokenIndex();
        Position positionStart = state.currentPosition();

        FunctionExpression function = readFunctionExpression();
        List<Node> parameters = function.parameters().content().children();
        boolean valid = parameters.size() <= 1 && function.functionReturnType() == null;
        for (Node csv : parameters) {
            Parameter parameter = (Parameter) ((Csv) csv).node();
            valid &= parameter.parameterType() == null;
        }
        if (!valid) {
            throw new InvalidCatchFunctionException(functionStart, tokenIndexStart, positionStart);
        }
        return function;
    }

    // ========================================================================
    // Types
    // ========================================================================

    protected Node readNullablePrimitiveType() {
        state.checkCancellation();
        if (isOnContextualIdentifier(ConstantKind.NULLABLE)) {
            return readPairedConstant(NodeKind.NULLABLE_PRIMITIVE_TYPE,
                () -> readContextualConstant(ConstantKind.NULLABLE),
                this::readPrimitiveType);
        }
        return readPrimitiveType();
    }

    protected PrimitiveType readPrimitiveType() {
        state.checkCancellation();
        Token token = state.currentToken();
        PrimitiveTypeKind primitiveTypeKind;
        if (state.isOn(TokenKind.IDENTIFIER)) {
            primitiveTypeKind = PrimitiveTypeKind.fromText(token.data());
            if (primitiveTypeKind == null) {
                throw new InvalidPrimitiveTypeException(token, state.tokenIndex(), state.currentPosition());
            }
        } else if (state.isOn(TokenKind.KEYWORD_TYPE)) {
            primitiveTypeKind = PrimitiveTypeKind.TYPE;
        } else if (state.isOn(TokenKind.NULL_LITERAL)) {
            primitiveTypeKind = PrimitiveTypeKind.NULL;
        } else {
            throw new ExpectedAnyTokenKindException(PRIMITIVE_TYPE_TOKEN_KINDS, token, state.tokenIndex(),
                state.currentPosition());
        }

        int id = state.startContext(NodeKind.PRIMITIVE_TYPE);
        state.advance();
        return state.endContext(new PrimitiveType(id, state.tokenRange(id), primitiveTypeKind));
    }

    protected Node readPrimaryType() {
        state.checkCancellation();
        Node structured = maybeReadStructuredType();
        return structured != null ? structured : readPrimitiveType();
    }

    /**
     * A primary type if one starts here, otherwise a primary expression.
     */
    protected Node readType() {
        state.checkCancellation();
        Node structured = maybeReadStructuredType();
        if (structured != null) {
            return structured;
        }

        Checkpoint checkpoint = state.checkpoint();
        try {
            return readPrimitiveType();
        } catch (ParseException e) {
            LOGGER.debug("Not a primitive type at token {}, reading a primary expression", checkpoint.tokenIndex());
            state.restore(checkpoint);
            return readPrimaryExpression();
        }
    }

    private Node maybeReadStructuredType() {
        if (state.isOn(TokenKind.LEFT_BRACKET)) {
            return readRecordType();
        } else if (state.isOn(TokenKind.LEFT_BRACE)) {
            return readListType();
        } else if (isOnContextualIdentifier(ConstantKind.TABLE)
            && TABLE_ROW_TYPE_STARTS.contains(state.tokenKindAt(state.tokenIndex() + 1))) {
            return readTableType();
        } else if (isOnContextualIdentifier(ConstantKind.FUNCTION)
            && state.tokenKindAt(state.tokenIndex() + 1) == TokenKind.LEFT_PARENTHESIS) {
            return readFunctionType();
        } else if (isOnContextualIdentifier(ConstantKind.NULLABLE)) {
            return readNullableType();
        }
        return null;
    }

    protected RecordType readRecordType() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.RECORD_TYPE);
        FieldSpecificationList fields = readFieldSpecificationList(true);
        return state.endContext(new RecordType(id, state.tokenRange(id), fields));
    }

    protected PairedConstant readTableType() {
        return readPairedConstant(NodeKind.TABLE_TYPE,
            () -> readContextualConstant(ConstantKind.TABLE),
            () -> state.isOn(TokenKind.AT_SIGN) || state.isOn(TokenKind.IDENTIFIER)
                || state.isOn(TokenKind.LEFT_PARENTHESIS)
                ? readPrimaryExpression()
                : readFieldSpecificationList(false));
    }

    /**
     * {@code [a = number, optional b, ...]}. The trailing open marker is only allowed for record types.
     */
    protected FieldSpecificationList readFieldSpecificationList(boolean allowOpenMarker) {
        state.checkCancellation();
        int id = state.startContext(NodeKind.FIELD_SPECIFICATION_LIST);
        Constant openConstant = readTokenKindAsConstant(TokenKind.LEFT_BRACKET, ConstantKind.LEFT_BRACKET);

        int arrayId = state.startContext(NodeKind.ARRAY_WRAPPER);
        List<Node> fields = new ArrayList<>();
        boolean continueReading = !state.isOn(TokenKind.RIGHT_BRACKET);
        while (continueReading) {
            if (allowOpenMarker && state.isOn(TokenKind.ELLIPSIS)) {
                break;
            }
            if (!fields.isEmpty()) {
                danglingCommaCheck(TokenKind.RIGHT_BRACKET).run();
            }
            if (!isOnFieldNameStart()) {
                throw fieldSpecificationError(allowOpenMarker);
            }

            int csvId = state.startContext(NodeKind.CSV);
            FieldSpecification field = readFieldSpecification();
            Constant commaConstant = maybeReadTokenKindAsConstant(TokenKind.COMMA, ConstantKind.COMMA);
            continueReading = commaConstant != null;
            fields.add(state.endContext(new Csv(csvId, state.tokenRange(csvId), field, commaConstant)));
        }
        ArrayWrapper content = state.endContext(new ArrayWrapper(arrayId, state.tokenRange(arrayId), fields));

        Constant openRecordMarkerConstant = allowOpenMarker
            ? maybeReadTokenKindAsConstant(TokenKind.ELLIPSIS, ConstantKind.ELLIPSIS)
            : skipAttribute();
        Constant closeConstant = readClosingConstant(TokenKind.RIGHT_BRACKET, ConstantKind.RIGHT_BRACKET);

        return state.endContext(new FieldSpecificationList(id, state.tokenRange(id), openConstant, content,
            openRecordMarkerConstant, closeConstant));
    }

    private FieldSpecification readFieldSpecification() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.FIELD_SPECIFICATION);

        boolean isOptional = isOnContextualIdentifier(ConstantKind.OPTIONAL)
            && isOnFieldNameStart(state.tokenIndex() + 1);
        Constant optionalConstant = isOptional ? readContextualConstant(ConstantKind.OPTIONAL) : skipAttribute();
        GeneralizedIdentifier name = readGeneralizedIdentifier();
        PairedConstant fieldTypeSpecification = maybeReadPairedConstant(NodeKind.FIELD_TYPE_SPECIFICATION,
            state.isOn(TokenKind.EQUAL),
            () -> readTokenKindAsConstant(TokenKind.EQUAL, ConstantKind.EQUAL),
            this::readType);

        return state.endContext(new FieldSpecification(id, state.tokenRange(id), optionalConstant, name,
            fieldTypeSpecification));
    }

    private boolean isOnFieldNameStart() {
        return isOnFieldNameStart(state.tokenIndex());
    }

    private boolean isOnFieldNameStart(int tokenIndex) {
        TokenKind kind = state.tokenKindAt(tokenIndex);
        return kind != null && (kind == TokenKind.IDENTIFIER || kind.isKeyword());
    }

    private ParseException fieldSpecificationError(boolean allowOpenMarker) {
        if (allowOpenMarker) {
            return new ExpectedAnyTokenKindException(List.of(TokenKind.IDENTIFIER, TokenKind.ELLIPSIS),
                state.currentToken(), state.tokenIndex(), state.currentPosition());
        }
        return new ExpectedTokenKindException(TokenKind.IDENTIFIER, state.currentToken(), state.tokenIndex(),
            state.currentPosition());
    }

    protected Wrapped readListType() {
        return readWrapped(NodeKind.LIST_TYPE, Wrapper.BRACE, this::readType, false);
    }

    protected FunctionType readFunctionType() {
        state.checkCancellation();
        int id = state.startContext(NodeKind.FUNCTION_TYPE);

        Constant functionConstant = readContextualConstant(ConstantKind.FUNCTION);
        Wrapped parameters = readParameterList(this::readAsType);
        PairedConstant functionReturnType = readAsType();

        return state.endContext(new FunctionType(id, state.tokenRange(id), functionConstant, parameters,
            functionReturnType));
    }

    protected PairedConstant readNullableType() {
        return readPairedConstant(NodeKind.NULLABLE_TYPE,
            () -> readContextualConstant(ConstantKind.NULLABLE),
            this::readType);
    }

    // ========================================================================
    // Literal attributes
    // ========================================================================

    protected Wrapped readRecordLiteral() {
        return readWrapped(NodeKind.RECORD_LITERAL, Wrapper.BRACKET,
            () -> readCsvArray(
                () -> readKeyValuePair(NodeKind.GENERALIZED_IDENTIFIER_PAIRED_ANY_LITERAL,
                    this::readGeneralizedIdentifier, this::readAnyLiteral),
                !state.isOn(TokenKind.RIGHT_BRACKET),
                danglingCommaCheck(TokenKind.RIGHT_BRACKET)),
            false);
    }

    protected Wrapped readListLiteral() {
        return readWrapped(NodeKind.LIST_LITERAL, Wrapper.BRACE,
            () -> readCsvArray(this::readAnyLiteral, !state.isOn(TokenKind.RIGHT_BRACE),
                danglingCommaCheck(TokenKind.RIGHT_BRACE)),
            false);
    }

    protected Node readAnyLiteral() {
        if (state.isOn(TokenKind.LEFT_BRACKET)) {
            return readRecordLiteral();
        } else if (state.isOn(TokenKind.LEFT_BRACE)) {
            return readListLiteral();
        }
        return readLiteralExpression();
    }

    private Wrapped maybeReadLiteralAttributes() {
        return state.isOn(TokenKind.LEFT_BRACKET) ? readRecordLiteral() : skipAttribute();
    }

    // ========================================================================
    // Key value pairs
    // ========================================================================

    protected KeyValuePair readIdentifierPairedExpression() {
        return readKeyValuePair(NodeKind.IDENTIFIER_PAIRED_EXPRESSION,
            () -> readIdentifier(IdentifierContextKind.KEY), this::readExpression);
    }

    private KeyValuePair readKeyValuePair(NodeKind kind, Supplier<Node> keyReader, Supplier<Node> valueReader) {
        state.checkCancellation();
        int id = state.startContext(kind);

        Node key = keyReader.get();
        Constant equalConstant = readTokenKindAsConstant(TokenKind.EQUAL, ConstantKind.EQUAL);
        Node value = valueReader.get();

        return state.endContext(new KeyValuePair(id, kind, state.tokenRange(id), key, equalConstant, value));
    }

    // ========================================================================
    // Disambiguation
    // ========================================================================

    /**
     * Classifies the bracket at the cursor by peeking ahead, or returns null when no classification
     * is possible before the end of input.
     */
    protected BracketDisambiguation disambiguateBracket() {
        int offset = state.tokenIndex() + 1;
        TokenKind next = state.tokenKindAt(offset);
        if (next == null) {
            return null;
        } else if (next == TokenKind.LEFT_BRACKET) {
            return BracketDisambiguation.FIELD_PROJECTION;
        } else if (next == TokenKind.RIGHT_BRACKET) {
            return BracketDisambiguation.RECORD;
        }

        for (offset += 1; offset < state.lexerSnapshot().size(); offset++) {
            TokenKind kind = state.tokenKindAt(offset);
            if (kind == TokenKind.EQUAL) {
                return BracketDisambiguation.RECORD;
            } else if (kind == TokenKind.RIGHT_BRACKET) {
                return BracketDisambiguation.FIELD_SELECTION;
            }
        }
        return null;
    }

    protected Node readBracketDisambiguation(List<BracketDisambiguation> allowed) {
        state.checkCancellation();
        BracketDisambiguation disambiguation = disambiguateBracket();
        if (disambiguation == null) {
            if (state.disambiguationBehavior() == DisambiguationBehavior.STRICT) {
                throw new UnterminatedSequenceException(UnterminatedSequenceException.SequenceKind.BRACKET,
                    state.currentToken(), state.tokenIndex(), state.currentPosition());
            }
            return readFurthestVariant(allowed, this::readBracketVariant);
        }
        if (!allowed.contains(disambiguation)) {
            // Only a record can be ruled out; read it as a field selection and let that report the error
            disambiguation = BracketDisambiguation.FIELD_SELECTION;
        }
        return readBracketVariant(disambiguation);
    }

    private Node readBracketVariant(BracketDisambiguation disambiguation) {
        return switch (disambiguation) {
            case FIELD_PROJECTION -> readFieldProjection();
            case FIELD_SELECTION -> readFieldSelection();
            case RECORD -> readRecordExpression();
        };
    }

    /**
     * Classifies the parenthesis at the cursor as a function expression or a parenthesized
     * expression, or returns null when it is never closed.
     */
    protected ParenthesisDisambiguation disambiguateParenthesis() {
        int depth = 1;
        for (int offset = state.tokenIndex() + 1; offset < state.lexerSnapshot().size(); offset++) {
            TokenKind kind = state.tokenKindAt(offset);
            if (kind == TokenKind.LEFT_PARENTHESIS) {
                depth++;
            } else if (kind == TokenKind.RIGHT_PARENTHESIS) {
                depth--;
            }
            if (depth == 0) {
                return classifyAfterClosingParenthesis(offset);
            }
        }
        return null;
    }

    // (x) as number => ... and (x) as number are only told apart by what follows the type
    private ParenthesisDisambiguation classifyAfterClosingParenthesis(int closingIndex) {
        TokenKind afterClosing = state.tokenKindAt(closingIndex + 1);
        if (afterClosing == TokenKind.FAT_ARROW) {
            return ParenthesisDisambiguation.FUNCTION_EXPRESSION;
        } else if (afterClosing != TokenKind.KEYWORD_AS) {
            return ParenthesisDisambiguation.PARENTHESIZED_EXPRESSION;
        }

        Checkpoint checkpoint = state.checkpoint();
        state.setTokenIndex(closingIndex + 2);
        try {
            readNullablePrimitiveType();
            return state.isOn(TokenKind.FAT_ARROW)
                ? ParenthesisDisambiguation.FUNCTION_EXPRESSION
                : ParenthesisDisambiguation.PARENTHESIZED_EXPRESSION;
        } catch (ParseException e) {
            return ParenthesisDisambiguation.PARENTHESIZED_EXPRESSION;
        } finally {
            state.restore(checkpoint);
        }
    }

    protected Node readAmbiguousParenthesis() {
        state.checkCancellation();
        ParenthesisDisambiguation disambiguation = disambiguateParenthesis();
        if (disambiguation == null) {
            if (state.disambiguationBehavior() == DisambiguationBehavior.STRICT) {
                throw new UnterminatedSequenceException(UnterminatedSequenceException.SequenceKind.PARENTHESIS,
                    state.currentToken(), state.tokenIndex(), state.currentPosition());
            }
            return readFurthestVariant(PARENTHESIS_VARIANTS, this::readParenthesisVariant);
        }
        return readParenthesisVariant(disambiguation);
    }

    private Node readParenthesisVariant(ParenthesisDisambiguation disambiguation) {
        return switch (disambiguation) {
            case FUNCTION_EXPRESSION -> readFunctionExpression();
            case PARENTHESIZED_EXPRESSION -> readNullCoalescing();
        };
    }

    /**
     * Tries each variant from the same starting point and keeps the one that consumed the most
     * tokens. Ties prefer a successful read, then the earlier variant. When the last variant tried
     * wins, its result (or error) and state are kept as they are; an earlier winner is read again.
     */
    private <V> Node readFurthestVariant(List<V> variants, Function<V, Node> reader) {
        Checkpoint start = state.checkpoint();
        int bestIndex = -1;
        int bestReached = -1;
        boolean bestSucceeded = false;
        Node lastNode = null;
        ParseException lastError = null;

        for (int i = 0; i < variants.size(); i++) {
            if (i > 0) {
                state.restore(start);
            }
            V variant = variants.get(i);
            lastNode = null;
            lastError = null;
            try {
                lastNode = reader.apply(variant);
            } catch (ParseException e) {
                LOGGER.debug("Variant {} failed: {}", variant, e.getMessage());
                lastError = e;
            }
            boolean succeeded = lastError == null;
            int reached = state.tokenIndex();
            if (bestIndex < 0 || reached > bestReached || (reached == bestReached && succeeded && !bestSucceeded)) {
                bestIndex = i;
                bestReached = reached;
                bestSucceeded = succeeded;
            }
        }

        V best = variants.get(bestIndex);
        if (bestIndex == variants.size() - 1) {
            LOGGER.debug("Keeping {} which reached token {}", best, bestReached);
            if (lastError != null) {
                throw lastError;
            }
            return lastNode;
        }

        state.restore(start);
        LOGGER.debug("Replaying {} which reached token {}", best, bestReached);
        return reader.apply(best);
    }

    // ========================================================================
    // Generic readers
    // ========================================================================

    private Wrapped readWrapped(NodeKind kind, Wrapper wrapper, Supplier<Node> contentReader, boolean allowOptional) {
        state.checkCancellation();
        int id = state.startContext(kind);

        Constant openConstant = readTokenKindAsConstant(wrapper.open, wrapper.openConstant);
        Node content = contentReader.get();
        Constant closeConstant = readClosingConstant(wrapper.close, wrapper.closeConstant);
        Constant optionalConstant = allowOptional
            ? maybeReadTokenKindAsConstant(TokenKind.QUESTION_MARK, ConstantKind.QUESTION_MARK)
            : null;

        return state.endContext(new Wrapped(id, kind, state.tokenRange(id), openConstant, content, closeConstant,
            optionalConstant));
    }

    /**
     * Reads comma separated values. {@code continuationCheck} runs before every value that follows a comma.
     */
    private ArrayWrapper readCsvArray(Supplier<Node> valueReader, boolean continueReading,
                                      Runnable continuationCheck) {
        state.checkCancellation();
        int id = state.startContext(NodeKind.ARRAY_WRAPPER);

        List<Node> elements = new ArrayList<>();
        while (continueReading) {
            int csvId = state.startContext(NodeKind.CSV);
            if (!elements.isEmpty()) {
                continuationCheck.run();
            }
            Node node = valueReader.get();
            Constant commaConstant = maybeReadTokenKindAsConstant(TokenKind.COMMA, ConstantKind.COMMA);
            continueReading = commaConstant != null;
            elements.add(state.endContext(new Csv(csvId, state.tokenRange(csvId), node, commaConstant)));
        }

        return state.endContext(new ArrayWrapper(id, state.tokenRange(id), elements));
    }

    private Runnable danglingCommaCheck(TokenKind closing) {
        return () -> {
            if (state.isOn(closing)) {
                throw new ExpectedCsvContinuationException(ExpectedCsvContinuationException.Kind.DANGLING_COMMA,
                    state.currentToken(), state.tokenIndex(), state.currentPosition());
            }
        };
    }

    private PairedConstant readPairedConstant(NodeKind kind, Supplier<Constant> constantReader,
                                              Supplier<Node> pairedReader) {
        state.checkCancellation();
        int id = state.startContext(kind);

        Constant constant = constantReader.get();
        Node paired = pairedReader.get();

        return state.endContext(new PairedConstant(id, kind, state.tokenRange(id), constant, paired));
    }

    private PairedConstant maybeReadPairedConstant(NodeKind kind, boolean present, Supplier<Constant> constantReader,
                                                   Supplier<Node> pairedReader) {
        return present ? readPairedConstant(kind, constantReader, pairedReader) : skipAttribute();
    }

    // ========================================================================
    // Constants
    // ========================================================================

    protected Constant readTokenKindAsConstant(TokenKind tokenKind, ConstantKind constantKind) {
        state.checkCancellation();
        expectTokenKind(tokenKind);
        return readCurrentTokenAsConstant(constantKind);
    }

    private Constant maybeReadTokenKindAsConstant(TokenKind tokenKind, ConstantKind constantKind) {
        return state.isOn(tokenKind) ? readTokenKindAsConstant(tokenKind, constantKind) : skipAttribute();
    }

    private Constant readClosingConstant(TokenKind tokenKind, ConstantKind constantKind) {
        if (!state.isOn(tokenKind)) {
            throw new ExpectedClosingTokenKindException(tokenKind, state.currentToken(), state.tokenIndex(),
                state.currentPosition());
        }
        return readCurrentTokenAsConstant(constantKind);
    }

    // optional, nullable, catch, function and table are plain identifiers that act as keywords in context
    private boolean isOnContextualIdentifier(ConstantKind constantKind) {
        return state.isOn(TokenKind.IDENTIFIER) && state.currentToken().data().equals(constantKind.text());
    }

    private Constant readContextualConstant(ConstantKind constantKind) {
        if (!isOnContextualIdentifier(constantKind)) {
            throw new InvariantException("Expected contextual keyword '" + constantKind.text() + "'");
        }
        return readCurrentTokenAsConstant(constantKind);
    }

    private Constant readCurrentTokenAsConstant(ConstantKind constantKind) {
        int id = state.startContext(NodeKind.CONSTANT);
        state.advance();
        return state.endContext(new Constant(id, state.tokenRange(id), constantKind));
    }

    private void expectTokenKind(TokenKind tokenKind) {
        if (!state.isOn(tokenKind)) {
            throw new ExpectedTokenKindException(tokenKind, state.currentToken(), state.tokenIndex(),
                state.currentPosition());
        }
    }

    /**
     * Records an absent optional attribute and returns null.
     */
    private <T extends Node> T skipAttribute() {
        state.incrementAttributeCounter();
        return null;
    }
}
