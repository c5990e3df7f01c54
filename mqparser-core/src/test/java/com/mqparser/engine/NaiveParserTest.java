package com.mqparser.engine;

import com.mqparser.ast.BinOpExpression;
import com.mqparser.ast.BinOpOperator;
import com.mqparser.ast.ConstantKind;
import com.mqparser.ast.Csv;
import com.mqparser.ast.ErrorHandlingExpression;
import com.mqparser.ast.FieldSpecification;
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
import com.mqparser.error.ExpectedTokenKindException;
import com.mqparser.error.InvalidCatchFunctionException;
import com.mqparser.error.InvalidPrimitiveTypeException;
import com.mqparser.error.ParseException;
import com.mqparser.error.RequiredParameterAfterOptionalParameterException;
import com.mqparser.error.UnterminatedSequenceException;
import com.mqparser.error.UnusedTokensRemainException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NaiveParserTest {

    private static Node parse(String source) {
        return ParserTestSupport.readExpression(source, NaiveParser::new);
    }

    private static <T extends ParseException> T parseError(Class<T> type, String source,
                                                          DisambiguationBehavior behavior) {
        NaiveParser parser = new NaiveParser(ParserTestSupport.state(source, behavior));
        return assertThrows(type, () -> ParserTestSupport.readExpression(parser), source);
    }

    private static <T extends ParseException> T parseError(Class<T> type, String source) {
        return parseError(type, source, DisambiguationBehavior.THOROUGH);
    }

    private static Node document(String source) {
        return new NaiveParser(ParserTestSupport.state(source)).readDocument();
    }

    private static List<NodeKind> kinds(List<Node> nodes) {
        return nodes.stream().map(Node::kind).toList();
    }

    private static Node csvNode(Node csv) {
        return ((Csv) csv).node();
    }

    // ========================================================================
    // Operators
    // ========================================================================

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        BinOpExpression root = (BinOpExpression) parse("1 + 2 * 3");
        assertEquals(BinOpOperator.ADDITION, root.operator());
        assertEquals(NodeKind.ARITHMETIC_EXPRESSION, root.kind());
        assertEquals(0, root.tokenRange().tokenIndexStart());
        assertEquals(4, root.tokenRange().tokenIndexEnd());

        BinOpExpression right = (BinOpExpression) root.right();
        assertEquals(BinOpOperator.MULTIPLICATION, right.operator());
        assertEquals("2", ((LiteralExpression) right.left()).literal());
    }

    @Test
    void testSameLevelOperatorsFoldLeft() {
        BinOpExpression root = (BinOpExpression) parse("1 - 2 - 3");
        assertEquals(BinOpOperator.SUBTRACTION, root.operator());
        assertInstanceOf(BinOpExpression.class, root.left(), "1 - 2 is grouped first");
        assertEquals("3", ((LiteralExpression) root.right()).literal());
    }

    @Test
    void testNullCoalescingNestsRight() {
        BinOpExpression root = (BinOpExpression) parse("a ?? b ?? c");
        assertEquals(NodeKind.NULL_COALESCING_EXPRESSION, root.kind());
        assertEquals(NodeKind.IDENTIFIER_EXPRESSION, root.left().kind());
        assertEquals(NodeKind.NULL_COALESCING_EXPRESSION, root.right().kind());
    }

    @Test
    void testLogicalAndComparisonLevels() {
        BinOpExpression root = (BinOpExpression) parse("a = 1 or b < 2 and c");
        assertEquals(BinOpOperator.OR, root.operator());
        assertEquals(NodeKind.EQUALITY_EXPRESSION, root.left().kind());

        BinOpExpression and = (BinOpExpression) root.right();
        assertEquals(BinOpOperator.AND, and.operator());
        assertEquals(NodeKind.RELATIONAL_EXPRESSION, and.left().kind());
    }

    @Test
    void testAsAndIsTakePrimitiveTypes() {
        BinOpExpression as = (BinOpExpression) parse("x as nullable number");
        assertEquals(NodeKind.AS_EXPRESSION, as.kind());
        PairedConstant nullable = (PairedConstant) as.right();
        assertEquals(NodeKind.NULLABLE_PRIMITIVE_TYPE, nullable.kind());
        assertEquals(PrimitiveTypeKind.NUMBER, ((PrimitiveType) nullable.paired()).primitiveTypeKind());

        BinOpExpression is = (BinOpExpression) parse("x is text");
        assertEquals(NodeKind.IS_EXPRESSION, is.kind());
        assertEquals(PrimitiveTypeKind.TEXT, ((PrimitiveType) is.right()).primitiveTypeKind());
    }

    @Test
    void testMetadata() {
        BinOpExpression root = (BinOpExpression) parse("1 meta [a = 1]");
        assertEquals(NodeKind.METADATA_EXPRESSION, root.kind());
        assertEquals(ConstantKind.META, root.operatorConstant().constantKind());
        assertEquals(NodeKind.RECORD_EXPRESSION, root.right().kind());
    }

    @Test
    void testSecondMetaIsLeftUnread() {
        UnusedTokensRemainException e = parseError(UnusedTokensRemainException.class, "a meta b meta c");
        assertEquals(3, e.getTokenIndex());
    }

    @Test
    void testUnaryOperators() {
        UnaryExpression not = (UnaryExpression) parse("not a");
        assertEquals(List.of(NodeKind.CONSTANT), kinds(not.operators().elements()));

        UnaryExpression negated = (UnaryExpression) parse("- - 1");
        assertEquals(2, negated.operators().elements().size());
        assertEquals(NodeKind.LITERAL_EXPRESSION, negated.typeExpression().kind());
    }

    // ========================================================================
    // Primary expressions
    // ========================================================================

    @Test
    void testLiterals() {
        assertEquals(LiteralKind.TEXT, ((LiteralExpression) parse("\"hello\"")).literalKind());
        assertEquals(LiteralKind.LOGICAL, ((LiteralExpression) parse("true")).literalKind());
        assertEquals(LiteralKind.NULL, ((LiteralExpression) parse("null")).literalKind());
        assertEquals(LiteralKind.NUMERIC, ((LiteralExpression) parse("0xFF")).literalKind());
        assertEquals(LiteralKind.NUMERIC, ((LiteralExpression) parse("#nan")).literalKind());
    }

    @Test
    void testInclusiveIdentifier() {
        RecursivePrimaryExpression invoke = (RecursivePrimaryExpression) parse("@f(1)");
        IdentifierExpression head = (IdentifierExpression) invoke.head();
        assertNotNull(head.inclusiveConstant());
        assertEquals("f", head.identifier().literal());
        assertEquals(List.of(NodeKind.INVOKE_EXPRESSION), kinds(invoke.recursiveExpressions().elements()));
    }

    @Test
    void testHashKeywordInvoke() {
        RecursivePrimaryExpression date = (RecursivePrimaryExpression) parse("#date(2020, 1, 1)");
        IdentifierExpression head = (IdentifierExpression) date.head();
        assertEquals(IdentifierContextKind.KEYWORD, head.identifier().identifierContextKind());
        assertEquals("#date", head.identifier().literal());

        Wrapped invoke = (Wrapped) date.recursiveExpressions().elements().get(0);
        assertEquals(3, invoke.content().children().size());
    }

    @Test
    void testRecursiveSuffixes() {
        RecursivePrimaryExpression root = (RecursivePrimaryExpression) parse("Source{0}[Name]");
        assertEquals(NodeKind.IDENTIFIER_EXPRESSION, root.head().kind());
        assertEquals(List.of(NodeKind.ITEM_ACCESS_EXPRESSION, NodeKind.FIELD_SELECTOR),
            kinds(root.recursiveExpressions().elements()));
    }

    @Test
    void testOptionalSuffixes() {
        RecursivePrimaryExpression root = (RecursivePrimaryExpression) parse("a{0}?[b]?[[c], [d]]?");
        List<Node> suffixes = root.recursiveExpressions().elements();
        assertEquals(List.of(NodeKind.ITEM_ACCESS_EXPRESSION, NodeKind.FIELD_SELECTOR, NodeKind.FIELD_PROJECTION),
            kinds(suffixes));
        for (Node suffix : suffixes) {
            assertNotNull(((Wrapped) suffix).optionalConstant(), suffix.kind() + " keeps its ?");
        }
    }

    @Test
    void testBracketForms() {
        assertEquals(NodeKind.RECORD_EXPRESSION, parse("[a = 1, b = 2]").kind());
        assertEquals(NodeKind.RECORD_EXPRESSION, parse("[]").kind());
        assertEquals(NodeKind.FIELD_SELECTOR, parse("[a]").kind());
        assertEquals(NodeKind.FIELD_PROJECTION, parse("[[a], [b]]").kind());
    }

    @Test
    void testGeneralizedIdentifierSpansTokens() {
        Wrapped record = (Wrapped) parse("[Date Time = 1]");
        Node csv = record.content().children().get(0);
        KeyValuePair pair = (KeyValuePair) csvNode(csv);
        assertEquals(NodeKind.GENERALIZED_IDENTIFIER_PAIRED_EXPRESSION, pair.kind());
        assertEquals("Date Time", ((GeneralizedIdentifier) pair.key()).literal());
    }

    @Test
    void testListWithRange() {
        Wrapped list = (Wrapped) parse("{1 .. 3, 5}");
        assertEquals(NodeKind.LIST_EXPRESSION, list.kind());
        List<Node> elements = list.content().children();
        RangeExpression range = (RangeExpression) csvNode(elements.get(0));
        assertEquals("1", ((LiteralExpression) range.left()).literal());
        assertEquals(NodeKind.LITERAL_EXPRESSION, csvNode(elements.get(1)).kind());
    }

    @Test
    void testNotImplemented() {
        assertEquals(NodeKind.NOT_IMPLEMENTED_EXPRESSION, parse("...").kind());
    }

    // ========================================================================
    // Keyword expressions
    // ========================================================================

    @Test
    void testLetExpression() {
        LetExpression let = (LetExpression) parse("let x = 1, y = 2 in x + y");
        assertEquals(2, let.variableList().elements().size());
        KeyValuePair first = (KeyValuePair) csvNode(let.variableList().elements().get(0));
        assertEquals(NodeKind.IDENTIFIER_PAIRED_EXPRESSION, first.kind());
        assertEquals("x", ((Identifier) first.key()).literal());
        assertEquals(NodeKind.ARITHMETIC_EXPRESSION, let.expression().kind());
    }

    @Test
    void testIfExpression() {
        IfExpression ifExpression = (IfExpression) parse("if a then 1 else 2");
        assertEquals(NodeKind.IDENTIFIER_EXPRESSION, ifExpression.condition().kind());
        assertEquals("2", ((LiteralExpression) ifExpression.falseExpression()).literal());
    }

    @Test
    void testEachAndError() {
        PairedConstant each = (PairedConstant) parse("each x + 1");
        assertEquals(NodeKind.EACH_EXPRESSION, each.kind());
        assertEquals(NodeKind.ARITHMETIC_EXPRESSION, each.paired().kind());

        PairedConstant error = (PairedConstant) parse("error \"bad\"");
        assertEquals(NodeKind.ERROR_RAISING_EXPRESSION, error.kind());
    }

    @Test
    void testErrorHandling() {
        ErrorHandlingExpression otherwise = (ErrorHandlingExpression) parse("try x otherwise 0");
        assertEquals(NodeKind.OTHERWISE_EXPRESSION, otherwise.handler().kind());

        ErrorHandlingExpression caught = (ErrorHandlingExpression) parse("try x catch (e) => e");
        assertEquals(NodeKind.CATCH_EXPRESSION, caught.handler().kind());
        assertEquals(NodeKind.FUNCTION_EXPRESSION, caught.handler().paired().kind());

        assertNotNull(parse("try x catch () => 1"));
        assertNull(((ErrorHandlingExpression) parse("try x")).handler());
    }

    @Test
    void testTypedCatchFunctionIsRejected() {
        InvalidCatchFunctionException e = parseError(InvalidCatchFunctionException.class,
            "try x catch (e as text) => e");
        assertEquals(3, e.getTokenIndex(), "Reported at the opening parenthesis");

        parseError(InvalidCatchFunctionException.class, "try x catch (a, b) => a");
    }

    @Test
    void testCatchFunctionMayHaveOptionalParameter() {
        ErrorHandlingExpression caught = (ErrorHandlingExpression) parse("try 1 catch (optional e) => 0");
        FunctionExpression function = (FunctionExpression) caught.handler().paired();
        Parameter parameter = (Parameter) csvNode(function.parameters().content().children().get(0));
        assertNotNull(parameter.optionalConstant());
        assertEquals("e", parameter.name().literal());
    }

    @Test
    void testCatchIsAnIdentifierOutsideErrorHandling() {
        LetExpression let = (LetExpression) parse("let catch = 1 in catch");
        IdentifierExpression body = (IdentifierExpression) let.expression();
        assertEquals("catch", body.identifier().literal());

        BinOpExpression sum = (BinOpExpression) parse("catch + 1");
        assertEquals(NodeKind.IDENTIFIER_EXPRESSION, sum.left().kind());
    }

    // ========================================================================
    // Functions
    // ========================================================================

    @Test
    void testFunctionWithOptionalParameterAndReturnType() {
        FunctionExpression function = (FunctionExpression) parse("(x, optional y as number) as text => x");
        List<Node> parameters = function.parameters().content().children();
        assertEquals(2, parameters.size());

        Parameter x = (Parameter) csvNode(parameters.get(0));
        assertNull(x.optionalConstant());
        assertNull(x.parameterType());

        Parameter y = (Parameter) csvNode(parameters.get(1));
        assertNotNull(y.optionalConstant());
        assertEquals("y", y.name().literal());
        assertNotNull(y.parameterType());
        assertNotNull(function.functionReturnType());
    }

    @Test
    void testParameterNamedOptional() {
        FunctionExpression function = (FunctionExpression) parse("(optional) => optional");
        Parameter parameter = (Parameter) csvNode(function.parameters().content().children().get(0));
        assertNull(parameter.optionalConstant());
        assertEquals("optional", parameter.name().literal());
    }

    @Test
    void testParenthesisDisambiguation() {
        assertEquals(NodeKind.FUNCTION_EXPRESSION, parse("(x) => x").kind());
        assertEquals(NodeKind.PARENTHESIZED_EXPRESSION, parse("(x)").kind());
        assertEquals(NodeKind.AS_EXPRESSION, parse("(x) as number").kind());
        assertEquals(NodeKind.FUNCTION_EXPRESSION, parse("(x) as number => x").kind());
        assertEquals(NodeKind.ARITHMETIC_EXPRESSION, parse("(1) + 2").kind());
    }

    // ========================================================================
    // Types
    // ========================================================================

    @Test
    void testPrimitiveTypeExpression() {
        PairedConstant type = (PairedConstant) parse("type number");
        assertEquals(NodeKind.TYPE_PRIMARY_TYPE, type.kind());
        assertEquals(PrimitiveTypeKind.NUMBER, ((PrimitiveType) type.paired()).primitiveTypeKind());
    }

    @Test
    void testTableType() {
        PairedConstant type = (PairedConstant) parse("type table [a = number]");
        PairedConstant table = (PairedConstant) type.paired();
        assertEquals(NodeKind.TABLE_TYPE, table.kind());
        assertEquals(NodeKind.FIELD_SPECIFICATION_LIST, table.paired().kind());
    }

    @Test
    void testListAndNullableTypes() {
        PairedConstant list = (PairedConstant) parse("type {number}");
        assertEquals(NodeKind.LIST_TYPE, list.paired().kind());

        PairedConstant nullable = (PairedConstant) parse("type nullable number");
        assertEquals(NodeKind.NULLABLE_TYPE, nullable.paired().kind());
    }

    @Test
    void testFunctionType() {
        PairedConstant type = (PairedConstant) parse("type function (x as number) as text");
        FunctionType function = (FunctionType) type.paired();
        assertEquals(1, function.parameters().content().children().size());
        assertEquals(NodeKind.AS_TYPE, function.functionReturnType().kind());
    }

    @Test
    void testOpenRecordType() {
        PairedConstant type = (PairedConstant) parse("type [a = number, optional b, ...]");
        RecordType record = (RecordType) type.paired();
        assertNotNull(record.fields().openRecordMarkerConstant());

        List<Node> fields = record.fields().content().elements();
        assertEquals(2, fields.size());
        FieldSpecification a = (FieldSpecification) csvNode(fields.get(0));
        assertNotNull(a.fieldTypeSpecification());
        FieldSpecification b = (FieldSpecification) csvNode(fields.get(1));
        assertNotNull(b.optionalConstant());
        assertEquals("b", b.name().literal());
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Test
    void testUnusedTokens() {
        UnusedTokensRemainException e = parseError(UnusedTokensRemainException.class, "1 2");
        assertEquals(1, e.getTokenIndex());
    }

    @Test
    void testMissingOperand() {
        ExpectedAnyTokenKindException e = parseError(ExpectedAnyTokenKindException.class, "1 +");
        assertEquals(2, e.getTokenIndex());
        assertNull(e.getToken(), "Reported at the end of input");
    }

    @Test
    void testDanglingComma() {
        ExpectedCsvContinuationException e = parseError(ExpectedCsvContinuationException.class, "[a = 1,]");
        assertEquals(ExpectedCsvContinuationException.Kind.DANGLING_COMMA, e.getKind());
        assertEquals(5, e.getTokenIndex());

        parseError(ExpectedCsvContinuationException.class, "f(1,)");
    }

    @Test
    void testLetContinuation() {
        ExpectedCsvContinuationException e = parseError(ExpectedCsvContinuationException.class, "let x = 1, in x");
        assertEquals(ExpectedCsvContinuationException.Kind.LET_EXPRESSION, e.getKind());
        assertEquals(5, e.getTokenIndex());
    }

    @Test
    void testRequiredParameterAfterOptional() {
        RequiredParameterAfterOptionalParameterException e = parseError(
            RequiredParameterAfterOptionalParameterException.class, "(optional x, y) => x");
        assertEquals(4, e.getTokenIndex());
    }

    @Test
    void testInvalidPrimitiveType() {
        InvalidPrimitiveTypeException e = parseError(InvalidPrimitiveTypeException.class, "x as foo");
        assertEquals(2, e.getTokenIndex());
    }

    @Test
    void testRecordNotAllowedAsSuffix() {
        ExpectedClosingTokenKindException e = parseError(ExpectedClosingTokenKindException.class, "x[a = 1]");
        assertEquals(3, e.getTokenIndex());
    }

    @Test
    void testUnterminatedBracket() {
        UnterminatedSequenceException strict = parseError(UnterminatedSequenceException.class, "[a",
            DisambiguationBehavior.STRICT);
        assertEquals(UnterminatedSequenceException.SequenceKind.BRACKET, strict.getSequenceKind());
        assertEquals(0, strict.getTokenIndex());

        ExpectedClosingTokenKindException thorough = parseError(ExpectedClosingTokenKindException.class, "[a");
        assertEquals(2, thorough.getTokenIndex());
    }

    @Test
    void testUnterminatedParenthesis() {
        UnterminatedSequenceException strict = parseError(UnterminatedSequenceException.class, "(x, y",
            DisambiguationBehavior.STRICT);
        assertEquals(UnterminatedSequenceException.SequenceKind.PARENTHESIS, strict.getSequenceKind());

        // The function reading gets furthest
        ExpectedClosingTokenKindException thorough = parseError(ExpectedClosingTokenKindException.class, "(x, y");
        assertEquals(4, thorough.getTokenIndex());
    }

    @Test
    void testDeeplyUnterminatedParenthesesAreReadOnce() {
        String source = "(".repeat(30) + "1";
        ExpectedClosingTokenKindException e = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> parseError(ExpectedClosingTokenKindException.class, source));
        assertEquals(31, e.getTokenIndex());
    }

    @Test
    void testFailedParseLeavesNoFinishedRoot() {
        ParseState state = ParserTestSupport.state("1 +");
        assertThrows(ParseException.class, () -> new NaiveParser(state).readExpression());
        assertFalse(state.registry().idsInState(NodeRegistry.SlotState.OPEN).isEmpty(),
            "The binary expression context stays open");
    }

    // ========================================================================
    // Documents
    // ========================================================================

    @Test
    void testSectionDocument() {
        Section section = (Section) document("section Foo; shared x = 1; y = 2;");
        assertEquals("Foo", section.name().literal());
        List<Node> members = section.sectionMembers().elements();
        assertEquals(2, members.size());
        assertNotNull(((SectionMember) members.get(0)).sharedConstant());
        assertNull(((SectionMember) members.get(1)).sharedConstant());
    }

    @Test
    void testSectionWithLiteralAttributes() {
        Section section = (Section) document("[Version = \"1\"] section; x = 1;");
        assertEquals(NodeKind.RECORD_LITERAL, section.literalAttributes().kind());
        assertNull(section.name());
        assertEquals(1, section.sectionMembers().elements().size());
    }

    @Test
    void testExpressionDocument() {
        assertEquals(NodeKind.ARITHMETIC_EXPRESSION, document("1 + 2").kind());
    }

    @Test
    void testDocumentReportsSectionErrorWhenItGetsFurther() {
        NaiveParser parser = new NaiveParser(ParserTestSupport.state("section Foo; x = ;"));
        ExpectedAnyTokenKindException e = assertThrows(ExpectedAnyTokenKindException.class, parser::readDocument);
        assertEquals(5, e.getTokenIndex());
    }

    @Test
    void testDocumentReportsExpressionErrorWhenItGetsFurther() {
        NaiveParser parser = new NaiveParser(ParserTestSupport.state("1 +"));
        ExpectedAnyTokenKindException e = assertThrows(ExpectedAnyTokenKindException.class, parser::readDocument);
        assertEquals(2, e.getTokenIndex());
    }

    @Test
    void testEmptyDocument() {
        NaiveParser parser = new NaiveParser(ParserTestSupport.state(""));
        ExpectedTokenKindException e = assertThrows(ExpectedTokenKindException.class, parser::readDocument);
        assertEquals(0, e.getTokenIndex());
    }

    @Test
    void testRegistryMatchesTree() {
        NaiveParser parser = new NaiveParser(ParserTestSupport.state("let x = [a = 1], y = x[a] in y * 2"));
        Node root = ParserTestSupport.readExpression(parser);
        String rendered = ParserTestSupport.render(parser.state().registry(), root);
        assertFalse(rendered.contains("!"), rendered);
        assertEquals(root.id(), parser.state().registry().rootId());
        assertTrue(parser.state().registry().idsInState(NodeRegistry.SlotState.OPEN).isEmpty());
    }
}
