package com.mqparser;

import com.mqparser.ast.Node;
import com.mqparser.engine.CombinatorialParser;
import com.mqparser.engine.NaiveParser;
import com.mqparser.engine.NodeRegistry;
import com.mqparser.engine.ParseState;
import com.mqparser.error.ParseException;
import com.mqparser.lexer.Lexer;
import com.mqparser.lexer.LexerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing M source text.
 * <pre>{@code
 * ParseOk result = new Parser().parse("let x = 1 in x + 2");
 * Node root = result.root();
 * }</pre>
 */
public class Parser {
    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final ParseSettings settings;

    public Parser() {
        this(ParseSettings.defaults());
    }

    public Parser(ParseSettings settings) {
        this.settings = settings;
    }

    public ParseSettings settings() {
        return settings;
    }

    /**
     * Lexes and parses {@code source}.
     *
     * @throws ParseException when the tokens do not form a document of the configured entry point
     * @throws com.mqparser.lexer.LexException when the text cannot be tokenized
     */
    public ParseOk parse(String source) {
        return parse(Lexer.lex(source));
    }

    public ParseOk parse(LexerSnapshot lexerSnapshot) {
        ParseState state = createState(lexerSnapshot);
        Node root = read(createParser(state));
        LOGGER.debug("Parsed {} tokens into {} nodes with the {} parser", lexerSnapshot.size(),
            state.registry().idCounter(), settings.parserKind());
        return new ParseOk(root, state.registry(), lexerSnapshot);
    }

    /**
     * Like {@link #parse(LexerSnapshot)}, but reports parse errors as a value: {@code Partial} when
     * some nodes were finished before the error, {@code Err} otherwise. Invariant and cancellation
     * failures are still thrown.
     */
    public PartialResult<ParseOk, ParsePartial, ParseException> tryParse(LexerSnapshot lexerSnapshot) {
        ParseState state = createState(lexerSnapshot);
        try {
            Node root = read(createParser(state));
            return new PartialResult.Ok<>(new ParseOk(root, state.registry(), lexerSnapshot));
        } catch (ParseException e) {
            LOGGER.debug("Parse failed: {}", e.getMessage());
            if (state.registry().idsInState(NodeRegistry.SlotState.FINISHED).isEmpty()) {
                return new PartialResult.Err<>(e);
            }
            return new PartialResult.Partial<>(new ParsePartial(state.registry(), lexerSnapshot), e);
        }
    }

    public PartialResult<ParseOk, ParsePartial, ParseException> tryParse(String source) {
        return tryParse(Lexer.lex(source));
    }

    private ParseState createState(LexerSnapshot lexerSnapshot) {
        return new ParseState(lexerSnapshot, settings.cancellationToken(), settings.disambiguationBehavior());
    }

    private NaiveParser createParser(ParseState state) {
        return switch (settings.parserKind()) {
            case NAIVE -> new NaiveParser(state);
            case COMBINATORIAL -> new CombinatorialParser(state);
        };
    }

    private Node read(NaiveParser parser) {
        return switch (settings.entryPoint()) {
            case DOCUMENT -> parser.readDocument();
            case EXPRESSION -> {
                Node expression = parser.readExpression();
                parser.expectNoMoreTokens();
                yield expression;
            }
            case SECTION_DOCUMENT -> {
                Node section = parser.readSectionDocument();
                parser.expectNoMoreTokens();
                yield section;
            }
        };
    }
}
