package com.mqparser;

import com.mqparser.engine.CancellationToken;
import com.mqparser.engine.DisambiguationBehavior;

/**
 * Immutable parse options. Start from {@link #defaults()} and adjust with the {@code with} methods.
 */
public record ParseSettings(
    ParserKind parserKind,
    DisambiguationBehavior disambiguationBehavior,
    EntryPoint entryPoint,
    CancellationToken cancellationToken
) {

    public ParseSettings {
        if (parserKind == null || disambiguationBehavior == null || entryPoint == null || cancellationToken == null) {
            throw new IllegalArgumentException("Parse settings must not contain null values");
        }
    }

    public static ParseSettings defaults() {
        return new ParseSettings(ParserKind.COMBINATORIAL, DisambiguationBehavior.THOROUGH, EntryPoint.DOCUMENT,
            new CancellationToken());
    }

    public ParseSettings withParserKind(ParserKind parserKind) {
        return new ParseSettings(parserKind, disambiguationBehavior, entryPoint, cancellationToken);
    }

    public ParseSettings withDisambiguationBehavior(DisambiguationBehavior disambiguationBehavior) {
        return new ParseSettings(parserKind, disambiguationBehavior, entryPoint, cancellationToken);
    }

    public ParseSettings withEntryPoint(EntryPoint entryPoint) {
        return new ParseSettings(parserKind, disambiguationBehavior, entryPoint, cancellationToken);
    }

    public ParseSettings withCancellationToken(CancellationToken cancellationToken) {
        return new ParseSettings(parserKind, disambiguationBehavior, entryPoint, cancellationToken);
    }
}
