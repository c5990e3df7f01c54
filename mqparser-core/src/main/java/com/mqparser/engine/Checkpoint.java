package com.mqparser.engine;

/**
 * Everything needed to roll a {@link ParseState} back to an earlier point.
 *
 * @param attributeCounter attribute counter of the current context, or -1 when there is none
 */
public record Checkpoint(int tokenIndex, int idCounter, int currentContextId, int attributeCounter) {
}
