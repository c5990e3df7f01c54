package com.mqparser.engine;

import com.mqparser.ast.Node;
import com.mqparser.ast.NodeKind;
import com.mqparser.ast.TokenRange;
import com.mqparser.error.InvariantException;
import com.mqparser.error.ParseCancelledException;
import com.mqparser.lexer.LexerSnapshot;
import com.mqparser.lexer.Position;
import com.mqparser.lexer.Token;
import com.mqparser.lexer.TokenKind;

/**
 * Mutable cursor over the token stream plus the node registry being filled.
 * End of stream is represented by a null current token.
 */
public class ParseState {

    private final LexerSnapshot lexerSnapshot;
    private final NodeRegistry registry = new NodeRegistry();
    private final CancellationToken cancellationToken;
    private final DisambiguationBehavior disambiguationBehavior;

    private int tokenIndex;
    private Token currentToken;
    private int currentContextId = NodeRegistry.NO_ID;

    public ParseState(LexerSnapshot lexerSnapshot, CancellationToken cancellationToken,
                      DisambiguationBehavior disambiguationBehavior) {
        this.lexerSnapshot = lexerSnapshot;
        this.cancellationToken = cancellationToken;
        this.disambiguationBehavior = disambiguationBehavior;
        setTokenIndex(0);
    }

    public LexerSnapshot lexerSnapshot() {
        return lexerSnapshot;
    }

    public NodeRegistry registry() {
        return registry;
    }

    public DisambiguationBehavior disambiguationBehavior() {
        return disambiguationBehavior;
    }

    // ========================================================================
    // Token cursor
    // ========================================================================

    public int tokenIndex() {
        return tokenIndex;
    }

    public Token currentToken() {
        return currentToken;
    }

    public TokenKind currentTokenKind() {
        return currentToken == null ? null : currentToken.kind();
    }

    public boolean isOn(TokenKind kind) {
        return currentToken != null && currentToken.kind() == kind;
    }

    public boolean isAtEnd() {
        return currentToken == null;
    }

    public Token tokenAt(int index) {
        return lexerSnapshot.get(index);
    }

    public TokenKind tokenKindAt(int index) {
        Token token = lexerSnapshot.get(index);
        return token == null ? null : token.kind();
    }

    public Token advance() {
        if (currentToken == null) {
            throw new InvariantException("Cannot advance past the end of the token stream");
        }
        Token consumed = currentToken;
        setTokenIndex(tokenIndex + 1);
        return consumed;
    }

    /**
     * Moves the cursor without touching the registry.
     */
    public void setTokenIndex(int tokenIndex) {
        this.tokenIndex = tokenIndex;
        this.currentToken = lexerSnapshot.get(tokenIndex);
    }

    /**
     * Where an error at the cursor is reported: the current token, or the end of the last token.
     */
    public Position currentPosition() {
        if (currentToken != null) {
            return currentToken.positionStart();
        }
        Token previous = lexerSnapshot.get(tokenIndex - 1);
        return previous != null ? previous.positionEnd() : Position.START;
    }

    public void checkCancellation() {
        if (cancellationToken.isCancelled()) {
            throw new ParseCancelledException("Parse cancelled at token " + tokenIndex);
        }
    }

    // ========================================================================
    // Contexts
    // ========================================================================

    public int currentContextId() {
        return currentContextId;
    }

    public void setCurrentContextId(int contextId) {
        this.currentContextId = contextId;
    }

    /**
     * Opens a context at the cursor under the current context and makes it current.
     */
    public int startContext(NodeKind kind) {
        currentContextId = registry.openContext(kind, tokenIndex, currentToken, currentContextId);
        return currentContextId;
    }

    /**
     * Opens a context starting at an earlier token under {@code parentId} and makes it current.
     */
    public int startContextAt(NodeKind kind, int tokenIndexStart, int parentId) {
        currentContextId = registry.openContext(kind, tokenIndexStart, tokenAt(tokenIndexStart), parentId);
        return currentContextId;
    }

    /**
     * Wraps an already built node in a new current context.
     */
    public int startContextAsParent(NodeKind kind, int existingId) {
        currentContextId = registry.openContextAsParent(kind, existingId);
        return currentContextId;
    }

    /**
     * Promotes the current context and returns to its parent.
     */
    public <T extends Node> T endContext(T node) {
        if (node.id() != currentContextId) {
            throw new InvariantException("Ending context " + node.id() + " but the current context is "
                + currentContextId);
        }
        registry.promote(currentContextId, node);
        currentContextId = registry.parentId(currentContextId);
        return node;
    }

    /**
     * Unwraps the current context and returns to its parent.
     */
    public void deleteContext(int contextId) {
        if (contextId != currentContextId) {
            throw new InvariantException("Deleting context " + contextId + " but the current context is "
                + currentContextId);
        }
        int parentId = registry.parentId(contextId);
        registry.deleteContext(contextId);
        currentContextId = parentId;
    }

    /**
     * Skips an absent optional attribute of the current context.
     */
    public void incrementAttributeCounter() {
        if (currentContextId == NodeRegistry.NO_ID) {
            throw new InvariantException("No open context to skip an attribute on");
        }
        registry.incrementAttributeCounter(currentContextId);
    }

    /**
     * Token range of a context that ends just before the cursor.
     */
    public TokenRange tokenRange(int contextId) {
        int start = registry.tokenIndexStart(contextId);
        int end = tokenIndex - 1;
        Token startToken = registry.tokenStart(contextId);
        Position positionStart = startToken != null ? startToken.positionStart() : currentPosition();
        Token endToken = end >= start ? tokenAt(end) : null;
        Position positionEnd = endToken != null ? endToken.positionEnd() : positionStart;
        return new TokenRange(start, end, positionStart, positionEnd);
    }

    // ========================================================================
    // Backtracking
    // ========================================================================

    public Checkpoint checkpoint() {
        int attributeCounter = currentContextId == NodeRegistry.NO_ID
            ? -1
            : registry.attributeCounter(currentContextId);
        return new Checkpoint(tokenIndex, registry.idCounter(), currentContextId, attributeCounter);
    }

    public void restore(Checkpoint checkpoint) {
        registry.rollback(checkpoint.idCounter());
        setTokenIndex(checkpoint.tokenIndex());
        currentContextId = checkpoint.currentContextId();
        if (currentContextId != NodeRegistry.NO_ID) {
            registry.setAttributeCounter(currentContextId, checkpoint.attributeCounter());
        }
    }
}
