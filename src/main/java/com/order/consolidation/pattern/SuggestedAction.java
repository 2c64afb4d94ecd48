package com.order.consolidation.pattern;

/**
 * What a message suggests should happen to the conversation's order session.
 * Declared in precedence order.
 */
public enum SuggestedAction {
    CLOSE_SESSION,
    MODIFY_SESSION,
    START_OR_EXTEND_SESSION,
    NONE
}
