package com.example.modelbridge.reorder;

/**
 * Outcome of a move: where the element was, where it is now, and the list length.
 */
public record MoveResult(String name, int oldPosition, int newPosition, int count) {
}
