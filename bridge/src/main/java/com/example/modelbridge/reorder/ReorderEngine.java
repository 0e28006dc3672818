package com.example.modelbridge.reorder;

import com.example.modelbridge.document.ModelDocumentStore;
import com.example.modelbridge.resolve.ResolvedEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

/**
 * Moves elements of order-significant lists. A move removes the element and reinserts it at the
 * target index, shifting the elements in between; it never swaps.
 */
@Slf4j
@RequiredArgsConstructor
public class ReorderEngine {

    private final ModelDocumentStore store;

    public MoveResult move(ResolvedEntity element, String name, int newPosition) {
        return move(element.parentList(), element.index(), name, newPosition);
    }

    /**
     * @throws PositionOutOfBoundsException when {@code newPosition} is outside {@code 0..count-1}
     */
    public MoveResult move(ArrayNode list, int currentIndex, String name, int newPosition) {
        int count = list.size();
        if (newPosition < 0 || newPosition >= count) {
            throw new PositionOutOfBoundsException(name, newPosition, count);
        }
        if (currentIndex < 0 || currentIndex >= count) {
            throw new IllegalArgumentException("Element index " + currentIndex + " outside list of " + count);
        }
        if (currentIndex != newPosition) {
            ObjectNode element = store.remove(list, currentIndex);
            store.insert(list, newPosition, element);
        }
        log.debug("Moved name={} from={} to={} count={}", name, currentIndex, newPosition, count);
        return new MoveResult(name, currentIndex, newPosition, count);
    }
}
