package com.example.modelbridge.reorder;

import com.example.modelbridge.api.BridgeException;
import com.example.modelbridge.api.ErrorCode;
import lombok.Getter;
import tools.jackson.databind.node.ObjectNode;

@Getter
public class PositionOutOfBoundsException extends BridgeException {

    private final String name;
    private final int position;
    private final int count;

    public PositionOutOfBoundsException(String name, int position, int count) {
        super("Position " + position + " is out of bounds for '" + name + "': list has " + count
                + " element(s), valid positions are 0.." + (count - 1));
        this.name = name;
        this.position = position;
        this.count = count;
    }

    @Override
    public ErrorCode errorCode() {
        return ErrorCode.BOUNDS_ERROR;
    }

    @Override
    public void describe(ObjectNode body) {
        body.put("position", position);
        body.put("count", count);
    }
}
