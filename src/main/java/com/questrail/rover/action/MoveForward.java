package com.questrail.rover.action;

import com.questrail.rover.api.Position;

/**
 * Advances the rover one cell along its heading.
 */
public final class MoveForward extends Move
{
    static final MoveForward INSTANCE = new MoveForward();

    private MoveForward() {}

    @Override
    protected void step(Position candidate) {
        candidate.moveForward();
    }

    @Override
    public String toString() {
        return "MoveForward";
    }
}
