package com.questrail.rover.action;

import com.questrail.rover.api.Position;

/**
 * Moves the rover one cell against its heading without turning it.
 * <p>
 * The step turns the candidate half way round, advances, and turns back, so
 * backward motion reuses the forward step. Rotation never consults sensors;
 * only the final cell is validated.
 */
public final class MoveBackward extends Move
{
    static final MoveBackward INSTANCE = new MoveBackward();

    private MoveBackward() {}

    @Override
    protected void step(Position candidate) {
        candidate.rotateForward();
        candidate.rotateForward();
        candidate.moveForward();
        candidate.rotateForward();
        candidate.rotateForward();
    }

    @Override
    public String toString() {
        return "MoveBackward";
    }
}
