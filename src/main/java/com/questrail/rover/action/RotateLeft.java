package com.questrail.rover.action;

/**
 * Turns the rover one quarter turn counter-clockwise, expressed as three
 * clockwise quarter turns.
 */
public final class RotateLeft extends Rotation
{
    static final RotateLeft INSTANCE = new RotateLeft();

    private RotateLeft() {}

    @Override
    protected int quarterTurns() {
        return 3;
    }

    @Override
    public String toString() {
        return "RotateLeft";
    }
}
