package com.questrail.rover.action;

/**
 * Turns the rover one quarter turn clockwise.
 */
public final class RotateRight extends Rotation
{
    static final RotateRight INSTANCE = new RotateRight();

    private RotateRight() {}

    @Override
    protected int quarterTurns() {
        return 1;
    }

    @Override
    public String toString() {
        return "RotateRight";
    }
}
