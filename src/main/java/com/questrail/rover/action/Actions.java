package com.questrail.rover.action;

import java.util.List;

/**
 * Static factories for the {@link Action} family.
 * <p>
 * Leaf actions are stateless, so the same instance is returned on every call.
 */
public final class Actions
{
    private Actions() {}

    public static Action moveForward() {
        return MoveForward.INSTANCE;
    }

    public static Action moveBackward() {
        return MoveBackward.INSTANCE;
    }

    public static Action rotateLeft() {
        return RotateLeft.INSTANCE;
    }

    public static Action rotateRight() {
        return RotateRight.INSTANCE;
    }

    public static Action compose(Action... actions) {
        return new Compose(List.of(actions));
    }

    public static Action compose(List<Action> actions) {
        return new Compose(actions);
    }
}
