package com.questrail.rover.api;

/**
 * Direction
 * -----------------------------------------------------------------------------
 * The four cardinal headings a rover can face.
 *
 * <h2>Cycle</h2>
 * Headings are ordered clockwise, NORTH → EAST → SOUTH → WEST → NORTH. The
 * successor relation {@link #next()} is the only primitive; every other turn is
 * expressed as a number of successor steps.
 *
 * <h2>Movement</h2>
 * Each heading owns exactly one unit displacement, returned by
 * {@link #unitVector()}. NORTH increases {@code y}, EAST increases {@code x}.
 */
public enum Direction
{
    NORTH(0, 1),
    EAST(1, 0),
    SOUTH(0, -1),
    WEST(-1, 0);

    private static final Direction[] CYCLE = values();

    private final Coordinates unitVector;

    Direction(int dx, int dy) {
        this.unitVector = new Coordinates(dx, dy);
    }

    /**
     * Returns the heading one quarter turn clockwise from this one.
     */
    public Direction next() {
        return CYCLE[(ordinal() + 1) % CYCLE.length];
    }

    /**
     * Returns the heading one quarter turn counter-clockwise from this one.
     */
    public Direction previous() {
        return next().next().next();
    }

    public Direction opposite() {
        return next().next();
    }

    /**
     * Returns the displacement of a single forward step along this heading.
     */
    public Coordinates unitVector() {
        return unitVector;
    }

    public String displayName() {
        return name();
    }
}
