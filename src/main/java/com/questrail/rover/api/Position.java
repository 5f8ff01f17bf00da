package com.questrail.rover.api;

import java.util.Objects;

/**
 * Position
 * -----------------------------------------------------------------------------
 * The pose of a rover: the cell it occupies and the heading it faces.
 *
 * <h2>Mutability</h2>
 * A {@code Position} is a small mutable working object. Actions update it in
 * place through two raw primitives:
 * <ul>
 *   <li>{@link #rotateForward()}: one quarter turn clockwise</li>
 *   <li>{@link #moveForward()}: one step along the current heading</li>
 * </ul>
 *
 * Neither primitive consults sensors. Safety is the concern of the caller,
 * which validates a {@link #copy()} before committing it with
 * {@link #overwriteWith(Position)}.
 *
 * <h2>Display</h2>
 * {@link #toString()} renders {@code "(x, y) HEADING"}, e.g.
 * {@code "(-1, 0) WEST"}.
 */
public final class Position
{
    private Coordinates coordinates;
    private Direction direction;

    public Position(Coordinates coordinates, Direction direction) {
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public Position(int x, int y, Direction direction) {
        this(new Coordinates(x, y), direction);
    }

    public Coordinates coordinates() {
        return coordinates;
    }

    public Direction direction() {
        return direction;
    }

    public void rotateForward() {
        direction = direction.next();
    }

    public void moveForward() {
        coordinates = coordinates.translate(direction.unitVector());
    }

    /**
     * Evaluates {@code sensor} at the current coordinates. Does not mutate.
     */
    public boolean isSafeFor(Sensor sensor) {
        return coordinates.isSafeFor(sensor);
    }

    public Position copy() {
        return new Position(coordinates, direction);
    }

    /**
     * Replaces this pose with the pose of {@code other}.
     */
    public void overwriteWith(Position other) {
        Objects.requireNonNull(other, "other");
        this.coordinates = other.coordinates;
        this.direction = other.direction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position other)) {
            return false;
        }
        return coordinates.equals(other.coordinates) && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(coordinates, direction);
    }

    @Override
    public String toString() {
        return coordinates + " " + direction.displayName();
    }
}
