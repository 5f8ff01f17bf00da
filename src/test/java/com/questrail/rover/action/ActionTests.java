package com.questrail.rover.action;

import com.questrail.rover.api.Coordinates;
import com.questrail.rover.api.Direction;
import com.questrail.rover.api.Position;
import com.questrail.rover.api.Sensor;
import com.questrail.rover.core.Sensors;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the {@link Action} family.
 *
 * These tests drive actions directly against a {@link Position}; no rover is
 * involved.
 */
class ActionTests
{
    private static final List<Sensor> SAFE = List.of(Sensors.alwaysSafe());

    // ---------------------------------------------------------------------
    // Rotation
    // ---------------------------------------------------------------------

    @Test
    void rotateRightTurnsClockwise() {
        Position p = new Position(0, 0, Direction.NORTH);

        assertTrue(Actions.rotateRight().execute(p, SAFE).isSuccess());
        assertEquals(Direction.EAST, p.direction());
    }

    @Test
    void rotateLeftTurnsCounterClockwise() {
        Position p = new Position(0, 0, Direction.NORTH);

        assertTrue(Actions.rotateLeft().execute(p, SAFE).isSuccess());
        assertEquals(Direction.WEST, p.direction());
    }

    @Test
    void leftAndRightCancelInEitherOrder() {
        for (Direction d : Direction.values()) {
            Position p = new Position(3, 3, d);
            Actions.rotateLeft().execute(p, SAFE);
            Actions.rotateRight().execute(p, SAFE);
            assertEquals(new Position(3, 3, d), p);

            Actions.rotateRight().execute(p, SAFE);
            Actions.rotateLeft().execute(p, SAFE);
            assertEquals(new Position(3, 3, d), p);
        }
    }

    @Test
    void rotationNeverConsultsSensors() {
        Position p = new Position(0, 0, Direction.SOUTH);
        List<Sensor> sensors = List.of((x, y) -> {
            throw new AssertionError("sensor consulted during rotation");
        });

        assertTrue(Actions.rotateLeft().execute(p, sensors).isSuccess());
        assertTrue(Actions.rotateRight().execute(p, sensors).isSuccess());
        assertEquals(Direction.SOUTH, p.direction());
    }

    // ---------------------------------------------------------------------
    // Moves
    // ---------------------------------------------------------------------

    @Test
    void moveForwardAdvancesAlongHeading() {
        Position p = new Position(0, 0, Direction.WEST);

        assertTrue(Actions.moveForward().execute(p, SAFE).isSuccess());
        assertEquals(new Position(-1, 0, Direction.WEST), p);
    }

    @Test
    void moveBackwardRetreatsWithoutTurning() {
        Position p = new Position(0, 0, Direction.NORTH);

        assertTrue(Actions.moveBackward().execute(p, SAFE).isSuccess());
        assertEquals(new Position(0, -1, Direction.NORTH), p);
    }

    @Test
    void forwardThenBackwardReturnsToStart() {
        for (Direction d : Direction.values()) {
            Position p = new Position(-2, 5, d);
            Actions.moveForward().execute(p, SAFE);
            Actions.moveBackward().execute(p, SAFE);
            assertEquals(new Position(-2, 5, d), p);
        }
    }

    @Test
    void refusedMoveLeavesPositionUntouched() {
        Position p = new Position(-1, -1, Direction.WEST);

        ActionResult result = Actions.moveForward().execute(p, List.of(Sensors.alwaysDangerous()));

        assertEquals(new ActionResult.DangerousField(new Coordinates(-2, -1)), result);
        assertEquals(new Position(-1, -1, Direction.WEST), p);
    }

    @Test
    void moveBackwardValidatesTargetCell() {
        Position p = new Position(0, 0, Direction.EAST);
        List<Sensor> sensors = List.of(Sensors.forbidding(Set.of(new Coordinates(-1, 0))));

        ActionResult result = Actions.moveBackward().execute(p, sensors);

        assertFalse(result.isSuccess());
        assertEquals(new Position(0, 0, Direction.EAST), p);
    }

    @Test
    void sensorsArePolledInOrderUntilFirstRefusal() {
        List<String> polled = new ArrayList<>();
        List<Sensor> sensors = List.of(
                (x, y) -> polled.add("first"),
                (x, y) -> { polled.add("second"); return false; },
                (x, y) -> polled.add("third"));

        Position p = new Position(0, 0, Direction.NORTH);
        assertFalse(Actions.moveForward().execute(p, sensors).isSuccess());

        assertEquals(List.of("first", "second"), polled);
    }

    @Test
    void sensorsSeeCandidateCellNotCurrentCell() {
        List<Coordinates> polled = new ArrayList<>();
        Position p = new Position(2, 2, Direction.SOUTH);

        Actions.moveForward().execute(p, List.of((x, y) -> polled.add(new Coordinates(x, y))));

        assertEquals(List.of(new Coordinates(2, 1)), polled);
    }

    @Test
    void noSensorsMeansEveryMoveIsAccepted() {
        Position p = new Position(0, 0, Direction.EAST);

        assertTrue(Actions.moveForward().execute(p, List.of()).isSuccess());
        assertEquals(new Coordinates(1, 0), p.coordinates());
    }

    @Test
    void sensorExceptionsPropagate() {
        Position p = new Position(0, 0, Direction.EAST);
        List<Sensor> sensors = List.of((x, y) -> {
            throw new IllegalStateException("sensor offline");
        });

        assertThrows(IllegalStateException.class, () -> Actions.moveForward().execute(p, sensors));
        assertEquals(new Position(0, 0, Direction.EAST), p);
    }

    // ---------------------------------------------------------------------
    // Compose
    // ---------------------------------------------------------------------

    @Test
    void composeAppliesChildrenInOrder() {
        Position p = new Position(0, 0, Direction.NORTH);
        Action action = Actions.compose(Actions.moveForward(), Actions.rotateRight(), Actions.moveForward());

        assertTrue(action.execute(p, SAFE).isSuccess());
        assertEquals(new Position(1, 1, Direction.EAST), p);
    }

    @Test
    void composeStopsAtFirstRefusalAndKeepsEarlierSteps() {
        // Hazard two cells north: first step succeeds, second is refused.
        Sensor sensor = Sensors.forbidding(Set.of(new Coordinates(0, 2)));
        List<String> evaluated = new ArrayList<>();
        Action trailing = Actions.compose(List.of(Actions.rotateRight()));

        Position p = new Position(0, 0, Direction.NORTH);
        Action action = Actions.compose(
                Actions.moveForward(),
                Actions.moveForward(),
                trailing);

        ActionResult result = action.execute(p, List.of(sensor, (x, y) -> evaluated.add(x + "," + y)));

        assertEquals(new ActionResult.DangerousField(new Coordinates(0, 2)), result);
        assertEquals(new Position(0, 1, Direction.NORTH), p);
        assertEquals(List.of("0,1"), evaluated);
    }

    @Test
    void emptyComposeSucceedsWithoutEffect() {
        Position p = new Position(7, 7, Direction.WEST);

        assertTrue(Actions.compose().execute(p, SAFE).isSuccess());
        assertEquals(new Position(7, 7, Direction.WEST), p);
    }

    @Test
    void nestedComposeRunsDepthFirst() {
        Action uTurn = Actions.compose(Actions.rotateRight(), Actions.rotateRight());
        Action action = Actions.compose(Actions.moveForward(), Actions.compose(uTurn, Actions.moveForward()));

        Position p = new Position(0, 0, Direction.EAST);
        assertTrue(action.execute(p, SAFE).isSuccess());

        assertEquals(new Position(0, 0, Direction.WEST), p);
    }

    @Test
    void deeplyNestedComposeDoesNotOverflow() {
        Action action = Actions.moveForward();
        for (int i = 0; i < 100_000; i++) {
            action = Actions.compose(action);
        }

        Position p = new Position(0, 0, Direction.NORTH);
        assertTrue(action.execute(p, SAFE).isSuccess());
        assertEquals(new Coordinates(0, 1), p.coordinates());
    }

    @Test
    void composeRejectsNullChildren() {
        List<Action> children = new ArrayList<>();
        children.add(null);

        assertThrows(NullPointerException.class, () -> Actions.compose(children));
    }

    @Test
    void sharedLeafActionsAreSingletons() {
        assertSame(Actions.moveForward(), Actions.moveForward());
        assertSame(Actions.rotateLeft(), Actions.rotateLeft());
    }
}
