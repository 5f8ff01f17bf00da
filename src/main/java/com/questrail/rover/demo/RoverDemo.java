package com.questrail.rover.demo;

import com.questrail.rover.api.Direction;
import com.questrail.rover.api.RoverDidNotLandException;
import com.questrail.rover.core.Rover;
import com.questrail.rover.core.Sensors;
import com.questrail.rover.observability.Slf4jRoverObservabilitySink;

import static com.questrail.rover.action.Actions.*;

/**
 * Walks a rover through landing, a full command string, an unprogrammed
 * command and a refused move, printing the rover after each step.
 */
public final class RoverDemo
{
    private RoverDemo() {}

    public static void main(String[] args) {
        Slf4jRoverObservabilitySink sink = new Slf4jRoverObservabilitySink();

        Rover rover = Rover.builder()
                .programCommand('F', moveForward())
                .programCommand('B', moveBackward())
                .programCommand('R', rotateRight())
                .programCommand('L', rotateLeft())
                .programCommand('U', compose(rotateRight(), rotateRight()))
                .addSensor(Sensors.alwaysSafe())
                .addSensor(Sensors.alwaysSafe())
                .withObservabilitySink(sink)
                .build();

        System.out.println(rover);
        try {
            rover.execute("F");
        } catch (RoverDidNotLandException e) {
            System.out.println("refused: " + e.getMessage());
        }

        rover.land(0, 0, Direction.EAST);
        System.out.println(rover);

        rover.execute("FFBRLU");
        System.out.println(rover);

        rover.execute("FXFFF");
        System.out.println(rover);

        rover.execute("FFF");
        System.out.println(rover);

        Rover broken = Rover.builder()
                .programCommand('X', moveForward())
                .addSensor(Sensors.alwaysDangerous())
                .withObservabilitySink(sink)
                .build();
        broken.land(-1, -1, Direction.WEST);
        broken.execute("X");
        System.out.println(broken);
    }
}
