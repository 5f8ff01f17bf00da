package com.questrail.rover.action;

import com.questrail.rover.api.Position;
import com.questrail.rover.api.Sensor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Compose
 * -----------------------------------------------------------------------------
 * An ordered sequence of actions bound to a single command.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Children are applied in order to the same position</li>
 *   <li>The first refused step ends the whole composition; later children are
 *       not evaluated</li>
 *   <li>Effects of children applied before the refusal are kept</li>
 *   <li>An empty composition succeeds without touching the position</li>
 * </ul>
 *
 * Nested compositions are flattened on the fly with an explicit stack of
 * iterators, so nesting depth is not bounded by the call stack.
 */
public final class Compose implements Action
{
    private final List<Action> actions;

    Compose(List<Action> actions) {
        Objects.requireNonNull(actions, "actions");
        for (Action action : actions) {
            Objects.requireNonNull(action, "actions contains null");
        }
        this.actions = List.copyOf(actions);
    }

    public List<Action> actions() {
        return actions;
    }

    @Override
    public ActionResult execute(Position position, List<Sensor> sensors) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(sensors, "sensors");

        Deque<Iterator<Action>> pending = new ArrayDeque<>();
        pending.push(actions.iterator());

        while (!pending.isEmpty()) {
            Iterator<Action> current = pending.peek();
            if (!current.hasNext()) {
                pending.pop();
                continue;
            }

            Action next = current.next();
            if (next instanceof Compose nested) {
                pending.push(nested.actions.iterator());
                continue;
            }

            ActionResult result = next.execute(position, sensors);
            if (!result.isSuccess()) {
                return result;
            }
        }
        return ActionResult.SUCCESS;
    }

    @Override
    public String toString() {
        return "Compose" + actions;
    }
}
