/**
 * Rover Actions
 * =============================================================================
 *
 * <p>The programmable command family. An action receives the rover's working
 * {@link com.questrail.rover.api.Position} and the rover's sensors, and either
 * applies every one of its steps or stops at the first step a sensor refuses.</p>
 *
 * <pre>
 *   Action
 *     ├── Rotation  (RotateLeft, RotateRight)   never fails
 *     ├── Move      (MoveForward, MoveBackward) compute, validate, commit
 *     └── Compose   ordered children, fail fast
 * </pre>
 *
 * <p>Refusals are values ({@link com.questrail.rover.action.ActionResult.DangerousField}),
 * not exceptions. The rover turns them into its stopped flag.</p>
 */
package com.questrail.rover.action;
