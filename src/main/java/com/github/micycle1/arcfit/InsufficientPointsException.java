package com.github.micycle1.arcfit;

/**
 * Thrown when a point sequence is too short for the requested operation (e.g.
 * fewer than two points for the ANGLE tactic, or an empty sequence for a
 * centroid or average radius).
 */
public class InsufficientPointsException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int required;
	private final int actual;

	public InsufficientPointsException(String operation, int required, int actual) {
		super(operation + " requires at least " + required + " point(s) but got " + actual);
		this.required = required;
		this.actual = actual;
	}

	public static void require(PointSequence points, int required, String operation) {
		if (points.size() < required) {
			throw new InsufficientPointsException(operation, required, points.size());
		}
	}

	public int getRequired() {
		return required;
	}

	public int getActual() {
		return actual;
	}
}
