package com.github.micycle1.arcfit.geometry;

/**
 * Angle arithmetic helpers. All angles are in radians.
 */
public final class Angles {

	private Angles() {
	}

	/** Wraps an angle into [-pi, pi]. */
	public static double wrap(double a) {
		return Math.IEEEremainder(a, 2.0 * Math.PI);
	}

	/**
	 * Smallest difference between two lines through the origin with directions a
	 * and b, ignoring which way along the line each points. Result is in [0, pi/2].
	 */
	public static double lineDifference(double a, double b) {
		return Math.abs(Math.IEEEremainder(a - b, Math.PI));
	}
}
