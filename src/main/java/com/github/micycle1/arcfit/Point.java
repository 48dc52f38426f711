package com.github.micycle1.arcfit;

/**
 * Immutable 2D point with finite coordinates.
 */
public final class Point {

	public final double x;
	public final double y;

	public Point(double x, double y) {
		if (!Double.isFinite(x) || !Double.isFinite(y)) {
			throw new IllegalArgumentException("Point coordinates must be finite: (" + x + ", " + y + ")");
		}
		// adding 0.0 turns -0.0 into 0.0, so coincident points compare equal
		this.x = x + 0.0;
		this.y = y + 0.0;
	}

	public double distance(Point other) {
		return Math.hypot(other.x - x, other.y - y);
	}

	// Angle of the vector from this point to other, in (-pi, pi]
	public double angleTo(Point other) {
		return Math.atan2(other.y - y, other.x - x);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Point)) {
			return false;
		}
		Point p = (Point) o;
		return Double.compare(x, p.x) == 0 && Double.compare(y, p.y) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(x) + Double.hashCode(y);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
