package com.github.micycle1.arcfit.geometry;

import com.github.micycle1.arcfit.DegenerateSegmentException;
import com.github.micycle1.arcfit.Point;

/**
 * Geometry of the segment joining two consecutive points.
 */
public final class Segments {

	// Tolerance on the right angle between a segment and its normal
	private static final double RIGHT_ANGLE_TOL = 1e-9;

	private Segments() {
	}

	/**
	 * Midpoint of p0-p1 and the angle of the segment normal.
	 * <p>
	 * The normal is the direction vector v = p1 - p0 rotated a quarter turn
	 * counter-clockwise, (-v.y, v.x). For points running counter-clockwise around
	 * a circle it therefore points toward the circle's center. Both angles use
	 * {@link Math#atan2(double, double)} so vertical and horizontal segments are
	 * handled.
	 *
	 * @throws DegenerateSegmentException if p0 equals p1
	 */
	public static SegmentNormal normal(Point p0, Point p1) {
		double vx = p1.x - p0.x;
		double vy = p1.y - p0.y;
		if (vx == 0.0 && vy == 0.0) {
			throw new DegenerateSegmentException("Zero-length segment at " + p0);
		}

		Point mid = midpoint(p0, p1);
		double angle = Math.atan2(vy, vx);
		double normalAngle = Math.atan2(vx, -vy);

		if (!(Math.abs(Math.abs(Angles.wrap(normalAngle - angle)) - Math.PI / 2) < RIGHT_ANGLE_TOL)) {
			throw new DegenerateSegmentException("Normal of " + p0 + " -> " + p1 + " is not perpendicular to it");
		}
		return new SegmentNormal(mid, normalAngle);
	}

	public static Point midpoint(Point p0, Point p1) {
		return new Point((p0.x + p1.x) / 2, (p0.y + p1.y) / 2);
	}
}
