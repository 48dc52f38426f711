package com.github.micycle1.arcfit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Samples points along a circle, optionally perturbed, for testing and
 * demonstrating the fitter. The fitter itself never uses randomness; callers
 * pass in their own {@link Random}.
 */
public final class ArcPoints {

	private ArcPoints() {
	}

	/**
	 * {@code numPoints} points evenly spaced by angle (counter-clockwise from angle
	 * 0) around the circle, each coordinate moved by a uniform random offset in
	 * [-j, j) with {@code j = jitterRatio * circumference / numPoints}.
	 */
	public static PointSequence generate(Point center, double radius, int numPoints, double jitterRatio, Random rnd) {
		Objects.requireNonNull(center, "center must not be null");
		if (numPoints < 1) {
			throw new IllegalArgumentException("numPoints must be positive: " + numPoints);
		}
		if (!(radius >= 0) || Double.isInfinite(radius)) {
			throw new IllegalArgumentException("radius must be nonnegative and finite: " + radius);
		}
		if (!(jitterRatio >= 0) || Double.isInfinite(jitterRatio)) {
			throw new IllegalArgumentException("jitterRatio must be nonnegative and finite: " + jitterRatio);
		}
		if (rnd == null && jitterRatio > 0) {
			rnd = new Random();
		}

		double jitterSize = jitterRatio * 2 * Math.PI * radius / numPoints;
		double angleStep = 2 * Math.PI / numPoints;
		List<Point> points = new ArrayList<>(numPoints);
		for (int i = 0; i < numPoints; i++) {
			double angle = i * angleStep;
			double x = center.x + radius * Math.cos(angle) + jitter(rnd, jitterSize);
			double y = center.y + radius * Math.sin(angle) + jitter(rnd, jitterSize);
			points.add(new Point(x, y));
		}
		return PointSequence.of(points);
	}

	/** Unperturbed circle outline, e.g. to draw a fitted circle. */
	public static PointSequence circle(Point center, double radius, int numPoints) {
		return generate(center, radius, numPoints, 0, null);
	}

	/**
	 * Keeps the leading {@code floor(arcRatio * n)} points of a sampled circle,
	 * i.e. the arc covering that fraction of it.
	 */
	public static PointSequence arc(PointSequence circle, double arcRatio) {
		if (!(arcRatio > 0 && arcRatio <= 1)) {
			throw new IllegalArgumentException("arcRatio must be in (0, 1]: " + arcRatio);
		}
		return circle.head(arcCount(circle.size(), arcRatio));
	}

	/** Number of points kept by {@link #arc(PointSequence, double)}. */
	public static int arcCount(int numPoints, double arcRatio) {
		// nudge so that e.g. 0.3 * 50 gives 15 rather than 14
		return (int) Math.floor(arcRatio * numPoints + 1e-9);
	}

	private static double jitter(Random rnd, double jitterSize) {
		if (jitterSize == 0) {
			return 0;
		}
		return rnd.nextDouble() * 2 * jitterSize - jitterSize;
	}
}
