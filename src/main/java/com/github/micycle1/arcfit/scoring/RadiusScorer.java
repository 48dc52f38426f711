package com.github.micycle1.arcfit.scoring;

import com.github.micycle1.arcfit.InsufficientPointsException;
import com.github.micycle1.arcfit.Point;
import com.github.micycle1.arcfit.PointSequence;
import com.github.micycle1.arcfit.geometry.Segments;

/**
 * Scores a candidate center by the mean absolute difference between each
 * segment midpoint's distance to the candidate and the average distance from
 * the candidate to all points.
 */
public final class RadiusScorer implements ResidualScorer {

	/**
	 * Mean Euclidean distance from {@code center} to every point.
	 *
	 * @throws InsufficientPointsException if {@code points} is empty
	 */
	public static double averageRadius(Point center, PointSequence points) {
		InsufficientPointsException.require(points, 1, "average radius");
		double total = 0;
		for (Point p : points) {
			total += center.distance(p);
		}
		return total / points.size();
	}

	@Override
	public double score(Point candidate, PointSequence points) {
		validate(points);
		return score(candidate, points, averageRadius(candidate, points));
	}

	/**
	 * Scores against an already computed average radius. A single point has no
	 * segments and scores 0.
	 */
	public double score(Point candidate, PointSequence points, double avgRadius) {
		validate(points);
		int segments = points.segmentCount();
		if (segments == 0) {
			return 0.0;
		}
		double sum = 0;
		for (int i = 0; i < segments; i++) {
			Point mid = Segments.midpoint(points.get(i), points.get(i + 1));
			sum += Math.abs(mid.distance(candidate) - avgRadius);
		}
		return sum / segments;
	}

	@Override
	public int minimumPoints() {
		return 1;
	}

	@Override
	public void validate(PointSequence points) {
		InsufficientPointsException.require(points, minimumPoints(), "RADIUS tactic");
	}
}
