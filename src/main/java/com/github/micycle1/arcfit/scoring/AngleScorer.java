package com.github.micycle1.arcfit.scoring;

import com.github.micycle1.arcfit.DegenerateSegmentException;
import com.github.micycle1.arcfit.InsufficientPointsException;
import com.github.micycle1.arcfit.Point;
import com.github.micycle1.arcfit.PointSequence;
import com.github.micycle1.arcfit.geometry.Angles;
import com.github.micycle1.arcfit.geometry.SegmentNormal;
import com.github.micycle1.arcfit.geometry.Segments;

/**
 * Scores a candidate center by how far each segment's normal deviates from the
 * line joining the segment midpoint to the candidate. For a chord of a circle
 * the normal through its midpoint passes exactly through the center.
 * <p>
 * Normals and midpoint-to-candidate directions are compared as undirected
 * lines (modulo pi), so the score does not depend on whether the points run
 * clockwise or counter-clockwise. The score is the mean deviation, in radians,
 * in [0, pi/2].
 */
public final class AngleScorer implements ResidualScorer {

	@Override
	public double score(Point candidate, PointSequence points) {
		validate(points);
		int segments = points.segmentCount();
		double sum = 0;
		for (int i = 0; i < segments; i++) {
			SegmentNormal sn = Segments.normal(points.get(i), points.get(i + 1));
			double toCenter = sn.midpoint.angleTo(candidate);
			sum += Angles.lineDifference(toCenter, sn.angle);
		}
		return sum / segments;
	}

	@Override
	public int minimumPoints() {
		return 2;
	}

	@Override
	public void validate(PointSequence points) {
		InsufficientPointsException.require(points, minimumPoints(), "ANGLE tactic");
		for (int i = 0; i + 1 < points.size(); i++) {
			if (points.get(i).equals(points.get(i + 1))) {
				throw new DegenerateSegmentException("Consecutive points coincide at " + points.get(i), i);
			}
		}
	}
}
