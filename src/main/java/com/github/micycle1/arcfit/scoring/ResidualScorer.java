package com.github.micycle1.arcfit.scoring;

import com.github.micycle1.arcfit.Point;
import com.github.micycle1.arcfit.PointSequence;

/**
 * <p>
 * Residual measure of how well a candidate circle center explains an ordered
 * point sequence. Implementations return a nonnegative score; the true center
 * of points sampled from a circle minimizes it, and lower is strictly better.
 * </p>
 * <p>
 * {@link #validate(PointSequence)} checks the preconditions that
 * {@link #score(Point, PointSequence)} relies on, so a search over many
 * candidates can fail before doing any floating-point work.
 * </p>
 */
public interface ResidualScorer {

	double score(Point candidate, PointSequence points);

	/** Fewest points this scorer accepts. */
	int minimumPoints();

	/**
	 * @throws com.github.micycle1.arcfit.InsufficientPointsException if there are
	 *                                                                too few points
	 */
	void validate(PointSequence points);
}
