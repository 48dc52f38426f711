package com.github.micycle1.arcfit;

import java.util.Objects;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.arcfit.scoring.RadiusScorer;
import com.github.micycle1.arcfit.scoring.ResidualScorer;

/**
 * <p>
 * Estimates the center of a circle from an ordered sequence of points sampled
 * along (part of) it, by exhaustive coarse-to-fine grid search.
 * </p>
 *
 * <p>
 * What:
 * </p>
 * <ul>
 * <li>{@link #fitAt(Point, double, PointSequence, Tactic)} scans one resolution
 * level: a 4x4 grid of candidate centers around a hint, spaced half the scan
 * range apart, each scored by the {@link Tactic}'s residual scorer.</li>
 * <li>{@link #fit(PointSequence, Tactic)} starts from the centroid with a scan
 * range equal to the larger side of the points' bounding box, then repeatedly
 * re-centers on the best candidate and halves the range until the score stops
 * improving and the range is small.</li>
 * </ul>
 *
 * <p>
 * Key usage pattern:
 * </p>
 * <ol>
 * <li>Construct (defaults suit unit-scale to moderately large inputs).</li>
 * <li>Optionally tune {@link #setScoreTolerance(double)},
 * {@link #setMinScanRange(double)} or {@link #setParallel(boolean)}.</li>
 * <li>Call {@link #fit(PointSequence, Tactic)}, or
 * {@link #fitResult(PointSequence, Tactic)} for the score and level count
 * too.</li>
 * </ol>
 *
 * <p>
 * Important assumptions & notes:
 * </p>
 * <ul>
 * <li>This is a local zoom search: it can settle in a local minimum if the
 * residual surface is flat or the grid straddles the optimum. There is no
 * restart strategy.</li>
 * <li>The candidate grid excludes its far boundary: candidates are
 * {@code hint - range + i * range / 2} for i = 0..3 on each axis. The hint
 * itself is always a candidate, so scores never get worse from one level to the
 * next.</li>
 * <li>Candidates are enumerated by increasing x, then increasing y; the first
 * one found wins a tie. Parallel scoring keeps this order.</li>
 * <li>Results are deterministic. Input points are never modified. Once
 * configured, an instance can be shared between threads.</li>
 * </ul>
 */
public class ArcFitter {

	private static final Logger LOGGER = LoggerFactory.getLogger(ArcFitter.class);

	/** Candidates per grid axis. */
	public static final int GRID_SIZE = 4;

	public static final double DEFAULT_SCORE_TOLERANCE = 1e-4;
	public static final double DEFAULT_MIN_SCAN_RANGE = 0.01;

	// Levels allowed beyond the halving count before the plateau check gives up
	private static final int EXTRA_LEVELS = 2;

	private double scoreTolerance = DEFAULT_SCORE_TOLERANCE;
	private double minScanRange = DEFAULT_MIN_SCAN_RANGE;
	private boolean parallel = false;

	public ArcFitter() {
	}

	/**
	 * Returns the estimated circle center of {@code points}.
	 *
	 * @throws InsufficientPointsException if there are fewer points than the
	 *                                     tactic needs
	 * @throws DegenerateSegmentException  if the tactic needs segment normals and
	 *                                     two consecutive points coincide
	 */
	public Point fit(PointSequence points, Tactic tactic) {
		return fitResult(points, tactic).center;
	}

	/**
	 * As {@link #fit(PointSequence, Tactic)}, also reporting the final score and
	 * how many grid levels were searched.
	 */
	public FitResult fitResult(PointSequence points, Tactic tactic) {
		Objects.requireNonNull(points, "points must not be null");
		Objects.requireNonNull(tactic, "tactic must not be null");
		tactic.scorer().validate(points);

		Point centerHint = points.centroid();
		double scanRange = points.extent();
		if (scanRange == 0.0) {
			// every point coincides: the centroid is an exact fit
			LOGGER.debug("Points have zero extent; returning centroid {}", centerHint);
			return new FitResult(centerHint, 0.0, 0);
		}

		final int maxLevels = maxLevels(scanRange);
		LOGGER.debug("fit start: tactic={} hint={} scanRange={} maxLevels={}", tactic, centerHint, scanRange, maxLevels);

		Double score = null;
		Double lastScore = null;
		int level = 0;
		while (score == null || lastScore == null || lastScore - score > scoreTolerance || scanRange > minScanRange) {
			if (level == maxLevels) {
				LOGGER.debug("fit stopped after {} levels before the score settled (last improvement {})", level, lastScore - score);
				break;
			}
			lastScore = score;
			FitResult r = fitAt(centerHint, scanRange, points, tactic);
			centerHint = r.center;
			score = r.score;
			scanRange /= 2;
			level++;
			LOGGER.debug("level {}: center={} score={} next scanRange={}", level, centerHint, score, scanRange);
		}

		return new FitResult(centerHint, score, level);
	}

	/**
	 * Scans one resolution level: scores the 4x4 grid of candidate centers
	 * {@code centerHint - scanRange + i * scanRange / 2} (i = 0..3 per axis) and
	 * returns the best. Ties keep the candidate found first in increasing-x then
	 * increasing-y order.
	 *
	 * @param scanRange half-width of the candidate square; must be positive
	 */
	public FitResult fitAt(Point centerHint, double scanRange, PointSequence points, Tactic tactic) {
		Objects.requireNonNull(centerHint, "centerHint must not be null");
		Objects.requireNonNull(points, "points must not be null");
		Objects.requireNonNull(tactic, "tactic must not be null");
		if (!(scanRange > 0) || Double.isInfinite(scanRange)) {
			throw new IllegalArgumentException("scanRange must be positive and finite: " + scanRange);
		}
		ResidualScorer scorer = tactic.scorer();
		scorer.validate(points);

		final double step = scanRange / 2;
		final double x0 = centerHint.x - scanRange;
		final double y0 = centerHint.y - scanRange;

		IntStream candidates = IntStream.range(0, GRID_SIZE * GRID_SIZE);
		if (parallel) {
			candidates = candidates.parallel();
		}
		// index = ix * GRID_SIZE + iy gives x-major enumeration order; the ordered
		// reduction keeps the lower index on equal scores
		return candidates.mapToObj(i -> {
			Point c = new Point(x0 + (i / GRID_SIZE) * step, y0 + (i % GRID_SIZE) * step);
			return new FitResult(c, scorer.score(c, points), 1);
		}).reduce((a, b) -> b.score < a.score ? b : a).orElseThrow();
	}

	/**
	 * Mean distance from {@code center} to every point; with a fitted center this
	 * is the radius of the fitted circle.
	 */
	public double averageRadius(Point center, PointSequence points) {
		return RadiusScorer.averageRadius(center, points);
	}

	/**
	 * Upper bound on grid levels for a search starting at {@code initialScanRange}:
	 * the halvings needed to reach the minimum scan range (at least two, so that
	 * an improvement can be measured) plus two for the score plateau check.
	 */
	int maxLevels(double initialScanRange) {
		int halvings = 0;
		for (double r = initialScanRange; r > minScanRange; r /= 2) {
			halvings++;
		}
		return Math.max(2, halvings) + EXTRA_LEVELS;
	}

	public double getScoreTolerance() {
		return scoreTolerance;
	}

	/**
	 * Largest score improvement between consecutive levels that still counts as
	 * settled.
	 */
	public void setScoreTolerance(double scoreTolerance) {
		if (!(scoreTolerance >= 0) || Double.isInfinite(scoreTolerance)) {
			throw new IllegalArgumentException("scoreTolerance must be nonnegative and finite: " + scoreTolerance);
		}
		this.scoreTolerance = scoreTolerance;
	}

	public double getMinScanRange() {
		return minScanRange;
	}

	/** Scan range below which the search may stop. */
	public void setMinScanRange(double minScanRange) {
		if (!(minScanRange > 0) || Double.isInfinite(minScanRange)) {
			throw new IllegalArgumentException("minScanRange must be positive and finite: " + minScanRange);
		}
		this.minScanRange = minScanRange;
	}

	public boolean isParallel() {
		return parallel;
	}

	/** Score the candidates of each level in parallel. */
	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}
}
