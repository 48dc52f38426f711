package com.github.micycle1.arcfit;

import com.github.micycle1.arcfit.scoring.AngleScorer;
import com.github.micycle1.arcfit.scoring.RadiusScorer;
import com.github.micycle1.arcfit.scoring.ResidualScorer;

/**
 * Residual scoring strategy used to judge how well a candidate center fits the
 * observed points.
 */
public enum Tactic {

	/**
	 * Compare each segment's normal with the direction from the segment midpoint
	 * toward the candidate center.
	 */
	ANGLE(new AngleScorer()),

	/**
	 * Compare the distance from each segment midpoint to the candidate center with
	 * the average point-to-center distance.
	 */
	RADIUS(new RadiusScorer());

	private final ResidualScorer scorer;

	Tactic(ResidualScorer scorer) {
		this.scorer = scorer;
	}

	public ResidualScorer scorer() {
		return scorer;
	}
}
