package com.github.micycle1.arcfit;

import java.util.Objects;

/**
 * Best center estimate with its residual score. Lower scores are better; zero
 * is a perfect geometric fit.
 */
public final class FitResult {

	public final Point center;
	public final double score;
	public final int iterations; // grid levels searched to produce this result

	public FitResult(Point center, double score, int iterations) {
		this.center = Objects.requireNonNull(center, "center must not be null");
		this.score = score;
		this.iterations = iterations;
	}

	@Override
	public String toString() {
		return "FitResult{center=" + center + ", score=" + score + ", iterations=" + iterations + "}";
	}
}
