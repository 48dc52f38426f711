package com.github.micycle1.arcfit.geometry;

import com.github.micycle1.arcfit.Point;

/**
 * Midpoint of a segment and the angle of its normal, (-pi, pi].
 */
public final class SegmentNormal {

	public final Point midpoint;
	public final double angle;

	SegmentNormal(Point midpoint, double angle) {
		this.midpoint = midpoint;
		this.angle = angle;
	}

	@Override
	public String toString() {
		return "SegmentNormal{midpoint=" + midpoint + ", angle=" + angle + "}";
	}
}
