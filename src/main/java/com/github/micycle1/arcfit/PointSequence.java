package com.github.micycle1.arcfit;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, read-only sequence of points sampled along an arc.
 * <p>
 * Order matters: consecutive points (i, i+1) form the segments that the
 * scoring tactics work on, so a sequence of n points has n-1 segments.
 */
public final class PointSequence implements Iterable<Point> {

	private final List<Point> points;

	private PointSequence(List<Point> points) {
		this.points = points;
	}

	public static PointSequence of(List<Point> points) {
		Objects.requireNonNull(points, "points must not be null");
		return new PointSequence(List.copyOf(points));
	}

	public static PointSequence of(Point... points) {
		return of(List.of(points));
	}

	/**
	 * Builds a sequence from parallel coordinate arrays.
	 */
	public static PointSequence of(double[] xs, double[] ys) {
		Objects.requireNonNull(xs, "xs must not be null");
		Objects.requireNonNull(ys, "ys must not be null");
		if (xs.length != ys.length) {
			throw new IllegalArgumentException("Coordinate arrays differ in length: " + xs.length + " vs " + ys.length);
		}
		List<Point> list = new ArrayList<>(xs.length);
		for (int i = 0; i < xs.length; i++) {
			list.add(new Point(xs[i], ys[i]));
		}
		return new PointSequence(List.copyOf(list));
	}

	public int size() {
		return points.size();
	}

	public boolean isEmpty() {
		return points.isEmpty();
	}

	public Point get(int i) {
		return points.get(i);
	}

	public int segmentCount() {
		return Math.max(0, points.size() - 1);
	}

	public List<Point> asList() {
		return points;
	}

	/**
	 * The first {@code n} points, e.g. to keep only part of a sampled circle.
	 */
	public PointSequence head(int n) {
		if (n < 0 || n > points.size()) {
			throw new IllegalArgumentException("head(" + n + ") out of range for " + points.size() + " points");
		}
		return new PointSequence(points.subList(0, n));
	}

	/** Arithmetic mean of all point coordinates. */
	public Point centroid() {
		InsufficientPointsException.require(this, 1, "centroid");
		double sx = 0, sy = 0;
		for (Point p : points) {
			sx += p.x;
			sy += p.y;
		}
		return new Point(sx / points.size(), sy / points.size());
	}

	public double width() {
		InsufficientPointsException.require(this, 1, "bounding box");
		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		for (Point p : points) {
			min = Math.min(min, p.x);
			max = Math.max(max, p.x);
		}
		return max - min;
	}

	public double height() {
		InsufficientPointsException.require(this, 1, "bounding box");
		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		for (Point p : points) {
			min = Math.min(min, p.y);
			max = Math.max(max, p.y);
		}
		return max - min;
	}

	/** Larger side of the axis-aligned bounding box. */
	public double extent() {
		return Math.max(width(), height());
	}

	@Override
	public Iterator<Point> iterator() {
		return points.iterator();
	}

	@Override
	public String toString() {
		return "PointSequence" + points;
	}
}
