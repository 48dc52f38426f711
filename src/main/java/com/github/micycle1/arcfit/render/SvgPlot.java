package com.github.micycle1.arcfit.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.github.micycle1.arcfit.ArcPoints;
import com.github.micycle1.arcfit.Point;
import com.github.micycle1.arcfit.PointSequence;
import com.github.micycle1.arcfit.geometry.SegmentNormal;
import com.github.micycle1.arcfit.geometry.Segments;

/**
 * Renders fitting input and output as a standalone SVG document: the sampled
 * points as a polyline, the normal of each segment, and the generated and
 * fitted circles with their centers. Y is flipped so that +y points up.
 */
public final class SvgPlot {

	private static final int CIRCLE_SAMPLES = 90;
	private static final double MARGIN_RATIO = 0.1;

	private static final String INPUT_COLOR = "black";
	private static final String FITTED_COLOR = "red";
	private static final String NORMAL_COLOR = "#1f77b4";

	private final PointSequence points;
	private final List<Circle> circles = new ArrayList<>();
	private boolean drawNormals = true;

	public SvgPlot(PointSequence points) {
		this.points = Objects.requireNonNull(points, "points must not be null");
	}

	/** Adds the circle the points were generated from. */
	public SvgPlot generated(Point center, double radius) {
		circles.add(new Circle(center, radius, INPUT_COLOR, 5));
		return this;
	}

	/** Adds the fitted circle. */
	public SvgPlot fitted(Point center, double radius) {
		circles.add(new Circle(center, radius, FITTED_COLOR, 3));
		return this;
	}

	public SvgPlot drawNormals(boolean drawNormals) {
		this.drawNormals = drawNormals;
		return this;
	}

	public String render() {
		double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY;
		double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
		for (Point p : points) {
			minX = Math.min(minX, p.x);
			maxX = Math.max(maxX, p.x);
			minY = Math.min(minY, p.y);
			maxY = Math.max(maxY, p.y);
		}
		for (Circle c : circles) {
			minX = Math.min(minX, c.center.x - c.radius);
			maxX = Math.max(maxX, c.center.x + c.radius);
			minY = Math.min(minY, c.center.y - c.radius);
			maxY = Math.max(maxY, c.center.y + c.radius);
		}
		if (minX > maxX) { // nothing to draw
			minX = minY = -1;
			maxX = maxY = 1;
		}
		double w = Math.max(maxX - minX, 1e-9), h = Math.max(maxY - minY, 1e-9);
		double margin = MARGIN_RATIO * Math.max(w, h);
		minX -= margin;
		minY -= margin;
		w += 2 * margin;
		h += 2 * margin;
		double stroke = Math.max(w, h) / 400;

		StringBuilder sb = new StringBuilder();
		sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
		sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"800\" height=\"").append(fmt(800 * h / w))
				.append("\" viewBox=\"").append(fmt(minX)).append(' ').append(fmt(minY)).append(' ').append(fmt(w)).append(' ')
				.append(fmt(h)).append("\">\n");
		sb.append("  <rect x=\"").append(fmt(minX)).append("\" y=\"").append(fmt(minY)).append("\" width=\"").append(fmt(w))
				.append("\" height=\"").append(fmt(h)).append("\" fill=\"white\"/>\n");

		// flip y about the middle of the view box
		sb.append("  <g transform=\"translate(0,").append(fmt(2 * minY + h)).append(") scale(1,-1)\">\n");

		if (drawNormals) {
			for (int i = 0; i < points.segmentCount(); i++) {
				Point p0 = points.get(i), p1 = points.get(i + 1);
				if (p0.equals(p1)) {
					continue;
				}
				SegmentNormal sn = Segments.normal(p0, p1);
				double len = p0.distance(p1);
				double ex = sn.midpoint.x + len * Math.cos(sn.angle);
				double ey = sn.midpoint.y + len * Math.sin(sn.angle);
				sb.append("    <line x1=\"").append(fmt(sn.midpoint.x)).append("\" y1=\"").append(fmt(sn.midpoint.y)).append("\" x2=\"")
						.append(fmt(ex)).append("\" y2=\"").append(fmt(ey)).append("\" stroke=\"").append(NORMAL_COLOR)
						.append("\" stroke-width=\"").append(fmt(stroke)).append("\" stroke-dasharray=\"").append(fmt(2 * stroke))
						.append("\"/>\n");
			}
		}

		for (Circle c : circles) {
			appendPolyline(sb, ArcPoints.circle(c.center, c.radius, CIRCLE_SAMPLES), c.color, stroke, true);
		}
		appendPolyline(sb, points, INPUT_COLOR, 2 * stroke, false);
		for (Circle c : circles) {
			sb.append("    <circle cx=\"").append(fmt(c.center.x)).append("\" cy=\"").append(fmt(c.center.y)).append("\" r=\"")
					.append(fmt(c.markerSize * stroke)).append("\" fill=\"").append(c.color).append("\"/>\n");
		}

		sb.append("  </g>\n</svg>\n");
		return sb.toString();
	}

	private static void appendPolyline(StringBuilder sb, PointSequence pts, String color, double width, boolean closed) {
		if (pts.isEmpty()) {
			return;
		}
		sb.append("    <").append(closed ? "polygon" : "polyline").append(" points=\"");
		for (int i = 0; i < pts.size(); i++) {
			if (i > 0) {
				sb.append(' ');
			}
			sb.append(fmt(pts.get(i).x)).append(',').append(fmt(pts.get(i).y));
		}
		sb.append("\" fill=\"none\" stroke=\"").append(color).append("\" stroke-width=\"").append(fmt(width)).append("\"/>\n");
	}

	private static String fmt(double v) {
		return String.format(Locale.ROOT, "%.6f", v);
	}

	private static final class Circle {
		final Point center;
		final double radius;
		final String color;
		final double markerSize;

		Circle(Point center, double radius, String color, double markerSize) {
			this.center = Objects.requireNonNull(center, "center must not be null");
			this.radius = radius;
			this.color = color;
			this.markerSize = markerSize;
		}
	}
}
