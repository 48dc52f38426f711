package com.github.micycle1.arcfit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

public class ArcFitterTest {

	private static final Point ORIGIN = new Point(0, 0);

	private static PointSequence circle(Point center, double radius, int n) {
		return ArcPoints.circle(center, radius, n);
	}

	@ParameterizedTest
	@EnumSource(Tactic.class)
	void fitsFullCircle(Tactic tactic) {
		Point c = new ArcFitter().fit(circle(ORIGIN, 10, 50), tactic);
		assertTrue(c.distance(ORIGIN) < 0.05, tactic + " -> " + c);
	}

	@ParameterizedTest
	@EnumSource(Tactic.class)
	void fitsOffsetCircle(Tactic tactic) {
		Point center = new Point(3, -2);
		Point c = new ArcFitter().fit(circle(center, 5, 40), tactic);
		assertTrue(c.distance(center) < 0.05, tactic + " -> " + c);
	}

	@Test
	void fitsPartialArcWithRadiusTactic() {
		PointSequence arc = circle(ORIGIN, 10, 50).head(15);
		Point c = new ArcFitter().fit(arc, Tactic.RADIUS);
		assertTrue(c.distance(ORIGIN) < 0.5, "30% arc -> " + c);
	}

	@ParameterizedTest
	@ValueSource(longs = { 1L, 42L, 2024L })
	void fitsJitteredCircle(long seed) {
		Point center = new Point(-4, 7);
		PointSequence pts = ArcPoints.generate(center, 10, 50, 0.05, new Random(seed));
		for (Tactic t : Tactic.values()) {
			Point c = new ArcFitter().fit(pts, t);
			assertTrue(c.distance(center) < 0.5, t + " seed " + seed + " -> " + c);
		}
	}

	@ParameterizedTest
	@ValueSource(doubles = { 0.5, 1, 10, 100, 1000 })
	void levelCountIsBounded(double radius) {
		PointSequence pts = ArcPoints.generate(new Point(1, 1), radius, 30, 0.02, new Random(7));
		double initialScanRange = pts.extent();
		int bound = (int) Math.ceil(Math.log(initialScanRange / ArcFitter.DEFAULT_MIN_SCAN_RANGE) / Math.log(2)) + 2;
		for (Tactic t : Tactic.values()) {
			FitResult r = new ArcFitter().fitResult(pts, t);
			assertTrue(r.iterations >= 2, t + " levels " + r.iterations);
			assertTrue(r.iterations <= bound, t + " levels " + r.iterations + " > " + bound);
			assertTrue(r.score >= 0);
		}
	}

	@Test
	void maxLevels() {
		ArcFitter fitter = new ArcFitter();
		assertEquals(13, fitter.maxLevels(20));
		assertEquals(4, fitter.maxLevels(0.005));
		fitter.setMinScanRange(1);
		assertEquals(7, fitter.maxLevels(20));
	}

	@Test
	void fitIsDeterministic() {
		PointSequence pts = ArcPoints.generate(new Point(2, 2), 8, 40, 0.1, new Random(99)).head(20);
		ArcFitter fitter = new ArcFitter();
		for (Tactic t : Tactic.values()) {
			FitResult a = fitter.fitResult(pts, t);
			FitResult b = fitter.fitResult(pts, t);
			assertEquals(a.center, b.center);
			assertEquals(a.score, b.score);
			assertEquals(a.iterations, b.iterations);
		}
	}

	@Test
	void fitAtTiesKeepFirstCandidate() {
		// one point: no segments, so every candidate scores 0
		PointSequence one = PointSequence.of(new Point(5, 5));
		FitResult r = new ArcFitter().fitAt(new Point(1, 2), 4, one, Tactic.RADIUS);
		assertEquals(new Point(-3, -2), r.center);
		assertEquals(0, r.score);
		assertEquals(1, r.iterations);
	}

	@Test
	void fitAtExcludesFarBoundary() {
		// true center sits exactly on the far edge of the scan square
		PointSequence pts = circle(new Point(10, 0), 10, 50);
		FitResult r = new ArcFitter().fitAt(ORIGIN, 10, pts, Tactic.RADIUS);
		assertEquals(5, r.center.x, 1e-12);
		assertEquals(0, r.center.y, 1e-12);
	}

	@Test
	void fitAtFindsCenterOnGrid() {
		FitResult r = new ArcFitter().fitAt(ORIGIN, 20, circle(ORIGIN, 10, 50), Tactic.ANGLE);
		assertEquals(0, r.center.x, 1e-12);
		assertEquals(0, r.center.y, 1e-12);
		assertEquals(0, r.score, 1e-9);
	}

	@Test
	void fitAtIsDeterministic() {
		PointSequence pts = ArcPoints.generate(ORIGIN, 10, 50, 0.2, new Random(3));
		ArcFitter fitter = new ArcFitter();
		FitResult a = fitter.fitAt(new Point(1, -1), 6, pts, Tactic.ANGLE);
		FitResult b = fitter.fitAt(new Point(1, -1), 6, pts, Tactic.ANGLE);
		assertEquals(a.center, b.center);
		assertEquals(a.score, b.score);
	}

	@Test
	void parallelMatchesSequential() {
		PointSequence pts = ArcPoints.generate(new Point(-3, 4), 6, 60, 0.1, new Random(11)).head(25);
		ArcFitter sequential = new ArcFitter();
		ArcFitter parallel = new ArcFitter();
		parallel.setParallel(true);
		for (Tactic t : Tactic.values()) {
			FitResult a = sequential.fitResult(pts, t);
			FitResult b = parallel.fitResult(pts, t);
			assertEquals(a.center, b.center, t.name());
			assertEquals(a.score, b.score, t.name());
		}
		PointSequence one = PointSequence.of(new Point(5, 5));
		assertEquals(new Point(-3, -2), parallel.fitAt(new Point(1, 2), 4, one, Tactic.RADIUS).center);
	}

	@Test
	void fitAtRejectsNonPositiveScanRange() {
		PointSequence pts = circle(ORIGIN, 1, 8);
		ArcFitter fitter = new ArcFitter();
		assertThrows(IllegalArgumentException.class, () -> fitter.fitAt(ORIGIN, 0, pts, Tactic.RADIUS));
		assertThrows(IllegalArgumentException.class, () -> fitter.fitAt(ORIGIN, -1, pts, Tactic.RADIUS));
		assertThrows(IllegalArgumentException.class, () -> fitter.fitAt(ORIGIN, Double.NaN, pts, Tactic.RADIUS));
	}

	@Test
	void insufficientPoints() {
		ArcFitter fitter = new ArcFitter();
		PointSequence empty = PointSequence.of();
		assertThrows(InsufficientPointsException.class, () -> fitter.fit(empty, Tactic.RADIUS));
		assertThrows(InsufficientPointsException.class, () -> fitter.fit(empty, Tactic.ANGLE));
		assertThrows(InsufficientPointsException.class, () -> fitter.averageRadius(ORIGIN, empty));
		assertThrows(InsufficientPointsException.class, () -> fitter.fit(PointSequence.of(new Point(1, 1)), Tactic.ANGLE));
	}

	@Test
	void coincidentPoints() {
		Point p = new Point(2.5, -1);
		PointSequence same = PointSequence.of(p, p, p);
		FitResult r = new ArcFitter().fitResult(same, Tactic.RADIUS);
		assertEquals(p, r.center);
		assertEquals(0, r.score);
		assertEquals(0, r.iterations);

		assertEquals(p, new ArcFitter().fit(PointSequence.of(p), Tactic.RADIUS));
		assertThrows(DegenerateSegmentException.class, () -> new ArcFitter().fit(same, Tactic.ANGLE));
	}

	@Test
	void signedZeroPointsCoincide() {
		PointSequence pair = PointSequence.of(new Point(0.0, 1), new Point(-0.0, 1));
		assertThrows(DegenerateSegmentException.class, () -> new ArcFitter().fitResult(pair, Tactic.ANGLE));
		assertEquals(new Point(0.0, -0.0), new Point(-0.0, 0.0));
	}

	@Test
	void averageRadiusOfFittedCircle() {
		ArcFitter fitter = new ArcFitter();
		PointSequence pts = circle(new Point(-6, 1), 4, 36);
		Point c = fitter.fit(pts, Tactic.RADIUS);
		assertEquals(4, fitter.averageRadius(c, pts), 0.05);
	}

	@Test
	void settingsAreValidated() {
		ArcFitter fitter = new ArcFitter();
		assertThrows(IllegalArgumentException.class, () -> fitter.setMinScanRange(0));
		assertThrows(IllegalArgumentException.class, () -> fitter.setScoreTolerance(-1));
		fitter.setScoreTolerance(0);
		assertEquals(0, fitter.getScoreTolerance());
	}
}
