package com.github.micycle1.arcfit.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.arcfit.ArcFitter;
import com.github.micycle1.arcfit.ArcPoints;
import com.github.micycle1.arcfit.DegenerateSegmentException;
import com.github.micycle1.arcfit.FitResult;
import com.github.micycle1.arcfit.InsufficientPointsException;
import com.github.micycle1.arcfit.Point;
import com.github.micycle1.arcfit.PointSequence;
import com.github.micycle1.arcfit.Tactic;
import com.github.micycle1.arcfit.render.SvgPlot;

/**
 * Command line demo: samples a jittered arc of a circle with a random center,
 * fits a center to it and optionally writes an SVG comparing the two.
 *
 * <pre>
 * arcfit [NUMBER_OF_POINTS_IN_CIRCLE] [RATIO_OF_POINTS_USED] [RATIO_OF_JITTER] [RADIUS|ANGLE] [SVG_OUTPUT]
 * </pre>
 */
public final class ArcFitCli {

	private static final Logger LOGGER = LoggerFactory.getLogger(ArcFitCli.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 2;
	public static final int EXIT_INSUFFICIENT_POINTS = 3;
	public static final int EXIT_DEGENERATE_SEGMENT = 4;
	public static final int EXIT_IO = 5;

	static final int DEFAULT_NUM_POINTS = 50;
	static final double DEFAULT_ARC_RATIO = 0.3;
	static final double DEFAULT_JITTER_RATIO = 0.05;
	static final Tactic DEFAULT_TACTIC = Tactic.RADIUS;
	static final double RADIUS = 10;

	private ArcFitCli() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err, new Random()));
	}

	/**
	 * Runs the demo and returns the process exit code.
	 */
	public static int run(String[] args, PrintStream out, PrintStream err, Random rnd) {
		Options opts;
		try {
			opts = Options.parse(args);
		} catch (UsageException e) {
			err.println(e.getMessage());
			usage(err);
			return EXIT_USAGE;
		}

		int usePoints = ArcPoints.arcCount(opts.numPoints, opts.arcRatio);
		Point startCenter = new Point(rnd.nextDouble() * 2 * RADIUS - RADIUS, rnd.nextDouble() * 2 * RADIUS - RADIUS);

		out.println("Using " + opts.tactic.name() + " to determine best fit.");
		out.println("Number of points in generated circle: " + opts.numPoints);
		out.println("Ratio of circle to use: " + opts.arcRatio + " ie: " + usePoints + " points");
		out.println("Ratio of distance between points to perturb coordinates by: " + opts.jitterRatio);
		out.println("Radius of generated circle: " + RADIUS);
		out.println("Center of generated circle: " + startCenter);
		out.println();

		PointSequence points = ArcPoints.arc(ArcPoints.generate(startCenter, RADIUS, opts.numPoints, opts.jitterRatio, rnd), opts.arcRatio);

		ArcFitter fitter = new ArcFitter();
		FitResult result;
		double radius;
		try {
			result = fitter.fitResult(points, opts.tactic);
			radius = fitter.averageRadius(result.center, points);
		} catch (InsufficientPointsException e) {
			err.println("Cannot fit: " + e.getMessage());
			return EXIT_INSUFFICIENT_POINTS;
		} catch (DegenerateSegmentException e) {
			err.println("Cannot fit: " + e.getMessage());
			return EXIT_DEGENERATE_SEGMENT;
		}

		out.println("Calculated center: " + result.center);
		out.println("Calculated radius: " + radius);
		out.println("Residual score: " + result.score + " after " + result.iterations + " levels");

		if (opts.svgOutput != null) {
			String svg = new SvgPlot(points).generated(startCenter, RADIUS).fitted(result.center, radius).render();
			try {
				Files.writeString(opts.svgOutput, svg, StandardCharsets.UTF_8);
			} catch (IOException e) {
				LOGGER.debug("Failed to write SVG to {}", opts.svgOutput, e);
				err.println("Could not write " + opts.svgOutput + ": " + e.getMessage());
				return EXIT_IO;
			}
			out.println("SVG written to: " + opts.svgOutput);
		}
		return EXIT_OK;
	}

	static void usage(PrintStream err) {
		err.println();
		err.println("Usage:");
		err.println(" arcfit [NUMBER_OF_POINTS_IN_CIRCLE] [RATIO_OF_POINTS_USED] [RATIO_OF_JITTER] [RADIUS/ANGLE] [SVG_OUTPUT]");
	}

	static final class UsageException extends Exception {
		private static final long serialVersionUID = 1L;

		UsageException(String message) {
			super(message);
		}
	}

	static final class Options {
		int numPoints = DEFAULT_NUM_POINTS;
		double arcRatio = DEFAULT_ARC_RATIO;
		double jitterRatio = DEFAULT_JITTER_RATIO;
		Tactic tactic = DEFAULT_TACTIC;
		Path svgOutput;

		static Options parse(String[] args) throws UsageException {
			Options o = new Options();
			if (args.length > 5) {
				throw new UsageException("Too many arguments.");
			}
			if (args.length > 0) {
				String s = args[0].trim();
				try {
					o.numPoints = Integer.parseInt(s);
				} catch (NumberFormatException e) {
					throw invalid(s, "Should be a positive integer.");
				}
				if (o.numPoints < 1) {
					throw invalid(s, "Should be a positive integer.");
				}
			}
			if (args.length > 1) {
				o.arcRatio = parseRatio(args[1].trim());
			}
			if (args.length > 2) {
				o.jitterRatio = parseRatio(args[2].trim());
			}
			if (args.length > 3) {
				String t = args[3].trim().toUpperCase(Locale.ROOT);
				try {
					o.tactic = Tactic.valueOf(t);
				} catch (IllegalArgumentException e) {
					throw invalid(args[3].trim(), "Should be one of " + Arrays.toString(Tactic.values()));
				}
			}
			if (args.length > 4) {
				o.svgOutput = Path.of(args[4].trim());
			}
			return o;
		}

		private static double parseRatio(String s) throws UsageException {
			double v;
			try {
				v = Double.parseDouble(s);
			} catch (NumberFormatException e) {
				throw invalid(s, "Should be a number between 0 and 1.");
			}
			if (!(v > 0 && v <= 1)) {
				throw invalid(s, "Should be a number between 0 and 1.");
			}
			return v;
		}

		private static UsageException invalid(String arg, String hint) {
			return new UsageException("Invalid parameter: " + arg + System.lineSeparator() + hint);
		}
	}
}
