package com.github.micycle1.arcfit;

/**
 * Thrown when a segment between two consecutive points has no defined
 * direction, so its normal cannot be computed.
 */
public class DegenerateSegmentException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int index;

	public DegenerateSegmentException(String message) {
		this(message, -1);
	}

	/**
	 * @param index index of the segment's first point in its sequence, or -1 if
	 *              unknown
	 */
	public DegenerateSegmentException(String message, int index) {
		super(index < 0 ? message : message + " (segment " + index + ")");
		this.index = index;
	}

	public int getIndex() {
		return index;
	}
}
