package my.allocationengine.app.service.simulation;

public record TimeDecay(double halfLife) {
	public static final TimeDecay NONE = new TimeDecay(Double.POSITIVE_INFINITY);

	public TimeDecay {
		if (Double.isNaN(halfLife) || halfLife <= 0.0) {
			throw new IllegalArgumentException("Half-life must be positive, got " + halfLife);
		}
	}

	public static TimeDecay ofHalfLife(Double halfLife) {
		return halfLife == null ? NONE : new TimeDecay(halfLife);
	}

	public boolean isNone() {
		return Double.isInfinite(halfLife);
	}

	public double factor(int steps) {
		if (isNone() || steps <= 0) {
			return 1.0;
		}
		return Math.pow(0.5, steps / halfLife);
	}
}
