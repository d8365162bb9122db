package my.allocationengine.app.service.simulation;

import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.OutcomeState;

/**
 * Per-step transition probabilities for one candidate. {@code step} counts the steps already
 * elapsed in the trial, starting at zero. Implementations must be stateless and thread-safe: one
 * instance is shared read-only by every worker.
 */
public interface TransitionModel {
	double advanceProbability(OutcomeState state, Candidate candidate, int step);

	double lapseProbability(OutcomeState state, Candidate candidate, int step);

	static double clamp01(double value) {
		if (Double.isNaN(value) || value <= 0.0) {
			return 0.0;
		}
		return Math.min(1.0, value);
	}
}
