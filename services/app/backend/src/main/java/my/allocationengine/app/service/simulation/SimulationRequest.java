package my.allocationengine.app.service.simulation;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Parameters of one simulation run. A {@code null} seed draws fresh entropy; a {@code null} time
 * budget runs every trial.
 */
public record SimulationRequest(int trials,
								int horizon,
								TransitionModel model,
								PayoffSchedule payoffs,
								TimeDecay decay,
								Long seed,
								List<Double> percentiles,
								Duration timeBudget) {
	public static final List<Double> DEFAULT_PERCENTILES = List.of(5.0, 25.0, 50.0, 75.0, 95.0);

	public SimulationRequest {
		if (trials < 1) {
			throw new IllegalArgumentException("At least one trial is required");
		}
		if (horizon < 1) {
			throw new IllegalArgumentException("Horizon must be at least one step");
		}
		Objects.requireNonNull(model, "model");
		payoffs = payoffs == null ? PayoffSchedule.DEFAULT : payoffs;
		decay = decay == null ? TimeDecay.NONE : decay;
		percentiles = percentiles == null ? DEFAULT_PERCENTILES : List.copyOf(percentiles);
		for (Double p : percentiles) {
			if (p == null || !(p > 0.0 && p <= 100.0)) {
				throw new IllegalArgumentException("Percentiles must lie in (0, 100], got " + p);
			}
		}
		if (timeBudget != null && (timeBudget.isNegative() || timeBudget.isZero())) {
			throw new IllegalArgumentException("Time budget must be positive");
		}
	}

	public static SimulationRequest of(int trials, int horizon, TransitionModel model, Long seed) {
		return new SimulationRequest(trials, horizon, model, null, null, seed, null, null);
	}

	public SimulationRequest withSeed(Long seed) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}

	public SimulationRequest withTrials(int trials) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}

	public SimulationRequest withModel(TransitionModel model) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}

	public SimulationRequest withPayoffs(PayoffSchedule payoffs) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}

	public SimulationRequest withDecay(TimeDecay decay) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}

	public SimulationRequest withTimeBudget(Duration timeBudget) {
		return new SimulationRequest(trials, horizon, model, payoffs, decay, seed, percentiles, timeBudget);
	}
}
