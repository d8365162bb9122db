package my.allocationengine.app.service.simulation;

import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.OutcomeState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class StrategyAdjustedTransitionModel implements TransitionModel {
	public static final double DEFAULT_CAP = 0.99;

	private final TransitionModel base;
	private final Map<OutcomeState, Double> multipliers;
	private final double cap;

	public StrategyAdjustedTransitionModel(TransitionModel base, Map<OutcomeState, Double> multipliers, double cap) {
		this.base = Objects.requireNonNull(base, "base");
		EnumMap<OutcomeState, Double> copy = new EnumMap<>(OutcomeState.class);
		if (multipliers != null) {
			for (Map.Entry<OutcomeState, Double> entry : multipliers.entrySet()) {
				Double multiplier = entry.getValue();
				if (multiplier == null || !Double.isFinite(multiplier) || multiplier < 0.0) {
					throw new IllegalArgumentException("Multiplier for " + entry.getKey() + " must be a non-negative number");
				}
				copy.put(entry.getKey(), multiplier);
			}
		}
		this.multipliers = copy;
		if (!(cap > 0.0 && cap <= 1.0)) {
			throw new IllegalArgumentException("Cap must lie in (0, 1]");
		}
		this.cap = cap;
	}

	public static StrategyAdjustedTransitionModel of(TransitionModel base, Map<OutcomeState, Double> multipliers) {
		return new StrategyAdjustedTransitionModel(base, multipliers, DEFAULT_CAP);
	}

	@Override
	public double advanceProbability(OutcomeState state, Candidate candidate, int step) {
		double probability = base.advanceProbability(state, candidate, step);
		Double multiplier = multipliers.get(state);
		if (multiplier == null) {
			return probability;
		}
		double adjusted = probability * multiplier;
		return TransitionModel.clamp01(Math.min(adjusted, Math.max(cap, probability)));
	}

	@Override
	public double lapseProbability(OutcomeState state, Candidate candidate, int step) {
		return base.lapseProbability(state, candidate, step);
	}
}
