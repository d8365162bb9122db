package my.allocationengine.app.service.simulation;

import my.allocationengine.app.config.AppProperties;
import my.allocationengine.app.domain.Candidate;
import my.allocationengine.app.domain.OutcomeState;

public record ParametricTransitionModel(double engage,
										double respond,
										double convert,
										double baseLapse,
										double lapseGrowth,
										double alphaTilt,
										double riskTilt) implements TransitionModel {
	public static final ParametricTransitionModel DEFAULT =
			new ParametricTransitionModel(0.6, 0.45, 0.35, 0.05, 0.15, 0.5, 0.5);

	public ParametricTransitionModel {
		requireProbability("engage", engage);
		requireProbability("respond", respond);
		requireProbability("convert", convert);
		requireProbability("baseLapse", baseLapse);
		if (!Double.isFinite(lapseGrowth) || lapseGrowth < 0.0) {
			throw new IllegalArgumentException("lapseGrowth must be a non-negative number");
		}
		if (!Double.isFinite(alphaTilt)) {
			throw new IllegalArgumentException("alphaTilt must be finite");
		}
		if (!Double.isFinite(riskTilt) || riskTilt < 0.0) {
			throw new IllegalArgumentException("riskTilt must be a non-negative number");
		}
	}

	public static ParametricTransitionModel certainConversion() {
		return new ParametricTransitionModel(1.0, 1.0, 1.0, 0.0, 0.0, 0.0, 0.0);
	}

	public static ParametricTransitionModel from(AppProperties.Simulation.Transition transition) {
		if (transition == null) {
			return DEFAULT;
		}
		return new ParametricTransitionModel(
				valueOr(transition.engage(), DEFAULT.engage()),
				valueOr(transition.respond(), DEFAULT.respond()),
				valueOr(transition.convert(), DEFAULT.convert()),
				valueOr(transition.baseLapse(), DEFAULT.baseLapse()),
				valueOr(transition.lapseGrowth(), DEFAULT.lapseGrowth()),
				valueOr(transition.alphaTilt(), DEFAULT.alphaTilt()),
				valueOr(transition.riskTilt(), DEFAULT.riskTilt()));
	}

	@Override
	public double advanceProbability(OutcomeState state, Candidate candidate, int step) {
		double base = switch (state) {
			case PROSPECT -> engage;
			case ENGAGED -> respond;
			case RESPONDED -> convert;
			case CONVERTED, LAPSED -> 0.0;
		};
		if (base == 0.0 || base == 1.0) {
			return base;
		}
		return TransitionModel.clamp01(base * (1.0 + alphaTilt * (candidate.expectedReturn() - 0.5)));
	}

	@Override
	public double lapseProbability(OutcomeState state, Candidate candidate, int step) {
		if (state.isTerminal()) {
			return 0.0;
		}
		double base = TransitionModel.clamp01(baseLapse * (1.0 + riskTilt * candidate.risk()));
		return TransitionModel.clamp01(1.0 - (1.0 - base) * Math.exp(-lapseGrowth * Math.max(0, step)));
	}

	private static void requireProbability(String name, double value) {
		if (!(value >= 0.0 && value <= 1.0)) {
			throw new IllegalArgumentException(name + " must lie in [0, 1], got " + value);
		}
	}

	private static double valueOr(Double value, double fallback) {
		return value == null ? fallback : value;
	}
}
