package my.allocationengine.app.service.simulation;

import my.allocationengine.app.config.AppProperties;
import my.allocationengine.app.domain.OutcomeState;

public record PayoffSchedule(double converted, double responded, double engaged, double prospect, double lapsed) {
	public static final PayoffSchedule DEFAULT = new PayoffSchedule(1.0, 0.25, 0.05, 0.0, 0.0);
	public static final PayoffSchedule CONVERSION_ONLY = new PayoffSchedule(1.0, 0.0, 0.0, 0.0, 0.0);

	public PayoffSchedule {
		if (!Double.isFinite(converted) || !Double.isFinite(responded) || !Double.isFinite(engaged)
				|| !Double.isFinite(prospect) || !Double.isFinite(lapsed)) {
			throw new IllegalArgumentException("Payoffs must be finite");
		}
	}

	public static PayoffSchedule from(AppProperties.Simulation.Payoff payoff) {
		if (payoff == null) {
			return DEFAULT;
		}
		return new PayoffSchedule(
				payoff.converted() == null ? DEFAULT.converted() : payoff.converted(),
				payoff.responded() == null ? DEFAULT.responded() : payoff.responded(),
				payoff.engaged() == null ? DEFAULT.engaged() : payoff.engaged(),
				payoff.prospect() == null ? DEFAULT.prospect() : payoff.prospect(),
				payoff.lapsed() == null ? DEFAULT.lapsed() : payoff.lapsed());
	}

	public double payoff(OutcomeState state) {
		return switch (state) {
			case CONVERTED -> converted;
			case RESPONDED -> responded;
			case ENGAGED -> engaged;
			case PROSPECT -> prospect;
			case LAPSED -> lapsed;
		};
	}
}
