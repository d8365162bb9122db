package my.allocationengine.app.service.correlation;

import my.allocationengine.app.domain.Candidate;

public final class IndependentCorrelationModel implements CorrelationModel {
	public static final IndependentCorrelationModel INSTANCE = new IndependentCorrelationModel();

	private IndependentCorrelationModel() {
	}

	@Override
	public double correlation(Candidate first, Candidate second) {
		return 0.0;
	}

	@Override
	public String name() {
		return "independent";
	}
}
