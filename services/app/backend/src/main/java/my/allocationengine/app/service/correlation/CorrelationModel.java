package my.allocationengine.app.service.correlation;

import my.allocationengine.app.domain.Candidate;

@FunctionalInterface
public interface CorrelationModel {
	double correlation(Candidate first, Candidate second);

	default String name() {
		return getClass().getSimpleName();
	}
}
