package my.allocationengine.app.service;

import my.allocationengine.app.domain.Candidate;

@FunctionalInterface
public interface AlphaScorer {
	AlphaScorer CANDIDATE_ESTIMATE = Candidate::expectedReturn;

	double score(Candidate candidate);
}
