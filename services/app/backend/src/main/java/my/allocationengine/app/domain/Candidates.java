package my.allocationengine.app.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class Candidates {
	private Candidates() {
	}

	public static List<Candidate> validated(List<Candidate> candidates) {
		Objects.requireNonNull(candidates, "candidates");
		for (Candidate candidate : candidates) {
			if (candidate == null) {
				throw new IllegalArgumentException("Candidate list contains a null entry");
			}
		}
		Candidate.requireUniqueIds(candidates);
		return List.copyOf(candidates);
	}

	public static List<String> ids(List<Candidate> candidates) {
		List<String> ids = new ArrayList<>(candidates.size());
		for (Candidate candidate : candidates) {
			ids.add(candidate.id());
		}
		return List.copyOf(ids);
	}
}
