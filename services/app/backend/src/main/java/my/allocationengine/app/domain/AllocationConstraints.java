package my.allocationengine.app.domain;

import my.allocationengine.app.error.InfeasibleAllocationException;

public record AllocationConstraints(double budget, double maxWeight) {
	public static final AllocationConstraints FULLY_INVESTED = new AllocationConstraints(1.0, 1.0);

	public AllocationConstraints {
		if (!Double.isFinite(budget) || !Double.isFinite(maxWeight)) {
			throw new IllegalArgumentException("Constraint values must be finite");
		}
	}

	public void requireFeasible(int candidateCount) {
		if (candidateCount <= 0) {
			throw new InfeasibleAllocationException("No candidates to allocate across");
		}
		if (budget <= 0.0 || budget > 1.0) {
			throw new InfeasibleAllocationException("Budget must lie in (0, 1], got " + budget);
		}
		if (maxWeight <= 0.0 || maxWeight > 1.0) {
			throw new InfeasibleAllocationException("Per-candidate cap must lie in (0, 1], got " + maxWeight);
		}
		if (maxWeight * candidateCount < budget - Allocation.TOLERANCE) {
			throw new InfeasibleAllocationException("Cap " + maxWeight + " across " + candidateCount
					+ " candidates cannot reach the budget " + budget);
		}
	}
}
