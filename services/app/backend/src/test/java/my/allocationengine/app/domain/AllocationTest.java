package my.allocationengine.app.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AllocationTest {
	@Test
	void snapsTinyNegativeWeightsToZero() {
		Allocation allocation = Allocation.fromArray(List.of("A", "B"), new double[]{-1e-12, 1.0});

		assertThat(allocation.weight("A")).isZero();
		assertThat(allocation.weight("B")).isEqualTo(1.0);
		assertThat(allocation.activeCount()).isEqualTo(1);
	}

	@Test
	void rejectsNegativeWeights() {
		assertThatThrownBy(() -> Allocation.fromArray(List.of("A", "B"), new double[]{-0.1, 0.5}))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("outside [0, 1]");
	}

	@Test
	void rejectsLeverage() {
		Map<String, Double> weights = new LinkedHashMap<>();
		weights.put("A", 0.7);
		weights.put("B", 0.6);

		assertThatThrownBy(() -> new Allocation(weights))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("above the budget");
	}

	@Test
	void cleaningDropsDustWithoutRenormalising() {
		Allocation allocation = Allocation.fromArray(List.of("A", "B", "C"), new double[]{0.59995, 0.40004, 0.00001});

		Allocation cleaned = allocation.cleaned(1e-4);

		assertThat(cleaned.weight("C")).isZero();
		assertThat(cleaned.weight("A")).isCloseTo(0.59995, within(1e-12));
		assertThat(cleaned.weight("B")).isCloseTo(0.40004, within(1e-12));
		assertThat(cleaned.total()).isLessThanOrEqualTo(allocation.total());
	}

	@Test
	void toArrayFollowsRequestedOrderAndDefaultsMissingIdsToZero() {
		Allocation allocation = Allocation.fromArray(List.of("A", "B"), new double[]{0.25, 0.75});

		assertThat(allocation.toArray(List.of("B", "X", "A"))).containsExactly(0.75, 0.0, 0.25);
	}
}
