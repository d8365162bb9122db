package my.allocationengine.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid Estimator estimator,
		@Valid Blender blender,
		@Valid Optimizer optimizer,
		@Valid Simulation simulation
) {
	public record Estimator(
			@Positive Double correlationLengthScale,
			@DecimalMin("0.0") @DecimalMax("1.0") Double maxAbsCorrelation
	) {
	}

	public record Blender(
			@Positive Double tau,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "0.5", inclusive = false) Double minConfidence,
			@Positive Double regularization,
			@Positive Double singularTolerance
	) {
	}

	public record Optimizer(
			@Positive Double conditionThreshold,
			@DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") Double shrinkageStep,
			@Positive Double ridge,
			@Min(1) Integer maxIterations,
			@Positive Double tolerance,
			@Min(2) Integer frontierPoints,
			@Positive Double minRiskAversion,
			@Positive Double maxRiskAversion,
			@PositiveOrZero Double l2Gamma,
			Double riskFreeRate,
			@PositiveOrZero Double weightCutoff
	) {
	}

	public record Simulation(
			@Min(1) Integer trials,
			@Min(1) Integer horizon,
			@Positive Double halfLife,
			@PositiveOrZero Integer parallelism,
			@Min(1) Integer chunkSize,
			List<Double> percentiles,
			@Valid Transition transition,
			@Valid Payoff payoff
	) {
		public record Transition(
				@DecimalMin("0.0") @DecimalMax("1.0") Double engage,
				@DecimalMin("0.0") @DecimalMax("1.0") Double respond,
				@DecimalMin("0.0") @DecimalMax("1.0") Double convert,
				@DecimalMin("0.0") @DecimalMax("1.0") Double baseLapse,
				@PositiveOrZero Double lapseGrowth,
				Double alphaTilt,
				@PositiveOrZero Double riskTilt
		) {
		}

		public record Payoff(
				Double converted,
				Double responded,
				Double engaged,
				Double prospect,
				Double lapsed
		) {
		}
	}
}
