package my.allocationengine.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import my.allocationengine.app.service.AlphaScorer;
import my.allocationengine.app.service.PortfolioOptimizer;
import my.allocationengine.app.service.ReportAggregator;
import my.allocationengine.app.service.RiskReturnEstimator;
import my.allocationengine.app.service.ScenarioSimulator;
import my.allocationengine.app.service.ViewBlender;
import my.allocationengine.app.service.correlation.CorrelationModel;
import my.allocationengine.app.service.correlation.FeatureDistanceCorrelationModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);
	private static final double DEFAULT_MAX_ABS_CORRELATION = 1.0;

	@Bean
	@ConditionalOnMissingBean(AlphaScorer.class)
	public AlphaScorer alphaScorer() {
		return AlphaScorer.CANDIDATE_ESTIMATE;
	}

	@Bean
	@ConditionalOnMissingBean(CorrelationModel.class)
	public CorrelationModel correlationModel(AppProperties properties) {
		Double lengthScale = properties.estimator() == null ? null : properties.estimator().correlationLengthScale();
		double resolved = lengthScale == null ? FeatureDistanceCorrelationModel.DEFAULT_LENGTH_SCALE : lengthScale;
		return new FeatureDistanceCorrelationModel(resolved);
	}

	@Bean
	public RiskReturnEstimator riskReturnEstimator(AlphaScorer alphaScorer,
												   CorrelationModel correlationModel,
												   AppProperties properties) {
		Double maxAbs = properties.estimator() == null ? null : properties.estimator().maxAbsCorrelation();
		double resolved = maxAbs == null ? DEFAULT_MAX_ABS_CORRELATION : maxAbs;
		logger.info("Risk/return estimator ready (correlation={}, maxAbsCorrelation={}).", correlationModel.name(), resolved);
		return new RiskReturnEstimator(alphaScorer, correlationModel, resolved);
	}

	@Bean
	public ViewBlender viewBlender(AppProperties properties) {
		return new ViewBlender(ViewBlender.Settings.from(properties.blender()));
	}

	@Bean
	public PortfolioOptimizer portfolioOptimizer(AppProperties properties) {
		return new PortfolioOptimizer(PortfolioOptimizer.Settings.from(properties.optimizer()));
	}

	@Bean
	public ScenarioSimulator scenarioSimulator(AppProperties properties) {
		ScenarioSimulator.Settings settings = ScenarioSimulator.Settings.from(properties.simulation());
		logger.info("Scenario simulator ready (parallelism={}, trials={}, horizon={}).",
				settings.parallelism(), settings.trials(), settings.horizon());
		return new ScenarioSimulator(settings);
	}

	@Bean
	public ReportAggregator reportAggregator(ObjectMapper objectMapper) {
		return new ReportAggregator(objectMapper);
	}
}
