package com.propplatform.analysis.config;

import com.propplatform.common.correlation.CorrelationAnalyzer;
import com.propplatform.common.store.EvaluatorWeightStore;
import com.propplatform.common.store.InMemoryEvaluatorWeightStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
@ComponentScan(basePackages = "com.propplatform.analysis")
@EnableConfigurationProperties({ScoringProperties.class, CorrelationProperties.class, BundleProperties.class})
public class AnalysisEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngineConfig.class);

    private static final int QUEUED_TASK_CAP = 10_000;

    @Bean(destroyMethod = "dispose")
    public Scheduler scoringScheduler(ScoringProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        log.info("Scoring scheduler created. workerThreads={} maxConcurrency={}",
                 threads, properties.getMaxConcurrency());
        return Schedulers.newBoundedElastic(threads, QUEUED_TASK_CAP, "scoring-worker");
    }

    @Bean
    public CorrelationAnalyzer correlationAnalyzer(CorrelationProperties properties) {
        return new CorrelationAnalyzer(properties.strengthTable(),
                                       properties.getBaseMagnitude(), properties.getFloor());
    }

    /** Used when no persistent store (such as the R2DBC one in history-service) is on the context. */
    @Bean
    @ConditionalOnMissingBean(EvaluatorWeightStore.class)
    public EvaluatorWeightStore inMemoryEvaluatorWeightStore() {
        log.info("No persistent EvaluatorWeightStore configured; using in-memory weights");
        return new InMemoryEvaluatorWeightStore();
    }
}
