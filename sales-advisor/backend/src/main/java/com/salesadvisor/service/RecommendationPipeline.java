package com.salesadvisor.service;

import com.salesadvisor.config.PipelineProperties;
import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.exception.ServiceNotReadyException;
import com.salesadvisor.exception.StoreNotFoundException;
import com.salesadvisor.feature.FeatureEncoder;
import com.salesadvisor.model.Forecaster;
import com.salesadvisor.rules.BenchmarkComparison;
import com.salesadvisor.rules.PromoImpact;
import com.salesadvisor.rules.Recommendation;
import com.salesadvisor.rules.RecommendationRules;
import com.salesadvisor.rules.ScenarioAttributes;
import com.salesadvisor.similarity.CohortIndex;
import com.salesadvisor.similarity.CohortResult;
import com.salesadvisor.similarity.CohortSummary;
import com.salesadvisor.similarity.SampleStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the fitted encoder, cohort index and forecaster. Requests are rejected until
 * {@link #initialize()} has completed once; afterwards the fitted state never changes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationPipeline {

    static final double PROMO_IMPACT_PERCENTILE = 75.0;

    private final CorpusLoader        corpusLoader;
    private final StoreProfileLookup  storeLookup;
    private final Forecaster          forecaster;
    private final RecommendationRules rules;
    private final PipelineProperties  properties;

    private final AtomicReference<FittedPipeline> fitted = new AtomicReference<>();

    public synchronized PipelineStatus initialize() {
        if (fitted.get() != null) {
            throw new IllegalStateException("Recommendation pipeline is already initialized");
        }
        long started = System.currentTimeMillis();

        TrainingCorpus corpus = corpusLoader.load();
        FeatureEncoder encoder = new FeatureEncoder();
        double[][] matrix = encoder.fitTransform(corpus.records());
        CohortIndex index = new CohortIndex();
        index.fit(matrix, corpus.targets(), corpus.promoFlags());
        Forecaster active = forecaster.compatibleWith(encoder.featureNames());

        fitted.set(new FittedPipeline(encoder, index, active, corpus.size(), Instant.now()));
        log.info("Pipeline ready | observations={} | features={} | model={} | degraded={} | elapsedMs={}",
                 corpus.size(), encoder.featureNames().size(), active.modelType(), active.isDegraded(),
                 System.currentTimeMillis() - started);
        return status();
    }

    public boolean isReady() {
        return fitted.get() != null;
    }

    public PipelineStatus status() {
        FittedPipeline current = fitted.get();
        if (current == null) {
            return new PipelineStatus(false, 0, 0, forecaster.modelType(), forecaster.isDegraded(), null);
        }
        return new PipelineStatus(true, current.observationCount(), current.encoder().featureNames().size(),
            current.forecaster().modelType(), current.forecaster().isDegraded(), current.fittedAt());
    }

    public RecommendationResult recommend(int storeId, LocalDate date, boolean promo) {
        return evaluate(storeId, date, promo).result();
    }

    public DetailedRecommendationResult detailedRecommend(int storeId, LocalDate date, boolean promo) {
        Evaluation evaluation = evaluate(storeId, date, promo);
        double[] targets = evaluation.cohort().targets();
        CohortSummary summary = CohortSummary.of(evaluation.cohort());
        BenchmarkComparison comparison = rules.compareToBenchmark(evaluation.result().forecast(), targets);
        PromoImpact promoImpact = rules.analyzePromoImpact(targets, PROMO_IMPACT_PERCENTILE);
        return new DetailedRecommendationResult(evaluation.result(), summary, comparison, promoImpact);
    }

    private Evaluation evaluate(int storeId, LocalDate date, boolean promo) {
        FittedPipeline current = fitted.get();
        if (current == null) {
            throw new ServiceNotReadyException();
        }
        StoreProfile profile = storeLookup.findStore(storeId)
            .orElseThrow(() -> new StoreNotFoundException(storeId));

        double[] x = current.encoder().buildScenarioVector(storeId, date, promo, profile);
        double forecast = current.forecaster().predict(x);
        CohortResult cohort = current.index().query(x, properties.getCohortSize());
        double[] targets = cohort.targets();
        double benchmark = SampleStatistics.mean(targets);
        List<Recommendation> recommendations =
            rules.generate(forecast, cohort, ScenarioAttributes.of(date, promo, profile));

        log.debug("Scenario evaluated | storeId={} | date={} | promo={} | forecast={} | benchmark={} | cohort={}",
                  storeId, date, promo, forecast, benchmark, targets.length);
        RecommendationResult result = new RecommendationResult(
            forecast,
            benchmark,
            recommendations,
            SampleStatistics.boxed(targets),
            StoreInfo.of(profile),
            current.forecaster().modelType(),
            current.forecaster().isDegraded());
        return new Evaluation(result, cohort);
    }

    private record Evaluation(RecommendationResult result, CohortResult cohort) {}

    private record FittedPipeline(
        FeatureEncoder encoder,
        CohortIndex index,
        Forecaster forecaster,
        int observationCount,
        Instant fittedAt
    ) {}
}
