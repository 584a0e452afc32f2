package com.salesadvisor.controller;

import com.salesadvisor.config.RequestGuardFilter;
import com.salesadvisor.dto.DetailedPredictResponse;
import com.salesadvisor.dto.HealthResponse;
import com.salesadvisor.dto.PredictRequest;
import com.salesadvisor.dto.PredictResponse;
import com.salesadvisor.service.DetailedRecommendationResult;
import com.salesadvisor.service.PipelineStatus;
import com.salesadvisor.service.RecommendationPipeline;
import com.salesadvisor.service.RecommendationResult;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationPipeline pipeline;

    @PostMapping("/predict")
    public ResponseEntity<PredictResponse> predict(
            @Valid @RequestBody PredictRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /predict | storeId={} | date={} | promo={} | requestId={}",
                 request.getStoreId(), request.getDate(), request.getPromo(), requestId);
        RecommendationResult result =
            pipeline.recommend(request.getStoreId(), request.getDate(), request.promoActive());
        log.info("Recommendation served | storeId={} | forecast={} | benchmark={} | recommendations={} | requestId={}",
                 request.getStoreId(), Math.round(result.forecast()), Math.round(result.benchmark()),
                 result.recommendations().size(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(PredictResponse.from(result));
    }

    @PostMapping("/predict/detailed")
    public ResponseEntity<DetailedPredictResponse> predictDetailed(
            @Valid @RequestBody PredictRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /predict/detailed | storeId={} | date={} | promo={} | requestId={}",
                 request.getStoreId(), request.getDate(), request.getPromo(), requestId);
        DetailedRecommendationResult detailed =
            pipeline.detailedRecommend(request.getStoreId(), request.getDate(), request.promoActive());
        log.info("Detailed recommendation served | storeId={} | forecast={} | category={} | requestId={}",
                 request.getStoreId(), Math.round(detailed.result().forecast()),
                 detailed.comparison().performanceCategory().code(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(DetailedPredictResponse.from(detailed));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        PipelineStatus status = pipeline.status();
        return ResponseEntity.status(status.ready() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(HealthResponse.from(status));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
        if (id != null && !id.isBlank()) {
            return id;
        }
        String current = MDC.get(RequestGuardFilter.REQUEST_ID_MDC_KEY);
        return current != null ? current : UUID.randomUUID().toString();
    }
}
