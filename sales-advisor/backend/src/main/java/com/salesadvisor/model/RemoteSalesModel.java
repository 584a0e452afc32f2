package com.salesadvisor.model;

import com.salesadvisor.client.InferenceApiClient;
import com.salesadvisor.exception.InferenceApiException;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

public class RemoteSalesModel implements SalesModel {

    private final InferenceApiClient client;
    private final List<String> featureNames;
    private final Duration blockTimeout;

    public RemoteSalesModel(InferenceApiClient client, List<String> featureNames, Duration blockTimeout) {
        this.client = client;
        this.featureNames = List.copyOf(featureNames);
        this.blockTimeout = blockTimeout;
    }

    @Override
    public double predict(double[] features) {
        String requestId = MDC.get("requestId");
        Double prediction = client.predict(features, featureNames,
                requestId != null ? requestId : UUID.randomUUID().toString())
            .block(blockTimeout);
        if (prediction == null) {
            throw new InferenceApiException("Inference API returned an empty prediction response");
        }
        return prediction;
    }

    @Override
    public String type() {
        return "remote";
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }
}
