package com.salesadvisor.similarity;

public record CohortNeighbor(int rowIndex, double target, double distance, Boolean promoActive) {}
