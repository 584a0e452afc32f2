package com.salesadvisor.service;

import com.salesadvisor.entity.SalesObservation;
import com.salesadvisor.entity.StoreProfile;

import java.util.List;

public interface HistoricalCorpusProvider {

    /**
     * All observations, ordered by store, date and id. The order fixes row indices of the cohort index.
     */
    List<SalesObservation> loadObservations();

    List<StoreProfile> loadStoreProfiles();
}
