package com.salesadvisor.service;

import com.salesadvisor.entity.SalesObservation;
import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.repository.SalesObservationRepository;
import com.salesadvisor.repository.StoreProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DatabaseCorpusProvider implements HistoricalCorpusProvider, StoreProfileLookup {

    private final SalesObservationRepository observationRepository;
    private final StoreProfileRepository     storeRepository;

    @Override
    public List<SalesObservation> loadObservations() {
        return observationRepository.findAllInCorpusOrder();
    }

    @Override
    public List<StoreProfile> loadStoreProfiles() {
        return storeRepository.findAll(Sort.by("storeId"));
    }

    @Override
    public Optional<StoreProfile> findStore(int storeId) {
        return storeRepository.findById(storeId);
    }
}
