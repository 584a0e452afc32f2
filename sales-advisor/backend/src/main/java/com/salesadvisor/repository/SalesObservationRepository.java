package com.salesadvisor.repository;

import com.salesadvisor.entity.SalesObservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface SalesObservationRepository extends JpaRepository<SalesObservation, Long> {

    @Query("""
        SELECT s FROM SalesObservation s
        ORDER BY s.storeId ASC, s.date ASC, s.id ASC
    """)
    List<SalesObservation> findAllInCorpusOrder();
}
