package com.salesadvisor.service;

import com.salesadvisor.entity.SalesObservation;
import com.salesadvisor.entity.StoreProfile;
import com.salesadvisor.exception.PipelineInitializationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CorpusLoaderTest {

    @Mock HistoricalCorpusProvider provider;
    @InjectMocks CorpusLoader loader;

    private static StoreProfile store(int id) {
        return StoreProfile.builder().storeId(id).storeType("a").assortment("a")
            .competitionDistance(1000.0).promo2(false).build();
    }

    private static SalesObservation observation(int storeId, int day, double sales, boolean open, boolean promo) {
        LocalDate date = LocalDate.of(2015, 7, day);
        return SalesObservation.builder().storeId(storeId).date(date)
            .dayOfWeek(date.getDayOfWeek().getValue()).sales(sales).customers(500)
            .open(open).promo(promo).stateHoliday("0").schoolHoliday(false).build();
    }

    @Test
    void load_keepsOpenPositiveRowsWithKnownStore() {
        when(provider.loadStoreProfiles()).thenReturn(List.of(store(1), store(2)));
        when(provider.loadObservations()).thenReturn(List.of(
            observation(1, 1, 5000, true, true),
            observation(1, 2, 0, true, false),
            observation(1, 3, 4000, false, false),
            observation(2, 1, 6000, true, false),
            observation(3, 1, 7000, true, true)));

        TrainingCorpus corpus = loader.load();

        assertThat(corpus.size()).isEqualTo(2);
        assertThat(corpus.rawCount()).isEqualTo(5);
        assertThat(corpus.droppedCount()).isEqualTo(3);
        assertThat(corpus.targets()).containsExactly(5000.0, 6000.0);
        assertThat(corpus.promoFlags()).containsExactly(true, false);
        assertThat(corpus.records()).extracting(r -> r.storeId()).containsExactly(1, 2);
        assertThat(corpus.records().get(0).storeType()).isEqualTo("a");
    }

    @Test
    void load_noValidRows_failsInitialization() {
        when(provider.loadStoreProfiles()).thenReturn(List.of(store(1)));
        when(provider.loadObservations()).thenReturn(List.of(observation(1, 1, 0, true, false)));

        assertThatThrownBy(() -> loader.load())
            .isInstanceOf(PipelineInitializationException.class)
            .hasMessageContaining("No valid observations");
    }

    @Test
    void load_emptyCorpus_failsInitialization() {
        when(provider.loadStoreProfiles()).thenReturn(List.of());
        when(provider.loadObservations()).thenReturn(List.of());

        assertThatThrownBy(() -> loader.load()).isInstanceOf(PipelineInitializationException.class);
    }
}
