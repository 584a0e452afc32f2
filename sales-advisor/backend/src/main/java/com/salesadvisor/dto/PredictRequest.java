package com.salesadvisor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class PredictRequest {

    @NotNull(message = "storeId is required")
    @Min(value = 1, message = "storeId must be >= 1")
    Integer storeId;

    @NotNull(message = "date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;

    @NotNull(message = "promo is required")
    @Min(value = 0, message = "promo must be 0 or 1")
    @Max(value = 1, message = "promo must be 0 or 1")
    Integer promo;

    public boolean promoActive() {
        return promo != null && promo == 1;
    }
}
