package com.salesadvisor.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "stores")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreProfile {

    @Id
    @Column(name = "store_id", nullable = false)
    private Integer storeId;

    @Column(name = "store_type", nullable = false, length = 10)
    private String storeType;

    @Column(nullable = false, length = 10)
    private String assortment;

    @Column(name = "competition_distance")
    private Double competitionDistance;

    @Column(name = "competition_open_since_month")
    private Integer competitionOpenSinceMonth;

    @Column(name = "competition_open_since_year")
    private Integer competitionOpenSinceYear;

    @Column(nullable = false)
    private boolean promo2;

    @Column(name = "promo2_since_week")
    private Integer promo2SinceWeek;

    @Column(name = "promo2_since_year")
    private Integer promo2SinceYear;

    @Column(name = "promo_interval", length = 50)
    private String promoInterval;
}
