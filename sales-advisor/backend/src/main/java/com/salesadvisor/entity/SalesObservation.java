package com.salesadvisor.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "sales",
    indexes = {
        @Index(name = "idx_sales_store", columnList = "store_id"),
        @Index(name = "idx_sales_date",  columnList = "sale_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SalesObservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "store_id", nullable = false)
    private int storeId;

    @Column(name = "sale_date", nullable = false)
    private LocalDate date;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(nullable = false)
    private double sales;

    @Column(nullable = false)
    private int customers;

    @Column(name = "is_open", nullable = false)
    private boolean open;

    @Column(nullable = false)
    private boolean promo;

    @Column(name = "state_holiday", nullable = false, length = 10)
    private String stateHoliday;

    @Column(name = "school_holiday", nullable = false)
    private boolean schoolHoliday;
}
