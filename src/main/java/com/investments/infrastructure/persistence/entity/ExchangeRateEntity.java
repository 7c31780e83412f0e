package com.investments.infrastructure.persistence.entity;

import com.investments.domain.model.ExchangeRate;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * JPA entity for the exchange_rates table
 */
@Entity
@Table(
        name = "exchange_rates",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_exchange_rates_pair", columnNames = {"from_currency", "to_currency"})
        },
        indexes = {
                @Index(name = "idx_exchange_rates_last_updated", columnList = "last_updated")
        }
)
@Getter
@Setter
public class ExchangeRateEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "from_currency", nullable = false, length = 3)
    private String fromCurrency;

    @Column(name = "to_currency", nullable = false, length = 3)
    private String toCurrency;

    @Column(name = "rate", nullable = false, precision = 18, scale = 8)
    private BigDecimal rate;

    @Column(name = "last_updated", nullable = false)
    private OffsetDateTime lastUpdated;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public ExchangeRateEntity() {
    }

    @PrePersist
    protected void onCreate() {
        createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        if (lastUpdated == null) {
            lastUpdated = createdAt;
        }
    }

    public void update(ExchangeRate exchangeRate) {
        this.rate = exchangeRate.rate();
        this.lastUpdated = exchangeRate.lastUpdated() != null
                ? exchangeRate.lastUpdated().atOffset(ZoneOffset.UTC)
                : OffsetDateTime.now(ZoneOffset.UTC);
    }
}
