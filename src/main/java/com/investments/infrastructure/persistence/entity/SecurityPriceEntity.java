package com.investments.infrastructure.persistence.entity;

import com.investments.domain.model.SecurityPrice;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * JPA entity for the security_prices table, one row per symbol and trading date
 */
@Entity
@Table(
        name = "security_prices",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_security_prices_symbol_date", columnNames = {"symbol", "price_date"})
        },
        indexes = {
                @Index(name = "idx_security_prices_symbol", columnList = "symbol"),
                @Index(name = "idx_security_prices_price_date", columnList = "price_date")
        }
)
@Getter
@Setter
public class SecurityPriceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    @Column(name = "open_price", precision = 15, scale = 4)
    private BigDecimal openPrice;

    @Column(name = "high_price", precision = 15, scale = 4)
    private BigDecimal highPrice;

    @Column(name = "low_price", precision = 15, scale = 4)
    private BigDecimal lowPrice;

    @Column(name = "close_price", nullable = false, precision = 15, scale = 4)
    private BigDecimal closePrice;

    @Column(name = "volume")
    private Long volume;

    @Column(name = "currency", length = 3)
    private String currency;

    @Column(name = "exchange_name", length = 10)
    private String exchangeName;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public SecurityPriceEntity() {
    }

    @PrePersist
    protected void onCreate() {
        createdAt = OffsetDateTime.now(ZoneOffset.UTC);
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Copies the market values of a refreshed row. Identity and creation time stay untouched.
     */
    public void update(SecurityPrice price) {
        this.openPrice = price.openPrice();
        this.highPrice = price.highPrice();
        this.lowPrice = price.lowPrice();
        this.closePrice = price.closePrice();
        this.volume = price.volume();
        this.currency = price.currency();
        this.exchangeName = price.exchangeName();
        this.updatedAt = price.updatedAt() != null
                ? price.updatedAt().atOffset(ZoneOffset.UTC)
                : OffsetDateTime.now(ZoneOffset.UTC);
    }
}
