package com.plaetzchen.community.domain.listing;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/** Partial listing update: {@code null} leaves a field unchanged. */
public record ServiceUpdate(
        @Size(min = 3, max = 100) String title,
        @Size(min = 10, max = 2000) String description,
        Boolean isOffering,
        PriceType priceType,
        @DecimalMin("0.00") BigDecimal priceAmount,
        @Size(min = 3, max = 3) String priceCurrency,
        @Positive Integer estimatedDurationHours,
        @Size(max = 50) String contactMethod) {}
