package io.signalbot.configs.properties;

import jakarta.validation.constraints.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Trading thresholds. All percentages are fractions (0.07 = 7%) and, except for
 * {@link #stopLossPercent}, refer to unleveraged price movement.
 */
@Getter
@Setter
@ToString
@Validated
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    @NotBlank
    private String symbol = "WLFIUSDT";

    @NotBlank
    private String marginAsset = "USDT";

    @Positive
    private int leverage = 4;

    /** Share of the available balance committed as margin per open. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal positionSizeFraction = new BigDecimal("0.96");

    @NotNull
    @PositiveOrZero
    private BigDecimal minOrderValue = new BigDecimal("5");

    /** Capital at risk; converted to a price distance of stopLossPercent / leverage. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal stopLossPercent = new BigDecimal("0.07");

    /** Retracement from peak profit that locks the profit (0.25 = a quarter of the peak given back). */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal trailingDropFraction = new BigDecimal("0.25");

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal trailingActivationFraction = new BigDecimal("0.008");

    @NotNull
    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal reentryThreshold = new BigDecimal("0.003");

    @Min(0)
    @Max(3)
    private int maxReentryAttempts = 3;

    @PositiveOrZero
    private int quantityScale = 0;

    @NotNull
    private Duration checkInterval = Duration.ofMillis(500);

    @NotNull
    private Duration protectiveCooldown = Duration.ofSeconds(3);

    @NotNull
    private Duration flipSettleDelay = Duration.ofMillis(500);

    @NotNull
    private Duration cacheTtl = Duration.ofMillis(100);

    @NotNull
    private Duration dedupWindow = Duration.ofSeconds(2);

    private boolean hedgeMode = true;

    private boolean isolatedMargin = false;

    private boolean monitorEnabled = true;

    @Positive
    private long monitorIntervalMs = 1_000;

    @NotBlank
    private String journalDir = "logs/trading";

    @AssertTrue(message = "durations must not be negative")
    public boolean isDurationsValid() {
        return notNegative(checkInterval) && notNegative(protectiveCooldown)
                && notNegative(flipSettleDelay) && notNegative(cacheTtl) && notNegative(dedupWindow);
    }

    private static boolean notNegative(Duration d) {
        return d == null || !d.isNegative();
    }
}
