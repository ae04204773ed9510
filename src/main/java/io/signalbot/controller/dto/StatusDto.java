package io.signalbot.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Builder
@AllArgsConstructor
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusDto {
    private boolean signalActive;
    private String externalStance;
    private String actualPosition;      // what the venue holds
    private String state;               // FLAT / OPEN / LOCKED
    private BigDecimal size;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal stopLossPrice;
    private BigDecimal balance;
    private int reentryAttempts;
    private Instant openedAt;           // start of the current leg
    private String pnl;
    private String pnlLeveraged;
}
