package io.signalbot.controller.dto;

import lombok.*;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class CredentialsReport {
    private Long serverTime;
    private int apiKeyLength;
    private int apiSecretLength;
    private String apiKeyPrefix;
    private boolean credentialsLoaded;
    private String balanceTest;
    private BigDecimal balance;
}
