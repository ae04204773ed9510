package io.signalbot.trading.status;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.controller.dto.StatusDto;
import io.signalbot.market_data.snapshot.MarketDataCache;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.PositionStateMachine;
import io.signalbot.trading.position.model.PositionRecord;
import io.signalbot.trading.risk.RiskEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class StatusService {
    private final MarketDataCache marketDataCache;
    private final PositionStateMachine positionStateMachine;
    private final RiskEngine riskEngine;
    private final TradingProperties properties;

    public StatusDto getStatus() {
        MarketSnapshot snapshot = marketDataCache.get();
        PositionRecord record = positionStateMachine.snapshot(properties.getSymbol());

        StatusDto.StatusDtoBuilder status = StatusDto.builder()
                .signalActive(record.isSignalActive())
                .externalStance(record.getExternalStance() == null ? "flat" : record.getExternalStance().lowerCase())
                .actualPosition(snapshot.actualPosition().lowerCase())
                .state(record.getState().name())
                .size(record.getSize())
                .entryPrice(nvl(record.getEntryPrice()))
                .currentPrice(snapshot.getPrice())
                .stopLossPrice(nvl(record.getStopLossPrice()))
                .balance(snapshot.getBalance())
                .reentryAttempts(record.getReentryAttempts())
                .openedAt(record.getOpenedAt());

        if (record.isTracking() && snapshot.isPriceValid()) {
            BigDecimal pnl = riskEngine.unleveragedPnl(record.getSide(), record.getEntryPrice(), snapshot.getPrice());
            status.pnl(percent(pnl))
                    .pnlLeveraged(percent(riskEngine.leveraged(pnl)));
        }
        return status.build();
    }

    private static String percent(BigDecimal fraction) {
        return String.format(Locale.ROOT, "%.2f%%", fraction.movePointRight(2));
    }

    private static BigDecimal nvl(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
