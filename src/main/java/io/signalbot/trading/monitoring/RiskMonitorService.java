package io.signalbot.trading.monitoring;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketDataCache;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.PositionStateMachine;
import io.signalbot.trading.risk.RiskAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RiskMonitorService {
    private final MarketDataCache marketDataCache;
    private final PositionStateMachine positionStateMachine;
    private final TradingProperties properties;

    /**
     * One protective evaluation. Does nothing, not even a venue call, while the signal source is flat
     * or no leg is tracked.
     */
    public RiskAction onHealthTick() {
        String symbol = properties.getSymbol();
        if (!positionStateMachine.needsProtection(symbol)) return RiskAction.NONE;

        long version = positionStateMachine.version(symbol);
        MarketSnapshot snapshot = marketDataCache.refresh();
        if (!snapshot.isPriceValid()) {
            log.debug("No valid price this cycle, skipping protections");
            return RiskAction.NONE;
        }

        RiskAction action = positionStateMachine.applyRiskCycle(symbol, snapshot, version);
        if (action.placesOrder() || action == RiskAction.RECONCILE_FLAT) {
            log.info("Risk cycle applied {}", action);
        }
        return action;
    }
}
