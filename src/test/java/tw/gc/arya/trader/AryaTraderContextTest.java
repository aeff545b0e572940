package tw.gc.arya.trader;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import tw.gc.arya.trader.execution.ExecutionService;
import tw.gc.arya.trader.execution.SimulatedExecutionService;
import tw.gc.arya.trader.history.BarHistory;
import tw.gc.arya.trader.indicators.IndicatorService;
import tw.gc.arya.trader.indicators.RollingIndicatorService;
import tw.gc.arya.trader.services.AryaStrategyEngine;
import tw.gc.arya.trader.services.BacktestRunner;
import tw.gc.arya.trader.strategy.StrategyParameters;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AryaTraderContextTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextWiresEngineWithDefaults() {
        StrategyParameters params = context.getBean(StrategyParameters.class);
        assertThat(params.getBuyLevel()).isEqualTo(51.0);
        assertThat(params.getStopTicks()).isEqualTo(24);

        assertThat(context.getBean(BarHistory.class).getCapacity()).isEqualTo(500);
        assertThat(context.getBean(ExecutionService.class)).isInstanceOf(SimulatedExecutionService.class);
        assertThat(context.getBean(IndicatorService.class)).isInstanceOf(RollingIndicatorService.class);
        assertThat(context.getBean(AryaStrategyEngine.class).getPosition().contracts()).isZero();
    }

    @Test
    void backtestRunnerDisabledByDefault() {
        assertThat(context.getBeanNamesForType(BacktestRunner.class)).isEmpty();
    }
}
