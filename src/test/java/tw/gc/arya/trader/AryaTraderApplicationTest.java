package tw.gc.arya.trader;

import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;

class AryaTraderApplicationTest {

    @Test
    void main_forwardsBacktestArgumentsUnchanged() {
        String[] args = {"--arya.backtest.enabled=true", "--arya.backtest.bars-file=target/replay.json"};
        ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
        AtomicReference<Object> forwarded = new AtomicReference<>();

        try (MockedStatic<SpringApplication> springApplication = mockStatic(SpringApplication.class)) {
            springApplication.when(() -> SpringApplication.run(eq(AryaTraderApplication.class), any(String[].class)))
                    .thenAnswer(invocation -> {
                        forwarded.set(invocation.getRawArguments()[1]);
                        return context;
                    });

            AryaTraderApplication.main(args);
        }

        assertThat(forwarded.get()).isInstanceOf(String[].class);
        assertThat((String[]) forwarded.get())
                .containsExactly("--arya.backtest.enabled=true", "--arya.backtest.bars-file=target/replay.json");
    }

    @Test
    void applicationClass_scansTraderPackage() {
        SpringBootApplication annotation = AryaTraderApplication.class.getAnnotation(SpringBootApplication.class);

        assertThat(annotation).isNotNull();
        assertThat(annotation.scanBasePackages()).isEmpty();
        assertThat(AryaTraderApplication.class.getPackageName()).isEqualTo("tw.gc.arya.trader");
    }
}
