package fr.lapetina.resilienthttp.domain.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DelayStrategyTest {

    @Nested
    @DisplayName("ExponentialDelayStrategy")
    class Exponential {

        @Test
        @DisplayName("should double the delay in seconds by default")
        void shouldDoubleInSeconds() {
            DelayStrategy strategy = new ExponentialDelayStrategy();

            assertThat(strategy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
            assertThat(strategy.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
            assertThat(strategy.delayFor(3)).isEqualTo(Duration.ofSeconds(8));
        }

        @Test
        @DisplayName("should honour the configured unit")
        void shouldUseUnit() {
            assertThat(new ExponentialDelayStrategy(ChronoUnit.MILLIS).delayFor(4))
                    .isEqualTo(Duration.ofMillis(16));
        }

        @Test
        @DisplayName("should cap the exponent instead of overflowing")
        void shouldCapExponent() {
            DelayStrategy strategy = new ExponentialDelayStrategy(ChronoUnit.MILLIS);

            assertThat(strategy.delayFor(100)).isEqualTo(strategy.delayFor(30));
            assertThat(strategy.delayFor(100)).isPositive();
        }
    }

    @Test
    @DisplayName("linear strategy should grow by one unit per retry")
    void linearShouldGrowByOneUnit() {
        DelayStrategy strategy = new LinearDelayStrategy(ChronoUnit.MILLIS);

        assertThat(strategy.delayFor(1)).isEqualTo(Duration.ofMillis(1));
        assertThat(strategy.delayFor(5)).isEqualTo(Duration.ofMillis(5));
    }

    @Test
    @DisplayName("constant strategy should ignore the retry count")
    void constantShouldIgnoreCount() {
        DelayStrategy strategy = new ConstantDelayStrategy(Duration.ofMillis(250));

        assertThat(strategy.delayFor(1)).isEqualTo(strategy.delayFor(7));
        assertThatThrownBy(() -> new ConstantDelayStrategy(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("DelayStrategyFactory")
    class Factory {

        @Test
        @DisplayName("should create built-in strategies by name")
        void shouldCreateByName() {
            assertThat(DelayStrategyFactory.create("Exponential", ChronoUnit.SECONDS).orElseThrow().getName())
                    .isEqualTo("exponential");
            assertThat(DelayStrategyFactory.create("constant", ChronoUnit.MILLIS).orElseThrow().delayFor(9))
                    .isEqualTo(Duration.ofMillis(1));
        }

        @Test
        @DisplayName("should fall back for unknown names")
        void shouldFallBack() {
            DelayStrategy fallback = new LinearDelayStrategy();

            assertThat(DelayStrategyFactory.create("fibonacci", ChronoUnit.SECONDS)).isEmpty();
            assertThat(DelayStrategyFactory.createOrDefault("fibonacci", ChronoUnit.SECONDS, fallback))
                    .isSameAs(fallback);
        }

        @Test
        @DisplayName("should register custom strategies")
        void shouldRegisterCustom() {
            DelayStrategyFactory.register("test-fixed", unit -> retries -> Duration.of(42, unit));

            assertThat(DelayStrategyFactory.create("TEST-FIXED", ChronoUnit.MILLIS).orElseThrow().delayFor(1))
                    .isEqualTo(Duration.ofMillis(42));
        }

        @Test
        @DisplayName("should parse exact time units")
        void shouldParseUnits() {
            assertThat(DelayStrategyFactory.parseUnit("seconds")).isEqualTo(ChronoUnit.SECONDS);
            assertThat(DelayStrategyFactory.parseUnit("millis")).isEqualTo(ChronoUnit.MILLIS);
            assertThat(DelayStrategyFactory.parseUnit("ms")).isEqualTo(ChronoUnit.MILLIS);
            assertThatThrownBy(() -> DelayStrategyFactory.parseUnit("months"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> DelayStrategyFactory.parseUnit("fortnights"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
