package fr.lapetina.resilienthttp.domain.strategy;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Creates delay strategies by configuration name.
 *
 * Every factory receives the configured time unit; {@code constant} uses one
 * unit as its fixed delay.
 */
public final class DelayStrategyFactory {

    private static final Map<String, Function<ChronoUnit, DelayStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("exponential", ExponentialDelayStrategy::new);
        register("linear", LinearDelayStrategy::new);
        register("constant", unit -> new ConstantDelayStrategy(Duration.of(1, unit)));
    }

    private DelayStrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param factory Creates a strategy for a given time unit
     */
    public static void register(String name, Function<ChronoUnit, DelayStrategy> factory) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), factory);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<DelayStrategy> create(String name, ChronoUnit unit) {
        if (name == null) {
            return Optional.empty();
        }
        Function<ChronoUnit, DelayStrategy> factory = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (factory == null) {
            return Optional.empty();
        }
        return Optional.of(factory.apply(unit));
    }

    /**
     * Creates a strategy by name, falling back to the default if the name is unknown.
     */
    public static DelayStrategy createOrDefault(String name, ChronoUnit unit, DelayStrategy defaultStrategy) {
        return create(name, unit).orElse(defaultStrategy);
    }

    /**
     * Parses a unit name such as {@code seconds} or {@code millis}.
     *
     * @throws IllegalArgumentException for an unknown or unsupported unit
     */
    public static ChronoUnit parseUnit(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Delay unit is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("MILLISECONDS") || normalized.equals("MS")) {
            normalized = "MILLIS";
        }
        ChronoUnit unit = ChronoUnit.valueOf(normalized);
        if (unit.isDurationEstimated()) {
            throw new IllegalArgumentException("Delay unit must have an exact duration: " + name);
        }
        return unit;
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
