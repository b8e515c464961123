package energy;

import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import energy.ml.CriticalValueSource;
import energy.ml.FeatureAugmentation;

/**
 * Run settings. Each key is read from a JVM system property first, then from the environment;
 * missing or malformed values fall back to the default.
 * <pre>
 * energy.windowSize     / ENERGY_WINDOW_SIZE      default 20
 * energy.criticalValues / ENERGY_CRITICAL_VALUES  TABULATED | EXACT, default TABULATED
 * energy.output         / ENERGY_OUTPUT           TEXT | JSON, default TEXT
 * </pre>
 */
public class ForecastConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ForecastConfig.class);

    public static final int DEFAULT_WINDOW_SIZE = 20;

    public enum OutputFormat { TEXT, JSON }

    private final int windowSize;
    private final CriticalValueSource criticalValues;
    private final OutputFormat outputFormat;

    public ForecastConfig(int windowSize, CriticalValueSource criticalValues, OutputFormat outputFormat) {
        this.windowSize = windowSize;
        this.criticalValues = criticalValues;
        this.outputFormat = outputFormat;
    }

    /** Settings from system properties and the process environment. */
    public static ForecastConfig load() {
        return fromLookups(System::getProperty, System::getenv);
    }

    public static ForecastConfig from(Map<String, String> properties, Map<String, String> env) {
        return fromLookups(properties::get, env::get);
    }

    static ForecastConfig fromLookups(Function<String, String> properties, Function<String, String> env) {
        int windowSize = DEFAULT_WINDOW_SIZE;
        String ws = lookup(properties, env, "energy.windowSize", "ENERGY_WINDOW_SIZE");
        if (ws != null) {
            try {
                int parsed = Integer.parseInt(ws.trim());
                if (parsed > FeatureAugmentation.FEATURES) {
                    windowSize = parsed;
                } else {
                    LOGGER.warn("Ignoring window size {}, must exceed {}. Using {}", parsed, FeatureAugmentation.FEATURES,
                        DEFAULT_WINDOW_SIZE);
                }
            } catch (NumberFormatException e) {
                LOGGER.warn("Ignoring window size \"{}\", not an integer. Using {}", ws, DEFAULT_WINDOW_SIZE);
            }
        }
        CriticalValueSource criticalValues = parseEnum(CriticalValueSource.class, CriticalValueSource.TABULATED,
            lookup(properties, env, "energy.criticalValues", "ENERGY_CRITICAL_VALUES"));
        OutputFormat output = parseEnum(OutputFormat.class, OutputFormat.TEXT,
            lookup(properties, env, "energy.output", "ENERGY_OUTPUT"));
        return new ForecastConfig(windowSize, criticalValues, output);
    }

    /** Copy with a different output format. */
    public ForecastConfig withOutputFormat(OutputFormat format) {
        return new ForecastConfig(windowSize, criticalValues, format);
    }

    public int getWindowSize() { return windowSize; }
    public CriticalValueSource getCriticalValues() { return criticalValues; }
    public OutputFormat getOutputFormat() { return outputFormat; }

    private static String lookup(Function<String, String> properties, Function<String, String> env,
                                 String property, String variable) {
        String v = properties.apply(property);
        if (v == null || v.isBlank()) v = env.apply(variable);
        return (v == null || v.isBlank()) ? null : v;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, E def, String value) {
        if (value == null) return def;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Ignoring unknown {} \"{}\". Using {}", type.getSimpleName(), value, def);
            return def;
        }
    }

    @Override
    public String toString() {
        return "ForecastConfig[windowSize=" + windowSize + ", criticalValues=" + criticalValues + ", output=" + outputFormat + "]";
    }
}
