package ai.lintal.rules;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * String-keyed configuration of one rule, read once when the rule is built.
 *
 * <p>Accessors never fail: a missing key yields the documented default, and a value that cannot be parsed yields the
 * default plus a warning. Keys a rule does not ask for are ignored so that richer configuration files keep working.
 */
public final class RuleProperties {
    private static final Logger logger = LogManager.getLogger(RuleProperties.class);

    private static final RuleProperties EMPTY = new RuleProperties("", ImmutableMap.of());

    private final String moduleName;
    private final ImmutableMap<String, String> values;

    private RuleProperties(String moduleName, ImmutableMap<String, String> values) {
        this.moduleName = moduleName;
        this.values = values;
    }

    public static RuleProperties empty() {
        return EMPTY;
    }

    public static RuleProperties of(Map<String, String> values) {
        return new RuleProperties("", ImmutableMap.copyOf(values));
    }

    /** Properties for a named module; the name only shows up in warnings. */
    public static RuleProperties of(String moduleName, Map<String, String> values) {
        return new RuleProperties(moduleName, ImmutableMap.copyOf(values));
    }

    public Map<String, String> asMap() {
        return values;
    }

    public boolean getBoolean(String key, boolean fallback) {
        var raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        var normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) return true;
        if (normalized.equals("false")) return false;
        warnMalformed(key, raw, String.valueOf(fallback));
        return fallback;
    }

    /** Compiles the configured regex; an invalid one falls back to {@code fallback}. */
    public Pattern getPattern(String key, Pattern fallback) {
        var raw = values.get(key);
        if (raw == null) {
            return fallback;
        }
        try {
            return Pattern.compile(raw);
        } catch (PatternSyntaxException e) {
            warnMalformed(key, raw, fallback.pattern());
            return fallback;
        }
    }

    private void warnMalformed(String key, @Nullable String raw, String fallback) {
        logger.warn(
                "Invalid value '{}' for property '{}'{}; using default '{}'",
                raw,
                key,
                moduleName.isEmpty() ? "" : " of " + moduleName,
                fallback);
    }

    @Override
    public String toString() {
        return moduleName.isEmpty() ? values.toString() : moduleName + values;
    }
}
