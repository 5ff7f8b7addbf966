package ai.lintal.rules;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

public class RulePropertiesTest {

    @Test
    public void missingKeysUseDefaults() {
        var props = RuleProperties.empty();

        assertTrue(props.getBoolean("processJavadoc", true));
        assertFalse(props.getBoolean("validateUnnamedVariables", false));
        assertEquals("^x$", props.getPattern("format", Pattern.compile("^x$")).pattern());
    }

    @Test
    public void booleansAreCaseInsensitive() {
        var props = RuleProperties.of(Map.of("a", "TRUE", "b", " false "));

        assertTrue(props.getBoolean("a", false));
        assertFalse(props.getBoolean("b", true));
    }

    @Test
    public void malformedValuesFallBack() {
        var props = RuleProperties.of("Demo", Map.of("flag", "yes", "format", "[a-z"));
        var fallback = Pattern.compile("^[a-z]+$");

        assertTrue(props.getBoolean("flag", true));
        assertFalse(props.getBoolean("flag", false));
        assertSame(fallback, props.getPattern("format", fallback));
    }

    @Test
    public void unknownKeysAreIgnored() {
        var props = RuleProperties.of(Map.of("someFutureOption", "42"));

        assertFalse(props.getBoolean("validateEnhancedForLoopVariable", false));
        assertEquals(Map.of("someFutureOption", "42"), props.asMap());
    }

    @Test
    public void validPatternIsCompiled() {
        var props = RuleProperties.of(Map.of("format", "^[A-Z]+$"));

        assertTrue(props.getPattern("format", Pattern.compile(".*")).matcher("ABC").matches());
    }
}
