package com.stamp.analysis;

import com.google.common.base.Enums;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Shared functionality for classes that load properties containing configuration information and expose these options
 * via the Config interfaces of Components.
 *
 * Some validation may be performed here, but any interpretation or conditional logic should be provided in Components
 * themselves.
 *
 * An example config file is shipped with the project so it's easy to see an exhaustive list of all parameters. All
 * configuration parameters are therefore required to avoid any confusion due to merging layers of defaults.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String STAMP_PROPERTY_PREFIX = "stamp-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    private static final Map<String, Boolean> BOOLEAN_WORDS =
        ImmutableMap.of("true", true, "yes", true, "false", false, "no", false);

    /**
     * Prepare to load config from the given properties, overriding from environment variables and system properties.
     * In the latter two sources, the keys may be in upper or lower case and use dashes, underscores, or dots as
     * separators. The usual config file keys must be prefixed with "stamp", e.g. STAMP_JOB_THREADS=5 or
     * java -Dstamp.job.threads=5. Precedence is: system properties > environment variables > config file.
     */
    protected ConfigBase (Properties properties) {
        this.properties = properties;
        setPropertiesFromMap(System.getenv(), "environment variable");
        setPropertiesFromMap(System.getProperties(), "system properties");
    }

    /** Static convenience method to uniformly load files into properties and catch errors. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from " + filename, e);
        }
    }

    /** Load properties packaged on the classpath, such as the shipped example configuration. */
    protected static Properties propsFromResource (String resourceName) {
        try (InputStream stream = ConfigBase.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new IllegalArgumentException("No such resource on the classpath: " + resourceName);
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
            return properties;
        } catch (Exception e) {
            throw new RuntimeException("Could not load configuration properties from resource " + resourceName, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
            return null;
        }
        return value.trim();
    }

    protected int intProp (String key) {
        Integer value = parsedProp(key, "an integer", Ints::tryParse);
        return value == null ? 0 : value;
    }

    protected double doubleProp (String key) {
        Double value = parsedProp(key, "a number", Doubles::tryParse);
        return value == null ? Double.NaN : value;
    }

    protected boolean boolProp (String key) {
        // Stricter than Boolean.parseBoolean, which reads any unexpected string as false.
        Boolean value = parsedProp(key, "a boolean", val -> BOOLEAN_WORDS.get(val.toLowerCase(Locale.ROOT)));
        return value != null && value;
    }

    protected <E extends Enum<E>> E enumProp (String key, Class<E> enumClass) {
        String expected = "one of " + Arrays.toString(enumClass.getEnumConstants());
        return parsedProp(key, expected,
            val -> Enums.getIfPresent(enumClass, val.toUpperCase(Locale.ROOT).replace('-', '_')).orNull());
    }

    /**
     * Read a required key through a parser that returns null for unparseable text. Missing and unparseable keys are
     * logged and recorded, and null is returned so that loading can continue.
     */
    private <T> T parsedProp (String key, String expected, Function<String, T> parser) {
        String val = strProp(key);
        if (val == null) return null;
        T parsed = parser.apply(val);
        if (parsed == null) {
            LOG.error("Value of configuration option '{}' could not be parsed as {}: {}", key, expected, val);
            keysWithErrors.add(key);
        }
        return parsed;
    }

    /**
     * Call this after reading all properties to enforce the presence of all configuration options.
     * @throws IllegalStateException naming every missing or unparseable key.
     */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            String message = "You must provide valid values for these configuration properties: "
                + String.join(", ", keysWithErrors);
            LOG.error(message);
            throw new IllegalStateException(message);
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties.
     * Case and separators are normalized to conform to both properties and environment variable conventions.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String) entry.getKey()).toLowerCase(Locale.ROOT).replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(STAMP_PROPERTY_PREFIX)) {
                key = key.substring(STAMP_PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
