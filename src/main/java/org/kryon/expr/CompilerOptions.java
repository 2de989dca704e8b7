package org.kryon.expr;

import org.kryon.expr.core.Configuration;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Per-engine compiler and VM settings.
 * <p>
 * Defaults come from {@link Configuration}. Options can also be read from a
 * YAML document whose keys are the field names:
 * <pre>
 * constantFolding: true
 * deadCodeElimination: true
 * debugInfo: false
 * builtinPrefixes: [string_, array_, math_, type_]
 * initialStackSize: 16
 * maxStackSize: 1024
 * maxInstructions: 65536
 * cacheSize: 256
 * </pre>
 * Missing keys keep their defaults; unknown keys are rejected.
 */
public class CompilerOptions implements Cloneable {
    public boolean constantFolding = true;
    public boolean deadCodeElimination = true;
    public boolean debugInfo = false; // Store the JSON source echo on each compiled unit
    public List<String> builtinPrefixes = new ArrayList<>(Arrays.asList(Configuration.defaultBuiltinPrefixes));
    public int initialStackSize = Configuration.defaultInitialStackSize;
    public int maxStackSize = Configuration.defaultMaxStackSize;
    public int maxInstructions = Configuration.defaultMaxInstructions;
    public int cacheSize = Configuration.defaultCacheSize;

    /**
     * @return true if {@code name} starts with one of the builtin prefixes
     */
    public boolean isBuiltinName(String name) {
        if (name == null) {
            return false;
        }
        for (String prefix : builtinPrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses options from a YAML document.
     *
     * @throws IllegalArgumentException if the document is not a mapping, names an
     *                                  unknown option or gives an option the wrong type
     */
    public static CompilerOptions fromYaml(String yaml) {
        LoadSettings settings = LoadSettings.builder()
                .setLabel(Configuration.optionsResource)
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid options document: " + e.getMessage(), e);
        }
        CompilerOptions options = new CompilerOptions();
        if (document == null) {
            return options;
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Options document must be a mapping");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            options.set(String.valueOf(entry.getKey()), entry.getValue());
        }
        return options;
    }

    public static CompilerOptions fromYaml(InputStream in) throws IOException {
        return fromYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    }

    /**
     * Loads {@code kryon-expr.yaml} from the classpath, or returns the defaults if
     * there is no such resource.
     */
    public static CompilerOptions loadDefault() {
        try (InputStream in = CompilerOptions.class.getClassLoader()
                .getResourceAsStream(Configuration.optionsResource)) {
            if (in == null) {
                return new CompilerOptions();
            }
            return fromYaml(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + Configuration.optionsResource, e);
        }
    }

    private void set(String key, Object value) {
        switch (key) {
            case "constantFolding":
                constantFolding = toBoolean(key, value);
                break;
            case "deadCodeElimination":
                deadCodeElimination = toBoolean(key, value);
                break;
            case "debugInfo":
                debugInfo = toBoolean(key, value);
                break;
            case "builtinPrefixes":
                if (!(value instanceof List)) {
                    throw new IllegalArgumentException("Option '" + key + "' must be a list");
                }
                List<String> prefixes = new ArrayList<>();
                for (Object prefix : (List<?>) value) {
                    prefixes.add(String.valueOf(prefix));
                }
                builtinPrefixes = prefixes;
                break;
            case "initialStackSize":
                initialStackSize = toPositiveInt(key, value);
                break;
            case "maxStackSize":
                maxStackSize = toPositiveInt(key, value);
                break;
            case "maxInstructions":
                maxInstructions = toPositiveInt(key, value);
                break;
            case "cacheSize":
                cacheSize = toPositiveInt(key, value);
                break;
            default:
                throw new IllegalArgumentException("Unknown option '" + key + "'");
        }
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("Option '" + key + "' must be true or false");
    }

    private static int toPositiveInt(String key, Object value) {
        if (value instanceof Number) {
            long n = ((Number) value).longValue();
            if (n > 0 && n <= Integer.MAX_VALUE) {
                return (int) n;
            }
        }
        throw new IllegalArgumentException("Option '" + key + "' must be a positive integer");
    }

    @Override
    public CompilerOptions clone() {
        try {
            CompilerOptions copy = (CompilerOptions) super.clone();
            copy.builtinPrefixes = new ArrayList<>(builtinPrefixes);
            return copy;
        } catch (CloneNotSupportedException e) {
            // This shouldn't happen, since we're implementing Cloneable
            throw new AssertionError();
        }
    }

    @Override
    public String toString() {
        return "CompilerOptions{\n" +
                "    constantFolding=" + constantFolding + ",\n" +
                "    deadCodeElimination=" + deadCodeElimination + ",\n" +
                "    debugInfo=" + debugInfo + ",\n" +
                "    builtinPrefixes=" + builtinPrefixes + ",\n" +
                "    initialStackSize=" + initialStackSize + ",\n" +
                "    maxStackSize=" + maxStackSize + ",\n" +
                "    maxInstructions=" + maxInstructions + ",\n" +
                "    cacheSize=" + cacheSize + "\n" +
                "}";
    }
}
