package org.kryon.expr.core;

/**
 * Central configuration class for the expression compiler and VM.
 * Contains the default limits used when no
 * {@link org.kryon.expr.CompilerOptions} override them.
 */
public final class Configuration {

    // Compiler limits
    public static final int defaultMaxInstructions = 65536;

    // VM operand stack
    public static final int defaultInitialStackSize = 16;
    public static final int defaultMaxStackSize = 1024;

    public static final int defaultCacheSize = 256;

    /** Namespace prefixes routed to the builtin registry */
    public static final String[] defaultBuiltinPrefixes = {"string_", "array_", "math_", "type_"};

    /** Classpath resource consulted by {@code CompilerOptions.loadDefault()} */
    public static final String optionsResource = "kryon-expr.yaml";

    // Diagnostics, read once from the environment
    public static final boolean debugEnabled = System.getenv("KRYON_EXPR_DEBUG") != null;
    public static final boolean traceEnabled = System.getenv("KRYON_EXPR_TRACE") != null;

    // Prevent instantiation
    private Configuration() {
    }
}
