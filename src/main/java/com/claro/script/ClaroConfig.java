package com.claro.script;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IllegalFormatException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Engine settings, bound from JSON.
 *
 * Defaults come from the classpath resource {@code claro-defaults.json}; a user file given
 * with {@code --config} overrides only the keys it names. Unknown keys are rejected.
 */
public final class ClaroConfig {

    public static final String DEFAULTS_RESOURCE = "/claro-defaults.json";

    private static final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private int maxCallDepth = 200;

    private boolean debug;

    private String inputPrompt = "Enter value for %s: ";

    private boolean traceIndent;

    public ClaroConfig() {}

    /** Settings from the bundled defaults resource. */
    public static ClaroConfig defaults() {
        try (InputStream in = ClaroConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return new ClaroConfig();
            return om.readValue(in, ClaroConfig.class).validated(DEFAULTS_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    /** Defaults overlaid with the keys present in {@code file}. */
    public static ClaroConfig load(Path file) throws IOException {
        return defaults().overlay(Files.readString(file), file.toString());
    }

    /** This config overlaid with the keys present in {@code json}. */
    public ClaroConfig overlay(String json, String sourceName) throws IOException {
        ClaroConfig copy = copy();
        ObjectReader reader = om.readerForUpdating(copy);
        try {
            reader.readValue(json);
        } catch (IOException e) {
            throw new IOException("Invalid configuration in " + sourceName + ": " + e.getMessage(), e);
        }
        return copy.validated(sourceName);
    }

    ClaroConfig validated(String sourceName) {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException(sourceName + ": maxCallDepth must be positive, got " + maxCallDepth);
        }
        if (inputPrompt == null) {
            throw new IllegalArgumentException(sourceName + ": inputPrompt must not be null");
        }
        checkPromptFormat(sourceName, inputPrompt);
        return this;
    }

    /** The prompt is formatted with the variable name as its only argument. */
    private static void checkPromptFormat(String sourceName, String prompt) {
        try {
            String.format(prompt, "name");
        } catch (IllegalFormatException e) {
            throw new IllegalArgumentException(sourceName + ": inputPrompt '" + prompt
                    + "' is not a valid format for one string argument: " + e.getMessage(), e);
        }
    }

    private ClaroConfig copy() {
        ClaroConfig c = new ClaroConfig();
        c.maxCallDepth = maxCallDepth;
        c.debug = debug;
        c.inputPrompt = inputPrompt;
        c.traceIndent = traceIndent;
        return c;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMaxCallDepth(int maxCallDepth) { this.maxCallDepth = maxCallDepth; }

    public boolean isDebug() { return debug; }

    public void setDebug(boolean debug) { this.debug = debug; }

    public String getInputPrompt() { return inputPrompt; }

    public void setInputPrompt(String inputPrompt) { this.inputPrompt = inputPrompt; }

    public boolean isTraceIndent() { return traceIndent; }

    public void setTraceIndent(boolean traceIndent) { this.traceIndent = traceIndent; }
}
