package com.nexuscontrol.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.PrintStream;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference adapter that prints every call to a stream instead of executing
 * it. Declares both {@code dry_run} and {@code apply} and never fails.
 *
 * Human-readable line: {@code <prefix> [<timestamp>] <tool>.<method> [<args>]},
 * where args longer than 100 characters are cut to 97 plus {@code ...}.
 */
public class StdoutAdapter implements DispatchAdapter {

    public static final String KIND = "stdout";

    static final int MAX_ARGS_LENGTH = 100;

    private static final Set<String> CAPABILITIES = Set.of(Capabilities.DRY_RUN, Capabilities.APPLY);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .build();

    private static final AdapterManifest MANIFEST = new AdapterManifest(
        AdapterManifest.SCHEMA_VERSION,
        KIND,
        CAPABILITIES.stream().toList(),
        ">=0.12,<2.0",
        manifestConfigSchema(),
        List.of()
    );

    private final Options options;
    private final PrintStream sink;
    private final Clock clock;

    public StdoutAdapter(Options options, PrintStream sink, Clock clock) {
        this.options = options;
        this.sink = sink;
        this.clock = clock;
    }

    public StdoutAdapter(Options options) {
        this(options, System.out, Clock.systemUTC());
    }

    /**
     * Builds an adapter from a loose configuration map, as found in adapter
     * config files. Unknown keys are ignored; mistyped values fall back to
     * defaults.
     */
    public static StdoutAdapter create(Map<String, ?> config) {
        return new StdoutAdapter(Options.fromMap(config));
    }

    @Override
    public String adapterId() {
        return options.adapterId();
    }

    @Override
    public String adapterKind() {
        return KIND;
    }

    @Override
    public Set<String> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public AdapterManifest manifest() {
        return MANIFEST;
    }

    public Options options() {
        return options;
    }

    @Override
    public Map<String, Object> call(String tool, String method, Map<String, Object> args) {
        Map<String, Object> safeArgs = args == null ? Map.of() : args;
        String timestamp = options.includeTimestamp() ? clock.instant().toString() : null;

        String line = options.jsonOutput()
            ? jsonLine(tool, method, safeArgs, timestamp)
            : humanLine(tool, method, safeArgs, timestamp);
        sink.println(line);

        if (!options.returnEcho()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("echoed", true);
        echo.put("tool", tool);
        echo.put("method", method);
        echo.put("args", safeArgs);
        echo.put("adapter_id", options.adapterId());
        return echo;
    }

    private String humanLine(String tool, String method, Map<String, Object> args, String timestamp) {
        StringBuilder line = new StringBuilder(options.prefix());
        if (timestamp != null) {
            line.append(' ').append(timestamp);
        }
        line.append(' ').append(tool).append('.').append(method);
        if (options.includeArgs() && !args.isEmpty()) {
            String rendered = toJson(args);
            if (rendered.length() > MAX_ARGS_LENGTH) {
                rendered = rendered.substring(0, MAX_ARGS_LENGTH - 3) + "...";
            }
            line.append(' ').append(rendered);
        }
        return line.toString();
    }

    private String jsonLine(String tool, String method, Map<String, Object> args, String timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tool", tool);
        data.put("method", method);
        if (timestamp != null) {
            data.put("timestamp", timestamp);
        }
        if (options.includeArgs()) {
            data.put("args", args);
        }
        return toJson(data);
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            // printing must not fail the call
            return String.valueOf(value);
        }
    }

    private static Map<String, AdapterManifest.ConfigOption> manifestConfigSchema() {
        Map<String, AdapterManifest.ConfigOption> schema = new LinkedHashMap<>();
        schema.put("adapter_id", AdapterManifest.ConfigOption.optional("string", null,
            "Custom adapter ID (defaults to 'stdout')"));
        schema.put("prefix", AdapterManifest.ConfigOption.optional("string", Options.DEFAULT_PREFIX,
            "Prefix for output lines"));
        schema.put("include_timestamp", AdapterManifest.ConfigOption.optional("boolean", true,
            "Include ISO timestamp in output"));
        schema.put("include_args", AdapterManifest.ConfigOption.optional("boolean", true,
            "Include full args in output"));
        schema.put("json_output", AdapterManifest.ConfigOption.optional("boolean", false,
            "Output as JSON instead of human-readable"));
        schema.put("return_echo", AdapterManifest.ConfigOption.optional("boolean", true,
            "Return the call info in the result"));
        return schema;
    }

    public record Options(
        String adapterId,
        String prefix,
        boolean includeTimestamp,
        boolean includeArgs,
        boolean jsonOutput,
        boolean returnEcho
    ) {

        public static final String DEFAULT_PREFIX = "[nexus]";

        public Options {
            adapterId = adapterId == null || adapterId.isBlank() ? KIND : adapterId;
            prefix = prefix == null ? DEFAULT_PREFIX : prefix;
        }

        public static Options defaults() {
            return new Options(KIND, DEFAULT_PREFIX, true, true, false, true);
        }

        static Options fromMap(Map<String, ?> config) {
            Map<String, ?> source = config == null ? Map.of() : config;
            return new Options(
                source.get("adapter_id") instanceof String id ? id : null,
                source.get("prefix") instanceof String p ? p : null,
                flag(source.get("include_timestamp"), true),
                flag(source.get("include_args"), true),
                flag(source.get("json_output"), false),
                flag(source.get("return_echo"), true)
            );
        }

        private static boolean flag(Object raw, boolean fallback) {
            return raw instanceof Boolean value ? value : fallback;
        }
    }
}
