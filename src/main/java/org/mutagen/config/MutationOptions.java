package org.mutagen.config;

import com.typesafe.config.Config;
import org.mutagen.compiler.backend.mutation.MutationField;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable options of the mutation pass, read from the {@code mutagen} config block.
 *
 * @param verbosity Compiler log verbosity, 0 (errors) to 4 (trace).
 * @param dumpEnabled Whether method bodies are dumped before and after the pass.
 * @param dumpDirectory Root directory of the dumps.
 * @param markerTypeName Name of the marker runtime type.
 * @param transactional Whether a failed pass leaves the method untouched.
 * @param keyFieldValues Values of the key slots.
 */
public record MutationOptions(
        int verbosity,
        boolean dumpEnabled,
        Path dumpDirectory,
        String markerTypeName,
        boolean transactional,
        Map<MutationField, Integer> keyFieldValues
) {

    public MutationOptions {
        keyFieldValues = Collections.unmodifiableMap(keyFieldValues.isEmpty()
                ? new EnumMap<>(MutationField.class)
                : new EnumMap<>(keyFieldValues));
    }

    /**
     * Parses the options from a resolved configuration containing the {@code mutagen} block
     * (see reference.conf).
     *
     * @param config The configuration.
     * @return The parsed options.
     * @throws IllegalArgumentException if a configured key is not one of KeyI0..KeyI15.
     */
    public static MutationOptions fromConfig(Config config) {
        Config compiler = config.getConfig("mutagen.compiler");
        Config mutation = config.getConfig("mutagen.mutation");

        Map<MutationField, Integer> keys = new EnumMap<>(MutationField.class);
        if (mutation.hasPath("keys")) {
            Config keyConfig = mutation.getConfig("keys");
            for (String name : keyConfig.root().keySet()) {
                MutationField field = MutationField.fromFieldName(name)
                        .orElseThrow(() -> new IllegalArgumentException(
                                "Unknown mutation key '" + name + "' in mutagen.mutation.keys (expected KeyI0..KeyI15)"));
                keys.put(field, keyConfig.getInt(name));
            }
        }

        return new MutationOptions(
                compiler.getInt("verbosity"),
                compiler.getBoolean("dump.enabled"),
                Path.of(compiler.getString("dump.directory")),
                mutation.getString("marker-type"),
                mutation.getBoolean("transactional"),
                keys);
    }
}
