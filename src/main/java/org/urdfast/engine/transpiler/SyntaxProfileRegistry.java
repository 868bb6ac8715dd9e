package org.urdfast.engine.transpiler;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for looking up output profiles by name.
 *
 * Built-in profiles (python, julia, matlab, cpp) are registered
 * automatically. Names are case-insensitive.
 */
public final class SyntaxProfileRegistry {

    private static final Map<String, SyntaxProfile> PROFILES = new ConcurrentHashMap<>();

    static {
        register(SyntaxProfiles.PYTHON);
        register(SyntaxProfiles.JULIA);
        register(SyntaxProfiles.MATLAB);
        register(SyntaxProfiles.CPP);
    }

    private SyntaxProfileRegistry() {
        // Static utility class
    }

    /**
     * Registers a profile.
     * Replaces any existing profile with the same name.
     */
    public static void register(SyntaxProfile profile) {
        PROFILES.put(key(profile.name()), profile);
    }

    /**
     * Gets a profile by name.
     *
     * @throws CodegenConfigurationException if no profile has this name
     */
    public static SyntaxProfile get(String name) {
        SyntaxProfile profile = name == null ? null : PROFILES.get(key(name));
        if (profile == null) {
            throw new CodegenConfigurationException("Unknown syntax profile: " + name +
                    ". Available profiles: " + new TreeSet<>(availableProfiles()));
        }
        return profile;
    }

    /**
     * Gets a profile by name, or null if not found.
     */
    public static SyntaxProfile getOrNull(String name) {
        return PROFILES.get(key(name));
    }

    /**
     * Returns the set of registered profile names.
     */
    public static Set<String> availableProfiles() {
        return Collections.unmodifiableSet(PROFILES.keySet());
    }

    public static boolean isSupported(String name) {
        return PROFILES.containsKey(key(name));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
