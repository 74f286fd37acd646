package org.foxesworld.hotscript.engine.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Typed readers over a {@link Properties} source (System properties by default).
 * Invalid values fall back to the default and are reported once per read.
 */
public final class SysProps {

    private static final Logger log = LogManager.getLogger(SysProps.class);

    private final Properties source;

    public SysProps(Properties source) {
        this.source = source;
    }

    public static SysProps system() {
        return new SysProps(System.getProperties());
    }

    public String str(String key, String def) {
        String raw = source.getProperty(key);
        return (raw == null || raw.isBlank()) ? def : raw.trim();
    }

    public boolean bool(String key, boolean def) {
        String raw = source.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        return Boolean.parseBoolean(raw.trim());
    }

    public int i32(String key, int def, int min) {
        String raw = source.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) {
                log.warn("Property {}={} is below minimum {}, using {}", key, v, min, def);
                return def;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("Property {}='{}' is not an integer, using {}", key, raw, def);
            return def;
        }
    }

    public long i64(String key, long def, long min) {
        String raw = source.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) {
                log.warn("Property {}={} is below minimum {}, using {}", key, v, min, def);
                return def;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("Property {}='{}' is not a number, using {}", key, raw, def);
            return def;
        }
    }

    public <E extends Enum<E>> E enumValue(String key, Class<E> type, E def) {
        String raw = source.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Property {}='{}' is not one of {}, using {}", key, raw, Set.of(type.getEnumConstants()), def);
            return def;
        }
    }

    /** Comma separated list; empty or missing -> defaults. */
    public Set<String> csv(String key, Set<String> defaults) {
        String raw = source.getProperty(key);
        if (raw == null || raw.isBlank()) return defaults;

        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String s : raw.split(",")) {
            String v = s.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? defaults : Set.copyOf(out);
    }
}
