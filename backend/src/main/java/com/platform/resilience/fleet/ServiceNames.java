package com.platform.resilience.fleet;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes service labels so compose labels, trace service names and configuration
 * entries agree: case-folded, '_' unified to '-', common "service" suffixes stripped.
 */
public final class ServiceNames {
    
    private static final List<String> GENERIC_SUFFIXES = List.of("-service", "service");
    
    private ServiceNames() {
    }
    
    public static String normalize(String label) {
        return normalize(label, List.of());
    }
    
    public static String normalize(String label, Collection<String> domainSuffixes) {
        if (label == null) {
            return "";
        }
        String name = label.strip().toLowerCase(Locale.ROOT).replace('_', '-');
        for (String suffix : GENERIC_SUFFIXES) {
            name = stripSuffix(name, suffix);
        }
        for (String suffix : domainSuffixes) {
            name = stripSuffix(name, suffix.strip().toLowerCase(Locale.ROOT).replace('_', '-'));
        }
        return name;
    }
    
    private static String stripSuffix(String name, String suffix) {
        if (!suffix.isEmpty() && name.endsWith(suffix) && name.length() > suffix.length()) {
            return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }
}
