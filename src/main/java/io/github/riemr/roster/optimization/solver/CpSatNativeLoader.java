package io.github.riemr.roster.optimization.solver;

import com.google.ortools.Loader;

/** Loads the OR-Tools native libraries once per JVM. */
public final class CpSatNativeLoader {

    private static boolean loaded = false;

    private CpSatNativeLoader() {
    }

    public static synchronized void ensureLoaded() {
        if (!loaded) {
            Loader.loadNativeLibraries();
            loaded = true;
        }
    }
}
