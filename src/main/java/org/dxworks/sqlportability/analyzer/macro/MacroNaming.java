package org.dxworks.sqlportability.analyzer.macro;

import java.util.Locale;

/**
 * Naming rules shared by the macro generator and the rewriter.
 */
public final class MacroNaming {

    public static final String PORTABLE_PREFIX = "portable_";
    public static final String MACRO_NAMESPACE = "portable";

    private MacroNaming() {
        // utility class
    }

    public static String dispatchName(String functionName) {
        return functionName.toLowerCase(Locale.ROOT);
    }

    public static String portableMacroName(String functionName) {
        return PORTABLE_PREFIX + dispatchName(functionName);
    }

    public static String adapterMacroName(String dialect, String functionName) {
        return dialect + "__" + dispatchName(functionName);
    }
}
