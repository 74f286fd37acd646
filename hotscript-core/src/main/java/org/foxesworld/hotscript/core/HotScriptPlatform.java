package org.foxesworld.hotscript.core;

public final class HotScriptPlatform {

    public static final String NAME = "HotScript";
    public static final String VERSION = "1.0.0";

    public static String java() {
        return System.getProperty("java.version");
    }

    public static String os() {
        return System.getProperty("os.name") + " " + System.getProperty("os.version");
    }

    public static int cores() {
        return Runtime.getRuntime().availableProcessors();
    }

    private HotScriptPlatform() {}
}
