package sdline.it.model;

public enum WindowMode {
    REPLACE,
    MERGE;

    public static WindowMode fromName(String name) {
        if ("replace".equals(name)) return REPLACE;
        if ("merge".equals(name)) return MERGE;
        throw new IllegalArgumentException("linewindowmode must be either 'replace' or 'merge'.");
    }
}
