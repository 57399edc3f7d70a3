package sdline.it.model;

public enum ObservingPattern {
    RASTER("RASTER"),
    SINGLE_POINT("SINGLE-POINT"),
    MULTI_POINT("MULTI-POINT");

    private final String label;

    ObservingPattern(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isRaster() {
        return this == RASTER;
    }

    public static ObservingPattern fromName(String name) {
        if (name != null) {
            for (ObservingPattern p : values()) {
                if (p.label.equals(name) || p.name().equals(name)) return p;
            }
        }
        throw new IllegalArgumentException("Invalid observing pattern: " + name);
    }
}
