package com.nayem.tessera.model;

/**
 * Position and size of a diagram object. Null components are left unchanged.
 */
public record Bounds(Integer x, Integer y, Integer width, Integer height) {

    public static final int DEFAULT_WIDTH = 120;
    public static final int DEFAULT_HEIGHT = 55;

    public static Bounds defaults(Integer x, Integer y, Integer width, Integer height) {
        return new Bounds(
                x != null ? x : 0,
                y != null ? y : 0,
                width != null ? width : DEFAULT_WIDTH,
                height != null ? height : DEFAULT_HEIGHT);
    }

    /**
     * Overlays the non-null components of {@code patch} onto this bounds.
     */
    public Bounds merge(Bounds patch) {
        return new Bounds(
                patch.x != null ? patch.x : x,
                patch.y != null ? patch.y : y,
                patch.width != null ? patch.width : width,
                patch.height != null ? patch.height : height);
    }
}
