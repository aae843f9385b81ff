package com.nayem.tessera.model;

/**
 * Field names understood by {@link Primitive.SetField}.
 */
public final class Fields {

    public static final String NAME = "name";
    public static final String DOCUMENTATION = "documentation";
    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String CONCEPT = "concept";
    public static final String BOUNDS = "bounds";
    public static final String CONTENT = "content";
    public static final String VIEWPOINT = "viewpoint";
    public static final String ACCESS_TYPE = "accessType";
    public static final String STRENGTH = "strength";
    public static final String FILL_COLOR = "fillColor";
    public static final String LINE_COLOR = "lineColor";
    public static final String FONT_COLOR = "fontColor";
    public static final String FONT = "font";
    public static final String OPACITY = "opacity";
    public static final String LINE_WIDTH = "lineWidth";
    public static final String TEXT_POSITION = "textPosition";

    private Fields() {
    }
}
