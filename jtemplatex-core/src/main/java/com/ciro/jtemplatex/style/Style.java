package com.ciro.jtemplatex.style;

import java.util.Objects;

/**
 * Estilo de un nodo: box model, propiedades flex, decoración y texto.
 * <p>
 * Es un valor inmutable. Se reemplaza entero (nunca campo a campo) y se compara por
 * igualdad de valor: el differ marca el estilo completo como cambiado ante cualquier
 * diferencia. Los floats se comparan con {@link Float#compare} así que NaN == NaN.
 */
public final class Style {

    public static final Style DEFAULT = builder().build();

    // --- Layout ---
    private final Dimension width;
    private final Dimension height;
    private final float minWidth;
    private final float minHeight;
    private final float maxWidth;
    private final float maxHeight;
    private final Edges margin;
    private final Edges padding;
    private final Edges position;
    private final float flexGrow;
    private final float flexShrink;
    private final float flexBasis;
    private final FlexDirection flexDirection;
    private final FlexWrap flexWrap;
    private final Justify justifyContent;
    private final Align alignItems;
    private final Align alignSelf;
    private final Align alignContent;
    private final PositionType positionType;
    private final float aspectRatio;
    private final Overflow overflow;
    private final Display display;
    private final Visibility visibility;

    // --- Decoración ---
    private final String backgroundColor;
    private final float borderWidth;
    private final String borderColor;
    private final float cornerRadius;
    private final Shadow shadow;
    private final float opacity;
    private final boolean clipsToBounds;

    // --- Texto ---
    private final float fontSize;
    private final String fontWeight;
    private final String textColor;
    private final TextAlign textAlign;
    private final float lineHeight;
    private final float letterSpacing;
    private final int numberOfLines;

    private Style(Builder b) {
        this.width = b.width;
        this.height = b.height;
        this.minWidth = b.minWidth;
        this.minHeight = b.minHeight;
        this.maxWidth = b.maxWidth;
        this.maxHeight = b.maxHeight;
        this.margin = b.margin;
        this.padding = b.padding;
        this.position = b.position;
        this.flexGrow = b.flexGrow;
        this.flexShrink = b.flexShrink;
        this.flexBasis = b.flexBasis;
        this.flexDirection = b.flexDirection;
        this.flexWrap = b.flexWrap;
        this.justifyContent = b.justifyContent;
        this.alignItems = b.alignItems;
        this.alignSelf = b.alignSelf;
        this.alignContent = b.alignContent;
        this.positionType = b.positionType;
        this.aspectRatio = b.aspectRatio;
        this.overflow = b.overflow;
        this.display = b.display;
        this.visibility = b.visibility;
        this.backgroundColor = b.backgroundColor;
        this.borderWidth = b.borderWidth;
        this.borderColor = b.borderColor;
        this.cornerRadius = b.cornerRadius;
        this.shadow = b.shadow;
        this.opacity = b.opacity;
        this.clipsToBounds = b.clipsToBounds;
        this.fontSize = b.fontSize;
        this.fontWeight = b.fontWeight;
        this.textColor = b.textColor;
        this.textAlign = b.textAlign;
        this.lineHeight = b.lineHeight;
        this.letterSpacing = b.letterSpacing;
        this.numberOfLines = b.numberOfLines;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public Dimension width()            { return width; }
    public Dimension height()           { return height; }
    public float minWidth()             { return minWidth; }
    public float minHeight()            { return minHeight; }
    public float maxWidth()             { return maxWidth; }
    public float maxHeight()            { return maxHeight; }
    public Edges margin()               { return margin; }
    public Edges padding()              { return padding; }
    public Edges position()             { return position; }
    public float flexGrow()             { return flexGrow; }
    public float flexShrink()           { return flexShrink; }
    public float flexBasis()            { return flexBasis; }
    public FlexDirection flexDirection(){ return flexDirection; }
    public FlexWrap flexWrap()          { return flexWrap; }
    public Justify justifyContent()     { return justifyContent; }
    public Align alignItems()           { return alignItems; }
    public Align alignSelf()            { return alignSelf; }
    public Align alignContent()         { return alignContent; }
    public PositionType positionType()  { return positionType; }
    public float aspectRatio()          { return aspectRatio; }
    public Overflow overflow()          { return overflow; }
    public Display display()            { return display; }
    public Visibility visibility()      { return visibility; }
    public String backgroundColor()     { return backgroundColor; }
    public float borderWidth()          { return borderWidth; }
    public String borderColor()         { return borderColor; }
    public float cornerRadius()         { return cornerRadius; }
    public Shadow shadow()              { return shadow; }
    public float opacity()              { return opacity; }
    public boolean clipsToBounds()      { return clipsToBounds; }
    public float fontSize()             { return fontSize; }
    public String fontWeight()          { return fontWeight; }
    public String textColor()           { return textColor; }
    public TextAlign textAlign()        { return textAlign; }
    public float lineHeight()           { return lineHeight; }
    public float letterSpacing()        { return letterSpacing; }
    public int numberOfLines()          { return numberOfLines; }

    /**
     * true si el nodo pinta algo propio (fondo, borde, esquinas, sombra, transparencia,
     * recorte) o está oculto. Un contenedor sin efecto visual puede aplanarse.
     */
    public boolean hasVisualEffect() {
        return backgroundColor != null
                || borderWidth > 0
                || cornerRadius > 0
                || shadow.isVisible()
                || opacity < 1f
                || clipsToBounds
                || overflow != Overflow.VISIBLE
                || visibility != Visibility.VISIBLE
                || display != Display.FLEX;
    }

    /**
     * Compara sólo los campos que afectan al layout (incluye los de texto, que cambian
     * la medición). Un cambio de color no obliga a recalcular frames.
     */
    public boolean needsRelayout(Style other) {
        if (other == null) return true;
        if (this == other) return false;
        return !(width.equals(other.width)
                && height.equals(other.height)
                && Float.compare(minWidth, other.minWidth) == 0
                && Float.compare(minHeight, other.minHeight) == 0
                && Float.compare(maxWidth, other.maxWidth) == 0
                && Float.compare(maxHeight, other.maxHeight) == 0
                && margin.equals(other.margin)
                && padding.equals(other.padding)
                && position.equals(other.position)
                && Float.compare(flexGrow, other.flexGrow) == 0
                && Float.compare(flexShrink, other.flexShrink) == 0
                && Float.compare(flexBasis, other.flexBasis) == 0
                && flexDirection == other.flexDirection
                && flexWrap == other.flexWrap
                && justifyContent == other.justifyContent
                && alignItems == other.alignItems
                && alignSelf == other.alignSelf
                && alignContent == other.alignContent
                && positionType == other.positionType
                && Float.compare(aspectRatio, other.aspectRatio) == 0
                && display == other.display
                && Float.compare(borderWidth, other.borderWidth) == 0
                && Float.compare(fontSize, other.fontSize) == 0
                && Objects.equals(fontWeight, other.fontWeight)
                && Float.compare(lineHeight, other.lineHeight) == 0
                && Float.compare(letterSpacing, other.letterSpacing) == 0
                && numberOfLines == other.numberOfLines);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Style s)) return false;
        return !needsRelayout(s)
                && overflow == s.overflow
                && visibility == s.visibility
                && Objects.equals(backgroundColor, s.backgroundColor)
                && Objects.equals(borderColor, s.borderColor)
                && Float.compare(cornerRadius, s.cornerRadius) == 0
                && shadow.equals(s.shadow)
                && Float.compare(opacity, s.opacity) == 0
                && clipsToBounds == s.clipsToBounds
                && Objects.equals(textColor, s.textColor)
                && textAlign == s.textAlign;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height, minWidth, minHeight, maxWidth, maxHeight,
                margin, padding, position, flexGrow, flexShrink, flexBasis,
                flexDirection, flexWrap, justifyContent, alignItems, alignSelf, alignContent,
                positionType, aspectRatio, overflow, display, visibility,
                backgroundColor, borderWidth, borderColor, cornerRadius, shadow, opacity, clipsToBounds,
                fontSize, fontWeight, textColor, textAlign, lineHeight, letterSpacing, numberOfLines);
    }

    @Override
    public String toString() {
        return "Style{w=" + width + ", h=" + height
                + ", dir=" + flexDirection.css()
                + ", grow=" + flexGrow
                + ", display=" + display.css()
                + (backgroundColor != null ? ", bg=" + backgroundColor : "")
                + "}";
    }

    public static final class Builder {
        private Dimension width = Dimension.AUTO;
        private Dimension height = Dimension.AUTO;
        private float minWidth = 0;
        private float minHeight = 0;
        private float maxWidth = Float.MAX_VALUE;
        private float maxHeight = Float.MAX_VALUE;
        private Edges margin = Edges.ZERO;
        private Edges padding = Edges.ZERO;
        private Edges position = Edges.UNDEFINED;
        private float flexGrow = 0;
        private float flexShrink = 1;
        private float flexBasis = Float.NaN;
        private FlexDirection flexDirection = FlexDirection.COLUMN;
        private FlexWrap flexWrap = FlexWrap.NO_WRAP;
        private Justify justifyContent = Justify.FLEX_START;
        private Align alignItems = Align.STRETCH;
        private Align alignSelf = Align.AUTO;
        private Align alignContent = Align.FLEX_START;
        private PositionType positionType = PositionType.RELATIVE;
        private float aspectRatio = Float.NaN;
        private Overflow overflow = Overflow.VISIBLE;
        private Display display = Display.FLEX;
        private Visibility visibility = Visibility.VISIBLE;
        private String backgroundColor;
        private float borderWidth = 0;
        private String borderColor;
        private float cornerRadius = 0;
        private Shadow shadow = Shadow.NONE;
        private float opacity = 1f;
        private boolean clipsToBounds = false;
        private float fontSize = 14f;
        private String fontWeight = "normal";
        private String textColor;
        private TextAlign textAlign = TextAlign.LEFT;
        private float lineHeight = Float.NaN;
        private float letterSpacing = 0;
        private int numberOfLines = 0;

        private Builder() {
        }

        private Builder(Style s) {
            this.width = s.width;
            this.height = s.height;
            this.minWidth = s.minWidth;
            this.minHeight = s.minHeight;
            this.maxWidth = s.maxWidth;
            this.maxHeight = s.maxHeight;
            this.margin = s.margin;
            this.padding = s.padding;
            this.position = s.position;
            this.flexGrow = s.flexGrow;
            this.flexShrink = s.flexShrink;
            this.flexBasis = s.flexBasis;
            this.flexDirection = s.flexDirection;
            this.flexWrap = s.flexWrap;
            this.justifyContent = s.justifyContent;
            this.alignItems = s.alignItems;
            this.alignSelf = s.alignSelf;
            this.alignContent = s.alignContent;
            this.positionType = s.positionType;
            this.aspectRatio = s.aspectRatio;
            this.overflow = s.overflow;
            this.display = s.display;
            this.visibility = s.visibility;
            this.backgroundColor = s.backgroundColor;
            this.borderWidth = s.borderWidth;
            this.borderColor = s.borderColor;
            this.cornerRadius = s.cornerRadius;
            this.shadow = s.shadow;
            this.opacity = s.opacity;
            this.clipsToBounds = s.clipsToBounds;
            this.fontSize = s.fontSize;
            this.fontWeight = s.fontWeight;
            this.textColor = s.textColor;
            this.textAlign = s.textAlign;
            this.lineHeight = s.lineHeight;
            this.letterSpacing = s.letterSpacing;
            this.numberOfLines = s.numberOfLines;
        }

        public Builder width(Dimension v)            { this.width = Objects.requireNonNull(v); return this; }
        public Builder width(float points)           { return width(Dimension.points(points)); }
        public Builder height(Dimension v)           { this.height = Objects.requireNonNull(v); return this; }
        public Builder height(float points)          { return height(Dimension.points(points)); }
        public Builder minWidth(float v)             { this.minWidth = v; return this; }
        public Builder minHeight(float v)            { this.minHeight = v; return this; }
        public Builder maxWidth(float v)             { this.maxWidth = v; return this; }
        public Builder maxHeight(float v)            { this.maxHeight = v; return this; }
        public Builder margin(Edges v)               { this.margin = Objects.requireNonNull(v); return this; }
        public Builder padding(Edges v)              { this.padding = Objects.requireNonNull(v); return this; }
        public Builder position(Edges v)             { this.position = Objects.requireNonNull(v); return this; }
        public Builder flexGrow(float v)             { this.flexGrow = v; return this; }
        public Builder flexShrink(float v)           { this.flexShrink = v; return this; }
        public Builder flexBasis(float v)            { this.flexBasis = v; return this; }
        public Builder flexDirection(FlexDirection v){ this.flexDirection = Objects.requireNonNull(v); return this; }
        public Builder flexWrap(FlexWrap v)          { this.flexWrap = Objects.requireNonNull(v); return this; }
        public Builder justifyContent(Justify v)     { this.justifyContent = Objects.requireNonNull(v); return this; }
        public Builder alignItems(Align v)           { this.alignItems = Objects.requireNonNull(v); return this; }
        public Builder alignSelf(Align v)            { this.alignSelf = Objects.requireNonNull(v); return this; }
        public Builder alignContent(Align v)         { this.alignContent = Objects.requireNonNull(v); return this; }
        public Builder positionType(PositionType v)  { this.positionType = Objects.requireNonNull(v); return this; }
        public Builder aspectRatio(float v)          { this.aspectRatio = v; return this; }
        public Builder overflow(Overflow v)          { this.overflow = Objects.requireNonNull(v); return this; }
        public Builder display(Display v)            { this.display = Objects.requireNonNull(v); return this; }
        public Builder visibility(Visibility v)      { this.visibility = Objects.requireNonNull(v); return this; }
        public Builder backgroundColor(String v)     { this.backgroundColor = v; return this; }
        public Builder borderWidth(float v)          { this.borderWidth = v; return this; }
        public Builder borderColor(String v)         { this.borderColor = v; return this; }
        public Builder cornerRadius(float v)         { this.cornerRadius = v; return this; }
        public Builder shadow(Shadow v)              { this.shadow = v == null ? Shadow.NONE : v; return this; }
        public Builder opacity(float v)              { this.opacity = v; return this; }
        public Builder clipsToBounds(boolean v)      { this.clipsToBounds = v; return this; }
        public Builder fontSize(float v)             { this.fontSize = v; return this; }
        public Builder fontWeight(String v)          { this.fontWeight = v; return this; }
        public Builder textColor(String v)           { this.textColor = v; return this; }
        public Builder textAlign(TextAlign v)        { this.textAlign = Objects.requireNonNull(v); return this; }
        public Builder lineHeight(float v)           { this.lineHeight = v; return this; }
        public Builder letterSpacing(float v)        { this.letterSpacing = v; return this; }
        public Builder numberOfLines(int v)          { this.numberOfLines = v; return this; }

        public Style build() {
            return new Style(this);
        }
    }
}
