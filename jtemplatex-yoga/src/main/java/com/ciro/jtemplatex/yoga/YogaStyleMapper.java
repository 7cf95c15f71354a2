package com.ciro.jtemplatex.yoga;

import com.ciro.jtemplatex.style.Align;
import com.ciro.jtemplatex.style.Display;
import com.ciro.jtemplatex.style.Edges;
import com.ciro.jtemplatex.style.FlexDirection;
import com.ciro.jtemplatex.style.FlexWrap;
import com.ciro.jtemplatex.style.Justify;
import com.ciro.jtemplatex.style.Overflow;
import com.ciro.jtemplatex.style.PositionType;
import com.ciro.jtemplatex.style.Style;

import static org.lwjgl.util.yoga.Yoga.*;

/**
 * Copia un {@link Style} sobre un nodo Yoga recién reseteado. Sólo se escriben los
 * valores que difieren del default de Yoga.
 */
final class YogaStyleMapper {

    private YogaStyleMapper() {}

    static void apply(long h, Style s) {
        // Dimensiones
        switch (s.width().unit()) {
            case POINT -> YGNodeStyleSetWidth(h, s.width().value());
            case PERCENT -> YGNodeStyleSetWidthPercent(h, s.width().value());
            case AUTO -> YGNodeStyleSetWidthAuto(h);
        }
        switch (s.height().unit()) {
            case POINT -> YGNodeStyleSetHeight(h, s.height().value());
            case PERCENT -> YGNodeStyleSetHeightPercent(h, s.height().value());
            case AUTO -> YGNodeStyleSetHeightAuto(h);
        }
        if (s.minWidth() > 0) YGNodeStyleSetMinWidth(h, s.minWidth());
        if (s.minHeight() > 0) YGNodeStyleSetMinHeight(h, s.minHeight());
        if (s.maxWidth() < Float.MAX_VALUE) YGNodeStyleSetMaxWidth(h, s.maxWidth());
        if (s.maxHeight() < Float.MAX_VALUE) YGNodeStyleSetMaxHeight(h, s.maxHeight());
        if (!Float.isNaN(s.aspectRatio())) YGNodeStyleSetAspectRatio(h, s.aspectRatio());

        // Cajas
        margin(h, s.margin());
        padding(h, s.padding());
        position(h, s.position());
        if (s.borderWidth() > 0) YGNodeStyleSetBorder(h, YGEdgeAll, s.borderWidth());

        // Flex
        YGNodeStyleSetFlexGrow(h, s.flexGrow());
        YGNodeStyleSetFlexShrink(h, s.flexShrink());
        if (Float.isNaN(s.flexBasis())) YGNodeStyleSetFlexBasisAuto(h);
        else YGNodeStyleSetFlexBasis(h, s.flexBasis());

        YGNodeStyleSetFlexDirection(h, flexDirection(s.flexDirection()));
        YGNodeStyleSetFlexWrap(h, wrap(s.flexWrap()));
        YGNodeStyleSetJustifyContent(h, justify(s.justifyContent()));
        YGNodeStyleSetAlignItems(h, align(s.alignItems()));
        YGNodeStyleSetAlignSelf(h, align(s.alignSelf()));
        YGNodeStyleSetAlignContent(h, align(s.alignContent()));
        YGNodeStyleSetPositionType(h, s.positionType() == PositionType.ABSOLUTE
                ? YGPositionTypeAbsolute : YGPositionTypeRelative);
        YGNodeStyleSetDisplay(h, s.display() == Display.NONE ? YGDisplayNone : YGDisplayFlex);
        YGNodeStyleSetOverflow(h, overflow(s.overflow()));
    }

    private static void margin(long h, Edges e) {
        if (!Float.isNaN(e.left())) YGNodeStyleSetMargin(h, YGEdgeLeft, e.left());
        if (!Float.isNaN(e.top())) YGNodeStyleSetMargin(h, YGEdgeTop, e.top());
        if (!Float.isNaN(e.right())) YGNodeStyleSetMargin(h, YGEdgeRight, e.right());
        if (!Float.isNaN(e.bottom())) YGNodeStyleSetMargin(h, YGEdgeBottom, e.bottom());
    }

    private static void padding(long h, Edges e) {
        if (!Float.isNaN(e.left())) YGNodeStyleSetPadding(h, YGEdgeLeft, e.left());
        if (!Float.isNaN(e.top())) YGNodeStyleSetPadding(h, YGEdgeTop, e.top());
        if (!Float.isNaN(e.right())) YGNodeStyleSetPadding(h, YGEdgeRight, e.right());
        if (!Float.isNaN(e.bottom())) YGNodeStyleSetPadding(h, YGEdgeBottom, e.bottom());
    }

    private static void position(long h, Edges e) {
        if (!Float.isNaN(e.left())) YGNodeStyleSetPosition(h, YGEdgeLeft, e.left());
        if (!Float.isNaN(e.top())) YGNodeStyleSetPosition(h, YGEdgeTop, e.top());
        if (!Float.isNaN(e.right())) YGNodeStyleSetPosition(h, YGEdgeRight, e.right());
        if (!Float.isNaN(e.bottom())) YGNodeStyleSetPosition(h, YGEdgeBottom, e.bottom());
    }

    static int flexDirection(FlexDirection d) {
        return switch (d) {
            case ROW -> YGFlexDirectionRow;
            case ROW_REVERSE -> YGFlexDirectionRowReverse;
            case COLUMN -> YGFlexDirectionColumn;
            case COLUMN_REVERSE -> YGFlexDirectionColumnReverse;
        };
    }

    static int wrap(FlexWrap w) {
        return switch (w) {
            case NO_WRAP -> YGWrapNoWrap;
            case WRAP -> YGWrapWrap;
            case WRAP_REVERSE -> YGWrapReverse;
        };
    }

    static int justify(Justify j) {
        return switch (j) {
            case FLEX_START -> YGJustifyFlexStart;
            case CENTER -> YGJustifyCenter;
            case FLEX_END -> YGJustifyFlexEnd;
            case SPACE_BETWEEN -> YGJustifySpaceBetween;
            case SPACE_AROUND -> YGJustifySpaceAround;
            case SPACE_EVENLY -> YGJustifySpaceEvenly;
        };
    }

    static int align(Align a) {
        return switch (a) {
            case AUTO -> YGAlignAuto;
            case FLEX_START -> YGAlignFlexStart;
            case CENTER -> YGAlignCenter;
            case FLEX_END -> YGAlignFlexEnd;
            case STRETCH -> YGAlignStretch;
            case BASELINE -> YGAlignBaseline;
            case SPACE_BETWEEN -> YGAlignSpaceBetween;
            case SPACE_AROUND -> YGAlignSpaceAround;
        };
    }

    static int overflow(Overflow o) {
        return switch (o) {
            case VISIBLE -> YGOverflowVisible;
            case HIDDEN -> YGOverflowHidden;
            case SCROLL -> YGOverflowScroll;
        };
    }
}
