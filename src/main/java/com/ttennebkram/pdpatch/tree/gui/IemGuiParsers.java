package com.ttennebkram.pdpatch.tree.gui;

import com.ttennebkram.pdpatch.tree.Position;

import java.util.List;

/**
 * Recognizes widget objects among {@code #X obj} statements.
 */
public final class IemGuiParsers {

    private IemGuiParsers() {
    }

    /** Check if a class name is one of the widget classes. */
    public static boolean isWidgetClass(String className) {
        switch (className) {
            case BangElement.CLASS_NAME:
            case ToggleElement.CLASS_NAME:
            case NumberBoxElement.CLASS_NAME:
            case SliderElement.VERTICAL:
            case SliderElement.HORIZONTAL:
            case RadioElement.VERTICAL:
            case RadioElement.HORIZONTAL:
            case "vdl":
            case "hdl":
            case CnvElement.CLASS_NAME:
            case VuElement.CLASS_NAME:
                return true;
            default:
                return false;
        }
    }

    /**
     * Parse a widget from its class name and creation arguments.
     *
     * @return the widget, or null when the class is not a widget or the fields
     *         do not fit its layout (too few, or non-numeric where a number is
     *         expected); such boxes stay generic objects
     */
    public static IemGuiElement parse(Position position, String className, List<String> args) {
        try {
            switch (className) {
                case BangElement.CLASS_NAME:
                    return BangElement.fromArguments(position, args);
                case ToggleElement.CLASS_NAME:
                    return ToggleElement.fromArguments(position, args);
                case NumberBoxElement.CLASS_NAME:
                    return NumberBoxElement.fromArguments(position, args);
                case SliderElement.VERTICAL:
                    return SliderElement.fromArguments(true, position, args);
                case SliderElement.HORIZONTAL:
                    return SliderElement.fromArguments(false, position, args);
                case RadioElement.VERTICAL:
                case RadioElement.HORIZONTAL:
                case "vdl":
                case "hdl":
                    return RadioElement.fromArguments(className, position, args);
                case CnvElement.CLASS_NAME:
                    return CnvElement.fromArguments(position, args);
                case VuElement.CLASS_NAME:
                    return VuElement.fromArguments(position, args);
                default:
                    return null;
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            return null;
        }
    }
}
