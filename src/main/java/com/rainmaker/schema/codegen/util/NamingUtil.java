package com.rainmaker.schema.codegen.util;

import java.util.Locale;

/**
 * Deterministic naming rules for synthesized models, enums and relation fields.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Upper-cases the first character only: {@code shippingAddress -> ShippingAddress}.
     */
    public static String capitalize(String str) {
        if (str == null || str.isEmpty()) {
            return str;
        }
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }

    /**
     * Model name for an object nested directly in a field.
     */
    public static String nestedModelName(String parentModel, String fieldName) {
        return parentModel + capitalize(fieldName);
    }

    /**
     * Model name for the object element of an array field.
     */
    public static String arrayItemModelName(String parentModel, String fieldName) {
        return parentModel + capitalize(fieldName) + "Item";
    }

    /**
     * Enum name; unique without a registry because model and field names are.
     */
    public static String enumName(String parentModel, String fieldName) {
        return parentModel + capitalize(fieldName) + "Enum";
    }

    public static String defaultRelationName(String fromModel, String toModel) {
        return fromModel + "To" + toModel;
    }

    public static String foreignKeyName(String relationField) {
        return relationField + "Id";
    }

    /**
     * Field name used on the far side of a relation: the originating model
     * name, lower-cased.
     */
    public static String inverseFieldName(String originModel) {
        return originModel.toLowerCase(Locale.ROOT);
    }
}
