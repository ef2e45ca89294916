package com.github.provjsonld.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

class ProvJsonLdUtils {

    /**
     * Adds a value to a subject. If the value is an array, all values in the
     * array will be added. A property holding more than one value becomes an
     * array.
     *
     * @param subject
     *            the subject to add the value to.
     * @param property
     *            the property that relates the value to the subject.
     * @param value
     *            the value to add.
     * @param allowDuplicate
     *            true to add a value the property already holds.
     */
    @SuppressWarnings("unchecked")
    static void addValue(Map<String, Object> subject, String property, Object value,
            boolean allowDuplicate) {

        if (isArray(value)) {
            for (final Object val : (List<Object>) value) {
                addValue(subject, property, val, allowDuplicate);
            }
        } else if (subject.containsKey(property)) {
            // check if subject already has the value if duplicates not allowed
            final boolean hasValue = !allowDuplicate && hasValue(subject, property, value);

            // make property an array if value not present
            if (!isArray(subject.get(property)) && !hasValue) {
                final List<Object> tmp = new ArrayList<Object>();
                tmp.add(subject.get(property));
                subject.put(property, tmp);
            }

            if (!hasValue) {
                ((List<Object>) subject.get(property)).add(value);
            }
        } else {
            subject.put(property, value);
        }
    }

    static void addValue(Map<String, Object> subject, String property, Object value) {
        addValue(subject, property, value, false);
    }

    /**
     * Determines if the given value is a property of the given subject.
     *
     * @param subject
     *            the subject to check.
     * @param property
     *            the property to check.
     * @param value
     *            the value to check.
     *
     * @return true if the value exists, false if not.
     */
    @SuppressWarnings("unchecked")
    static boolean hasValue(Map<String, Object> subject, String property, Object value) {
        if (!subject.containsKey(property)) {
            return false;
        }
        final Object val = subject.get(property);
        if (isArray(val)) {
            for (final Object item : (List<Object>) val) {
                if (compareValues(value, item)) {
                    return true;
                }
            }
            return false;
        }
        return compareValues(value, val);
    }

    /**
     * Compares two attribute values for equality. Scalars and value objects
     * are equal when their JSON forms are equal.
     */
    static boolean compareValues(Object v1, Object v2) {
        return v1 == null ? v2 == null : v1.equals(v2);
    }

    static boolean isArray(Object v) {
        return (v instanceof List);
    }

    static boolean isObject(Object v) {
        return (v instanceof Map);
    }

    static boolean isString(Object v) {
        return (v instanceof String);
    }
}
