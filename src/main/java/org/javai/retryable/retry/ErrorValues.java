package org.javai.retryable.retry;

import java.util.List;
import java.util.Map;

/**
 * Recognizes returned values that signal failure without throwing.
 *
 * <p>A value is an error value when it is the tag {@value #ERROR} itself, or when it is
 * tagged with it: a list or array whose first element is the tag, or a map entry whose key is.
 */
public final class ErrorValues {

    public static final String ERROR = "error";

    private ErrorValues() {
        // Utility class
    }

    public static boolean isError(Object value) {
        if (value instanceof List<?> list) {
            return !list.isEmpty() && ERROR.equals(list.get(0));
        }
        if (value instanceof Object[] array) {
            return array.length > 0 && ERROR.equals(array[0]);
        }
        if (value instanceof Map.Entry<?, ?> entry) {
            return ERROR.equals(entry.getKey());
        }
        return ERROR.equals(value);
    }
}
