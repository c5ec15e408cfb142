package com.querygate.warehouse;

import com.querygate.model.ClassifiedError;

/**
 * Maps engine exceptions onto {@link ClassifiedError}. Implementations must be total: anything they
 * do not recognize is {@link ClassifiedError.Kind#FATAL}, never transient and never logic.
 */
public interface WarehouseErrorClassifier {

    ClassifiedError classify(Throwable error);

    /**
     * Walk the cause chain looking for an instance of {@code type}.
     *
     * @param error root error
     * @param type type to look for
     * @param <T> type
     * @return first match or null
     */
    static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 16) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return null;
    }
}
