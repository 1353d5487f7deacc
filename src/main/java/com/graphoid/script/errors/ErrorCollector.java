package com.graphoid.script.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.graphoid.debug.Debug;

/** Accumulates soft failures while the error mode is {@code :collect}. */
public final class ErrorCollector {
    private static final String TAG = "Errors";

    private final List<ErrorObject> errors = new ArrayList<>();

    public void collect(ErrorObject error) {
        Debug.get().i(TAG, "collected " + error.type + ": " + error.message);
        errors.add(error);
    }

    public List<ErrorObject> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }

    public void clear() {
        errors.clear();
    }
}
