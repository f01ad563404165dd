package com.ttennebkram.pdpatch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of {@link Patcher#validate(boolean)}: connection errors, which make
 * the patch invalid, and cycle warnings, which do not.
 */
public class ValidationReport {

    private final List<PatchConnectionException> errors = new ArrayList<>();
    private final List<CycleWarning> cycleWarnings = new ArrayList<>();

    void addError(PatchConnectionException error) {
        errors.add(error);
    }

    void addCycleWarnings(List<CycleWarning> warnings) {
        cycleWarnings.addAll(warnings);
    }

    public List<PatchConnectionException> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<CycleWarning> getCycleWarnings() {
        return Collections.unmodifiableList(cycleWarnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasCycles() {
        return !cycleWarnings.isEmpty();
    }

    /** Throw the first error, if any. */
    public void throwIfInvalid() {
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
    }

    @Override
    public String toString() {
        return "ValidationReport{errors=" + errors.size() + ", cycles=" + cycleWarnings.size() + "}";
    }
}
