package com.ttennebkram.pdpatch.model;

/**
 * Base of errors raised while wiring or looking up nodes.
 */
public class PatchConnectionException extends IllegalArgumentException {

    public PatchConnectionException(String message) {
        super(message);
    }
}
