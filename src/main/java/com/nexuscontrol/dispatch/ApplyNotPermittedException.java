package com.nexuscontrol.dispatch;

/**
 * An apply-mode run was refused before anything was recorded. The router
 * never downgrades such a request to a dry run.
 */
public class ApplyNotPermittedException extends RuntimeException {

    public ApplyNotPermittedException(String message) {
        super(message);
    }
}
