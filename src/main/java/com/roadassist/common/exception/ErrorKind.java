package com.roadassist.common.exception;

/**
 * Stable classification of {@link ErrorCode}s.
 *
 * <p>The first four kinds abort the primary operation and roll its transaction back.
 * {@link #EXTERNAL_COLLABORATOR} is raised by best-effort side effects and external
 * lookups; side-effect failures of this kind are recorded and never surface from the
 * call that triggered them.</p>
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    PERMISSION,
    STATE_CONFLICT,
    EXTERNAL_COLLABORATOR
}
