package in.launchkit.domain.common;

/**
 * Error taxonomy for LaunchKit operations.
 *
 * Each kind carries the HTTP status a control surface should translate it to.
 */
public enum ErrorKind {
    VALIDATION(400),
    NOT_FOUND(404),
    CONFLICT(409),
    CONFIG_MISSING(400),
    DISABLED(403),
    POLICY_VIOLATION(400),
    EXTERNAL_CALL_FAILED(502),
    RESPONSE_INVALID(502);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
