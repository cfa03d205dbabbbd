package in.livebid.domain.event;

public enum CloseReason {
    /** End time reached. */
    EXPIRED,
    /** Explicit administrative close. */
    ADMIN
}
