package io.github.mvbazaar.jobs.retention;

/**
 * The retention rules of the maintenance jobs.
 */
public final class RetentionPolicies {
    public static final int PENDING_INVITATION_DAYS = 30;
    public static final int PUSH_TOKEN_INACTIVE_DAYS = 90;
    public static final int ORPHANED_UPLOAD_DAYS = 30;
    public static final int AUDIT_LOG_ANONYMIZE_YEARS = 1;
    public static final int AUDIT_LOG_DELETE_YEARS = 3;
    public static final int DELETION_GRACE_DAYS = 30;

    /** Unresolved invitations. */
    public static final RetentionPolicy PENDING_INVITATIONS =
            RetentionPolicy.ofDays("pending-invitations", PENDING_INVITATION_DAYS);

    /** Push tokens by last use. */
    public static final RetentionPolicy INACTIVE_PUSH_TOKENS =
            RetentionPolicy.ofDays("inactive-push-tokens", PUSH_TOKEN_INACTIVE_DAYS);

    public static final RetentionPolicy ORPHANED_UPLOADS =
            RetentionPolicy.ofDays("orphaned-uploads", ORPHANED_UPLOAD_DAYS);

    public static final RetentionPolicy AUDIT_LOG_ANONYMIZATION =
            RetentionPolicy.ofYears("audit-log-anonymization", AUDIT_LOG_ANONYMIZE_YEARS);

    public static final RetentionPolicy AUDIT_LOG_DELETION =
            RetentionPolicy.ofYears("audit-log-deletion", AUDIT_LOG_DELETE_YEARS);

    /** Grace period between an account deletion request and its finalization. */
    public static final RetentionPolicy ACCOUNT_DELETION_GRACE =
            RetentionPolicy.ofDays("account-deletion-grace", DELETION_GRACE_DAYS);

    private RetentionPolicies() {
    }
}
