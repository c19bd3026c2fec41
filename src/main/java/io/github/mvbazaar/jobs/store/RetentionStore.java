package io.github.mvbazaar.jobs.store;

import io.github.mvbazaar.jobs.deletion.DeletionRequestStore;

/**
 * Storage handle given to the job setup. Each job reaches the records it maintains only through these views;
 * atomicity of individual calls is the implementation's concern.
 */
public interface RetentionStore {
    InvitationStore invitations();

    PushTokenStore pushTokens();

    AuditLogStore auditLogs();

    UploadStore uploads();

    UserStore users();

    CollaborationStore collaborations();

    PersonalDataStore personalData();

    DeletionRequestStore deletionRequests();
}
