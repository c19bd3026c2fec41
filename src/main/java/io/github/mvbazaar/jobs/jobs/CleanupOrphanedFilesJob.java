package io.github.mvbazaar.jobs.jobs;

import io.github.mvbazaar.jobs.retention.RetentionPolicies;
import io.github.mvbazaar.jobs.schedulers.JobResult;
import io.github.mvbazaar.jobs.store.Upload;
import io.github.mvbazaar.jobs.store.UploadStore;
import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;
import org.apache.commons.vfs2.FileSystemManager;
import org.apache.commons.vfs2.VFS;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deletes uploads older than 30 days that no user avatar or project image points at.
 * The physical file goes first; a missing or undeletable file is logged and the record is removed anyway.
 * A record that cannot be removed is reported and the remaining uploads are still processed.
 */
public class CleanupOrphanedFilesJob implements MaintenanceJob {
    private final static Logger logger = LoggerFactory.getLogger(CleanupOrphanedFilesJob.class);

    public static final String NAME = "cleanup-orphaned-files";
    public static final Path DEFAULT_UPLOADS_ROOT = Path.of("/tmp/uploads");

    private final UploadStore uploads;
    private final Path uploadsRoot;
    private final Clock clock;
    private final FileSystemManager fsManager; // may be null, then VFS default manager

    public CleanupOrphanedFilesJob(@NotNull UploadStore uploads, @NotNull Path uploadsRoot, @NotNull Clock clock) {
        this(uploads, uploadsRoot, clock, null);
    }

    public CleanupOrphanedFilesJob(@NotNull UploadStore uploads, @NotNull Path uploadsRoot, @NotNull Clock clock,
                                   @Nullable FileSystemManager fsManager) {
        this.uploads = Objects.requireNonNull(uploads, "uploads");
        this.uploadsRoot = Objects.requireNonNull(uploadsRoot, "uploadsRoot").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.fsManager = fsManager;
    }

    @Override
    public @NotNull String name() {
        return NAME;
    }

    @Override
    public @NotNull String description() {
        return "Delete uploaded files not referenced by any entity older than " + RetentionPolicies.ORPHANED_UPLOAD_DAYS + " days";
    }

    @Override
    public @NotNull String defaultSchedule() {
        return "0 4 * * *";
    }

    public @NotNull Path getUploadsRoot() {
        return uploadsRoot;
    }

    @Override
    public JobResult execute() throws Exception {
        logger.info("Starting cleanup of orphaned uploaded files under {}", uploadsRoot);
        Instant cutoff = RetentionPolicies.ORPHANED_UPLOADS.cutoff(clock.instant());

        List<Upload> oldUploads = uploads.findCreatedBefore(cutoff);
        logger.debug("Found {} old uploads to check", oldUploads.size());

        List<Upload> orphaned = new ArrayList<>();
        for (Upload upload : oldUploads) {
            if (uploads.countReferences(upload.publicUrl()) == 0) {
                orphaned.add(upload);
            }
        }
        logger.debug("Found {} orphaned files to delete", orphaned.size());

        int deletedRecords = 0;
        int deletedFiles = 0;
        List<String> errors = new ArrayList<>();

        FileSystemManager manager = fsManager != null ? fsManager : VFS.getManager();
        try (FileObject root = manager.resolveFile(uploadsRoot.toUri().toString())) {
            for (Upload upload : orphaned) {
                try {
                    if (deletePhysicalFile(root, upload)) {
                        deletedFiles++;
                    }
                    uploads.delete(upload.getId());
                    deletedRecords++;
                } catch (Exception e) {
                    String msg = "Failed to delete upload " + upload.getId() + ": " + e.getMessage();
                    errors.add(msg);
                    logger.error(msg, e);
                }
            }
        }

        logger.info("Orphaned file cleanup completed: checkedCount={}, orphanedCount={}, deletedRecords={}, deletedFiles={}, errors={}",
                oldUploads.size(), orphaned.size(), deletedRecords, deletedFiles, errors.size());
        return JobResult.newBuilder(errors.isEmpty())
                .message("Deleted " + deletedRecords + " orphaned file records and " + deletedFiles + " physical files")
                .detail("checkedCount", oldUploads.size())
                .detail("orphanedCount", orphaned.size())
                .detail("deletedRecords", deletedRecords)
                .detail("deletedFiles", deletedFiles)
                .detail("cutoffDate", cutoff.toString())
                .detail("errors", errors.isEmpty() ? null : List.copyOf(errors))
                .build();
    }

    /**
     * @return true if a file was removed from disk
     */
    private boolean deletePhysicalFile(FileObject root, Upload upload) {
        try (FileObject file = root.resolveFile(upload.getFilename())) {
            if (!root.getName().isDescendent(file.getName())) {
                logger.warn("Upload {} points outside the uploads root, file left in place: {}", upload.getId(), upload.getFilename());
                return false;
            }
            file.refresh();
            if (!file.exists()) {
                logger.warn("Could not delete file, it does not exist: {}", file.getName().getPath());
                return false;
            }
            if (file.delete()) {
                logger.debug("Deleted file: {}", file.getName().getPath());
                return true;
            }
            logger.warn("Could not delete file: {}", file.getName().getPath());
            return false;
        } catch (FileSystemException e) {
            logger.warn("Could not delete file of upload {}: {}", upload.getId(), e.getMessage());
            return false;
        }
    }
}
