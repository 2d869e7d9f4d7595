package dataval;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Result of evaluating the backups of one file.
 *
 * @param selves     the subject plus every store entry describing the same file
 * @param backups    backup candidates that exist on disk, in tier order
 * @param bestBackup the backup the status is based on, if any
 */
public record BackupEvaluation(FileRecord subject,
                               BackupStatus status,
                               List<FileRecord> matches,
                               List<FileRecord> selves,
                               List<Backup> backups,
                               @Nullable Backup bestBackup) {

    /**
     * @param kind the best classification of the backup against any of the selves
     */
    public record Backup(Tier tier, FileRecord record, MatchKind kind) {
    }

    public boolean isDeletable() {
        return status.isDeletable();
    }
}
