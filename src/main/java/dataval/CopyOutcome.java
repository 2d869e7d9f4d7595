package dataval;

import java.nio.file.Path;

public sealed interface CopyOutcome permits CopyOutcome.Copied, CopyOutcome.AlreadyValid, CopyOutcome.Skipped,
        CopyOutcome.Refused, CopyOutcome.Failed {

    Path source();

    default boolean isSuccess() {
        return this instanceof Copied || this instanceof AlreadyValid;
    }

    record Copied(Path source, Path destination, int attempts, boolean validated, boolean sourceRemoved) implements CopyOutcome {
    }

    record AlreadyValid(Path source, Path destination, boolean sourceRemoved) implements CopyOutcome {
    }

    record Skipped(Path source, Path destination, String reason) implements CopyOutcome {
    }

    record Refused(Path source, Path destination, String reason) implements CopyOutcome {
    }

    record Failed(Path source, Reason reason) implements CopyOutcome {

        public enum Reason {
            NOT_FOUND,
            IO,
            RETRY_EXHAUSTED,
            ERROR
        }
    }
}
