package dataval;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "copy", mixinStandardHelpOptions = true, description = "copy a file or folder to a backup location and validate it")
public class Copy implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SOURCE", description = "file or folder to copy")
    private Path source;

    @Option(names = {"--dest"}, description = "destination folder or file, defaults to the root of --tier")
    private Path destination;

    @Option(names = {"--tier"}, description = "tier to copy to when no --dest is given: ${COMPLETION-CANDIDATES}", defaultValue = "ARCHIVE")
    private Tier tier;

    @Option(names = {"--no-validate"}, description = "Don't compare checksums after copying")
    private boolean noValidate;

    @Option(names = {"--recopy"}, description = "Copy even if the destination already has a copy")
    private boolean recopy;

    @Option(names = {"--remove-source"}, description = "Delete the source after a validated copy")
    private boolean removeSource;

    @Option(names = {"--no-session-folder"}, description = "Don't add a session folder to the destination")
    private boolean noSessionFolder;

    @Override
    public Integer call() throws Exception {
        Impl impl = new Impl();
        try {
            CopyOptions options = new CopyOptions(!noSessionFolder, !noValidate, recopy, removeSource);
            Path target = destination != null ? destination : impl.tierRoot(tier);
            List<CopyOutcome> outcomes = impl.copy(source, target, options);
            return outcomes.stream().allMatch(outcome -> outcome.isSuccess() || outcome instanceof CopyOutcome.Skipped) ? 0 : 1;
        } finally {
            impl.shutdown();
        }
    }
}
