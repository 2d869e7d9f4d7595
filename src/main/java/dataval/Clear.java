package dataval;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "clear", mixinStandardHelpOptions = true, description = "delete files that have a validated backup")
public class Clear implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FOLDER", description = "folders to clear")
    private List<Path> folders;

    @Option(names = {"--no-delete"}, description = "Show what would be deleted")
    private boolean noDelete;

    @Option(names = {"--min-age-days"}, description = "Keep files of sessions younger than this, overrides the config")
    private Integer minAgeDays;

    @Option(names = {"--skip-raw-data-check"}, description = "Clear raw data even if no sorted data is on the archive tier")
    private boolean skipRawDataCheck;

    @Override
    public Integer call() throws Exception {
        Impl impl = new Impl();
        try {
            ClearOptions options = impl.config().getClearOptions().withDryRun(noDelete);
            if (minAgeDays != null) {
                options = options.withMinAgeDays(minAgeDays);
            }
            if (skipRawDataCheck) {
                options = options.withSkipRawDataCheck(true);
            }
            List<ClearSummary> summaries = impl.clearFolders(folders, options);
            return summaries.stream().anyMatch(summary -> summary.failures() > 0) ? 1 : 0;
        } finally {
            impl.shutdown();
        }
    }
}
