package dataval;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "status", mixinStandardHelpOptions = true, description = "show the backup status of files")
public class Status implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FILE")
    private List<Path> files;

    @Option(names = {"--complete-checksums"}, description = "Compute missing checksums of unconfirmed backups")
    private boolean completeChecksums;

    @Override
    public Integer call() throws Exception {
        Impl impl = new Impl();
        try {
            impl.status(files, completeChecksums);
            return 0;
        } finally {
            impl.shutdown();
        }
    }
}
