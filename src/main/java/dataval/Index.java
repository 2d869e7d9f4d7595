package dataval;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "index", mixinStandardHelpOptions = true, description = "add checksums of all files in folders to the record store")
public class Index implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "FOLDER")
    private List<Path> folders;

    @Override
    public Integer call() throws Exception {
        Impl impl = new Impl();
        try {
            impl.index(folders);
            return 0;
        } finally {
            impl.shutdown();
        }
    }
}
