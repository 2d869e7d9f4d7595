package dataval;

import picocli.CommandLine;

public class DatavalVersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() throws Exception {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[]{"dataval " + (implementationVersion == null ? "(development)" : implementationVersion)};
    }
}
