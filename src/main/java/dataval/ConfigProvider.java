package dataval;

import java.nio.file.Path;
import java.util.Map;

public interface ConfigProvider {

    Map<Tier, Path> getTierRoots();

    Path getStoreFile();

    String getChecksumAlgorithm();

    long getAutoChecksumThresholdBytes();

    long getRegenerateThresholdBytes();

    ClearOptions getClearOptions();

    int getWorkers();
}
