package dataval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The known checksum algorithms, ordered from cheapest to most expensive.
 * <p>
 * A provider is self tested once before the first checksum it computes is trusted.
 */
public class ChecksumRegistry {

    private final Logger logger = LoggerFactory.getLogger("dataval");

    private final Map<String, ChecksumProvider> providers = new LinkedHashMap<>();
    private final Map<String, Boolean> selfTested = new ConcurrentHashMap<>();

    public ChecksumRegistry(List<ChecksumProvider> providers) {
        for (ChecksumProvider provider : providers) {
            this.providers.put(provider.algorithmName(), provider);
        }
    }

    public static ChecksumRegistry defaultRegistry() {
        return new ChecksumRegistry(List.of(
                new Crc32ChecksumProvider(),
                new Sha3ChecksumProvider(),
                new Sha256ChecksumProvider()));
    }

    public ChecksumProvider get(String algorithm) {
        ChecksumProvider provider = providers.get(algorithm);
        if (provider == null) {
            throw new IllegalArgumentException("unknown checksum algorithm " + algorithm);
        }
        return provider;
    }

    public boolean supports(String algorithm) {
        return providers.containsKey(algorithm);
    }

    public List<String> algorithms() {
        return new ArrayList<>(providers.keySet());
    }

    public String compute(String algorithm, Path path) throws IOException {
        ChecksumProvider provider = get(algorithm);
        ensureSelfTested(provider);
        logger.debug("computing {} for {}", algorithm, path);
        return provider.compute(path);
    }

    /**
     * @return the first algorithm in registry order that is among the candidates, or the
     * cheapest registered algorithm if none is
     */
    public String cheapest(Collection<String> candidates) {
        for (String algorithm : providers.keySet()) {
            if (candidates.contains(algorithm)) {
                return algorithm;
            }
        }
        return providers.keySet().iterator().next();
    }

    public int rank(String algorithm) {
        int i = 0;
        for (String name : providers.keySet()) {
            if (name.equals(algorithm)) {
                return i;
            }
            i++;
        }
        return Integer.MAX_VALUE;
    }

    void ensureSelfTested(ChecksumProvider provider) {
        boolean passed = selfTested.computeIfAbsent(provider.algorithmName(), name -> {
            boolean result = provider.selfTest();
            if (result) {
                logger.debug("checksum self test passed for {}", name);
            } else {
                logger.error("checksum self test failed for {}", name);
            }
            return result;
        });
        if (!passed) {
            throw new ChecksumSelfTestException(provider.algorithmName());
        }
    }
}
