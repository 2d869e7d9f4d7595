package dataval;

public class ChecksumSelfTestException extends RuntimeException {

    public ChecksumSelfTestException(String algorithm) {
        super("checksum self test failed for " + algorithm);
    }
}
