package dataval;

public class InvalidChecksumException extends IllegalArgumentException {

    public InvalidChecksumException(String checksum, String algorithm) {
        super("'" + checksum + "' is not a valid " + algorithm + " checksum");
    }
}
