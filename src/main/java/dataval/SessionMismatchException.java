package dataval;

public class SessionMismatchException extends RuntimeException {

    public SessionMismatchException(String message) {
        super(message);
    }
}
