package dataval;

/**
 * @param addSessionSubdir      put the file below a session folder in the destination if the destination has none
 * @param validate              compare checksums of source and copy afterwards
 * @param allowRecopy           copy even if the destination already holds a copy
 * @param removeSourceOnSuccess delete the source once the copy is validated, implies {@code validate}
 */
public record CopyOptions(boolean addSessionSubdir,
                          boolean validate,
                          boolean allowRecopy,
                          boolean removeSourceOnSuccess) {

    public CopyOptions {
        if (removeSourceOnSuccess) {
            validate = true;
        }
    }

    public static CopyOptions defaults() {
        return new CopyOptions(true, true, false, false);
    }

    public CopyOptions withValidate(boolean validate) {
        return new CopyOptions(addSessionSubdir, validate, allowRecopy, removeSourceOnSuccess);
    }

    public CopyOptions withAllowRecopy(boolean allowRecopy) {
        return new CopyOptions(addSessionSubdir, validate, allowRecopy, removeSourceOnSuccess);
    }

    public CopyOptions withRemoveSourceOnSuccess(boolean removeSourceOnSuccess) {
        return new CopyOptions(addSessionSubdir, validate, allowRecopy, removeSourceOnSuccess);
    }

    public CopyOptions withAddSessionSubdir(boolean addSessionSubdir) {
        return new CopyOptions(addSessionSubdir, validate, allowRecopy, removeSourceOnSuccess);
    }
}
