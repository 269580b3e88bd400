package io.databrain.error;

/**
 * A query or mutation referenced an id that does not exist.
 */
public class NotFoundException extends BrainException {

    private final String id;

    public NotFoundException(String what, String id) {
        super("%s not found: %s".formatted(what, id));
        this.id = id;
    }

    public String id() {
        return id;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
