package io.gdcc.repository.collections.error;

public class NotFoundException extends CollectionException {
    private final String pid;

    public NotFoundException(String pid) {
        super("Object not found: " + pid);
        this.pid = pid;
    }

    public String pid() {
        return pid;
    }
}
