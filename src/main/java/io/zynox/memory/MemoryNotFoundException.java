package io.zynox.memory;

/**
 * No memory exists for the requested id.
 */
public class MemoryNotFoundException extends RuntimeException {

    private final String id;

    public MemoryNotFoundException(String id) {
        super("Memory not found: " + id);
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
