package org.databridge.hierarchy;

/**
 * A project or hierarchy id that does not exist.
 */
public class NotFoundException extends IllegalArgumentException {

    public NotFoundException(String message) {
        super(message);
    }
}
