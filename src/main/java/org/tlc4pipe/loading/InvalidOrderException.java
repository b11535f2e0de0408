package org.tlc4pipe.loading;

import java.util.Collections;
import java.util.List;

public class InvalidOrderException extends IllegalArgumentException {

    private final List<String> errors;

    public InvalidOrderException(List<String> errors) {
        super("Invalid order: " + String.join("; ", errors));
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
