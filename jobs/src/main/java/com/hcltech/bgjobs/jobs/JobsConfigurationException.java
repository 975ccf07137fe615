package com.hcltech.bgjobs.jobs;

import java.util.List;

/**
 * Invalid barrier configuration. Always thrown before any slot or thread exists.
 */
public class JobsConfigurationException extends IllegalArgumentException {
    private final List<String> errors;

    public JobsConfigurationException(String error) {
        this(List.of(error));
    }

    public JobsConfigurationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
