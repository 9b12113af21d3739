package com.tsa.exception;

import java.util.List;

/**
 * Exception thrown when conditions refer to each other in a cycle through
 * their secondary blocks.
 */
public class DependencyCycleException extends TsaException {

    private final List<String> members;

    public DependencyCycleException(List<String> members) {
        super(ErrorKind.DEPENDENCY_CYCLE, "Conditions refer to each other in a cycle: " + members);
        this.members = List.copyOf(members);
    }

    public List<String> getMembers() {
        return members;
    }
}
