package org.muma.kv.exception;

public class OptionConflictException extends RedisException {

    private final String option;
    private final String conflictsWith;

    public OptionConflictException(String option, String conflictsWith) {
        super(option + " and " + conflictsWith + " options at the same time are not compatible");
        this.option = option;
        this.conflictsWith = conflictsWith;
    }

    public String getOption() {
        return option;
    }

    public String getConflictsWith() {
        return conflictsWith;
    }
}
