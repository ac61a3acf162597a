package net.wizeops.tiercache.exceptions;

import lombok.Getter;

@Getter
public class ValidationException extends CacheException {
    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }
}
