package org.dendrite.pulse.filesystem.query;

/**
 * 分页或排序参数非法。
 */
public class InvalidQueryParameterException extends IllegalArgumentException {

    public InvalidQueryParameterException(String message) {
        super(message);
    }
}
