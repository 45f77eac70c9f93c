package com.questrail.thing.description;

/**
 * Indicates that a Thing description, or a value embedded in it, could not be
 * rendered as JSON.
 */
public final class DescriptionEncodingException extends RuntimeException
{
    public DescriptionEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
