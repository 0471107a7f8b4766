package com.gridmaze.generator;

public class MalformedMazeException extends IllegalArgumentException {

    public MalformedMazeException(String message) {
        super(message);
    }

    public MalformedMazeException(String message, Throwable cause) {
        super(message, cause);
    }
}
