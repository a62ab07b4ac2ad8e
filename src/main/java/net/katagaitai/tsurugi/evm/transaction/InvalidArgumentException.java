package net.katagaitai.tsurugi.evm.transaction;

public class InvalidArgumentException extends IllegalArgumentException {
    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }

    public static InvalidArgumentException notFound(String name) {
        return new InvalidArgumentException("Argument not found: " + name);
    }
}
