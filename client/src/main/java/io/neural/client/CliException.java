// file: client/src/main/java/io/neural/client/CliException.java
package io.neural.client;

/** Usage or server error reported to the user without a stack trace. */
final class CliException extends RuntimeException {
    CliException(String msg) {
        super(msg);
    }
}
