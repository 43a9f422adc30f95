package io.clusteroperator.configgen;

/**
 * The config payload of one role could not be generated or merged.
 * Blocks that component only; the message ends up in its status reason.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
