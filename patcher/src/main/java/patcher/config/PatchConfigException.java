package patcher.config;

/**
 * Exception thrown when patch configuration cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>Configuration file cannot be parsed (invalid YAML/properties syntax)</li>
 *   <li>A catalog section is incomplete (e.g. field types without a declaration)</li>
 * </ul>
 *
 * <p>This is an unchecked exception to allow configuration loading to be
 * integrated into initialization code without forced exception handling.
 *
 * @see PatchConfigLoader
 * @see PatchConfig
 */
public class PatchConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public PatchConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public PatchConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
