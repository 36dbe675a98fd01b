package io.mapreducer.error;

/** Invalid or missing run parameters. Raised before any work is started. */
public class ConfigurationException extends SummarizationException {
    private final String key;

    public ConfigurationException(String key, String message) {
        super(ErrorKind.CONFIGURATION, null, null, message, null);
        this.key = key;
    }

    public ConfigurationException(String key, String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, null, null, message, cause);
        this.key = key;
    }

    protected ConfigurationException(Phase phase, Integer segmentIndex, String key, String message) {
        super(ErrorKind.CONFIGURATION, phase, segmentIndex, message, null);
        this.key = key;
    }

    /** Name of the offending configuration key, if the failure is tied to one. */
    public String key() { return key; }
}
