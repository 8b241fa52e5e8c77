package com.ofacwatch.common.exception;

/**
 * Base for configuration values rejected at startup. Carries the offending key and value.
 */
public abstract class ConfigurationException extends OfacWatchException {

    private final String configKey;
    private final String actualValue;

    protected ConfigurationException(ErrorCode errorCode, String message, String configKey, String actualValue) {
        super(errorCode, message);
        this.configKey = configKey;
        this.actualValue = actualValue;
        if (configKey != null) {
            withMetadata("configKey", configKey);
        }
        if (actualValue != null) {
            withMetadata("actualValue", actualValue);
        }
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getActualValue() {
        return actualValue;
    }

    public String getConfigContext() {
        StringBuilder context = new StringBuilder();
        if (configKey != null) context.append("key=").append(configKey);
        if (actualValue != null) context.append(", actual=").append(actualValue);
        return context.toString();
    }

    @Override
    public String getMessage() {
        String baseMessage = super.getMessage();
        String context = getConfigContext();
        if (context.isEmpty()) {
            return baseMessage;
        }
        return baseMessage + " [" + context + "]";
    }
}
