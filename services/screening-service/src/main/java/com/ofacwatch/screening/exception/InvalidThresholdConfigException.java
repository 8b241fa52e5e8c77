package com.ofacwatch.screening.exception;

import com.ofacwatch.common.exception.ConfigurationException;
import com.ofacwatch.common.exception.ErrorCode;

/**
 * Classification thresholds are out of [0,1] or not strictly ordered.
 */
public class InvalidThresholdConfigException extends ConfigurationException {

    public InvalidThresholdConfigException(double highThreshold, double lowThreshold) {
        super(ErrorCode.CONFIG_INVALID_THRESHOLDS,
                ErrorCode.CONFIG_INVALID_THRESHOLDS.getDefaultMessage(),
                "ofacwatch.screening.thresholds",
                "high=" + highThreshold + ", low=" + lowThreshold);
    }
}
