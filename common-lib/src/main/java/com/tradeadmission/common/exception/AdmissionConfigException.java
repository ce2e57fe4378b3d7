package com.tradeadmission.common.exception;

/**
 * An admission limit or portfolio snapshot that violates configured bounds.
 * {@link #getSetting()} names the offending setting, e.g. {@code capacity}.
 */
public class AdmissionConfigException extends RuntimeException {
    private final String setting;

    public AdmissionConfigException(String setting, String message) {
        super("[" + setting + "] " + message);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
