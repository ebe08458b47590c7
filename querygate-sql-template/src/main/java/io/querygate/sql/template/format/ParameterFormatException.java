package io.querygate.sql.template.format;

import io.querygate.sql.template.model.SqlFormat;

/**
 * A value could not be rendered safely in the requested format. Recoverable: the template resolver
 * reports the parameter as missing. The message never contains the rejected value.
 */
public class ParameterFormatException extends Exception {

    private final SqlFormat format;

    public ParameterFormatException(SqlFormat format, String message) {
        super(message);
        this.format = format;
    }

    public SqlFormat getFormat() {
        return format;
    }
}
