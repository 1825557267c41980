package com.ndf.cnl.error;

/** A single line of CNL could not be parsed. */
public class CnlParseException extends CnlException {
    public CnlParseException(int line, String message) {
        super(ErrorKind.PARSE_ERROR, line, null, message + " (line " + line + ")");
    }
}
