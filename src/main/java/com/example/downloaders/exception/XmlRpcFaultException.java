package com.example.downloaders.exception;

import lombok.Getter;

/** A {@code <fault>} element returned by an XML-RPC server. */
@Getter
public class XmlRpcFaultException extends DownloaderException {
    private final int faultCode;
    private final String faultString;

    public XmlRpcFaultException(int faultCode, String faultString) {
        super(Kind.PROTOCOL, "XML-RPC Fault: " + (faultString == null || faultString.isEmpty()
                ? "fault code " + faultCode
                : faultString));
        this.faultCode = faultCode;
        this.faultString = faultString;
    }
}
