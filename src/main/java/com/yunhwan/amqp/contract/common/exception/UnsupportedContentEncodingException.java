package com.yunhwan.amqp.contract.common.exception;

public class UnsupportedContentEncodingException extends RuntimeException {

    public UnsupportedContentEncodingException(String contentEncoding) {
        super("Unsupported content-encoding: \"" + contentEncoding + "\". Supported encodings are: gzip, deflate");
    }
}
