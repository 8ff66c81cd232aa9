package com.yunhwan.amqp.contract.infra.messaging.codec;

import com.yunhwan.amqp.contract.common.exception.UnsupportedContentEncodingException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * content-encoding 헤더에 따라 payload 압축을 푼다.
 * 지원: gzip, deflate. 헤더가 없거나 identity면 그대로 반환.
 */
public class ContentDecoder {

    public byte[] decode(byte[] body, String contentEncoding) throws IOException {
        if (contentEncoding == null || contentEncoding.isBlank()) {
            return body;
        }
        String encoding = contentEncoding.trim().toLowerCase(Locale.ROOT);
        switch (encoding) {
            case "identity":
                return body;
            case "gzip":
                if (body.length == 0) return body;
                try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
                    return in.readAllBytes();
                }
            case "deflate":
                if (body.length == 0) return body;
                try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(body))) {
                    return in.readAllBytes();
                }
            default:
                throw new UnsupportedContentEncodingException(contentEncoding);
        }
    }
}
