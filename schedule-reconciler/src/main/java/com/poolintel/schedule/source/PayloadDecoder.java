package com.poolintel.schedule.source;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Decodes upstream payloads, honouring a leading byte-order mark.
 * Some city feeds are served as UTF-16LE with a BOM despite a JSON content type.
 */
public final class PayloadDecoder {

    private PayloadDecoder() {
    }

    public static String decode(byte[] body) {
        if (body == null || body.length == 0) return "";

        if (startsWith(body, 0xFF, 0xFE)) {
            return decode(body, 2, StandardCharsets.UTF_16LE);
        }
        if (startsWith(body, 0xFE, 0xFF)) {
            return decode(body, 2, StandardCharsets.UTF_16BE);
        }
        if (startsWith(body, 0xEF, 0xBB, 0xBF)) {
            return decode(body, 3, StandardCharsets.UTF_8);
        }
        return new String(body, StandardCharsets.UTF_8);
    }

    private static String decode(byte[] body, int offset, Charset charset) {
        return new String(body, offset, body.length - offset, charset);
    }

    private static boolean startsWith(byte[] body, int... prefix) {
        if (body.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if ((body[i] & 0xFF) != prefix[i]) return false;
        }
        return true;
    }
}
