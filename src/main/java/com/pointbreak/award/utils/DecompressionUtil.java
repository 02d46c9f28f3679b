package com.pointbreak.award.utils;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;
import com.github.luben.zstd.ZstdInputStream;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.DataFormatException;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;

/**
 * Decodes upstream bodies. The synthetic client advertises gzip, deflate and br itself, so OkHttp
 * leaves the body encoded and it is decoded here.
 */
public class DecompressionUtil {

    private static final Logger logger = LoggerFactory.getLogger(DecompressionUtil.class);
    private static final int BUFFER_SIZE = 8192;
    private static boolean brotliLoaded = false;

    static {
        try {
            Brotli4jLoader.ensureAvailability();
            brotliLoaded = true;
            logger.info("Brotli native library loaded successfully");
        } catch (Throwable e) {
            logger.warn("Brotli native library not available: {}", e.getMessage());
        }
    }

    private DecompressionUtil() {
    }

    /**
     * Reads and decodes an OkHttp response body using its Content-Encoding header.
     *
     * @return the decoded body, or an empty string when there is none
     * @throws IOException if the body cannot be read or decoded
     */
    public static String decompressResponse(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return "";
        }
        return decompress(body.bytes(), response.header("Content-Encoding"));
    }

    /**
     * Decodes bytes per the given Content-Encoding. Missing or unknown encodings fall back to
     * magic-byte detection, then to plain UTF-8.
     */
    public static String decompress(byte[] data, String contentEncoding) throws IOException {
        if (data == null || data.length == 0) {
            return "";
        }
        String encoding = contentEncoding == null ? "" : contentEncoding.toLowerCase(Locale.ROOT).trim();
        logger.debug("Decoding {} bytes (Content-Encoding: '{}')", data.length, encoding);

        switch (encoding) {
            case "br":
                return decompressWithBrotli(data);
            case "zstd":
                return readAll(new ZstdInputStream(new ByteArrayInputStream(data)));
            case "gzip":
            case "x-gzip":
                return readAll(new GZIPInputStream(new ByteArrayInputStream(data)));
            case "deflate":
                return inflate(data);
            case "":
            case "identity":
                return detectAndDecode(data);
            default:
                logger.warn("Unknown Content-Encoding '{}', trying magic bytes", encoding);
                return detectAndDecode(data);
        }
    }

    private static String detectAndDecode(byte[] data) throws IOException {
        if (data.length >= 2) {
            int b0 = data[0] & 0xFF;
            int b1 = data[1] & 0xFF;

            // GZIP: 1F 8B
            if (b0 == 0x1F && b1 == 0x8B) {
                return readAll(new GZIPInputStream(new ByteArrayInputStream(data)));
            }
            // Zstandard: 28 B5 2F FD
            if (data.length >= 4 && b0 == 0x28 && b1 == 0xB5
                    && (data[2] & 0xFF) == 0x2F && (data[3] & 0xFF) == 0xFD) {
                return readAll(new ZstdInputStream(new ByteArrayInputStream(data)));
            }
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    private static String decompressWithBrotli(byte[] data) throws IOException {
        if (!brotliLoaded) {
            throw new IOException("Brotli native library not loaded");
        }
        return readAll(new BrotliInputStream(new ByteArrayInputStream(data)));
    }

    // zlib-wrapped first, raw DEFLATE as fallback
    private static String inflate(byte[] data) throws IOException {
        try {
            return inflate(data, false);
        } catch (IOException e) {
            logger.debug("zlib inflate failed, retrying raw: {}", e.getMessage());
            return inflate(data, true);
        }
    }

    private static String inflate(byte[] data, boolean nowrap) throws IOException {
        Inflater inflater = new Inflater(nowrap);
        try (ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(data.length * 2, BUFFER_SIZE))) {
            inflater.setInput(data);
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int count;
                try {
                    count = inflater.inflate(buffer);
                } catch (DataFormatException e) {
                    throw new IOException("Invalid DEFLATE data: " + e.getMessage(), e);
                }
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                out.write(buffer, 0, count);
            }
            if (!inflater.finished()) {
                throw new IOException("Truncated DEFLATE stream");
            }
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            inflater.end();
        }
    }

    private static String readAll(InputStream in) throws IOException {
        try (InputStream stream = in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int len;
            while ((len = stream.read(buffer)) > 0) {
                out.write(buffer, 0, len);
            }
            return out.toString(StandardCharsets.UTF_8);
        }
    }
}
