package com.example.kiosksync.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public class GzipCodec {

    private static final Logger logger = LoggerFactory.getLogger(GzipCodec.class);

    public byte[] compress(byte[] data, String label) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException("Compressing " + label + " failed", e);
        }
        byte[] compressed = out.toByteArray();
        if (logger.isDebugEnabled()) {
            double ratio = data.length == 0 ? 0.0 : 100.0 * (data.length - compressed.length) / data.length;
            logger.debug("Compressed {}: {} -> {} bytes ({}% saved)", label, data.length, compressed.length,
                    String.format("%.1f", ratio));
        }
        return compressed;
    }

    public byte[] decompress(byte[] data, String label) {
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return gzip.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Decompressing " + label + " failed", e);
        }
    }
}
