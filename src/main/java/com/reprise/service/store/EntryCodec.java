package com.reprise.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reprise.exception.CacheException;
import com.reprise.model.CacheEntry;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Serializes cache entries to JSON and compresses response payloads with GZIP.
 */
public class EntryCodec {

    private final ObjectMapper objectMapper;

    public EntryCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(CacheEntry entry) {
        try {
            return objectMapper.writeValueAsBytes(entry);
        } catch (IOException e) {
            throw new CacheException("Failed to serialize cache entry " + entry.getId(), e);
        }
    }

    public CacheEntry decode(byte[] data) {
        try {
            return objectMapper.readValue(data, CacheEntry.class);
        } catch (IOException e) {
            throw new CacheException("Failed to deserialize cache entry", e);
        }
    }

    /**
     * Compress a payload using GZIP.
     */
    public byte[] compress(byte[] payload) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {

            gzipOut.write(payload);
            gzipOut.finish();

            return baos.toByteArray();
        } catch (IOException e) {
            throw new CacheException("Failed to compress payload", e);
        }
    }

    /**
     * Decompress a GZIP payload.
     */
    public byte[] decompress(byte[] compressed) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(compressed);
             GZIPInputStream gzipIn = new GZIPInputStream(bais);
             ByteArrayOutputStream baos = new ByteArrayOutputStream()) {

            byte[] buffer = new byte[1024];
            int len;
            while ((len = gzipIn.read(buffer)) > 0) {
                baos.write(buffer, 0, len);
            }

            return baos.toByteArray();
        } catch (IOException e) {
            throw new CacheException("Failed to decompress payload", e);
        }
    }

    /**
     * Response bytes as the caller stored them.
     */
    public byte[] responseOf(CacheEntry entry) {
        if (entry.getResponse() == null) {
            return new byte[0];
        }
        return entry.isCompressed() ? decompress(entry.getResponse()) : entry.getResponse();
    }
}
