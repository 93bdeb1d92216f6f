package com.printshop_voice_backend.services;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded FIFO of recorded audio chunks. At capacity the oldest chunk is evicted.
 */
public class AudioBuffer {

    private final int maxChunks;
    private final Deque<byte[]> chunks = new ArrayDeque<>();
    private long totalBytes;

    public AudioBuffer(int maxChunks) {
        if (maxChunks < 1) {
            throw new IllegalArgumentException("maxChunks must be positive");
        }
        this.maxChunks = maxChunks;
    }

    /**
     * @return true if the oldest chunk had to be evicted to make room
     */
    public synchronized boolean append(byte[] chunk) {
        boolean evicted = false;
        if (chunks.size() >= maxChunks) {
            byte[] oldest = chunks.pollFirst();
            totalBytes -= oldest.length;
            evicted = true;
        }
        chunks.addLast(chunk);
        totalBytes += chunk.length;
        return evicted;
    }

    /**
     * Concatenate all chunks in arrival order and empty the buffer.
     */
    public synchronized byte[] drain() {
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(totalBytes, Integer.MAX_VALUE));
        for (byte[] chunk : chunks) {
            out.write(chunk, 0, chunk.length);
        }
        clear();
        return out.toByteArray();
    }

    public synchronized void clear() {
        chunks.clear();
        totalBytes = 0;
    }

    public synchronized int size() {
        return chunks.size();
    }

    public synchronized boolean isEmpty() {
        return chunks.isEmpty();
    }

    public synchronized long getTotalBytes() {
        return totalBytes;
    }

    public int getMaxChunks() {
        return maxChunks;
    }
}
