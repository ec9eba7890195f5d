package com.facefinder.common.serialization;

import com.facefinder.common.exception.CorruptIndexException;
import com.facefinder.common.model.IndexKind;
import com.facefinder.common.model.IndexSnapshot;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

public class IndexSnapshotDeserializer {

    public IndexSnapshot deserialize(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        if (data.length < 4 + 1 + 8) {
            throw new CorruptIndexException("Index snapshot truncated: " + data.length + " bytes");
        }

        verifyChecksum(data);

        try {
            ByteBuffer buffer = ByteBuffer.wrap(data, 0, data.length - 8);
            int magic = buffer.getInt();
            if (magic != IndexSnapshotSerializer.MAGIC) {
                throw new CorruptIndexException(String.format("Bad index snapshot magic 0x%08X", magic));
            }
            byte version = buffer.get();
            if (version != IndexSnapshotSerializer.FORMAT_VERSION) {
                throw new CorruptIndexException("Unsupported index snapshot version " + version);
            }

            int dimension = (int) readVarint(buffer);
            IndexKind kind = readKind(buffer.get());
            boolean trained = buffer.get() != 0;
            int probeCount = (int) readVarint(buffer);
            long trainedOn = readVarint(buffer);

            int centroidCount = (int) readVarint(buffer);
            float[][] centroids = new float[centroidCount][];
            for (int c = 0; c < centroidCount; c++) {
                float[] centroid = new float[dimension];
                for (int i = 0; i < dimension; i++) {
                    centroid[i] = buffer.getFloat();
                }
                centroids[c] = centroid;
            }

            int listCount = (int) readVarint(buffer);
            long[][] lists = new long[listCount][];
            for (int l = 0; l < listCount; l++) {
                lists[l] = readIds(buffer);
            }
            long[] tombstones = readIds(buffer);

            if (buffer.hasRemaining()) {
                throw new CorruptIndexException("Trailing bytes after index snapshot: " + buffer.remaining());
            }

            return IndexSnapshot.builder()
                .dimension(dimension)
                .kind(kind)
                .trained(trained)
                .probeCount(probeCount)
                .trainedOn(trainedOn)
                .centroids(centroids)
                .lists(lists)
                .tombstones(tombstones)
                .build();
        } catch (BufferUnderflowException | IllegalStateException | IllegalArgumentException
                 | NegativeArraySizeException e) {
            throw new CorruptIndexException("Failed to decode index snapshot", e);
        }
    }

    private void verifyChecksum(byte[] data) {
        int payloadLength = data.length - 8;
        CRC32 crc = new CRC32();
        crc.update(data, 0, payloadLength);
        long stored = ByteBuffer.wrap(data, payloadLength, 8).getLong();
        if (stored != crc.getValue()) {
            throw new CorruptIndexException("Index snapshot checksum mismatch");
        }
    }

    private IndexKind readKind(byte ordinal) {
        IndexKind[] kinds = IndexKind.values();
        if (ordinal < 0 || ordinal >= kinds.length) {
            throw new CorruptIndexException("Unknown index kind " + ordinal);
        }
        return kinds[ordinal];
    }

    private long[] readIds(ByteBuffer buffer) {
        int size = (int) readVarint(buffer);
        if (size > buffer.remaining()) {
            throw new CorruptIndexException("Id list longer than remaining snapshot bytes");
        }
        long[] ids = new long[size];
        for (int i = 0; i < size; i++) {
            ids[i] = readVarint(buffer);
        }
        return ids;
    }

    long readVarint(ByteBuffer buffer) {
        long result = 0;
        int shift = 0;
        byte b;

        do {
            if (shift >= 64) {
                throw new IllegalStateException("Varint too long");
            }
            b = buffer.get();
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        } while ((b & 0x80) != 0);

        return result;
    }
}
