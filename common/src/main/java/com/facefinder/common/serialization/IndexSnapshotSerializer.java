package com.facefinder.common.serialization;

import com.facefinder.common.model.IndexSnapshot;

import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * Binary serializer for {@link IndexSnapshot}.
 * Format:
 * [magic (4 bytes)] [format version (1 byte)]
 * [dimension (varint)] [kind ordinal (1 byte)] [trained (1 byte)]
 * [probeCount (varint)] [trainedOn (varint)]
 * [centroid count (varint)] [centroids (count * dimension * 4 bytes)]
 * [list count (varint)] for each list: [size (varint)] [ids (varint each)]
 * [tombstone count (varint)] [ids (varint each)]
 * [CRC32 of everything above (8 bytes)]
 */
public class IndexSnapshotSerializer {

    static final int MAGIC = 0x46464958; // "FFIX"
    static final byte FORMAT_VERSION = 1;

    public byte[] serialize(IndexSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }

        int totalSize = calculateSize(snapshot);
        ByteBuffer buffer = ByteBuffer.allocate(totalSize);

        buffer.putInt(MAGIC);
        buffer.put(FORMAT_VERSION);
        writeVarint(buffer, snapshot.dimension());
        buffer.put((byte) snapshot.kind().ordinal());
        buffer.put((byte) (snapshot.trained() ? 1 : 0));
        writeVarint(buffer, snapshot.probeCount());
        writeVarint(buffer, snapshot.trainedOn());

        writeVarint(buffer, snapshot.centroids().length);
        for (float[] centroid : snapshot.centroids()) {
            if (centroid.length != snapshot.dimension()) {
                throw new IllegalArgumentException("Centroid dimension does not match snapshot dimension");
            }
            for (float value : centroid) {
                buffer.putFloat(value);
            }
        }

        writeVarint(buffer, snapshot.lists().length);
        for (long[] list : snapshot.lists()) {
            writeIds(buffer, list);
        }
        writeIds(buffer, snapshot.tombstones());

        CRC32 crc = new CRC32();
        crc.update(buffer.array(), 0, buffer.position());
        buffer.putLong(crc.getValue());

        return buffer.array();
    }

    private void writeIds(ByteBuffer buffer, long[] ids) {
        writeVarint(buffer, ids.length);
        for (long id : ids) {
            writeVarint(buffer, id);
        }
    }

    void writeVarint(ByteBuffer buffer, long value) {
        while ((value & ~0x7FL) != 0) {
            buffer.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        buffer.put((byte) (value & 0x7F));
    }

    int calculateSize(IndexSnapshot snapshot) {
        int size = 4 + 1; // magic + version
        size += varintSize(snapshot.dimension());
        size += 2; // kind + trained
        size += varintSize(snapshot.probeCount());
        size += varintSize(snapshot.trainedOn());

        size += varintSize(snapshot.centroids().length);
        size += snapshot.centroids().length * snapshot.dimension() * 4;

        size += varintSize(snapshot.lists().length);
        for (long[] list : snapshot.lists()) {
            size += idsSize(list);
        }
        size += idsSize(snapshot.tombstones());

        return size + 8; // crc
    }

    private int idsSize(long[] ids) {
        int size = varintSize(ids.length);
        for (long id : ids) {
            size += varintSize(id);
        }
        return size;
    }

    private int varintSize(long value) {
        int size = 0;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size + 1;
    }
}
