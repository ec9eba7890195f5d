package com.facefinder.storage.service;

import com.facefinder.common.model.BoundingBox;
import com.facefinder.common.model.FaceRecord;
import com.facefinder.common.model.NewFace;
import com.facefinder.common.model.RoomInfo;
import com.facefinder.storage.TestFaces;
import com.facefinder.storage.config.StorageProperties;
import com.facefinder.storage.index.VectorIndex;
import com.facefinder.storage.kv.EmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FaceStorageServiceInvariantTest {

    private static final String ROOM = "room";

    @Mock
    private EmbeddingStore store;

    @Mock
    private VectorIndex index;

    private FaceStorageServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new FaceStorageServiceImpl(store, index, new StorageProperties());
        when(store.getRoomInfo(ROOM)).thenReturn(Optional.of(RoomInfo.forNewRoom(ROOM, ROOM, 4)));
    }

    @Test
    @DisplayName("Index and store disagreeing after an insert forces a rebuild")
    void mismatchAfterInsertRebuilds() {
        NewFace face = TestFaces.face("p.jpg", 1, 0, 0, 0);
        List<FaceRecord> records = List.of(record(1));
        when(store.appendBatch(ROOM, List.of(face))).thenReturn(records);
        when(store.activeCount(ROOM)).thenReturn(1L);
        when(index.activeCount(ROOM)).thenReturn(0);

        service.insert(ROOM, face);

        verify(index).insert(ROOM, records);
        verify(index).rebuild(ROOM);
    }

    @Test
    void consistentInsertDoesNotRebuild() {
        NewFace face = TestFaces.face("p.jpg", 1, 0, 0, 0);
        when(store.appendBatch(ROOM, List.of(face))).thenReturn(List.of(record(1)));
        when(store.activeCount(ROOM)).thenReturn(1L);
        when(index.activeCount(ROOM)).thenReturn(1);

        service.insert(ROOM, face);

        verify(index, never()).rebuild(ROOM);
    }

    @Test
    void mismatchAfterDeleteRebuilds() {
        when(store.removeByPhoto(ROOM, "p.jpg")).thenReturn(List.of(1L, 2L));
        when(store.activeCount(ROOM)).thenReturn(3L);
        when(index.activeCount(ROOM)).thenReturn(5);

        assertThat(service.deleteByPhoto(ROOM, "p.jpg")).isEqualTo(2);

        verify(index).markDeleted(ROOM, List.of(1L, 2L));
        verify(index).rebuild(ROOM);
    }

    @Test
    void deleteOfUnknownPhotoLeavesIndexAlone() {
        when(store.removeByPhoto(ROOM, "p.jpg")).thenReturn(List.of());

        assertThat(service.deleteByPhoto(ROOM, "p.jpg")).isZero();

        verify(index, never()).markDeleted(any(), any());
    }

    private FaceRecord record(long id) {
        return FaceRecord.builder()
            .id(id)
            .roomId(ROOM)
            .photo("p.jpg")
            .bbox(BoundingBox.of(0, 0, 1, 1))
            .embedding(new float[]{1, 0, 0, 0})
            .createdAt(Instant.now())
            .build();
    }
}
