package com.example.dsr.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestStatus;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequestProgressTest {

    @Test
    @DisplayName("percentage rounds completed over total")
    void percentageRounds() {
        assertEquals(33, RequestProgress.percentage(1, 3));
        assertEquals(67, RequestProgress.percentage(2, 3));
        assertEquals(100, RequestProgress.percentage(4, 4));
        assertEquals(0, RequestProgress.percentage(0, 0));
    }

    @Test
    @DisplayName("failed items count toward the total but not the percentage")
    void failedItemsDoNotCountAsDone() {
        RequestProgress progress = RequestProgress.of(List.of(
                item(1, RequestStatus.COMPLETED),
                item(2, RequestStatus.FAILED),
                item(3, RequestStatus.PENDING)));

        assertEquals(3, progress.totalItems());
        assertEquals(1, progress.completedItems());
        assertEquals(1, progress.failedItems());
        assertEquals(33, progress.percentage());
    }

    private static RequestItem item(int sequence, RequestStatus status) {
        return RequestItem.builder()
                .requestId(1L)
                .sequence(sequence)
                .databaseName("db")
                .schemaName("public")
                .tableName("t" + sequence)
                .columns(List.of("email"))
                .status(status)
                .createdAt(0L)
                .updatedAt(0L)
                .build();
    }
}
