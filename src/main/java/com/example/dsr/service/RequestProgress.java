package com.example.dsr.service;

import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestStatus;
import java.util.List;

/**
 * Point-in-time progress of a request, derived from its items. A request with no items reports
 * zero percent.
 */
public record RequestProgress(
        int totalItems,
        int completedItems,
        int failedItems,
        int percentage
) {

    public static RequestProgress of(List<RequestItem> items) {
        int total = items.size();
        int completed = (int) items.stream().filter(item -> item.getStatus() == RequestStatus.COMPLETED).count();
        int failed = (int) items.stream().filter(item -> item.getStatus() == RequestStatus.FAILED).count();
        return new RequestProgress(total, completed, failed, percentage(completed, total));
    }

    static int percentage(int completed, int total) {
        return total > 0 ? (int) Math.round(completed * 100.0 / total) : 0;
    }
}
