package com.example.dsr.access;

import com.example.dsr.models.RequestItem;
import java.util.List;

public interface RequestItemAccess {

    /**
     * Items of one request ordered by ascending sequence, which is their execution order.
     */
    List<RequestItem> findAllByRequestId(long requestId);

    RequestItem save(RequestItem item);
}
