package com.example.dsr.access;

import com.example.dsr.models.RequestItem;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryRequestItemAccess implements RequestItemAccess {

    private final ConcurrentHashMap<String, RequestItem> items = new ConcurrentHashMap<>();

    @Override
    public List<RequestItem> findAllByRequestId(long requestId) {
        return items.values().stream()
                .filter(item -> item.getRequestId() == requestId)
                .sorted(Comparator.comparing(RequestItem::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public RequestItem save(RequestItem item) {
        items.put(item.getRequestId() + "#" + item.getSequence(), item);
        return item;
    }
}
