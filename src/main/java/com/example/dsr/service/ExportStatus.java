package com.example.dsr.service;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import java.util.List;

public record ExportStatus(
        Request request,
        List<RequestItem> items,
        RequestProgress progress
) { }
