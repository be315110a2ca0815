package com.example.dsr.service;

import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import java.util.List;

/**
 * @param totalDeletedRows rows reported by completed items only
 * @param plan the plan stored at submission, or null if planning never finished
 */
public record DeletionStatus(
        Request request,
        List<RequestItem> items,
        DeletionPlan plan,
        RequestProgress progress,
        long totalDeletedRows
) { }
