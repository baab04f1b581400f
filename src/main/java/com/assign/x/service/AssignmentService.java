package com.assign.x.service;

import com.assign.x.dto.AssignmentRequest;
import com.assign.x.dto.AssignmentResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToDoubleBiFunction;

public interface AssignmentService {
    AssignmentResponse assign(AssignmentRequest request);
    <L, R> CompletableFuture<AssignmentResponse> assignAsync(List<L> rows, List<R> cols,
                                                             ToDoubleBiFunction<L, R> scorer, String mode);
}
