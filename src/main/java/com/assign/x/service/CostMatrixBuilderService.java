package com.assign.x.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.ToDoubleBiFunction;

public interface CostMatrixBuilderService {
    <L, R> CompletableFuture<double[][]> build(List<L> rows, List<R> cols, ToDoubleBiFunction<L, R> scorer);
}
