/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.fable.tables.executor;

import static com.amazon.fable.CommonUtils.checkArgument;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Processes cells concurrently on a private thread pool.
 */
public class ParallelCellExecutor extends AbstractCellExecutor {

    private ForkJoinPool forkJoinPool;

    @Getter
    private final int threadPoolSize;

    public ParallelCellExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be positive");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public <T, R> List<R> map(List<T> cells, Function<T, R> task) {
        return submitAndJoin(() -> cells.parallelStream().map(task).collect(Collectors.toList()));
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
