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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CellExecutorTest {

    private static List<Integer> inputs(int n) {
        return IntStream.range(0, n).boxed().collect(Collectors.toList());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 4 })
    public void testParallelKeepsInputOrder(int threadPoolSize) {
        List<Integer> cells = inputs(200);
        List<Integer> expected = new SequentialCellExecutor().map(cells, i -> i * i);
        List<Integer> actual = new ParallelCellExecutor(threadPoolSize).map(cells, i -> i * i);
        assertEquals(expected, actual);
        assertEquals(39601, actual.get(199));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTaskRunsOncePerCell() {
        Function<Integer, String> task = mock(Function.class);
        when(task.apply(anyInt())).thenReturn("done");
        List<String> results = new ParallelCellExecutor(3).map(inputs(10), task);
        assertEquals(Collections.nCopies(10, "done"), results);
        verify(task, times(10)).apply(anyInt());
    }

    @Test
    public void testSequentialRunsInCallingThread() {
        List<String> threads = new ArrayList<>();
        new SequentialCellExecutor().map(inputs(5), i -> threads.add(Thread.currentThread().getName()));
        assertEquals(Collections.nCopies(5, Thread.currentThread().getName()), threads);
    }

    @Test
    public void testIllegalPoolSize() {
        assertThrows(IllegalArgumentException.class, () -> new ParallelCellExecutor(0));
    }
}
