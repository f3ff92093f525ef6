package com.astrazeneca.structhunt.data;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.assertEquals;

public class RunStatusTest {
    private static final WorkerResult OK = WorkerResult.succeeded("chr1", 10, Collections.emptyList());
    private static final WorkerResult FAILED = WorkerResult.failed("chr2", 10, "exit code 1");

    @DataProvider(name = "results")
    public Object[][] results() {
        return new Object[][] {
                {Collections.emptyList(), RunStatus.SUCCESS, 0},
                {Arrays.asList(OK, OK), RunStatus.SUCCESS, 0},
                {Arrays.asList(OK, FAILED), RunStatus.PARTIAL_SUCCESS, 2},
                {Collections.singletonList(FAILED), RunStatus.FAILURE, 1},
        };
    }

    @Test(dataProvider = "results")
    public void testStatusOfResults(List<WorkerResult> results, RunStatus expected, int exitCode) {
        RunStatus status = RunStatus.of(results);

        assertEquals(status, expected);
        assertEquals(status.exitCode, exitCode);
    }
}
