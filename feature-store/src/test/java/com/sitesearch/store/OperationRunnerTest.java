package com.sitesearch.store;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class OperationRunnerTest {

    /**
     * Handle that reports EXECUTING for a number of polls before its final status.
     */
    private static class ScriptedHandle implements OperationHandle {
        private final OperationRequest request;
        private final OperationStatus finalStatus;
        private int pollsRemaining;
        int polls = 0;
        boolean cancelled = false;

        ScriptedHandle(OperationRequest request, OperationStatus finalStatus, int pollsBeforeDone) {
            this.request = request;
            this.finalStatus = finalStatus;
            this.pollsRemaining = pollsBeforeDone;
        }

        @Override
        public OperationRequest getRequest() {
            return request;
        }

        @Override
        public OperationStatus getStatus() {
            polls++;
            if (pollsRemaining-- > 0) {
                return OperationStatus.EXECUTING;
            }
            return finalStatus;
        }

        @Override
        public String getErrorMessage() {
            return finalStatus == OperationStatus.FAILED ? "ERROR 000732: Input does not exist" : null;
        }

        @Override
        public List<String> getMessages() {
            return Arrays.asList("Start Time: now", "Failed to execute");
        }

        @Override
        public void cancel() {
            cancelled = true;
        }
    }

    private static class ScriptedStore implements FeatureStore {
        private final OperationStatus finalStatus;
        private final int polls;
        ScriptedHandle last;

        ScriptedStore(OperationStatus finalStatus, int polls) {
            this.finalStatus = finalStatus;
            this.polls = polls;
        }

        @Override
        public boolean nameExists(String workspace, DatasetKind kind, String name) {
            return false;
        }

        @Override
        public FieldList getFields(String dataset) throws DatasetNotFoundException {
            throw new DatasetNotFoundException(dataset);
        }

        @Override
        public DatasetKind getKind(String dataset) throws DatasetNotFoundException {
            throw new DatasetNotFoundException(dataset);
        }

        @Override
        public GeometryKind sampleGeometryKind(String dataset) throws DatasetNotFoundException {
            throw new DatasetNotFoundException(dataset);
        }

        @Override
        public RowCursor search(String dataset) throws DatasetNotFoundException {
            throw new DatasetNotFoundException(dataset);
        }

        @Override
        public OperationHandle execute(OperationRequest request) {
            last = new ScriptedHandle(request, finalStatus, polls);
            return last;
        }
    }

    @Test
    public void testPollsUntilSucceeded() throws Exception {
        ScriptedStore store = new ScriptedStore(OperationStatus.SUCCEEDED, 3);
        OperationRunner runner = new OperationRunner(store, 1L);

        OperationHandle handle = runner.run(EngineOperation.DELETE, "/mem/x.gdb/Temp");

        assertSame(store.last, handle);
        assertEquals(4, store.last.polls, "Three EXECUTING polls then the terminal one");
    }

    @Test
    public void testFailureCarriesErrorAndDiagnostics() {
        ScriptedStore store = new ScriptedStore(OperationStatus.FAILED, 1);
        OperationRunner runner = new OperationRunner(store, 1L);

        OperationFailedException e = assertThrows(OperationFailedException.class,
                () -> runner.run(EngineOperation.STATISTICS, "in", "out", "", ""));

        assertEquals(OperationStatus.FAILED, e.getStatus());
        assertEquals(EngineOperation.STATISTICS, e.getRequest().getOperation());
        assertTrue(e.getMessage().contains("ERROR 000732"), e.getMessage());
        assertEquals(2, e.getDiagnostics().size());
        assertTrue(e.getFullMessage().contains("Failed to execute"));
    }

    @Test
    public void testCancelledIsAFailure() {
        ScriptedStore store = new ScriptedStore(OperationStatus.CANCELLED, 0);
        OperationRunner runner = new OperationRunner(store, 1L);

        OperationFailedException e = assertThrows(OperationFailedException.class,
                () -> runner.run(EngineOperation.COPY_FEATURES, "in", "out"));
        assertEquals(OperationStatus.CANCELLED, e.getStatus());
    }

    @Test
    public void testInterruptCancelsOperation() {
        ScriptedStore store = new ScriptedStore(OperationStatus.SUCCEEDED, Integer.MAX_VALUE);
        OperationRunner runner = new OperationRunner(store, 1L);

        Thread.currentThread().interrupt();
        try {
            OperationFailedException e = assertThrows(OperationFailedException.class,
                    () -> runner.run(EngineOperation.COPY_FEATURES, "in", "out"));
            assertEquals(OperationStatus.CANCELLED, e.getStatus());
            assertTrue(store.last.cancelled, "The handle should be cancelled");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testPollIntervalMustBePositive() {
        ScriptedStore store = new ScriptedStore(OperationStatus.SUCCEEDED, 0);
        assertThrows(IllegalArgumentException.class, () -> new OperationRunner(store, 0L));
        assertEquals(OperationRunner.DEFAULT_POLL_INTERVAL_MILLIS, new OperationRunner(store).getPollIntervalMillis());
    }
}
