package org.Aayush.cpusim.io;

import org.Aayush.cpusim.core.SimulationException;
import org.Aayush.cpusim.process.ProcessTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("ProcessTableLoader Tests")
class ProcessTableLoaderTest {

    private final ProcessTableLoader loader = new ProcessTableLoader(100);

    @Test
    @DisplayName("Parses count followed by arrival,burst lines")
    void testParse() {
        ProcessTable table = loader.parse("3\n0,10\n 1 , 1\n\n2,1\n");

        assertEquals(3, table.size());
        assertEquals(1, table.get(1).getArrivalTime());
        assertEquals(1, table.get(1).getBurstTime());
        assertEquals(2, table.get(2).getArrivalTime());
    }

    @Test
    @DisplayName("Lines beyond the declared count are ignored")
    void testTrailingLinesIgnored() {
        ProcessTable table = loader.parse("1\r\n5,3\r\n9,9\r\n");
        assertEquals(1, table.size());
        assertEquals(5, table.get(0).getArrivalTime());
    }

    @Test
    @DisplayName("Zero declared processes yields an empty table")
    void testZeroCount() {
        assertEquals(0, loader.parse("0\n").size());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  \n", "x\n0,1", "2\n0,1", "1\n0;1", "1\n0,1,2", "1\na,1", "-1\n", "1\n1,2,", "1\n,1"})
    @DisplayName("Validation: malformed content fails with INPUT_FORMAT")
    void testMalformedInput(String content) {
        SimulationException ex = assertThrows(SimulationException.class, () -> loader.parse(content));
        assertEquals(ProcessTableLoader.REASON_INPUT_FORMAT, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: invalid process values keep their own reason code")
    void testInvalidProcessSpec() {
        SimulationException ex = assertThrows(SimulationException.class, () -> loader.parse("1\n0,0\n"));
        assertEquals(ProcessTable.REASON_INVALID_PROCESS_SPEC, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: declared count above capacity fails with CAPACITY_EXCEEDED")
    void testCapacityExceeded() {
        ProcessTableLoader small = new ProcessTableLoader(2);
        SimulationException ex = assertThrows(SimulationException.class, () -> small.parse("3\n0,1\n0,1\n0,1\n"));
        assertEquals(ProcessTable.REASON_CAPACITY_EXCEEDED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Loads UTF-8 files from disk")
    void testLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("processes.txt");
        Files.writeString(file, "2\n0,4\n1,4\n", StandardCharsets.UTF_8);

        ProcessTable table = loader.load(file);
        assertEquals(2, table.size());
        assertEquals(4, table.get(1).getBurstTime());
    }
}
