// file: cli/src/test/java/io/schemasync/cli/MainTest.java
package io.schemasync.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void help_exits_cleanly() {
        assertEquals(Main.OK, Main.run(new String[]{"--help"}));
    }

    @Test
    void usage_errors_exit_with_two() {
        assertEquals(Main.FAILED, Main.run(new String[]{"--schema"}));
        assertEquals(Main.FAILED, Main.run(new String[]{"--bogus"}));
    }

    @Test
    void unreadable_schema_fails_before_connecting(@TempDir Path dir) {
        assertEquals(Main.FAILED, Main.run(new String[]{
                "--url", "jdbc:sqlserver://127.0.0.1:1;loginTimeout=1", "--schema", dir.resolve("none.json").toString(), "--yes"}));
    }
}
