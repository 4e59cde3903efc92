// file: cli/src/test/java/io/schemasync/cli/CliConfigTest.java
package io.schemasync.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliConfigTest {

    @Test
    void parses_all_options() {
        var cfg = CliConfig.fromArgs(new String[]{
                "--url", "jdbc:sqlserver://db:1433", "--user", "deploy", "--password-env", "DB_PW",
                "-s", "schema.json", "-y", "--no-children"});

        assertEquals("jdbc:sqlserver://db:1433", cfg.url());
        assertEquals("deploy", cfg.user());
        assertEquals("DB_PW", cfg.passwordEnv());
        assertEquals("schema.json", cfg.schemaPath());
        assertTrue(cfg.assumeYes());
        assertFalse(cfg.alignChildren());
        assertFalse(cfg.help());
    }

    @Test
    void defaults_prompt_and_recurse() {
        var cfg = CliConfig.fromArgs(new String[]{"-u", "jdbc:sqlserver://db", "--schema", "s.json"});

        assertNull(cfg.user());
        assertEquals("SCHEMASYNC_PASSWORD", cfg.passwordEnv());
        assertFalse(cfg.assumeYes());
        assertTrue(cfg.alignChildren());
    }

    @Test
    void help_wins_over_missing_options() {
        assertTrue(CliConfig.fromArgs(new String[]{"--help"}).help());
    }

    @Test
    void usage_errors_are_reported() {
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"--schema", "s.json"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"--url"}));
        assertThrows(IllegalArgumentException.class, () -> CliConfig.fromArgs(new String[]{"--colour", "red"}));
    }
}
