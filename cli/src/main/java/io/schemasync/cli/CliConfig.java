// file: cli/src/main/java/io/schemasync/cli/CliConfig.java
package io.schemasync.cli;

/**
 * Command-line configuration.
 *
 * Supports:
 *  - url:           JDBC URL of the SQL Server instance
 *  - user:          login name (omit for integrated security)
 *  - passwordEnv:   environment variable holding the password
 *  - schemaPath:    JSON file with the declared server tree
 *  - assumeYes:     approve every change without prompting
 *  - alignChildren: recurse below the server root (off with --no-children)
 *  - help:          print usage and exit
 */
public record CliConfig(
        String url,
        String user,
        String passwordEnv,
        String schemaPath,
        boolean assumeYes,
        boolean alignChildren,
        boolean help
) {

    public static final String USAGE = """
            Usage: schemasync --url <jdbc-url> --schema <file.json> [options]

            Options:
              --url,          -u   JDBC URL, e.g. jdbc:sqlserver://localhost:1433;encrypt=false
              --user              Login name (omit for integrated security)
              --password-env      Environment variable holding the password (default: SCHEMASYNC_PASSWORD)
              --schema,       -s   Declared schema JSON file
              --yes,          -y   Approve every change without asking
              --no-children       Align the server's own attributes only
              --help,         -h   Show this help message
            """;

    /**
     * Very small CLI parser.
     *
     * @throws IllegalArgumentException on unknown options, missing values or
     *                                  missing required options
     */
    public static CliConfig fromArgs(String[] args) {
        String url = null;
        String user = null;
        String passwordEnv = "SCHEMASYNC_PASSWORD";
        String schema = null;
        boolean yes = false;
        boolean children = true;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(null, null, null, null, false, true, true);
                }

                case "--url", "-u" -> {
                    ensureValue(args, i);
                    url = args[++i];
                }

                case "--user" -> {
                    ensureValue(args, i);
                    user = args[++i];
                }

                case "--password-env" -> {
                    ensureValue(args, i);
                    passwordEnv = args[++i];
                }

                case "--schema", "-s" -> {
                    ensureValue(args, i);
                    schema = args[++i];
                }

                case "--yes", "-y" -> yes = true;

                case "--no-children" -> children = false;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing required option: --url");
        if (schema == null || schema.isBlank()) throw new IllegalArgumentException("Missing required option: --schema");
        return new CliConfig(url, user, passwordEnv, schema, yes, children, false);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }
}
