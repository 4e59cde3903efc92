// file: cli/src/main/java/io/schemasync/cli/ConsoleConfirmationProvider.java
package io.schemasync.cli;

import io.schemasync.core.live.ConfirmationProvider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Asks the operator on the console. Anything but "y" or "yes" declines,
 * and so does end of input.
 */
public final class ConsoleConfirmationProvider implements ConfirmationProvider {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationProvider(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static ConsoleConfirmationProvider system() {
        return new ConsoleConfirmationProvider(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    @Override
    public boolean confirm(String description) {
        out.print(description + " [y/N] ");
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read confirmation", e);
        }
        if (answer == null) {
            out.println();
            return false;
        }
        String a = answer.strip().toLowerCase(Locale.ROOT);
        return a.equals("y") || a.equals("yes");
    }
}
